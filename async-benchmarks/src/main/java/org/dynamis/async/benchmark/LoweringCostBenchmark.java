package org.dynamis.async.benchmark;

import java.util.concurrent.TimeUnit;

import org.dynamis.async.AsyncLowering;
import org.dynamis.async.LoweringOptions;
import org.dynamis.async.liveness.HoistingStrategy;
import org.dynamis.async.LoweringResult;
import org.dynamis.async.diagnostic.CollectingDiagnosticSink;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

/**
 * Measures the cost of lowering a compilation unit, from parse to printed source. Shows what
 * adding async procedures to a behaviour costs a build.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@Fork(2)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class LoweringCostBenchmark {

    private static final String HEADER = """
            package bench;

            import org.dynamis.async.runtime.AsyncBehaviour;
            import org.dynamis.async.runtime.AsyncProcedure;
            import org.dynamis.async.runtime.CancellationToken;
            import org.dynamis.async.runtime.Task;
            import static org.dynamis.async.runtime.Async.await;

            """;

    static final String SIMPLE = HEADER + """
            public class Patrol extends AsyncBehaviour {
                int laps;

                @AsyncProcedure
                public Task<Void> patrol() {
                    laps++;
                    await(Task.delay(1.0f));
                    laps++;
                }
            }
            """;

    static final String COMPLEX = HEADER + """
            public class Quest extends AsyncBehaviour {
                int gold;

                @AsyncProcedure
                public Task<Integer> fetch(int amount) {
                    await(Task.yieldFrame());
                    return amount * 2;
                }

                @AsyncProcedure
                public Task<Integer> run(int start, CancellationToken token) {
                    int total = start;
                    String label = "quest-" + start;
                    await(Task.delay(0.5f));
                    int first = await(fetch(total));
                    total += first;
                    if (total > 10) {
                        gold += total;
                    }
                    await(Task.delayFrames(3));
                    int second = await(fetch(total));
                    for (int i = 0; i < 3; i++) {
                        total += i;
                    }
                    await(Task.whenAll(fetch(1), fetch(2)));
                    gold += second + label.length();
                    return total + second;
                }
            }
            """;

    @State(Scope.Thread)
    public static class LoweringState {

        @Param({"DATAFLOW", "POSITIONAL"})
        public HoistingStrategy hoisting;

        AsyncLowering lowering;

        @Setup(Level.Trial)
        public void init() {
            lowering = AsyncLowering.builder()
                    .options(LoweringOptions.builder().hoistingStrategy(hoisting).build())
                    .diagnostics(new CollectingDiagnosticSink())
                    .build();
        }
    }

    @Benchmark
    public void lowerSimple(LoweringState state, Blackhole bh) {
        LoweringResult result = state.lowering.lowerSource(SIMPLE);
        bh.consume(result.source());
    }

    @Benchmark
    public void lowerComplex(LoweringState state, Blackhole bh) {
        LoweringResult result = state.lowering.lowerSource(COMPLEX);
        bh.consume(result.source());
    }
}
