package org.dynamis.async.segment;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.stmt.Statement;
import org.dynamis.async.AsyncLowering;
import org.dynamis.async.model.Segment;
import org.dynamis.async.model.StateMachineArtifact;
import org.dynamis.async.model.SuspensionKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.dynamis.async.test.Fixtures.behaviour;
import static org.dynamis.async.test.Fixtures.method;
import static org.dynamis.async.test.Fixtures.owner;
import static org.dynamis.async.test.Fixtures.parse;

class BodySegmenterTest {

    private static final String SOURCE = behaviour("Segments", """
                @AsyncProcedure
                public Task<Integer> child(int n) {
                    return n;
                }

                @AsyncProcedure
                public Task<Void> seq() {
                    log("A");
                    await(Task.delay(1f));
                    log("B");
                    await(Task.yieldFrame());
                    log("C");
                }

                @AsyncProcedure
                public Task<Void> none() {
                    log("only");
                }

                @AsyncProcedure
                public Task<Integer> values(int seed) {
                    int kept = seed + 1, dropped = 0;
                    log("" + dropped);
                    int received = await(child(kept));
                    kept = await(child(received));
                    return await(child(kept));
                }
            """);

    @Test
    void segmentCount_isSuspensionCountPlusOne() {
        assertThat(lower("seq").segments()).hasSize(3);
        assertThat(lower("none").segments()).hasSize(1);
    }

    @Test
    void segments_keepTheirStatementsInSourceOrder() {
        List<Segment> segments = lower("seq").segments();

        assertThat(texts(segments.get(0))).containsExactly("log(\"A\");");
        assertThat(texts(segments.get(1))).containsExactly("log(\"B\");");
        assertThat(texts(segments.get(2))).containsExactly("log(\"C\");");
        assertThat(segments.get(0).terminator().kind()).isEqualTo(SuspensionKind.TIMED_DELAY);
        assertThat(segments.get(1).terminator().kind()).isEqualTo(SuspensionKind.YIELD_ONE_STEP);
        assertThat(segments.get(2).isTerminal()).isTrue();
    }

    @Test
    void hoistedDeclarator_becomesAnAssignmentAndTheRestStaysDeclared() {
        List<Segment> segments = lower("values").segments();

        assertThat(texts(segments.get(0))).containsExactly(
                "__values_kept = __values_seed + 1;",
                "int dropped = 0;",
                "log(\"\" + dropped);");
    }

    @Test
    void suspensionOperands_referToSlots() {
        Segment first = lower("values").segments().get(0);

        assertThat(first.terminator().awaited().toString()).isEqualTo("child(__values_kept)");
    }

    @Test
    void awaitedValues_areDeliveredAtTheStartOfTheNextSegment() {
        List<Segment> segments = lower("values").segments();

        assertThat(texts(segments.get(1)).get(0)).isEqualTo("__values_received = __values_await0.getResult();");
        assertThat(texts(segments.get(2)).get(0)).isEqualTo("__values_kept = __values_await1.getResult();");
        assertThat(texts(segments.get(3))).containsExactly("return __values_await2.getResult();");
    }

    private static List<String> texts(Segment segment) {
        return segment.statements().stream().map(Statement::toString).collect(Collectors.toList());
    }

    private static StateMachineArtifact lower(String procedure) {
        CompilationUnit unit = parse(SOURCE);
        MethodDeclaration method = method(unit, procedure);
        return AsyncLowering.builder().build().lowerProcedure(owner(method), method);
    }
}
