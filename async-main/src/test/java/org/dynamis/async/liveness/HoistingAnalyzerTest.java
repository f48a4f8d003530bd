package org.dynamis.async.liveness;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;
import org.dynamis.async.AsyncLowering;
import org.dynamis.async.LoweringOptions;
import org.dynamis.async.StorageTypeException;
import org.dynamis.async.model.HoistedSlot;
import org.dynamis.async.model.SlotOrigin;
import org.dynamis.async.model.StateMachineArtifact;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.dynamis.async.test.Fixtures.behaviour;
import static org.dynamis.async.test.Fixtures.method;
import static org.dynamis.async.test.Fixtures.owner;
import static org.dynamis.async.test.Fixtures.parse;

class HoistingAnalyzerTest {

    private static final String SOURCE = behaviour("Hoisting", """
                @AsyncProcedure
                public Task<Integer> child() {
                    return 1;
                }

                @AsyncProcedure
                public Task<Void> params(int used, int unused) {
                    await(Task.yieldFrame());
                    log("" + used);
                }

                @AsyncProcedure
                public Task<Void> early(int x) {
                    log("" + x);
                    await(Task.yieldFrame());
                    log("after");
                }

                @AsyncProcedure
                public Task<Void> token(CancellationToken token) {
                    await(Task.yieldFrame());
                }

                @AsyncProcedure
                public Task<Void> locals() {
                    int before = 1;
                    log("" + before);
                    int across = 2;
                    await(Task.delay(1f));
                    log("" + across);
                    int after = 3;
                    log("" + after);
                }

                @AsyncProcedure
                public Task<Void> scoped() {
                    for (int i = 0; i < 3; i++) {
                        int square = i * i;
                        log("" + square);
                    }
                    await(Task.yieldFrame());
                    for (int i = 0; i < 3; i++) {
                        log("" + i);
                    }
                }

                @AsyncProcedure
                public Task<Void> delegating() {
                    Integer value = await(child());
                    log("" + value);
                }

                @AsyncProcedure
                public Task<Void> inferred() {
                    var name = "x";
                    await(Task.yieldFrame());
                    log(name);
                }

                @AsyncProcedure
                public Task<Void> localRecord() {
                    record Point(int x) {}
                    Point p = new Point(1);
                    await(Task.yieldFrame());
                    log("" + p);
                }

                @AsyncProcedure
                public Task<Void> anonymous() {
                    var counter = new Object() { int hits; };
                    await(Task.yieldFrame());
                    counter.hits++;
                }

                @AsyncProcedure
                public <T> Task<Void> generic(T item) {
                    await(Task.yieldFrame());
                    log("" + item);
                }

                @AsyncProcedure
                public Task<Void> reassigned() {
                    int t = 1;
                    log("" + t);
                    await(Task.yieldFrame());
                    t = 5;
                    log("" + t);
                    await(Task.yieldFrame());
                    log("done");
                }

                @AsyncProcedure
                public Task<Integer> readFirst() {
                    int t = 1;
                    await(Task.yieldFrame());
                    t = t + 1;
                    return t;
                }
            """);

    @Test
    void parameter_isHoistedOnlyWhenReferenced() {
        assertThat(hoisted("params")).containsExactly("used");
        assertThat(slots("params").get(0).origin()).isEqualTo(SlotOrigin.PARAMETER);
        assertThat(slots("params").get(0).storageName()).isEqualTo("__params_used");
    }

    @Test
    void parameter_readOnlyBeforeTheSuspension_isStillHoisted() {
        List<HoistedSlot> slots = slots("early");

        assertThat(slots).extracting(HoistedSlot::originalName).containsExactly("x");
        assertThat(slots.get(0).storageName()).isEqualTo("__early_x");
        assertThat(lower("early", LoweringOptions.defaults()).entry().toString()).contains("__early_x = x;");
    }

    @Test
    void cancellationToken_isAlwaysHoisted() {
        assertThat(hoisted("token")).containsExactly("token");
    }

    @Test
    void local_isHoistedOnlyWhenASuspensionSeparatesDeclarationAndUse() {
        assertThat(hoisted("locals")).containsExactly("across");
    }

    @Test
    void nestedScopeLocals_areNeverHoisted() {
        assertThat(hoisted("scoped")).isEmpty();
    }

    @Test
    void delegation_getsAnAwaiterSlot() {
        List<HoistedSlot> slots = slots("delegating");

        assertThat(slots).extracting(HoistedSlot::originalName).containsExactly("value", "await#0");
        HoistedSlot awaiter = slots.get(1);
        assertThat(awaiter.origin()).isEqualTo(SlotOrigin.AWAITED);
        assertThat(awaiter.storageName()).isEqualTo("__delegating_await0");
        assertThat(awaiter.type().asString()).isEqualTo("org.dynamis.async.runtime.Task<java.lang.Integer>");
    }

    @Test
    void varLocal_getsItsInferredType() {
        HoistedSlot slot = slots("inferred").get(0);

        assertThat(slot.originalName()).isEqualTo("name");
        assertThat(slot.type().asString()).isEqualTo("java.lang.String");
    }

    @Test
    void localRecordType_cannotBeStored() {
        assertThatThrownBy(() -> slots("localRecord"))
                .isInstanceOf(StorageTypeException.class)
                .satisfies(e -> assertThat(((StorageTypeException) e).getVariableName()).isEqualTo("p"));
    }

    @Test
    void anonymousClassType_cannotBeStored() {
        assertThatThrownBy(() -> slots("anonymous"))
                .isInstanceOf(StorageTypeException.class);
    }

    @Test
    void methodTypeVariable_cannotBeStored() {
        assertThatThrownBy(() -> slots("generic"))
                .isInstanceOf(StorageTypeException.class)
                .hasMessageContaining("type variable");
    }

    @Test
    void positional_hoistsEveryLocalUsedAcrossASuspension() {
        assertThat(hoisted("reassigned")).containsExactly("t");
        assertThat(hoisted("readFirst")).containsExactly("t");
    }

    @Test
    void dataflow_keepsLocalsThatAreOverwrittenBeforeTheirNextRead() {
        LoweringOptions dataflow = LoweringOptions.builder().hoistingStrategy(HoistingStrategy.DATAFLOW).build();

        assertThat(hoisted("reassigned", dataflow)).isEmpty();
        assertThat(hoisted("readFirst", dataflow)).containsExactly("t");
        assertThat(hoisted("locals", dataflow)).containsExactly("across");
    }

    @Test
    void dataflow_redeclaresTransientLocalsInLaterSegments() {
        LoweringOptions dataflow = LoweringOptions.builder().hoistingStrategy(HoistingStrategy.DATAFLOW).build();

        StateMachineArtifact artifact = lower("reassigned", dataflow);

        assertThat(artifact.segments().get(1).statements().get(0).toString()).isEqualTo("int t;");
        assertThat(artifact.segments().get(2).statements().get(0).toString()).isEqualTo("log(\"done\");");
    }

    private static List<String> hoisted(String procedure) {
        return hoisted(procedure, LoweringOptions.defaults());
    }

    private static List<String> hoisted(String procedure, LoweringOptions options) {
        return lower(procedure, options).slots().stream()
                .filter(slot -> slot.origin() != SlotOrigin.AWAITED)
                .map(HoistedSlot::originalName)
                .collect(Collectors.toList());
    }

    private static List<HoistedSlot> slots(String procedure) {
        return lower(procedure, LoweringOptions.defaults()).slots();
    }

    private static StateMachineArtifact lower(String procedure, LoweringOptions options) {
        CompilationUnit unit = parse(SOURCE);
        MethodDeclaration method = method(unit, procedure);
        return AsyncLowering.builder().options(options).build().lowerProcedure(owner(method), method);
    }
}
