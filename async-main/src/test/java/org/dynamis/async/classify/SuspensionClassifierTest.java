package org.dynamis.async.classify;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.type.Type;
import org.dynamis.async.ClassificationException;
import org.dynamis.async.bind.Binder;
import org.dynamis.async.bind.BoundType;
import org.dynamis.async.bind.SymbolSolverBinder;
import org.dynamis.async.model.SuspensionKind;
import org.dynamis.async.model.SuspensionPoint;
import org.dynamis.async.model.SuspensionShape;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.dynamis.async.test.Fixtures.behaviour;
import static org.dynamis.async.test.Fixtures.method;
import static org.dynamis.async.test.Fixtures.parse;

class SuspensionClassifierTest {

    private static CompilationUnit unit;
    private static SuspensionClassifier classifier;

    @BeforeAll
    static void parseFixture() {
        unit = parse(behaviour("Kinds", """
                    @AsyncProcedure
                    public Task<Integer> child() {
                        return 1;
                    }

                    @AsyncProcedure
                    public Task<Void> timed(float seconds) {
                        await(Task.delay(seconds * 2));
                    }

                    @AsyncProcedure
                    public Task<Void> frames() {
                        await(Task.delayFrames(3));
                    }

                    @AsyncProcedure
                    public Task<Void> yielding() {
                        await(Task.yieldFrame());
                    }

                    @AsyncProcedure
                    public Task<Void> joinAll() {
                        await(Task.whenAll(child(), child()));
                    }

                    @AsyncProcedure
                    public Task<Void> joinAny() {
                        int winner = await(Task.whenAny(child(), child()));
                    }

                    @AsyncProcedure
                    public Task<Void> delegate() {
                        Integer value = await(child());
                    }

                    @AsyncProcedure
                    public Task<Void> delegateVariable(Task<Void> other) {
                        await(other);
                    }

                    @AsyncProcedure
                    public Task<Void> valueOfDelay() {
                        Object nothing = await(Task.delay(1f));
                    }

                    @AsyncProcedure
                    public Task<Void> lookalike() {
                        Other.await(Task.yieldFrame(), 2);
                    }

                    static class Other {
                        static void await(Task<?> task, int times) {
                        }
                    }
                """));
        classifier = new SuspensionClassifier(new SymbolSolverBinder(SuspensionClassifierTest.class.getClassLoader()));
    }

    @Test
    void delay_isTimedWithItsDurationOperand() {
        SuspensionPoint point = classifyFirst("timed");

        assertThat(point.kind()).isEqualTo(SuspensionKind.TIMED_DELAY);
        assertThat(point.timingExpression()).hasValueSatisfying(e -> assertThat(e.toString()).isEqualTo("seconds * 2"));
        assertThat(point.carriesValue()).isFalse();
        assertThat(point.shape()).isEqualTo(SuspensionShape.BARE);
    }

    @Test
    void delayFrames_isFrameDelay() {
        SuspensionPoint point = classifyFirst("frames");

        assertThat(point.kind()).isEqualTo(SuspensionKind.FRAME_DELAY);
        assertThat(point.timing().toString()).isEqualTo("3");
    }

    @Test
    void yieldFrame_isYieldOneStep() {
        SuspensionPoint point = classifyFirst("yielding");

        assertThat(point.kind()).isEqualTo(SuspensionKind.YIELD_ONE_STEP);
        assertThat(point.timingExpression()).isEmpty();
        assertThat(point.kind().isCompletionBased()).isFalse();
    }

    @Test
    void whenAll_joinsEveryArgument() {
        SuspensionPoint point = classifyFirst("joinAll");

        assertThat(point.kind()).isEqualTo(SuspensionKind.JOIN_ALL);
        assertThat(point.joined()).hasSize(2);
        assertThat(point.carriesValue()).isFalse();
        assertThat(point.awaitedType().asString()).contains("Task<java.lang.Void>");
    }

    @Test
    void whenAny_carriesTheWinnerIndex() {
        SuspensionPoint point = classifyFirst("joinAny");

        assertThat(point.kind()).isEqualTo(SuspensionKind.JOIN_ANY);
        assertThat(point.carriesValue()).isTrue();
        assertThat(point.shape()).isEqualTo(SuspensionShape.DECLARE);
    }

    @Test
    void taskTypedCall_isDelegation() {
        SuspensionPoint point = classifyFirst("delegate");

        assertThat(point.kind()).isEqualTo(SuspensionKind.DELEGATE_TO_PROCEDURE);
        assertThat(point.carriesValue()).isTrue();
        assertThat(point.awaitedType().asString()).isEqualTo("org.dynamis.async.runtime.Task<java.lang.Integer>");
    }

    @Test
    void taskTypedVariableOfVoid_isDelegationWithoutValue() {
        SuspensionPoint point = classifyFirst("delegateVariable");

        assertThat(point.kind()).isEqualTo(SuspensionKind.DELEGATE_TO_PROCEDURE);
        assertThat(point.carriesValue()).isFalse();
    }

    @Test
    void nonTaskOperand_isRejected() {
        CompilationUnit stringUnit = parse(behaviour("Strings", """
                    @AsyncProcedure
                    public Task<Void> notATask() {
                        await("text");
                    }
                """));
        MethodDeclaration method = method(stringUnit, "notATask");
        MethodCallExpr site = method.findFirst(MethodCallExpr.class).orElseThrow();
        Statement statement = method.getBody().get().getStatement(0);
        SuspensionClassifier stringly = new SuspensionClassifier(new AwaitOnlyBinder());

        assertThatThrownBy(() -> stringly.classify(0, site, SuspensionShape.BARE, statement, 0, 0))
                .isInstanceOf(ClassificationException.class)
                .satisfies(e -> {
                    ClassificationException ce = (ClassificationException) e;
                    assertThat(ce.getExpression()).isEqualTo("\"text\"");
                    assertThat(ce.getRange()).isPresent();
                });
    }

    @Test
    void usingTheValueOfADelay_isRejected() {
        assertThatThrownBy(() -> classifyFirst("valueOfDelay"))
                .isInstanceOf(ClassificationException.class)
                .hasMessageContaining("delivers no value");
    }

    @Test
    void sameNamedMethodOfAnotherClass_isNotASuspension() {
        MethodDeclaration method = method(unit, "lookalike");

        assertThat(classifier.findSuspensions(method)).isEmpty();
    }

    /**
     * Knows only the suspension operator and that string literals are strings.
     */
    private static final class AwaitOnlyBinder implements Binder {
        @Override
        public Optional<String> resolveMethod(MethodCallExpr call) {
            return call.getNameAsString().equals("await") ? Optional.of(Primitives.AWAIT) : Optional.empty();
        }

        @Override
        public Optional<String> resolveAnnotation(AnnotationExpr annotation) {
            return Optional.empty();
        }

        @Override
        public Optional<BoundType> typeOf(Expression expression) {
            return expression.isStringLiteralExpr()
                    ? Optional.of(new BoundType("java.lang.String", List.of(), "java.lang.String", true))
                    : Optional.empty();
        }

        @Override
        public Optional<BoundType> resolveType(Type type) {
            return Optional.empty();
        }

        @Override
        public boolean isSubtypeOf(ClassOrInterfaceDeclaration declaration, String qualifiedName) {
            return false;
        }
    }

    private static SuspensionPoint classifyFirst(String procedure) {
        MethodDeclaration method = method(unit, procedure);
        List<MethodCallExpr> sites = classifier.findSuspensions(method);
        assertThat(sites).hasSize(1);
        MethodCallExpr site = sites.get(0);
        Statement statement = method.getBody().get().getStatement(0);
        SuspensionShape shape = SuspensionShapes.shapeOf(site, statement).orElseThrow();
        return classifier.classify(0, site, shape, statement, 0, 0);
    }
}
