package org.dynamis.async.classify;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.type.Type;
import org.dynamis.async.ClassificationException;
import org.dynamis.async.bind.Binder;
import org.dynamis.async.bind.BoundType;
import org.dynamis.async.model.SuspensionKind;
import org.dynamis.async.model.SuspensionPoint;
import org.dynamis.async.model.SuspensionShape;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.dynamis.async.ast.AsyncAstUtils.unwrap;

/**
 * Finds suspension sites and decides what each one waits for.
 */
public class SuspensionClassifier {

    private static final Logger log = LogManager.getLogger(SuspensionClassifier.class);

    private final Binder binder;

    public SuspensionClassifier(Binder binder) {
        this.binder = binder;
    }

    /**
     * Whether {@code call} is the suspension operator. The simple name is checked first so the
     * binder is only consulted for candidates.
     */
    public boolean isSuspension(MethodCallExpr call) {
        if (!call.getNameAsString().equals(Primitives.AWAIT_SIMPLE_NAME)) {
            return false;
        }
        return binder.resolveMethod(call).filter(Primitives.AWAIT::equals).isPresent();
    }

    /**
     * Suspension sites under {@code root} in source order, closures included.
     */
    public List<MethodCallExpr> findSuspensions(Node root) {
        return root.findAll(MethodCallExpr.class).stream()
                .filter(this::isSuspension)
                .collect(Collectors.toList());
    }

    /**
     * Classifies one suspension site.
     *
     * @throws ClassificationException if the awaited expression is not a recognised primitive and not a
     *                                 {@code Task}, or its value is used although it carries none
     */
    public SuspensionPoint classify(int index, MethodCallExpr site, SuspensionShape shape, Statement statement,
                                    int statementIndex, int ordinal) {
        if (site.getArguments().size() != 1) {
            throw new ClassificationException("await takes exactly one task, found "
                    + site.getArguments().size() + " arguments", site.toString(), site.getRange().orElse(null));
        }
        Expression awaited = unwrap(site.getArgument(0));
        Optional<BoundType> awaitedType = binder.typeOf(awaited);

        SuspensionKind kind = null;
        Expression timing = null;
        List<Expression> joined = List.of();
        if (awaited instanceof MethodCallExpr) {
            MethodCallExpr call = (MethodCallExpr) awaited;
            String identity = binder.resolveMethod(call).orElse("");
            switch (identity) {
                case Primitives.DELAY:
                    kind = SuspensionKind.TIMED_DELAY;
                    timing = requireOperand(call, "a duration in seconds");
                    break;
                case Primitives.DELAY_FRAMES:
                    kind = SuspensionKind.FRAME_DELAY;
                    timing = requireOperand(call, "a frame count");
                    break;
                case Primitives.YIELD_FRAME:
                    kind = SuspensionKind.YIELD_ONE_STEP;
                    break;
                case Primitives.WHEN_ALL:
                    kind = SuspensionKind.JOIN_ALL;
                    joined = List.copyOf(call.getArguments());
                    break;
                case Primitives.WHEN_ANY:
                    kind = SuspensionKind.JOIN_ANY;
                    joined = List.copyOf(call.getArguments());
                    break;
                default:
                    break;
            }
        }
        if (kind == null) {
            if (awaitedType.isEmpty()) {
                throw new ClassificationException("Cannot determine what '" + awaited + "' waits for: its type does not resolve",
                        awaited.toString(), awaited.getRange().orElse(null));
            }
            if (!awaitedType.get().is(Primitives.TASK)) {
                throw new ClassificationException("'" + awaited + "' has type " + awaitedType.get().description()
                        + ", expected " + Primitives.TASK, awaited.toString(), awaited.getRange().orElse(null));
            }
            kind = SuspensionKind.DELEGATE_TO_PROCEDURE;
        }

        boolean carriesValue = carriesValue(kind, awaitedType);
        if (shape.usesValue() && !carriesValue) {
            throw new ClassificationException("The value of '" + site + "' is used, but " + kind
                    + " delivers no value", site.toString(), site.getRange().orElse(null));
        }
        log.debug("Suspension #{} '{}' classified as {}", index, awaited, kind);
        return new SuspensionPoint(index, kind, timing, joined, awaited, carriesValue, slotType(kind, awaitedType),
                shape, site, statement, statementIndex, ordinal);
    }

    private static Expression requireOperand(MethodCallExpr call, String what) {
        if (call.getArguments().isEmpty()) {
            throw new ClassificationException(call.getNameAsString() + " needs " + what,
                    call.toString(), call.getRange().orElse(null));
        }
        return call.getArgument(0);
    }

    private static boolean carriesValue(SuspensionKind kind, Optional<BoundType> awaitedType) {
        switch (kind) {
            case TIMED_DELAY:
            case FRAME_DELAY:
            case YIELD_ONE_STEP:
            case JOIN_ALL:
                return false;
            case JOIN_ANY:
                return true;
            default:
                return awaitedType.flatMap(type -> type.typeArgument(0))
                        .map(argument -> !argument.is("java.lang.Void"))
                        .orElse(false);
        }
    }

    private static Type slotType(SuspensionKind kind, Optional<BoundType> awaitedType) {
        if (!kind.isCompletionBased()) {
            return null;
        }
        return awaitedType.filter(BoundType::denotable)
                .map(BoundType::toAstType)
                .orElseGet(() -> StaticJavaParser.parseType(Primitives.TASK + "<?>"));
    }
}
