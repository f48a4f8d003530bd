package org.dynamis.async.model;

import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.type.Type;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * One classified suspension.
 *
 * @param index          zero-based position among the procedure's suspensions
 * @param kind           what it waits for
 * @param timing         delay or frame-count operand, {@code null} for other kinds
 * @param joined         joined tasks of {@code whenAll}/{@code whenAny}, empty otherwise
 * @param awaited        the expression handed to {@code await}
 * @param carriesValue   whether the awaited task delivers a value
 * @param awaitedType    static type of {@code awaited}, used for its awaiter slot
 * @param shape          statement form of the suspension
 * @param site           the {@code await} call
 * @param statement      top-level body statement containing the call
 * @param statementIndex index of {@code statement} in the body
 * @param ordinal        source ordinal of {@code site}
 */
public record SuspensionPoint(int index, SuspensionKind kind, Expression timing, List<Expression> joined,
                              Expression awaited, boolean carriesValue, Type awaitedType, SuspensionShape shape,
                              MethodCallExpr site, Statement statement, int statementIndex, int ordinal) {

    public SuspensionPoint {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(awaited, "awaited");
        joined = List.copyOf(joined);
    }

    public Optional<Expression> timingExpression() {
        return Optional.ofNullable(timing);
    }

    /**
     * Copy whose operand expressions are replaced by {@code rewrite} applied to clones.
     */
    public SuspensionPoint withOperands(UnaryOperator<Expression> rewrite) {
        Expression newTiming = timing == null ? null : rewrite.apply(timing.clone());
        List<Expression> newJoined = new ArrayList<>();
        for (Expression expression : joined) {
            newJoined.add(rewrite.apply(expression.clone()));
        }
        return new SuspensionPoint(index, kind, newTiming, newJoined, rewrite.apply(awaited.clone()), carriesValue,
                awaitedType, shape, site, statement, statementIndex, ordinal);
    }
}
