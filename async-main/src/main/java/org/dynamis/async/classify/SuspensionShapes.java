package org.dynamis.async.classify;

import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import org.dynamis.async.model.SuspensionShape;

import java.util.Optional;

import static org.dynamis.async.ast.AsyncAstUtils.unwrap;

/**
 * Recognises the statement forms a suspension may take.
 */
public final class SuspensionShapes {

    private SuspensionShapes() {}

    /**
     * The shape of {@code statement} if it consists of nothing but the suspension {@code site}.
     */
    public static Optional<SuspensionShape> shapeOf(MethodCallExpr site, Statement statement) {
        if (statement instanceof ReturnStmt) {
            Optional<Expression> value = ((ReturnStmt) statement).getExpression();
            return value.isPresent() && unwrap(value.get()) == site
                    ? Optional.of(SuspensionShape.RETURN) : Optional.empty();
        }
        if (!(statement instanceof ExpressionStmt)) {
            return Optional.empty();
        }
        Expression expression = unwrap(((ExpressionStmt) statement).getExpression());
        if (expression == site) {
            return Optional.of(SuspensionShape.BARE);
        }
        if (expression instanceof AssignExpr) {
            AssignExpr assign = (AssignExpr) expression;
            boolean simpleTarget = assign.getTarget() instanceof NameExpr || assign.getTarget() instanceof FieldAccessExpr;
            if (assign.getOperator() == AssignExpr.Operator.ASSIGN && simpleTarget && unwrap(assign.getValue()) == site) {
                return Optional.of(SuspensionShape.ASSIGN);
            }
            return Optional.empty();
        }
        if (expression instanceof VariableDeclarationExpr) {
            VariableDeclarationExpr declaration = (VariableDeclarationExpr) expression;
            if (declaration.getVariables().size() == 1) {
                Optional<Expression> initializer = declaration.getVariable(0).getInitializer();
                if (initializer.isPresent() && unwrap(initializer.get()) == site) {
                    return Optional.of(SuspensionShape.DECLARE);
                }
            }
        }
        return Optional.empty();
    }
}
