package org.dynamis.async.emit;

import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import org.dynamis.async.ast.AsyncAstUtils;

import java.util.List;

/**
 * Turns {@code return e;} into {@code { result.complete(e); return; }}. Returns inside closures
 * belong to the closure and are left alone.
 */
final class ReturnRewriter {

    private ReturnRewriter() {}

    static void rewrite(BlockStmt block, String resultField) {
        List<ReturnStmt> returns = block.findAll(ReturnStmt.class,
                r -> AsyncAstUtils.enclosingClosure(r, block).isEmpty());
        for (ReturnStmt ret : returns) {
            Expression value = ret.getExpression().map(Expression::clone).orElseGet(NullLiteralExpr::new);
            MethodCallExpr complete = new MethodCallExpr(new NameExpr(resultField), "complete", new NodeList<>(value));
            ret.replace(new BlockStmt(new NodeList<>(new ExpressionStmt(complete), new ReturnStmt())));
        }
    }
}
