package org.dynamis.async.ast;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.LocalClassDeclarationStmt;
import com.github.javaparser.ast.stmt.LocalRecordDeclarationStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.ThrowStmt;

import java.util.Optional;

public final class AsyncAstUtils {

    private AsyncAstUtils() {}

    /**
     * Lambdas, anonymous class bodies and local type declarations: code that runs in its own frame,
     * outside the procedure's segment sequence.
     */
    public static boolean isClosure(Node node) {
        if (node instanceof LambdaExpr
                || node instanceof LocalClassDeclarationStmt
                || node instanceof LocalRecordDeclarationStmt) {
            return true;
        }
        return node instanceof ObjectCreationExpr && ((ObjectCreationExpr) node).getAnonymousClassBody().isPresent();
    }

    /**
     * Nearest closure between {@code node} and {@code boundary} (exclusive), if any.
     */
    public static Optional<Node> enclosingClosure(Node node, Node boundary) {
        Node current = node.getParentNode().orElse(null);
        while (current != null && current != boundary) {
            if (isClosure(current)) {
                return Optional.of(current);
            }
            current = current.getParentNode().orElse(null);
        }
        return Optional.empty();
    }

    /**
     * Nearest statement containing {@code node}.
     */
    public static Optional<Statement> enclosingStatement(Node node) {
        Node current = node.getParentNode().orElse(null);
        while (current != null && !(current instanceof Statement)) {
            current = current.getParentNode().orElse(null);
        }
        return Optional.ofNullable((Statement) current);
    }

    /**
     * The ancestor of {@code node} that is a direct statement of {@code body}, or {@code node}
     * itself when it already is one.
     */
    public static Optional<Statement> topLevelStatement(Node node, BlockStmt body) {
        Node current = node;
        while (current != null) {
            Node parent = current.getParentNode().orElse(null);
            if (parent == body && current instanceof Statement) {
                return Optional.of((Statement) current);
            }
            current = parent;
        }
        return Optional.empty();
    }

    /**
     * Position of {@code statement} among the direct statements of {@code body}, by identity.
     * {@code NodeList.indexOf} compares structurally, which confuses repeated statements.
     */
    public static int statementIndex(BlockStmt body, Statement statement) {
        for (int i = 0; i < body.getStatements().size(); i++) {
            if (body.getStatement(i) == statement) {
                return i;
            }
        }
        return -1;
    }

    public static Expression unwrap(Expression expression) {
        Expression current = expression;
        while (current instanceof EnclosedExpr) {
            current = ((EnclosedExpr) current).getInner();
        }
        return current;
    }

    /**
     * Whether normal completion of {@code statement} is impossible, judged syntactically on its
     * last statement. Conservative: {@code false} when unsure.
     */
    public static boolean completesAbruptly(Statement statement) {
        if (statement instanceof ReturnStmt || statement instanceof ThrowStmt) {
            return true;
        }
        if (statement instanceof BlockStmt) {
            BlockStmt block = (BlockStmt) statement;
            return !block.getStatements().isEmpty() && completesAbruptly(block.getStatements().getLast().get());
        }
        if (statement instanceof IfStmt) {
            IfStmt ifStmt = (IfStmt) statement;
            return ifStmt.getElseStmt().isPresent()
                    && completesAbruptly(ifStmt.getThenStmt())
                    && completesAbruptly(ifStmt.getElseStmt().get());
        }
        return false;
    }
}
