package org.dynamis.async.segment;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithParameters;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.TryStmt;
import org.dynamis.async.model.HoistedSlot;
import org.dynamis.async.model.HoistingPlan;

import java.util.Optional;

/**
 * Redirects references to hoisted variables to their fields. Works on clones; the source
 * tree is never touched.
 */
public final class HoistedNameRewriter {

    private final HoistingPlan plan;

    public HoistedNameRewriter(HoistingPlan plan) {
        this.plan = plan;
    }

    /**
     * A clone of {@code node}, taken from top-level statement {@code statementIndex}, with every
     * hoisted reference renamed. References inside closures are renamed too: a captured field needs
     * no effectively-final copy. Inside anonymous and local class bodies a name declared by that
     * body shadows the hoisted variable and is kept.
     */
    @SuppressWarnings("unchecked")
    public <N extends Node> N rewrite(N node, int statementIndex) {
        N copy = (N) node.clone();
        if (copy instanceof NameExpr) {
            rename((NameExpr) copy, statementIndex);
            return copy;
        }
        for (NameExpr name : copy.findAll(NameExpr.class)) {
            if (!isShadowed(name, copy)) {
                rename(name, statementIndex);
            }
        }
        return copy;
    }

    private void rename(NameExpr name, int statementIndex) {
        Optional<HoistedSlot> slot = plan.slotFor(name.getNameAsString(), statementIndex);
        slot.ifPresent(s -> name.setName(s.storageName()));
    }

    // ── Shadowing inside class bodies ──────────────────────────────────────────

    private static boolean isShadowed(NameExpr name, Node root) {
        Node boundary = outermostClassBody(name, root);
        if (boundary == null) {
            return false;
        }
        String identifier = name.getNameAsString();
        Node child = name;
        Node current = name.getParentNode().orElse(null);
        while (current != null) {
            if (declares(current, child, identifier)) {
                return true;
            }
            if (current == boundary || current == root) {
                return false;
            }
            child = current;
            current = current.getParentNode().orElse(null);
        }
        return false;
    }

    /**
     * The outermost anonymous or local class between {@code name} and {@code root}, or null.
     */
    private static Node outermostClassBody(NameExpr name, Node root) {
        Node boundary = null;
        Node child = name;
        Node current = name.getParentNode().orElse(null);
        while (current != null) {
            if (current instanceof TypeDeclaration) {
                boundary = current;
            } else if (current instanceof ObjectCreationExpr && child instanceof BodyDeclaration) {
                boundary = current;
            }
            if (current == root) {
                break;
            }
            child = current;
            current = current.getParentNode().orElse(null);
        }
        return boundary;
    }

    /**
     * Whether {@code scope} declares {@code identifier} so that it is visible from its child {@code child}.
     */
    private static boolean declares(Node scope, Node child, String identifier) {
        if (scope instanceof BlockStmt) {
            return declaredBefore(((BlockStmt) scope).getStatements(), child, identifier);
        }
        if (scope instanceof SwitchEntry) {
            return declaredBefore(((SwitchEntry) scope).getStatements(), child, identifier);
        }
        if (scope instanceof NodeWithParameters && !(scope instanceof RecordDeclaration)) {
            return hasParameter(((NodeWithParameters<?>) scope).getParameters(), identifier);
        }
        if (scope instanceof CatchClause) {
            return ((CatchClause) scope).getParameter().getNameAsString().equals(identifier);
        }
        if (scope instanceof ForStmt) {
            return ((ForStmt) scope).getInitialization().stream()
                    .anyMatch(init -> init instanceof VariableDeclarationExpr
                            && declaresVariable((VariableDeclarationExpr) init, identifier));
        }
        if (scope instanceof ForEachStmt) {
            ForEachStmt forEach = (ForEachStmt) scope;
            return child != forEach.getIterable() && declaresVariable(forEach.getVariable(), identifier);
        }
        if (scope instanceof TryStmt) {
            return ((TryStmt) scope).getResources().stream()
                    .anyMatch(resource -> resource instanceof VariableDeclarationExpr
                            && declaresVariable((VariableDeclarationExpr) resource, identifier));
        }
        if (scope instanceof RecordDeclaration) {
            RecordDeclaration record = (RecordDeclaration) scope;
            return hasParameter(record.getParameters(), identifier) || hasField(record.getMembers(), identifier);
        }
        if (scope instanceof TypeDeclaration) {
            return hasField(((TypeDeclaration<?>) scope).getMembers(), identifier);
        }
        if (scope instanceof ObjectCreationExpr && child instanceof BodyDeclaration) {
            return ((ObjectCreationExpr) scope).getAnonymousClassBody()
                    .map(members -> hasField(members, identifier))
                    .orElse(false);
        }
        return false;
    }

    private static boolean declaredBefore(NodeList<Statement> statements, Node child, String identifier) {
        for (Statement statement : statements) {
            if (statement == child) {
                return false;
            }
            if (statement instanceof ExpressionStmt
                    && ((ExpressionStmt) statement).getExpression() instanceof VariableDeclarationExpr
                    && declaresVariable((VariableDeclarationExpr) ((ExpressionStmt) statement).getExpression(), identifier)) {
                return true;
            }
        }
        return false;
    }

    private static boolean declaresVariable(VariableDeclarationExpr declaration, String identifier) {
        return declaration.getVariables().stream().anyMatch(v -> v.getNameAsString().equals(identifier));
    }

    private static boolean hasParameter(NodeList<Parameter> parameters, String identifier) {
        return parameters.stream().anyMatch(p -> p.getNameAsString().equals(identifier));
    }

    private static boolean hasField(NodeList<BodyDeclaration<?>> members, String identifier) {
        return members.stream()
                .filter(member -> member instanceof FieldDeclaration)
                .anyMatch(member -> ((FieldDeclaration) member).getVariables().stream()
                        .anyMatch(v -> v.getNameAsString().equals(identifier)));
    }
}
