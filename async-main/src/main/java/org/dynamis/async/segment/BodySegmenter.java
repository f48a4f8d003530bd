package org.dynamis.async.segment;

import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.type.Type;
import org.dynamis.async.model.AsyncProcedureDescriptor;
import org.dynamis.async.model.HoistedSlot;
import org.dynamis.async.model.HoistingPlan;
import org.dynamis.async.model.Segment;
import org.dynamis.async.model.SuspensionPoint;
import org.dynamis.async.model.TransientLocal;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.dynamis.async.ast.AsyncAstUtils.unwrap;

/**
 * Splits a procedure body at its suspension points. Segment {@code i} holds the statements after
 * suspension {@code i - 1} (starting with the delivery of its value, if any) up to and including
 * the evaluation of suspension {@code i}.
 */
public class BodySegmenter {

    private static final Logger log = LogManager.getLogger(BodySegmenter.class);

    public List<Segment> segment(AsyncProcedureDescriptor procedure, List<SuspensionPoint> points, HoistingPlan plan) {
        HoistedNameRewriter rewriter = new HoistedNameRewriter(plan);
        Map<Integer, SuspensionPoint> byStatement = new HashMap<>();
        points.forEach(p -> byStatement.put(p.statementIndex(), p));

        List<Segment> segments = new ArrayList<>();
        List<Statement> current = new ArrayList<>();
        List<Statement> statements = procedure.body().getStatements();
        for (int i = 0; i < statements.size(); i++) {
            Statement statement = statements.get(i);
            SuspensionPoint point = byStatement.get(i);
            if (point != null) {
                int at = i;
                SuspensionPoint rewritten = point.withOperands(e -> rewriter.rewrite(e, at));
                segments.add(new Segment(segments.size(), current, rewritten));
                current = new ArrayList<>();
                addRedeclarations(current, plan.redeclarationsFor(segments.size()));
                delivery(point, plan, rewriter).ifPresent(current::add);
            } else if (isDeclaration(statement)) {
                current.addAll(splitDeclaration((VariableDeclarationExpr) ((ExpressionStmt) statement).getExpression(),
                        i, plan, rewriter));
            } else {
                current.add(rewriter.rewrite(statement, i));
            }
        }
        segments.add(new Segment(segments.size(), current, null));
        log.debug("Procedure '{}' split into {} segments", procedure.name(), segments.size());
        return segments;
    }

    private static boolean isDeclaration(Statement statement) {
        return statement instanceof ExpressionStmt
                && ((ExpressionStmt) statement).getExpression() instanceof VariableDeclarationExpr;
    }

    /**
     * Hoisted declarators become assignments to their fields (or vanish without an initializer);
     * the others stay declarations, one per statement, in source order.
     */
    private static List<Statement> splitDeclaration(VariableDeclarationExpr declaration, int statementIndex,
                                                    HoistingPlan plan, HoistedNameRewriter rewriter) {
        List<Statement> result = new ArrayList<>();
        for (VariableDeclarator declarator : declaration.getVariables()) {
            Optional<HoistedSlot> slot = plan.slotFor(declarator.getNameAsString(), statementIndex);
            Optional<Expression> initializer = declarator.getInitializer()
                    .map(e -> rewriter.rewrite(e, statementIndex));
            if (slot.isPresent()) {
                initializer.ifPresent(value -> result.add(assign(slot.get().storageName(), value)));
            } else {
                VariableDeclarator copy = new VariableDeclarator(declarator.getType().clone(), declarator.getNameAsString());
                initializer.ifPresent(copy::setInitializer);
                result.add(new ExpressionStmt(new VariableDeclarationExpr(modifiersOf(declaration),
                        new NodeList<>(copy))));
            }
        }
        return result;
    }

    private static void addRedeclarations(List<Statement> segment, List<TransientLocal> locals) {
        for (TransientLocal local : locals) {
            segment.add(new ExpressionStmt(new VariableDeclarationExpr(local.type().clone(), local.name())));
        }
    }

    /**
     * The statement that hands the awaited value to its destination at the start of the next segment.
     */
    private static Optional<Statement> delivery(SuspensionPoint point, HoistingPlan plan, HoistedNameRewriter rewriter) {
        if (!point.shape().usesValue()) {
            return Optional.empty();
        }
        HoistedSlot awaiter = plan.awaiterFor(point.index())
                .orElseThrow(() -> new IllegalStateException("No awaiter slot for suspension #" + point.index()));
        Expression value = new MethodCallExpr(new NameExpr(awaiter.storageName()), "getResult");
        Statement statement = point.statement();
        switch (point.shape()) {
            case RETURN:
                return Optional.of(new ReturnStmt(value));
            case ASSIGN: {
                AssignExpr assign = (AssignExpr) unwrap(((ExpressionStmt) statement).getExpression());
                Expression target = rewriter.rewrite(assign.getTarget(), point.statementIndex());
                return Optional.of(new ExpressionStmt(new AssignExpr(target, value, AssignExpr.Operator.ASSIGN)));
            }
            case DECLARE: {
                VariableDeclarationExpr declaration =
                        (VariableDeclarationExpr) unwrap(((ExpressionStmt) statement).getExpression());
                VariableDeclarator declarator = declaration.getVariable(0);
                Optional<HoistedSlot> slot = plan.slotFor(declarator.getNameAsString(), point.statementIndex());
                if (slot.isPresent()) {
                    return Optional.of(assign(slot.get().storageName(), value));
                }
                Type type = declarator.getType().clone();
                VariableDeclarator copy = new VariableDeclarator(type, declarator.getNameAsString(), value);
                return Optional.of(new ExpressionStmt(new VariableDeclarationExpr(modifiersOf(declaration),
                        new NodeList<>(copy))));
            }
            default:
                return Optional.empty();
        }
    }

    private static NodeList<Modifier> modifiersOf(VariableDeclarationExpr declaration) {
        NodeList<Modifier> modifiers = new NodeList<>();
        declaration.getModifiers().forEach(m -> modifiers.add(m.clone()));
        return modifiers;
    }

    private static Statement assign(String field, Expression value) {
        return new ExpressionStmt(new AssignExpr(new NameExpr(field), value, AssignExpr.Operator.ASSIGN));
    }
}
