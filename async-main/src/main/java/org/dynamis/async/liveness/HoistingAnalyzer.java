package org.dynamis.async.liveness;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.Statement;
import org.dynamis.async.LoweringOptions;
import org.dynamis.async.ast.SourceOrder;
import org.dynamis.async.emit.GeneratedNames;
import org.dynamis.async.model.AsyncProcedureDescriptor;
import org.dynamis.async.model.HoistedSlot;
import org.dynamis.async.model.HoistingPlan;
import org.dynamis.async.model.LocalDeclaration;
import org.dynamis.async.model.ProcedureParameter;
import org.dynamis.async.model.SlotOrigin;
import org.dynamis.async.model.SuspensionPoint;
import org.dynamis.async.model.SuspensionShape;
import org.dynamis.async.model.TransientLocal;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.dynamis.async.ast.AsyncAstUtils.unwrap;

/**
 * Decides which variables must survive a suspension and therefore move into fields.
 */
public class HoistingAnalyzer {

    private static final Logger log = LogManager.getLogger(HoistingAnalyzer.class);

    private enum Event { NONE, USE, DEF }

    private final LoweringOptions options;
    private final StorageTypePolicy storageTypes;

    public HoistingAnalyzer(LoweringOptions options, StorageTypePolicy storageTypes) {
        this.options = options;
        this.storageTypes = storageTypes;
    }

    public HoistingPlan analyze(AsyncProcedureDescriptor procedure, List<SuspensionPoint> points, SourceOrder order) {
        GeneratedNames names = new GeneratedNames(options.getNamePrefix(), procedure.name());
        BlockStmt body = procedure.body();
        List<NameExpr> references = body.findAll(NameExpr.class);
        List<HoistedSlot> slots = new ArrayList<>();
        Map<Integer, List<TransientLocal>> redeclarations = new HashMap<>();

        // ── Parameters ─────────────────────────────────────────────────────────
        for (ProcedureParameter parameter : procedure.parameters()) {
            boolean referenced = references.stream().anyMatch(r -> r.getNameAsString().equals(parameter.name()));
            if (parameter.cancellation() || referenced) {
                slots.add(new HoistedSlot(parameter.name(), names.slot(parameter.name()),
                        storageTypes.parameterType(procedure, parameter), SlotOrigin.PARAMETER, 0));
            }
        }

        // ── Locals ─────────────────────────────────────────────────────────────
        for (LocalDeclaration local : procedure.locals()) {
            List<Integer> uses = references.stream()
                    .filter(r -> r.getNameAsString().equals(local.name()))
                    .map(order::ordinal)
                    .filter(at -> at > local.ordinal() && at <= local.scopeEnd())
                    .collect(Collectors.toList());
            boolean hoist;
            if (options.getHoistingStrategy() == HoistingStrategy.DATAFLOW && local.topLevel()) {
                Liveness liveness = liveness(procedure, points, local);
                hoist = liveness.liveAcrossBoundary;
                if (!hoist) {
                    for (int segment : liveness.laterSegments) {
                        redeclarations.computeIfAbsent(segment, k -> new ArrayList<>())
                                .add(new TransientLocal(local.name(), storageTypes.localType(procedure, local)));
                    }
                }
            } else {
                hoist = points.stream().anyMatch(p -> p.ordinal() > local.ordinal()
                        && uses.stream().anyMatch(use -> use > p.ordinal()));
            }
            if (hoist) {
                slots.add(new HoistedSlot(local.name(), names.slot(local.name()),
                        storageTypes.localType(procedure, local), SlotOrigin.LOCAL, local.statementIndex()));
            }
        }

        // ── Awaited tasks ──────────────────────────────────────────────────────
        for (SuspensionPoint point : points) {
            if (point.kind().isCompletionBased()) {
                slots.add(new HoistedSlot("await#" + point.index(), names.awaiter(point.index()),
                        point.awaitedType().clone(), SlotOrigin.AWAITED, 0));
            }
        }

        log.debug("Procedure '{}' hoists {}", procedure.name(),
                slots.stream().map(HoistedSlot::originalName).collect(Collectors.toList()));
        return new HoistingPlan(slots, redeclarations);
    }

    // ── Backward liveness over segments ────────────────────────────────────────

    private static final class Liveness {
        boolean liveAcrossBoundary;
        final List<Integer> laterSegments = new ArrayList<>();
    }

    private static Liveness liveness(AsyncProcedureDescriptor procedure, List<SuspensionPoint> points,
                                     LocalDeclaration local) {
        int segmentCount = points.size() + 1;
        List<List<Event>> events = new ArrayList<>();
        for (int i = 0; i < segmentCount; i++) {
            events.add(new ArrayList<>());
        }
        Map<Integer, SuspensionPoint> byStatement = new HashMap<>();
        points.forEach(p -> byStatement.put(p.statementIndex(), p));

        String name = local.name();
        int declaringSegment = -1;
        List<Statement> statements = procedure.body().getStatements();
        int segment = 0;
        for (int i = 0; i < statements.size(); i++) {
            Statement statement = statements.get(i);
            SuspensionPoint point = byStatement.get(i);
            if (i == local.statementIndex()) {
                if (point != null && point.shape() == SuspensionShape.DECLARE) {
                    declaringSegment = segment + 1;
                    events.get(segment + 1).add(Event.DEF);
                } else {
                    declaringSegment = segment;
                    events.get(segment).add(local.declarator().getInitializer().isPresent() ? Event.DEF : Event.NONE);
                }
            } else if (i > local.statementIndex()) {
                if (point != null) {
                    events.get(segment).add(references(point.awaited(), name) ? Event.USE : Event.NONE);
                    if (point.shape() == SuspensionShape.ASSIGN && assignsTo(point.statement(), name)) {
                        events.get(segment + 1).add(Event.DEF);
                    }
                } else {
                    events.get(segment).add(eventOf(statement, name));
                }
            }
            if (point != null) {
                segment++;
            }
        }

        boolean liveIn = false;
        boolean[] liveOut = new boolean[segmentCount];
        for (int j = segmentCount - 1; j >= 0; j--) {
            liveOut[j] = liveIn;
            List<Event> segmentEvents = events.get(j);
            Event first = segmentEvents.stream().filter(e -> e != Event.NONE).findFirst().orElse(Event.NONE);
            boolean defined = segmentEvents.contains(Event.DEF);
            liveIn = first == Event.USE || (liveOut[j] && !defined);
        }

        Liveness result = new Liveness();
        for (int j = Math.max(declaringSegment, 0); j < segmentCount - 1; j++) {
            result.liveAcrossBoundary |= liveOut[j];
        }
        for (int j = declaringSegment + 1; j < segmentCount; j++) {
            if (events.get(j).stream().anyMatch(e -> e != Event.NONE)) {
                result.laterSegments.add(j);
            }
        }
        return result;
    }

    private static Event eventOf(Statement statement, String name) {
        if (statement instanceof ExpressionStmt) {
            Expression expression = unwrap(((ExpressionStmt) statement).getExpression());
            if (expression instanceof AssignExpr) {
                AssignExpr assign = (AssignExpr) expression;
                if (assign.getOperator() == AssignExpr.Operator.ASSIGN
                        && isName(assign.getTarget(), name)
                        && !references(assign.getValue(), name)) {
                    return Event.DEF;
                }
            }
        }
        return references(statement, name) ? Event.USE : Event.NONE;
    }

    private static boolean assignsTo(Statement statement, String name) {
        Expression expression = unwrap(((ExpressionStmt) statement).getExpression());
        return expression instanceof AssignExpr && isName(((AssignExpr) expression).getTarget(), name);
    }

    private static boolean isName(Expression expression, String name) {
        return expression instanceof NameExpr && ((NameExpr) expression).getNameAsString().equals(name);
    }

    private static boolean references(Node node, String name) {
        return node.findFirst(NameExpr.class, n -> n.getNameAsString().equals(name)).isPresent();
    }
}
