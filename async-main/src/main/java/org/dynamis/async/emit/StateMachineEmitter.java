package org.dynamis.async.emit;

import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.MethodReferenceExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.ThisExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.PrimitiveType;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.ast.type.VoidType;
import org.dynamis.async.LoweringOptions;
import org.dynamis.async.ast.AsyncAstUtils;
import org.dynamis.async.classify.Primitives;
import org.dynamis.async.model.AsyncProcedureDescriptor;
import org.dynamis.async.model.HoistedSlot;
import org.dynamis.async.model.HoistingPlan;
import org.dynamis.async.model.ProcedureParameter;
import org.dynamis.async.model.Segment;
import org.dynamis.async.model.SlotOrigin;
import org.dynamis.async.model.StateMachineArtifact;
import org.dynamis.async.model.SuspensionPoint;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the resumable form of a procedure: one field per slot, an entry method with the original
 * signature, and a dispatcher that runs one segment per call.
 * <p>
 * Dispatcher layout, for segments {@code 0..N}:
 * <pre>
 * if (result == null || result.isDone()) return;
 * switch (state) {
 *     case i: { [completion guard] segment i; state = i + 1; schedule(...); return; }
 *     case N: { segment N; result.complete(null); return; }
 *     default: return;
 * }
 * </pre>
 */
public class StateMachineEmitter {

    private static final Logger log = LogManager.getLogger(StateMachineEmitter.class);

    private final LoweringOptions options;

    public StateMachineEmitter(LoweringOptions options) {
        this.options = options;
    }

    public StateMachineArtifact emit(AsyncProcedureDescriptor procedure, HoistingPlan plan, List<Segment> segments) {
        GeneratedNames names = new GeneratedNames(options.getNamePrefix(), procedure.name());

        List<FieldDeclaration> fields = new ArrayList<>();
        fields.add(field(PrimitiveType.intType(), names.state()));
        fields.add(field(taskOf(procedure), names.result()));
        for (HoistedSlot slot : plan.slots()) {
            fields.add(field(slot.type().clone(), slot.storageName()));
        }

        MethodDeclaration entry = entry(procedure, plan, names);
        MethodDeclaration dispatch = dispatch(procedure, plan, segments, names);

        Set<String> imports = new LinkedHashSet<>(List.of(Primitives.TASK, Primitives.TIMING, Primitives.RESUMPTION));
        log.debug("Emitted state machine for '{}' with {} fields and {} states",
                procedure.name(), fields.size(), segments.size());
        return new StateMachineArtifact(procedure, names.state(), names.result(), dispatch, entry, fields,
                plan.slots(), segments, imports);
    }

    // ── Entry ──────────────────────────────────────────────────────────────────

    private static MethodDeclaration entry(AsyncProcedureDescriptor procedure, HoistingPlan plan, GeneratedNames names) {
        BlockStmt body = new BlockStmt();
        body.addStatement(assign(names.state(), new IntegerLiteralExpr("0")));
        ClassOrInterfaceType diamond = new ClassOrInterfaceType(null, "Task").setTypeArguments(new NodeList<>());
        body.addStatement(assign(names.result(), new ObjectCreationExpr(null, diamond, new NodeList<>())));
        for (ProcedureParameter parameter : procedure.parameters()) {
            plan.slotFor(parameter.name(), 0)
                    .filter(slot -> slot.origin() == SlotOrigin.PARAMETER)
                    .ifPresent(slot -> body.addStatement(assign(slot.storageName(), new NameExpr(parameter.name()))));
        }
        body.addStatement(new MethodCallExpr(null, names.dispatch(), new NodeList<>()));
        body.addStatement(new ReturnStmt(new NameExpr(names.result())));

        MethodDeclaration entry = procedure.declaration().clone();
        entry.setBody(body);
        return entry;
    }

    // ── Dispatcher ─────────────────────────────────────────────────────────────

    private MethodDeclaration dispatch(AsyncProcedureDescriptor procedure, HoistingPlan plan, List<Segment> segments,
                                       GeneratedNames names) {
        BlockStmt body = new BlockStmt();
        Expression finished = new BinaryExpr(
                new BinaryExpr(new NameExpr(names.result()), new NullLiteralExpr(), BinaryExpr.Operator.EQUALS),
                call(names.result(), "isDone"),
                BinaryExpr.Operator.OR);
        body.addStatement(new IfStmt(finished, returnBlock(), null));

        Optional<HoistedSlot> token = procedure.cancellationParameter()
                .flatMap(parameter -> plan.slotFor(parameter.name(), 0));
        if (token.isPresent()) {
            String field = token.get().storageName();
            Expression requested = new BinaryExpr(
                    new BinaryExpr(new NameExpr(field), new NullLiteralExpr(), BinaryExpr.Operator.NOT_EQUALS),
                    call(field, "isCancellationRequested"),
                    BinaryExpr.Operator.AND);
            body.addStatement(new IfStmt(requested,
                    returnBlock(new ExpressionStmt(call(names.result(), "cancel"))), null));
        }

        NodeList<SwitchEntry> entries = new NodeList<>();
        for (Segment segment : segments) {
            Optional<SuspensionPoint> previous = segment.index() == 0
                    ? Optional.empty()
                    : segments.get(segment.index() - 1).terminatorPoint();
            BlockStmt branch = branch(segment, previous, plan, names);
            entries.add(new SwitchEntry(new NodeList<>(new IntegerLiteralExpr(String.valueOf(segment.index()))),
                    SwitchEntry.Type.STATEMENT_GROUP, new NodeList<>(branch)));
        }
        entries.add(new SwitchEntry(new NodeList<>(), SwitchEntry.Type.STATEMENT_GROUP,
                new NodeList<>(new ReturnStmt())));
        body.addStatement(new SwitchStmt(new NameExpr(names.state()), entries));

        MethodDeclaration dispatch = new MethodDeclaration(new NodeList<>(Modifier.publicModifier()),
                new VoidType(), names.dispatch());
        dispatch.setBody(body);
        return dispatch;
    }

    private BlockStmt branch(Segment segment, Optional<SuspensionPoint> previous, HoistingPlan plan,
                             GeneratedNames names) {
        BlockStmt branch = new BlockStmt();
        segment.statements().forEach(statement -> branch.addStatement(statement.clone()));
        ReturnRewriter.rewrite(branch, names.result());

        if (previous.isPresent() && previous.get().kind().isCompletionBased()) {
            List<Statement> guard = completionGuard(awaiterOf(previous.get(), plan), names);
            for (int i = guard.size() - 1; i >= 0; i--) {
                branch.getStatements().addFirst(guard.get(i));
            }
        }

        boolean abrupt = !branch.getStatements().isEmpty()
                && AsyncAstUtils.completesAbruptly(branch.getStatements().getLast().get());
        if (abrupt) {
            return branch;
        }
        if (segment.isTerminal()) {
            branch.addStatement(call(names.result(), "complete", new NullLiteralExpr()));
            branch.addStatement(new ReturnStmt());
            return branch;
        }

        SuspensionPoint point = segment.terminator();
        Expression timing;
        if (point.kind().isCompletionBased()) {
            String awaiter = awaiterOf(point, plan);
            branch.addStatement(assign(awaiter, point.awaited().clone()));
            timing = completionTiming(awaiter);
        } else {
            timing = timing(point);
        }
        branch.addStatement(assign(names.state(), new IntegerLiteralExpr(String.valueOf(segment.index() + 1))));
        branch.addStatement(schedule(names, timing));
        branch.addStatement(new ReturnStmt());
        return branch;
    }

    /**
     * Re-waits while the awaited task is running, and forwards its fault or cancellation.
     */
    private List<Statement> completionGuard(String awaiter, GeneratedNames names) {
        List<Statement> guard = new ArrayList<>();
        guard.add(new IfStmt(new UnaryExpr(call(awaiter, "isDone"), UnaryExpr.Operator.LOGICAL_COMPLEMENT),
                returnBlock(schedule(names, completionTiming(awaiter))), null));
        guard.add(new IfStmt(call(awaiter, "isFaulted"),
                returnBlock(new ExpressionStmt(call(names.result(), "fail", call(awaiter, "getError")))), null));
        guard.add(new IfStmt(call(awaiter, "isCanceled"),
                returnBlock(new ExpressionStmt(call(names.result(), "cancel"))), null));
        return guard;
    }

    private Expression completionTiming(String awaiter) {
        switch (options.getJoinStrategy()) {
            case NEXT_TICK:
                return staticCall("Timing", "nextFrame");
            case COMPLETION_SIGNAL:
            default:
                return staticCall("Timing", "whenComplete", new NameExpr(awaiter));
        }
    }

    private static Expression timing(SuspensionPoint point) {
        switch (point.kind()) {
            case TIMED_DELAY:
                return staticCall("Timing", "seconds", point.timing().clone());
            case FRAME_DELAY:
                return staticCall("Timing", "frames", point.timing().clone());
            case YIELD_ONE_STEP:
                return staticCall("Timing", "nextFrame");
            default:
                throw new IllegalStateException("No fixed timing for " + point.kind());
        }
    }

    private static String awaiterOf(SuspensionPoint point, HoistingPlan plan) {
        return plan.awaiterFor(point.index())
                .map(HoistedSlot::storageName)
                .orElseThrow(() -> new IllegalStateException("No awaiter slot for suspension #" + point.index()));
    }

    // ── Node helpers ───────────────────────────────────────────────────────────

    private static Statement schedule(GeneratedNames names, Expression timing) {
        Expression resumption = staticCall("Resumption", "of", new ThisExpr(),
                new MethodReferenceExpr(new ThisExpr(), null, names.dispatch()));
        return new ExpressionStmt(new MethodCallExpr(null, "schedule", new NodeList<>(resumption, timing)));
    }

    private static ClassOrInterfaceType taskOf(AsyncProcedureDescriptor procedure) {
        return new ClassOrInterfaceType(null, "Task").setTypeArguments(procedure.resultType().clone());
    }

    private static FieldDeclaration field(Type type, String name) {
        return new FieldDeclaration(new NodeList<>(Modifier.privateModifier()), new VariableDeclarator(type, name));
    }

    private static Statement assign(String field, Expression value) {
        return new ExpressionStmt(new AssignExpr(new NameExpr(field), value, AssignExpr.Operator.ASSIGN));
    }

    private static MethodCallExpr call(String scope, String method, Expression... arguments) {
        return new MethodCallExpr(new NameExpr(scope), method, new NodeList<>(arguments));
    }

    private static MethodCallExpr staticCall(String type, String method, Expression... arguments) {
        return new MethodCallExpr(new NameExpr(type), method, new NodeList<>(arguments));
    }

    private static BlockStmt returnBlock(Statement... before) {
        BlockStmt block = new BlockStmt();
        for (Statement statement : before) {
            block.addStatement(statement);
        }
        block.addStatement(new ReturnStmt());
        return block;
    }
}
