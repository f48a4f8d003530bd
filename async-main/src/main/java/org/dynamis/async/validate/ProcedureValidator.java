package org.dynamis.async.validate;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.ContinueStmt;
import com.github.javaparser.ast.stmt.LabeledStmt;
import com.github.javaparser.ast.stmt.Statement;
import org.dynamis.async.LoweringOptions;
import org.dynamis.async.ast.AsyncAstUtils;
import org.dynamis.async.bind.Binder;
import org.dynamis.async.classify.Primitives;
import org.dynamis.async.classify.ProcedureDescriber;
import org.dynamis.async.classify.SuspensionClassifier;
import org.dynamis.async.classify.SuspensionShapes;
import org.dynamis.async.diagnostic.Diagnostic;
import org.dynamis.async.diagnostic.DiagnosticCode;
import org.dynamis.async.emit.GeneratedNames;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks that a procedure has a shape the lowering can express. Every violation is reported;
 * the caller decides to stop when any of them is an error.
 */
public class ProcedureValidator {

    private final Binder binder;
    private final SuspensionClassifier classifier;
    private final LoweringOptions options;
    private final ProcedureDescriber describer;

    public ProcedureValidator(Binder binder, SuspensionClassifier classifier, LoweringOptions options) {
        this.binder = binder;
        this.classifier = classifier;
        this.options = options;
        this.describer = new ProcedureDescriber(binder);
    }

    public List<Diagnostic> validate(ClassOrInterfaceDeclaration owner, MethodDeclaration method) {
        String name = method.getNameAsString();
        List<Diagnostic> diagnostics = new ArrayList<>();

        Optional<BlockStmt> maybeBody = method.getBody();
        if (maybeBody.isEmpty()) {
            diagnostics.add(Diagnostic.error(DiagnosticCode.MISSING_BODY, name, method,
                    "Async procedure '" + name + "' has no statement body"));
            return diagnostics;
        }
        BlockStmt body = maybeBody.get();
        if (!describer.returnsTask(method)) {
            diagnostics.add(Diagnostic.error(DiagnosticCode.NOT_A_TASK, name, method,
                    "Async procedure '" + name + "' returns " + method.getType() + " instead of Task"));
            return diagnostics;
        }

        if (method.isStatic()) {
            diagnostics.add(Diagnostic.error(DiagnosticCode.STATIC_PROCEDURE, name, method,
                    "Async procedure '" + name + "' is static; its state needs an instance"));
        }
        if (!binder.isSubtypeOf(owner, Primitives.ASYNC_BEHAVIOUR)) {
            diagnostics.add(Diagnostic.error(DiagnosticCode.NOT_A_BEHAVIOUR, name, owner,
                    "Class '" + owner.getNameAsString() + "' declares async procedure '" + name
                            + "' but does not extend AsyncBehaviour"));
        }
        if (method.isSynchronized()) {
            diagnostics.add(Diagnostic.warning(DiagnosticCode.SYNCHRONIZED_PROCEDURE, name, method,
                    "synchronized has no effect on '" + name + "': its segments run in separate resumptions"));
        }

        checkLabeledJumps(name, body, diagnostics);
        List<MethodCallExpr> suspensions = classifier.findSuspensions(body);
        checkSuspensionPlacement(name, body, suspensions, diagnostics);
        if (!suspensions.isEmpty()) {
            checkGeneratorMarkers(name, body, diagnostics);
        }
        checkNameCollisions(owner, method, diagnostics);
        return diagnostics;
    }

    private static void checkLabeledJumps(String name, BlockStmt body, List<Diagnostic> diagnostics) {
        for (Node node : body.findAll(Node.class, n -> isLabeledJump(n) && AsyncAstUtils.enclosingClosure(n, body).isEmpty())) {
            diagnostics.add(Diagnostic.error(DiagnosticCode.LABELED_JUMP, name, node,
                    "Labeled jump '" + firstLine(node) + "' cannot be split across resumptions"));
        }
    }

    private static boolean isLabeledJump(Node node) {
        if (node instanceof LabeledStmt) {
            return true;
        }
        if (node instanceof BreakStmt) {
            return ((BreakStmt) node).getLabel().isPresent();
        }
        return node instanceof ContinueStmt && ((ContinueStmt) node).getLabel().isPresent();
    }

    private static void checkSuspensionPlacement(String name, BlockStmt body, List<MethodCallExpr> suspensions,
                                                 List<Diagnostic> diagnostics) {
        Map<Statement, MethodCallExpr> seen = new IdentityHashMap<>();
        for (MethodCallExpr site : suspensions) {
            if (AsyncAstUtils.enclosingClosure(site, body).isPresent()) {
                diagnostics.add(Diagnostic.error(DiagnosticCode.SUSPENSION_IN_CLOSURE, name, site,
                        "'" + site + "' suspends inside a lambda or nested class"));
                continue;
            }
            Statement top = AsyncAstUtils.topLevelStatement(site, body)
                    .orElseThrow(() -> new IllegalStateException("Suspension outside the body: " + site));
            Statement nearest = AsyncAstUtils.enclosingStatement(site).orElse(top);
            if (nearest != top) {
                diagnostics.add(Diagnostic.error(DiagnosticCode.NESTED_SUSPENSION, name, site,
                        "'" + site + "' suspends inside nested control flow"));
                continue;
            }
            if (seen.put(top, site) != null) {
                diagnostics.add(Diagnostic.error(DiagnosticCode.EMBEDDED_SUSPENSION, name, site,
                        "Statement '" + firstLine(top) + "' suspends more than once"));
                continue;
            }
            if (SuspensionShapes.shapeOf(site, top).isEmpty()) {
                diagnostics.add(Diagnostic.error(DiagnosticCode.EMBEDDED_SUSPENSION, name, site,
                        "'" + site + "' is part of a larger expression"));
            }
        }
    }

    private void checkGeneratorMarkers(String name, BlockStmt body, List<Diagnostic> diagnostics) {
        Set<String> simpleNames = options.getGeneratorMarkers().stream()
                .map(marker -> marker.substring(marker.lastIndexOf('.') + 1))
                .collect(Collectors.toSet());
        for (MethodCallExpr call : body.findAll(MethodCallExpr.class)) {
            if (!simpleNames.contains(call.getNameAsString())
                    || AsyncAstUtils.enclosingClosure(call, body).isPresent()) {
                continue;
            }
            Optional<String> identity = binder.resolveMethod(call);
            if (identity.isPresent() && options.getGeneratorMarkers().contains(identity.get())) {
                diagnostics.add(Diagnostic.error(DiagnosticCode.GENERATOR_YIELD, name, call,
                        "'" + call + "' yields generator values in a procedure that also suspends"));
            }
        }
    }

    private void checkNameCollisions(ClassOrInterfaceDeclaration owner, MethodDeclaration method,
                                     List<Diagnostic> diagnostics) {
        String name = method.getNameAsString();
        GeneratedNames names = new GeneratedNames(options.getNamePrefix(), name);
        for (BodyDeclaration<?> member : owner.getMembers()) {
            if (member == method) {
                continue;
            }
            for (String memberName : memberNames(member)) {
                if (names.isGenerated(memberName)) {
                    diagnostics.add(Diagnostic.error(DiagnosticCode.NAME_COLLISION, name, member,
                            "Member '" + memberName + "' clashes with names generated for '" + name + "'"));
                }
            }
        }
        long overloads = owner.getMethodsByName(name).stream()
                .filter(m -> m != method && describer.isMarked(m))
                .count();
        if (overloads > 0) {
            diagnostics.add(Diagnostic.error(DiagnosticCode.NAME_COLLISION, name, method,
                    "Async procedure '" + name + "' is overloaded; another async overload would share its generated members"));
        }
    }

    private static List<String> memberNames(BodyDeclaration<?> member) {
        if (member instanceof FieldDeclaration) {
            return ((FieldDeclaration) member).getVariables().stream()
                    .map(VariableDeclarator::getNameAsString)
                    .collect(Collectors.toList());
        }
        if (member instanceof MethodDeclaration) {
            return List.of(((MethodDeclaration) member).getNameAsString());
        }
        return List.of();
    }

    private static String firstLine(Node node) {
        String text = node.toString();
        int newline = text.indexOf('\n');
        return newline < 0 ? text : text.substring(0, newline) + " ...";
    }
}
