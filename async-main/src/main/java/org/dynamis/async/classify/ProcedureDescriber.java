package org.dynamis.async.classify;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.type.ArrayType;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;
import org.dynamis.async.ast.AsyncAstUtils;
import org.dynamis.async.ast.SourceOrder;
import org.dynamis.async.bind.Binder;
import org.dynamis.async.model.AsyncProcedureDescriptor;
import org.dynamis.async.model.LocalDeclaration;
import org.dynamis.async.model.ProcedureParameter;

import java.util.ArrayList;
import java.util.List;

/**
 * Recognises async procedures and gathers the facts later passes need about them.
 */
public class ProcedureDescriber {

    private final Binder binder;

    public ProcedureDescriber(Binder binder) {
        this.binder = binder;
    }

    /**
     * Whether {@code method} carries {@code @AsyncProcedure}, by resolved identity.
     */
    public boolean isMarked(MethodDeclaration method) {
        return method.getAnnotations().stream()
                .filter(annotation -> annotation.getName().getIdentifier().equals(Primitives.ASYNC_PROCEDURE_SIMPLE_NAME))
                .anyMatch(annotation -> binder.resolveAnnotation(annotation)
                        .map(Primitives.ASYNC_PROCEDURE::equals)
                        .orElse(false));
    }

    public boolean returnsTask(MethodDeclaration method) {
        if (!(method.getType() instanceof ClassOrInterfaceType)) {
            return false;
        }
        return binder.resolveType(method.getType())
                .map(type -> type.is(Primitives.TASK))
                .orElse(false);
    }

    public AsyncProcedureDescriptor describe(ClassOrInterfaceDeclaration owner, MethodDeclaration method, SourceOrder order) {
        Type resultType = resultTypeOf(method);
        boolean returnsValue = !(resultType.asString().equals("Void") || resultType.asString().equals("java.lang.Void"));
        return new AsyncProcedureDescriptor(method.getNameAsString(), owner, method, resultType, returnsValue,
                parametersOf(method), localsOf(method, order));
    }

    private static Type resultTypeOf(MethodDeclaration method) {
        ClassOrInterfaceType task = method.getType().asClassOrInterfaceType();
        return task.getTypeArguments()
                .filter(arguments -> arguments.size() == 1)
                .map(arguments -> arguments.get(0).clone())
                .orElseGet(() -> new ClassOrInterfaceType(null, "Void"));
    }

    private List<ProcedureParameter> parametersOf(MethodDeclaration method) {
        List<ProcedureParameter> parameters = new ArrayList<>();
        boolean cancellationSeen = false;
        for (Parameter parameter : method.getParameters()) {
            Type type = parameter.isVarArgs() ? new ArrayType(parameter.getType().clone()) : parameter.getType().clone();
            boolean cancellation = !cancellationSeen && isCancellationToken(parameter.getType());
            cancellationSeen |= cancellation;
            parameters.add(new ProcedureParameter(parameter.getNameAsString(), type, cancellation, parameter));
        }
        return parameters;
    }

    private boolean isCancellationToken(Type type) {
        return binder.resolveType(type)
                .map(bound -> bound.is(Primitives.CANCELLATION_TOKEN))
                .orElse(false);
    }

    private static List<LocalDeclaration> localsOf(MethodDeclaration method, SourceOrder order) {
        BlockStmt body = method.getBody().orElseThrow(() -> new IllegalStateException("No body: " + method.getNameAsString()));
        List<LocalDeclaration> locals = new ArrayList<>();
        for (VariableDeclarator declarator : body.findAll(VariableDeclarator.class)) {
            if (!(declarator.getParentNode().orElse(null) instanceof VariableDeclarationExpr)) {
                continue;
            }
            if (AsyncAstUtils.enclosingClosure(declarator, body).isPresent()) {
                continue;
            }
            Node scope = scopeOf(declarator, body);
            Statement top = AsyncAstUtils.topLevelStatement(declarator, body)
                    .orElseThrow(() -> new IllegalStateException("Declarator outside the body: " + declarator));
            locals.add(new LocalDeclaration(declarator.getNameAsString(), declarator.getType().clone(),
                    order.ordinal(declarator), order.end(scope), AsyncAstUtils.statementIndex(body, top),
                    scope == body, declarator));
        }
        return locals;
    }

    private static Node scopeOf(VariableDeclarator declarator, BlockStmt body) {
        Node current = declarator.getParentNode().orElse(body);
        while (current != body) {
            if (current instanceof BlockStmt || current instanceof ForStmt || current instanceof ForEachStmt
                    || current instanceof TryStmt || current instanceof SwitchEntry || current instanceof CatchClause) {
                return current;
            }
            current = current.getParentNode().orElse(body);
        }
        return body;
    }
}
