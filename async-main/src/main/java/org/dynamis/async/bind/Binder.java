package org.dynamis.async.bind;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.type.Type;

import java.util.Optional;

/**
 * Semantic queries the lowering asks about the source it rewrites. An empty answer means
 * "unknown"; callers decide whether unknown is an error.
 */
public interface Binder {

    /**
     * Prepares {@code unit} for queries. Called once per unit before any other method.
     */
    default void attach(CompilationUnit unit) {
    }

    /**
     * Qualified name of the method {@code call} invokes, e.g. {@code org.dynamis.async.runtime.Task.delay}.
     */
    Optional<String> resolveMethod(MethodCallExpr call);

    /**
     * Qualified name of the annotation type {@code annotation} refers to.
     */
    Optional<String> resolveAnnotation(AnnotationExpr annotation);

    Optional<BoundType> typeOf(Expression expression);

    Optional<BoundType> resolveType(Type type);

    boolean isSubtypeOf(ClassOrInterfaceDeclaration declaration, String qualifiedName);
}
