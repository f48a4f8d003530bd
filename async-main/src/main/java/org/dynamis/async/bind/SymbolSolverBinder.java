package org.dynamis.async.bind;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.resolution.declarations.ResolvedMethodDeclaration;
import com.github.javaparser.resolution.declarations.ResolvedReferenceTypeDeclaration;
import com.github.javaparser.resolution.types.ResolvedReferenceType;
import com.github.javaparser.resolution.types.ResolvedType;
import com.github.javaparser.symbolsolver.JavaSymbolSolver;
import com.github.javaparser.symbolsolver.javaparsermodel.declarations.JavaParserAnonymousClassDeclaration;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link Binder} backed by the JavaParser symbol solver. Resolution failures are logged at debug
 * level and answered with "unknown".
 */
public class SymbolSolverBinder implements Binder {

    private static final Logger log = LogManager.getLogger(SymbolSolverBinder.class);

    private final JavaSymbolSolver symbolSolver;

    public SymbolSolverBinder(ClassLoader classLoader) {
        this.symbolSolver = AsyncParsers.newSymbolSolver(classLoader);
    }

    @Override
    public void attach(CompilationUnit unit) {
        if (!unit.containsData(Node.SYMBOL_RESOLVER_KEY)) {
            symbolSolver.inject(unit);
        }
    }

    @Override
    public Optional<String> resolveMethod(MethodCallExpr call) {
        try {
            ResolvedMethodDeclaration method = call.resolve();
            return Optional.of(method.getQualifiedName());
        } catch (RuntimeException e) {
            log.debug("Cannot resolve method call '{}': {}", call, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<String> resolveAnnotation(AnnotationExpr annotation) {
        try {
            return Optional.of(annotation.resolve().getQualifiedName());
        } catch (RuntimeException e) {
            log.debug("Cannot resolve annotation '{}': {}", annotation, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<BoundType> typeOf(Expression expression) {
        try {
            return Optional.of(bind(expression.calculateResolvedType()));
        } catch (RuntimeException e) {
            log.debug("Cannot compute the type of '{}': {}", expression, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<BoundType> resolveType(Type type) {
        try {
            return Optional.of(bind(type.resolve()));
        } catch (RuntimeException e) {
            log.debug("Cannot resolve type '{}': {}", type, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean isSubtypeOf(ClassOrInterfaceDeclaration declaration, String qualifiedName) {
        try {
            ResolvedReferenceTypeDeclaration resolved = declaration.resolve();
            if (resolved.getQualifiedName().equals(qualifiedName)) {
                return true;
            }
            return resolved.getAllAncestors().stream()
                    .anyMatch(ancestor -> ancestor.getQualifiedName().equals(qualifiedName));
        } catch (RuntimeException e) {
            log.debug("Cannot resolve ancestors of '{}': {}", declaration.getNameAsString(), e.getMessage());
            return false;
        }
    }

    static BoundType bind(ResolvedType type) {
        if (type.isPrimitive()) {
            String name = type.asPrimitive().describe();
            return new BoundType(name, List.of(), name, true);
        }
        if (type.isArray()) {
            BoundType component = bind(type.asArrayType().getComponentType());
            return new BoundType(component.qualifiedName() + "[]", List.of(), type.describe(), component.denotable());
        }
        if (type.isReferenceType()) {
            ResolvedReferenceType reference = type.asReferenceType();
            List<BoundType> arguments = new ArrayList<>();
            boolean denotable = !isAnonymous(reference);
            for (ResolvedType argument : reference.typeParametersValues()) {
                BoundType bound = bind(argument);
                arguments.add(bound);
                denotable &= bound.denotable();
            }
            return new BoundType(reference.getQualifiedName(), arguments, type.describe(), denotable);
        }
        if (type.isTypeVariable()) {
            // a method's type variable does not exist at field level
            boolean denotable = type.asTypeParameter().declaredOnType();
            return new BoundType(type.describe(), List.of(), type.describe(), denotable);
        }
        if (type.isWildcard()) {
            return new BoundType("?", List.of(), type.describe(), true);
        }
        // null type, lambda constraints, captures and intersections cannot be written as a field type
        return new BoundType(type.describe(), List.of(), type.describe(), false);
    }

    private static boolean isAnonymous(ResolvedReferenceType reference) {
        return reference.getTypeDeclaration()
                .map(declaration -> declaration instanceof JavaParserAnonymousClassDeclaration)
                .orElse(false);
    }
}
