package org.dynamis.async.liveness;

import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.LocalClassDeclarationStmt;
import com.github.javaparser.ast.stmt.LocalRecordDeclarationStmt;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.ast.type.TypeParameter;
import org.dynamis.async.StorageTypeException;
import org.dynamis.async.bind.Binder;
import org.dynamis.async.bind.BoundType;
import org.dynamis.async.model.AsyncProcedureDescriptor;
import org.dynamis.async.model.LocalDeclaration;
import org.dynamis.async.model.ProcedureParameter;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Decides the field type of a hoisted variable. A field type must be nameable at class level:
 * {@code var} needs a resolvable denotable type, and neither local classes nor the procedure's
 * own type variables may appear in it.
 */
public class StorageTypePolicy {

    private final Binder binder;

    public StorageTypePolicy(Binder binder) {
        this.binder = binder;
    }

    /**
     * Checks the {@code T} of the declared {@code Task<T>}, which types the result field.
     */
    public Type resultType(AsyncProcedureDescriptor procedure) {
        return check(procedure, procedure.name() + " result", procedure.resultType());
    }

    public Type parameterType(AsyncProcedureDescriptor procedure, ProcedureParameter parameter) {
        return check(procedure, parameter.name(), parameter.type());
    }

    public Type localType(AsyncProcedureDescriptor procedure, LocalDeclaration local) {
        if (!local.isVar()) {
            return check(procedure, local.name(), local.type());
        }
        Optional<Expression> initializer = local.declarator().getInitializer();
        Optional<BoundType> bound = initializer.flatMap(binder::typeOf);
        if (bound.isEmpty()) {
            throw new StorageTypeException(local.name(), "var", "the type of its initializer does not resolve",
                    local.declarator().getRange().orElse(null));
        }
        if (!bound.get().denotable()) {
            throw new StorageTypeException(local.name(), bound.get().description(), "the inferred type cannot be named",
                    local.declarator().getRange().orElse(null));
        }
        String simple = simpleName(bound.get().qualifiedName());
        if (localTypeNames(procedure).contains(simple)) {
            throw new StorageTypeException(local.name(), bound.get().description(),
                    "it is a class declared inside the procedure", local.declarator().getRange().orElse(null));
        }
        return check(procedure, local.name(), bound.get().toAstType());
    }

    private Type check(AsyncProcedureDescriptor procedure, String variable, Type type) {
        Set<String> localTypes = localTypeNames(procedure);
        Set<String> typeVariables = new HashSet<>();
        for (TypeParameter parameter : procedure.declaration().getTypeParameters()) {
            typeVariables.add(parameter.getNameAsString());
        }
        for (ClassOrInterfaceType named : type.findAll(ClassOrInterfaceType.class)) {
            String name = named.getNameAsString();
            if (named.getScope().isEmpty() && localTypes.contains(name)) {
                throw new StorageTypeException(variable, type.asString(), "'" + name + "' is declared inside the procedure",
                        named.getRange().orElse(null));
            }
            if (named.getScope().isEmpty() && typeVariables.contains(name)) {
                throw new StorageTypeException(variable, type.asString(),
                        "'" + name + "' is a type variable of the procedure", named.getRange().orElse(null));
            }
        }
        return type.clone();
    }

    private static Set<String> localTypeNames(AsyncProcedureDescriptor procedure) {
        BlockStmt body = procedure.body();
        Set<String> names = new HashSet<>();
        body.findAll(LocalClassDeclarationStmt.class)
                .forEach(s -> names.add(s.getClassDeclaration().getNameAsString()));
        body.findAll(LocalRecordDeclarationStmt.class)
                .forEach(s -> names.add(s.getRecordDeclaration().getNameAsString()));
        return names;
    }

    private static String simpleName(String qualifiedName) {
        return qualifiedName.substring(qualifiedName.lastIndexOf('.') + 1);
    }
}
