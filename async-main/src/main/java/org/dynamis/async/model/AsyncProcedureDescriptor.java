package org.dynamis.async.model;

import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.type.Type;

import java.util.List;
import java.util.Optional;

/**
 * An async procedure ready for lowering.
 *
 * @param name         procedure name
 * @param owner        declaring class
 * @param declaration  the source method
 * @param resultType   {@code T} of the declared {@code Task<T>}
 * @param returnsValue whether {@code T} is something other than {@code Void}
 * @param parameters   declared parameters in order
 * @param locals       locals declared in the body, in source order
 */
public record AsyncProcedureDescriptor(String name, ClassOrInterfaceDeclaration owner, MethodDeclaration declaration,
                                       Type resultType, boolean returnsValue, List<ProcedureParameter> parameters,
                                       List<LocalDeclaration> locals) {

    public AsyncProcedureDescriptor {
        parameters = List.copyOf(parameters);
        locals = List.copyOf(locals);
    }

    public BlockStmt body() {
        return declaration.getBody().orElseThrow(() -> new IllegalStateException("Procedure " + name + " has no body"));
    }

    public Optional<ProcedureParameter> cancellationParameter() {
        return parameters.stream().filter(ProcedureParameter::cancellation).findFirst();
    }
}
