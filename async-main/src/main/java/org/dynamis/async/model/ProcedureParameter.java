package org.dynamis.async.model;

import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.type.Type;

/**
 * @param name         parameter name
 * @param type         storage type; {@code T[]} for a varargs {@code T...}
 * @param cancellation whether this is the procedure's cancellation token
 * @param declaration  the source parameter
 */
public record ProcedureParameter(String name, Type type, boolean cancellation, Parameter declaration) {
}
