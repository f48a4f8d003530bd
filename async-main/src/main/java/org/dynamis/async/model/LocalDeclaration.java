package org.dynamis.async.model;

import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.type.Type;

/**
 * A local variable declared in the procedure body, outside any closure.
 *
 * @param name           variable name
 * @param type           declared type, possibly {@code var}
 * @param ordinal        source ordinal of the declarator
 * @param scopeEnd       last source ordinal inside the declaring scope
 * @param statementIndex index of the top-level body statement containing the declarator
 * @param topLevel       whether the declaring scope is the body itself
 * @param declarator     the source declarator
 */
public record LocalDeclaration(String name, Type type, int ordinal, int scopeEnd, int statementIndex,
                               boolean topLevel, VariableDeclarator declarator) {

    public boolean isVar() {
        return type.isVarType();
    }
}
