package org.dynamis.async.bind;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.type.Type;

import java.util.List;
import java.util.Optional;

/**
 * A static type as the binder sees it.
 *
 * @param qualifiedName erased qualified name, or the keyword for primitives
 * @param typeArguments bound type arguments, empty for raw and non-generic types
 * @param description   source form with fully qualified names, e.g. {@code java.util.List<java.lang.String>}
 * @param denotable     whether the type can be written down as a field type
 */
public record BoundType(String qualifiedName, List<BoundType> typeArguments, String description, boolean denotable) {

    public BoundType {
        typeArguments = List.copyOf(typeArguments);
    }

    public boolean is(String name) {
        return qualifiedName.equals(name);
    }

    public Optional<BoundType> typeArgument(int index) {
        return index < typeArguments.size() ? Optional.of(typeArguments.get(index)) : Optional.empty();
    }

    public Type toAstType() {
        return StaticJavaParser.parseType(description);
    }
}
