package org.dynamis.async.model;

import com.github.javaparser.ast.type.Type;

/**
 * A local that stays a local but is referenced in a segment after the one declaring it,
 * so that segment needs its own declaration.
 */
public record TransientLocal(String name, Type type) {
}
