package org.dynamis.async.model;

import com.github.javaparser.ast.type.Type;

import java.util.Objects;

/**
 * A per-instance field standing in for a parameter, a local, or an awaited task.
 *
 * @param originalName   source name, or {@code await#k} for awaiter slots
 * @param storageName    generated field name
 * @param type           field type
 * @param origin         what the slot replaces
 * @param scopeStart     index of the first top-level body statement in which references to
 *                       {@code originalName} mean this slot
 */
public record HoistedSlot(String originalName, String storageName, Type type, SlotOrigin origin, int scopeStart) {

    public HoistedSlot {
        Objects.requireNonNull(originalName, "originalName");
        Objects.requireNonNull(storageName, "storageName");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(origin, "origin");
    }

    public boolean renames(String name, int statementIndex) {
        return origin != SlotOrigin.AWAITED && originalName.equals(name) && statementIndex >= scopeStart;
    }
}
