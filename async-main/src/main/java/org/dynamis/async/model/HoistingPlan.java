package org.dynamis.async.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of liveness analysis: the slots to emit and, per segment index, the transient locals to
 * re-declare at the top of that segment.
 */
public record HoistingPlan(List<HoistedSlot> slots, Map<Integer, List<TransientLocal>> redeclarations) {

    public HoistingPlan {
        slots = List.copyOf(slots);
        redeclarations = Map.copyOf(redeclarations);
    }

    public List<TransientLocal> redeclarationsFor(int segmentIndex) {
        return redeclarations.getOrDefault(segmentIndex, List.of());
    }

    public Optional<HoistedSlot> slotFor(String name, int statementIndex) {
        return slots.stream().filter(slot -> slot.renames(name, statementIndex)).findFirst();
    }

    public Optional<HoistedSlot> awaiterFor(int pointIndex) {
        String name = "await#" + pointIndex;
        return slots.stream()
                .filter(slot -> slot.origin() == SlotOrigin.AWAITED && slot.originalName().equals(name))
                .findFirst();
    }
}
