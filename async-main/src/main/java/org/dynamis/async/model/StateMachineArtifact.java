package org.dynamis.async.model;

import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;

import java.util.List;
import java.util.Set;

/**
 * Everything emitted for one procedure. Nodes are detached; applying the artifact to a
 * compilation unit is the caller's job.
 *
 * @param procedure  the lowered procedure
 * @param stateField name of the state-index field
 * @param resultField name of the result-task field
 * @param dispatch   the dispatcher method
 * @param entry      replacement for the original method
 * @param fields     state, result and slot fields, in that order
 * @param slots      hoisted slots backing {@code fields}
 * @param segments   the segments the dispatcher switches over
 * @param imports    qualified names of runtime types the emitted code refers to
 */
public record StateMachineArtifact(AsyncProcedureDescriptor procedure, String stateField, String resultField,
                                   MethodDeclaration dispatch, MethodDeclaration entry, List<FieldDeclaration> fields,
                                   List<HoistedSlot> slots, List<Segment> segments, Set<String> imports) {

    public StateMachineArtifact {
        fields = List.copyOf(fields);
        slots = List.copyOf(slots);
        segments = List.copyOf(segments);
        imports = Set.copyOf(imports);
    }

    public int finalState() {
        return segments.size() - 1;
    }
}
