package org.dynamis.async;

import com.github.javaparser.ast.CompilationUnit;
import org.dynamis.async.model.StateMachineArtifact;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of lowering one compilation unit. Procedures that failed are left as they were in
 * {@link #unit()}; everything else has been replaced by its state machine.
 */
public final class LoweringResult {

    /**
     * A procedure that could not be lowered.
     */
    public record ProcedureFailure(String owner, String procedure, AsyncLoweringException cause) {
    }

    private final CompilationUnit unit;
    private final List<StateMachineArtifact> artifacts;
    private final List<ProcedureFailure> failures;

    LoweringResult(CompilationUnit unit, List<StateMachineArtifact> artifacts, List<ProcedureFailure> failures) {
        this.unit = unit;
        this.artifacts = List.copyOf(artifacts);
        this.failures = List.copyOf(failures);
    }

    public CompilationUnit unit() {
        return unit;
    }

    public List<StateMachineArtifact> artifacts() {
        return artifacts;
    }

    public List<ProcedureFailure> failures() {
        return failures;
    }

    public boolean isSuccessful() {
        return failures.isEmpty();
    }

    public Optional<StateMachineArtifact> artifact(String procedure) {
        return artifacts.stream().filter(a -> a.procedure().name().equals(procedure)).findFirst();
    }

    public Optional<ProcedureFailure> failure(String procedure) {
        return failures.stream().filter(f -> f.procedure().equals(procedure)).findFirst();
    }

    /**
     * The lowered unit as Java source.
     */
    public String source() {
        return ArtifactPrinter.print(unit);
    }
}
