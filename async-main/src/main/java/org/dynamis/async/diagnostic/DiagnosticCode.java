package org.dynamis.async.diagnostic;

/**
 * Stable diagnostic identifiers with their default remediation hints.
 */
public enum DiagnosticCode {

    MISSING_BODY("ASYNC001", "Give the procedure a block body; there is no statement list to split."),
    SUSPENSION_IN_CLOSURE("ASYNC002", "Extract the suspending closure into a named async procedure and await that."),
    LABELED_JUMP("ASYNC003", "Replace the labeled jump with structured control flow or a flag variable."),
    GENERATOR_YIELD("ASYNC004", "Split the generator part and the suspending part into separate procedures."),
    NESTED_SUSPENSION("ASYNC005", "Move the await to a top-level statement of the procedure body, e.g. by extracting the loop body into its own async procedure."),
    EMBEDDED_SUSPENSION("ASYNC006", "Assign the awaited value to a local in its own statement, then use the local."),
    STATIC_PROCEDURE("ASYNC007", "Make the procedure an instance method; its state lives in per-instance fields."),
    NOT_A_BEHAVIOUR("ASYNC008", "Let the declaring class extend org.dynamis.async.runtime.AsyncBehaviour."),
    NAME_COLLISION("ASYNC009", "Rename the clashing member or configure a different generated-name prefix."),
    CLASSIFICATION("ASYNC010", "Await one of the Task primitives or an expression of type Task."),
    STORAGE_TYPE("ASYNC011", "Declare the variable with an explicit, named type."),
    NOT_A_TASK("ASYNC012", "Declare the procedure to return org.dynamis.async.runtime.Task<T>, or remove @AsyncProcedure."),
    SYNCHRONIZED_PROCEDURE("ASYNC100", "Remove the synchronized modifier."),
    LOWERED("ASYNC101", null);

    private final String id;
    private final String hint;

    DiagnosticCode(String id, String hint) {
        this.id = id;
        this.hint = hint;
    }

    public String id() {
        return id;
    }

    public String hint() {
        return hint;
    }
}
