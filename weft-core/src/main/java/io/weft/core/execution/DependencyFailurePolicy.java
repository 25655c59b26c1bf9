package io.weft.core.execution;

/// What the engine does with a step whose dependency did not succeed in the same run.
public enum DependencyFailurePolicy {
    /// Do not run the step; report it as failed and skipped.
    SKIP_DEPENDENTS,
    /// Run the step anyway.
    EXECUTE_ANYWAY
}
