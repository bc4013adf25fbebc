package com.apitool.model.execution;

/**
 * Terminal result of a tool invocation. Built once per pipeline branch and never mutated.
 */
public sealed interface ExecutionOutcome permits Succeeded, SetupNeeded, Failed {

    ExecutionStage stage();

    /**
     * @return the HTTP-equivalent status stored on the audit record
     */
    int statusCode();
}
