package com.apitool.model.execution;

/**
 * States of one invocation. The last three are terminal.
 */
public enum ExecutionStage {
    VALIDATING,
    CHECKING_PREREQUISITES,
    INVOKING,
    SUCCEEDED,
    SETUP_NEEDED,
    FAILED
}
