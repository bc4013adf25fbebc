package com.apitool.service.api;

import com.apitool.model.CallerIdentity;
import com.apitool.model.execution.ExecutionOutcome;
import java.util.Map;

/**
 * Runs a registered tool end to end and audits the outcome.
 */
public interface ToolExecutionService {

    /**
     * Validates the parameters, resolves credentials, calls the upstream API and records exactly one
     * execution record for every terminal state except an unknown tool.
     *
     * @param toolId         The id of the registered tool.
     * @param caller         The invoking user and organization.
     * @param conversationId Optional conversation the call belongs to.
     * @param params         The raw parameter object.
     * @return The terminal outcome. Never throws for pipeline failures.
     */
    ExecutionOutcome execute(String toolId, CallerIdentity caller, String conversationId, Map<String, Object> params);
}
