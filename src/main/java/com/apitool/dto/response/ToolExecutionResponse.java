package com.apitool.dto.response;

import com.apitool.model.execution.ExecutionOutcome;
import com.apitool.model.execution.Failed;
import com.apitool.model.execution.SetupNeeded;
import com.apitool.model.execution.Succeeded;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * The caller-facing envelope of an invocation. Its three shapes are stable:
 * <ul>
 *     <li>success: {@code {success: true, data: <upstream body>}}</li>
 *     <li>setup needed: {@code {success: true, data: {needsSetup: true, ...}, hint}}</li>
 *     <li>error: {@code {success: false, error, details, hint}}</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolExecutionResponse(boolean success, JsonNode data, String error, JsonNode details, String hint) {

    static final String SETUP_HINT = "Present the required inputs to the user. Once they confirm the setup is done, call the tool again.";

    public static ToolExecutionResponse from(ExecutionOutcome outcome, ObjectMapper objectMapper) {
        if (outcome instanceof Succeeded succeeded) {
            return new ToolExecutionResponse(true, succeeded.body(), null, null, null);
        }
        if (outcome instanceof SetupNeeded setupNeeded) {
            return new ToolExecutionResponse(true, objectMapper.valueToTree(setupNeeded), null, null, SETUP_HINT);
        }
        Failed failed = (Failed) outcome;
        return new ToolExecutionResponse(false, null, failed.error(), failed.details(), failed.hint());
    }
}
