package com.apitool.model.execution;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The upstream API answered with a 2xx status.
 *
 * @param body The response body as JSON, or a text node when the body was not JSON.
 */
public record Succeeded(int statusCode, JsonNode body) implements ExecutionOutcome {

    @Override
    public ExecutionStage stage() {
        return ExecutionStage.SUCCEEDED;
    }
}
