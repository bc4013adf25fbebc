package com.apitool.model.execution;

import com.apitool.exception.ErrorKind;
import com.apitool.exception.ToolEngineException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;

/**
 * The invocation ended with a classified error.
 *
 * @param details Structured detail: validation issues, the upstream body, or a list of problems.
 * @param hint    Guidance for the calling agent, may be {@code null}.
 */
public record Failed(ErrorKind kind, int statusCode, String error, JsonNode details, String hint)
        implements ExecutionOutcome {

    public static Failed from(ToolEngineException e) {
        JsonNode details;
        if (!e.getDetails().isEmpty()) {
            ArrayNode problems = JsonNodeFactory.instance.arrayNode();
            e.getDetails().forEach(problems::add);
            details = problems;
        } else {
            details = e.getCause() == null ? null : TextNode.valueOf(String.valueOf(e.getCause().getMessage()));
        }
        String hint = e.getKind().isConfigurationError()
                ? "The tool is misconfigured. Ask the tool administrator to fix its definition."
                : null;
        return new Failed(e.getKind(), e.getStatusCode(), e.getMessage(), details, hint);
    }

    @Override
    public ExecutionStage stage() {
        return ExecutionStage.FAILED;
    }
}
