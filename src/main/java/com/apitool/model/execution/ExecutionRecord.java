package com.apitool.model.execution;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Immutable audit row written once for every terminal state of an invocation.
 */
@Value
@Builder
@Jacksonized
public class ExecutionRecord {

    String id;
    String toolId;
    String userId;
    String organizationId;
    String conversationId;

    /**
     * The parameters the pipeline ran with, after validation when it got that far.
     */
    JsonNode input;

    /**
     * The caller-facing envelope returned for this invocation.
     */
    JsonNode output;

    int statusCode;
    String error;
    String errorDetails;
    String hint;
    Instant createdAt;
    Instant updatedAt;
}
