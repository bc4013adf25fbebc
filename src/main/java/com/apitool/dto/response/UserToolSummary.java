package com.apitool.dto.response;

import com.apitool.model.UserToolStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * A tool a caller has linked, with the tool's descriptive fields and the caller's execution counts.
 *
 * @param succeededExecutions Executions that ended with a 2xx status.
 * @param failedExecutions    Executions that ended with a status of 400 or above.
 * @param createdAt           When the caller first used the tool.
 */
public record UserToolSummary(
        String toolId,
        String name,
        String description,
        String utilityProvider,
        String securityOption,
        @JsonProperty("isVerified") boolean verified,
        String creatorUserId,
        UserToolStatus status,
        long totalExecutions,
        long succeededExecutions,
        long failedExecutions,
        Instant createdAt,
        Instant updatedAt) {
}
