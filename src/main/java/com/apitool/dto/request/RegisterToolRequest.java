package com.apitool.dto.request;

import com.apitool.model.SecuritySecrets;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A tool definition as submitted by its author, before validation and id assignment.
 */
public record RegisterToolRequest(
        String name,
        String description,
        String utilityProvider,
        JsonNode openapiSpecification,
        String securityOption,
        SecuritySecrets securitySecrets) {
}
