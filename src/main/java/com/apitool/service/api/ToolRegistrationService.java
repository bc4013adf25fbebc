package com.apitool.service.api;

import com.apitool.dto.request.RegisterToolRequest;
import com.apitool.model.CallerIdentity;
import com.apitool.model.ToolDefinition;

public interface ToolRegistrationService {
    /**
     * Checks a submitted tool definition and persists it under a new id.
     *
     * @param request The submitted definition.
     * @param creator The user and organization registering the tool.
     * @return The persisted tool.
     * @throws com.apitool.exception.InvalidToolDefinitionException listing every problem found.
     */
    ToolDefinition register(RegisterToolRequest request, CallerIdentity creator);
}
