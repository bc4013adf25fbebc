package com.apitool.service.api;

import com.apitool.model.ApiOperation;
import com.apitool.model.execution.OutboundRequest;
import com.apitool.model.security.CredentialResolution;
import java.util.Map;

public interface RequestBuilder {
    /**
     * Assembles the outbound request for one invocation.
     *
     * @param operation       The normalized operation.
     * @param validatedParams Parameters that passed validation.
     * @param credentials     The resolved credentials and the scheme that injects them.
     * @return The request, ready to send.
     * @throws com.apitool.exception.RequestBuildException if a path parameter is missing.
     */
    OutboundRequest build(ApiOperation operation, Map<String, Object> validatedParams, CredentialResolution.Ready credentials);
}
