package com.apitool.dto.request;

import java.util.List;

/**
 * Body of the OAuth status check sent to the gateway.
 */
public record OAuthCheckRequest(String userId, String organizationId, String oauthProvider, List<String> requiredScopes) {
}
