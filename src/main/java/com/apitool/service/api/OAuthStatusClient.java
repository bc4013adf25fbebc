package com.apitool.service.api;

import com.apitool.model.CallerIdentity;
import com.apitool.model.security.OAuthStatus;
import java.util.List;

public interface OAuthStatusClient {
    /**
     * Asks the OAuth collaborator whether the caller has authorized the provider for the given scopes.
     *
     * @param caller   The invoking user and organization.
     * @param provider The OAuth provider, i.e. the tool's utility provider.
     * @param scopes   Every scope the tool may need.
     * @return An access token, or the URL where the user must authorize.
     */
    OAuthStatus checkAuth(CallerIdentity caller, String provider, List<String> scopes);
}
