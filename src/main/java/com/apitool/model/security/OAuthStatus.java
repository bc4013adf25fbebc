package com.apitool.model.security;

/**
 * Answer of the OAuth status collaborator: either an access token or the URL where the user
 * must authorize.
 */
public record OAuthStatus(boolean hasAuth, String accessToken, String authUrl) {

    public static OAuthStatus authorized(String accessToken) {
        return new OAuthStatus(true, accessToken, null);
    }

    public static OAuthStatus needsAuth(String authUrl) {
        return new OAuthStatus(false, null, authUrl);
    }
}
