package com.apitool.model.security;

import com.apitool.model.CallerIdentity;
import java.util.Locale;

/**
 * Composite key of a stored secret.
 * <p>
 * Secrets belong to the calling organization and user and are namespaced by the tool's
 * utility provider, so two tools of the same provider share credentials.
 */
public record SecretKey(String scope, String userId, String organizationId, String providerTag, String secretTypeTag) {

    public static final String CLIENT_SCOPE = "client";

    public static SecretKey forClient(CallerIdentity caller, String providerTag, String secretTypeTag) {
        return new SecretKey(CLIENT_SCOPE, caller.userId(), caller.organizationId(), providerTag, secretTypeTag);
    }

    /**
     * @return a deterministic identifier such as {@code client:org-1:user-1:github:api_key}
     */
    public String toSecretId() {
        return String.join(":", part(scope), part(organizationId), part(userId), part(providerTag), part(secretTypeTag));
    }

    private static String part(String value) {
        if (value == null || value.isBlank()) {
            return "-";
        }
        return value.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s:]+", "_");
    }
}
