package com.apitool.dto.request;

/**
 * A record representing a request to store a secret for a caller.
 *
 * @param providerTag   The utility provider the secret belongs to (e.g., "github").
 * @param secretType    The secret-type tag (e.g., "api key").
 * @param value         The secret itself. It is never logged.
 * @param userId        The owning user.
 * @param organizationId The owning organization.
 */
public record SetSecretRequest(String providerTag, String secretType, String value, String userId, String organizationId) {

    @Override
    public String toString() {
        return "SetSecretRequest[providerTag=" + providerTag + ", secretType=" + secretType
                + ", userId=" + userId + ", organizationId=" + organizationId + "]";
    }
}
