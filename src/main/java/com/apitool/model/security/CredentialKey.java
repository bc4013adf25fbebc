package com.apitool.model.security;

/**
 * Identifies one credential slot of a security scheme. Keys are compared structurally.
 */
public record CredentialKey(String schemeName, CredentialRole role) {

    @Override
    public String toString() {
        return schemeName + role.suffix();
    }
}
