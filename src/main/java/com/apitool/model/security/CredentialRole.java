package com.apitool.model.security;

/**
 * The part a credential plays within its security scheme.
 */
public enum CredentialRole {
    SECRET(""),
    USERNAME("-username"),
    PASSWORD("-password"),
    ACCESS_TOKEN("-oauth");

    private final String suffix;

    CredentialRole(String suffix) {
        this.suffix = suffix;
    }

    String suffix() {
        return suffix;
    }
}
