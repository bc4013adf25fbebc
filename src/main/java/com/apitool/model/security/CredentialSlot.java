package com.apitool.model.security;

/**
 * A credential the secret store must supply, and the secret-type tag it is stored under.
 */
public record CredentialSlot(CredentialKey key, String secretTypeTag) {
}
