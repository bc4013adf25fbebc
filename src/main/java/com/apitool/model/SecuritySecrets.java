package com.apitool.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Locale;

/**
 * Maps each credential role of a security scheme to the secret-type tag that fills it.
 *
 * @param name     Tag for the single secret of an apiKey or bearer scheme.
 * @param username Tag for the username of a basic scheme.
 * @param password Tag for the password of a basic scheme; absent means "no password".
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SecuritySecrets(
        @JsonAlias("x-secret-name") String name,
        @JsonAlias("x-secret-username") String username,
        @JsonAlias("x-secret-password") String password) {

    public static SecuritySecrets none() {
        return new SecuritySecrets(null, null, null);
    }

    public boolean isEmpty() {
        return isBlank(name) && isBlank(username) && isBlank(password);
    }

    /**
     * @return a copy with every tag trimmed and lowercased, blank tags dropped.
     */
    public SecuritySecrets normalized() {
        return new SecuritySecrets(normalize(name), normalize(username), normalize(password));
    }

    private static String normalize(String tag) {
        return isBlank(tag) ? null : tag.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
