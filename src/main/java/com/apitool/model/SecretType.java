package com.apitool.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The closed vocabulary of secret-type tags a tool definition may reference.
 */
public enum SecretType {

    API_KEY("api key"),
    API_SECRET_KEY("api secret key"),
    ACCESS_TOKEN("access token"),
    BEARER_TOKEN("bearer token"),
    USERNAME("username"),
    PASSWORD("password"),
    CLIENT_ID("client id"),
    CLIENT_SECRET("client secret"),
    WEBHOOK_SECRET("webhook secret");

    private final String tag;

    SecretType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static Optional<SecretType> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(t -> t.tag.equals(normalized)).findFirst();
    }

    public static List<String> tags() {
        return Arrays.stream(values()).map(SecretType::tag).toList();
    }
}
