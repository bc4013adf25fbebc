package com.apitool.model;

import java.util.Locale;

/**
 * Where an operation parameter travels on the wire.
 */
public enum ParameterLocation {
    PATH,
    QUERY,
    HEADER,
    COOKIE;

    public static ParameterLocation from(String in) {
        if (in == null) {
            throw new IllegalArgumentException("Parameter location is missing");
        }
        return valueOf(in.trim().toUpperCase(Locale.ROOT));
    }
}
