package com.apitool.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum UserToolStatus {
    UNSET,
    ACTIVE,
    DELETED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
