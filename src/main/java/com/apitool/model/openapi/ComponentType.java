package com.apitool.model.openapi;

/**
 * The {@code components} namespaces a tool document may reference.
 */
public enum ComponentType {
    PARAMETERS("parameters"),
    REQUEST_BODIES("requestBodies"),
    SCHEMAS("schemas"),
    SECURITY_SCHEMES("securitySchemes");

    private final String prefix;

    ComponentType(String section) {
        this.prefix = "#/components/" + section + "/";
    }

    public String prefix() {
        return prefix;
    }
}
