package com.apitool.model;

import java.util.List;

/**
 * A {@code {variable}} declared on the tool's single server entry.
 */
public record ServerVariableDefinition(String defaultValue, List<String> enumValues, String description) {
}
