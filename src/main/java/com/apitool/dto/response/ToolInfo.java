package com.apitool.dto.response;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A tool together with the input schema an agent should fill in.
 *
 * @param schema The derived input schema; annotated and empty when the tool document is invalid.
 */
public record ToolInfo(String id, String name, String description, String utilityProvider, ObjectNode schema) {
}
