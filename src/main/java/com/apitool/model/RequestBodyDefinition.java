package com.apitool.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The first media type declared for an operation's request body.
 *
 * @param mediaType The declared content type, e.g. {@code application/json}.
 * @param schema    The body schema with its top-level properties resolved, or {@code null}.
 * @param required  Whether the document marks the body as required.
 */
public record RequestBodyDefinition(String mediaType, JsonNode schema, boolean required) {

    /**
     * Only object bodies with declared properties are merged into the flat parameter namespace.
     * Every other body receives the whole parameter object verbatim.
     */
    public boolean isObjectWithProperties() {
        return schema != null
                && "object".equals(schema.path("type").asText())
                && schema.path("properties").isObject()
                && !schema.path("properties").isEmpty();
    }
}
