package com.apitool.model.execution;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * The flat object schema describing every input a tool accepts.
 *
 * @param schema  Always present, so that it can be shown even when derivation failed.
 * @param failure Why derivation failed, or {@code null} on success.
 */
public record DerivedInputSchema(ObjectNode schema, String failure) {

    public static DerivedInputSchema of(ObjectNode schema) {
        return new DerivedInputSchema(schema, null);
    }

    /**
     * An object schema with no properties, annotated with the reason in its {@code description}.
     */
    public static DerivedInputSchema degraded(String reason) {
        ObjectNode schema = JsonNodeFactory.instance.objectNode();
        schema.put("type", "object");
        schema.putObject("properties");
        schema.put("description", reason);
        return new DerivedInputSchema(schema, reason);
    }

    public boolean isDegraded() {
        return failure != null;
    }

    public boolean hasNoProperties() {
        return schema.path("properties").isEmpty();
    }
}
