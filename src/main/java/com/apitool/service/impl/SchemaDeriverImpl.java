package com.apitool.service.impl;

import com.apitool.model.ApiOperation;
import com.apitool.model.ApiParameter;
import com.apitool.model.ParameterLocation;
import com.apitool.model.RequestBodyDefinition;
import com.apitool.model.ServerVariableDefinition;
import com.apitool.model.execution.DerivedInputSchema;
import com.apitool.service.api.SchemaDeriver;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Builds the flat input schema of a tool.
 * <p>
 * Properties come from server variables (always optional), path, query and header parameters,
 * and, when the request body is an object with declared properties, from those body properties.
 * Names are a single namespace: the first definition of a name wins and later ones are logged.
 */
@Service
@Slf4j
public class SchemaDeriverImpl implements SchemaDeriver {

    @Override
    public DerivedInputSchema derive(ApiOperation operation) {
        if (!operation.getUnresolvedRefs().isEmpty()) {
            String refs = operation.getUnresolvedRefs().stream().map(Object::toString).collect(Collectors.joining(", "));
            return DerivedInputSchema.degraded("Schema derivation failed: unresolved references " + refs);
        }
        try {
            ObjectNode schema = JsonNodeFactory.instance.objectNode();
            schema.put("type", "object");
            ObjectNode properties = schema.putObject("properties");
            ArrayNode required = schema.putArray("required");
            Set<String> requiredNames = new HashSet<>();

            operation.getServerVariables().forEach((name, variable) ->
                    addProperty(properties, required, requiredNames, name, serverVariableSchema(variable), false, "server variable"));

            for (ApiParameter parameter : operation.getParameters()) {
                if (parameter.getIn() == ParameterLocation.COOKIE) {
                    log.debug("Cookie parameter '{}' is not part of the input schema.", parameter.getName());
                    continue;
                }
                addProperty(properties, required, requiredNames, parameter.getName(),
                        parameterSchema(parameter), parameter.isRequired(), parameter.getIn().name().toLowerCase() + " parameter");
            }

            RequestBodyDefinition body = operation.getRequestBody();
            if (body != null && body.isObjectWithProperties()) {
                Set<String> bodyRequired = new HashSet<>();
                body.schema().path("required").forEach(name -> bodyRequired.add(name.asText()));
                for (Map.Entry<String, JsonNode> property : body.schema().path("properties").properties()) {
                    addProperty(properties, required, requiredNames, property.getKey(), property.getValue().deepCopy(),
                            bodyRequired.contains(property.getKey()), "body property");
                }
            }

            return DerivedInputSchema.of(schema);
        } catch (RuntimeException e) {
            log.warn("Schema derivation for {} failed: {}", operation.getOperationId(), e.getMessage());
            return DerivedInputSchema.degraded("Schema derivation failed: " + e.getMessage());
        }
    }

    private void addProperty(ObjectNode properties, ArrayNode required, Set<String> requiredNames,
                             String name, JsonNode propertySchema, boolean isRequired, String source) {
        if (properties.has(name)) {
            log.warn("Input name '{}' from {} collides with an earlier definition; keeping the first one.", name, source);
            return;
        }
        properties.set(name, propertySchema);
        if (isRequired && requiredNames.add(name)) {
            required.add(name);
        }
    }

    private JsonNode parameterSchema(ApiParameter parameter) {
        ObjectNode schema = parameter.getSchema() != null && parameter.getSchema().isObject()
                ? ((ObjectNode) parameter.getSchema()).deepCopy()
                : JsonNodeFactory.instance.objectNode();
        if (parameter.getDescription() != null && !schema.has("description")) {
            schema.put("description", parameter.getDescription());
        }
        return schema;
    }

    private JsonNode serverVariableSchema(ServerVariableDefinition variable) {
        ObjectNode schema = JsonNodeFactory.instance.objectNode();
        schema.put("type", "string");
        if (variable.defaultValue() != null) {
            schema.put("default", variable.defaultValue());
        }
        if (variable.enumValues() != null && !variable.enumValues().isEmpty()) {
            ArrayNode values = schema.putArray("enum");
            variable.enumValues().forEach(values::add);
        }
        if (variable.description() != null) {
            schema.put("description", variable.description());
        }
        return schema;
    }
}
