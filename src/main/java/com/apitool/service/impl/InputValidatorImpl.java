package com.apitool.service.impl;

import com.apitool.model.execution.DerivedInputSchema;
import com.apitool.model.execution.ValidationIssue;
import com.apitool.model.execution.ValidationResult;
import com.apitool.service.api.InputValidator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Validates caller parameters with the networknt JSON Schema validator (draft 7).
 * Issue paths are expressed in the flat parameter namespace: {@code b} rather than {@code $.b}.
 */
@Service
@Slf4j
public class InputValidatorImpl implements InputValidator {

    private static final JsonSchemaFactory SCHEMA_FACTORY = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public ValidationResult validate(DerivedInputSchema schema, Map<String, Object> params) {
        Map<String, Object> input = params == null ? Map.of() : params;
        if (schema.hasNoProperties() && input.isEmpty()) {
            return ValidationResult.valid(input);
        }
        try {
            JsonSchema jsonSchema = SCHEMA_FACTORY.getSchema(schema.schema());
            JsonNode instance = objectMapper.valueToTree(input);
            Set<ValidationMessage> messages = jsonSchema.validate(instance);
            if (messages.isEmpty()) {
                return ValidationResult.valid(input);
            }
            List<ValidationIssue> issues = messages.stream()
                    .map(this::toIssue)
                    .sorted(Comparator.comparing(ValidationIssue::path).thenComparing(ValidationIssue::message))
                    .toList();
            log.debug("Input failed validation with {} issue(s): {}", issues.size(), issues);
            return ValidationResult.invalid(issues);
        } catch (RuntimeException e) {
            log.error("Schema validation could not run: {}", e.getMessage());
            return ValidationResult.processFailed("Schema validation process failed: " + e.getMessage());
        }
    }

    private ValidationIssue toIssue(ValidationMessage message) {
        String path = toParameterPath(message.getInstanceLocation() == null ? "$" : message.getInstanceLocation().toString());
        if ("required".equals(message.getType())) {
            String property = message.getProperty();
            if (property == null && message.getArguments() != null && message.getArguments().length > 0) {
                property = String.valueOf(message.getArguments()[0]);
            }
            if (property != null) {
                path = path.isEmpty() ? property : path + "/" + property;
            }
        }
        return new ValidationIssue(path.isEmpty() ? "/" : path, message.getMessage());
    }

    /**
     * Turns {@code $.a.b[0]} or {@code $['a b']} into {@code a/b/0} or {@code a b}.
     */
    static String toParameterPath(String instanceLocation) {
        String path = instanceLocation.startsWith("$") ? instanceLocation.substring(1) : instanceLocation;
        path = path.replaceAll("\\['([^']*)']", "/$1")
                .replaceAll("\\[(\\d+)]", "/$1")
                .replace('.', '/');
        return path.startsWith("/") ? path.substring(1) : path;
    }
}
