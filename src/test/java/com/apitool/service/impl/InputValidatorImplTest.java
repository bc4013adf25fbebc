package com.apitool.service.impl;

import com.apitool.model.execution.DerivedInputSchema;
import com.apitool.model.execution.ValidationIssue;
import com.apitool.model.execution.ValidationResult;
import com.apitool.support.TestSpecs;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InputValidatorImplTest {

    private InputValidatorImpl inputValidator;
    private DerivedInputSchema recordSchema;

    @BeforeEach
    void setUp() {
        inputValidator = new InputValidatorImpl();
        // One required query parameter "a" (string) and one optional body property "b" (number).
        recordSchema = new SchemaDeriverImpl().derive(new SpecNormalizerImpl().normalize(TestSpecs.load(TestSpecs.CREATE_RECORD)));
    }

    @Test
    void validate_withRequiredParameter_shouldReturnTheParams() {
        Map<String, Object> input = Map.of("a", "x");

        ValidationResult result = inputValidator.validate(recordSchema, input);

        assertThat(result.isValid()).isTrue();
        assertThat(result.validatedParams()).isEqualTo(Map.of("a", "x"));
        assertThat(result.issues()).isEmpty();
    }

    @Test
    void validate_withMissingRequiredParameter_shouldReportExactlyOneIssueAtItsName() {
        ValidationResult result = inputValidator.validate(recordSchema, Map.of());

        assertThat(result.isValid()).isFalse();
        assertThat(result.issues()).extracting(ValidationIssue::path).containsExactly("a");
    }

    @Test
    void validate_withWrongBodyPropertyType_shouldReportExactlyOneIssueAtItsName() {
        Map<String, Object> input = Map.of("a", "x", "b", "not-a-number");

        ValidationResult result = inputValidator.validate(recordSchema, input);

        assertThat(result.isValid()).isFalse();
        assertThat(result.issues()).hasSize(1);
        assertThat(result.issues().get(0).path()).isEqualTo("b");
        assertThat(result.issues().get(0).message()).isNotBlank();
    }

    @Test
    void validate_withEmptySchemaAndNoInput_shouldAcceptWithoutValidating() {
        ObjectNode empty = JsonNodeFactory.instance.objectNode();
        empty.put("type", "object");
        empty.putObject("properties");

        ValidationResult result = inputValidator.validate(DerivedInputSchema.of(empty), null);

        assertThat(result.isValid()).isTrue();
        assertThat(result.validatedParams()).isEmpty();
    }

    @Test
    void validate_withWrongPathParameterType_shouldReportIt() {
        DerivedInputSchema itemsSchema = new SchemaDeriverImpl().derive(new SpecNormalizerImpl().normalize(TestSpecs.load(TestSpecs.ITEMS_API)));

        ValidationResult result = inputValidator.validate(itemsSchema, Map.of("itemId", "abc"));

        assertThat(result.issues()).extracting(ValidationIssue::path).containsExactly("itemId");
    }

    @Test
    void toParameterPath_shouldUseTheFlatNamespace() {
        assertThat(InputValidatorImpl.toParameterPath("$.b")).isEqualTo("b");
        assertThat(InputValidatorImpl.toParameterPath("$.a.b[0]")).isEqualTo("a/b/0");
        assertThat(InputValidatorImpl.toParameterPath("$['X-Request Id']")).isEqualTo("X-Request Id");
        assertThat(InputValidatorImpl.toParameterPath("$")).isEmpty();
    }
}
