package com.apitool.service.api;

import com.apitool.model.execution.DerivedInputSchema;
import com.apitool.model.execution.ValidationResult;
import java.util.Map;

public interface InputValidator {
    /**
     * Validates caller parameters against a derived schema.
     *
     * @param schema The schema to validate against.
     * @param params The raw parameter object; {@code null} is treated as empty.
     * @return The validated parameters, or one issue per violated constraint.
     */
    ValidationResult validate(DerivedInputSchema schema, Map<String, Object> params);
}
