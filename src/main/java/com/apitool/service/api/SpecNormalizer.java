package com.apitool.service.api;

import com.apitool.model.ApiOperation;
import com.fasterxml.jackson.databind.JsonNode;

public interface SpecNormalizer {
    /**
     * Parses a tool's OpenAPI document and extracts its single operation.
     * <p>
     * Local references under {@code components} are followed one level deep; references that
     * cannot be followed are recorded on the returned operation rather than thrown.
     *
     * @param openapiSpecification The raw OpenAPI 3.x document.
     * @return The normalized operation.
     * @throws com.apitool.exception.InvalidSpecException if the document cannot be parsed or does not
     *         declare exactly one path, one method on that path and one non-root server.
     */
    ApiOperation normalize(JsonNode openapiSpecification);
}
