package com.apitool.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single resolved parameter of an {@link ApiOperation}.
 * <p>
 * Lombok's {@code @Data} annotation generates standard boilerplate code.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ApiParameter {

    private String name;

    /**
     * The location of the parameter: path, query, header or cookie.
     */
    private ParameterLocation in;

    /**
     * Path parameters are always required, whatever the document says.
     */
    private boolean required;

    private String description;

    /**
     * The JSON Schema of the parameter value, already free of {@code $ref} at the top level.
     */
    private JsonNode schema;
}
