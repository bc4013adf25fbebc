package com.apitool.model;

import com.apitool.model.openapi.RefResolution;
import io.swagger.v3.oas.models.security.SecurityScheme;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;

/**
 * The single operation of a tool's OpenAPI document, normalized for schema derivation,
 * credential resolution and request building.
 * <p>
 * Instances are derived on every invocation and never persisted. Lombok's {@code @Data}
 * annotation generates standard boilerplate code.
 */
@Data
public class ApiOperation {

    /**
     * The {@code operationId} of the document, or one generated from the method and path.
     */
    private String operationId;

    /**
     * Upper-case HTTP method, e.g. "GET" or "POST".
     */
    private String httpMethod;

    /**
     * The path key of the document, which may contain placeholders such as {@code /items/{itemId}}.
     */
    private String pathTemplate;

    private String summary;

    /**
     * {@code info.title} of the document, used in setup prompts.
     */
    private String title;

    /**
     * URL of the single server entry, possibly containing {@code {variable}} placeholders.
     */
    private String serverUrl;

    private Map<String, ServerVariableDefinition> serverVariables = new LinkedHashMap<>();

    /**
     * Path-item and operation parameters, operation-level entries overriding path-level ones.
     */
    private List<ApiParameter> parameters = new ArrayList<>();

    private RequestBodyDefinition requestBody;

    /**
     * Declared {@code components.securitySchemes}, kept raw so that the credential resolver
     * can reject {@code $ref} entries itself.
     */
    private Map<String, SecurityScheme> securitySchemes = new LinkedHashMap<>();

    /**
     * Every reference the normalizer could not follow. A non-empty list makes schema derivation fail.
     */
    private List<RefResolution.Unresolved<?>> unresolvedRefs = new ArrayList<>();
}
