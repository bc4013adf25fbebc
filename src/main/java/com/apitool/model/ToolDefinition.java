package com.apitool.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A registered tool: a third-party HTTP endpoint described by a single-operation OpenAPI document.
 * <p>
 * Only the secret-type tags needed by the chosen security scheme are stored here, never the
 * secrets themselves. Lombok's {@code @Data} annotation generates standard boilerplate code.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ToolDefinition {

    private String id;

    private String name;

    private String description;

    /**
     * Lowercase tag naming the API family. Secrets are looked up under this namespace.
     */
    private String utilityProvider;

    /**
     * The raw OpenAPI 3.x document. It must declare exactly one path, one method and one server.
     */
    private JsonNode openapiSpecification;

    /**
     * Name of the chosen scheme under {@code components.securitySchemes}, or {@code null}
     * when the tool is unauthenticated.
     */
    private String securityOption;

    private SecuritySecrets securitySecrets;

    @JsonProperty("isVerified")
    private boolean verified;

    private String creatorUserId;

    private String creatorOrganizationId;

    private Instant createdAt;

    private Instant updatedAt;
}
