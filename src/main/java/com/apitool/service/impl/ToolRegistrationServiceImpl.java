package com.apitool.service.impl;

import com.apitool.dto.request.RegisterToolRequest;
import com.apitool.exception.DuplicateToolException;
import com.apitool.exception.InvalidToolDefinitionException;
import com.apitool.exception.ToolEngineException;
import com.apitool.model.ApiOperation;
import com.apitool.model.CallerIdentity;
import com.apitool.model.SecretType;
import com.apitool.model.SecuritySecrets;
import com.apitool.model.ToolDefinition;
import com.apitool.model.security.BasicScheme;
import com.apitool.model.security.CredentialScheme;
import com.apitool.service.api.SpecNormalizer;
import com.apitool.service.api.ToolRegistrationService;
import com.apitool.service.api.ToolStateService;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.models.security.SecurityScheme;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Checks submitted tool definitions and persists the valid ones.
 * <p>
 * Every problem is collected before anything is rejected, so the author sees the full list at once.
 * A valid definition is still refused when a tool with the same name and provider exists.
 */
@Service
@Slf4j
public class ToolRegistrationServiceImpl implements ToolRegistrationService {

    private final SpecNormalizer specNormalizer;
    private final ToolStateService toolStateService;

    public ToolRegistrationServiceImpl(SpecNormalizer specNormalizer, ToolStateService toolStateService) {
        this.specNormalizer = specNormalizer;
        this.toolStateService = toolStateService;
    }

    @Override
    public ToolDefinition register(RegisterToolRequest request, CallerIdentity creator) {
        List<String> problems = new ArrayList<>();
        requireText(request.name(), "name", problems);
        requireText(request.description(), "description", problems);
        requireText(request.utilityProvider(), "utilityProvider", problems);

        SecuritySecrets secrets = request.securitySecrets() == null
                ? SecuritySecrets.none()
                : request.securitySecrets().normalized();
        checkSecretTag(secrets.name(), "name", problems);
        checkSecretTag(secrets.username(), "username", problems);
        checkSecretTag(secrets.password(), "password", problems);

        String provider = isBlank(request.utilityProvider()) ? null : request.utilityProvider().trim().toLowerCase(Locale.ROOT);
        ApiOperation operation = checkDocument(request.openapiSpecification(), problems);
        String securityOption = isBlank(request.securityOption()) ? null : request.securityOption().trim();
        if (operation != null && securityOption != null) {
            checkSecurity(operation, securityOption, secrets, provider, problems);
        }

        if (!problems.isEmpty()) {
            log.warn("Rejected tool definition '{}': {}", request.name(), problems);
            throw new InvalidToolDefinitionException(problems);
        }
        rejectDuplicate(request.name().trim(), provider);

        Instant now = Instant.now();
        ToolDefinition tool = ToolDefinition.builder()
                .id(UUID.randomUUID().toString())
                .name(request.name().trim())
                .description(request.description().trim())
                .utilityProvider(provider)
                .openapiSpecification(request.openapiSpecification())
                .securityOption(securityOption)
                .securitySecrets(secrets.isEmpty() ? null : secrets)
                .verified(false)
                .creatorUserId(creator.userId())
                .creatorOrganizationId(creator.organizationId())
                .createdAt(now)
                .updatedAt(now)
                .build();
        log.info("Registering tool '{}' for provider '{}'", tool.getName(), provider);
        return toolStateService.saveTool(tool);
    }

    private void rejectDuplicate(String name, String provider) {
        toolStateService.listTools().stream()
                .filter(existing -> name.equalsIgnoreCase(existing.getName()) && provider.equals(existing.getUtilityProvider()))
                .findFirst()
                .ifPresent(existing -> {
                    log.warn("Rejected tool definition '{}': provider '{}' already has tool {}", name, provider, existing.getId());
                    throw new DuplicateToolException(name, provider, existing.getId());
                });
    }

    private ApiOperation checkDocument(JsonNode document, List<String> problems) {
        if (document == null || !document.isObject()) {
            problems.add("openapiSpecification must be a JSON object.");
            return null;
        }
        if (!document.path("openapi").asText("").startsWith("3.")) {
            problems.add("openapiSpecification must be an OpenAPI 3.x document.");
        }
        if (isBlank(document.path("info").path("title").asText(null))) {
            problems.add("openapiSpecification.info.title is required.");
        }
        if (isBlank(document.path("info").path("version").asText(null))) {
            problems.add("openapiSpecification.info.version is required.");
        }
        try {
            return specNormalizer.normalize(document);
        } catch (ToolEngineException e) {
            if (e.getDetails().isEmpty()) {
                problems.add(e.getMessage());
            } else {
                problems.addAll(e.getDetails());
            }
            return null;
        }
    }

    private void checkSecurity(ApiOperation operation, String securityOption, SecuritySecrets secrets,
                               String provider, List<String> problems) {
        SecurityScheme declared = operation.getSecuritySchemes().get(securityOption);
        if (declared == null) {
            problems.add("securityOption '" + securityOption + "' is not declared under components.securitySchemes.");
            return;
        }
        if (declared.get$ref() != null) {
            problems.add("securityOption '" + securityOption + "' must not be a $ref.");
            return;
        }
        try {
            CredentialScheme scheme = CredentialScheme.of(securityOption, declared, secrets, provider);
            if (scheme instanceof BasicScheme && secrets.name() != null) {
                problems.add("securitySecrets.name must not be set for basic authentication; use username and password.");
            }
        } catch (ToolEngineException e) {
            problems.add(e.getMessage());
        }
    }

    private static void checkSecretTag(String tag, String role, List<String> problems) {
        if (tag != null && SecretType.fromTag(tag).isEmpty()) {
            problems.add("securitySecrets." + role + " '" + tag + "' is not a known secret type. Expected one of: "
                    + String.join(", ", SecretType.tags()) + ".");
        }
    }

    private static void requireText(String value, String field, List<String> problems) {
        if (isBlank(value)) {
            problems.add(field + " is required.");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
