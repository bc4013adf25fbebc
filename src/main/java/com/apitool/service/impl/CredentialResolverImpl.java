package com.apitool.service.impl;

import com.apitool.exception.MisconfiguredToolException;
import com.apitool.model.ApiOperation;
import com.apitool.model.CallerIdentity;
import com.apitool.model.ToolDefinition;
import com.apitool.model.execution.SetupNeeded;
import com.apitool.model.security.CredentialKey;
import com.apitool.model.security.CredentialResolution;
import com.apitool.model.security.CredentialScheme;
import com.apitool.model.security.CredentialSlot;
import com.apitool.model.security.OAuth2Scheme;
import com.apitool.model.security.OAuthStatus;
import com.apitool.model.security.ResolvedCredentials;
import com.apitool.model.security.SecretKey;
import com.apitool.service.api.CredentialResolver;
import com.apitool.service.api.OAuthStatusClient;
import com.apitool.service.api.SecretStore;
import io.swagger.v3.oas.models.security.SecurityScheme;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Resolves a tool's credentials from the secret store or the OAuth collaborator.
 * <p>
 * Every invocation resolves from scratch; nothing is cached. Secret values are never logged,
 * only their composite key ids.
 */
@Service
@Slf4j
public class CredentialResolverImpl implements CredentialResolver {

    private final SecretStore secretStore;
    private final OAuthStatusClient oAuthStatusClient;

    public CredentialResolverImpl(SecretStore secretStore, OAuthStatusClient oAuthStatusClient) {
        this.secretStore = secretStore;
        this.oAuthStatusClient = oAuthStatusClient;
    }

    /**
     * Resolves the credentials of the tool's chosen security scheme for one caller.
     * <p>
     * A scheme whose secret tags are incomplete asks the caller to contact an administrator.
     * OAuth2 schemes are checked with the OAuth collaborator; other schemes read one secret per slot.
     *
     * @param tool      The tool being invoked.
     * @param operation The tool's normalized operation.
     * @param caller    The user and organization whose secrets are read.
     * @return A ready resolution, or a setup request listing the missing secret types.
     * @throws com.apitool.exception.MisconfiguredToolException if the security option is undeclared or a $ref.
     */
    @Override
    public CredentialResolution resolve(ToolDefinition tool, ApiOperation operation, CallerIdentity caller) {
        String option = tool.getSecurityOption();
        if (option == null || option.isBlank()) {
            log.debug("Tool {} declares no security option, no credentials needed.", tool.getId());
            return CredentialResolution.notRequired();
        }

        SecurityScheme declared = operation.getSecuritySchemes().get(option);
        if (declared == null) {
            throw new MisconfiguredToolException(
                    "Security option '" + option + "' is not declared under components.securitySchemes.");
        }
        if (declared.get$ref() != null) {
            throw new MisconfiguredToolException(
                    "Security option '" + option + "' is a reference (" + declared.get$ref() + "), which is not supported.");
        }

        CredentialScheme scheme;
        try {
            scheme = CredentialScheme.of(option, declared, tool.getSecuritySecrets(), tool.getUtilityProvider());
        } catch (MisconfiguredToolException e) {
            log.error("Tool {} has an incomplete security configuration: {}", tool.getId(), e.getMessage());
            return new CredentialResolution.SetupRequired(contactAdministrator(tool, operation, e.getMessage()));
        }

        Map<CredentialKey, String> resolved = new LinkedHashMap<>();
        if (scheme instanceof OAuth2Scheme oauth) {
            OAuthStatus status = oAuthStatusClient.checkAuth(caller, oauth.provider(), oauth.scopes());
            if (!status.hasAuth()) {
                log.info("User {} must authorize {} before using tool {}.", caller.userId(), oauth.provider(), tool.getId());
                return new CredentialResolution.SetupRequired(authorizationNeeded(tool, operation, status.authUrl()));
            }
            resolved.put(oauth.tokenKey(), status.accessToken());
        }

        Set<CredentialKey> unresolved = new LinkedHashSet<>();
        for (CredentialSlot slot : scheme.slots()) {
            String value = fetchSecret(tool, caller, slot);
            if (value == null || value.isEmpty()) {
                unresolved.add(slot.key());
            } else {
                resolved.put(slot.key(), value);
            }
        }
        if (!unresolved.isEmpty()) {
            List<String> missing = scheme.missingSecretTypes(unresolved);
            log.info("Tool {} is missing secrets {} for user {}.", tool.getId(), missing, caller.userId());
            return new CredentialResolution.SetupRequired(secretsNeeded(tool, operation, missing));
        }
        return new CredentialResolution.Ready(scheme, new ResolvedCredentials(resolved));
    }

    private String fetchSecret(ToolDefinition tool, CallerIdentity caller, CredentialSlot slot) {
        SecretKey key = SecretKey.forClient(caller, tool.getUtilityProvider(), slot.secretTypeTag());
        try {
            String value = secretStore.getSecret(key);
            log.debug("Secret lookup {} for slot {}: {}", key.toSecretId(), slot.key(), value == null || value.isEmpty() ? "missing" : "found");
            return value;
        } catch (RuntimeException e) {
            log.warn("Secret lookup {} failed, treating it as missing: {}", key.toSecretId(), e.getMessage());
            return null;
        }
    }

    private SetupNeeded secretsNeeded(ToolDefinition tool, ApiOperation operation, List<String> missing) {
        String title = displayTitle(tool, operation);
        return new SetupNeeded(
                tool.getUtilityProvider(),
                "Configure " + title,
                "To use '" + title + "', provide the following: " + String.join(", ", missing) + ".",
                "Configuration required for " + title + ". Please provide the missing secrets.",
                missing,
                List.of(),
                null);
    }

    private SetupNeeded authorizationNeeded(ToolDefinition tool, ApiOperation operation, String authUrl) {
        String title = displayTitle(tool, operation);
        return new SetupNeeded(
                tool.getUtilityProvider(),
                "Configure " + title,
                "Authorize access to " + tool.getUtilityProvider() + " to use '" + title + "'.",
                "Authorization required for " + title + ". Please complete the authorization flow.",
                List.of(),
                List.of(),
                authUrl);
    }

    private SetupNeeded contactAdministrator(ToolDefinition tool, ApiOperation operation, String reason) {
        String title = displayTitle(tool, operation);
        return new SetupNeeded(
                tool.getUtilityProvider(),
                "Configure " + title,
                "The security configuration of this tool is incomplete: " + reason,
                "Tool '" + title + "' is not configured correctly. Please contact your administrator.",
                List.of(),
                List.of(),
                null);
    }

    private String displayTitle(ToolDefinition tool, ApiOperation operation) {
        return operation.getTitle() != null && !operation.getTitle().isBlank() ? operation.getTitle() : tool.getName();
    }
}
