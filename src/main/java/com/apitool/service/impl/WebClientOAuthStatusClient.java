package com.apitool.service.impl;

import com.apitool.config.ToolEngineProperties;
import com.apitool.dto.request.OAuthCheckRequest;
import com.apitool.exception.ErrorKind;
import com.apitool.exception.ToolEngineException;
import com.apitool.model.CallerIdentity;
import com.apitool.model.security.OAuthStatus;
import com.apitool.service.api.OAuthStatusClient;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;

/**
 * Asks the OAuth gateway whether a user has authorized a provider.
 * <p>
 * The gateway answers {@code {"success": true, "data": {"hasAuth": ..., ...}}}. The access token
 * is read from {@code data.accessToken} or from the first entry of {@code data.oauthCredentials}.
 */
@Service
@Slf4j
public class WebClientOAuthStatusClient implements OAuthStatusClient {

    static final String CHECK_PATH = "/oauth/check";
    static final String API_KEY_HEADER = "x-api-key";

    private final WebClient webClient;
    private final ToolEngineProperties.OAuth settings;
    private final Duration responseTimeout;

    public WebClientOAuthStatusClient(@Qualifier("gatewayWebClient") WebClient webClient, ToolEngineProperties properties) {
        this.webClient = webClient;
        this.settings = properties.getOauth();
        this.responseTimeout = properties.getHttp().getResponseTimeout();
    }

    @Override
    public OAuthStatus checkAuth(CallerIdentity caller, String provider, List<String> scopes) {
        String gatewayUrl = settings.getGatewayUrl();
        if (gatewayUrl == null || gatewayUrl.isBlank()) {
            throw new ToolEngineException(ErrorKind.ORCHESTRATION_ERROR, "OAuth gateway URL is not configured.");
        }
        OAuthCheckRequest body = new OAuthCheckRequest(caller.userId(), caller.organizationId(), provider, scopes);
        String url = gatewayUrl.replaceAll("/+$", "") + CHECK_PATH;
        log.debug("Checking OAuth status of user {} for provider {} with scopes {}", caller.userId(), provider, scopes);

        JsonNode response;
        try {
            response = webClient.post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(headers -> {
                        if (settings.getApiKey() != null && !settings.getApiKey().isBlank()) {
                            headers.set(API_KEY_HEADER, settings.getApiKey());
                        }
                    })
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(responseTimeout)
                    .block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            log.error("OAuth status check for provider {} failed: {}", provider, cause.getMessage());
            throw new ToolEngineException(ErrorKind.ORCHESTRATION_ERROR, "Failed to check OAuth status.", cause);
        }
        return toStatus(response);
    }

    private OAuthStatus toStatus(JsonNode response) {
        if (response == null || !response.path("success").asBoolean(false)) {
            String error = response == null ? "empty response" : response.path("error").asText("unknown error");
            throw new ToolEngineException(ErrorKind.ORCHESTRATION_ERROR, "OAuth status check was rejected: " + error);
        }
        JsonNode data = response.path("data");
        if (!data.path("hasAuth").asBoolean(false)) {
            return OAuthStatus.needsAuth(data.path("authUrl").asText(null));
        }
        String token = data.path("accessToken").asText(null);
        if (token == null) {
            token = data.path("oauthCredentials").path(0).path("accessToken").asText(null);
        }
        if (token == null || token.isEmpty()) {
            throw new ToolEngineException(ErrorKind.ORCHESTRATION_ERROR, "OAuth gateway reported authorization without an access token.");
        }
        return OAuthStatus.authorized(token);
    }
}
