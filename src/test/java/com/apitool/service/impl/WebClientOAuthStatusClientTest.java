package com.apitool.service.impl;

import com.apitool.config.HttpClientFactory;
import com.apitool.config.ToolEngineProperties;
import com.apitool.exception.ErrorKind;
import com.apitool.exception.ToolEngineException;
import com.apitool.model.CallerIdentity;
import com.apitool.model.security.OAuthStatus;
import com.apitool.support.TestSpecs;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebClientOAuthStatusClientTest {

    private static final CallerIdentity CALLER = new CallerIdentity("user-1", "org-1");
    private static final List<String> SCOPES = List.of("items:read", "items:write");

    private MockWebServer mockWebServer;
    private ToolEngineProperties properties;
    private WebClientOAuthStatusClient oAuthStatusClient;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();
        properties = new ToolEngineProperties();
        properties.getOauth().setGatewayUrl(mockWebServer.url("/gateway/").toString());
        properties.getOauth().setApiKey("gateway-key");
        properties.getOauth().getRetry().setInitialBackoff(Duration.ofMillis(10));
        properties.getHttp().setResponseTimeout(Duration.ofSeconds(5));
        oAuthStatusClient = newClient();
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    @Test
    void checkAuth_shouldPostTheCallerAndScopesAndReturnTheToken() throws Exception {
        enqueueJson(200, "{\"success\": true, \"data\": {\"hasAuth\": true, \"accessToken\": \"tok-1\"}}");

        OAuthStatus status = oAuthStatusClient.checkAuth(CALLER, "acme", SCOPES);

        assertThat(status).isEqualTo(OAuthStatus.authorized("tok-1"));
        RecordedRequest request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/gateway/oauth/check");
        assertThat(request.getHeader("x-api-key")).isEqualTo("gateway-key");
        assertThat(TestSpecs.json(request.getBody().readUtf8())).isEqualTo(TestSpecs.json(
                "{\"userId\": \"user-1\", \"organizationId\": \"org-1\", \"oauthProvider\": \"acme\","
                        + " \"requiredScopes\": [\"items:read\", \"items:write\"]}"));
    }

    @Test
    void checkAuth_shouldFallBackToTheFirstStoredCredential() {
        enqueueJson(200, "{\"success\": true, \"data\": {\"hasAuth\": true,"
                + " \"oauthCredentials\": [{\"accessToken\": \"tok-2\"}]}}");

        assertThat(oAuthStatusClient.checkAuth(CALLER, "acme", SCOPES).accessToken()).isEqualTo("tok-2");
    }

    @Test
    void checkAuth_withoutAuthorization_shouldReturnTheAuthUrl() {
        enqueueJson(200, "{\"success\": true, \"data\": {\"hasAuth\": false, \"authUrl\": \"https://auth.example.com/start\"}}");

        OAuthStatus status = oAuthStatusClient.checkAuth(CALLER, "acme", SCOPES);

        assertThat(status.hasAuth()).isFalse();
        assertThat(status.authUrl()).isEqualTo("https://auth.example.com/start");
    }

    @Test
    void checkAuth_shouldRetryWhileTheGatewayIsUnavailable() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(503));
        mockWebServer.enqueue(new MockResponse().setResponseCode(429));
        enqueueJson(200, "{\"success\": true, \"data\": {\"hasAuth\": true, \"accessToken\": \"tok-3\"}}");

        OAuthStatus status = oAuthStatusClient.checkAuth(CALLER, "acme", SCOPES);

        assertThat(status.accessToken()).isEqualTo("tok-3");
        assertThat(mockWebServer.getRequestCount()).isEqualTo(3);
    }

    @Test
    void checkAuth_shouldNotRetryClientErrors() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(401));

        assertThatThrownBy(() -> oAuthStatusClient.checkAuth(CALLER, "acme", SCOPES))
                .isInstanceOfSatisfying(ToolEngineException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.ORCHESTRATION_ERROR);
                    assertThat(e.getMessage()).isEqualTo("Failed to check OAuth status.");
                });
        assertThat(mockWebServer.getRequestCount()).isEqualTo(1);
    }

    @Test
    void checkAuth_whenRejected_shouldThrowWithTheGatewayError() {
        enqueueJson(200, "{\"success\": false, \"error\": \"unknown provider\"}");

        assertThatThrownBy(() -> oAuthStatusClient.checkAuth(CALLER, "acme", SCOPES))
                .isInstanceOf(ToolEngineException.class)
                .hasMessage("OAuth status check was rejected: unknown provider");
    }

    @Test
    void checkAuth_withoutGatewayUrl_shouldThrow() {
        properties.getOauth().setGatewayUrl(" ");

        assertThatThrownBy(() -> newClient().checkAuth(CALLER, "acme", SCOPES))
                .isInstanceOf(ToolEngineException.class)
                .hasMessage("OAuth gateway URL is not configured.");
        assertThat(mockWebServer.getRequestCount()).isZero();
    }

    private WebClientOAuthStatusClient newClient() {
        return new WebClientOAuthStatusClient(new HttpClientFactory().gatewayWebClient(properties), properties);
    }

    private void enqueueJson(int status, String body) {
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(status)
                .setBody(body)
                .addHeader("Content-Type", "application/json"));
    }
}
