package com.apitool.service.impl;

import com.apitool.exception.RequestBuildException;
import com.apitool.model.ApiOperation;
import com.apitool.model.ParameterLocation;
import com.apitool.model.execution.OutboundRequest;
import com.apitool.model.security.ApiKeyScheme;
import com.apitool.model.security.BearerScheme;
import com.apitool.model.security.CredentialKey;
import com.apitool.model.security.CredentialResolution;
import com.apitool.model.security.CredentialRole;
import com.apitool.model.security.ResolvedCredentials;
import com.apitool.support.TestSpecs;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestBuilderImplTest {

    private SpecNormalizerImpl specNormalizer;
    private RequestBuilderImpl requestBuilder;

    @BeforeEach
    void setUp() {
        specNormalizer = new SpecNormalizerImpl();
        requestBuilder = new RequestBuilderImpl();
    }

    @Test
    void build_shouldSubstitutePathParamsAndRouteQueryAndHeaders() {
        ApiOperation operation = specNormalizer.normalize(TestSpecs.load(TestSpecs.ITEMS_API));
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("itemId", 42);
        params.put("verbose", true);
        params.put("X-Request-Id", "req-7");
        params.put("session", "dropped");

        OutboundRequest request = requestBuilder.build(operation, params, CredentialResolution.notRequired());

        assertThat(request.getMethod()).isEqualTo(HttpMethod.GET);
        assertThat(request.toUri().toString()).isEqualTo("https://api.example.com/v1/items/42?verbose=true");
        assertThat(request.getHeaders().getFirst("X-Request-Id")).isEqualTo("req-7");
        assertThat(request.getHeaders().containsKey(HttpHeaders.COOKIE)).isFalse();
        assertThat(request.getBody()).isNull();
    }

    @Test
    void build_shouldEncodePathAndQueryValues() {
        ApiOperation operation = specNormalizer.normalize(TestSpecs.load(TestSpecs.ITEMS_API));

        OutboundRequest request = requestBuilder.build(operation, Map.of("itemId", "a b/c"), CredentialResolution.notRequired());

        assertThat(request.toUri().toString()).isEqualTo("https://api.example.com/v1/items/a%20b%2Fc");
    }

    @Test
    void build_shouldPercentEncodePlusSlashAndEqualsInQueryValues() {
        ApiOperation operation = specNormalizer.normalize(TestSpecs.load(TestSpecs.CREATE_RECORD));

        OutboundRequest request = requestBuilder.build(operation, Map.of("a", "2024-01-01T00:00:00+02:00 a/b=c"),
                CredentialResolution.notRequired());

        assertThat(request.toUri().getRawQuery()).isEqualTo("a=2024-01-01T00%3A00%3A00%2B02%3A00%20a%2Fb%3Dc");
        assertThat(request.toUri().getQuery()).isEqualTo("a=2024-01-01T00:00:00+02:00 a/b=c");
    }

    @Test
    void build_withMissingPathParameter_shouldFail() {
        ApiOperation operation = specNormalizer.normalize(TestSpecs.load(TestSpecs.ITEMS_API));

        assertThatThrownBy(() -> requestBuilder.build(operation, Map.of("verbose", true), CredentialResolution.notRequired()))
                .isInstanceOf(RequestBuildException.class)
                .hasMessage("Missing required path parameter: itemId");
    }

    @Test
    void build_withObjectBody_shouldProjectOnlyDeclaredProperties() {
        ApiOperation operation = specNormalizer.normalize(TestSpecs.load(TestSpecs.CREATE_RECORD));

        OutboundRequest request = requestBuilder.build(operation, Map.of("a", "x", "b", 3.5), CredentialResolution.notRequired());

        assertThat(request.getMethod()).isEqualTo(HttpMethod.POST);
        assertThat(request.toUri().toString()).isEqualTo("https://records.example.com/records?a=x");
        assertThat(request.getContentType()).isEqualTo(MediaType.APPLICATION_JSON);
        assertThat(request.getBody()).isEqualTo(Map.of("b", 3.5));
    }

    @Test
    void build_withOptionalObjectBodyAndNoBodyValues_shouldSendNoBody() {
        ApiOperation operation = specNormalizer.normalize(TestSpecs.load(TestSpecs.CREATE_RECORD));

        OutboundRequest request = requestBuilder.build(operation, Map.of("a", "x"), CredentialResolution.notRequired());

        assertThat(request.getBody()).isNull();
    }

    /**
     * A body that is not an object receives the whole parameter object. This only works when the
     * body schema happens to match the full parameter set, and is kept for compatibility.
     */
    @Test
    void build_withNonObjectBody_shouldSendTheWholeParameterObject() {
        ApiOperation operation = specNormalizer.normalize(TestSpecs.load(TestSpecs.BULK_IMPORT));
        Map<String, Object> params = Map.of("first", "a", "second", "b");

        OutboundRequest request = requestBuilder.build(operation, params, CredentialResolution.notRequired());

        assertThat(request.getMethod()).isEqualTo(HttpMethod.PUT);
        assertThat(request.getBody()).isEqualTo(params);
    }

    @Test
    void build_shouldUseServerVariableDefaultUnlessOverridden() {
        ApiOperation operation = specNormalizer.normalize(TestSpecs.load(TestSpecs.REGIONAL_SEARCH));

        OutboundRequest byDefault = requestBuilder.build(operation, Map.of(), CredentialResolution.notRequired());
        OutboundRequest overridden = requestBuilder.build(operation, Map.of("region", "us"), CredentialResolution.notRequired());

        assertThat(byDefault.toUri().toString()).isEqualTo("https://eu.search.example.com/api/search");
        assertThat(overridden.toUri().toString()).isEqualTo("https://us.search.example.com/api/search");
    }

    @Test
    void build_shouldEncodeCallerSuppliedServerVariableValues() {
        ApiOperation operation = specNormalizer.normalize(TestSpecs.load(TestSpecs.REGIONAL_SEARCH));

        OutboundRequest request = requestBuilder.build(operation, Map.of("region", "evil.com/x?y#"),
                CredentialResolution.notRequired());

        assertThat(request.getServerUrl()).isEqualTo("https://evil.com%2Fx%3Fy%23.search.example.com/api");
    }

    @Test
    void build_shouldRepeatListQueryValuesAndJoinListHeaderValues() {
        ApiOperation operation = specNormalizer.normalize(TestSpecs.load(TestSpecs.REGIONAL_SEARCH));
        Map<String, Object> params = Map.of("tags", List.of("red", "blue"), "X-Trace", List.of("a", "b"));

        OutboundRequest request = requestBuilder.build(operation, params, CredentialResolution.notRequired());

        assertThat(request.toUri().getRawQuery()).isEqualTo("tags=red&tags=blue");
        assertThat(request.getHeaders().getFirst("X-Trace")).isEqualTo("a,b");
    }

    @Test
    void build_withApiKeyInQuery_shouldAddTheKeyToTheQueryString() {
        ApiOperation operation = specNormalizer.normalize(TestSpecs.load(TestSpecs.ITEMS_API));
        ApiKeyScheme scheme = new ApiKeyScheme("apiKeyQuery", "api_key", ParameterLocation.QUERY, "api key");
        ResolvedCredentials credentials = new ResolvedCredentials(Map.of(scheme.key(), "k&y"));

        OutboundRequest request = requestBuilder.build(operation, Map.of("itemId", 1),
                new CredentialResolution.Ready(scheme, credentials));

        assertThat(request.toUri().getRawQuery()).isEqualTo("api_key=k%26y");
    }

    @Test
    void build_withApiKeyInQueryContainingPlus_shouldKeepThePlusLiteral() {
        ApiOperation operation = specNormalizer.normalize(TestSpecs.load(TestSpecs.ITEMS_API));
        ApiKeyScheme scheme = new ApiKeyScheme("apiKeyQuery", "api_key", ParameterLocation.QUERY, "api key");
        ResolvedCredentials credentials = new ResolvedCredentials(Map.of(scheme.key(), "ab+cd/ef=="));

        OutboundRequest request = requestBuilder.build(operation, Map.of("itemId", 1),
                new CredentialResolution.Ready(scheme, credentials));

        assertThat(request.toUri().getRawQuery()).isEqualTo("api_key=ab%2Bcd%2Fef%3D%3D");
    }

    @Test
    void build_withBearerScheme_shouldSetTheAuthorizationHeader() {
        ApiOperation operation = specNormalizer.normalize(TestSpecs.load(TestSpecs.ITEMS_API));
        BearerScheme scheme = new BearerScheme("bearerAuth", "bearer token");
        ResolvedCredentials credentials = new ResolvedCredentials(
                Map.of(new CredentialKey("bearerAuth", CredentialRole.SECRET), "tkn"));

        OutboundRequest request = requestBuilder.build(operation, Map.of("itemId", 1),
                new CredentialResolution.Ready(scheme, credentials));

        assertThat(request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer tkn");
    }
}
