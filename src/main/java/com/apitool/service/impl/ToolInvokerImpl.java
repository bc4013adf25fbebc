package com.apitool.service.impl;

import com.apitool.config.ToolEngineProperties;
import com.apitool.exception.ErrorKind;
import com.apitool.exception.RequestBuildException;
import com.apitool.model.execution.ExecutionOutcome;
import com.apitool.model.execution.Failed;
import com.apitool.model.execution.OutboundRequest;
import com.apitool.model.execution.Succeeded;
import com.apitool.service.api.ToolInvoker;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.JsonPathException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;

/**
 * Sends an assembled request with WebFlux and maps the answer to an outcome.
 * <p>
 * Exactly one attempt is made, bounded by {@code tool-engine.http.response-timeout}.
 * A timeout or connection failure is reported like any other transport failure.
 */
@Service
@Slf4j
public class ToolInvokerImpl implements ToolInvoker {

    private final WebClient webClient;
    private final Duration responseTimeout;
    // Upstream amounts keep every digit.
    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    public ToolInvokerImpl(@Qualifier("toolWebClient") WebClient webClient, ToolEngineProperties properties) {
        this.webClient = webClient;
        this.responseTimeout = properties.getHttp().getResponseTimeout();
    }

    @Override
    public ExecutionOutcome invoke(OutboundRequest request) {
        URI uri = request.toUri();
        WebClient.RequestBodySpec spec = webClient.method(request.getMethod())
                .uri(uri)
                .headers(headers -> headers.addAll(request.getHeaders()));
        WebClient.RequestHeadersSpec<?> ready = request.getBody() == null ? spec : withBody(spec, request);

        log.info("Calling {} {}", request.getMethod(), uri);
        try {
            UpstreamResponse response = ready
                    .exchangeToMono(clientResponse -> clientResponse.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(body -> new UpstreamResponse(clientResponse.statusCode().value(), body)))
                    .timeout(responseTimeout)
                    .block();
            if (response == null) {
                return transportFailure(new IllegalStateException("No response received"));
            }
            return toOutcome(response);
        } catch (RuntimeException e) {
            return transportFailure(Exceptions.unwrap(e));
        }
    }

    private WebClient.RequestHeadersSpec<?> withBody(WebClient.RequestBodySpec spec, OutboundRequest request) {
        MediaType contentType = request.getContentType() == null ? MediaType.APPLICATION_JSON : request.getContentType();
        spec.contentType(contentType);
        Object body = request.getBody();

        if (MediaType.APPLICATION_FORM_URLENCODED.isCompatibleWith(contentType) && body instanceof Map<?, ?> fields) {
            MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
            fields.forEach((name, value) -> form.add(String.valueOf(name), value == null ? "" : String.valueOf(value)));
            return spec.body(BodyInserters.fromFormData(form));
        }
        if (isJson(contentType)) {
            return spec.bodyValue(body);
        }
        try {
            return spec.bodyValue(objectMapper.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            throw new RequestBuildException("Request body could not be serialized: " + e.getOriginalMessage(), e);
        }
    }

    private ExecutionOutcome toOutcome(UpstreamResponse response) {
        if (response.status() >= 200 && response.status() < 300) {
            log.info("Upstream answered {}", response.status());
            return new Succeeded(response.status(), parseBody(response.body()));
        }
        String message = extractErrorMessage(response);
        log.warn("Upstream answered {}: {}", response.status(), message);
        return new Failed(ErrorKind.UPSTREAM_ERROR, response.status(),
                "External API Error (" + response.status() + "): " + message,
                parseBody(response.body()), null);
    }

    private ExecutionOutcome transportFailure(Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        log.error("Tool call failed before a response was received: {}", message);
        return new Failed(ErrorKind.UPSTREAM_ERROR, 500, "Tool Execution Failed: " + message,
                TextNode.valueOf(cause.getClass().getSimpleName()), null);
    }

    /**
     * Prefers {@code error} when it is a string, then {@code error.message}, then a plain-text
     * body, then the bare status.
     */
    private String extractErrorMessage(UpstreamResponse response) {
        String body = response.body();
        if (body == null || body.isBlank()) {
            return "Request failed with status code " + response.status();
        }
        if (!looksLikeJson(body)) {
            return body.trim();
        }
        try {
            DocumentContext document = JsonPath.parse(body);
            String message = readString(document, "$.error");
            if (message == null) {
                message = readString(document, "$.error.message");
            }
            if (message != null) {
                return message;
            }
        } catch (JsonPathException e) {
            log.debug("Error body of status {} is not valid JSON: {}", response.status(), e.getMessage());
        }
        return "Request failed with status code " + response.status();
    }

    private String readString(DocumentContext document, String path) {
        try {
            Object value = document.read(path);
            return value instanceof String text ? text : null;
        } catch (JsonPathException e) {
            return null;
        }
    }

    private JsonNode parseBody(String body) {
        if (body == null || body.isBlank()) {
            return NullNode.getInstance();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(body);
        }
    }

    private static boolean isJson(MediaType contentType) {
        return MediaType.APPLICATION_JSON.isCompatibleWith(contentType)
                || (contentType.getSubtype() != null && contentType.getSubtype().endsWith("+json"));
    }

    private static boolean looksLikeJson(String body) {
        String trimmed = body.trim();
        return trimmed.startsWith("{") || trimmed.startsWith("[");
    }

    private record UpstreamResponse(int status, String body) {
    }
}
