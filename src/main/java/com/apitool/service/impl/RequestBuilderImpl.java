package com.apitool.service.impl;

import com.apitool.exception.RequestBuildException;
import com.apitool.model.ApiOperation;
import com.apitool.model.ApiParameter;
import com.apitool.model.ParameterLocation;
import com.apitool.model.RequestBodyDefinition;
import com.apitool.model.ServerVariableDefinition;
import com.apitool.model.execution.OutboundRequest;
import com.apitool.model.security.CredentialResolution;
import com.apitool.service.api.RequestBuilder;
import com.fasterxml.jackson.databind.JsonNode;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriUtils;

@Service
@Slf4j
public class RequestBuilderImpl implements RequestBuilder {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^{}]+)}");

    /**
     * Assembles the outbound request for one invocation.
     * <p>
     * Caller-supplied server variables and path values are percent-encoded here. Query values are
     * encoded once when the request URI is produced.
     *
     * @param operation       The normalized operation.
     * @param validatedParams The parameters that passed validation; {@code null} is treated as empty.
     * @param credentials     The resolved credentials and the scheme that applies them.
     * @return The request, ready to send.
     * @throws com.apitool.exception.RequestBuildException if a path parameter is missing or the body media type is invalid.
     */
    @Override
    public OutboundRequest build(ApiOperation operation, Map<String, Object> validatedParams,
                                 CredentialResolution.Ready credentials) {
        Map<String, Object> params = validatedParams == null ? Map.of() : validatedParams;
        OutboundRequest request = new OutboundRequest(HttpMethod.valueOf(operation.getHttpMethod()));
        request.setServerUrl(resolveServerUrl(operation, params));
        request.setPath(resolvePath(operation, params));
        routeParameters(operation, params, request);
        attachBody(operation, params, request);

        if (credentials.scheme() != null) {
            log.debug("Applying security scheme '{}' to {} {}", credentials.scheme().schemeName(),
                    operation.getHttpMethod(), operation.getPathTemplate());
            credentials.scheme().apply(credentials.credentials(), request);
        }
        return request;
    }

    private String resolveServerUrl(ApiOperation operation, Map<String, Object> params) {
        Matcher matcher = PLACEHOLDER.matcher(operation.getServerUrl());
        StringBuilder url = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            ServerVariableDefinition variable = operation.getServerVariables().get(name);
            String value = null;
            if (params.get(name) != null) {
                // Caller values may not add path segments or a query to the server URL.
                value = UriUtils.encodePathSegment(stringify(params.get(name)), StandardCharsets.UTF_8);
            } else if (variable != null && variable.defaultValue() != null) {
                value = variable.defaultValue();
            }
            if (value == null) {
                log.warn("Server variable '{}' has no value and no default; leaving it unresolved.", name);
                matcher.appendReplacement(url, Matcher.quoteReplacement(matcher.group()));
            } else {
                matcher.appendReplacement(url, Matcher.quoteReplacement(value));
            }
        }
        matcher.appendTail(url);
        return url.toString();
    }

    private String resolvePath(ApiOperation operation, Map<String, Object> params) {
        String path = operation.getPathTemplate();
        for (ApiParameter parameter : operation.getParameters()) {
            if (parameter.getIn() != ParameterLocation.PATH) {
                continue;
            }
            String placeholder = "{" + parameter.getName() + "}";
            Object value = params.get(parameter.getName());
            if (value == null) {
                if (path.contains(placeholder)) {
                    throw new RequestBuildException("Missing required path parameter: " + parameter.getName());
                }
                continue;
            }
            path = path.replace(placeholder, UriUtils.encodePathSegment(stringify(value), StandardCharsets.UTF_8));
        }
        Matcher leftover = PLACEHOLDER.matcher(path);
        if (leftover.find()) {
            throw new RequestBuildException("Path placeholder '" + leftover.group() + "' has no matching path parameter.");
        }
        return path;
    }

    private void routeParameters(ApiOperation operation, Map<String, Object> params, OutboundRequest request) {
        for (ApiParameter parameter : operation.getParameters()) {
            Object value = params.get(parameter.getName());
            if (value == null) {
                continue;
            }
            switch (parameter.getIn()) {
                case QUERY -> {
                    if (value instanceof Collection<?> values) {
                        values.forEach(item -> request.addQueryParam(parameter.getName(), stringify(item)));
                    } else {
                        request.addQueryParam(parameter.getName(), stringify(value));
                    }
                }
                case HEADER -> request.setHeader(parameter.getName(), stringify(value));
                case COOKIE -> log.warn("Cookie parameter '{}' is not supported and was dropped.", parameter.getName());
                default -> {
                    // path parameters are already in the path
                }
            }
        }
    }

    private void attachBody(ApiOperation operation, Map<String, Object> params, OutboundRequest request) {
        RequestBodyDefinition body = operation.getRequestBody();
        if (body == null) {
            return;
        }
        try {
            request.setContentType(MediaType.parseMediaType(body.mediaType()));
        } catch (InvalidMediaTypeException e) {
            throw new RequestBuildException("Request body media type '" + body.mediaType() + "' is invalid.", e);
        }

        Map<String, Object> payload;
        if (body.isObjectWithProperties()) {
            payload = new LinkedHashMap<>();
            for (Map.Entry<String, JsonNode> property : body.schema().path("properties").properties()) {
                if (params.containsKey(property.getKey())) {
                    payload.put(property.getKey(), params.get(property.getKey()));
                }
            }
        } else {
            // Non-object bodies receive the whole parameter object.
            payload = new LinkedHashMap<>(params);
        }

        if (payload.isEmpty() && !body.required()) {
            log.debug("No body values supplied for optional request body, sending none.");
            return;
        }
        request.setBody(payload);
    }

    private static String stringify(Object value) {
        if (value instanceof Collection<?> values) {
            return values.stream().map(String::valueOf).collect(Collectors.joining(","));
        }
        return String.valueOf(value);
    }
}
