package com.apitool.model.execution;

import com.apitool.exception.RequestBuildException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import lombok.Getter;
import lombok.Setter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

/**
 * A fully assembled HTTP request for one tool invocation.
 * <p>
 * {@code serverUrl} and {@code path} hold already-encoded text. Query names and values are kept
 * raw and fully percent-encoded once when {@link #toUri()} is called, so reserved characters
 * such as {@code +}, {@code /} and {@code =} reach the upstream intact.
 */
@Getter
@Setter
public class OutboundRequest {

    private final HttpMethod method;
    private String serverUrl;
    private String path;
    private final MultiValueMap<String, String> queryParams = new LinkedMultiValueMap<>();
    private final HttpHeaders headers = new HttpHeaders();
    private MediaType contentType;
    private Object body;

    public OutboundRequest(HttpMethod method) {
        this.method = method;
    }

    public void addQueryParam(String name, String value) {
        queryParams.add(name, value);
    }

    public void setQueryParam(String name, String value) {
        queryParams.set(name, value);
    }

    public void setHeader(String name, String value) {
        headers.set(name, value);
    }

    public URI toUri() {
        String base = serverUrl.endsWith("/") ? serverUrl.substring(0, serverUrl.length() - 1) : serverUrl;
        String target = base + path;
        try {
            UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(target);
            queryParams.forEach((name, values) -> values.forEach(value -> builder.queryParam(
                    UriUtils.encode(name, StandardCharsets.UTF_8),
                    UriUtils.encode(value, StandardCharsets.UTF_8))));
            return builder.build(true).toUri();
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new RequestBuildException("Could not build request URI from '" + target + "': " + e.getMessage(), e);
        }
    }
}
