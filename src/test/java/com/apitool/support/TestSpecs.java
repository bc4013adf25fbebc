package com.apitool.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Loads the OpenAPI tool documents under {@code src/test/resources/specs}.
 */
public final class TestSpecs {

    public static final String ITEMS_API = "items-api.json";
    public static final String CREATE_RECORD = "create-record.json";
    public static final String REGIONAL_SEARCH = "regional-search.json";
    public static final String BULK_IMPORT = "bulk-import.json";
    public static final String UNRESOLVED_REF = "unresolved-ref.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TestSpecs() {
    }

    public static ObjectNode load(String name) {
        try (InputStream in = TestSpecs.class.getClassLoader().getResourceAsStream("specs/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("No test spec named " + name);
            }
            return (ObjectNode) MAPPER.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Loads a document and points its single server at the given URL, e.g. a MockWebServer.
     */
    public static ObjectNode loadWithServer(String name, String serverUrl) {
        ObjectNode spec = load(name);
        ((ObjectNode) spec.get("servers").get(0)).put("url", serverUrl);
        return spec;
    }

    public static JsonNode json(String text) {
        try {
            return MAPPER.readTree(text);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
