package com.apitool.service.impl;

import com.apitool.exception.InvalidSpecException;
import com.apitool.model.ApiOperation;
import com.apitool.model.ApiParameter;
import com.apitool.model.ParameterLocation;
import com.apitool.model.RequestBodyDefinition;
import com.apitool.model.ServerVariableDefinition;
import com.apitool.model.openapi.RefResolution;
import com.apitool.service.api.SpecNormalizer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.swagger.v3.core.util.Json;
import io.swagger.v3.core.util.Json31;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.SpecVersion;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.parameters.Parameter;
import io.swagger.v3.oas.models.parameters.RequestBody;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.parser.OpenAPIV3Parser;
import io.swagger.v3.parser.core.models.ParseOptions;
import io.swagger.v3.parser.core.models.SwaggerParseResult;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class SpecNormalizerImpl implements SpecNormalizer {

    // Bean properties of swagger models that leak into their JSON form.
    private static final Set<String> SERIALIZATION_ARTIFACTS = Set.of("exampleSetFlag", "specVersion", "types", "jsonSchema");

    /**
     * {@inheritDoc}
     * This implementation parses the document with swagger-parser without letting it resolve
     * references, so that every {@code $ref} goes through {@link ComponentRefResolver} exactly once.
     */
    @Override
    public ApiOperation normalize(JsonNode openapiSpecification) {
        if (openapiSpecification == null || !openapiSpecification.isObject()) {
            throw new InvalidSpecException("openapiSpecification must be a JSON object.");
        }
        OpenAPI openAPI = parse(openapiSpecification);
        List<String> violations = conventionViolations(openapiSpecification, openAPI);
        if (!violations.isEmpty()) {
            throw new InvalidSpecException(violations);
        }

        Map.Entry<String, PathItem> pathEntry = openAPI.getPaths().entrySet().iterator().next();
        PathItem pathItem = pathEntry.getValue();
        Map.Entry<PathItem.HttpMethod, Operation> operationEntry = pathItem.readOperationsMap().entrySet().iterator().next();
        Operation operation = operationEntry.getValue();
        Server server = openAPI.getServers().get(0);
        ComponentRefResolver refs = new ComponentRefResolver(openAPI.getComponents());
        ObjectMapper schemaMapper = openAPI.getSpecVersion() == SpecVersion.V31 ? Json31.mapper() : Json.mapper();

        ApiOperation apiOp = new ApiOperation();
        String method = operationEntry.getKey().name();
        apiOp.setOperationId(operation.getOperationId() != null
                ? operation.getOperationId()
                : generateOperationId(method, pathEntry.getKey()));
        apiOp.setHttpMethod(method);
        apiOp.setPathTemplate(pathEntry.getKey());
        apiOp.setSummary(operation.getSummary() != null ? operation.getSummary() : operation.getDescription());
        apiOp.setTitle(openAPI.getInfo() != null ? openAPI.getInfo().getTitle() : null);
        apiOp.setServerUrl(server.getUrl());
        if (server.getVariables() != null) {
            server.getVariables().forEach((name, variable) -> apiOp.getServerVariables().put(name,
                    new ServerVariableDefinition(variable.getDefault(), variable.getEnum(), variable.getDescription())));
        }

        List<RefResolution.Unresolved<?>> unresolved = apiOp.getUnresolvedRefs();
        apiOp.setParameters(collectParameters(pathItem, operation, refs, schemaMapper, unresolved));
        apiOp.setRequestBody(createRequestBody(operation.getRequestBody(), refs, schemaMapper, unresolved));

        if (openAPI.getComponents() != null && openAPI.getComponents().getSecuritySchemes() != null) {
            apiOp.getSecuritySchemes().putAll(openAPI.getComponents().getSecuritySchemes());
        }
        if (!unresolved.isEmpty()) {
            log.warn("Operation {} {} has unresolved references: {}", method, pathEntry.getKey(), unresolved);
        }
        log.debug("Normalized operation {} {} on {}", method, pathEntry.getKey(), server.getUrl());
        return apiOp;
    }

    private OpenAPI parse(JsonNode document) {
        ParseOptions options = new ParseOptions();
        options.setResolve(false);
        SwaggerParseResult result = new OpenAPIV3Parser().readContents(document.toString(), null, options);
        if (result == null || result.getOpenAPI() == null) {
            List<String> messages = result == null || result.getMessages() == null || result.getMessages().isEmpty()
                    ? List.of("the document could not be parsed as OpenAPI 3.x")
                    : result.getMessages();
            throw new InvalidSpecException(messages);
        }
        if (result.getMessages() != null && !result.getMessages().isEmpty()) {
            log.debug("OpenAPI parser reported: {}", result.getMessages());
        }
        return result.getOpenAPI();
    }

    private List<String> conventionViolations(JsonNode document, OpenAPI openAPI) {
        List<String> violations = new ArrayList<>();
        int pathCount = openAPI.getPaths() == null ? 0 : openAPI.getPaths().size();
        if (pathCount != 1) {
            violations.add("paths must contain exactly one path, found " + pathCount + ".");
        } else {
            Map.Entry<String, PathItem> only = openAPI.getPaths().entrySet().iterator().next();
            int methodCount = only.getValue() == null ? 0 : only.getValue().readOperationsMap().size();
            if (methodCount != 1) {
                violations.add("path '" + only.getKey() + "' must declare exactly one HTTP method, found " + methodCount + ".");
            }
        }

        // The parser invents a "/" server when none is declared, so count the raw entries.
        JsonNode servers = document.path("servers");
        int serverCount = servers.isArray() ? servers.size() : 0;
        if (serverCount != 1) {
            violations.add("servers must contain exactly one entry, found " + serverCount + ".");
        } else {
            String url = servers.get(0).path("url").asText("").trim();
            if (url.isEmpty() || "/".equals(url)) {
                violations.add("servers[0].url must be a non-root URL.");
            }
        }
        return violations;
    }

    private List<ApiParameter> collectParameters(PathItem pathItem, Operation operation, ComponentRefResolver refs,
                                                 ObjectMapper schemaMapper, List<RefResolution.Unresolved<?>> unresolved) {
        // Operation-level parameters override path-level ones with the same name and location.
        Map<String, ApiParameter> byLocationAndName = new LinkedHashMap<>();
        Stream.concat(listOrEmpty(pathItem.getParameters()).stream(), listOrEmpty(operation.getParameters()).stream())
                .forEach(raw -> {
                    RefResolution<Parameter> resolution = refs.parameter(raw);
                    if (resolution instanceof RefResolution.Unresolved<Parameter> miss) {
                        unresolved.add(miss);
                        return;
                    }
                    Parameter parameter = ((RefResolution.Resolved<Parameter>) resolution).value();
                    ApiParameter apiParam = createApiParameter(parameter, refs, schemaMapper, unresolved);
                    byLocationAndName.put(apiParam.getIn() + ":" + apiParam.getName(), apiParam);
                });
        return new ArrayList<>(byLocationAndName.values());
    }

    private ApiParameter createApiParameter(Parameter parameter, ComponentRefResolver refs, ObjectMapper schemaMapper,
                                            List<RefResolution.Unresolved<?>> unresolved) {
        if (parameter.getName() == null || parameter.getName().isBlank()) {
            throw new InvalidSpecException("A parameter of the operation has no name.");
        }
        ParameterLocation location;
        try {
            location = ParameterLocation.from(parameter.getIn());
        } catch (IllegalArgumentException e) {
            throw new InvalidSpecException("Parameter '" + parameter.getName() + "' has unsupported location '" + parameter.getIn() + "'.");
        }

        Schema<?> schema = parameter.getSchema();
        if (schema == null && parameter.getContent() != null && !parameter.getContent().isEmpty()) {
            schema = parameter.getContent().values().iterator().next().getSchema();
        }
        JsonNode schemaNode = schema == null
                ? JsonNodeFactory.instance.objectNode()
                : toSchemaNode(schema, refs, schemaMapper, unresolved);

        ApiParameter apiParam = new ApiParameter();
        apiParam.setName(parameter.getName());
        apiParam.setIn(location);
        apiParam.setRequired(location == ParameterLocation.PATH || Boolean.TRUE.equals(parameter.getRequired()));
        apiParam.setDescription(parameter.getDescription());
        apiParam.setSchema(schemaNode);
        return apiParam;
    }

    private RequestBodyDefinition createRequestBody(RequestBody requestBody, ComponentRefResolver refs,
                                                    ObjectMapper schemaMapper, List<RefResolution.Unresolved<?>> unresolved) {
        if (requestBody == null) {
            return null;
        }
        RefResolution<RequestBody> resolution = refs.requestBody(requestBody);
        if (resolution instanceof RefResolution.Unresolved<RequestBody> miss) {
            unresolved.add(miss);
            return null;
        }
        RequestBody body = ((RefResolution.Resolved<RequestBody>) resolution).value();
        if (body.getContent() == null || body.getContent().isEmpty()) {
            return null;
        }
        Map.Entry<String, MediaType> first = body.getContent().entrySet().iterator().next();
        JsonNode schemaNode = first.getValue() == null || first.getValue().getSchema() == null
                ? null
                : toSchemaNode(first.getValue().getSchema(), refs, schemaMapper, unresolved);
        return new RequestBodyDefinition(first.getKey(), schemaNode, Boolean.TRUE.equals(body.getRequired()));
    }

    /**
     * Converts a swagger schema to JSON Schema, following its own reference and those of its
     * top-level properties. Returns {@code null} when the schema itself cannot be resolved.
     */
    private JsonNode toSchemaNode(Schema<?> schema, ComponentRefResolver refs, ObjectMapper schemaMapper,
                                  List<RefResolution.Unresolved<?>> unresolved) {
        RefResolution<Schema<?>> resolution = refs.schema(schema);
        if (resolution instanceof RefResolution.Unresolved<Schema<?>> miss) {
            unresolved.add(miss);
            return null;
        }
        Schema<?> resolved = ((RefResolution.Resolved<Schema<?>>) resolution).value();
        ObjectNode node = convert(resolved, schemaMapper);

        if (resolved.getProperties() != null && !resolved.getProperties().isEmpty()) {
            ObjectNode resolvedProperties = node.putObject("properties");
            resolved.getProperties().forEach((name, property) -> {
                RefResolution<Schema<?>> propertyResolution = refs.schema((Schema<?>) property);
                if (propertyResolution instanceof RefResolution.Unresolved<Schema<?>> propertyMiss) {
                    unresolved.add(propertyMiss);
                    return;
                }
                resolvedProperties.set(name, convert(((RefResolution.Resolved<Schema<?>>) propertyResolution).value(), schemaMapper));
            });
        }
        return node;
    }

    private ObjectNode convert(Schema<?> schema, ObjectMapper schemaMapper) {
        JsonNode node = schemaMapper.valueToTree(schema);
        ObjectNode objectNode = node != null && node.isObject() ? (ObjectNode) node : JsonNodeFactory.instance.objectNode();
        objectNode.remove(SERIALIZATION_ARTIFACTS);
        return objectNode;
    }

    private static <T> List<T> listOrEmpty(List<T> list) {
        return list == null ? Collections.emptyList() : list;
    }

    private String generateOperationId(String httpMethod, String path) {
        String sanitizedPath = path
                .replaceAll("\\{", "by_")
                .replaceAll("[{}/]", "_")
                .replaceAll("_+", "_")
                .replaceAll("^_|_$", "");
        return httpMethod.toLowerCase() + "_" + sanitizedPath;
    }
}
