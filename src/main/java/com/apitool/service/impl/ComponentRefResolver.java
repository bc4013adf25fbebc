package com.apitool.service.impl;

import com.apitool.model.openapi.ComponentType;
import com.apitool.model.openapi.RefResolution;
import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.parameters.Parameter;
import io.swagger.v3.oas.models.parameters.RequestBody;
import io.swagger.v3.oas.models.security.SecurityScheme;
import java.util.Map;
import java.util.function.Function;

/**
 * Follows local {@code #/components/...} references of one document, exactly one level deep.
 * A reference that lands on another reference is reported as unresolved.
 */
public class ComponentRefResolver {

    private final Components components;

    public ComponentRefResolver(Components components) {
        this.components = components;
    }

    public RefResolution<Parameter> parameter(Parameter parameter) {
        return resolve(parameter, parameter.get$ref(), ComponentType.PARAMETERS,
                name -> lookup(components == null ? null : components.getParameters(), name), Parameter::get$ref);
    }

    public RefResolution<RequestBody> requestBody(RequestBody requestBody) {
        return resolve(requestBody, requestBody.get$ref(), ComponentType.REQUEST_BODIES,
                name -> lookup(components == null ? null : components.getRequestBodies(), name), RequestBody::get$ref);
    }

    public RefResolution<Schema<?>> schema(Schema<?> schema) {
        return resolve(schema, schema.get$ref(), ComponentType.SCHEMAS, this::componentSchema, Schema::get$ref);
    }

    public RefResolution<SecurityScheme> securityScheme(SecurityScheme scheme) {
        return resolve(scheme, scheme.get$ref(), ComponentType.SECURITY_SCHEMES,
                name -> lookup(components == null ? null : components.getSecuritySchemes(), name), SecurityScheme::get$ref);
    }

    private Schema<?> componentSchema(String name) {
        if (components == null || components.getSchemas() == null) {
            return null;
        }
        return (Schema<?>) components.getSchemas().get(name);
    }

    private static <T> T lookup(Map<String, T> registry, String name) {
        return registry == null ? null : registry.get(name);
    }

    private <T> RefResolution<T> resolve(T candidate, String ref, ComponentType type,
                                         Function<String, T> registry, Function<T, String> refOf) {
        if (ref == null) {
            return new RefResolution.Resolved<>(candidate);
        }
        if (!ref.startsWith(type.prefix())) {
            return new RefResolution.Unresolved<>(ref, "only local " + type.prefix() + "<name> references are supported");
        }
        String name = ref.substring(type.prefix().length());
        T target = registry.apply(name);
        if (target == null) {
            return new RefResolution.Unresolved<>(ref, "no component named '" + name + "'");
        }
        if (refOf.apply(target) != null) {
            return new RefResolution.Unresolved<>(ref, "nested reference to " + refOf.apply(target) + " is not supported");
        }
        return new RefResolution.Resolved<>(target);
    }
}
