package com.apitool.model.security;

import com.apitool.exception.MisconfiguredToolException;
import com.apitool.exception.UnsupportedSchemeException;
import com.apitool.model.ParameterLocation;
import com.apitool.model.SecuritySecrets;
import com.apitool.model.execution.OutboundRequest;
import io.swagger.v3.oas.models.security.SecurityScheme;
import java.util.List;

/**
 * An API key sent as a header or query parameter.
 *
 * @param parameterName The wire-level header or query key, from the scheme's {@code name}.
 * @param location      {@link ParameterLocation#HEADER} or {@link ParameterLocation#QUERY}.
 */
public record ApiKeyScheme(String schemeName, String parameterName, ParameterLocation location, String secretTypeTag)
        implements CredentialScheme {

    static ApiKeyScheme from(String schemeName, SecurityScheme scheme, SecuritySecrets tags) {
        if (scheme.getName() == null || scheme.getName().isBlank()) {
            throw new MisconfiguredToolException("apiKey scheme '" + schemeName + "' declares no parameter name.");
        }
        if (scheme.getIn() == null) {
            throw new MisconfiguredToolException("apiKey scheme '" + schemeName + "' declares no location.");
        }
        ParameterLocation location = switch (scheme.getIn()) {
            case HEADER -> ParameterLocation.HEADER;
            case QUERY -> ParameterLocation.QUERY;
            default -> throw new UnsupportedSchemeException(
                    "apiKey in '" + scheme.getIn() + "' of '" + schemeName + "' is not supported.");
        };
        String tag = CredentialScheme.requireTag(tags.name(), "name", schemeName);
        return new ApiKeyScheme(schemeName, scheme.getName(), location, tag);
    }

    public CredentialKey key() {
        return new CredentialKey(schemeName, CredentialRole.SECRET);
    }

    @Override
    public List<CredentialSlot> slots() {
        return List.of(new CredentialSlot(key(), secretTypeTag));
    }

    @Override
    public void apply(ResolvedCredentials credentials, OutboundRequest request) {
        String value = credentials.require(key());
        if (location == ParameterLocation.QUERY) {
            request.setQueryParam(parameterName, value);
        } else {
            request.setHeader(parameterName, value);
        }
    }
}
