package com.apitool.model.security;

import com.apitool.exception.MisconfiguredToolException;
import com.apitool.model.execution.OutboundRequest;
import io.swagger.v3.oas.models.security.OAuthFlow;
import io.swagger.v3.oas.models.security.OAuthFlows;
import io.swagger.v3.oas.models.security.SecurityScheme;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;
import org.springframework.http.HttpHeaders;

/**
 * OAuth2: the access token comes from the OAuth status collaborator, not the secret store.
 *
 * @param provider The tool's utility provider, passed to the collaborator.
 * @param scopes   Union of the scopes of every declared flow.
 */
public record OAuth2Scheme(String schemeName, String provider, List<String> scopes) implements CredentialScheme {

    static OAuth2Scheme from(String schemeName, SecurityScheme scheme, String utilityProvider) {
        if (utilityProvider == null || utilityProvider.isBlank()) {
            throw new MisconfiguredToolException("oauth2 scheme '" + schemeName + "' requires a utility provider on the tool.");
        }
        Set<String> scopes = new LinkedHashSet<>();
        OAuthFlows flows = scheme.getFlows();
        if (flows != null) {
            Stream.of(flows.getAuthorizationCode(), flows.getClientCredentials(), flows.getImplicit(), flows.getPassword())
                    .filter(flow -> flow != null && flow.getScopes() != null)
                    .map(OAuthFlow::getScopes)
                    .forEach(declared -> scopes.addAll(declared.keySet()));
        }
        return new OAuth2Scheme(schemeName, utilityProvider, new ArrayList<>(scopes));
    }

    public CredentialKey tokenKey() {
        return new CredentialKey(schemeName, CredentialRole.ACCESS_TOKEN);
    }

    @Override
    public List<CredentialSlot> slots() {
        return List.of();
    }

    @Override
    public void apply(ResolvedCredentials credentials, OutboundRequest request) {
        request.setHeader(HttpHeaders.AUTHORIZATION, "Bearer " + credentials.require(tokenKey()));
    }
}
