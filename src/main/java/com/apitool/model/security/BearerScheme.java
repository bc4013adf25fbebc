package com.apitool.model.security;

import com.apitool.model.SecuritySecrets;
import com.apitool.model.execution.OutboundRequest;
import java.util.List;
import org.springframework.http.HttpHeaders;

public record BearerScheme(String schemeName, String secretTypeTag) implements CredentialScheme {

    static BearerScheme from(String schemeName, SecuritySecrets tags) {
        return new BearerScheme(schemeName, CredentialScheme.requireTag(tags.name(), "name", schemeName));
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
        request.setHeader(HttpHeaders.AUTHORIZATION, "Bearer " + credentials.require(key()));
    }
}
