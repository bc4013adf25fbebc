package com.apitool.model.security;

import com.apitool.model.SecuritySecrets;
import com.apitool.model.execution.OutboundRequest;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.springframework.http.HttpHeaders;

/**
 * HTTP basic authentication.
 *
 * @param passwordTypeTag {@code null} when the tool declares no password; an empty password is sent then.
 */
public record BasicScheme(String schemeName, String usernameTypeTag, String passwordTypeTag) implements CredentialScheme {

    static BasicScheme from(String schemeName, SecuritySecrets tags) {
        String username = CredentialScheme.requireTag(tags.username(), "username", schemeName);
        String password = tags.password() == null || tags.password().isBlank() ? null : tags.password();
        return new BasicScheme(schemeName, username, password);
    }

    public CredentialKey usernameKey() {
        return new CredentialKey(schemeName, CredentialRole.USERNAME);
    }

    public CredentialKey passwordKey() {
        return new CredentialKey(schemeName, CredentialRole.PASSWORD);
    }

    @Override
    public List<CredentialSlot> slots() {
        List<CredentialSlot> slots = new ArrayList<>();
        slots.add(new CredentialSlot(usernameKey(), usernameTypeTag));
        if (passwordTypeTag != null) {
            slots.add(new CredentialSlot(passwordKey(), passwordTypeTag));
        }
        return slots;
    }

    /**
     * A missing username also asks for the declared password, since both are entered together.
     */
    @Override
    public List<String> missingSecretTypes(Collection<CredentialKey> unresolved) {
        Set<String> missing = new LinkedHashSet<>();
        if (unresolved.contains(usernameKey())) {
            missing.add(usernameTypeTag);
            if (passwordTypeTag != null) {
                missing.add(passwordTypeTag);
            }
        }
        if (passwordTypeTag != null && unresolved.contains(passwordKey())) {
            missing.add(passwordTypeTag);
        }
        return List.copyOf(missing);
    }

    @Override
    public void apply(ResolvedCredentials credentials, OutboundRequest request) {
        String username = credentials.require(usernameKey());
        String password = passwordTypeTag == null ? "" : credentials.find(passwordKey()).orElse("");
        request.setHeader(HttpHeaders.AUTHORIZATION,
                "Basic " + HttpHeaders.encodeBasicAuth(username, password, StandardCharsets.UTF_8));
    }
}
