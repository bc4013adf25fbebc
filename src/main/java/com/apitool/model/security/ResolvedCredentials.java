package com.apitool.model.security;

import com.apitool.exception.RequestBuildException;
import java.util.Map;
import java.util.Optional;

/**
 * Credential values fetched for one invocation, keyed by slot.
 */
public record ResolvedCredentials(Map<CredentialKey, String> values) {

    public ResolvedCredentials {
        values = Map.copyOf(values);
    }

    public static ResolvedCredentials none() {
        return new ResolvedCredentials(Map.of());
    }

    public Optional<String> find(CredentialKey key) {
        return Optional.ofNullable(values.get(key));
    }

    public String require(CredentialKey key) {
        return find(key).orElseThrow(() -> new RequestBuildException("No resolved credential for slot " + key));
    }

    @Override
    public String toString() {
        return "ResolvedCredentials" + values.keySet();
    }
}
