package com.apitool.model.security;

import com.apitool.model.execution.SetupNeeded;

/**
 * Outcome of checking a tool's prerequisites for one caller.
 */
public sealed interface CredentialResolution permits CredentialResolution.Ready, CredentialResolution.SetupRequired {

    static Ready notRequired() {
        return new Ready(null, ResolvedCredentials.none());
    }

    /**
     * Every slot resolved. {@code scheme} is {@code null} for unauthenticated tools.
     */
    record Ready(CredentialScheme scheme, ResolvedCredentials credentials) implements CredentialResolution {
    }

    record SetupRequired(SetupNeeded setupNeeded) implements CredentialResolution {
    }
}
