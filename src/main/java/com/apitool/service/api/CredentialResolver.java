package com.apitool.service.api;

import com.apitool.model.ApiOperation;
import com.apitool.model.CallerIdentity;
import com.apitool.model.ToolDefinition;
import com.apitool.model.security.CredentialResolution;

/**
 * Resolves the credentials a tool needs for a given caller.
 */
public interface CredentialResolver {

    /**
     * Looks up every credential slot of the tool's security scheme.
     *
     * @param tool      The tool being invoked.
     * @param operation The tool's normalized operation, carrying the declared security schemes.
     * @param caller    The user and organization whose secrets are used.
     * @return {@link CredentialResolution.Ready} with the resolved values, or
     *         {@link CredentialResolution.SetupRequired} when the caller must supply something first.
     * @throws com.apitool.exception.MisconfiguredToolException if the security option names a missing
     *         or referenced scheme.
     * @throws com.apitool.exception.UnsupportedSchemeException if the scheme type is not implemented.
     */
    CredentialResolution resolve(ToolDefinition tool, ApiOperation operation, CallerIdentity caller);
}
