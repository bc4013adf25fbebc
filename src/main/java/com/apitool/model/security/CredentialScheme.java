package com.apitool.model.security;

import com.apitool.exception.MisconfiguredToolException;
import com.apitool.exception.UnsupportedSchemeException;
import com.apitool.model.SecuritySecrets;
import com.apitool.model.execution.OutboundRequest;
import io.swagger.v3.oas.models.security.SecurityScheme;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * The security schemes a tool may use, each variant carrying only the fields it needs.
 * <p>
 * A variant knows which credential slots it requires from the secret store, how to report
 * the secret-type tags that are still missing, and how to inject resolved values into an
 * {@link OutboundRequest}.
 */
public sealed interface CredentialScheme permits ApiKeyScheme, BearerScheme, BasicScheme, OAuth2Scheme {

    String schemeName();

    /**
     * @return the slots to resolve through the secret store; empty for OAuth2.
     */
    List<CredentialSlot> slots();

    /**
     * @param unresolved keys of slots whose lookup came back empty or failed
     * @return the secret-type tags the caller must provide, without duplicates
     */
    default List<String> missingSecretTypes(Collection<CredentialKey> unresolved) {
        return slots().stream()
                .filter(slot -> unresolved.contains(slot.key()))
                .map(CredentialSlot::secretTypeTag)
                .distinct()
                .toList();
    }

    void apply(ResolvedCredentials credentials, OutboundRequest request);

    /**
     * Maps a declared OpenAPI security scheme onto its variant.
     *
     * @throws MisconfiguredToolException when the scheme or the tool's secrets lack a required field
     * @throws UnsupportedSchemeException when the type or scheme combination is not implemented
     */
    static CredentialScheme of(String schemeName, SecurityScheme scheme, SecuritySecrets secrets, String utilityProvider) {
        if (scheme.getType() == null) {
            throw new UnsupportedSchemeException("Security scheme '" + schemeName + "' declares no type.");
        }
        SecuritySecrets tags = secrets == null ? SecuritySecrets.none() : secrets;
        return switch (scheme.getType()) {
            case APIKEY -> ApiKeyScheme.from(schemeName, scheme, tags);
            case HTTP -> httpScheme(schemeName, scheme, tags);
            case OAUTH2 -> OAuth2Scheme.from(schemeName, scheme, utilityProvider);
            default -> throw new UnsupportedSchemeException(
                    "Security scheme type '" + scheme.getType() + "' of '" + schemeName + "' is not supported.");
        };
    }

    private static CredentialScheme httpScheme(String schemeName, SecurityScheme scheme, SecuritySecrets tags) {
        String httpScheme = scheme.getScheme() == null ? "" : scheme.getScheme().trim().toLowerCase(Locale.ROOT);
        return switch (httpScheme) {
            case "bearer" -> BearerScheme.from(schemeName, tags);
            case "basic" -> BasicScheme.from(schemeName, tags);
            default -> throw new UnsupportedSchemeException(
                    "HTTP authentication scheme '" + scheme.getScheme() + "' of '" + schemeName + "' is not supported.");
        };
    }

    static String requireTag(String tag, String role, String schemeName) {
        if (tag == null || tag.isBlank()) {
            throw new MisconfiguredToolException(
                    "securitySecrets." + role + " is required by security scheme '" + schemeName + "'.");
        }
        return tag;
    }
}
