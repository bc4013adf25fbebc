package com.apitool.cli;

import com.apitool.config.ToolEngineProperties;
import com.apitool.dto.request.SetSecretRequest;
import com.apitool.dto.response.CommandResponse;
import com.apitool.model.CallerIdentity;
import com.apitool.model.SecretType;
import com.apitool.model.security.SecretKey;
import com.apitool.service.api.SecretStore;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * A Spring Shell component for storing the secrets that tools need.
 * <p>
 * This is how a user completes the setup that a {@code run-tool} call asked for.
 */
@ShellComponent
@Slf4j
public class SecretCommand {

    private final SecretStore secretStore;
    private final ToolEngineProperties properties;

    public SecretCommand(SecretStore secretStore, ToolEngineProperties properties) {
        this.secretStore = secretStore;
        this.properties = properties;
    }

    /**
     * Stores one secret, encrypted, for the given caller.
     *
     * @param provider The utility provider of the tool, e.g. "github".
     * @param type     The secret-type tag, e.g. "api key".
     * @param value    The secret itself.
     * @param user     The owning user; defaults to {@code tool-engine.caller.user-id}.
     * @param org      The owning organization; defaults to {@code tool-engine.caller.organization-id}.
     * @return A colored confirmation or error message.
     */
    @ShellMethod(key = "set-secret", value = "Store a secret used by tools of a provider.")
    public String setSecret(
            @ShellOption(value = {"--provider", "-p"}, help = "The utility provider, e.g. 'github'.") String provider,
            @ShellOption(value = {"--type", "-t"}, help = "The secret type, e.g. 'api key'.") String type,
            @ShellOption(value = {"--value"}, help = "The secret value.") String value,
            @ShellOption(value = {"--user"}, help = "The owning user id.", defaultValue = ShellOption.NULL) String user,
            @ShellOption(value = {"--org"}, help = "The owning organization id.", defaultValue = ShellOption.NULL) String org
    ) {
        var request = new SetSecretRequest(
                provider.trim().toLowerCase(Locale.ROOT),
                type.trim().toLowerCase(Locale.ROOT),
                value,
                user != null ? user : properties.getCaller().getUserId(),
                org != null ? org : properties.getCaller().getOrganizationId());

        if (SecretType.fromTag(request.secretType()).isEmpty()) {
            return CommandResponse.error("Unknown secret type '" + request.secretType() + "'. Expected one of: "
                    + String.join(", ", SecretType.tags())).toAnsiString();
        }
        if (request.value() == null || request.value().isEmpty()) {
            return CommandResponse.error("The secret value must not be empty.").toAnsiString();
        }

        log.debug("Storing {}", request);
        CallerIdentity owner = new CallerIdentity(request.userId(), request.organizationId());
        secretStore.setSecret(SecretKey.forClient(owner, request.providerTag(), request.secretType()), request.value());
        return CommandResponse.ok("Stored '" + request.secretType() + "' for provider '" + request.providerTag() + "'.").toAnsiString();
    }
}
