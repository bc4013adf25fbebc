package com.apitool.model.execution;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * The caller must provide secrets or complete an authorization before the tool can run.
 * This is a valid terminal outcome, not an error.
 *
 * @param requiredSecretInputs        Secret-type tags still missing; empty for configuration problems.
 * @param requiredActionConfirmations Always empty, kept for envelope compatibility.
 * @param oauthUrl                    Where to authorize, for OAuth2 tools only.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SetupNeeded(
        String utilityProvider,
        String title,
        String description,
        String message,
        List<String> requiredSecretInputs,
        List<String> requiredActionConfirmations,
        String oauthUrl) implements ExecutionOutcome {

    public SetupNeeded {
        requiredSecretInputs = requiredSecretInputs == null ? List.of() : List.copyOf(requiredSecretInputs);
        requiredActionConfirmations = requiredActionConfirmations == null ? List.of() : List.copyOf(requiredActionConfirmations);
    }

    @JsonProperty("needsSetup")
    public boolean needsSetup() {
        return true;
    }

    @Override
    public ExecutionStage stage() {
        return ExecutionStage.SETUP_NEEDED;
    }

    @Override
    public int statusCode() {
        return 200;
    }
}
