package com.apitool.service.impl;

import com.apitool.dto.response.ToolExecutionResponse;
import com.apitool.exception.ErrorKind;
import com.apitool.exception.InvalidSpecException;
import com.apitool.exception.ToolEngineException;
import com.apitool.model.ApiOperation;
import com.apitool.model.CallerIdentity;
import com.apitool.model.ToolDefinition;
import com.apitool.model.UserToolStatus;
import com.apitool.model.execution.DerivedInputSchema;
import com.apitool.model.execution.ExecutionOutcome;
import com.apitool.model.execution.ExecutionRecord;
import com.apitool.model.execution.ExecutionStage;
import com.apitool.model.execution.Failed;
import com.apitool.model.execution.OutboundRequest;
import com.apitool.model.execution.SetupNeeded;
import com.apitool.model.execution.Succeeded;
import com.apitool.model.execution.ValidationResult;
import com.apitool.model.security.CredentialResolution;
import com.apitool.service.api.CredentialResolver;
import com.apitool.service.api.InputValidator;
import com.apitool.service.api.RequestBuilder;
import com.apitool.service.api.SchemaDeriver;
import com.apitool.service.api.SpecNormalizer;
import com.apitool.service.api.ToolExecutionService;
import com.apitool.service.api.ToolInvoker;
import com.apitool.service.api.ToolStateService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Sequences one tool invocation: {@code VALIDATING -> CHECKING_PREREQUISITES -> INVOKING}, ending
 * in {@code SUCCEEDED}, {@code SETUP_NEEDED} or {@code FAILED}.
 * <p>
 * Each branch produces its terminal {@link ExecutionOutcome} once; a single audit write follows.
 * Audit and user-tool bookkeeping failures are logged and never replace the outcome.
 */
@Service
@Slf4j
public class ToolExecutionServiceImpl implements ToolExecutionService {

    static final String VALIDATION_ERROR_MESSAGE = "Input validation failed.";
    static final String SCHEMA_FAILURE_MESSAGE = "Schema Derivation Failed: Could not create validation schema from OpenAPI specification.";

    private final ToolStateService toolStateService;
    private final SpecNormalizer specNormalizer;
    private final SchemaDeriver schemaDeriver;
    private final InputValidator inputValidator;
    private final CredentialResolver credentialResolver;
    private final RequestBuilder requestBuilder;
    private final ToolInvoker toolInvoker;
    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    public ToolExecutionServiceImpl(ToolStateService toolStateService,
                                    SpecNormalizer specNormalizer,
                                    SchemaDeriver schemaDeriver,
                                    InputValidator inputValidator,
                                    CredentialResolver credentialResolver,
                                    RequestBuilder requestBuilder,
                                    ToolInvoker toolInvoker) {
        this.toolStateService = toolStateService;
        this.specNormalizer = specNormalizer;
        this.schemaDeriver = schemaDeriver;
        this.inputValidator = inputValidator;
        this.credentialResolver = credentialResolver;
        this.requestBuilder = requestBuilder;
        this.toolInvoker = toolInvoker;
    }

    @Override
    public ExecutionOutcome execute(String toolId, CallerIdentity caller, String conversationId, Map<String, Object> params) {
        String logPrefix = String.format("[Tool %s] User: %s", toolId, caller.userId());
        log.info("{} Execution requested.", logPrefix);
        linkUserTool(caller, toolId, logPrefix);

        ToolDefinition tool;
        try {
            tool = toolStateService.getToolById(toolId);
        } catch (RuntimeException e) {
            log.error("{} Could not load tool definition.", logPrefix, e);
            return new Failed(ErrorKind.ORCHESTRATION_ERROR, 500, "Failed to load tool definition.",
                    TextNode.valueOf(String.valueOf(e.getMessage())), null);
        }
        if (tool == null) {
            log.warn("{} Tool not found.", logPrefix);
            return new Failed(ErrorKind.TOOL_NOT_FOUND, ErrorKind.TOOL_NOT_FOUND.defaultStatus(),
                    "Tool not found: " + toolId, null, "Check the tool id with the tool catalogue.");
        }

        Map<String, Object> input = params == null ? Map.of() : params;
        ExecutionOutcome outcome = runPipeline(tool, caller, input, logPrefix);
        log.info("{} Finished in stage {} with status {}.", logPrefix, outcome.stage(), outcome.statusCode());

        audit(tool, caller, conversationId, input, outcome, logPrefix);
        if (outcome instanceof Succeeded) {
            markActive(caller, toolId, logPrefix);
        }
        return outcome;
    }

    private ExecutionOutcome runPipeline(ToolDefinition tool, CallerIdentity caller, Map<String, Object> input, String logPrefix) {
        ExecutionStage stage = ExecutionStage.VALIDATING;
        try {
            ApiOperation operation = specNormalizer.normalize(tool.getOpenapiSpecification());
            DerivedInputSchema schema = schemaDeriver.derive(operation);
            if (schema.isDegraded()) {
                log.error("{} {}", logPrefix, schema.failure());
                throw new InvalidSpecException(SCHEMA_FAILURE_MESSAGE);
            }
            ValidationResult validation = inputValidator.validate(schema, input);
            if (!validation.isValid()) {
                return validationFailure(validation, logPrefix);
            }

            stage = ExecutionStage.CHECKING_PREREQUISITES;
            log.info("{} Input valid, checking prerequisites.", logPrefix);
            CredentialResolution resolution = credentialResolver.resolve(tool, operation, caller);
            if (resolution instanceof CredentialResolution.SetupRequired setupRequired) {
                SetupNeeded setupNeeded = setupRequired.setupNeeded();
                log.info("{} Setup needed: {}", logPrefix, setupNeeded.requiredSecretInputs());
                return setupNeeded;
            }

            stage = ExecutionStage.INVOKING;
            OutboundRequest request = requestBuilder.build(operation, validation.validatedParams(),
                    (CredentialResolution.Ready) resolution);
            return toolInvoker.invoke(request);
        } catch (ToolEngineException e) {
            log.error("{} {} during {}: {}", logPrefix, e.getKind(), stage, e.getMessage());
            return Failed.from(e);
        } catch (RuntimeException e) {
            log.error("{} Unexpected failure during {}.", logPrefix, stage, e);
            return new Failed(ErrorKind.ORCHESTRATION_ERROR, 500, "Tool execution failed unexpectedly.",
                    TextNode.valueOf(String.valueOf(e.getMessage())), null);
        }
    }

    private Failed validationFailure(ValidationResult validation, String logPrefix) {
        if (validation.processFailure() != null) {
            log.error("{} {}", logPrefix, validation.processFailure());
            return new Failed(ErrorKind.VALIDATION_ERROR, 500, validation.processFailure(), null, null);
        }
        log.info("{} Input validation failed with {} issue(s).", logPrefix, validation.issues().size());
        return new Failed(ErrorKind.VALIDATION_ERROR, ErrorKind.VALIDATION_ERROR.defaultStatus(), VALIDATION_ERROR_MESSAGE,
                objectMapper.valueToTree(validation.issues()),
                "Correct the listed parameters using the tool's input schema and call the tool again.");
    }

    private void audit(ToolDefinition tool, CallerIdentity caller, String conversationId,
                       Map<String, Object> input, ExecutionOutcome outcome, String logPrefix) {
        try {
            Instant now = Instant.now();
            ExecutionRecord.ExecutionRecordBuilder record = ExecutionRecord.builder()
                    .id(UUID.randomUUID().toString())
                    .toolId(tool.getId())
                    .userId(caller.userId())
                    .organizationId(caller.organizationId())
                    .conversationId(conversationId)
                    .input(objectMapper.valueToTree(input))
                    .output(objectMapper.valueToTree(ToolExecutionResponse.from(outcome, objectMapper)))
                    .statusCode(outcome.statusCode())
                    .createdAt(now)
                    .updatedAt(now);
            if (outcome instanceof Failed failed) {
                record.error(failed.error())
                        .errorDetails(failed.details() == null ? null : failed.details().toString())
                        .hint(failed.hint());
            } else if (outcome instanceof SetupNeeded setupNeeded) {
                record.hint(setupNeeded.description());
            }
            toolStateService.recordExecution(record.build());
        } catch (RuntimeException e) {
            log.error("{} Failed to record execution; the outcome is returned unchanged.", logPrefix, e);
        }
    }

    private void linkUserTool(CallerIdentity caller, String toolId, String logPrefix) {
        try {
            toolStateService.getOrCreateUserToolLink(caller.userId(), caller.organizationId(), toolId);
        } catch (RuntimeException e) {
            log.error("{} Could not link user to tool.", logPrefix, e);
        }
    }

    private void markActive(CallerIdentity caller, String toolId, String logPrefix) {
        try {
            toolStateService.updateUserToolStatus(caller.userId(), caller.organizationId(), toolId, UserToolStatus.ACTIVE);
        } catch (RuntimeException e) {
            log.error("{} Could not update user tool status.", logPrefix, e);
        }
    }
}
