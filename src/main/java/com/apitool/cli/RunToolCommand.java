package com.apitool.cli;

import com.apitool.cli.ui.JsonPrinter;
import com.apitool.cli.ui.Spinner;
import com.apitool.config.ToolEngineProperties;
import com.apitool.dto.response.CommandResponse;
import com.apitool.dto.response.ToolExecutionResponse;
import com.apitool.model.CallerIdentity;
import com.apitool.model.execution.ExecutionOutcome;
import com.apitool.service.api.ToolExecutionService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.slf4j.LoggerFactory;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * A Spring Shell component that invokes a registered tool, the way an agent would.
 * <p>
 * The result is printed as the caller-facing envelope: {@code success} with the upstream data,
 * {@code success} with a setup request, or a classified error with details and a hint.
 */
@ShellComponent
public class RunToolCommand {

    private final ToolExecutionService toolExecutionService;
    private final ToolEngineProperties properties;
    private final Spinner spinner;
    private final JsonPrinter jsonPrinter;
    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    public RunToolCommand(ToolExecutionService toolExecutionService,
                          ToolEngineProperties properties,
                          Spinner spinner,
                          JsonPrinter jsonPrinter) {
        this.toolExecutionService = toolExecutionService;
        this.properties = properties;
        this.spinner = spinner;
        this.jsonPrinter = jsonPrinter;
    }

    /**
     * Executes a tool with the given parameters as the configured caller.
     *
     * @param id           The id of the tool.
     * @param params       The parameters as a JSON object, e.g. {@code '{"itemId": 42}'}.
     * @param conversation An optional conversation id stored with the execution record.
     * @param verbose      If true, enables debug logging for the duration of the call.
     * @return The colorized result envelope.
     */
    @ShellMethod(key = "run-tool", value = "Execute a registered tool with JSON parameters.")
    public String runTool(
            @ShellOption(value = {"--id"}, help = "The id of the tool.") String id,
            @ShellOption(value = {"--params", "-p"}, help = "Parameters as a JSON object.", defaultValue = "{}") String params,
            @ShellOption(value = {"--conversation", "-c"}, help = "Conversation id to record.", defaultValue = ShellOption.NULL) String conversation,
            @ShellOption(value = {"--verbose", "-v"}, help = "Enable verbose debug logging.", defaultValue = "false", arity = 0) boolean verbose
    ) {
        Map<String, Object> input;
        try {
            input = objectMapper.readValue(params, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            return CommandResponse.error("--params must be a JSON object: " + e.getOriginalMessage()).toAnsiString();
        }

        ch.qos.logback.classic.Logger rootLogger = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        ch.qos.logback.classic.Level originalLevel = rootLogger.getLevel();
        if (verbose) {
            rootLogger.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }
        try {
            CallerIdentity caller = new CallerIdentity(properties.getCaller().getUserId(), properties.getCaller().getOrganizationId());
            ExecutionOutcome outcome = spinner.spin("Calling tool...",
                    () -> toolExecutionService.execute(id, caller, conversation, input == null ? Map.of() : input));
            ToolExecutionResponse response = ToolExecutionResponse.from(outcome, objectMapper);
            return jsonPrinter.format(objectMapper.valueToTree(response));
        } catch (RuntimeException e) {
            return CommandResponse.error("An error occurred: " + e.getMessage()).toAnsiString();
        } finally {
            if (verbose) {
                rootLogger.setLevel(originalLevel);
            }
        }
    }
}
