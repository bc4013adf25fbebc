package com.apitool.cli;

import com.apitool.config.ToolEngineProperties;
import com.apitool.dto.request.RegisterToolRequest;
import com.apitool.dto.response.CommandResponse;
import com.apitool.dto.response.ToolInfo;
import com.apitool.dto.response.ToolSummary;
import com.apitool.cli.ui.JsonPrinter;
import com.apitool.exception.ToolEngineException;
import com.apitool.model.CallerIdentity;
import com.apitool.model.ToolDefinition;
import com.apitool.service.api.ToolCatalogService;
import com.apitool.service.api.ToolRegistrationService;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.File;
import java.io.IOException;
import java.util.List;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Shell commands for registering tools and browsing the tool catalogue.
 */
@ShellComponent
public class ToolCommand {

    private final ToolRegistrationService toolRegistrationService;
    private final ToolCatalogService toolCatalogService;
    private final ToolEngineProperties properties;
    private final JsonPrinter jsonPrinter;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public ToolCommand(ToolRegistrationService toolRegistrationService,
                       ToolCatalogService toolCatalogService,
                       ToolEngineProperties properties,
                       JsonPrinter jsonPrinter) {
        this.toolRegistrationService = toolRegistrationService;
        this.toolCatalogService = toolCatalogService;
        this.properties = properties;
        this.jsonPrinter = jsonPrinter;
    }

    /**
     * Registers the tool definition stored in a JSON file.
     * <p>
     * The file holds {@code name}, {@code description}, {@code utilityProvider},
     * {@code openapiSpecification} and, for authenticated tools, {@code securityOption} and
     * {@code securitySecrets}. Every problem found in the definition is listed at once.
     *
     * @param file Path of the tool definition document.
     * @return The new tool id, or the problems that prevented registration.
     */
    @ShellMethod(key = "register-tool", value = "Register a tool from a tool definition JSON file.")
    public String registerTool(@ShellOption(value = {"--file", "-f"}, help = "Path to the tool definition JSON file.") String file) {
        RegisterToolRequest request;
        try {
            request = objectMapper.readValue(new File(file), RegisterToolRequest.class);
        } catch (IOException e) {
            return CommandResponse.error("Could not read tool definition '" + file + "': " + e.getMessage()).toAnsiString();
        }
        CallerIdentity creator = new CallerIdentity(properties.getCaller().getUserId(), properties.getCaller().getOrganizationId());
        try {
            ToolDefinition tool = toolRegistrationService.register(request, creator);
            return CommandResponse.ok("Registered tool '" + tool.getName() + "' with id " + tool.getId()).toAnsiString();
        } catch (ToolEngineException e) {
            StringBuilder message = new StringBuilder("Tool definition rejected:");
            List<String> problems = e.getDetails().isEmpty() ? List.of(e.getMessage()) : e.getDetails();
            problems.forEach(problem -> message.append("\n  - ").append(problem));
            return CommandResponse.error(message.toString()).toAnsiString();
        }
    }

    @ShellMethod(key = "list-tools", value = "List all registered tools.")
    public String listTools() {
        List<ToolSummary> tools = toolCatalogService.listTools();
        if (tools.isEmpty()) {
            return "No tools registered yet. Use 'register-tool --file <path>' first.";
        }
        StringBuilder sb = new StringBuilder();
        for (ToolSummary tool : tools) {
            sb.append(JsonPrinter.ANSI_CYAN).append(tool.id()).append(JsonPrinter.ANSI_RESET)
                    .append("  ").append(tool.name())
                    .append(" - ").append(tool.description())
                    .append("\n");
        }
        return sb.toString().stripTrailing();
    }

    @ShellMethod(key = "tool-info", value = "Show a tool and the input schema it accepts.")
    public String toolInfo(@ShellOption(value = {"--id"}, help = "The id of the tool.") String id) {
        try {
            ToolInfo info = toolCatalogService.getToolInfo(id);
            return jsonPrinter.format(objectMapper.valueToTree(info));
        } catch (ToolEngineException e) {
            return CommandResponse.error(e.getMessage()).toAnsiString();
        }
    }
}
