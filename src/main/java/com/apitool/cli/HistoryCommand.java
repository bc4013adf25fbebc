package com.apitool.cli;

import com.apitool.cli.ui.JsonPrinter;
import com.apitool.config.ToolEngineProperties;
import com.apitool.dto.response.UserToolSummary;
import com.apitool.model.execution.ExecutionRecord;
import com.apitool.service.api.ToolCatalogService;
import java.util.List;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Shell commands over a caller's execution history and tool links.
 */
@ShellComponent
public class HistoryCommand {

    private final ToolCatalogService toolCatalogService;
    private final ToolEngineProperties properties;

    public HistoryCommand(ToolCatalogService toolCatalogService, ToolEngineProperties properties) {
        this.toolCatalogService = toolCatalogService;
        this.properties = properties;
    }

    @ShellMethod(key = "executions", value = "List a caller's tool executions, newest first.")
    public String executions(
            @ShellOption(value = {"--user"}, help = "The user id.", defaultValue = ShellOption.NULL) String user,
            @ShellOption(value = {"--org"}, help = "The organization id.", defaultValue = ShellOption.NULL) String org
    ) {
        List<ExecutionRecord> records = toolCatalogService.listExecutions(userOrDefault(user), orgOrDefault(org));
        if (records.isEmpty()) {
            return "No executions recorded.";
        }
        StringBuilder sb = new StringBuilder();
        for (ExecutionRecord record : records) {
            String color = record.getStatusCode() >= 200 && record.getStatusCode() < 300 ? JsonPrinter.ANSI_GREEN : JsonPrinter.ANSI_RED;
            sb.append(record.getCreatedAt()).append("  ")
                    .append(JsonPrinter.ANSI_CYAN).append(record.getToolId()).append(JsonPrinter.ANSI_RESET).append("  ")
                    .append(color).append(record.getStatusCode()).append(JsonPrinter.ANSI_RESET);
            if (record.getError() != null) {
                sb.append("  ").append(record.getError());
            } else if (record.getHint() != null) {
                sb.append("  ").append(record.getHint());
            }
            sb.append("\n");
        }
        return sb.toString().stripTrailing();
    }

    @ShellMethod(key = "my-tools", value = "List the tools a caller has used, with their status and execution counts.")
    public String myTools(
            @ShellOption(value = {"--user"}, help = "The user id.", defaultValue = ShellOption.NULL) String user,
            @ShellOption(value = {"--org"}, help = "The organization id.", defaultValue = ShellOption.NULL) String org
    ) {
        List<UserToolSummary> tools = toolCatalogService.listUserTools(userOrDefault(user), orgOrDefault(org));
        if (tools.isEmpty()) {
            return "No tools used yet.";
        }
        StringBuilder sb = new StringBuilder();
        for (UserToolSummary tool : tools) {
            sb.append(JsonPrinter.ANSI_CYAN).append(tool.toolId()).append(JsonPrinter.ANSI_RESET)
                    .append("  ").append(tool.name())
                    .append(" (").append(tool.utilityProvider()).append(tool.verified() ? ", verified" : "").append(")")
                    .append("  ").append(tool.status().wireValue())
                    .append("  runs: ").append(tool.totalExecutions())
                    .append(", ").append(JsonPrinter.ANSI_GREEN).append(tool.succeededExecutions()).append(" ok").append(JsonPrinter.ANSI_RESET)
                    .append(", ").append(JsonPrinter.ANSI_RED).append(tool.failedExecutions()).append(" failed").append(JsonPrinter.ANSI_RESET)
                    .append("\n");
        }
        return sb.toString().stripTrailing();
    }

    private String userOrDefault(String user) {
        return user != null ? user : properties.getCaller().getUserId();
    }

    private String orgOrDefault(String org) {
        return org != null ? org : properties.getCaller().getOrganizationId();
    }
}
