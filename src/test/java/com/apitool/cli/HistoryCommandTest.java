package com.apitool.cli;

import com.apitool.config.ToolEngineProperties;
import com.apitool.dto.response.UserToolSummary;
import com.apitool.model.UserToolStatus;
import com.apitool.model.execution.ExecutionRecord;
import com.apitool.service.api.ToolCatalogService;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HistoryCommandTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

    @Mock
    private ToolCatalogService toolCatalogService;

    private HistoryCommand historyCommand;

    @BeforeEach
    void setUp() {
        historyCommand = new HistoryCommand(toolCatalogService, new ToolEngineProperties());
    }

    @Test
    void executions_shouldShowTheErrorOrHintOfEachRecord() {
        when(toolCatalogService.listExecutions("local-user", "local-org")).thenReturn(List.of(
                ExecutionRecord.builder().toolId("tool-1").statusCode(404).error("External API Error (404): not found").createdAt(NOW).build(),
                ExecutionRecord.builder().toolId("tool-2").statusCode(200).hint("Provide your api key.").createdAt(NOW).build()));

        String output = historyCommand.executions(null, null);

        assertThat(output.split("\n")).hasSize(2);
        assertThat(output).contains("External API Error (404): not found").contains("Provide your api key.");
    }

    @Test
    void executions_withoutHistory_shouldSaySo() {
        when(toolCatalogService.listExecutions("user-2", "org-2")).thenReturn(List.of());

        assertThat(historyCommand.executions("user-2", "org-2")).isEqualTo("No executions recorded.");
    }

    @Test
    void myTools_shouldShowTheWireStatusAndExecutionCounts() {
        when(toolCatalogService.listUserTools("local-user", "local-org")).thenReturn(List.of(
                new UserToolSummary("tool-1", "Get item", "Fetches one item", "acme", "apiKeyHeader", true, "admin",
                        UserToolStatus.ACTIVE, 5, 3, 2, NOW, NOW)));

        String output = historyCommand.myTools(null, null);

        assertThat(output).contains("tool-1").contains("Get item (acme, verified)").contains("active")
                .contains("runs: 5").contains("3 ok").contains("2 failed");
    }

    @Test
    void myTools_withoutLinkedTools_shouldSaySo() {
        when(toolCatalogService.listUserTools("user-2", "org-2")).thenReturn(List.of());

        assertThat(historyCommand.myTools("user-2", "org-2")).isEqualTo("No tools used yet.");
    }
}
