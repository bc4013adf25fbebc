package com.apitool.service.impl;

import com.apitool.dto.response.ToolInfo;
import com.apitool.dto.response.ToolSummary;
import com.apitool.dto.response.UserToolSummary;
import com.apitool.exception.ToolNotFoundException;
import com.apitool.model.ToolDefinition;
import com.apitool.model.UserToolLink;
import com.apitool.model.UserToolStatus;
import com.apitool.model.execution.ExecutionRecord;
import com.apitool.service.api.ToolStateService;
import com.apitool.support.TestSpecs;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ToolCatalogServiceImplTest {

    @Mock
    private ToolStateService toolStateService;

    private ToolCatalogServiceImpl toolCatalogService;

    @BeforeEach
    void setUp() {
        toolCatalogService = new ToolCatalogServiceImpl(toolStateService, new SpecNormalizerImpl(), new SchemaDeriverImpl());
    }

    @Test
    void listTools_shouldSummarizeEveryTool() {
        when(toolStateService.listTools()).thenReturn(List.of(
                tool("t1", TestSpecs.load(TestSpecs.CREATE_RECORD)),
                tool("t2", TestSpecs.load(TestSpecs.ITEMS_API))));

        assertThat(toolCatalogService.listTools()).containsExactly(
                new ToolSummary("t1", "Tool t1", "Description of t1"),
                new ToolSummary("t2", "Tool t2", "Description of t2"));
    }

    @Test
    void getToolInfo_shouldIncludeTheDerivedInputSchema() {
        when(toolStateService.getToolById("t1")).thenReturn(tool("t1", TestSpecs.load(TestSpecs.CREATE_RECORD)));

        ToolInfo info = toolCatalogService.getToolInfo("t1");

        assertThat(info.utilityProvider()).isEqualTo("records");
        assertThat(info.schema().path("properties").has("a")).isTrue();
        assertThat(info.schema().path("required").toString()).contains("\"a\"");
    }

    @Test
    void getToolInfo_withInvalidDocument_shouldReturnAnAnnotatedEmptySchema() {
        ObjectNode spec = TestSpecs.load(TestSpecs.CREATE_RECORD);
        spec.remove("servers");
        when(toolStateService.getToolById("t1")).thenReturn(tool("t1", spec));

        ToolInfo info = toolCatalogService.getToolInfo("t1");

        assertThat(info.schema().path("properties").isEmpty()).isTrue();
        assertThat(info.schema().path("description").asText()).isEqualTo(ToolCatalogServiceImpl.INVALID_OPERATION_MESSAGE);
    }

    @Test
    void getToolInfo_withUnknownId_shouldThrow() {
        when(toolStateService.getToolById("missing")).thenReturn(null);

        assertThatThrownBy(() -> toolCatalogService.getToolInfo("missing")).isInstanceOf(ToolNotFoundException.class);
    }

    @Test
    void listUserTools_shouldCountTheCallersExecutionsPerTool() {
        when(toolStateService.listUserToolLinks("user-1", "org-1")).thenReturn(List.of(
                link("t1", UserToolStatus.ACTIVE),
                link("t2", UserToolStatus.UNSET)));
        when(toolStateService.listExecutions("user-1", "org-1")).thenReturn(List.of(
                execution("t1", 200),
                execution("t1", 201),
                execution("t1", 404),
                execution("t1", 500),
                execution("t1", 302)));
        ToolDefinition verified = tool("t1", TestSpecs.load(TestSpecs.ITEMS_API)).toBuilder()
                .securityOption("apiKeyHeader")
                .verified(true)
                .creatorUserId("admin")
                .build();
        when(toolStateService.getToolById("t1")).thenReturn(verified);
        when(toolStateService.getToolById("t2")).thenReturn(tool("t2", TestSpecs.load(TestSpecs.CREATE_RECORD)));

        List<UserToolSummary> summaries = toolCatalogService.listUserTools("user-1", "org-1");

        assertThat(summaries).hasSize(2);
        UserToolSummary first = summaries.get(0);
        assertThat(first.toolId()).isEqualTo("t1");
        assertThat(first.name()).isEqualTo("Tool t1");
        assertThat(first.utilityProvider()).isEqualTo("records");
        assertThat(first.securityOption()).isEqualTo("apiKeyHeader");
        assertThat(first.verified()).isTrue();
        assertThat(first.creatorUserId()).isEqualTo("admin");
        assertThat(first.status()).isEqualTo(UserToolStatus.ACTIVE);
        assertThat(first.totalExecutions()).isEqualTo(5);
        assertThat(first.succeededExecutions()).isEqualTo(2);
        assertThat(first.failedExecutions()).isEqualTo(2);

        UserToolSummary second = summaries.get(1);
        assertThat(second.toolId()).isEqualTo("t2");
        assertThat(second.totalExecutions()).isZero();
        assertThat(second.succeededExecutions()).isZero();
        assertThat(second.failedExecutions()).isZero();
    }

    @Test
    void listUserTools_shouldLeaveOutDeletedLinksAndUnknownTools() {
        when(toolStateService.listUserToolLinks("user-1", "org-1")).thenReturn(List.of(
                link("t1", UserToolStatus.DELETED),
                link("gone", UserToolStatus.ACTIVE),
                link("t3", UserToolStatus.ACTIVE)));
        when(toolStateService.listExecutions("user-1", "org-1")).thenReturn(List.of(execution("t1", 200)));
        when(toolStateService.getToolById("gone")).thenReturn(null);
        when(toolStateService.getToolById("t3")).thenReturn(tool("t3", TestSpecs.load(TestSpecs.CREATE_RECORD)));

        List<UserToolSummary> summaries = toolCatalogService.listUserTools("user-1", "org-1");

        assertThat(summaries).extracting(UserToolSummary::toolId).containsExactly("t3");
    }

    private static UserToolLink link(String toolId, UserToolStatus status) {
        Instant now = Instant.parse("2026-01-01T10:00:00Z");
        return new UserToolLink("user-1", "org-1", toolId, status, now, now);
    }

    private static ExecutionRecord execution(String toolId, int statusCode) {
        return ExecutionRecord.builder().toolId(toolId).userId("user-1").organizationId("org-1").statusCode(statusCode).build();
    }

    private static ToolDefinition tool(String id, JsonNode spec) {
        return ToolDefinition.builder()
                .id(id)
                .name("Tool " + id)
                .description("Description of " + id)
                .utilityProvider("records")
                .openapiSpecification(spec)
                .build();
    }
}
