package com.apitool.service.impl;

import com.apitool.dto.response.ToolInfo;
import com.apitool.dto.response.ToolSummary;
import com.apitool.dto.response.UserToolSummary;
import com.apitool.exception.ToolEngineException;
import com.apitool.exception.ToolNotFoundException;
import com.apitool.model.ToolDefinition;
import com.apitool.model.UserToolLink;
import com.apitool.model.UserToolStatus;
import com.apitool.model.execution.DerivedInputSchema;
import com.apitool.model.execution.ExecutionRecord;
import com.apitool.service.api.SchemaDeriver;
import com.apitool.service.api.SpecNormalizer;
import com.apitool.service.api.ToolCatalogService;
import com.apitool.service.api.ToolStateService;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class ToolCatalogServiceImpl implements ToolCatalogService {

    static final String INVALID_OPERATION_MESSAGE = "Schema derivation failed due to invalid operation in OpenAPI spec";

    private final ToolStateService toolStateService;
    private final SpecNormalizer specNormalizer;
    private final SchemaDeriver schemaDeriver;

    public ToolCatalogServiceImpl(ToolStateService toolStateService, SpecNormalizer specNormalizer, SchemaDeriver schemaDeriver) {
        this.toolStateService = toolStateService;
        this.specNormalizer = specNormalizer;
        this.schemaDeriver = schemaDeriver;
    }

    /**
     * @return A summary of every registered tool, in storage order.
     */
    @Override
    public List<ToolSummary> listTools() {
        return toolStateService.listTools().stream()
                .map(tool -> new ToolSummary(tool.getId(), tool.getName(), tool.getDescription()))
                .toList();
    }

    /**
     * {@inheritDoc}
     * <p>
     * An invalid tool document does not fail the lookup; the schema is replaced by an empty
     * object schema whose description says why.
     */
    @Override
    public ToolInfo getToolInfo(String toolId) {
        ToolDefinition tool = toolStateService.getToolById(toolId);
        if (tool == null) {
            throw new ToolNotFoundException(toolId);
        }
        return new ToolInfo(tool.getId(), tool.getName(), tool.getDescription(), tool.getUtilityProvider(),
                deriveSchema(tool).schema());
    }

    /**
     * @param userId         The id of the calling user.
     * @param organizationId The id of the calling user's organization.
     * @return The caller's execution records, newest first.
     */
    @Override
    public List<ExecutionRecord> listExecutions(String userId, String organizationId) {
        return toolStateService.listExecutions(userId, organizationId);
    }

    /**
     * {@inheritDoc}
     * <p>
     * Links whose tool no longer exists are skipped. Counts cover only the caller's own executions.
     */
    @Override
    public List<UserToolSummary> listUserTools(String userId, String organizationId) {
        Map<String, List<ExecutionRecord>> executionsByTool = toolStateService.listExecutions(userId, organizationId).stream()
                .filter(record -> record.getToolId() != null)
                .collect(Collectors.groupingBy(ExecutionRecord::getToolId));

        List<UserToolSummary> summaries = new ArrayList<>();
        for (UserToolLink link : toolStateService.listUserToolLinks(userId, organizationId)) {
            if (link.getStatus() == UserToolStatus.DELETED) {
                continue;
            }
            ToolDefinition tool = toolStateService.getToolById(link.getToolId());
            if (tool == null) {
                log.warn("User {} is linked to unknown tool {}; skipping it.", userId, link.getToolId());
                continue;
            }
            summaries.add(summarize(link, tool, executionsByTool.getOrDefault(link.getToolId(), List.of())));
        }
        return summaries;
    }

    private static UserToolSummary summarize(UserToolLink link, ToolDefinition tool, List<ExecutionRecord> executions) {
        long succeeded = executions.stream().filter(record -> record.getStatusCode() >= 200 && record.getStatusCode() < 300).count();
        long failed = executions.stream().filter(record -> record.getStatusCode() >= 400).count();
        return new UserToolSummary(tool.getId(), tool.getName(), tool.getDescription(), tool.getUtilityProvider(),
                tool.getSecurityOption(), tool.isVerified(), tool.getCreatorUserId(), link.getStatus(),
                executions.size(), succeeded, failed, link.getCreatedAt(), link.getUpdatedAt());
    }

    private DerivedInputSchema deriveSchema(ToolDefinition tool) {
        try {
            return schemaDeriver.derive(specNormalizer.normalize(tool.getOpenapiSpecification()));
        } catch (ToolEngineException e) {
            log.warn("Tool {} has an invalid OpenAPI document: {}", tool.getId(), e.getMessage());
            return DerivedInputSchema.degraded(INVALID_OPERATION_MESSAGE);
        }
    }
}
