package com.apitool.service.api;

import com.apitool.dto.response.ToolInfo;
import com.apitool.dto.response.ToolSummary;
import com.apitool.dto.response.UserToolSummary;
import com.apitool.model.execution.ExecutionRecord;
import java.util.List;

/**
 * Read-only views over registered tools and the audit trail.
 */
public interface ToolCatalogService {

    List<ToolSummary> listTools();

    /**
     * @param toolId The id of the tool.
     * @return The tool with its derived input schema.
     * @throws com.apitool.exception.ToolNotFoundException if no tool has that id.
     */
    ToolInfo getToolInfo(String toolId);

    List<ExecutionRecord> listExecutions(String userId, String organizationId);

    /**
     * Lists the tools a caller has linked, leaving out links marked {@code deleted}.
     *
     * @param userId         The id of the calling user.
     * @param organizationId The id of the calling user's organization.
     * @return One summary per linked tool, with the caller's execution counts for it.
     */
    List<UserToolSummary> listUserTools(String userId, String organizationId);
}
