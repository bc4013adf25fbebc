package com.apitool.service.api;

import com.apitool.model.ToolDefinition;
import com.apitool.model.UserToolLink;
import com.apitool.model.UserToolStatus;
import com.apitool.model.execution.ExecutionRecord;
import java.util.List;

/**
 * An interface defining the contract for persisting tool definitions, user-tool links and the
 * execution audit trail, abstracting the underlying storage mechanism.
 */
public interface ToolStateService {

    /**
     * Retrieves a tool by its id.
     *
     * @param toolId The id of the tool.
     * @return The tool, or {@code null} if none is registered under that id.
     */
    ToolDefinition getToolById(String toolId);

    /**
     * Saves or replaces a tool definition.
     *
     * @param tool The tool to persist; its id must be set.
     * @return The persisted tool.
     */
    ToolDefinition saveTool(ToolDefinition tool);

    List<ToolDefinition> listTools();

    /**
     * Appends an execution record. Records are never updated or deleted.
     *
     * @param record The record to append.
     * @return The stored record.
     */
    ExecutionRecord recordExecution(ExecutionRecord record);

    /**
     * @return the caller's execution records, newest first
     */
    List<ExecutionRecord> listExecutions(String userId, String organizationId);

    /**
     * Returns the link between a caller and a tool, creating it with status {@code unset} if absent.
     */
    UserToolLink getOrCreateUserToolLink(String userId, String organizationId, String toolId);

    void updateUserToolStatus(String userId, String organizationId, String toolId, UserToolStatus status);

    List<UserToolLink> listUserToolLinks(String userId, String organizationId);
}
