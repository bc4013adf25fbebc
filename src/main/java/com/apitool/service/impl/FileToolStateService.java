package com.apitool.service.impl;

import com.apitool.config.ToolEngineProperties;
import com.apitool.model.ToolDefinition;
import com.apitool.model.UserToolLink;
import com.apitool.model.UserToolStatus;
import com.apitool.model.execution.ExecutionRecord;
import com.apitool.service.api.ToolStateService;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.annotation.PostConstruct;
import java.io.File;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * A file-based implementation of {@link ToolStateService}.
 * <p>
 * Tool definitions, user-tool links and execution records live in memory and are written to
 * {@code state.json} under {@code tool-engine.state.directory} after every change. Execution
 * records are only ever appended.
 */
@Service
@Slf4j
public class FileToolStateService implements ToolStateService {

    static final String STATE_FILE_NAME = "state.json";

    private final JsonStateFile stateFile;
    private final Map<String, ToolDefinition> tools = new ConcurrentHashMap<>();
    private final Map<String, UserToolLink> userToolLinks = new ConcurrentHashMap<>();
    private final List<ExecutionRecord> executions = new CopyOnWriteArrayList<>();

    public FileToolStateService(ToolEngineProperties properties) {
        this.stateFile = new JsonStateFile(new File(properties.getState().getDirectory(), STATE_FILE_NAME));
    }

    /**
     * Loads the persisted state once the bean has been constructed.
     */
    @PostConstruct
    public void init() {
        stateFile.read(new TypeReference<StoredState>() {}).ifPresent(state -> {
            if (state.tools() != null) {
                tools.putAll(state.tools());
            }
            if (state.userToolLinks() != null) {
                state.userToolLinks().forEach(link -> userToolLinks.put(
                        linkKey(link.getUserId(), link.getOrganizationId(), link.getToolId()), link));
            }
            if (state.executions() != null) {
                executions.addAll(state.executions());
            }
            log.info("Loaded {} tool(s) and {} execution record(s).", tools.size(), executions.size());
        });
    }

    @Override
    public ToolDefinition getToolById(String toolId) {
        return toolId == null ? null : tools.get(toolId);
    }

    @Override
    public ToolDefinition saveTool(ToolDefinition tool) {
        Objects.requireNonNull(tool.getId(), "tool id");
        tools.put(tool.getId(), tool);
        saveState();
        log.info("Saved tool '{}' ({})", tool.getName(), tool.getId());
        return tool;
    }

    @Override
    public List<ToolDefinition> listTools() {
        return tools.values().stream()
                .sorted(Comparator.comparing(ToolDefinition::getName, Comparator.nullsLast(String::compareToIgnoreCase)))
                .toList();
    }

    @Override
    public ExecutionRecord recordExecution(ExecutionRecord record) {
        executions.add(record);
        saveState();
        return record;
    }

    @Override
    public List<ExecutionRecord> listExecutions(String userId, String organizationId) {
        return executions.stream()
                .filter(record -> Objects.equals(record.getUserId(), userId)
                        && Objects.equals(record.getOrganizationId(), organizationId))
                .sorted(Comparator.comparing(ExecutionRecord::getCreatedAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder())).reversed())
                .toList();
    }

    @Override
    public synchronized UserToolLink getOrCreateUserToolLink(String userId, String organizationId, String toolId) {
        String key = linkKey(userId, organizationId, toolId);
        UserToolLink existing = userToolLinks.get(key);
        if (existing != null) {
            return existing;
        }
        Instant now = Instant.now();
        UserToolLink link = new UserToolLink(userId, organizationId, toolId, UserToolStatus.UNSET, now, now);
        userToolLinks.put(key, link);
        saveState();
        return link;
    }

    @Override
    public synchronized void updateUserToolStatus(String userId, String organizationId, String toolId, UserToolStatus status) {
        UserToolLink link = getOrCreateUserToolLink(userId, organizationId, toolId);
        link.setStatus(status);
        link.setUpdatedAt(Instant.now());
        saveState();
    }

    @Override
    public List<UserToolLink> listUserToolLinks(String userId, String organizationId) {
        return userToolLinks.values().stream()
                .filter(link -> Objects.equals(link.getUserId(), userId)
                        && Objects.equals(link.getOrganizationId(), organizationId))
                .sorted(Comparator.comparing(UserToolLink::getCreatedAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder())))
                .toList();
    }

    private synchronized void saveState() {
        stateFile.write(new StoredState(Map.copyOf(tools), new ArrayList<>(userToolLinks.values()), new ArrayList<>(executions)));
    }

    private static String linkKey(String userId, String organizationId, String toolId) {
        return organizationId + "|" + userId + "|" + toolId;
    }

    record StoredState(Map<String, ToolDefinition> tools, List<UserToolLink> userToolLinks, List<ExecutionRecord> executions) {
    }
}
