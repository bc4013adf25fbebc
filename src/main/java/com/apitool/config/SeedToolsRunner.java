package com.apitool.config;

import com.apitool.dto.request.RegisterToolRequest;
import com.apitool.exception.ToolEngineException;
import com.apitool.model.CallerIdentity;
import com.apitool.model.ToolDefinition;
import com.apitool.service.api.ToolRegistrationService;
import com.apitool.service.api.ToolStateService;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Registers the tool definitions found in {@code tool-engine.seed.directory} on startup.
 * <p>
 * Each {@code *.json} file holds one tool definition. A definition whose name is already
 * registered is skipped, so restarting the shell does not create duplicates.
 */
@Component
@Profile("!test") // Ensures this does not run during tests
public class SeedToolsRunner implements CommandLineRunner {

    private final ToolEngineProperties properties;
    private final ToolRegistrationService toolRegistrationService;
    private final ToolStateService toolStateService;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public SeedToolsRunner(ToolEngineProperties properties,
                           ToolRegistrationService toolRegistrationService,
                           ToolStateService toolStateService) {
        this.properties = properties;
        this.toolRegistrationService = toolRegistrationService;
        this.toolStateService = toolStateService;
    }

    @Override
    public void run(String... args) {
        String seedDirectory = properties.getSeed().getDirectory();
        if (seedDirectory == null || seedDirectory.isBlank()) {
            return;
        }
        System.out.println("\n--- Seeding tools from '" + seedDirectory + "' ---");
        File[] files = new File(seedDirectory).listFiles((dir, name) -> name.toLowerCase(Locale.ROOT).endsWith(".json"));
        if (files == null || files.length == 0) {
            System.out.println("No tool definition (.json) files found. Skipping.");
            System.out.println("--- Seeding Complete ---\n");
            return;
        }

        Set<String> registeredNames = toolStateService.listTools().stream()
                .map(ToolDefinition::getName)
                .collect(Collectors.toSet());
        CallerIdentity creator = new CallerIdentity(properties.getCaller().getUserId(), properties.getCaller().getOrganizationId());

        Arrays.sort(files, Comparator.comparing(File::getName));
        for (File file : files) {
            try {
                RegisterToolRequest request = objectMapper.readValue(file, RegisterToolRequest.class);
                if (registeredNames.contains(request.name())) {
                    System.out.println("  [SEED] SKIPPED: Tool '" + request.name() + "' is already registered.");
                    continue;
                }
                ToolDefinition tool = toolRegistrationService.register(request, creator);
                registeredNames.add(tool.getName());
                System.out.println("  [SEED] Registered tool '" + tool.getName() + "' with id " + tool.getId() + ".");
            } catch (IOException e) {
                System.err.println("  [SEED] FAILED: Could not read '" + file.getName() + "'. Error: " + e.getMessage());
            } catch (ToolEngineException e) {
                System.err.println("  [SEED] FAILED: '" + file.getName() + "' was rejected. Error: " + e.getMessage());
            }
        }
        System.out.println("--- Seeding Complete ---\n");
    }
}
