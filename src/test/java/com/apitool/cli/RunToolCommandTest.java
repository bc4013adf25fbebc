package com.apitool.cli;

import com.apitool.cli.ui.JsonPrinter;
import com.apitool.cli.ui.Spinner;
import com.apitool.config.ToolEngineProperties;
import com.apitool.exception.ErrorKind;
import com.apitool.model.CallerIdentity;
import com.apitool.model.execution.Failed;
import com.apitool.model.execution.SetupNeeded;
import com.apitool.model.execution.Succeeded;
import com.apitool.service.api.ToolExecutionService;
import com.apitool.support.TestSpecs;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RunToolCommandTest {

    private static final CallerIdentity DEFAULT_CALLER = new CallerIdentity("local-user", "local-org");

    @Mock
    private ToolExecutionService toolExecutionService;

    @Mock
    private Spinner spinner;

    private RunToolCommand runToolCommand;

    @BeforeEach
    void setUp() {
        runToolCommand = new RunToolCommand(toolExecutionService, new ToolEngineProperties(), spinner, new JsonPrinter());
        lenient().when(spinner.spin(anyString(), any())).thenAnswer(invocation -> {
            Supplier<?> task = invocation.getArgument(1, Supplier.class);
            return task.get();
        });
    }

    @Test
    void runTool_shouldPrintTheUpstreamDataAsTheDefaultCaller() {
        when(toolExecutionService.execute(eq("tool-1"), eq(DEFAULT_CALLER), eq("conv-9"), eq(Map.of("itemId", 42))))
                .thenReturn(new Succeeded(201, TestSpecs.json("{\"id\": 7}")));

        String output = runToolCommand.runTool("tool-1", "{\"itemId\": 42}", "conv-9", false);

        assertThat(output).contains("\"success\"").contains("true").contains("\"id\"").contains("7");
    }

    @Test
    void runTool_whenSetupIsNeeded_shouldPrintTheRequiredInputs() {
        when(toolExecutionService.execute(anyString(), any(), any(), any())).thenReturn(new SetupNeeded(
                "acme", "Items API setup", "Provide your api key.", "Setup required.", List.of("api key"), List.of(), null));

        String output = runToolCommand.runTool("tool-1", "{}", null, false);

        assertThat(output).contains("\"needsSetup\"").contains("\"requiredSecretInputs\"").contains("api key");
    }

    @Test
    void runTool_whenFailed_shouldPrintTheErrorAndHint() {
        when(toolExecutionService.execute(anyString(), any(), any(), any())).thenReturn(new Failed(
                ErrorKind.UPSTREAM_ERROR, 404, "External API Error (404): not found", null, null));

        String output = runToolCommand.runTool("tool-1", "{}", null, false);

        assertThat(output).contains("External API Error (404): not found").contains("false");
    }

    @Test
    void runTool_withMalformedParams_shouldNotExecute() {
        String output = runToolCommand.runTool("tool-1", "[1, 2", null, false);

        assertThat(output).contains("--params must be a JSON object");
        verifyNoInteractions(toolExecutionService);
    }

    @Test
    void runTool_whenExecutionThrows_shouldPrintAGracefulError() {
        when(toolExecutionService.execute(anyString(), any(), any(), any())).thenThrow(new IllegalStateException("boom"));

        assertThat(runToolCommand.runTool("tool-1", "{}", null, false)).contains("An error occurred: boom");
    }

    @Test
    void runTool_verboseFlag_shouldRestoreTheLogLevel() {
        ch.qos.logback.classic.Logger rootLogger = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        ch.qos.logback.classic.Level originalLevel = rootLogger.getLevel();
        when(toolExecutionService.execute(anyString(), any(), any(), any())).thenAnswer(invocation -> {
            assertThat(rootLogger.getLevel()).isEqualTo(ch.qos.logback.classic.Level.DEBUG);
            return new Succeeded(200, TestSpecs.json("{}"));
        });

        runToolCommand.runTool("tool-1", "{}", null, true);

        assertThat(rootLogger.getLevel()).isEqualTo(originalLevel);
        verify(toolExecutionService).execute(anyString(), any(), any(), any());
    }
}
