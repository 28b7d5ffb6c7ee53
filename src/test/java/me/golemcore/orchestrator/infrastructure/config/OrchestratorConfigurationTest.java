package me.golemcore.orchestrator.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.orchestrator.domain.conversation.MessageStore;
import me.golemcore.orchestrator.domain.conversation.TranscriptViewBuilder;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.service.Orchestrator;
import me.golemcore.orchestrator.domain.service.ReasoningModelService;
import me.golemcore.orchestrator.domain.service.ToolRequestExtractor;
import me.golemcore.orchestrator.port.outbound.LlmPort;
import me.golemcore.orchestrator.port.outbound.ToolLauncherPort;
import me.golemcore.orchestrator.port.outbound.ToolSessionPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class OrchestratorConfigurationTest {

    private OrchestratorConfiguration configuration;
    private OrchestratorProperties properties;

    @BeforeEach
    void setUp() {
        configuration = new OrchestratorConfiguration();
        properties = new OrchestratorProperties();
    }

    @Test
    void shouldSeedStoreWithPersonalityAndConvention() {
        properties.getAgent().setCustomSystemPrompt("You are a travel assistant.");

        MessageStore store = configuration.messageStore(properties);

        Message system = store.snapshot().get(0);
        assertEquals(Message.ROLE_SYSTEM, system.getRole());
        assertTrue(system.getContent().startsWith("You are a travel assistant."));
        assertTrue(system.getContent().contains("END_INSTRUCTION"));
    }

    @Test
    void shouldRegisterConfiguredToolsOnOrchestrator() {
        ToolLauncherPort launcher = mock(ToolLauncherPort.class);
        properties.getTools().put("weather", "/srv/weather/server.py");
        properties.setToolsFile("/etc/orchestrator/tools.json");
        ReasoningModelService model = configuration.reasoningModelService(mock(LlmPort.class),
                new TranscriptViewBuilder(), new ToolRequestExtractor(), properties);

        Orchestrator orchestrator = configuration.orchestrator(model, launcher, mock(ToolSessionPort.class),
                configuration.messageStore(properties), properties);

        assertFalse(orchestrator.isStarted());
        verify(launcher).registerFromConfig(any());
        verify(launcher).registerFromFile(Path.of("/etc/orchestrator/tools.json"));
    }

    @Test
    void shouldBuildQueryPipeline() {
        LlmPort llmPort = mock(LlmPort.class);
        ObjectMapper objectMapper = new ObjectMapper();
        ReasoningModelService model = configuration.reasoningModelService(llmPort,
                configuration.transcriptViewBuilder(), configuration.toolRequestExtractor(), properties);
        Orchestrator orchestrator = configuration.orchestrator(model, mock(ToolLauncherPort.class),
                mock(ToolSessionPort.class), configuration.messageStore(properties), properties);

        assertNotNull(configuration.agent(orchestrator, configuration.queryProcessor(orchestrator,
                configuration.toolCallSynthesizer(llmPort, configuration.toolCallValidator(objectMapper),
                        objectMapper, properties),
                configuration.toolExecutor(mock(ToolSessionPort.class), properties), properties)));
    }
}
