package me.golemcore.orchestrator.domain.service;

import me.golemcore.orchestrator.domain.conversation.MessageStore;
import me.golemcore.orchestrator.domain.exception.ConfigurationException;
import me.golemcore.orchestrator.port.outbound.ToolLauncherPort;
import me.golemcore.orchestrator.port.outbound.ToolSessionPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AgentTest {

    @TempDir
    Path tempDir;

    private Orchestrator orchestrator;
    private QueryProcessor queryProcessor;
    private Agent agent;

    @BeforeEach
    void setUp() {
        orchestrator = mock(Orchestrator.class);
        queryProcessor = mock(QueryProcessor.class);
        agent = new Agent(orchestrator, queryProcessor);
    }

    @Test
    void shouldNameToolAfterParentDirectory() throws IOException {
        Path dir = Files.createDirectories(tempDir.resolve("weather"));
        Path server = Files.writeString(dir.resolve("server.py"), "print('hi')");

        agent.addTool(server.toString());

        verify(orchestrator).registerToolProvider("weather", server.toAbsolutePath().normalize().toString());
    }

    @Test
    void shouldUseExplicitName() throws IOException {
        Path server = Files.writeString(tempDir.resolve("server.py"), "print('hi')");

        agent.addTool(server.toString(), "forecast");

        verify(orchestrator).registerToolProvider("forecast", server.toAbsolutePath().normalize().toString());
    }

    @Test
    void shouldRejectMissingArtifact() {
        String missing = tempDir.resolve("nope.py").toString();

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> agent.addTool(missing));
        assertTrue(e.getMessage().startsWith("Tool artifact not found: "));
    }

    @Test
    void shouldStartLazilyOnFirstQuery() {
        when(orchestrator.isStarted()).thenReturn(false);
        when(queryProcessor.processQuery("hello")).thenReturn("hi there");

        assertEquals("hi there", agent.processQuery("hello"));
        verify(orchestrator).start();
    }

    @Test
    void shouldNotRestartWhenAlreadyStarted() {
        when(orchestrator.isStarted()).thenReturn(true);

        agent.processQuery("hello");

        verify(orchestrator, never()).start();
    }

    @Test
    void shouldReportFailedStartInsteadOfThrowing() {
        when(orchestrator.isStarted()).thenReturn(false);
        doThrow(new ConfigurationException("Orchestrator has been shut down")).when(orchestrator).start();

        agent.shutdown();
        String result = agent.processQuery("hello");

        assertEquals(QueryProcessor.TECHNICAL_PROBLEM_PREFIX + "Orchestrator has been shut down", result);
        verify(queryProcessor, never()).processQuery(anyString());
    }

    @Test
    void shouldAnswerAfterShutdownWithRealOrchestrator() {
        Orchestrator real = new Orchestrator(mock(ReasoningModelService.class),
                mock(ToolLauncherPort.class), mock(ToolSessionPort.class), new MessageStore("system"));
        Agent realAgent = new Agent(real, queryProcessor);

        realAgent.shutdown();

        assertTrue(realAgent.processQuery("hello").startsWith(QueryProcessor.TECHNICAL_PROBLEM_PREFIX));
        verify(queryProcessor, never()).processQuery(anyString());
    }

    @Test
    void shouldDelegateShutdown() {
        agent.shutdown();

        verify(orchestrator).shutdown();
    }
}
