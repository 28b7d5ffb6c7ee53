package me.golemcore.orchestrator.domain.service;

import me.golemcore.orchestrator.domain.conversation.MessageStore;
import me.golemcore.orchestrator.domain.exception.ConfigurationException;
import me.golemcore.orchestrator.domain.exception.ToolExecutionException;
import me.golemcore.orchestrator.domain.model.ToolSchema;
import me.golemcore.orchestrator.port.outbound.ToolLauncherPort;
import me.golemcore.orchestrator.port.outbound.ToolSessionPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OrchestratorTest {

    private ReasoningModelService model;
    private ToolLauncherPort launcher;
    private ToolSessionPort sessions;
    private MessageStore store;
    private Orchestrator orchestrator;

    @BeforeEach
    void setUp() {
        model = mock(ReasoningModelService.class);
        launcher = mock(ToolLauncherPort.class);
        sessions = mock(ToolSessionPort.class);
        store = new MessageStore("system prompt");
        orchestrator = new Orchestrator(model, launcher, sessions, store);
    }

    @Test
    void shouldRegisterBufferedProvidersOnStart() {
        orchestrator.registerToolProvider("weather", "/tools/weather/server.py");
        orchestrator.registerToolProvider("files", "/tools/files/server.py");
        verify(launcher, never()).registerServer(any(), any());

        orchestrator.start();

        InOrder order = inOrder(launcher);
        order.verify(launcher).registerServer("weather", "/tools/weather/server.py");
        order.verify(launcher).registerServer("files", "/tools/files/server.py");
        order.verify(launcher).launchAll();
        assertTrue(orchestrator.isStarted());
    }

    @Test
    void shouldRejectDuplicateProvider() {
        orchestrator.registerToolProvider("weather", "/a.py");

        assertThrows(IllegalArgumentException.class, () -> orchestrator.registerToolProvider("weather", "/b.py"));
    }

    @Test
    void shouldLaunchProviderRegisteredAfterStart() {
        orchestrator.start();
        when(sessions.discoverTools()).thenReturn(Map.of("late", List.of(ToolSchema.simple("late_tool", "Late"))));

        orchestrator.registerToolProvider("late", "/tools/late/server.py");

        verify(launcher).registerServer("late", "/tools/late/server.py");
        verify(launcher, times(2)).launchAll();
        assertEquals(List.of("late_tool"),
                orchestrator.getAvailableTools().stream().map(ToolSchema::getName).toList());
    }

    @Test
    void shouldKeepRunningWhenLateProviderFailsToLaunch() {
        orchestrator.start();
        doThrow(new ToolExecutionException("Failed to launch tool servers", List.of("late: exited")))
                .when(launcher).launchAll();

        assertDoesNotThrow(() -> orchestrator.registerToolProvider("late", "/tools/late/server.py"));
        assertTrue(orchestrator.isStarted());
    }

    @Test
    void shouldRejectProviderAfterShutdown() {
        orchestrator.start();
        orchestrator.shutdown();

        assertThrows(ConfigurationException.class, () -> orchestrator.registerToolProvider("late", "/late.py"));
        verify(launcher, never()).registerServer(any(), any());
    }

    @Test
    void shouldStartOnlyOnce() {
        orchestrator.start();
        orchestrator.start();

        verify(launcher, times(1)).launchAll();
    }

    @Test
    void shouldStayUsableWhenSomeServersFailToLaunch() {
        doThrow(new ToolExecutionException("Failed to launch tool servers", List.of("broken: exited")))
                .when(launcher).launchAll();

        assertDoesNotThrow(orchestrator::start);
        assertTrue(orchestrator.isStarted());
    }

    @Test
    void shouldRequireStartBeforeListingTools() {
        ConfigurationException e = assertThrows(ConfigurationException.class, orchestrator::getAvailableTools);
        assertEquals("Orchestrator not started: call start() first", e.getMessage());
    }

    @Test
    void shouldFlattenToolsAcrossSessions() {
        Map<String, List<ToolSchema>> discovered = new LinkedHashMap<>();
        discovered.put("weather", List.of(ToolSchema.simple("get_weather", "Weather")));
        discovered.put("files", List.of(ToolSchema.simple("read_file", "Read"),
                ToolSchema.simple("get_weather", "Shadowed")));
        when(sessions.discoverTools()).thenReturn(discovered);
        orchestrator.start();

        List<ToolSchema> tools = orchestrator.getAvailableTools();

        assertEquals(List.of("get_weather", "read_file"), tools.stream().map(ToolSchema::getName).toList());
        assertEquals("Weather", tools.get(0).getDescription());
    }

    @Test
    void shouldShutdownOnce() {
        orchestrator.start();

        orchestrator.shutdown();
        orchestrator.shutdown();

        verify(launcher, times(1)).shutdown();
        assertFalse(orchestrator.isStarted());
    }

    @Test
    void shouldNotRestartAfterShutdown() {
        orchestrator.shutdown();

        assertThrows(ConfigurationException.class, orchestrator::start);
    }

    @Test
    void shouldLogShutdownFailuresWithoutThrowing() {
        orchestrator.start();
        doThrow(new ToolExecutionException("Failed to stop tool servers", List.of("weather: hung")))
                .when(launcher).shutdown();

        assertDoesNotThrow(orchestrator::shutdown);
    }

    @Test
    void shouldDelegateConfigAndFileRegistration() {
        Map<String, String> tools = Map.of("weather", "/tools/weather/server.py");
        Path file = Path.of("/etc/tools.json");

        orchestrator.registerToolsFromConfig(tools);
        orchestrator.registerToolsFromConfig(Map.of());
        orchestrator.registerToolsFromFile(file);

        verify(launcher, times(1)).registerFromConfig(any());
        verify(launcher).registerFromFile(file);
    }

    @Test
    void shouldExposeHistorySnapshot() {
        store.addUser("hi");

        assertEquals(2, orchestrator.getHistory().size());
        assertEquals(store, orchestrator.getMessageStore());
    }
}
