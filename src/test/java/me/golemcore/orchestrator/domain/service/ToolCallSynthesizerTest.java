package me.golemcore.orchestrator.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.orchestrator.domain.model.LlmRequest;
import me.golemcore.orchestrator.domain.model.LlmResponse;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.SynthesisResult;
import me.golemcore.orchestrator.domain.model.ToolSchema;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ToolCallSynthesizerTest {

    private static final String VALID_WEATHER_CALL = """
            {"tool_calls": [{"function": {"name": "get_weather", "arguments": "{\\"city\\": \\"Paris\\"}"}}]}
            """;
    private static final String UNKNOWN_TOOL_CALL = """
            {"tool_calls": [{"function": {"name": "launch_rocket", "arguments": "{}"}}]}
            """;

    private LlmPort llmPort;
    private OrchestratorProperties.ToolCallingProperties settings;
    private ToolCallSynthesizer synthesizer;
    private List<ToolSchema> tools;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        settings = new OrchestratorProperties.ToolCallingProperties();
        settings.setTimeoutMs(1_000);
        ObjectMapper objectMapper = new ObjectMapper();
        synthesizer = new ToolCallSynthesizer(llmPort, new ToolCallValidator(objectMapper), objectMapper, settings);

        tools = List.of(
                tool("get_weather", "Get the current weather for a city", "city"),
                tool("search_web", "Search the web for a query", "query"),
                tool("send_email", "Send an email message", "to", "subject", "body"),
                tool("read_file", "Read a file from disk", "path"));
    }

    private static ToolSchema tool(String name, String description, String... params) {
        Map<String, Object> properties = new java.util.LinkedHashMap<>();
        for (String param : params) {
            properties.put(param, Map.of("type", "string"));
        }
        return ToolSchema.builder()
                .name(name)
                .description(description)
                .inputSchema(Map.of("type", "object", "properties", properties))
                .build();
    }

    private static CompletableFuture<LlmResponse> reply(String content) {
        return CompletableFuture.completedFuture(LlmResponse.builder().content(content).build());
    }

    @Test
    void shouldReturnValidCallOnFirstAttempt() {
        when(llmPort.chat(any())).thenReturn(reply(VALID_WEATHER_CALL));

        SynthesisResult result = synthesizer.synthesize("weather in Paris", tools);

        assertEquals(1, result.toolCalls().size());
        Message.ToolCall call = result.toolCalls().get(0);
        assertEquals("get_weather", call.getName());
        assertEquals("{\"city\": \"Paris\"}", call.getArguments());
        assertTrue(call.getId().matches("call_[0-9a-f]{8}"));
        assertTrue(result.stats().isSuccess());
        assertEquals(1, result.stats().getAttempts());
        assertEquals(1, result.stats().getValidCalls());
        assertEquals(0, result.stats().getInvalidCalls());
    }

    @Test
    void shouldSendJsonModeRequestWithClosedWorldPrompt() {
        when(llmPort.chat(any())).thenReturn(reply(VALID_WEATHER_CALL));

        synthesizer.synthesize("weather in Paris", tools);

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(captor.capture());
        LlmRequest request = captor.getValue();
        assertTrue(request.isJsonMode());
        assertEquals("deepseek", request.getProvider());
        assertEquals("deepseek-chat", request.getModel());
        assertTrue(request.getSystemPrompt().contains("- send_email: Send an email message\n  Parameters: to, subject, body"));
        assertTrue(request.getSystemPrompt().contains("IMPORTANT RULES:"));
        assertEquals("weather in Paris", request.getMessages().get(0).getContent());
    }

    @Test
    void shouldAcceptSingleFunctionObject() {
        when(llmPort.chat(any())).thenReturn(reply("""
                {"id": "call_given", "function": {"name": "search_web", "arguments": "{\\"query\\": \\"java\\"}"}}
                """));

        SynthesisResult result = synthesizer.synthesize("search java", tools);

        assertEquals(1, result.toolCalls().size());
        assertEquals("call_given", result.toolCalls().get(0).getId());
    }

    @Test
    void shouldKeepOnlyValidCallsFromMixedOutput() {
        when(llmPort.chat(any())).thenReturn(reply("""
                {"tool_calls": [
                  {"function": {"name": "get_weather", "arguments": "{\\"city\\": \\"Paris\\"}"}},
                  {"function": {"name": "launch_rocket", "arguments": "{}"}},
                  {"function": {"name": "get_weather", "arguments": "{\\"city\\": \\"Rome\\"}"}}
                ]}
                """));

        SynthesisResult result = synthesizer.synthesize("weather in Paris and Rome", tools);

        assertEquals(2, result.toolCalls().size());
        assertEquals(2, result.stats().getValidCalls());
        assertEquals(1, result.stats().getInvalidCalls());
        assertEquals(3, result.stats().getTotalCalls());
        assertTrue(result.stats().isSuccess());
    }

    @Test
    void shouldRetryWithFewerCandidatesAfterInvalidAttempt() {
        when(llmPort.chat(any())).thenReturn(reply(UNKNOWN_TOOL_CALL), reply(VALID_WEATHER_CALL));

        SynthesisResult result = synthesizer.synthesize("weather in Paris for the city", tools);

        assertEquals(1, result.toolCalls().size());
        assertEquals(2, result.stats().getAttempts());
        assertEquals(1, result.stats().getInvalidCalls());

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort, times(2)).chat(captor.capture());
        String secondPrompt = captor.getAllValues().get(1).getSystemPrompt();
        assertTrue(secondPrompt.contains("- get_weather:"));
        assertEquals(3, secondPrompt.split("\n  Parameters: ", -1).length - 1);
        assertFalse(secondPrompt.contains("- read_file:"));
    }

    @Test
    void shouldReturnEmptyAfterExhaustingRetries() {
        when(llmPort.chat(any())).thenReturn(reply("this is not json"));

        SynthesisResult result = synthesizer.synthesize("do something impossible", tools);

        assertTrue(result.isEmpty());
        assertFalse(result.stats().isSuccess());
        assertEquals(5, result.stats().getAttempts());
        assertFalse(result.stats().getErrors().isEmpty());

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort, atLeastOnce()).chat(captor.capture());
        long synthesisCalls = captor.getAllValues().stream().filter(LlmRequest::isJsonMode).count();
        long rewriteCalls = captor.getAllValues().stream().filter(r -> !r.isJsonMode()).count();
        assertEquals(5, synthesisCalls);
        // rewrites follow failed attempts 2, 3 and 4; the last attempt is not followed by one
        assertEquals(3, rewriteCalls);
    }

    @Test
    void shouldNeverThrowWhenModelFails() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("boom")));
        settings.setMaxRetries(2);

        SynthesisResult result = synthesizer.synthesize("weather in Paris", tools);

        assertTrue(result.isEmpty());
        assertEquals(2, result.stats().getAttempts());
        assertTrue(result.stats().lastError().contains("boom"));
    }

    @Test
    void shouldSkipModelWhenNoToolsAvailable() {
        SynthesisResult result = synthesizer.synthesize("weather in Paris", List.of());

        assertTrue(result.isEmpty());
        verify(llmPort, never()).chat(any());
    }

    @Test
    void shouldComputeKeepCount() {
        assertEquals(6, ToolCallSynthesizer.keepCount(8, 0));
        assertEquals(4, ToolCallSynthesizer.keepCount(8, 1));
        assertEquals(2, ToolCallSynthesizer.keepCount(8, 2));
        assertEquals(2, ToolCallSynthesizer.keepCount(8, 3));
        assertEquals(2, ToolCallSynthesizer.keepCount(3, 0));
        assertEquals(1, ToolCallSynthesizer.keepCount(1, 0));
        assertEquals(1, ToolCallSynthesizer.keepCount(2, 4));
    }

    @Test
    void shouldRankCandidatesByKeywordOverlap() {
        List<ToolSchema> kept = synthesizer.shrinkCandidates("send an email to bob with subject hello",
                tools, tools.size(), 1);

        assertEquals(2, kept.size());
        assertEquals("send_email", kept.get(0).getName());
    }

    @Test
    void shouldKeepOrderOnTies() {
        List<ToolSchema> kept = synthesizer.shrinkCandidates("zzz", tools, tools.size(), 0);

        assertEquals(List.of("get_weather", "search_web", "send_email"),
                kept.stream().map(ToolSchema::getName).toList());
    }

    @Test
    void shouldNeverGrowCandidateList() {
        List<ToolSchema> two = tools.subList(0, 2);

        List<ToolSchema> kept = synthesizer.shrinkCandidates("weather", two, tools.size(), 0);

        assertEquals(2, kept.size());
    }

    @Test
    void shouldTruncateInstructionWhenRewriteFails() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));
        String instruction = "x".repeat(300);

        String rewritten = synthesizer.rewriteInstruction(instruction, "unknown tool", tools);

        assertEquals(150, rewritten.length());
    }

    @Test
    void shouldTruncateNoFurtherThanMinimumLength() {
        assertEquals(100, ToolCallSynthesizer.truncate("y".repeat(150)).length());
        assertEquals(80, ToolCallSynthesizer.truncate("y".repeat(80)).length());
    }

    @Test
    void shouldUseRewrittenInstructionWhenModelAnswers() {
        when(llmPort.chat(any())).thenReturn(reply("  Call get_weather with city=Paris  "));

        String rewritten = synthesizer.rewriteInstruction("weather?", "unknown tool", tools);

        assertEquals("Call get_weather with city=Paris", rewritten);
    }
}
