package me.golemcore.orchestrator.domain.service;

import me.golemcore.orchestrator.domain.conversation.MessageStore;
import me.golemcore.orchestrator.domain.exception.ConfigurationException;
import me.golemcore.orchestrator.domain.exception.ModelException;
import me.golemcore.orchestrator.domain.exception.ToolExecutionException;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.ModelTurn;
import me.golemcore.orchestrator.domain.model.SynthesisResult;
import me.golemcore.orchestrator.domain.model.SynthesisStats;
import me.golemcore.orchestrator.domain.model.ToolResult;
import me.golemcore.orchestrator.domain.model.ToolSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.slf4j.event.Level;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class QueryProcessorTest {

    private static final List<ToolSchema> TOOLS = List.of(ToolSchema.simple("get_weather", "Get weather"));
    private static final Message.ToolCall WEATHER_CALL = Message.ToolCall.builder()
            .id("call_0000abcd")
            .name("get_weather")
            .arguments("{\"city\":\"Paris\"}")
            .build();

    private Orchestrator orchestrator;
    private ReasoningModelService model;
    private ToolCallSynthesizer synthesizer;
    private ToolExecutor toolExecutor;
    private MessageStore store;
    private QueryProcessor processor;

    @BeforeEach
    void setUp() {
        orchestrator = mock(Orchestrator.class);
        model = mock(ReasoningModelService.class);
        synthesizer = mock(ToolCallSynthesizer.class);
        toolExecutor = mock(ToolExecutor.class);
        store = new MessageStore("You are helpful.");

        when(orchestrator.getMessageStore()).thenReturn(store);
        when(orchestrator.getModel()).thenReturn(model);
        when(orchestrator.getAvailableTools()).thenReturn(TOOLS);

        processor = new QueryProcessor(orchestrator, synthesizer, toolExecutor, 3);
    }

    private static ModelTurn answer(String text) {
        return new ModelTurn(text, null, List.of());
    }

    private static ModelTurn asking(String text, String... requests) {
        return new ModelTurn(text, "thinking", List.of(requests));
    }

    private static SynthesisResult synthesized(Message.ToolCall... calls) {
        return new SynthesisResult(List.of(calls), new SynthesisStats());
    }

    @Test
    void shouldReturnDirectAnswer() {
        when(model.execute(anyList(), eq(TOOLS))).thenReturn(answer("Paris is the capital of France."));

        String result = processor.processQuery("What is the capital of France?");

        assertEquals("Paris is the capital of France.", result);
        assertEquals(3, store.size());
        assertEquals(Message.ROLE_ASSISTANT, store.lastMessage().getRole());
        verify(synthesizer, never()).synthesize(any(), any());
    }

    @Test
    void shouldRunToolThenAnswer() {
        when(model.execute(anyList(), eq(TOOLS)))
                .thenReturn(asking("Checking.", "weather in Paris"))
                .thenReturn(answer("It is 22C in Paris."));
        when(synthesizer.synthesize("weather in Paris", TOOLS)).thenReturn(synthesized(WEATHER_CALL));
        when(toolExecutor.execute(WEATHER_CALL)).thenReturn(ToolResult.success("22C, sunny"));

        String result = processor.processQuery("Weather in Paris?");

        assertEquals("It is 22C in Paris.", result);
        List<Message> history = store.snapshot();
        assertEquals(5, history.size());
        assertEquals(List.of("weather in Paris"), history.get(2).getToolRequests());
        Message toolMessage = history.get(3);
        assertEquals(Message.ROLE_TOOL, toolMessage.getRole());
        assertEquals("get_weather", toolMessage.getToolName());
        assertEquals("call_0000abcd", toolMessage.getToolCallId());
        assertEquals("22C, sunny", toolMessage.getContent());
    }

    @Test
    void shouldFeedToolFailureBackAsText() {
        when(model.execute(anyList(), eq(TOOLS)))
                .thenReturn(asking("Checking.", "weather in Paris"))
                .thenReturn(answer("The weather service is unavailable."));
        when(synthesizer.synthesize(any(), any())).thenReturn(synthesized(WEATHER_CALL));
        when(toolExecutor.execute(WEATHER_CALL)).thenThrow(new ToolExecutionException("connection lost"));

        String result = processor.processQuery("Weather in Paris?");

        assertEquals("The weather service is unavailable.", result);
        assertEquals("Error calling tool get_weather: connection lost", store.snapshot().get(3).getContent());
    }

    @Test
    void shouldFeedUnexpectedToolErrorBackAsText() {
        when(model.execute(anyList(), eq(TOOLS)))
                .thenReturn(asking("Checking.", "weather in Paris"))
                .thenReturn(answer("The weather service is unavailable."));
        when(synthesizer.synthesize(any(), any())).thenReturn(synthesized(WEATHER_CALL));
        when(toolExecutor.execute(WEATHER_CALL)).thenThrow(new IllegalStateException("session pipe broken"));

        String result = processor.processQuery("Weather in Paris?");

        assertEquals("The weather service is unavailable.", result);
        List<Message> history = store.snapshot();
        assertEquals(5, history.size());
        assertEquals(Message.ROLE_TOOL, history.get(3).getRole());
        assertEquals("Error calling tool get_weather: session pipe broken", history.get(3).getContent());
        verify(model, times(2)).execute(anyList(), eq(TOOLS));
    }

    @Test
    void shouldFeedFailedToolResultBackAsText() {
        when(model.execute(anyList(), eq(TOOLS)))
                .thenReturn(asking("Checking.", "weather in Atlantis"))
                .thenReturn(answer("No such city."));
        when(synthesizer.synthesize(any(), any())).thenReturn(synthesized(WEATHER_CALL));
        when(toolExecutor.execute(WEATHER_CALL)).thenReturn(ToolResult.failure("City not found"));

        processor.processQuery("Weather in Atlantis?");

        assertEquals("City not found", store.snapshot().get(3).getContent());
    }

    @Test
    void shouldContinueWhenSynthesisFindsNothing() {
        when(model.execute(anyList(), eq(TOOLS)))
                .thenReturn(asking("Let me look.", "teleport me"))
                .thenReturn(answer("I cannot do that."));
        when(synthesizer.synthesize(any(), any())).thenReturn(synthesized());

        String result = processor.processQuery("Teleport me to Mars");

        assertEquals("I cannot do that.", result);
        assertEquals(4, store.size());
        verify(toolExecutor, never()).execute(any());
    }

    @Test
    void shouldRunSeveralRequestsInOrder() {
        Message.ToolCall romeCall = Message.ToolCall.builder().id("call_1111abcd").name("get_weather")
                .arguments("{\"city\":\"Rome\"}").build();
        when(model.execute(anyList(), eq(TOOLS)))
                .thenReturn(asking("Checking both.", "weather in Paris", "weather in Rome"))
                .thenReturn(answer("Both are sunny."));
        when(synthesizer.synthesize("weather in Paris", TOOLS)).thenReturn(synthesized(WEATHER_CALL));
        when(synthesizer.synthesize("weather in Rome", TOOLS)).thenReturn(synthesized(romeCall));
        when(toolExecutor.execute(WEATHER_CALL)).thenReturn(ToolResult.success("Paris: sunny"));
        when(toolExecutor.execute(romeCall)).thenReturn(ToolResult.success("Rome: sunny"));

        processor.processQuery("Weather in Paris and Rome?");

        InOrder order = inOrder(toolExecutor);
        order.verify(toolExecutor).execute(WEATHER_CALL);
        order.verify(toolExecutor).execute(romeCall);
        List<Message> history = store.snapshot();
        assertEquals("Paris: sunny", history.get(3).getContent());
        assertEquals("Rome: sunny", history.get(4).getContent());
    }

    @Test
    void shouldStopAfterMaxIterations() {
        when(model.execute(anyList(), eq(TOOLS))).thenReturn(asking("Still looking.", "weather in Paris"));
        when(synthesizer.synthesize(any(), any())).thenReturn(synthesized(WEATHER_CALL));
        when(toolExecutor.execute(WEATHER_CALL)).thenReturn(ToolResult.success("22C"));

        String result = processor.processQuery("Weather in Paris?");

        assertEquals(QueryProcessor.MAX_ITERATIONS_PREFIX + "Still looking.", result);
        verify(model, times(3)).execute(anyList(), eq(TOOLS));
        Message last = store.lastMessage();
        assertEquals(result, last.getContent());
        assertEquals(Boolean.TRUE, last.getMetadata().get(QueryProcessor.METADATA_MAX_ITERATIONS));
    }

    @Test
    void shouldDumpHistoryWhenMaxIterationsReached() {
        MessageStore spiedStore = spy(new MessageStore("You are helpful."));
        when(orchestrator.getMessageStore()).thenReturn(spiedStore);
        when(model.execute(anyList(), eq(TOOLS))).thenReturn(asking("Still looking.", "weather in Paris"));
        when(synthesizer.synthesize(any(), any())).thenReturn(synthesized(WEATHER_CALL));
        when(toolExecutor.execute(WEATHER_CALL)).thenReturn(ToolResult.success("22C"));

        new QueryProcessor(orchestrator, synthesizer, toolExecutor, 2).processQuery("Weather in Paris?");

        verify(spiedStore).logHistory(Level.WARN, "Reached max iterations");
    }

    @Test
    void shouldApologizeWhenModelReturnsNoText() {
        when(model.execute(anyList(), eq(TOOLS))).thenReturn(answer(null));

        assertEquals(QueryProcessor.NOT_UNDERSTOOD, processor.processQuery("???"));
    }

    @Test
    void shouldReportModelFailure() {
        when(model.execute(anyList(), eq(TOOLS))).thenThrow(new ModelException("Model call failed: 401"));

        String result = processor.processQuery("Hello");

        assertEquals(QueryProcessor.TECHNICAL_PROBLEM_PREFIX + "Model call failed: 401", result);
    }

    @Test
    void shouldReportUnstartedOrchestrator() {
        when(orchestrator.getAvailableTools())
                .thenThrow(new ConfigurationException("Orchestrator not started: call start() first"));

        String result = processor.processQuery("Hello");

        assertTrue(result.startsWith(QueryProcessor.TECHNICAL_PROBLEM_PREFIX));
        assertTrue(result.endsWith("call start() first"));
    }
}
