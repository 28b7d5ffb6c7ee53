package me.golemcore.orchestrator.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolCallValidatorTest {

    private static final Set<String> TOOLS = Set.of("get_weather", "search");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ToolCallValidator validator = new ToolCallValidator(objectMapper);

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    @Test
    void shouldAcceptWellFormedCall() throws Exception {
        JsonNode call = json("""
                {"id": "call_1", "type": "function",
                 "function": {"name": "get_weather", "arguments": "{\\"city\\": \\"Paris\\"}"}}
                """);

        assertTrue(validator.isValid(call, TOOLS));
        assertNull(validator.rejectionReason(call, TOOLS));
    }

    @Test
    void shouldAcceptEmptyArgumentsObject() throws Exception {
        assertTrue(validator.isValid(json("""
                {"type": "function", "function": {"name": "search", "arguments": "{}"}}
                """), TOOLS));
    }

    @Test
    void shouldRejectWrongType() throws Exception {
        assertFalse(validator.isValid(json("""
                {"type": "tool", "function": {"name": "search", "arguments": "{}"}}
                """), TOOLS));
        assertFalse(validator.isValid(json("""
                {"function": {"name": "search", "arguments": "{}"}}
                """), TOOLS));
    }

    @Test
    void shouldRejectUnknownToolName() throws Exception {
        assertFalse(validator.isValid(json("""
                {"type": "function", "function": {"name": "launch_rocket", "arguments": "{}"}}
                """), TOOLS));
    }

    @Test
    void shouldRejectNonTextualName() throws Exception {
        assertFalse(validator.isValid(json("""
                {"type": "function", "function": {"name": 42, "arguments": "{}"}}
                """), TOOLS));
    }

    @Test
    void shouldRejectArgumentsThatAreNotAJsonObjectString() throws Exception {
        assertFalse(validator.isValid(json("""
                {"type": "function", "function": {"name": "search", "arguments": {"q": "java"}}}
                """), TOOLS));
        assertFalse(validator.isValid(json("""
                {"type": "function", "function": {"name": "search", "arguments": "[1, 2]"}}
                """), TOOLS));
        assertFalse(validator.isValid(json("""
                {"type": "function", "function": {"name": "search", "arguments": "{not json"}}
                """), TOOLS));
        assertFalse(validator.isValid(json("""
                {"type": "function", "function": {"name": "search"}}
                """), TOOLS));
    }

    @Test
    void shouldRejectNonObjects() throws Exception {
        assertFalse(validator.isValid(json("[]"), TOOLS));
        assertFalse(validator.isValid(null, TOOLS));
        assertFalse(validator.isValid(json("""
                {"type": "function", "function": "search"}
                """), TOOLS));
    }
}
