/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */


package me.golemcore.orchestrator.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.LlmRequest;
import me.golemcore.orchestrator.domain.model.LlmResponse;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.SynthesisResult;
import me.golemcore.orchestrator.domain.model.SynthesisStats;
import me.golemcore.orchestrator.domain.model.ToolSchema;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.LlmPort;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Turns one natural-language tool request into validated, structured tool
 * calls using a JSON-mode model.
 *
 * <p>
 * Each attempt lists only the current candidate tools in a closed-world prompt
 * and keeps the calls that pass {@link ToolCallValidator}. After an attempt
 * with no valid call the candidate list is narrowed to the tools whose
 * name, description and parameters share the most keywords with the
 * instruction; from the second failure on, the instruction itself is also
 * rewritten by the model using the last error. Running out of attempts yields
 * an empty result, never an exception.
 */
@Slf4j
public class ToolCallSynthesizer {

    private static final int MIN_INSTRUCTION_LENGTH = 100;
    private static final double SHRINK_STEP = 0.25;
    private static final double MAX_SHRINK = 0.75;

    private static final String REWRITE_PROMPT = """
            You rewrite instructions for a tool calling model. The previous instruction failed to \
            produce a valid tool call. Rewrite it so that it names exactly one of the available tools \
            and states every argument explicitly. Output the rewritten instruction only.""";

    private final LlmPort llmPort;
    private final ToolCallValidator validator;
    private final ObjectMapper objectMapper;
    private final OrchestratorProperties.ToolCallingProperties settings;

    public ToolCallSynthesizer(LlmPort llmPort, ToolCallValidator validator, ObjectMapper objectMapper,
            OrchestratorProperties.ToolCallingProperties settings) {
        this.llmPort = llmPort;
        this.validator = validator;
        this.objectMapper = objectMapper;
        this.settings = settings;
    }

    public SynthesisResult synthesize(String request, List<ToolSchema> tools) {
        SynthesisStats stats = new SynthesisStats();
        if (tools == null || tools.isEmpty()) {
            stats.recordError("No tools available");
            return new SynthesisResult(List.of(), stats);
        }
        if (request == null || request.isBlank()) {
            stats.recordError("Empty tool request");
            return new SynthesisResult(List.of(), stats);
        }

        Set<String> toolNames = new HashSet<>();
        for (ToolSchema tool : tools) {
            toolNames.add(tool.getName());
        }

        int maxRetries = Math.max(1, settings.getMaxRetries());
        List<ToolSchema> candidates = new ArrayList<>(tools);
        String instruction = request;

        for (int attempt = 0; attempt < maxRetries; attempt++) {
            stats.setAttempts(attempt + 1);
            log.debug("[Synthesizer] Attempt {}/{} with {} candidate tools", attempt + 1, maxRetries,
                    candidates.size());

            List<JsonNode> rawCalls = requestCalls(instruction, candidates, stats);
            stats.setTotalCalls(stats.getTotalCalls() + rawCalls.size());

            List<Message.ToolCall> valid = new ArrayList<>();
            for (JsonNode call : rawCalls) {
                String reason = validator.rejectionReason(call, toolNames);
                if (reason == null) {
                    valid.add(toToolCall(call));
                    stats.setValidCalls(stats.getValidCalls() + 1);
                } else {
                    stats.setInvalidCalls(stats.getInvalidCalls() + 1);
                    stats.recordError(reason);
                    log.warn("[Synthesizer] Invalid tool call on attempt {}: {}", attempt + 1, reason);
                }
            }

            if (!valid.isEmpty()) {
                stats.setSuccess(true);
                return new SynthesisResult(valid, stats);
            }

            if (attempt + 1 < maxRetries) {
                if (attempt >= 1) {
                    instruction = rewriteInstruction(instruction, stats.lastError(), candidates);
                }
                candidates = shrinkCandidates(instruction, candidates, tools.size(), attempt);
            }
        }

        log.warn("[Synthesizer] No valid tool call after {} attempts: {}", stats.getAttempts(), stats.lastError());
        return new SynthesisResult(List.of(), stats);
    }

    /**
     * Number of tools kept after failed attempt {@code attempt} (zero based),
     * relative to the original list size.
     */
    static int keepCount(int originalSize, int attempt) {
        double fraction = 1 - Math.min(SHRINK_STEP * (attempt + 1), MAX_SHRINK);
        return Math.max(1, (int) Math.floor(originalSize * fraction));
    }

    List<ToolSchema> shrinkCandidates(String instruction, List<ToolSchema> candidates, int originalSize,
            int attempt) {
        int keep = Math.min(keepCount(originalSize, attempt), candidates.size());
        Set<String> keywords = keywords(instruction);
        List<ToolSchema> ranked = new ArrayList<>(candidates);
        // List.sort is stable, so ties keep their current order
        ranked.sort(Comparator.comparingInt((ToolSchema tool) -> overlap(keywords, tool)).reversed());
        List<ToolSchema> kept = new ArrayList<>(ranked.subList(0, keep));
        log.debug("[Synthesizer] Narrowed candidates to {}: {}", keep,
                kept.stream().map(ToolSchema::getName).toList());
        return kept;
    }

    String rewriteInstruction(String instruction, String lastError, List<ToolSchema> candidates) {
        StringBuilder user = new StringBuilder();
        user.append("Instruction:\n").append(instruction).append("\n\n");
        if (lastError != null) {
            user.append("Error from the previous attempt:\n").append(lastError).append("\n\n");
        }
        user.append(toolList(candidates));

        LlmRequest request = LlmRequest.builder()
                .provider(settings.getProvider())
                .model(settings.getModel())
                .systemPrompt(REWRITE_PROMPT)
                .temperature(settings.getTemperature())
                .build();
        request.addMessage(Message.builder().role(Message.ROLE_USER).content(user.toString()).build());

        try {
            LlmResponse response = call(request);
            if (response != null && response.hasChoices() && response.getContent() != null
                    && !response.getContent().isBlank()) {
                log.debug("[Synthesizer] Rewrote instruction");
                return response.getContent().strip();
            }
            log.debug("[Synthesizer] Rewrite returned no text, truncating instruction");
        } catch (SynthesisCallException e) {
            log.debug("[Synthesizer] Rewrite failed, truncating instruction: {}", e.getMessage());
        }
        return truncate(instruction);
    }

    static String truncate(String instruction) {
        int target = Math.max(MIN_INSTRUCTION_LENGTH, instruction.length() / 2);
        return instruction.length() <= target ? instruction : instruction.substring(0, target);
    }

    static String buildSystemPrompt(List<ToolSchema> candidates) {
        return """
                You are a tool calling expert. Your task is to generate correct JSON format tool calls \
                based ONLY on the tools that are available.

                AVAILABLE TOOLS (ONLY USE THESE - DO NOT INVENT NEW ONES):
                """ + toolList(candidates) + """

                IMPORTANT RULES:
                1. ONLY use tool names from the list above - never invent new tool names
                2. ONLY use parameter names that are listed for each tool - never invent new parameters
                3. If a requested tool doesn't exactly match any available tool, use the closest matching one
                4. YOU CAN USE MULTIPLE TOOLS OR THE SAME TOOL MULTIPLE TIMES if the request requires it
                5. If only one tool is needed, still use the proper array format with a single element

                You must output strictly in the following JSON format:
                {
                    "tool_calls": [
                        {
                            "function": {
                                "name": "tool_name",
                                "arguments": "{\\"parameter_name\\": \\"parameter_value\\"}"
                            }
                        }
                    ]
                }

                The number of tool calls in the array should match exactly what's needed.
                Output JSON only, no other text. The arguments must be a valid JSON string (with escaped quotes).""";
    }

    private List<JsonNode> requestCalls(String instruction, List<ToolSchema> candidates, SynthesisStats stats) {
        LlmRequest request = LlmRequest.builder()
                .provider(settings.getProvider())
                .model(settings.getModel())
                .systemPrompt(buildSystemPrompt(candidates))
                .temperature(settings.getTemperature())
                .jsonMode(true)
                .build();
        request.addMessage(Message.builder().role(Message.ROLE_USER).content(instruction).build());

        String content;
        try {
            LlmResponse response = call(request);
            if (response == null || !response.hasChoices()) {
                stats.recordError("Model returned no choices");
                return List.of();
            }
            content = response.getContent();
        } catch (SynthesisCallException e) {
            stats.recordError(e.getMessage());
            log.warn("[Synthesizer] Model call failed: {}", e.getMessage());
            return List.of();
        }
        return parseCalls(content, stats);
    }

    /**
     * Accepts {@code {"tool_calls": [...]}} or a single
     * {@code {"function": {...}}}. Adds {@code type} and {@code id} when absent.
     */
    List<JsonNode> parseCalls(String content, SynthesisStats stats) {
        if (content == null || content.isBlank()) {
            stats.recordError("Empty response from tool calling model");
            return List.of();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(stripCodeFence(content));
        } catch (JsonProcessingException e) {
            stats.recordError("Unparseable tool call output: " + e.getOriginalMessage());
            log.warn("[Synthesizer] Unparseable output: {}", content);
            return List.of();
        }

        List<JsonNode> calls = new ArrayList<>();
        if (root != null && root.has("tool_calls") && root.get("tool_calls").isArray()) {
            root.get("tool_calls").forEach(calls::add);
        } else if (root != null && root.has("function")) {
            calls.add(root);
        }
        if (calls.isEmpty()) {
            stats.recordError("No tool calls in output");
            return List.of();
        }

        for (JsonNode call : calls) {
            if (call instanceof ObjectNode node) {
                if (!node.has("type")) {
                    node.put("type", Message.ToolCall.TYPE_FUNCTION);
                }
                if (!node.hasNonNull("id")) {
                    node.put("id", newCallId());
                }
            }
        }
        return calls;
    }

    private Message.ToolCall toToolCall(JsonNode call) {
        JsonNode function = call.get("function");
        return Message.ToolCall.builder()
                .id(call.get("id").asText())
                .name(function.get("name").asText())
                .arguments(function.get("arguments").asText())
                .build();
    }

    private LlmResponse call(LlmRequest request) {
        CompletableFuture<LlmResponse> future = null;
        try {
            future = llmPort.chat(request);
            return future.get(settings.getTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new SynthesisCallException("Tool calling model timed out after " + settings.getTimeoutMs() + " ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SynthesisCallException("Tool calling model call interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new SynthesisCallException("Tool calling model failed: " + cause.getMessage());
        } catch (RuntimeException e) {
            throw new SynthesisCallException("Tool calling model failed: " + e.getMessage());
        }
    }

    private static String toolList(List<ToolSchema> tools) {
        StringBuilder sb = new StringBuilder();
        for (ToolSchema tool : tools) {
            List<String> params = tool.parameterNames();
            sb.append("- ").append(tool.getName()).append(": ")
                    .append(tool.getDescription() != null ? tool.getDescription() : "No description available")
                    .append("\n  Parameters: ")
                    .append(params.isEmpty() ? "No parameters" : String.join(", ", params))
                    .append('\n');
        }
        return sb.toString();
    }

    private static int overlap(Set<String> keywords, ToolSchema tool) {
        StringBuilder text = new StringBuilder(tool.getName() != null ? tool.getName() : "");
        text.append(' ').append(tool.getDescription() != null ? tool.getDescription() : "");
        for (String param : tool.parameterNames()) {
            text.append(' ').append(param);
        }
        Set<String> toolWords = keywords(text.toString());
        int score = 0;
        for (String keyword : keywords) {
            if (toolWords.contains(keyword)) {
                score++;
            }
        }
        return score;
    }

    static Set<String> keywords(String text) {
        Set<String> words = new LinkedHashSet<>();
        if (text == null) {
            return words;
        }
        for (String word : text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (word.length() > 1) {
                words.add(word);
            }
        }
        return words;
    }

    private static String stripCodeFence(String content) {
        String trimmed = content.strip();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int lastFence = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && lastFence > firstNewline) {
                return trimmed.substring(firstNewline + 1, lastFence).strip();
            }
        }
        return trimmed;
    }

    private static String newCallId() {
        return "call_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    /**
     * A model call made during synthesis failed; always handled inside this
     * class.
     */
    private static final class SynthesisCallException extends RuntimeException {
        private static final long serialVersionUID = 1L;

        SynthesisCallException(String message) {
            super(message);
        }
    }
}
