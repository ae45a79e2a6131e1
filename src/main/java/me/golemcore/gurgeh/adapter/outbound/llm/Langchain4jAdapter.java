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

package me.golemcore.gurgeh.adapter.outbound.llm;

import me.golemcore.gurgeh.domain.model.LlmRequest;
import me.golemcore.gurgeh.domain.model.LlmResponse;
import me.golemcore.gurgeh.domain.model.LlmUsage;
import me.golemcore.gurgeh.domain.model.Message;
import me.golemcore.gurgeh.domain.model.ReasoningResult;
import me.golemcore.gurgeh.domain.model.ToolDefinition;
import me.golemcore.gurgeh.infrastructure.config.AgentProperties;
import me.golemcore.gurgeh.port.outbound.LlmPort;
import me.golemcore.gurgeh.port.outbound.ReasoningPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Reasoning backend using the langchain4j Anthropic integration.
 *
 * <p>
 * Serves two ports: the single-shot {@link ReasoningPort} used by each
 * awakening, and the tool-using {@link LlmPort} used by delegated workers.
 * Transient failures (rate limit, overload, server errors, timeouts) are
 * retried with fixed backoff. An authentication failure marks the adapter
 * fatally unavailable until restart.
 *
 * <p>
 * Configuration via {@code agent.llm.*} and {@code agent.delegation.*}.
 *
 * @see LlmErrorClassifier
 */
@Component
@Slf4j
public class Langchain4jAdapter implements ReasoningPort, LlmPort {

    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final AgentProperties.LlmProperties llmConfig;
    private final AgentProperties.DelegationProperties delegationConfig;
    private final int maxTokensPerCycle;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private volatile ChatModel primaryModel;
    private volatile ChatModel delegateModel;
    private volatile boolean fatal;

    public Langchain4jAdapter(AgentProperties properties) {
        this.llmConfig = properties.getLlm();
        this.delegationConfig = properties.getDelegation();
        this.maxTokensPerCycle = properties.getAwakening().getMaxTokensPerCycle();
    }

    @Override
    public boolean isAvailable() {
        return !fatal && llmConfig.getApiKey() != null && !llmConfig.getApiKey().isBlank();
    }

    @Override
    public Optional<ReasoningResult> reason(String systemPrompt, String userMessage, int maxOutputTokens) {
        if (!isAvailable()) {
            log.error("[LLM] Reasoning unavailable: {}", fatal ? "fatal backend error" : "no API key configured");
            return Optional.empty();
        }

        List<ChatMessage> messages = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(SystemMessage.from(systemPrompt));
        }
        messages.add(UserMessage.from(userMessage));
        ChatRequest request = ChatRequest.builder()
                .messages(messages)
                .maxOutputTokens(maxOutputTokens)
                .build();

        try {
            ChatModel model = getPrimaryModel();
            ChatResponse response = callWithRetry(() -> model.chat(request), llmConfig.getMaxAttempts(),
                    llmConfig.getBackoffMs(), "reasoning");
            String text = response.aiMessage().text();
            LlmUsage usage = convertUsage(response.tokenUsage());
            String stopReason = response.finishReason() != null ? response.finishReason().name() : "unknown";
            log.info("[LLM] Reasoning complete: {} in / {} out, stop={}", usage.getInputTokens(),
                    usage.getOutputTokens(), stopReason);
            return Optional.of(new ReasoningResult(text != null ? text : "", usage, stopReason));
        } catch (LlmCallException e) {
            log.error("[LLM] Reasoning call failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            if (!isAvailable()) {
                throw new LlmCallException(LlmErrorClassifier.withCode(LlmErrorClassifier.AUTHENTICATION,
                        "Reasoning backend unavailable"));
            }
            ChatRequest.Builder builder = ChatRequest.builder()
                    .messages(convertMessages(request));
            List<ToolSpecification> tools = convertTools(request);
            if (!tools.isEmpty()) {
                builder.toolSpecifications(tools);
            }
            if (request.getMaxTokens() != null) {
                builder.maxOutputTokens(request.getMaxTokens());
            }
            ChatRequest chatRequest = builder.build();

            ChatModel model = getDelegateModel();
            ChatResponse response = callWithRetry(() -> model.chat(chatRequest), delegationConfig.getMaxAttempts(),
                    delegationConfig.getBackoffMs(), "delegation");
            return convertResponse(response);
        });
    }

    /**
     * Creates the underlying chat model. Visible for tests.
     */
    protected ChatModel createModel(String modelName, int maxTokens) {
        AnthropicChatModel.AnthropicChatModelBuilder builder = AnthropicChatModel.builder()
                .apiKey(llmConfig.getApiKey())
                .modelName(modelName)
                .maxRetries(0) // Retry handled by our backoff logic
                .maxTokens(maxTokens)
                .temperature(llmConfig.getTemperature())
                .timeout(Duration.ofMillis(llmConfig.getTimeoutMs()));
        if (llmConfig.getBaseUrl() != null && !llmConfig.getBaseUrl().isBlank()) {
            builder.baseUrl(llmConfig.getBaseUrl());
        }
        log.info("[LLM] Created model {} (max tokens {})", modelName, maxTokens);
        return builder.build();
    }

    private ChatModel getPrimaryModel() {
        ChatModel model = primaryModel;
        if (model == null) {
            synchronized (this) {
                if (primaryModel == null) {
                    primaryModel = createModel(llmConfig.getModel(), maxTokensPerCycle);
                }
                model = primaryModel;
            }
        }
        return model;
    }

    private ChatModel getDelegateModel() {
        ChatModel model = delegateModel;
        if (model == null) {
            synchronized (this) {
                if (delegateModel == null) {
                    delegateModel = createModel(delegationConfig.getModel(), delegationConfig.getMaxOutputTokens());
                }
                model = delegateModel;
            }
        }
        return model;
    }

    private ChatResponse callWithRetry(Supplier<ChatResponse> call, int maxAttempts, List<Long> backoffMs,
            String purpose) {
        int attempts = Math.max(1, maxAttempts);
        for (int attempt = 0; attempt < attempts; attempt++) {
            try {
                return call.get();
            } catch (RuntimeException e) {
                String code = LlmErrorClassifier.classify(e);
                if (LlmErrorClassifier.isFatal(code)) {
                    fatal = true;
                    log.error("[LLM] Fatal {} error ({}), disabling reasoning until restart", purpose, code);
                    throw new LlmCallException(LlmErrorClassifier.withCode(code, e.getMessage()), e);
                }
                boolean retry = LlmErrorClassifier.isTransient(code) && attempt < attempts - 1;
                if (!retry) {
                    throw new LlmCallException(LlmErrorClassifier.withCode(code, e.getMessage()), e);
                }
                long delay = backoffFor(backoffMs, attempt);
                log.warn("[LLM] Retryable {} error {} (attempt {}/{}), retrying in {}ms", purpose, code,
                        attempt + 1, attempts, delay);
                sleep(delay);
            }
        }
        throw new LlmCallException("LLM call failed: max retries exhausted");
    }

    private static long backoffFor(List<Long> backoffMs, int attempt) {
        if (backoffMs == null || backoffMs.isEmpty()) {
            return 0;
        }
        return backoffMs.get(Math.min(attempt, backoffMs.size() - 1));
    }

    private static void sleep(long delayMs) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new LlmCallException("LLM call interrupted during retry backoff", ie);
        }
    }

    private List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();

        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }

        for (Message msg : request.getMessages()) {
            switch (msg.getRole()) {
            case "user" -> messages.add(UserMessage.from(msg.getContent()));
            case "assistant" -> {
                if (msg.hasToolCalls()) {
                    List<ToolExecutionRequest> toolRequests = msg.getToolCalls().stream()
                            .map(tc -> ToolExecutionRequest.builder()
                                    .id(tc.getId())
                                    .name(tc.getName())
                                    .arguments(convertArgsToJson(tc.getArguments()))
                                    .build())
                            .toList();
                    if (msg.getContent() != null && !msg.getContent().isBlank()) {
                        messages.add(AiMessage.from(msg.getContent(), toolRequests));
                    } else {
                        messages.add(AiMessage.from(toolRequests));
                    }
                } else {
                    messages.add(AiMessage.from(msg.getContent()));
                }
            }
            case "tool" -> messages.add(ToolExecutionResultMessage.from(
                    msg.getToolCallId(),
                    msg.getToolName(),
                    msg.getContent()));
            default -> log.warn("[LLM] Unknown message role: {}, skipping", msg.getRole());
            }
        }
        return messages;
    }

    private List<ToolSpecification> convertTools(LlmRequest request) {
        if (request.getTools() == null || request.getTools().isEmpty()) {
            return Collections.emptyList();
        }
        return request.getTools().stream()
                .map(this::convertToolDefinition)
                .toList();
    }

    @SuppressWarnings("unchecked")
    private ToolSpecification convertToolDefinition(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        if (tool.getInputSchema() != null) {
            Map<String, Object> schema = tool.getInputSchema();
            Map<String, Object> properties = (Map<String, Object>) schema.get(SCHEMA_KEY_PROPERTIES);
            List<String> required = (List<String>) schema.get("required");

            if (properties != null) {
                JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
                for (Map.Entry<String, Object> entry : properties.entrySet()) {
                    schemaBuilder.addProperty(entry.getKey(),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
                if (required != null && !required.isEmpty()) {
                    schemaBuilder.required(required);
                }
                builder.parameters(schemaBuilder.build());
            }
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = (String) paramSchema.getOrDefault("type", "string");
        String description = (String) paramSchema.get("description");
        List<String> enumValues = (List<String>) paramSchema.get("enum");

        if (enumValues != null && !enumValues.isEmpty()) {
            return JsonEnumSchema.builder().enumValues(enumValues).description(description).build();
        }

        return switch (type) {
        case "integer" -> JsonIntegerSchema.builder().description(description).build();
        case "number" -> JsonNumberSchema.builder().description(description).build();
        case "boolean" -> JsonBooleanSchema.builder().description(description).build();
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder().description(description);
            if (paramSchema.containsKey("items")) {
                builder.items(toJsonSchemaElement((Map<String, Object>) paramSchema.get("items")));
            }
            yield builder.build();
        }
        default -> JsonStringSchema.builder().description(description).build();
        };
    }

    private LlmResponse convertResponse(ChatResponse response) {
        AiMessage aiMessage = response.aiMessage();

        List<Message.ToolCall> toolCalls = null;
        if (aiMessage.hasToolExecutionRequests()) {
            toolCalls = aiMessage.toolExecutionRequests().stream()
                    .map(ter -> Message.ToolCall.builder()
                            .id(ter.id())
                            .name(ter.name())
                            .arguments(parseJsonArgs(ter.arguments()))
                            .build())
                    .toList();
            log.trace("[LLM] Parsed {} tool calls from response", toolCalls.size());
        }

        return LlmResponse.builder()
                .content(aiMessage.text())
                .toolCalls(toolCalls)
                .usage(convertUsage(response.tokenUsage()))
                .model(delegationConfig.getModel())
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }

    private static LlmUsage convertUsage(TokenUsage tokenUsage) {
        if (tokenUsage == null) {
            return LlmUsage.empty();
        }
        return LlmUsage.of(
                tokenUsage.inputTokenCount() != null ? tokenUsage.inputTokenCount() : 0,
                tokenUsage.outputTokenCount() != null ? tokenUsage.outputTokenCount() : 0);
    }

    private String convertArgsToJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (JsonProcessingException e) {
            log.warn("[LLM] Failed to serialize tool arguments: {}", e.getMessage());
            return "{}";
        }
    }

    private Map<String, Object> parseJsonArgs(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE_REF);
        } catch (JsonProcessingException e) {
            log.warn("[LLM] Failed to parse tool arguments: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }

    /**
     * Raised when a backend call fails for good.
     */
    public static class LlmCallException extends RuntimeException {
        private static final long serialVersionUID = 1L;

        public LlmCallException(String message) {
            super(message);
        }

        public LlmCallException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
