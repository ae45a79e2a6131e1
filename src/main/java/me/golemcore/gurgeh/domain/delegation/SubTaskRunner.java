package me.golemcore.gurgeh.domain.delegation;

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

import me.golemcore.gurgeh.domain.component.ToolComponent;
import me.golemcore.gurgeh.domain.model.Action;
import me.golemcore.gurgeh.domain.model.DelegationOutcome;
import me.golemcore.gurgeh.domain.model.DelegationTaskType;
import me.golemcore.gurgeh.domain.model.LlmRequest;
import me.golemcore.gurgeh.domain.model.LlmResponse;
import me.golemcore.gurgeh.domain.model.LlmUsage;
import me.golemcore.gurgeh.domain.model.Message;
import me.golemcore.gurgeh.domain.model.ToolDefinition;
import me.golemcore.gurgeh.domain.model.ToolResult;
import me.golemcore.gurgeh.infrastructure.config.AgentProperties;
import me.golemcore.gurgeh.port.outbound.LlmPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * Runs one delegated sub-task: a bounded tool loop against the delegate model
 * with a read-only tool surface.
 *
 * <p>
 * The loop ends when the model answers without tool calls. When the turn cap
 * is reached first, the last text the model produced is salvaged. The worker
 * never writes files; its final text is returned to the orchestrator.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class SubTaskRunner {

    static final String TRUNCATION_MARKER = "\n... [truncated]";

    private static final String CODE_PROMPT = """
            You are a code generation worker for an autonomous AI entity.
            Produce high-quality code based on the brief provided.
            You can read the entity's existing files using the read_file and list_files tools \
            to understand context, style, and conventions.

            Rules:
            - Produce ONLY the final code content. No preamble, no explanation, no markdown fences.
            - Write clean, working code with helpful comments.
            - If the brief references existing files, read them first for context.
            - Your output will be written to a file by the supervisor. Return only the file content.""";

    private static final String SERVE_PROMPT = """
            You are a content generation worker for an autonomous AI entity.
            Produce high-quality web content based on the brief provided.
            You can read the entity's existing files using the read_file and list_files tools \
            to understand the site's style and structure.

            Rules:
            - Produce ONLY the final HTML/CSS/JS content. No preamble, no explanation, no markdown fences.
            - For HTML: produce complete, self-contained files with inline CSS and JS.
            - Match the visual style of the existing site if possible \
            (read /public/index.html or /public/style.css for reference).
            - An AI disclosure footer will be injected automatically. Do NOT add one yourself.
            - Your output will be written to a file by the supervisor. Return only the file content.""";

    private final LlmPort llmPort;
    private final Map<String, ToolComponent> tools = new LinkedHashMap<>();
    private final int maxTurns;
    private final int maxToolResultChars;
    private final int maxOutputTokens;

    public SubTaskRunner(LlmPort llmPort, List<ToolComponent> tools, AgentProperties properties) {
        this.llmPort = llmPort;
        tools.forEach(tool -> this.tools.put(tool.getToolName(), tool));
        AgentProperties.DelegationProperties config = properties.getDelegation();
        this.maxTurns = Math.max(1, config.getMaxTurns());
        this.maxToolResultChars = config.getMaxToolResultChars();
        this.maxOutputTokens = config.getMaxOutputTokens();
    }

    /**
     * Runs the worker loop for one delegate action. Never throws; the outcome
     * carries the accumulated usage even on failure. Cost is left for the
     * caller to fill in.
     */
    public DelegationOutcome run(Action.Delegate task) {
        DelegationTaskType taskType = task.effectiveTaskType();
        String systemPrompt = taskType == DelegationTaskType.CODE ? CODE_PROMPT : SERVE_PROMPT;
        List<ToolDefinition> toolDefinitions = tools.values().stream()
                .map(ToolComponent::getDefinition)
                .toList();

        List<Message> messages = new ArrayList<>();
        messages.add(Message.user(task.brief()));
        LlmUsage usage = LlmUsage.empty();
        String lastText = null;
        int turns = 0;

        log.info("[Delegation] Starting {} worker for {} (brief: {} chars)",
                taskType, task.path(), task.brief().length());

        while (turns < maxTurns) {
            turns++;
            LlmResponse response;
            try {
                response = llmPort.chat(LlmRequest.builder()
                        .systemPrompt(systemPrompt)
                        .messages(new ArrayList<>(messages))
                        .tools(toolDefinitions)
                        .maxTokens(maxOutputTokens)
                        .build()).join();
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("[Delegation] Worker call failed on turn {}: {}", turns, cause.getMessage());
                return failure(task, "Worker call failed: " + cause.getMessage(), usage, turns);
            }
            if (response == null) {
                return failure(task, "Worker received no response", usage, turns);
            }

            usage.add(response.getUsage());
            // Only the latest turn's text can be salvaged at the cap
            lastText = response.getContent();

            if (!response.hasToolCalls()) {
                if (response.getContent() == null || response.getContent().isBlank()) {
                    log.warn("[Delegation] Worker returned empty content for {}", task.path());
                    return failure(task, "Worker returned empty content", usage, turns);
                }
                return success(task, response.getContent(), usage, turns);
            }

            messages.add(Message.builder()
                    .role("assistant")
                    .content(response.getContent())
                    .toolCalls(response.getToolCalls())
                    .build());
            for (Message.ToolCall call : response.getToolCalls()) {
                messages.add(Message.toolResult(call, truncate(executeTool(call))));
            }
        }

        log.warn("[Delegation] Worker for {} hit max turns ({}) without completing", task.path(), maxTurns);
        if (lastText != null && !lastText.isBlank()) {
            return success(task, lastText, usage, turns);
        }
        return failure(task, "Worker hit max turns without producing content", usage, turns);
    }

    private String executeTool(Message.ToolCall call) {
        ToolComponent tool = tools.get(call.getName());
        if (tool == null) {
            return "Unknown tool: " + call.getName();
        }
        log.debug("[Delegation] Tool call: {} {}", call.getName(), call.getArguments());
        try {
            Map<String, Object> arguments = call.getArguments() != null ? call.getArguments() : Map.of();
            ToolResult result = tool.execute(arguments).join();
            return result.toModelText();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return "Error: " + cause.getMessage();
        }
    }

    private String truncate(String text) {
        if (text.length() <= maxToolResultChars) {
            return text;
        }
        return text.substring(0, maxToolResultChars) + TRUNCATION_MARKER;
    }

    private static DelegationOutcome success(Action.Delegate task, String content, LlmUsage usage, int turns) {
        log.info("[Delegation] Worker for {} completed in {} turns ({} chars)", task.path(), turns,
                content.length());
        return DelegationOutcome.builder()
                .task(task)
                .success(true)
                .content(content)
                .usage(usage)
                .turns(turns)
                .build();
    }

    private static DelegationOutcome failure(Action.Delegate task, String error, LlmUsage usage, int turns) {
        return DelegationOutcome.builder()
                .task(task)
                .success(false)
                .error(error)
                .usage(usage)
                .turns(turns)
                .build();
    }
}
