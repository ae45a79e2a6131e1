package me.golemcore.gurgeh.domain.service;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.gurgeh.domain.delegation.DelegationOrchestrator;
import me.golemcore.gurgeh.domain.model.Action;
import me.golemcore.gurgeh.domain.model.DelegationOutcome;
import me.golemcore.gurgeh.domain.model.DelegationTaskType;
import me.golemcore.gurgeh.domain.model.ExecutionLog;
import me.golemcore.gurgeh.domain.model.ExecutionResult;
import me.golemcore.gurgeh.domain.model.FetchResult;
import me.golemcore.gurgeh.domain.model.WriteMode;
import me.golemcore.gurgeh.infrastructure.config.AgentProperties;
import me.golemcore.gurgeh.port.outbound.CheckpointPort;
import me.golemcore.gurgeh.port.outbound.FetchPort;
import me.golemcore.gurgeh.port.outbound.ImageGenerationPort;
import me.golemcore.gurgeh.security.PathSandbox;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Carries out approved actions against the sandboxed filesystem and the
 * outbound ports.
 *
 * <p>
 * Every action yields exactly one {@link ExecutionResult}, in input order; a
 * failing action never prevents the next one from running. Delegate actions
 * are collected and handed to the {@link DelegationOrchestrator} in a single
 * call after the other actions, and the content their workers return goes
 * through the same write path as serve and write actions.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class ActionExecutor {

    static final String PUBLIC_PREFIX = "/public/";
    static final String EXECUTION_LOG_DIR = "/self/execution-logs";
    static final String FETCH_RESULTS_DIR = "/self/fetch-results";
    static final String OUTBOX_DIR = "/comms/outbox";
    static final String IMAGES_DIR = "/public/images";

    private static final int ERROR_PREVIEW = 200;
    private static final int THOUGHT_PREVIEW = 200;

    private final AgentFileService fileService;
    private final PathSandbox sandbox;
    private final ShellCommandRunner shellRunner;
    private final DisclosureInjector disclosureInjector;
    private final ScheduleService scheduleService;
    private final DelegationOrchestrator delegationOrchestrator;
    private final FetchPort fetchPort;
    private final CheckpointPort checkpointPort;
    private final List<ImageGenerationPort> imageGenerators;
    private final ObjectMapper objectMapper;
    private final AgentProperties.ShellProperties shellConfig;
    private final Clock clock;

    @SuppressWarnings("PMD.ExcessiveParameterList")
    public ActionExecutor(AgentFileService fileService, PathSandbox sandbox, ShellCommandRunner shellRunner,
            DisclosureInjector disclosureInjector, ScheduleService scheduleService,
            DelegationOrchestrator delegationOrchestrator, FetchPort fetchPort, CheckpointPort checkpointPort,
            List<ImageGenerationPort> imageGenerators, ObjectMapper objectMapper, AgentProperties properties,
            Clock clock) {
        this.fileService = fileService;
        this.sandbox = sandbox;
        this.shellRunner = shellRunner;
        this.disclosureInjector = disclosureInjector;
        this.scheduleService = scheduleService;
        this.delegationOrchestrator = delegationOrchestrator;
        this.fetchPort = fetchPort;
        this.checkpointPort = checkpointPort;
        this.imageGenerators = imageGenerators;
        this.objectMapper = objectMapper;
        this.shellConfig = properties.getShell();
        this.clock = clock;
    }

    /**
     * Executes approved actions.
     *
     * @param actions
     *            actions approved by the policy engine
     * @param awakening
     *            current awakening number
     * @return one result per action, in input order
     */
    public List<ExecutionResult> execute(List<Action> actions, long awakening) {
        ExecutionResult[] results = new ExecutionResult[actions.size()];
        List<Integer> delegateIndexes = new ArrayList<>();

        for (int i = 0; i < actions.size(); i++) {
            Action action = actions.get(i);
            if (action instanceof Action.Delegate) {
                delegateIndexes.add(i);
                continue;
            }
            results[i] = executeSafely(action, awakening);
        }

        if (!delegateIndexes.isEmpty()) {
            List<Action.Delegate> tasks = delegateIndexes.stream()
                    .map(i -> (Action.Delegate) actions.get(i))
                    .toList();
            List<ExecutionResult> delegated = executeDelegations(tasks, awakening);
            for (int j = 0; j < delegateIndexes.size(); j++) {
                results[delegateIndexes.get(j)] = delegated.get(j);
            }
        }

        List<ExecutionResult> ordered = Arrays.asList(results);
        long succeeded = ordered.stream().filter(ExecutionResult::isSuccess).count();
        log.info("[Executor] {} of {} actions succeeded", succeeded, ordered.size());
        return ordered;
    }

    private ExecutionResult executeSafely(Action action, long awakening) {
        try {
            return executeOne(action, awakening);
        } catch (PathSandbox.SandboxViolationException e) {
            log.warn("[Executor] Sandbox rejected {} action: {}", action.kind().getTag(), e.getMessage());
            return ExecutionResult.failure(action, e.getMessage());
        } catch (RuntimeException e) {
            log.error("[Executor] {} action failed", action.kind().getTag(), e);
            return ExecutionResult.failure(action, e.getMessage());
        }
    }

    private ExecutionResult executeOne(Action action, long awakening) {
        return switch (action.kind()) {
        case WRITE -> executeWrite((Action.Write) action);
        case SERVE -> executeServe((Action.Serve) action);
        case THINK -> executeThink((Action.Think) action);
        case CHECKPOINT -> executeCheckpoint((Action.Checkpoint) action);
        case MESSAGE -> executeMessage((Action.OutboundMessage) action);
        case FETCH -> executeFetch((Action.Fetch) action);
        case EXECUTE -> executeCommand((Action.Execute) action, awakening);
        case IMAGE -> executeImage((Action.Image) action);
        case SET_SCHEDULE -> executeSetSchedule((Action.SetSchedule) action);
        case DELEGATE -> ExecutionResult.failure(action, "Delegate actions are executed in batch");
        };
    }

    private ExecutionResult executeWrite(Action.Write action) {
        Optional<String> invalid = action.validationError();
        if (invalid.isPresent()) {
            return ExecutionResult.failure(action, invalid.get());
        }
        WriteMode mode = action.effectiveMode();
        if (mode == WriteMode.APPEND) {
            fileService.appendEntry(action.path(), action.content());
        } else {
            fileService.write(action.path(), action.content(), WriteMode.OVERWRITE);
        }
        log.info("[Executor] Write {} ({}, {} chars)", action.path(), mode, action.content().length());
        return ExecutionResult.success(action);
    }

    private ExecutionResult executeServe(Action.Serve action) {
        Optional<String> invalid = action.validationError();
        if (invalid.isPresent()) {
            return ExecutionResult.failure(action, invalid.get());
        }
        String servePath = publish(action.path(), action.content());
        return ExecutionResult.success(action, servePath);
    }

    private ExecutionResult executeThink(Action.Think action) {
        log.info("[Executor] Thought: {}", preview(action.content(), THOUGHT_PREVIEW));
        return ExecutionResult.success(action);
    }

    private ExecutionResult executeCheckpoint(Action.Checkpoint action) {
        String label = action.effectiveLabel();
        if (checkpointPort.createCheckpoint(label)) {
            return ExecutionResult.success(action, label);
        }
        return ExecutionResult.failure(action, "Checkpoint failed: " + label);
    }

    private ExecutionResult executeMessage(Action.OutboundMessage action) {
        Optional<String> invalid = action.validationError();
        if (invalid.isPresent()) {
            return ExecutionResult.failure(action, invalid.get());
        }
        String recipient = action.effectiveRecipient();
        Instant now = Instant.now(clock);
        String path = OUTBOX_DIR + "/msg-" + now.toEpochMilli() + "-to-" + sanitizeFileToken(recipient) + ".md";
        String body = "To: " + recipient + "\nDate: " + now + "\n\n" + action.content();
        fileService.write(path, body, WriteMode.OVERWRITE);
        log.info("[Executor] Message to {} written to outbox: {}", recipient, path);
        return ExecutionResult.success(action, path);
    }

    private ExecutionResult executeFetch(Action.Fetch action) {
        Optional<String> invalid = action.validationError();
        if (invalid.isPresent()) {
            return ExecutionResult.failure(action, invalid.get());
        }
        Optional<FetchResult> result = fetchPort.fetch(action.url());
        if (result.isEmpty()) {
            return ExecutionResult.failure(action, "Fetch failed or domain not allowed");
        }

        Instant now = Instant.now(clock);
        String path = FETCH_RESULTS_DIR + "/fetch-" + now.toEpochMilli() + ".txt";
        String body = "URL: " + action.url() + "\nStatus: " + result.get().status() + "\nFetched: " + now
                + "\n\n" + result.get().body();
        try {
            fileService.write(path, body, WriteMode.OVERWRITE);
        } catch (RuntimeException e) {
            log.warn("[Executor] Could not save fetch result: {}", e.getMessage());
            return ExecutionResult.success(action);
        }
        log.info("[Executor] Fetched {} (status {})", action.url(), result.get().status());
        return ExecutionResult.success(action, path);
    }

    private ExecutionResult executeCommand(Action.Execute action, long awakening) {
        Optional<String> invalid = action.validationError();
        if (invalid.isPresent()) {
            return ExecutionResult.failure(action, invalid.get());
        }
        String logicalDir = action.workingDir() != null && !action.workingDir().isBlank()
                ? sandbox.normalize(action.workingDir())
                : shellConfig.getDefaultWorkingDir();
        Path workDir = sandbox.validate(logicalDir);
        fileService.ensureDirectory(logicalDir);

        long timeoutMs = action.timeoutMs() != null ? action.timeoutMs() : shellConfig.getDefaultTimeoutMs();
        ExecutionLog entry = shellRunner.run(action.command(), workDir, logicalDir, timeoutMs, awakening);
        persistExecutionLog(entry);

        if (entry.isSuccess()) {
            return ExecutionResult.success(action, entry.getId());
        }
        if (entry.isTimedOut()) {
            return ExecutionResult.failure(action, "Timed out after " + timeoutMs + "ms: "
                    + preview(entry.getStderr(), ERROR_PREVIEW));
        }
        return ExecutionResult.failure(action, "Exit code " + entry.getExitCode() + ": "
                + preview(entry.getStderr(), ERROR_PREVIEW));
    }

    private ExecutionResult executeImage(Action.Image action) {
        Optional<String> invalid = action.validationError();
        if (invalid.isPresent()) {
            return ExecutionResult.failure(action, invalid.get());
        }
        if (imageGenerators.isEmpty()) {
            return ExecutionResult.failure(action, "Image generation unavailable");
        }
        String path = action.path() != null && !action.path().isBlank()
                ? action.path()
                : IMAGES_DIR + "/image-" + clock.millis() + ".png";
        Path target = sandbox.validate(path);
        String aspectRatio = action.aspectRatio() != null ? action.aspectRatio() : "16:9";
        if (imageGenerators.get(0).generate(action.prompt(), aspectRatio, target)) {
            log.info("[Executor] Image generated at {}", path);
            return ExecutionResult.success(action, path);
        }
        return ExecutionResult.failure(action, "Image generation failed");
    }

    private ExecutionResult executeSetSchedule(Action.SetSchedule action) {
        Optional<String> invalid = action.validationError();
        if (invalid.isPresent()) {
            return ExecutionResult.failure(action, invalid.get());
        }
        try {
            String normalized = scheduleService.saveAgentSchedule(action.effectiveCron());
            return ExecutionResult.success(action, normalized);
        } catch (IllegalArgumentException e) {
            return ExecutionResult.failure(action, e.getMessage());
        }
    }

    private List<ExecutionResult> executeDelegations(List<Action.Delegate> tasks, long awakening) {
        List<DelegationOutcome> outcomes;
        try {
            outcomes = delegationOrchestrator.delegate(tasks, awakening);
        } catch (RuntimeException e) {
            log.error("[Executor] Delegation failed", e);
            return tasks.stream()
                    .map(task -> ExecutionResult.failure(task, "Delegation failed: " + e.getMessage()))
                    .toList();
        }

        List<ExecutionResult> results = new ArrayList<>(outcomes.size());
        for (DelegationOutcome outcome : outcomes) {
            Action.Delegate task = outcome.getTask();
            if (!outcome.isSuccess()) {
                results.add(ExecutionResult.failure(task, outcome.getError()));
                continue;
            }
            try {
                results.add(ExecutionResult.success(task, writeDelegatedContent(task, outcome.getContent())));
            } catch (RuntimeException e) {
                log.warn("[Executor] Failed to write delegated content to {}: {}", task.path(), e.getMessage());
                results.add(ExecutionResult.failure(task, e.getMessage()));
            }
        }
        return results;
    }

    private String writeDelegatedContent(Action.Delegate task, String content) {
        if (task.effectiveTaskType() == DelegationTaskType.CODE) {
            fileService.write(task.path(), content, WriteMode.OVERWRITE);
            log.info("[Executor] Delegated code written to {} ({} chars)", task.path(), content.length());
            return task.path();
        }
        return publish(task.path(), content);
    }

    private String publish(String path, String content) {
        String servePath = toServePath(path);
        String published = disclosureInjector.isMarkup(servePath) ? disclosureInjector.inject(content) : content;
        fileService.write(servePath, published, WriteMode.OVERWRITE);
        log.info("[Executor] Served {} ({} chars)", servePath, published.length());
        return servePath;
    }

    /**
     * Maps a serve target into the public zone. The prefix check runs on the
     * normalized path so that parent segments cannot leave the zone.
     */
    String toServePath(String path) {
        String normalized = sandbox.normalize(path);
        if (normalized.startsWith(PUBLIC_PREFIX)) {
            return normalized;
        }
        return PUBLIC_PREFIX + normalized.substring(1);
    }

    private void persistExecutionLog(ExecutionLog entry) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(entry);
            fileService.write(EXECUTION_LOG_DIR + "/" + entry.getId() + ".json", json, WriteMode.OVERWRITE);
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("[Executor] Failed to save execution log {}", entry.getId(), e);
        }
    }

    private static String sanitizeFileToken(String value) {
        return value.replaceAll("[^a-zA-Z0-9_-]", "_");
    }

    private static String preview(String text, int maxLen) {
        if (text == null) {
            return "";
        }
        return text.length() > maxLen ? text.substring(0, maxLen) + "..." : text;
    }
}
