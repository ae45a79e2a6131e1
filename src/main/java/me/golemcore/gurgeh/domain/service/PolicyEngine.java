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

import me.golemcore.gurgeh.domain.model.Action;
import me.golemcore.gurgeh.domain.model.ActionKind;
import me.golemcore.gurgeh.domain.model.DecisionRecord;
import me.golemcore.gurgeh.domain.model.DecisionRecord.Decision;
import me.golemcore.gurgeh.infrastructure.config.AgentProperties;
import me.golemcore.gurgeh.security.CommandDenylist;
import me.golemcore.gurgeh.security.PathSandbox;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Evaluates every proposed action before execution and produces an auditable
 * {@link DecisionRecord}.
 *
 * <p>
 * Rules, first match wins:
 * <ul>
 * <li>malformed action (missing required field) - block</li>
 * <li>write target is the founding document or inside the agent source tree -
 * block</li>
 * <li>shell command matches the {@link CommandDenylist} - block</li>
 * <li>everything else - proceed, with a kind-specific harm assessment</li>
 * </ul>
 *
 * <p>
 * Decisions for externally facing kinds and every block are persisted via
 * {@link DecisionRecordStore}. The engine consults no other component's state
 * except path legality, and never throws for a well-typed action.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class PolicyEngine {

    private static final int PREVIEW_LENGTH = 100;

    private final PathSandbox sandbox;
    private final CommandDenylist commandDenylist;
    private final DecisionRecordStore recordStore;
    private final DecisionRetentionPolicy retentionPolicy;
    private final Clock clock;
    private final List<String> protectedFiles;
    private final String sourcePrefix;
    private final AtomicLong decisionCounter = new AtomicLong();

    public PolicyEngine(PathSandbox sandbox, CommandDenylist commandDenylist, DecisionRecordStore recordStore,
            DecisionRetentionPolicy retentionPolicy, AgentProperties properties, Clock clock) {
        this.sandbox = sandbox;
        this.commandDenylist = commandDenylist;
        this.recordStore = recordStore;
        this.retentionPolicy = retentionPolicy;
        this.clock = clock;
        this.protectedFiles = List.copyOf(properties.getSandbox().getProtectedFiles());
        this.sourcePrefix = properties.getSandbox().getSourcePrefix();
    }

    /**
     * Evaluates the actions in order and returns those that may proceed.
     * Blocked actions are logged and dropped.
     */
    public List<Action> filter(List<Action> actions) {
        List<Action> approved = new ArrayList<>();
        for (Action action : actions) {
            DecisionRecord record = evaluate(action);
            if (record.isBlocked()) {
                log.warn("[Policy] Blocked {} action: {}", action.kind().getTag(), record.getReasoning());
                continue;
            }
            approved.add(action);
        }
        log.info("[Policy] {} of {} actions approved", approved.size(), actions.size());
        return approved;
    }

    /**
     * Evaluates a single action and persists the decision when it must be
     * audited.
     */
    public DecisionRecord evaluate(Action action) {
        DecisionRecord record = decide(action);
        if (record.isBlocked() || action.kind().isExternallyFacing()) {
            persist(record);
        }
        return record;
    }

    private DecisionRecord decide(Action action) {
        String id = nextId();
        Instant now = Instant.now(clock);
        ActionKind kind = action.kind();

        Optional<String> validationError = action.validationError();
        if (validationError.isPresent()) {
            return record(id, now, kind, "Malformed " + kind.getTag() + " action",
                    "Cannot assess an incomplete action.", Decision.BLOCK, validationError.get());
        }

        if (writesToPath(kind)) {
            Optional<DecisionRecord> hardBlock = checkProtectedTarget(id, now, action);
            if (hardBlock.isPresent()) {
                return hardBlock.get();
            }
        }

        return switch (kind) {
        case EXECUTE -> evaluateCommand(id, now, (Action.Execute) action);
        case SERVE -> record(id, now, kind, "Serve content at " + action.targetPath().orElse(""),
                "Published with an AI disclosure notice. Low risk.", Decision.PROCEED,
                "Disclosure is injected before publishing.");
        case FETCH -> record(id, now, kind, "Fetch " + ((Action.Fetch) action).url(),
                "Domain allow-list is enforced by the fetch tool.", Decision.PROCEED,
                "Outbound requests are limited to allow-listed domains.");
        case IMAGE -> record(id, now, kind, "Generate image: " + preview(action.content()),
                "Generated image is stored in the public zone and audited.", Decision.PROCEED,
                "Image generation is permitted.");
        case DELEGATE -> record(id, now, kind, "Delegate generation of " + action.targetPath().orElse(""),
                "Workers are read-only; their output passes through the regular write pipeline.",
                Decision.PROCEED, "Delegated output is written by the executor, not by the worker.");
        case MESSAGE -> record(id, now, kind,
                "Message to " + ((Action.OutboundMessage) action).effectiveRecipient() + ": "
                        + preview(action.content()),
                "Stored in the outbox for review, never sent automatically.", Decision.PROCEED,
                "Local outbox only.");
        default -> record(id, now, kind, kind.getTag() + " action",
                "Internal action without external effects.", Decision.PROCEED,
                "No harm pathway identified.");
        };
    }

    private DecisionRecord evaluateCommand(String id, Instant now, Action.Execute action) {
        Optional<String> violation = commandDenylist.findViolation(action.command(), action.workingDir());
        if (violation.isPresent()) {
            return record(id, now, ActionKind.EXECUTE, "Destructive command: " + preview(action.command()),
                    "Command matches the destructive pattern denylist.", Decision.BLOCK,
                    "Command blocked by safety denylist: " + violation.get());
        }
        return record(id, now, ActionKind.EXECUTE, "Shell command: " + preview(action.command()),
                "Shell access granted by the operator. Command is logged for audit.", Decision.PROCEED,
                "No denylist pattern matched.");
    }

    private Optional<DecisionRecord> checkProtectedTarget(String id, Instant now, Action action) {
        Optional<String> target = action.targetPath();
        if (target.isEmpty()) {
            return Optional.empty();
        }

        String normalized;
        try {
            normalized = sandbox.normalize(target.get());
        } catch (PathSandbox.SandboxViolationException e) {
            return Optional.of(record(id, now, action.kind(), "Illegal target path: " + target.get(),
                    "Path traversal outside the sandbox.", Decision.BLOCK, e.getMessage()));
        }

        for (String protectedFile : protectedFiles) {
            if (normalized.startsWith(stem(protectedFile))) {
                return Optional.of(record(id, now, action.kind(), "Write to founding document: " + normalized,
                        "The founding document is immutable.", Decision.BLOCK,
                        "The founding document cannot be modified."));
            }
        }
        if (sourcePrefix != null && (normalized.equals(sourcePrefix) || normalized.startsWith(sourcePrefix + "/"))) {
            return Optional.of(record(id, now, action.kind(), "Write to agent source: " + normalized,
                    "Self-modification of the agent source tree is not permitted.", Decision.BLOCK,
                    "The agent cannot modify its own source code."));
        }
        return Optional.empty();
    }

    private static boolean writesToPath(ActionKind kind) {
        return kind == ActionKind.WRITE || kind == ActionKind.SERVE
                || kind == ActionKind.IMAGE || kind == ActionKind.DELEGATE;
    }

    private static String stem(String protectedFile) {
        int dot = protectedFile.lastIndexOf('.');
        int slash = protectedFile.lastIndexOf('/');
        return dot > slash ? protectedFile.substring(0, dot) : protectedFile;
    }

    private void persist(DecisionRecord record) {
        recordStore.save(record);
        if (retentionPolicy.onRecordPersisted()) {
            recordStore.compact(retentionPolicy.getRetentionLimit());
        }
    }

    private String nextId() {
        long counter = decisionCounter.incrementAndGet();
        return String.format("decision-%d-%04d", clock.millis(), counter);
    }

    private static DecisionRecord record(String id, Instant now, ActionKind kind, String description,
            String harmAssessment, Decision decision, String reasoning) {
        return DecisionRecord.builder()
                .id(id)
                .timestamp(now)
                .actionType(kind.getTag())
                .description(description)
                .harmAssessment(harmAssessment)
                .decision(decision)
                .reasoning(reasoning)
                .build();
    }

    private static String preview(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > PREVIEW_LENGTH ? text.substring(0, PREVIEW_LENGTH) + "..." : text;
    }
}
