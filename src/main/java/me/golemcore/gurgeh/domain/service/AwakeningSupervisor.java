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
import me.golemcore.gurgeh.domain.model.AwakeningState;
import me.golemcore.gurgeh.domain.model.CycleReport;
import me.golemcore.gurgeh.domain.model.ExecutionResult;
import me.golemcore.gurgeh.domain.model.ModelClass;
import me.golemcore.gurgeh.domain.model.ReasoningResult;
import me.golemcore.gurgeh.domain.model.SupervisorState;
import me.golemcore.gurgeh.infrastructure.config.AgentProperties;
import me.golemcore.gurgeh.port.outbound.CheckpointPort;
import me.golemcore.gurgeh.port.outbound.ReasoningPort;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives one awakening cycle at a time: gather context, reason, evaluate,
 * execute and record.
 *
 * <p>
 * The supervisor is single-flight: a trigger that arrives while a cycle is
 * running is rejected, not queued. When the energy ledger is exhausted the
 * supervisor goes {@link SupervisorState#DORMANT} after a best-effort
 * checkpoint; a later trigger re-checks the budget. A failure in any step
 * aborts the rest of that cycle only.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class AwakeningSupervisor {

    static final String DORMANCY_CHECKPOINT = "dormancy-no-energy";
    private static final int RESPONSE_EXCERPT = 500;

    private final AgentFileService fileService;
    private final EnergyLedgerService ledger;
    private final ReasoningPort reasoningPort;
    private final ContextGatherer contextGatherer;
    private final BriefingBuilder briefingBuilder;
    private final ActionParser actionParser;
    private final PolicyEngine policyEngine;
    private final ActionExecutor actionExecutor;
    private final InboxService inboxService;
    private final WorkHistoryService workHistoryService;
    private final ScheduleService scheduleService;
    private final CheckpointPort checkpointPort;
    private final AgentProperties properties;

    private final AtomicReference<SupervisorState> state = new AtomicReference<>(SupervisorState.IDLE);
    private final AtomicReference<CycleReport> lastReport = new AtomicReference<>();
    private volatile String foundingDocument = "";

    @SuppressWarnings("PMD.ExcessiveParameterList")
    public AwakeningSupervisor(AgentFileService fileService, EnergyLedgerService ledger,
            ReasoningPort reasoningPort, ContextGatherer contextGatherer, BriefingBuilder briefingBuilder,
            ActionParser actionParser, PolicyEngine policyEngine, ActionExecutor actionExecutor,
            InboxService inboxService, WorkHistoryService workHistoryService, ScheduleService scheduleService,
            CheckpointPort checkpointPort, AgentProperties properties) {
        this.fileService = fileService;
        this.ledger = ledger;
        this.reasoningPort = reasoningPort;
        this.contextGatherer = contextGatherer;
        this.briefingBuilder = briefingBuilder;
        this.actionParser = actionParser;
        this.policyEngine = policyEngine;
        this.actionExecutor = actionExecutor;
        this.inboxService = inboxService;
        this.workHistoryService = workHistoryService;
        this.scheduleService = scheduleService;
        this.checkpointPort = checkpointPort;
        this.properties = properties;
    }

    /**
     * Prepares the filesystem layout, the ledger and the founding document.
     * A missing founding document is logged and tolerated.
     */
    @PostConstruct
    public void initialize() {
        fileService.initDirectories();
        ledger.initialize();
        foundingDocument = fileService.read(properties.getFoundingDocument()).orElse("");
        if (foundingDocument.isBlank()) {
            log.error("[Supervisor] Founding document not found at {}; the agent will reason without it",
                    properties.getFoundingDocument());
        }
        log.info("[Supervisor] Initialized '{}' with balance ${}", properties.getName(),
                String.format(Locale.ROOT, "%.4f", ledger.getBalance()));
    }

    public SupervisorState getState() {
        return state.get();
    }

    public Optional<CycleReport> getLastReport() {
        return Optional.ofNullable(lastReport.get());
    }

    /**
     * Runs one awakening unless one is already in progress.
     *
     * @return false if a cycle was already running and nothing was done
     */
    public boolean triggerAwakening() {
        SupervisorState previous = state.get();
        if (previous == SupervisorState.RUNNING || !state.compareAndSet(previous, SupervisorState.RUNNING)) {
            log.warn("[Supervisor] Trigger rejected, awakening already in progress");
            return false;
        }

        SupervisorState next = SupervisorState.IDLE;
        try {
            if (!ledger.hasBudget()) {
                next = SupervisorState.DORMANT;
                enterDormancy();
                return true;
            }
            lastReport.set(runCycle());
        } catch (RuntimeException e) {
            log.error("[Supervisor] Awakening cycle error", e);
        } finally {
            state.set(next);
        }
        return true;
    }

    private void enterDormancy() {
        log.warn("[Supervisor] No energy remaining. Entering dormancy.");
        lastReport.set(CycleReport.aborted(contextGatherer.getAwakeningCount(), "No energy remaining"));
        try {
            checkpointPort.createCheckpoint(DORMANCY_CHECKPOINT);
        } catch (RuntimeException e) {
            log.warn("[Supervisor] Dormancy checkpoint failed: {}", e.getMessage());
        }
    }

    CycleReport runCycle() {
        if (!reasoningPort.isAvailable()) {
            log.error("[Supervisor] Reasoning engine unavailable. Skipping awakening.");
            return CycleReport.aborted(contextGatherer.getAwakeningCount(), "Reasoning engine unavailable");
        }

        String scheduleBefore = scheduleService.getActiveCron();
        AwakeningState awakening = contextGatherer.gather();
        long number = awakening.getAwakeningNumber();
        log.info("[Supervisor] === AWAKENING #{} ===", number);

        AgentProperties.AwakeningProperties config = properties.getAwakening();
        int contextBudget = config.getContextWindowTokens() - BriefingBuilder.estimateTokens(foundingDocument)
                - config.getMaxTokensPerCycle();
        String briefing = briefingBuilder.truncate(briefingBuilder.build(awakening), contextBudget);

        Optional<ReasoningResult> reasoning = reasoningPort.reason(foundingDocument, briefing,
                config.getMaxTokensPerCycle());
        if (reasoning.isEmpty()) {
            log.error("[Supervisor] Reasoning returned nothing. Skipping action execution.");
            return CycleReport.aborted(number, "Reasoning failed");
        }
        ReasoningResult result = reasoning.get();
        ledger.recordUsage(number, result.usage(), ModelClass.PRIMARY);

        List<Action> proposed = actionParser.parse(result.text());
        log.info("[Supervisor] Parsed {} actions: {}", proposed.size(),
                proposed.stream().map(a -> a.kind().getTag()).toList());
        List<Action> approved = policyEngine.filter(proposed);
        List<ExecutionResult> results = actionExecutor.execute(approved, number);

        inboxService.markRead(awakening.getInbox());
        workHistoryService.append(number, awakening.getTimestamp(), results);

        long succeeded = results.stream().filter(ExecutionResult::isSuccess).count();
        workHistoryService.writeAwakeningLog(number, summarize(approved.size(), succeeded, result));

        boolean scheduleChanged = approved.stream().anyMatch(a -> a.kind() == ActionKind.SET_SCHEDULE)
                && !scheduleBefore.equals(scheduleService.getActiveCron());

        log.info("[Supervisor] === AWAKENING #{} COMPLETE === actions={}, succeeded={}, balance=${}", number,
                approved.size(), succeeded, String.format(Locale.ROOT, "%.4f", ledger.getBalance()));
        return CycleReport.builder()
                .awakeningNumber(number)
                .completed(true)
                .proposedActions(proposed.size())
                .approvedActions(approved.size())
                .results(results)
                .usage(result.usage())
                .scheduleChanged(scheduleChanged)
                .build();
    }

    private String summarize(int attempted, long succeeded, ReasoningResult result) {
        String text = result.text() != null ? result.text() : "";
        return String.join("\n",
                "Actions: " + attempted + " attempted, " + succeeded + " succeeded, " + (attempted - succeeded)
                        + " failed",
                "Tokens: " + result.usage().getInputTokens() + " in / " + result.usage().getOutputTokens() + " out",
                String.format(Locale.ROOT, "Balance: $%.4f", ledger.getBalance()),
                "Stop reason: " + result.stopReason(),
                "",
                "Response excerpt:",
                text.length() > RESPONSE_EXCERPT ? text.substring(0, RESPONSE_EXCERPT) : text);
    }
}
