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
import me.golemcore.gurgeh.domain.model.AgentTask;
import me.golemcore.gurgeh.domain.model.AwakeningState;
import me.golemcore.gurgeh.domain.model.ExecutionLog;
import me.golemcore.gurgeh.domain.model.InboxMessage;
import me.golemcore.gurgeh.domain.model.WriteMode;
import me.golemcore.gurgeh.infrastructure.config.AgentProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Assembles the {@link AwakeningState} at the start of a cycle. Increments
 * the persistent awakening counter and stamps the last-awakening time as a
 * side effect. All reads go through the sandbox.
 */
@Service
@Slf4j
public class ContextGatherer {

    static final String COUNTER_FILE = "/self/awakening-count";
    static final String LAST_AWAKENING_FILE = "/self/last-awakening";
    static final String TASKS_DIR = "/self/tasks";

    private final AgentFileService fileService;
    private final InboxService inboxService;
    private final WorkHistoryService workHistoryService;
    private final EnergyLedgerService ledger;
    private final ScheduleService scheduleService;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int recentExecutionLogs;

    public ContextGatherer(AgentFileService fileService, InboxService inboxService,
            WorkHistoryService workHistoryService, EnergyLedgerService ledger, ScheduleService scheduleService,
            ObjectMapper objectMapper, AgentProperties properties, Clock clock) {
        this.fileService = fileService;
        this.inboxService = inboxService;
        this.workHistoryService = workHistoryService;
        this.ledger = ledger;
        this.scheduleService = scheduleService;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.recentExecutionLogs = properties.getAwakening().getRecentExecutionLogs();
    }

    public AwakeningState gather() {
        Instant now = Instant.now(clock);
        long awakeningNumber = getAwakeningCount() + 1;
        fileService.write(COUNTER_FILE, String.valueOf(awakeningNumber), WriteMode.OVERWRITE);

        Long timeSinceLastMs = readLastAwakening()
                .map(last -> now.toEpochMilli() - last.toEpochMilli())
                .orElse(null);
        fileService.write(LAST_AWAKENING_FILE, now.toString(), WriteMode.OVERWRITE);

        List<InboxMessage> inbox = inboxService.readUnread();
        List<AgentTask> tasks = readOpenTasks();

        AwakeningState state = AwakeningState.builder()
                .awakeningNumber(awakeningNumber)
                .timestamp(now)
                .timeSinceLastMs(timeSinceLastMs)
                .identity(readOptional("/self/identity.md"))
                .journal(readOptional("/self/journal.md"))
                .values(readOptional("/self/values.md"))
                .currentFocus(readOptional("/self/current-focus.md"))
                .workHistory(workHistoryService.read())
                .inbox(inbox)
                .tasks(tasks)
                .recentExecutions(readRecentExecutions())
                .energy(ledger.getLedger())
                .activeSchedule(scheduleService.getActiveCron())
                .build();

        log.info("[Context] Gathered awakening #{}: identity={}, journal={}, inbox={}, tasks={}, balance=${}",
                awakeningNumber, state.getIdentity() != null, state.getJournal() != null, inbox.size(),
                tasks.size(), String.format("%.4f", state.getEnergy().getBalanceUsd()));
        return state;
    }

    /**
     * Number of awakenings completed so far, 0 when the counter is missing or
     * unreadable.
     */
    public long getAwakeningCount() {
        return fileService.read(COUNTER_FILE)
                .map(String::trim)
                .map(ContextGatherer::parseCount)
                .orElse(0L);
    }

    /**
     * Open tasks sorted by priority, then by creation time.
     */
    public List<AgentTask> readOpenTasks() {
        List<AgentTask> tasks = new ArrayList<>();
        for (String file : fileService.list(TASKS_DIR)) {
            if (!file.endsWith(".json")) {
                continue;
            }
            Optional<String> content = fileService.read(TASKS_DIR + "/" + file);
            if (content.isEmpty()) {
                continue;
            }
            try {
                AgentTask task = objectMapper.readValue(content.get(), AgentTask.class);
                if (task.isOpen()) {
                    tasks.add(task);
                }
            } catch (JsonProcessingException e) {
                log.warn("[Context] Failed to parse task file {}: {}", file, e.getOriginalMessage());
            }
        }
        tasks.sort(Comparator.comparingInt(AgentTask::priorityRank)
                .thenComparing(task -> task.getCreatedAt() != null ? task.getCreatedAt() : ""));
        return tasks;
    }

    private List<ExecutionLog> readRecentExecutions() {
        List<String> files = fileService.list(ActionExecutor.EXECUTION_LOG_DIR).stream()
                .filter(name -> name.endsWith(".json"))
                .sorted(Comparator.reverseOrder())
                .limit(recentExecutionLogs)
                .toList();
        List<ExecutionLog> logs = new ArrayList<>();
        for (String file : files) {
            fileService.read(ActionExecutor.EXECUTION_LOG_DIR + "/" + file).ifPresent(json -> {
                try {
                    logs.add(objectMapper.readValue(json, ExecutionLog.class));
                } catch (JsonProcessingException e) {
                    log.warn("[Context] Failed to parse execution log {}: {}", file, e.getOriginalMessage());
                }
            });
        }
        return logs;
    }

    private Optional<Instant> readLastAwakening() {
        return fileService.read(LAST_AWAKENING_FILE).map(String::trim).flatMap(value -> {
            try {
                return Optional.of(Instant.parse(value));
            } catch (DateTimeParseException e) {
                log.warn("[Context] Unreadable last awakening timestamp: {}", value);
                return Optional.empty();
            }
        });
    }

    private String readOptional(String path) {
        return fileService.read(path).filter(content -> !content.isBlank()).orElse(null);
    }

    private static long parseCount(String value) {
        try {
            return Math.max(0, Long.parseLong(value));
        } catch (NumberFormatException e) {
            return 0L;
        }
    }
}
