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
import me.golemcore.gurgeh.domain.model.ExecutionResult;
import me.golemcore.gurgeh.domain.model.WriteMode;
import me.golemcore.gurgeh.infrastructure.config.AgentProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Keeps the agent's record of visible work: a capped rolling history of what
 * each awakening produced, and one human-readable log per awakening.
 */
@Service
@Slf4j
public class WorkHistoryService {

    static final String WORK_HISTORY_FILE = "/self/work-history.md";
    static final String AWAKENINGS_DIR = "/self/awakenings";
    private static final Pattern ENTRY_BOUNDARY = Pattern.compile("(?m)(?=^## Awakening)");
    private static final int COMMAND_PREVIEW = 80;

    private final AgentFileService fileService;
    private final Clock clock;
    private final int maxEntries;

    public WorkHistoryService(AgentFileService fileService, AgentProperties properties, Clock clock) {
        this.fileService = fileService;
        this.clock = clock;
        this.maxEntries = Math.max(1, properties.getAwakening().getWorkHistoryMaxEntries());
    }

    public String read() {
        return fileService.read(WORK_HISTORY_FILE).orElse("");
    }

    /**
     * Appends an entry describing the successful visible actions of one
     * awakening, dropping the oldest entries beyond the cap. Awakenings with no
     * visible work leave the history unchanged.
     */
    public void append(long awakening, Instant timestamp, List<ExecutionResult> results) {
        List<String> lines = new ArrayList<>();
        lines.add("## Awakening #" + awakening + " (" + timestamp.toString().substring(0, 10) + ")");
        for (ExecutionResult result : results) {
            if (result.isSuccess()) {
                describe(result.getAction()).ifPresent(line -> lines.add("- " + line));
            }
        }
        if (lines.size() <= 1) {
            return;
        }
        lines.add("");
        String entry = String.join("\n", lines);

        try {
            List<String> entries = new ArrayList<>(Arrays.stream(ENTRY_BOUNDARY.split(read()))
                    .filter(e -> !e.isBlank())
                    .toList());
            entries.add(entry);
            if (entries.size() > maxEntries) {
                entries = entries.subList(entries.size() - maxEntries, entries.size());
            }
            fileService.write(WORK_HISTORY_FILE, String.join("\n", entries), WriteMode.OVERWRITE);
        } catch (RuntimeException e) {
            log.error("[History] Failed to append work history for awakening #{}", awakening, e);
        }
    }

    /**
     * Writes {@code /self/awakenings/awakening-NNNNN.md}.
     */
    public void writeAwakeningLog(long awakening, String summary) {
        String path = String.format("%s/awakening-%05d.md", AWAKENINGS_DIR, awakening);
        String content = "# Awakening #" + awakening + "\n\nTimestamp: " + Instant.now(clock) + "\n\n" + summary;
        try {
            fileService.write(path, content, WriteMode.OVERWRITE);
        } catch (RuntimeException e) {
            log.error("[History] Failed to write awakening log #{}", awakening, e);
        }
    }

    private static Optional<String> describe(Action action) {
        return switch (action.kind()) {
        case SERVE -> Optional.of("PUBLISHED: " + action.targetPath().orElse(""));
        case WRITE -> describeWrite((Action.Write) action);
        case IMAGE -> Optional.of("GENERATED IMAGE: " + action.targetPath().orElse("(default path)"));
        case EXECUTE -> Optional.of("EXECUTED: " + preview(action.content()));
        case MESSAGE -> Optional.of("SENT MESSAGE: to " + ((Action.OutboundMessage) action).effectiveRecipient());
        case DELEGATE -> {
            Action.Delegate delegate = (Action.Delegate) action;
            yield Optional.of("DELEGATED: " + delegate.effectiveTaskType().name().toLowerCase(Locale.ROOT)
                    + " -> " + delegate.path());
        }
        case FETCH -> Optional.of("FETCHED: " + ((Action.Fetch) action).url());
        case SET_SCHEDULE -> Optional.of("SCHEDULE: updated to " + ((Action.SetSchedule) action).effectiveCron());
        case THINK, CHECKPOINT -> Optional.empty();
        };
    }

    private static Optional<String> describeWrite(Action.Write write) {
        if (write.path() == null) {
            return Optional.empty();
        }
        if (write.path().startsWith("/self/tasks/")) {
            return Optional.of("TASK UPDATE: " + write.path());
        }
        if (write.path().startsWith("/public/")) {
            return Optional.of("PUBLISHED: " + write.path());
        }
        return Optional.of("WROTE: " + write.path());
    }

    private static String preview(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > COMMAND_PREVIEW ? text.substring(0, COMMAND_PREVIEW) : text;
    }
}
