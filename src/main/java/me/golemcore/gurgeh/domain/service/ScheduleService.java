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

import me.golemcore.gurgeh.domain.model.WriteMode;
import me.golemcore.gurgeh.infrastructure.config.AgentProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Resolves the cron expression that drives awakenings.
 *
 * <p>
 * The agent may choose its own rhythm by writing a cron expression to
 * {@code /self/schedule.txt} (via the set-schedule action). When that file is
 * missing or holds an invalid expression, the configured interval is used
 * (every N minutes). Five-field expressions are accepted and normalized
 * to Spring's six-field form.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class ScheduleService {

    static final String SCHEDULE_FILE = "/self/schedule.txt";
    private static final int CRON_FIVE_FIELDS = 5;
    private static final int CRON_SIX_FIELDS = 6;

    private final AgentFileService fileService;
    private final Clock clock;
    private final int intervalMinutes;

    public ScheduleService(AgentFileService fileService, AgentProperties properties, Clock clock) {
        this.fileService = fileService;
        this.clock = clock;
        this.intervalMinutes = Math.max(1, properties.getAwakening().getIntervalMinutes());
    }

    public String getDefaultCron() {
        return "*/" + intervalMinutes + " * * * *";
    }

    /**
     * Returns the cron expression currently in effect, in the form it was
     * written (five or six fields).
     */
    public String getActiveCron() {
        Optional<String> agentSchedule = fileService.read(SCHEDULE_FILE)
                .map(String::trim)
                .filter(s -> !s.isEmpty());
        if (agentSchedule.isPresent()) {
            try {
                normalizeCronExpression(agentSchedule.get());
                return agentSchedule.get();
            } catch (IllegalArgumentException e) {
                log.warn("[Schedule] Invalid agent schedule '{}', using default: {}", agentSchedule.get(),
                        e.getMessage());
            }
        }
        return getDefaultCron();
    }

    /**
     * Validates and persists a schedule chosen by the agent.
     *
     * @return the normalized six-field expression
     * @throws IllegalArgumentException
     *             if the expression is not a valid cron expression
     */
    public String saveAgentSchedule(String cronExpression) {
        String normalized = normalizeCronExpression(cronExpression);
        fileService.write(SCHEDULE_FILE, cronExpression.trim(), WriteMode.OVERWRITE);
        log.info("[Schedule] Agent schedule set to '{}'", cronExpression.trim());
        return normalized;
    }

    /**
     * Next fire time of the active schedule strictly after the given instant.
     */
    public Instant computeNextExecution(Instant after) {
        CronExpression cron = CronExpression.parse(normalizeCronExpression(getActiveCron()));
        ZonedDateTime next = cron.next(after.atZone(clock.getZone()));
        if (next == null) {
            return after.plusSeconds(intervalMinutes * 60L);
        }
        return next.toInstant();
    }

    static String normalizeCronExpression(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("Cron expression cannot be empty");
        }

        String trimmed = input.trim();
        String[] parts = trimmed.split("\\s+");

        String sixFieldCron;
        if (parts.length == CRON_FIVE_FIELDS) {
            sixFieldCron = "0 " + trimmed;
        } else if (parts.length == CRON_SIX_FIELDS) {
            sixFieldCron = trimmed;
        } else {
            throw new IllegalArgumentException("Invalid cron expression: expected 5 or 6 fields, got " + parts.length);
        }

        try {
            CronExpression.parse(sixFieldCron);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid cron expression '" + trimmed + "': " + e.getMessage());
        }

        return sixFieldCron;
    }
}
