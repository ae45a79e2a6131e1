package me.golemcore.gurgeh.auto;

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

import me.golemcore.gurgeh.domain.service.AwakeningSupervisor;
import me.golemcore.gurgeh.domain.service.ScheduleService;
import me.golemcore.gurgeh.infrastructure.config.AgentProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Fires awakenings on the active cron schedule.
 *
 * <p>
 * A single daemon thread holds at most one pending fire. After every cycle,
 * scheduled or manual, the schedule is re-read (the agent may have changed it)
 * and the next fire is re-armed from the current time. Overlap is prevented
 * by the supervisor itself, so a fire that lands during a manual cycle is a
 * no-op.
 *
 * @since 1.0
 * @see ScheduleService
 */
@Component
@Slf4j
public class AwakeningScheduler {

    private final AwakeningSupervisor supervisor;
    private final ScheduleService scheduleService;
    private final AgentProperties.AwakeningProperties config;
    private final Clock clock;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> pending;
    private volatile Instant nextFireTime;

    public AwakeningScheduler(AwakeningSupervisor supervisor, ScheduleService scheduleService,
            AgentProperties properties, Clock clock) {
        this.supervisor = supervisor;
        this.scheduleService = scheduleService;
        this.config = properties.getAwakening();
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        if (!config.isSchedulerEnabled()) {
            log.info("[Scheduler] Awakening scheduler disabled");
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "awakening-scheduler");
            t.setDaemon(true);
            return t;
        });

        if (config.isRunOnStartup()) {
            log.info("[Scheduler] Running first awakening on startup");
            synchronized (this) {
                pending = scheduler.schedule(this::fire, 0, TimeUnit.MILLISECONDS);
            }
        } else {
            rearm();
        }
    }

    @PreDestroy
    public void shutdown() {
        if (scheduler == null) {
            return;
        }
        synchronized (this) {
            if (pending != null) {
                pending.cancel(false);
            }
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[Scheduler] Shut down");
    }

    /**
     * Runs an awakening on the calling thread and resets the timer.
     *
     * @return false if an awakening was already running
     */
    public boolean triggerNow() {
        log.info("[Scheduler] Awakening triggered manually");
        boolean started = supervisor.triggerAwakening();
        if (started) {
            rearm();
        }
        return started;
    }

    public Optional<Instant> getNextFireTime() {
        return Optional.ofNullable(nextFireTime);
    }

    void fire() {
        try {
            supervisor.triggerAwakening();
        } catch (RuntimeException e) {
            log.error("[Scheduler] Awakening failed", e);
        } finally {
            rearm();
        }
    }

    synchronized void rearm() {
        if (scheduler == null || scheduler.isShutdown()) {
            return;
        }
        if (pending != null) {
            pending.cancel(false);
        }
        Instant now = Instant.now(clock);
        Instant next;
        try {
            next = scheduleService.computeNextExecution(now);
        } catch (IllegalArgumentException e) {
            log.error("[Scheduler] Invalid schedule, using the default interval: {}", e.getMessage());
            next = now.plus(Duration.ofMinutes(Math.max(1, config.getIntervalMinutes())));
        }
        long delayMs = Math.max(0, Duration.between(now, next).toMillis());
        nextFireTime = next;
        pending = scheduler.schedule(this::fire, delayMs, TimeUnit.MILLISECONDS);
        log.info("[Scheduler] Next awakening at {} (cron '{}')", next, scheduleService.getActiveCron());
    }
}
