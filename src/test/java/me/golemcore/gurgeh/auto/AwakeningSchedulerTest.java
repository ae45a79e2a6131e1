package me.golemcore.gurgeh.auto;

import me.golemcore.gurgeh.domain.service.AwakeningSupervisor;
import me.golemcore.gurgeh.domain.service.ScheduleService;
import me.golemcore.gurgeh.infrastructure.config.AgentProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AwakeningSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-03-14T09:30:00Z");
    private static final Instant NEXT = Instant.parse("2026-03-14T10:00:00Z");

    private AwakeningSupervisor supervisor;
    private ScheduleService scheduleService;
    private AgentProperties properties;
    private AwakeningScheduler scheduler;

    @BeforeEach
    void setUp() {
        supervisor = mock(AwakeningSupervisor.class);
        scheduleService = mock(ScheduleService.class);
        when(scheduleService.computeNextExecution(any())).thenReturn(NEXT);
        when(scheduleService.getActiveCron()).thenReturn("*/30 * * * *");
        properties = new AgentProperties();
        properties.getAwakening().setRunOnStartup(false);
        scheduler = new AwakeningScheduler(supervisor, scheduleService, properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void shouldArmNextFireFromScheduleOnInit() {
        scheduler.init();

        assertEquals(Optional.of(NEXT), scheduler.getNextFireTime());
        verify(scheduleService).computeNextExecution(NOW);
        verify(supervisor, never()).triggerAwakening();
    }

    @Test
    void shouldStayIdleWhenDisabled() {
        properties.getAwakening().setSchedulerEnabled(false);
        when(supervisor.triggerAwakening()).thenReturn(true);

        scheduler.init();

        assertTrue(scheduler.triggerNow());
        assertTrue(scheduler.getNextFireTime().isEmpty());
        verify(scheduleService, never()).computeNextExecution(any());
    }

    @Test
    void shouldRearmAfterManualTrigger() {
        scheduler.init();
        when(supervisor.triggerAwakening()).thenReturn(true);

        assertTrue(scheduler.triggerNow());

        verify(scheduleService, times(2)).computeNextExecution(NOW);
    }

    @Test
    void shouldNotRearmWhenTriggerRejected() {
        scheduler.init();
        when(supervisor.triggerAwakening()).thenReturn(false);

        assertFalse(scheduler.triggerNow());

        verify(scheduleService, times(1)).computeNextExecution(NOW);
    }

    @Test
    void shouldRearmEvenWhenAwakeningThrows() {
        scheduler.init();
        when(supervisor.triggerAwakening()).thenThrow(new IllegalStateException("boom"));

        scheduler.fire();

        verify(scheduleService, times(2)).computeNextExecution(NOW);
    }

    @Test
    void shouldFallBackToIntervalWhenScheduleInvalid() {
        when(scheduleService.computeNextExecution(any())).thenThrow(new IllegalArgumentException("bad cron"));

        scheduler.init();

        assertEquals(Optional.of(NOW.plusSeconds(30 * 60)), scheduler.getNextFireTime());
    }
}
