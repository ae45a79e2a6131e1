package me.golemcore.gurgeh.domain.service;

import me.golemcore.gurgeh.domain.model.AgentTask;
import me.golemcore.gurgeh.domain.model.AwakeningState;
import me.golemcore.gurgeh.testsupport.SandboxFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContextGathererTest {

    @TempDir
    Path tempDir;

    private SandboxFixture fixture;
    private InboxService inboxService;
    private ContextGatherer gatherer;

    @BeforeEach
    void setUp() {
        fixture = SandboxFixture.create(tempDir);
        fixture.properties().getAwakening().setRecentExecutionLogs(2);
        AgentFileService files = fixture.fileService();
        inboxService = new InboxService(files, fixture.clock());
        gatherer = new ContextGatherer(files, inboxService,
                new WorkHistoryService(files, fixture.properties(), fixture.clock()),
                new EnergyLedgerService(files, fixture.objectMapper(), fixture.properties(), fixture.clock()),
                new ScheduleService(files, fixture.properties(), fixture.clock()),
                fixture.objectMapper(), fixture.properties(), fixture.clock());
    }

    @Test
    void shouldStartCountingFromOneOnFirstAwakening() {
        AwakeningState state = gatherer.gather();

        assertEquals(1, state.getAwakeningNumber());
        assertNull(state.getTimeSinceLastMs());
        assertNull(state.getIdentity());
        assertEquals("1", fixture.readPhysical("/self/awakening-count"));
        assertEquals("2026-03-14T09:30:00Z", fixture.readPhysical("/self/last-awakening"));
        assertEquals(50.0, state.getEnergy().getBalanceUsd(), 1e-9);
        assertEquals("*/30 * * * *", state.getActiveSchedule());
    }

    @Test
    void shouldIncrementCounterAndMeasureTimeSinceLast() {
        fixture.writePhysical("/self/awakening-count", "41\n");
        fixture.writePhysical("/self/last-awakening", "2026-03-14T09:00:00Z");

        AwakeningState state = gatherer.gather();

        assertEquals(42, state.getAwakeningNumber());
        assertEquals(30 * 60 * 1000L, state.getTimeSinceLastMs());
    }

    @Test
    void shouldTreatCorruptCounterAsZero() {
        fixture.writePhysical("/self/awakening-count", "many");
        fixture.writePhysical("/self/last-awakening", "yesterday");

        AwakeningState state = gatherer.gather();

        assertEquals(1, state.getAwakeningNumber());
        assertNull(state.getTimeSinceLastMs());
    }

    @Test
    void shouldReadSelfFilesAndInbox() {
        fixture.writePhysical("/self/identity.md", "I am a gardener.");
        fixture.writePhysical("/self/values.md", "   ");
        inboxService.receive("operator", "hello");

        AwakeningState state = gatherer.gather();

        assertEquals("I am a gardener.", state.getIdentity());
        assertNull(state.getValues());
        assertEquals(1, state.getInbox().size());
    }

    @Test
    void shouldReturnOpenTasksByPriorityThenCreation() {
        fixture.writePhysical("/self/tasks/a.json",
                "{\"id\":\"a\",\"priority\":\"low\",\"status\":\"suggested\",\"createdAt\":\"2026-01-01\"}");
        fixture.writePhysical("/self/tasks/b.json",
                "{\"id\":\"b\",\"priority\":\"urgent\",\"status\":\"accepted\",\"createdAt\":\"2026-01-02\"}");
        fixture.writePhysical("/self/tasks/c.json",
                "{\"id\":\"c\",\"priority\":\"urgent\",\"status\":\"suggested\",\"createdAt\":\"2026-01-01\"}");
        fixture.writePhysical("/self/tasks/d.json",
                "{\"id\":\"d\",\"priority\":\"high\",\"status\":\"completed\"}");
        fixture.writePhysical("/self/tasks/broken.json", "{not json");
        fixture.writePhysical("/self/tasks/notes.txt", "ignored");

        List<AgentTask> tasks = gatherer.readOpenTasks();

        assertEquals(List.of("c", "b", "a"), tasks.stream().map(AgentTask::getId).toList());
    }

    @Test
    void shouldLoadMostRecentExecutionLogs() {
        for (int i = 1; i <= 3; i++) {
            fixture.writePhysical("/self/execution-logs/exec-" + i + ".json",
                    "{\"id\":\"exec-" + i + "\",\"command\":\"echo " + i + "\",\"status\":\"OK\"}");
        }

        AwakeningState state = gatherer.gather();

        assertEquals(List.of("exec-3", "exec-2"),
                state.getRecentExecutions().stream().map(e -> e.getId()).toList());
        assertTrue(state.getRecentExecutions().get(0).isSuccess());
    }

    @Test
    void shouldReportCountWithoutSideEffects() {
        fixture.writePhysical("/self/awakening-count", "5");

        assertEquals(5, gatherer.getAwakeningCount());
        assertEquals(5, gatherer.getAwakeningCount());
    }
}
