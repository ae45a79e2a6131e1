package me.golemcore.gurgeh.domain.service;

import me.golemcore.gurgeh.domain.model.Action;
import me.golemcore.gurgeh.domain.model.AwakeningState;
import me.golemcore.gurgeh.domain.model.CycleReport;
import me.golemcore.gurgeh.domain.model.ExecutionResult;
import me.golemcore.gurgeh.domain.model.InboxMessage;
import me.golemcore.gurgeh.domain.model.LlmUsage;
import me.golemcore.gurgeh.domain.model.ModelClass;
import me.golemcore.gurgeh.domain.model.ReasoningResult;
import me.golemcore.gurgeh.domain.model.SupervisorState;
import me.golemcore.gurgeh.domain.model.WriteMode;
import me.golemcore.gurgeh.infrastructure.config.AgentProperties;
import me.golemcore.gurgeh.port.outbound.CheckpointPort;
import me.golemcore.gurgeh.port.outbound.ReasoningPort;
import me.golemcore.gurgeh.testsupport.SandboxFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AwakeningSupervisorTest {

    private static final String FOUNDING = "Be kind. Be honest.";

    @TempDir
    Path tempDir;

    private AgentFileService fileService;
    private EnergyLedgerService ledger;
    private ReasoningPort reasoningPort;
    private ContextGatherer contextGatherer;
    private BriefingBuilder briefingBuilder;
    private ActionParser actionParser;
    private PolicyEngine policyEngine;
    private ActionExecutor actionExecutor;
    private InboxService inboxService;
    private WorkHistoryService workHistoryService;
    private ScheduleService scheduleService;
    private CheckpointPort checkpointPort;
    private AwakeningSupervisor supervisor;

    @BeforeEach
    void setUp() {
        fileService = mock(AgentFileService.class);
        ledger = mock(EnergyLedgerService.class);
        reasoningPort = mock(ReasoningPort.class);
        contextGatherer = mock(ContextGatherer.class);
        briefingBuilder = mock(BriefingBuilder.class);
        actionParser = mock(ActionParser.class);
        policyEngine = mock(PolicyEngine.class);
        actionExecutor = mock(ActionExecutor.class);
        inboxService = mock(InboxService.class);
        workHistoryService = mock(WorkHistoryService.class);
        scheduleService = mock(ScheduleService.class);
        checkpointPort = mock(CheckpointPort.class);

        AgentProperties properties = new AgentProperties();
        when(fileService.read("/founding-document.md")).thenReturn(Optional.of(FOUNDING));
        when(ledger.hasBudget()).thenReturn(true);
        when(reasoningPort.isAvailable()).thenReturn(true);
        when(scheduleService.getActiveCron()).thenReturn("*/30 * * * *");
        when(briefingBuilder.build(any())).thenReturn("briefing");
        when(briefingBuilder.truncate(anyString(), anyInt())).thenReturn("briefing");

        supervisor = new AwakeningSupervisor(fileService, ledger, reasoningPort, contextGatherer, briefingBuilder,
                actionParser, policyEngine, actionExecutor, inboxService, workHistoryService, scheduleService,
                checkpointPort, properties);
        supervisor.initialize();
    }

    private AwakeningState stateWithInbox(List<InboxMessage> inbox) {
        AwakeningState state = AwakeningState.builder()
                .awakeningNumber(7)
                .timestamp(Instant.parse("2026-03-14T09:30:00Z"))
                .inbox(inbox)
                .build();
        when(contextGatherer.gather()).thenReturn(state);
        return state;
    }

    @Test
    void shouldInitializeLayoutLedgerAndFoundingDocument() {
        verify(fileService).initDirectories();
        verify(ledger).initialize();
        assertEquals(SupervisorState.IDLE, supervisor.getState());
        assertTrue(supervisor.getLastReport().isEmpty());
    }

    @Test
    void shouldRunFullCycle() {
        List<InboxMessage> inbox = List.of(new InboxMessage("m.md", "operator", "hi", "now"));
        AwakeningState state = stateWithInbox(inbox);
        LlmUsage usage = LlmUsage.of(1_000, 200);
        when(reasoningPort.reason(eq(FOUNDING), eq("briefing"), anyInt()))
                .thenReturn(Optional.of(new ReasoningResult("<action type=\"think\">x</action>", usage, "end_turn")));
        Action write = new Action.Write("/self/journal.md", WriteMode.APPEND, "entry");
        Action think = new Action.Think("x");
        when(actionParser.parse(anyString())).thenReturn(List.of(write, think));
        when(policyEngine.filter(List.of(write, think))).thenReturn(List.of(write));
        List<ExecutionResult> results = List.of(ExecutionResult.success(write));
        when(actionExecutor.execute(List.of(write), 7L)).thenReturn(results);

        assertTrue(supervisor.triggerAwakening());

        verify(ledger).recordUsage(7L, usage, ModelClass.PRIMARY);
        verify(inboxService).markRead(inbox);
        verify(workHistoryService).append(7L, state.getTimestamp(), results);
        verify(workHistoryService).writeAwakeningLog(eq(7L), anyString());
        CycleReport report = supervisor.getLastReport().orElseThrow();
        assertTrue(report.isCompleted());
        assertEquals(2, report.getProposedActions());
        assertEquals(1, report.getApprovedActions());
        assertEquals(1, report.successCount());
        assertFalse(report.isScheduleChanged());
        assertEquals(SupervisorState.IDLE, supervisor.getState());
    }

    @Test
    void shouldReserveRoomForFoundingDocumentAndOutput() {
        stateWithInbox(List.of());
        when(reasoningPort.reason(anyString(), anyString(), anyInt())).thenReturn(Optional.empty());

        supervisor.triggerAwakening();

        int expectedBudget = 100_000 - BriefingBuilder.estimateTokens(FOUNDING) - 16_384;
        verify(briefingBuilder).truncate("briefing", expectedBudget);
        verify(reasoningPort).reason(FOUNDING, "briefing", 16_384);
    }

    @Test
    void shouldAbortWhenReasoningFails() {
        stateWithInbox(List.of(new InboxMessage("m.md", "op", "hi", "now")));
        when(reasoningPort.reason(anyString(), anyString(), anyInt())).thenReturn(Optional.empty());

        assertTrue(supervisor.triggerAwakening());

        CycleReport report = supervisor.getLastReport().orElseThrow();
        assertFalse(report.isCompleted());
        assertEquals("Reasoning failed", report.getAbortReason());
        verify(actionExecutor, never()).execute(any(), anyLong());
        verify(inboxService, never()).markRead(any());
    }

    @Test
    void shouldSkipCycleWhenReasoningUnavailable() {
        when(reasoningPort.isAvailable()).thenReturn(false);
        when(contextGatherer.getAwakeningCount()).thenReturn(4L);

        assertTrue(supervisor.triggerAwakening());

        assertEquals("Reasoning engine unavailable", supervisor.getLastReport().orElseThrow().getAbortReason());
        verify(contextGatherer, never()).gather();
    }

    @Test
    void shouldEnterDormancyWithoutBudget() {
        when(ledger.hasBudget()).thenReturn(false);
        when(contextGatherer.getAwakeningCount()).thenReturn(12L);

        assertTrue(supervisor.triggerAwakening());

        assertEquals(SupervisorState.DORMANT, supervisor.getState());
        verify(checkpointPort).createCheckpoint(AwakeningSupervisor.DORMANCY_CHECKPOINT);
        verify(reasoningPort, never()).reason(anyString(), anyString(), anyInt());
        CycleReport report = supervisor.getLastReport().orElseThrow();
        assertEquals(12L, report.getAwakeningNumber());
        assertEquals("No energy remaining", report.getAbortReason());
    }

    @Test
    void shouldGoDormantWithRealLedgerAtExactlyZeroBalance() {
        SandboxFixture fixture = SandboxFixture.create(tempDir);
        fixture.properties().getEconomics().setInitialBudgetUsd(0.0);
        fixture.writePhysical("/founding-document.md", FOUNDING);
        EnergyLedgerService realLedger = new EnergyLedgerService(fixture.fileService(), fixture.objectMapper(),
                fixture.properties(), fixture.clock());
        AwakeningSupervisor realSupervisor = new AwakeningSupervisor(fixture.fileService(), realLedger,
                reasoningPort, contextGatherer, briefingBuilder, actionParser, policyEngine, actionExecutor,
                inboxService, workHistoryService, scheduleService, checkpointPort, fixture.properties());
        realSupervisor.initialize();

        assertEquals(0.0, realLedger.getBalance());
        assertTrue(realSupervisor.triggerAwakening());

        assertEquals(SupervisorState.DORMANT, realSupervisor.getState());
        verify(reasoningPort, never()).reason(anyString(), anyString(), anyInt());
        verify(checkpointPort).createCheckpoint(AwakeningSupervisor.DORMANCY_CHECKPOINT);
    }

    @Test
    void shouldGoDormantOnNextTriggerAfterCycleSpendsRemainingBudget() {
        SandboxFixture fixture = SandboxFixture.create(tempDir);
        fixture.properties().getEconomics().setInitialBudgetUsd(1.0);
        EnergyLedgerService realLedger = new EnergyLedgerService(fixture.fileService(), fixture.objectMapper(),
                fixture.properties(), fixture.clock());
        AwakeningSupervisor realSupervisor = new AwakeningSupervisor(fixture.fileService(), realLedger,
                reasoningPort, contextGatherer, briefingBuilder, actionParser, policyEngine, actionExecutor,
                inboxService, workHistoryService, scheduleService, checkpointPort, fixture.properties());
        realSupervisor.initialize();
        stateWithInbox(List.of());
        // One million input tokens at the primary rate cost five dollars
        when(reasoningPort.reason(anyString(), anyString(), anyInt())).thenReturn(
                Optional.of(new ReasoningResult("", LlmUsage.of(1_000_000, 0), "end_turn")));
        when(actionParser.parse(anyString())).thenReturn(List.of());
        when(policyEngine.filter(List.of())).thenReturn(List.of());
        when(actionExecutor.execute(List.of(), 7L)).thenReturn(List.of());

        assertTrue(realSupervisor.triggerAwakening());
        assertEquals(SupervisorState.IDLE, realSupervisor.getState());
        assertEquals(0.0, realLedger.getBalance());

        assertTrue(realSupervisor.triggerAwakening());

        assertEquals(SupervisorState.DORMANT, realSupervisor.getState());
        verify(reasoningPort).reason(anyString(), anyString(), anyInt());
    }

    @Test
    void shouldWakeFromDormancyOnceBudgetReturns() {
        when(ledger.hasBudget()).thenReturn(false);
        doThrow(new IllegalStateException("sprite missing")).when(checkpointPort).createCheckpoint(anyString());
        supervisor.triggerAwakening();
        assertEquals(SupervisorState.DORMANT, supervisor.getState());

        when(ledger.hasBudget()).thenReturn(true);
        stateWithInbox(List.of());
        when(reasoningPort.reason(anyString(), anyString(), anyInt())).thenReturn(Optional.empty());

        assertTrue(supervisor.triggerAwakening());
        assertEquals(SupervisorState.IDLE, supervisor.getState());
        verify(contextGatherer).gather();
    }

    @Test
    void shouldReturnToIdleAfterStepFailure() {
        when(contextGatherer.gather()).thenThrow(new IllegalStateException("disk gone"));

        assertTrue(supervisor.triggerAwakening());

        assertEquals(SupervisorState.IDLE, supervisor.getState());
    }

    @Test
    void shouldDetectScheduleChange() {
        stateWithInbox(List.of());
        when(reasoningPort.reason(anyString(), anyString(), anyInt()))
                .thenReturn(Optional.of(new ReasoningResult("text", LlmUsage.of(1, 1), "end_turn")));
        Action schedule = new Action.SetSchedule("0 * * * *", null);
        when(actionParser.parse("text")).thenReturn(List.of(schedule));
        when(policyEngine.filter(List.of(schedule))).thenReturn(List.of(schedule));
        when(actionExecutor.execute(List.of(schedule), 7L)).thenReturn(List.of(ExecutionResult.success(schedule)));
        when(scheduleService.getActiveCron()).thenReturn("*/30 * * * *", "0 * * * *");

        supervisor.triggerAwakening();

        assertTrue(supervisor.getLastReport().orElseThrow().isScheduleChanged());
    }

    @Test
    void shouldRejectConcurrentTrigger() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(contextGatherer.gather()).thenAnswer(invocation -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            throw new IllegalStateException("stop here");
        });

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<Boolean> first = pool.submit(supervisor::triggerAwakening);
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            assertEquals(SupervisorState.RUNNING, supervisor.getState());

            assertFalse(supervisor.triggerAwakening());

            release.countDown();
            assertTrue(first.get(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
        assertEquals(SupervisorState.IDLE, supervisor.getState());
    }
}
