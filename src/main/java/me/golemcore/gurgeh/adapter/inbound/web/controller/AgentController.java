package me.golemcore.gurgeh.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gurgeh.adapter.inbound.web.dto.AgentStatusResponse;
import me.golemcore.gurgeh.adapter.inbound.web.dto.IdentityResponse;
import me.golemcore.gurgeh.adapter.inbound.web.dto.InboxMessageRequest;
import me.golemcore.gurgeh.auto.AwakeningScheduler;
import me.golemcore.gurgeh.domain.model.CycleReport;
import me.golemcore.gurgeh.domain.model.EnergyLedger;
import me.golemcore.gurgeh.domain.service.AgentFileService;
import me.golemcore.gurgeh.domain.service.AwakeningSupervisor;
import me.golemcore.gurgeh.domain.service.ContextGatherer;
import me.golemcore.gurgeh.domain.service.EnergyLedgerService;
import me.golemcore.gurgeh.domain.service.InboxService;
import me.golemcore.gurgeh.domain.service.PublicSiteService;
import me.golemcore.gurgeh.domain.service.ScheduleService;
import me.golemcore.gurgeh.infrastructure.config.AgentProperties;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

/**
 * Operator endpoints: status, manual awakening, inbox delivery and identity.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class AgentController {

    private final AwakeningSupervisor supervisor;
    private final AwakeningScheduler scheduler;
    private final EnergyLedgerService ledgerService;
    private final ContextGatherer contextGatherer;
    private final ScheduleService scheduleService;
    private final InboxService inboxService;
    private final AgentFileService fileService;
    private final PublicSiteService siteService;
    private final AgentProperties properties;

    @GetMapping("/status")
    public Mono<ResponseEntity<AgentStatusResponse>> status() {
        EnergyLedger ledger = ledgerService.getLedger();
        AgentStatusResponse response = AgentStatusResponse.builder()
                .name(properties.getName())
                .awakenings(contextGatherer.getAwakeningCount())
                .state(supervisor.getState().name())
                .balanceUsd(ledger.getBalanceUsd())
                .totalSpentUsd(ledger.getTotalSpentUsd())
                .initialBudgetUsd(ledger.getInitialBudgetUsd())
                .schedule(scheduleService.getActiveCron())
                .nextAwakening(scheduler.getNextFireTime().map(Object::toString).orElse(null))
                .uptimeSeconds(siteService.getUptime().toSeconds())
                .pageViews(siteService.getPageViews())
                .lastCycle(supervisor.getLastReport().map(AgentController::toLastCycle).orElse(null))
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }

    @PostMapping("/awaken")
    public Mono<ResponseEntity<Map<String, Object>>> awaken() {
        log.info("[API] Manual awakening requested");
        return Mono.fromCallable(scheduler::triggerNow)
                .subscribeOn(Schedulers.boundedElastic())
                .map(started -> {
                    if (!started) {
                        throw new IllegalStateException("An awakening is already in progress");
                    }
                    Map<String, Object> body = Map.of(
                            "triggered", true,
                            "state", supervisor.getState().name());
                    return ResponseEntity.ok(body);
                });
    }

    @PostMapping("/inbox")
    public Mono<ResponseEntity<Map<String, String>>> sendMessage(@RequestBody InboxMessageRequest request) {
        if (request == null || isBlank(request.getFrom()) || isBlank(request.getMessage())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Both 'from' and 'message' are required");
        }
        String filename = inboxService.receive(request.getFrom(), request.getMessage());
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(Map.of("stored", filename)));
    }

    @GetMapping("/identity")
    public Mono<ResponseEntity<IdentityResponse>> identity() {
        IdentityResponse response = IdentityResponse.builder()
                .identity(fileService.read("/self/identity.md").orElse(null))
                .values(fileService.read("/self/values.md").orElse(null))
                .currentFocus(fileService.read("/self/current-focus.md").orElse(null))
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }

    private static AgentStatusResponse.LastCycle toLastCycle(CycleReport report) {
        return AgentStatusResponse.LastCycle.builder()
                .awakening(report.getAwakeningNumber())
                .completed(report.isCompleted())
                .abortReason(report.getAbortReason())
                .proposedActions(report.getProposedActions())
                .approvedActions(report.getApprovedActions())
                .succeededActions(report.successCount())
                .scheduleChanged(report.isScheduleChanged())
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
