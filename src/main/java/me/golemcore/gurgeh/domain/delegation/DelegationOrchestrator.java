package me.golemcore.gurgeh.domain.delegation;

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
import me.golemcore.gurgeh.domain.model.DelegationOutcome;
import me.golemcore.gurgeh.domain.model.EnergyTransaction;
import me.golemcore.gurgeh.domain.model.LlmUsage;
import me.golemcore.gurgeh.domain.model.ModelClass;
import me.golemcore.gurgeh.domain.service.EnergyLedgerService;
import me.golemcore.gurgeh.infrastructure.config.AgentProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fans delegate actions out to read-only workers in bounded concurrent
 * batches under a per-call spending ceiling.
 *
 * <p>
 * Before each batch the spend accumulated by this call is compared with the
 * ceiling; once it is reached every remaining task is skipped without being
 * attempted. Overshoot is therefore bounded by one batch. Each sub-task's
 * usage is charged to the ledger as soon as it finishes, successful or not.
 * Outcomes are returned in input order.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class DelegationOrchestrator {

    private final SubTaskRunner runner;
    private final EnergyLedgerService ledger;
    private final double maxBudgetUsd;
    private final int maxConcurrent;
    private final ModelClass modelClass;
    private final ExecutorService workers;

    public DelegationOrchestrator(SubTaskRunner runner, EnergyLedgerService ledger, AgentProperties properties) {
        this.runner = runner;
        this.ledger = ledger;
        AgentProperties.DelegationProperties config = properties.getDelegation();
        this.maxBudgetUsd = config.getMaxBudgetUsd();
        this.maxConcurrent = Math.max(1, config.getMaxConcurrent());
        this.modelClass = config.getModelClass();
        AtomicInteger threadCounter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(maxConcurrent, r -> {
            Thread t = new Thread(r, "delegation-worker-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Delegation] Workers did not terminate within timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Runs all delegate tasks of one cycle.
     *
     * @param tasks
     *            delegate actions, already approved by the policy engine
     * @param awakening
     *            current awakening number, used for ledger entries
     * @return one outcome per task, in input order
     */
    public List<DelegationOutcome> delegate(List<Action.Delegate> tasks, long awakening) {
        List<DelegationOutcome> outcomes = new ArrayList<>(tasks.size());
        double spent = 0.0;

        for (int start = 0; start < tasks.size(); start += maxConcurrent) {
            List<Action.Delegate> batch = tasks.subList(start, Math.min(start + maxConcurrent, tasks.size()));

            if (spent >= maxBudgetUsd) {
                log.warn("[Delegation] Budget ceiling ${} reached (spent ${}), skipping {} remaining tasks",
                        maxBudgetUsd, String.format("%.4f", spent), tasks.size() - start);
                for (Action.Delegate task : tasks.subList(start, tasks.size())) {
                    outcomes.add(DelegationOutcome.skipped(task, "Delegation budget exhausted"));
                }
                break;
            }

            log.info("[Delegation] Running batch of {} (tasks {}-{} of {})", batch.size(), start + 1,
                    start + batch.size(), tasks.size());
            List<CompletableFuture<DelegationOutcome>> futures = batch.stream()
                    .map(task -> CompletableFuture.supplyAsync(() -> runAndCharge(task, awakening), workers))
                    .toList();
            for (int i = 0; i < futures.size(); i++) {
                DelegationOutcome outcome = await(futures.get(i), batch.get(i));
                spent += outcome.getCost();
                outcomes.add(outcome);
            }
        }

        long succeeded = outcomes.stream().filter(DelegationOutcome::isSuccess).count();
        log.info("[Delegation] {} of {} tasks succeeded, spent ${}", succeeded, tasks.size(),
                String.format("%.4f", spent));
        return outcomes;
    }

    private DelegationOutcome runAndCharge(Action.Delegate task, long awakening) {
        DelegationOutcome outcome;
        try {
            outcome = runner.run(task);
        } catch (RuntimeException e) {
            log.error("[Delegation] Worker for {} crashed", task.path(), e);
            outcome = DelegationOutcome.builder()
                    .task(task)
                    .success(false)
                    .error("Worker crashed: " + e.getMessage())
                    .usage(LlmUsage.empty())
                    .build();
        }
        LlmUsage usage = outcome.getUsage();
        if (usage != null && usage.getTotalTokens() > 0) {
            double cost = ledger.recordUsage(awakening, usage, modelClass,
                    EnergyTransaction.TransactionType.DELEGATION);
            outcome.setCost(cost);
        }
        return outcome;
    }

    private static DelegationOutcome await(CompletableFuture<DelegationOutcome> future, Action.Delegate task) {
        try {
            return future.join();
        } catch (RuntimeException e) {
            log.error("[Delegation] Failed to collect outcome for {}", task.path(), e);
            return DelegationOutcome.builder()
                    .task(task)
                    .success(false)
                    .error("Worker failed: " + e.getMessage())
                    .usage(LlmUsage.empty())
                    .build();
        }
    }
}
