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
import me.golemcore.gurgeh.domain.model.EnergyLedger;
import me.golemcore.gurgeh.domain.model.EnergyTransaction;
import me.golemcore.gurgeh.domain.model.LlmUsage;
import me.golemcore.gurgeh.domain.model.ModelClass;
import me.golemcore.gurgeh.domain.model.WriteMode;
import me.golemcore.gurgeh.infrastructure.config.AgentProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Tracks the agent's energy budget in US dollars.
 *
 * <p>
 * Every reasoning call is converted to a cost from its token usage and the
 * rate table of its {@link ModelClass}. The balance is always recomputed as
 * {@code max(0, initial + earned - spent)}. The ledger is persisted to
 * {@code /income/balance.json} after every mutation; a failed save is logged
 * and the in-memory state stays authoritative.
 *
 * <p>
 * Recording is synchronized because delegated workers report usage from
 * several threads.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class EnergyLedgerService {

    private static final double TOKENS_PER_RATE_UNIT = 1_000_000.0;

    private final AgentFileService fileService;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final AgentProperties.EconomicsProperties economics;

    private EnergyLedger ledger;

    public EnergyLedgerService(AgentFileService fileService, ObjectMapper objectMapper,
            AgentProperties properties, Clock clock) {
        this.fileService = fileService;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.economics = properties.getEconomics();
    }

    /**
     * Loads the persisted ledger or creates a fresh one with the configured
     * initial budget.
     */
    public synchronized void initialize() {
        Optional<EnergyLedger> existing = load();
        if (existing.isPresent()) {
            ledger = existing.get();
            if (ledger.getTransactions() == null) {
                ledger.setTransactions(new ArrayList<>());
            }
            recomputeBalance();
            log.info("[Ledger] Loaded ledger: balance=${}", String.format("%.4f", ledger.getBalanceUsd()));
            return;
        }

        ledger = EnergyLedger.builder()
                .initialBudgetUsd(economics.getInitialBudgetUsd())
                .balanceUsd(economics.getInitialBudgetUsd())
                .build();
        save();
        log.info("[Ledger] Initialized new ledger with ${}", economics.getInitialBudgetUsd());
    }

    /**
     * Records token usage for a primary reasoning call.
     *
     * @return the cost charged in USD
     */
    public double recordUsage(long awakening, LlmUsage usage, ModelClass modelClass) {
        return recordUsage(awakening, usage, modelClass, EnergyTransaction.TransactionType.API_CALL);
    }

    /**
     * Converts token usage to a cost, appends a transaction, recomputes the
     * balance and persists the ledger.
     *
     * @return the cost charged in USD
     */
    public synchronized double recordUsage(long awakening, LlmUsage usage, ModelClass modelClass,
            EnergyTransaction.TransactionType type) {
        ensureLoaded();
        int inputTokens = usage != null ? usage.getInputTokens() : 0;
        int outputTokens = usage != null ? usage.getOutputTokens() : 0;
        double cost = calculateCost(inputTokens, outputTokens, modelClass);

        ledger.setTotalSpentUsd(ledger.getTotalSpentUsd() + cost);
        recomputeBalance();

        List<EnergyTransaction> transactions = ledger.getTransactions();
        transactions.add(EnergyTransaction.builder()
                .awakening(awakening)
                .timestamp(Instant.now(clock))
                .inputTokens(inputTokens)
                .outputTokens(outputTokens)
                .cost(cost)
                .type(type)
                .build());
        int limit = economics.getTransactionHistoryLimit();
        if (transactions.size() > limit) {
            transactions.subList(0, transactions.size() - limit).clear();
        }

        save();
        log.info("[Ledger] Recorded {} in / {} out ({}, {}): ${} -> balance ${}",
                inputTokens, outputTokens, modelClass, type,
                String.format("%.4f", cost), String.format("%.4f", ledger.getBalanceUsd()));
        return cost;
    }

    public double calculateCost(int inputTokens, int outputTokens, ModelClass modelClass) {
        AgentProperties.RateProperties rate = modelClass == ModelClass.DELEGATE
                ? economics.getDelegateRate()
                : economics.getPrimaryRate();
        return inputTokens / TOKENS_PER_RATE_UNIT * rate.getInputPerMillion()
                + outputTokens / TOKENS_PER_RATE_UNIT * rate.getOutputPerMillion();
    }

    public synchronized double getBalance() {
        ensureLoaded();
        return ledger.getBalanceUsd();
    }

    public synchronized boolean hasBudget() {
        ensureLoaded();
        return ledger.getBalanceUsd() > 0;
    }

    /**
     * Returns a snapshot copy of the ledger.
     */
    public synchronized EnergyLedger getLedger() {
        ensureLoaded();
        return ledger.copy();
    }

    private void recomputeBalance() {
        double balance = ledger.getInitialBudgetUsd() + ledger.getTotalEarnedUsd() - ledger.getTotalSpentUsd();
        ledger.setBalanceUsd(Math.max(0, balance));
    }

    private void ensureLoaded() {
        if (ledger == null) {
            initialize();
        }
    }

    private Optional<EnergyLedger> load() {
        Optional<String> json = fileService.read(economics.getLedgerPath());
        if (json.isEmpty() || json.get().isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json.get(), EnergyLedger.class));
        } catch (JsonProcessingException e) {
            log.warn("[Ledger] Corrupt ledger file, starting fresh: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private void save() {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(ledger);
            fileService.write(economics.getLedgerPath(), json, WriteMode.OVERWRITE);
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("[Ledger] Failed to persist ledger: {}", e.getMessage());
        }
    }
}
