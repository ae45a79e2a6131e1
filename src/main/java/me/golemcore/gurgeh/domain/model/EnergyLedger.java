package me.golemcore.gurgeh.domain.model;

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

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Persisted energy account of the agent. Stored as
 * {@code /income/balance.json}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnergyLedger {

    @JsonProperty("balance_usd")
    private double balanceUsd;

    @JsonProperty("initial_budget_usd")
    private double initialBudgetUsd;

    @JsonProperty("total_earned_usd")
    private double totalEarnedUsd;

    @JsonProperty("total_spent_usd")
    private double totalSpentUsd;

    @Builder.Default
    private List<EnergyTransaction> transactions = new ArrayList<>();

    public EnergyLedger copy() {
        return EnergyLedger.builder()
                .balanceUsd(balanceUsd)
                .initialBudgetUsd(initialBudgetUsd)
                .totalEarnedUsd(totalEarnedUsd)
                .totalSpentUsd(totalSpentUsd)
                .transactions(transactions != null ? new ArrayList<>(transactions) : new ArrayList<>())
                .build();
    }
}
