package me.golemcore.gurgeh;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Gurgeh autonomous agent.
 *
 * <p>
 * Gurgeh wakes up on a cron schedule, asks a reasoning backend what to do, and
 * turns the proposed actions into governed effects inside a filesystem sandbox
 * while spending from a finite energy budget.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → AwakeningScheduler, AgentController
 * Domain Layer       → AwakeningSupervisor, PolicyEngine, ActionExecutor,
 *                      DelegationOrchestrator, EnergyLedgerService
 * Security           → PathSandbox, CommandDenylist
 * Infrastructure     → LLM/Fetch/Checkpoint adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code agent.*}
 * prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class GurgehApplication {

    public static void main(String[] args) {
        SpringApplication.run(GurgehApplication.class, args);
    }

}
