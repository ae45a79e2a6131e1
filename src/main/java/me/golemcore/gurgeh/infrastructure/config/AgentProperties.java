package me.golemcore.gurgeh.infrastructure.config;

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

import me.golemcore.gurgeh.domain.model.ModelClass;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the agent.
 *
 * <p>
 * All agent configuration is organized under the {@code agent.*} prefix. This
 * class contains nested property classes for each subsystem:
 * <ul>
 * <li>{@link SandboxProperties} - logical zones, protected paths, file
 * ceilings</li>
 * <li>{@link EconomicsProperties} - initial budget and token rates</li>
 * <li>{@link AwakeningProperties} - schedule and per-cycle token limits</li>
 * <li>{@link PolicyProperties} - decision record retention</li>
 * <li>{@link ShellProperties} - subprocess timeouts and output caps</li>
 * <li>{@link FetchProperties} - domain allow-list and response caps</li>
 * <li>{@link DelegationProperties} - worker budget, turns and
 * concurrency</li>
 * <li>{@link LlmProperties} - reasoning backend connection and retry</li>
 * <li>{@link CheckpointProperties} - external checkpoint tool</li>
 * <li>{@link HttpProperties} - shared HTTP client</li>
 * </ul>
 *
 * <p>
 * When {@code agent.base-dir} is {@code /} logical paths map one-to-one onto
 * the host filesystem. Any other value confines every logical path under that
 * directory.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    private String name = "moral-agent-alpha";
    private String baseDir = "/";
    private String foundingDocument = "/founding-document.md";

    private SandboxProperties sandbox = new SandboxProperties();
    private EconomicsProperties economics = new EconomicsProperties();
    private AwakeningProperties awakening = new AwakeningProperties();
    private PolicyProperties policy = new PolicyProperties();
    private ShellProperties shell = new ShellProperties();
    private FetchProperties fetch = new FetchProperties();
    private DelegationProperties delegation = new DelegationProperties();
    private LlmProperties llm = new LlmProperties();
    private CheckpointProperties checkpoint = new CheckpointProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class SandboxProperties {
        private List<String> allowedZones = new ArrayList<>(
                List.of("/self/", "/projects/", "/income/", "/comms/", "/public/"));
        private List<String> protectedFiles = new ArrayList<>(List.of("/founding-document.md"));
        private List<String> protectedPrefixes = new ArrayList<>(
                List.of("/opt/agent", "/etc", "/usr", "/bin", "/sbin", "/root"));
        private String sourcePrefix = "/opt/agent";
        private long maxFileSizeBytes = 1024L * 1024L;
        private long journalWarnSizeBytes = 500L * 1024L;
    }

    @Data
    public static class EconomicsProperties {
        private double initialBudgetUsd = 50.0;
        private String ledgerPath = "/income/balance.json";
        private int transactionHistoryLimit = 100;
        private RateProperties primaryRate = new RateProperties(5.00, 25.00);
        private RateProperties delegateRate = new RateProperties(0.80, 4.00);
    }

    @Data
    public static class RateProperties {
        private double inputPerMillion;
        private double outputPerMillion;

        public RateProperties() {
        }

        public RateProperties(double inputPerMillion, double outputPerMillion) {
            this.inputPerMillion = inputPerMillion;
            this.outputPerMillion = outputPerMillion;
        }
    }

    @Data
    public static class AwakeningProperties {
        private int intervalMinutes = 30;
        private int maxTokensPerCycle = 16384;
        private int contextWindowTokens = 100_000;
        private int workHistoryMaxEntries = 50;
        private int recentExecutionLogs = 5;
        private boolean runOnStartup = true;
        private boolean schedulerEnabled = true;
    }

    @Data
    public static class PolicyProperties {
        private int decisionRetentionLimit = 200;
        private int cleanupEvery = 20;
    }

    @Data
    public static class ShellProperties {
        private long defaultTimeoutMs = 30_000;
        private int maxOutputBytes = 50 * 1024;
        private String defaultWorkingDir = "/projects";
        private String allowedEnvVars = "";
    }

    @Data
    public static class FetchProperties {
        private List<String> allowedDomains = new ArrayList<>(List.of(
                "api.anthropic.com",
                "github.com",
                "raw.githubusercontent.com",
                "en.wikipedia.org",
                "news.ycombinator.com"));
        private int maxResponseBytes = 100 * 1024;
        private long timeoutMs = 10_000;
        private String userAgent = "AutonomousMoralAgent/1.0";
    }

    @Data
    public static class DelegationProperties {
        private double maxBudgetUsd = 0.50;
        private int maxTurns = 15;
        private int maxConcurrent = 3;
        private int maxToolResultChars = 50_000;
        private int maxOutputTokens = 8192;
        private String model = "claude-opus-4-20250514";
        private ModelClass modelClass = ModelClass.PRIMARY;
        private int maxAttempts = 2;
        private List<Long> backoffMs = new ArrayList<>(List.of(2000L, 4000L));
    }

    @Data
    public static class LlmProperties {
        private String apiKey;
        private String baseUrl;
        private String model = "claude-opus-4-20250514";
        private double temperature = 1.0;
        private long timeoutMs = 300_000;
        private int maxAttempts = 3;
        private List<Long> backoffMs = new ArrayList<>(List.of(2000L, 4000L, 8000L));
    }

    @Data
    public static class CheckpointProperties {
        private boolean enabled = true;
        private String command = "sprite";
        private String spriteName;
        private long timeoutMs = 30_000;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10_000;
        private long readTimeout = 30_000;
        private long writeTimeout = 30_000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300_000;
    }
}
