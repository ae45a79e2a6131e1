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

import me.golemcore.gurgeh.port.outbound.ReasoningPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;

/**
 * Shared beans and startup banner.
 *
 * <p>
 * Provides the {@link Clock} every time-dependent service reads from and the
 * {@link ObjectMapper} used for ledger, decision and execution log files.
 * Installs a JVM-wide handler that logs uncaught exceptions.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final AgentProperties properties;
    private final ReasoningPort reasoningPort;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        // Log and keep running
        Thread.setDefaultUncaughtExceptionHandler((thread, error) -> log.error(
                "[Supervisor] Uncaught exception in thread {}", thread.getName(), error));

        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        log.info("Gurgeh v{} starting as '{}'", version, properties.getName());
        log.info("Base directory: {}", properties.getBaseDir());
        log.info("Reasoning model: {}", properties.getLlm().getModel());
        log.info("Awakening interval: {} min, scheduler {}", properties.getAwakening().getIntervalMinutes(),
                properties.getAwakening().isSchedulerEnabled() ? "enabled" : "disabled");
        if (!reasoningPort.isAvailable()) {
            log.warn("No reasoning API key configured: awakenings will abort until agent.llm.api-key is set");
        }
    }
}
