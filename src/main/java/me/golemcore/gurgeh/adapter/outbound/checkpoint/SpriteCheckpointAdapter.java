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

package me.golemcore.gurgeh.adapter.outbound.checkpoint;

import me.golemcore.gurgeh.infrastructure.config.AgentProperties;
import me.golemcore.gurgeh.port.outbound.CheckpointPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Creates environment snapshots through the {@code sprite} command line tool.
 *
 * <p>
 * Runs {@code sprite checkpoint create [-s name] -comment label}. Labels are
 * reduced to {@code [A-Za-z0-9_-]} and 64 characters. Failures are logged and
 * reported as {@code false}, never thrown.
 */
@Component
@Slf4j
public class SpriteCheckpointAdapter implements CheckpointPort {

    private static final int MAX_LABEL_LENGTH = 64;

    private final AgentProperties.CheckpointProperties config;

    public SpriteCheckpointAdapter(AgentProperties properties) {
        this.config = properties.getCheckpoint();
    }

    @Override
    public boolean createCheckpoint(String label) {
        if (!config.isEnabled()) {
            log.debug("[Checkpoint] Disabled, skipping '{}'", label);
            return false;
        }

        List<String> command = buildCommand(label);
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);

        try {
            Process process = pb.start();
            process.getOutputStream().close();
            boolean completed = process.waitFor(config.getTimeoutMs(), TimeUnit.MILLISECONDS);
            if (!completed) {
                process.destroyForcibly();
                log.warn("[Checkpoint] Timed out after {}ms", config.getTimeoutMs());
                return false;
            }
            String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8).trim();
            if (process.exitValue() != 0) {
                log.warn("[Checkpoint] Failed with exit code {}: {}", process.exitValue(), output);
                return false;
            }
            log.info("[Checkpoint] Created '{}'", command.get(command.size() - 1));
            return true;
        } catch (IOException e) {
            log.warn("[Checkpoint] Could not run {}: {}", config.getCommand(), e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Checkpoint] Interrupted while waiting for {}", config.getCommand());
            return false;
        }
    }

    List<String> buildCommand(String label) {
        List<String> command = new ArrayList<>(List.of(config.getCommand(), "checkpoint", "create"));
        if (config.getSpriteName() != null && !config.getSpriteName().isBlank()) {
            command.add("-s");
            command.add(config.getSpriteName());
        }
        command.add("-comment");
        command.add(sanitizeLabel(label));
        return command;
    }

    static String sanitizeLabel(String label) {
        if (label == null || label.isBlank()) {
            return "checkpoint";
        }
        String sanitized = label.trim().replaceAll("[^A-Za-z0-9_-]", "-");
        return sanitized.length() > MAX_LABEL_LENGTH ? sanitized.substring(0, MAX_LABEL_LENGTH) : sanitized;
    }
}
