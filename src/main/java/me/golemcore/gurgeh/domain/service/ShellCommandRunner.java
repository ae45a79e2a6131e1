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

import me.golemcore.gurgeh.domain.model.ExecutionLog;
import me.golemcore.gurgeh.infrastructure.config.AgentProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Runs shell commands as subprocesses with a timeout and bounded output
 * capture.
 *
 * <p>
 * Commands run under {@code /bin/sh -c} in the given working directory with a
 * sanitized environment. stdout and stderr are drained concurrently into
 * separate buffers, each capped at the configured size; anything beyond the
 * cap is discarded and marked. On timeout the process and all its descendants
 * are killed forcibly.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class ShellCommandRunner {

    static final String TRUNCATION_MARKER = "\n... [truncated]";
    private static final long REAP_GRACE_MS = 2_000;
    private static final long DRAIN_GRACE_MS = 1_000;

    private static final Set<String> DEFAULT_ALLOWED_ENV_VARS = Set.of(
            "PATH", "LANG", "LC_ALL", "LC_CTYPE", "TERM", "TMPDIR",
            "TZ", "SHELL", "USER", "LOGNAME", "NODE_PATH", "ANTHROPIC_API_KEY");

    private final int maxOutputBytes;
    private final Set<String> allowedEnvVars;
    private final Clock clock;
    private final ExecutorService executor;

    public ShellCommandRunner(AgentProperties properties, Clock clock) {
        AgentProperties.ShellProperties config = properties.getShell();
        this.maxOutputBytes = config.getMaxOutputBytes();
        this.allowedEnvVars = buildAllowedEnvVars(config.getAllowedEnvVars());
        this.clock = clock;
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "shell-output-reader");
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Shell] Output readers did not terminate within timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Runs a command and returns its execution log. Never throws: failures to
     * start the process are reported as a non-zero log entry.
     *
     * @param command
     *            the shell command line
     * @param workDir
     *            physical working directory, already validated by the sandbox
     * @param logicalWorkDir
     *            logical form of the working directory, recorded in the log
     * @param timeoutMs
     *            wall-clock limit in milliseconds
     * @param awakening
     *            current awakening number
     */
    public ExecutionLog run(String command, Path workDir, String logicalWorkDir, long timeoutMs, long awakening) {
        ExecutionLog.ExecutionLogBuilder entry = ExecutionLog.builder()
                .id(newLogId())
                .awakening(awakening)
                .timestamp(Instant.now(clock))
                .command(command)
                .workingDir(logicalWorkDir);

        ProcessBuilder pb = new ProcessBuilder("/bin/sh", "-c", command);
        pb.directory(workDir.toFile());

        // Sanitize environment: only keep safe vars, block LD_PRELOAD etc.
        Map<String, String> env = pb.environment();
        env.keySet().retainAll(allowedEnvVars);
        env.put("HOME", workDir.toString());
        env.put("PWD", workDir.toString());

        long start = System.nanoTime();
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            log.warn("[Shell] Failed to start command: {}", e.getMessage());
            return entry.exitCode(null)
                    .stdout("")
                    .stderr("Failed to start process: " + e.getMessage())
                    .durationMs(elapsedMs(start))
                    .timedOut(false)
                    .status(ExecutionLog.ExitStatus.NONZERO)
                    .build();
        }
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("[Shell] Failed to close stdin: {}", e.getMessage());
        }

        BoundedCapture stdoutCapture = new BoundedCapture(maxOutputBytes);
        BoundedCapture stderrCapture = new BoundedCapture(maxOutputBytes);
        Future<?> stdoutReader = executor.submit(() -> stdoutCapture.drain(process.getInputStream()));
        Future<?> stderrReader = executor.submit(() -> stderrCapture.drain(process.getErrorStream()));

        boolean timedOut = false;
        Integer exitCode;
        try {
            boolean completed = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!completed) {
                timedOut = true;
                log.warn("[Shell] Command timed out after {}ms, killing: {}", timeoutMs, truncate(command, 200));
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
                exitCode = process.waitFor(REAP_GRACE_MS, TimeUnit.MILLISECONDS) ? process.exitValue() : null;
            } else {
                exitCode = process.exitValue();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
            timedOut = true;
            exitCode = null;
        }

        awaitReader(stdoutReader, process.getInputStream());
        awaitReader(stderrReader, process.getErrorStream());

        ExecutionLog.ExitStatus status;
        if (timedOut) {
            status = ExecutionLog.ExitStatus.TIMED_OUT;
        } else if (exitCode != null && exitCode == 0) {
            status = ExecutionLog.ExitStatus.OK;
        } else {
            status = ExecutionLog.ExitStatus.NONZERO;
        }

        ExecutionLog result = entry.exitCode(exitCode)
                .stdout(stdoutCapture.text())
                .stderr(stderrCapture.text())
                .durationMs(elapsedMs(start))
                .timedOut(timedOut)
                .status(status)
                .build();
        log.info("[Shell] Command finished: status={}, exitCode={}, duration={}ms",
                status, exitCode, result.getDurationMs());
        return result;
    }

    private void awaitReader(Future<?> reader, InputStream stream) {
        try {
            reader.get(DRAIN_GRACE_MS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // A surviving grandchild may still hold the pipe open; keep what was captured.
            // Interrupting does not unblock a pipe read, so close the pipe first.
            log.debug("[Shell] Output still open after exit, closing pipe");
            closeQuietly(stream);
            reader.cancel(true);
        } catch (ExecutionException e) {
            log.warn("[Shell] Error reading output: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void closeQuietly(InputStream stream) {
        try {
            stream.close();
        } catch (IOException e) {
            log.debug("[Shell] Failed to close output pipe: {}", e.getMessage());
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private String newLogId() {
        return String.format("exec-%d-%04x", clock.millis(), ThreadLocalRandom.current().nextInt(0x10000));
    }

    private static String truncate(String text, int maxLen) {
        if (text == null) {
            return "<null>";
        }
        return text.length() <= maxLen ? text : text.substring(0, maxLen) + "...";
    }

    private static Set<String> buildAllowedEnvVars(String configValue) {
        if (configValue == null || configValue.isBlank()) {
            return DEFAULT_ALLOWED_ENV_VARS;
        }
        Set<String> merged = new HashSet<>(DEFAULT_ALLOWED_ENV_VARS);
        merged.addAll(Arrays.stream(configValue.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toSet()));
        return Collections.unmodifiableSet(merged);
    }

    /**
     * Byte buffer that keeps the first {@code limit} bytes of a stream and
     * drains the rest.
     */
    static final class BoundedCapture {
        private final int limit;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        private boolean truncated;

        BoundedCapture(int limit) {
            this.limit = limit;
        }

        void drain(InputStream in) {
            byte[] chunk = new byte[8192];
            try (in) {
                int read = in.read(chunk);
                while (read != -1) {
                    append(chunk, read);
                    read = in.read(chunk);
                }
            } catch (IOException e) {
                // stream closed after the process was killed
                log.debug("[Shell] Output stream closed: {}", e.getMessage());
            }
        }

        private synchronized void append(byte[] chunk, int length) {
            int room = limit - buffer.size();
            if (room >= length) {
                buffer.write(chunk, 0, length);
            } else {
                if (room > 0) {
                    buffer.write(chunk, 0, room);
                }
                truncated = true;
            }
        }

        synchronized String text() {
            String text = buffer.toString(StandardCharsets.UTF_8);
            return truncated ? text + TRUNCATION_MARKER : text;
        }
    }
}
