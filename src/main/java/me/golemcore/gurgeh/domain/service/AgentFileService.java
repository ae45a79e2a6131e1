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

import me.golemcore.gurgeh.domain.model.WriteMode;
import me.golemcore.gurgeh.infrastructure.config.AgentProperties;
import me.golemcore.gurgeh.security.PathSandbox;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Sandboxed file access for the agent's own files.
 *
 * <p>
 * Every operation takes a logical path and goes through {@link PathSandbox}:
 * writes through the full validation pipeline, reads through the relaxed one.
 * Writes enforce a per-file size ceiling before any byte reaches disk.
 * Overwrites are atomic (temp file, fsync, rename).
 *
 * @since 1.0
 */
@Service
@Slf4j
public class AgentFileService {

    private static final List<String> AGENT_DIRECTORIES = List.of(
            "/self", "/self/logs", "/self/awakenings", "/self/decisions", "/self/decisions/pending",
            "/self/tasks", "/self/execution-logs",
            "/projects", "/income", "/comms", "/comms/inbox", "/comms/outbox",
            "/public", "/public/images");

    private static final String DEFAULT_INDEX_HTML = """
            <!DOCTYPE html>
            <html lang="en">
            <head>
              <meta charset="utf-8">
              <title>Awakening</title>
            </head>
            <body>
              <h1>This space is still empty.</h1>
              <p>An autonomous agent lives here. It has not published anything yet.</p>
            </body>
            </html>
            """;

    private final PathSandbox sandbox;
    private final Clock clock;
    private final long maxFileSizeBytes;
    private final long journalWarnSizeBytes;

    public AgentFileService(PathSandbox sandbox, AgentProperties properties, Clock clock) {
        this.sandbox = sandbox;
        this.clock = clock;
        this.maxFileSizeBytes = properties.getSandbox().getMaxFileSizeBytes();
        this.journalWarnSizeBytes = properties.getSandbox().getJournalWarnSizeBytes();
    }

    /**
     * Creates the zone layout and a placeholder public page.
     */
    public void initDirectories() {
        for (String dir : AGENT_DIRECTORIES) {
            try {
                Files.createDirectories(sandbox.resolveForRead(dir));
            } catch (IOException e) {
                log.error("[Files] Failed to create directory {}: {}", dir, e.getMessage());
            }
        }
        if (!exists("/public/index.html")) {
            write("/public/index.html", DEFAULT_INDEX_HTML, WriteMode.OVERWRITE);
        }
        log.info("[Files] Directory layout ready under {}", sandbox.getRoot());
    }

    public Optional<String> read(String logicalPath) {
        try {
            Path path = sandbox.resolveForRead(logicalPath);
            if (!Files.isRegularFile(path)) {
                return Optional.empty();
            }
            return Optional.of(Files.readString(path, StandardCharsets.UTF_8));
        } catch (PathSandbox.SandboxViolationException e) {
            log.warn("[Files] Read rejected for {}: {}", logicalPath, e.getMessage());
            return Optional.empty();
        } catch (IOException e) {
            log.warn("[Files] Failed to read {}: {}", logicalPath, e.getMessage());
            return Optional.empty();
        }
    }

    public boolean exists(String logicalPath) {
        try {
            return Files.exists(sandbox.resolveForRead(logicalPath));
        } catch (PathSandbox.SandboxViolationException e) {
            return false;
        }
    }

    /**
     * Writes content to a logical path.
     *
     * @throws PathSandbox.SandboxViolationException
     *             if the path is rejected by the sandbox
     * @throws FileSizeLimitException
     *             if the resulting file would exceed the size ceiling
     * @throws UncheckedIOException
     *             on I/O failure
     */
    public void write(String logicalPath, String content, WriteMode mode) {
        Path path = sandbox.validate(logicalPath);
        byte[] bytes = (content != null ? content : "").getBytes(StandardCharsets.UTF_8);

        try {
            long existing = mode == WriteMode.APPEND && Files.isRegularFile(path) ? Files.size(path) : 0;
            long resulting = existing + bytes.length;
            if (resulting > maxFileSizeBytes) {
                log.warn("[Files] Size ceiling exceeded for {}: {} > {}", logicalPath, resulting, maxFileSizeBytes);
                throw new FileSizeLimitException("File " + logicalPath + " would be " + resulting
                        + " bytes, limit is " + maxFileSizeBytes);
            }

            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            if (mode == WriteMode.APPEND) {
                Files.write(path, bytes, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } else {
                writeAtomically(path, bytes);
            }

            if (logicalPath.contains("journal") && resulting > journalWarnSizeBytes) {
                log.warn("[Files] Journal {} is {} bytes, consider summarizing", logicalPath, resulting);
            }
            log.debug("[Files] {} {} ({} bytes)", mode, logicalPath, bytes.length);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + logicalPath, e);
        }
    }

    /**
     * Appends a timestamped entry, separated from earlier content by a header
     * line.
     */
    public void appendEntry(String logicalPath, String content) {
        String entry = "\n--- [" + Instant.now(clock) + "] ---\n" + (content != null ? content : "");
        write(logicalPath, entry, WriteMode.APPEND);
    }

    /**
     * Lists entry names in a logical directory, sorted by name. Missing
     * directories yield an empty list.
     */
    public List<String> list(String logicalDir) {
        try {
            Path dir = sandbox.resolveForRead(logicalDir);
            if (!Files.isDirectory(dir)) {
                return Collections.emptyList();
            }
            try (Stream<Path> entries = Files.list(dir)) {
                List<String> names = new ArrayList<>();
                entries.map(p -> p.getFileName().toString())
                        .filter(name -> !name.endsWith(".tmp"))
                        .sorted()
                        .forEach(names::add);
                return names;
            }
        } catch (PathSandbox.SandboxViolationException e) {
            log.warn("[Files] List rejected for {}: {}", logicalDir, e.getMessage());
            return Collections.emptyList();
        } catch (IOException e) {
            log.warn("[Files] Failed to list {}: {}", logicalDir, e.getMessage());
            return Collections.emptyList();
        }
    }

    /**
     * Creates a writable logical directory and its parents if missing.
     */
    public Path ensureDirectory(String logicalDir) {
        Path dir = sandbox.validate(logicalDir);
        try {
            return Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create directory " + logicalDir, e);
        }
    }

    public boolean isDirectory(String logicalPath) {
        try {
            return Files.isDirectory(sandbox.resolveForRead(logicalPath));
        } catch (PathSandbox.SandboxViolationException e) {
            return false;
        }
    }

    public boolean delete(String logicalPath) {
        Path path = sandbox.validate(logicalPath);
        try {
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("[Files] Failed to delete {}: {}", logicalPath, e.getMessage());
            return false;
        }
    }

    /**
     * Moves a file between two writable logical paths, replacing the target.
     */
    public void move(String fromLogical, String toLogical) {
        Path from = sandbox.validate(fromLogical);
        Path to = sandbox.validate(toLogical);
        try {
            Path parent = to.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to move " + fromLogical + " to " + toLogical, e);
        }
    }

    private void writeAtomically(Path targetPath, byte[] bytes) throws IOException {
        // Fresh random name created exclusively, so a pre-planted link at a guessable name is never followed
        Path tempPath = Files.createTempFile(targetPath.getParent(), targetPath.getFileName() + ".", ".tmp");
        try {
            try (OutputStream os = Files.newOutputStream(tempPath,
                    StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    LinkOption.NOFOLLOW_LINKS);
                    FileChannel channel = FileChannel.open(tempPath, StandardOpenOption.WRITE,
                            LinkOption.NOFOLLOW_LINKS)) {
                os.write(bytes);
                os.flush();
                channel.force(true);
            }
            try {
                Files.move(tempPath, targetPath,
                        StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("[Files] Atomic move not supported, using regular move");
                Files.move(tempPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempPath);
            } catch (IOException cleanupEx) {
                log.warn("[Files] Failed to cleanup temp file: {}", tempPath);
            }
            throw e;
        }
    }

    /**
     * Raised when a write would push a file past the size ceiling.
     */
    public static class FileSizeLimitException extends IllegalStateException {
        private static final long serialVersionUID = 1L;

        public FileSizeLimitException(String message) {
            super(message);
        }
    }
}
