package me.golemcore.gurgeh.security;

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

import me.golemcore.gurgeh.infrastructure.config.AgentProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Translates logical agent paths into physical filesystem paths.
 *
 * <p>
 * Logical paths are slash-rooted ({@code /self/journal.md}). A write target
 * passes every rule below, in order:
 * <ol>
 * <li>Normalization: backslashes become slashes, {@code .} and {@code ..} are
 * resolved without clamping at the root. A {@code ..} that cannot be consumed
 * is a traversal attempt.</li>
 * <li>Exact match against protected files.</li>
 * <li>Protected prefixes (system directories, agent source tree).</li>
 * <li>Allowed zones: the path must live under one of them.</li>
 * <li>Physical resolution under the configured root. When the root is not
 * {@code /}, the real path of the nearest existing ancestor must stay inside
 * the real root, which defeats symlink escapes.</li>
 * </ol>
 *
 * <p>
 * Reads use the relaxed pipeline: normalization and physical resolution only.
 *
 * <p>
 * This class is the only place where logical paths become physical ones. It
 * holds no mutable state.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class PathSandbox {

    private static final String SEPARATOR = "/";
    private static final String PARENT = "..";
    private static final String CURRENT = ".";

    private final Path root;
    private final boolean confined;
    private final List<String> allowedZones;
    private final List<String> protectedFiles;
    private final List<String> protectedPrefixes;

    public PathSandbox(AgentProperties properties) {
        AgentProperties.SandboxProperties sandbox = properties.getSandbox();
        this.root = Paths.get(properties.getBaseDir()).toAbsolutePath().normalize();
        this.confined = root.getParent() != null;
        this.allowedZones = List.copyOf(sandbox.getAllowedZones());
        this.protectedFiles = List.copyOf(sandbox.getProtectedFiles());
        this.protectedPrefixes = List.copyOf(sandbox.getProtectedPrefixes());

        if (confined) {
            try {
                Files.createDirectories(root);
            } catch (IOException e) {
                log.error("[Sandbox] Failed to create sandbox root: {}", root, e);
            }
        }
        log.info("[Sandbox] Root: {} (confined: {})", root, confined);
    }

    public Path getRoot() {
        return root;
    }

    public boolean isConfined() {
        return confined;
    }

    /**
     * Normalizes a logical path into its canonical slash-rooted form.
     *
     * @throws SandboxViolationException
     *             if the path is empty or a parent segment escapes the root
     */
    public String normalize(String logicalPath) {
        if (logicalPath == null || logicalPath.isBlank()) {
            throw new SandboxViolationException("Path must not be empty");
        }
        if (logicalPath.indexOf('\0') >= 0) {
            throw new SandboxViolationException("Path contains NUL character");
        }
        String normalized = normalizeSegments(logicalPath);
        if (normalized == null) {
            log.warn("[Sandbox] Traversal attempt: {}", logicalPath);
            throw new SandboxViolationException("Path traversal detected: " + logicalPath);
        }
        return normalized;
    }

    /**
     * Resolves {@code .} and {@code ..} segments of a slash-rooted path without
     * clamping at the root.
     *
     * @return the canonical form, or {@code null} when a parent segment
     *         escapes the root
     */
    public static String normalizeSegments(String path) {
        String unified = path.trim().replace('\\', '/');
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : unified.split(SEPARATOR)) {
            if (segment.isEmpty() || CURRENT.equals(segment)) {
                continue;
            }
            if (PARENT.equals(segment)) {
                if (segments.isEmpty()) {
                    return null;
                }
                segments.removeLast();
                continue;
            }
            segments.addLast(segment);
        }
        return SEPARATOR + String.join(SEPARATOR, segments);
    }

    /**
     * Full validation pipeline for write targets.
     *
     * @return the physical path the logical path maps to
     * @throws SandboxViolationException
     *             if any rule rejects the path
     */
    public Path validate(String logicalPath) {
        String normalized = normalize(logicalPath);

        if (protectedFiles.contains(normalized)) {
            log.warn("[Sandbox] Write to protected file blocked: {}", normalized);
            throw new SandboxViolationException("Access denied: protected file " + normalized);
        }
        for (String prefix : protectedPrefixes) {
            if (isUnder(normalized, prefix)) {
                log.warn("[Sandbox] Write under protected prefix {} blocked: {}", prefix, normalized);
                throw new SandboxViolationException("Access denied: protected path " + normalized);
            }
        }
        if (!isInAllowedZone(normalized)) {
            log.warn("[Sandbox] Path outside allowed zones: {}", normalized);
            throw new SandboxViolationException("Access denied: " + normalized + " is outside allowed zones");
        }

        return toPhysical(normalized);
    }

    /**
     * Relaxed resolution used for reads: normalization and physical mapping
     * only.
     */
    public Path resolveForRead(String logicalPath) {
        return toPhysical(normalize(logicalPath));
    }

    /**
     * Checks zone membership of a raw logical path. The zone directory itself
     * counts as inside the zone; paths that fail normalization never do.
     */
    public boolean isInAllowedZone(String logicalPath) {
        String normalized;
        try {
            normalized = normalize(logicalPath);
        } catch (SandboxViolationException e) {
            return false;
        }
        for (String zone : allowedZones) {
            if (isUnder(normalized, zone)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Maps a physical path back to its logical form. Returns {@code null} for
     * paths outside the root.
     */
    public String toLogical(Path physical) {
        Path absolute = physical.toAbsolutePath().normalize();
        if (!absolute.startsWith(root)) {
            return null;
        }
        Path relative = root.relativize(absolute);
        return SEPARATOR + relative.toString().replace('\\', '/');
    }

    private static boolean isUnder(String normalized, String prefix) {
        String trimmed = prefix.endsWith(SEPARATOR) ? prefix.substring(0, prefix.length() - 1) : prefix;
        return normalized.equals(trimmed) || normalized.startsWith(trimmed + SEPARATOR);
    }

    private Path toPhysical(String normalized) {
        if (!confined) {
            return Paths.get(normalized);
        }

        Path candidate;
        try {
            candidate = root.resolve(normalized.substring(1)).normalize();
        } catch (InvalidPathException e) {
            throw new SandboxViolationException("Invalid path: " + normalized);
        }
        if (!candidate.startsWith(root)) {
            throw new SandboxViolationException("Path escapes sandbox root: " + normalized);
        }

        // Follow symlinks on the nearest existing ancestor to prevent symlink escape
        Path existing = candidate;
        while (existing != null && !Files.exists(existing, LinkOption.NOFOLLOW_LINKS)) {
            existing = existing.getParent();
        }
        if (existing == null) {
            return candidate;
        }
        try {
            Path realExisting = existing.toRealPath();
            Path realRoot = root.toRealPath();
            if (!realExisting.startsWith(realRoot)) {
                log.warn("[Sandbox] Symlink escape blocked: {} -> {}", existing, realExisting);
                throw new SandboxViolationException("Path escapes sandbox root: " + normalized);
            }
        } catch (IOException e) {
            log.warn("[Sandbox] Failed to resolve real path for {}: {}", normalized, e.getMessage());
            throw new SandboxViolationException("Unresolvable path: " + normalized);
        }
        return candidate;
    }

    /**
     * Raised when a logical path violates a sandbox rule.
     */
    public static class SandboxViolationException extends SecurityException {
        private static final long serialVersionUID = 1L;

        public SandboxViolationException(String message) {
            super(message);
        }
    }
}
