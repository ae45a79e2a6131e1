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

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Denylist of shell command patterns that are blocked regardless of any other
 * grant.
 *
 * <p>
 * Covered categories:
 * <ul>
 * <li>root deletion and recursive deletion outside the writable zones</li>
 * <li>filesystem creation ({@code mkfs})</li>
 * <li>raw writes to block devices ({@code dd of=/dev/...}, redirects)</li>
 * <li>recursive permission or ownership changes on the root</li>
 * <li>fork bombs</li>
 * </ul>
 *
 * <p>
 * Recursive delete targets are resolved against the command's working
 * directory, following any {@code cd} earlier in the same command line. A
 * target that cannot be resolved (home directory, variable expansion, a
 * parent segment above the root) counts as outside the zones, and so does any
 * target once a {@code cd} has left them.
 */
@Component
@Slf4j
public class CommandDenylist {

    private static final List<Pattern> BLOCKED_PATTERNS = List.of(
            Pattern.compile("\\brm\\s+(-[a-zA-Z]+\\s+)*-[a-zA-Z]*[rR][a-zA-Z]*\\s+(-[a-zA-Z]+\\s+)*/\\*?(\\s|$|;|&|\\|)"),
            Pattern.compile("\\bmkfs(\\.\\w+)?\\b"),
            Pattern.compile("\\bdd\\b.*\\bof=/dev/"),
            Pattern.compile(">\\s*/dev/(sd|hd|nvme|xvd|vd|mmcblk)"),
            Pattern.compile("\\bch(mod|own)\\s+(-[a-zA-Z]+\\s+)*-[a-zA-Z]*R[a-zA-Z]*\\s+(\\S+\\s+)?/\\*?(\\s|$|;|&|\\|)"),
            Pattern.compile(":\\s*\\(\\s*\\)\\s*\\{\\s*:\\s*\\|\\s*:\\s*&\\s*}\\s*;\\s*:"));

    private static final Pattern COMMAND_SEPARATOR = Pattern.compile("&&|\\|\\||[;|&\\n]");
    private static final Pattern RECURSIVE_FLAG = Pattern.compile("-[a-zA-Z]*[rR][a-zA-Z]*");

    private final List<String> writableZones;
    private final String defaultWorkingDir;

    public CommandDenylist(AgentProperties properties) {
        this.writableZones = List.copyOf(properties.getSandbox().getAllowedZones());
        this.defaultWorkingDir = properties.getShell().getDefaultWorkingDir();
    }

    /**
     * Checks a command that runs in the default working directory.
     */
    public Optional<String> findViolation(String command) {
        return findViolation(command, null);
    }

    /**
     * Returns a description of the first denylist rule the command matches.
     *
     * @param command
     *            the shell command line
     * @param logicalWorkDir
     *            logical working directory the command starts in, or
     *            {@code null} for the default one
     */
    public Optional<String> findViolation(String command, String logicalWorkDir) {
        if (command == null || command.isBlank()) {
            return Optional.empty();
        }
        for (Pattern pattern : BLOCKED_PATTERNS) {
            if (pattern.matcher(command).find()) {
                log.warn("[Policy] Blocked pattern in command: {}", command);
                return Optional.of("matches blocked pattern " + pattern.pattern());
            }
        }
        String startDir = logicalWorkDir != null && !logicalWorkDir.isBlank() ? logicalWorkDir : defaultWorkingDir;
        Optional<String> violation = findRecursiveDeleteOutsideZones(command, startDir);
        violation.ifPresent(reason -> log.warn("[Policy] Blocked command ({}): {}", reason, command));
        return violation;
    }

    private Optional<String> findRecursiveDeleteOutsideZones(String command, String startDir) {
        // null means the shell has moved somewhere that cannot be resolved
        String cwd = PathSandbox.normalizeSegments(startDir.startsWith("/") ? startDir : "/" + startDir);

        for (String segment : COMMAND_SEPARATOR.split(command)) {
            List<String> tokens = tokenize(segment);
            if (tokens.isEmpty()) {
                continue;
            }
            String program = tokens.get(0);
            if ("cd".equals(program)) {
                cwd = tokens.size() > 1 ? resolve(cwd, tokens.get(1)) : null;
                continue;
            }

            int rmIndex = indexOfRm(tokens);
            if (rmIndex < 0) {
                continue;
            }
            List<String> arguments = tokens.subList(rmIndex + 1, tokens.size());
            if (!isRecursive(arguments)) {
                continue;
            }
            if (cwd == null || !isInWritableZone(cwd)) {
                return Optional.of("recursive delete after leaving writable zones: " + segment.trim());
            }
            boolean endOfOptions = false;
            for (String argument : arguments) {
                if (!endOfOptions && "--".equals(argument)) {
                    endOfOptions = true;
                    continue;
                }
                if (!endOfOptions && argument.startsWith("-")) {
                    continue;
                }
                if (argument.startsWith("~") || argument.startsWith("$HOME") || argument.startsWith("${HOME")) {
                    return Optional.of("recursive delete of home directory: " + argument);
                }
                String resolved = resolve(cwd, argument);
                if (resolved == null || !isInWritableZone(resolved)) {
                    return Optional.of("recursive delete outside writable zones: " + argument);
                }
            }
        }
        return Optional.empty();
    }

    private static List<String> tokenize(String segment) {
        String trimmed = segment.trim();
        while (!trimmed.isEmpty() && (trimmed.charAt(0) == '(' || trimmed.charAt(0) == '{')) {
            trimmed = trimmed.substring(1).trim();
        }
        if (trimmed.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(trimmed.split("\\s+"))
                .map(CommandDenylist::stripQuotes)
                .toList();
    }

    private static int indexOfRm(List<String> tokens) {
        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            if ("rm".equals(token) || token.endsWith("/rm")) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isRecursive(List<String> arguments) {
        for (String argument : arguments) {
            if ("--".equals(argument)) {
                return false;
            }
            if ("--recursive".equals(argument) || RECURSIVE_FLAG.matcher(argument).matches()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Resolves a shell path argument against a logical directory. Returns
     * {@code null} for targets that depend on the environment or escape the
     * root.
     */
    private static String resolve(String cwd, String target) {
        if (target.isEmpty() || target.startsWith("~") || target.startsWith("-")
                || target.contains("$") || target.contains("`")) {
            return null;
        }
        if (target.startsWith("/")) {
            return PathSandbox.normalizeSegments(target);
        }
        if (cwd == null) {
            return null;
        }
        return PathSandbox.normalizeSegments(cwd + "/" + target);
    }

    private boolean isInWritableZone(String normalized) {
        for (String zone : writableZones) {
            String trimmed = zone.endsWith("/") ? zone.substring(0, zone.length() - 1) : zone;
            if (normalized.equals(trimmed) || normalized.startsWith(trimmed + "/")) {
                return true;
            }
        }
        return false;
    }

    private static String stripQuotes(String token) {
        if (token.length() >= 2 && (token.startsWith("\"") && token.endsWith("\"")
                || token.startsWith("'") && token.endsWith("'"))) {
            return token.substring(1, token.length() - 1);
        }
        return token;
    }
}
