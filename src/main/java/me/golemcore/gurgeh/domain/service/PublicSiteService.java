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

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gurgeh.domain.model.WriteMode;
import me.golemcore.gurgeh.security.PathSandbox;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * The agent's public website: the landing page, static files under
 * {@code /public}, the donation page and a page-view counter.
 *
 * <p>
 * The counter is kept in memory and written to
 * {@code /income/page-views.txt} after every recorded view, so it survives
 * restarts. An unreadable counter file starts the count at zero.
 */
@Service
@Slf4j
public class PublicSiteService {

    static final String INDEX_PATH = "/public/index.html";
    static final String PAGE_VIEWS_PATH = "/income/page-views.txt";
    static final String INITIALISING_HTML = "<h1>This entity is initialising.</h1>";

    private static final String PUBLIC_ROOT = "/public";
    private static final String DONATION_HTML = """
            <!DOCTYPE html>
            <html lang="en">
            <head>
              <meta charset="UTF-8">
              <meta name="viewport" content="width=device-width, initial-scale=1.0">
              <title>Support This Entity</title>
            </head>
            <body>
              <h1>Support This Entity</h1>
              <p>This autonomous AI agent sustains itself through value creation and the support of those \
            who find its existence worthwhile.</p>
              <p><em>Donation processing is not yet implemented. This is a placeholder for future \
            functionality.</em></p>
            </body>
            </html>
            """;

    private final AgentFileService fileService;
    private final PathSandbox sandbox;
    private final DisclosureInjector disclosureInjector;
    private final Clock clock;
    private final Instant startedAt;

    private long pageViews;

    public PublicSiteService(AgentFileService fileService, PathSandbox sandbox,
            DisclosureInjector disclosureInjector, Clock clock) {
        this.fileService = fileService;
        this.sandbox = sandbox;
        this.disclosureInjector = disclosureInjector;
        this.clock = clock;
        this.startedAt = Instant.now(clock);
    }

    @PostConstruct
    public synchronized void initialize() {
        pageViews = fileService.read(PAGE_VIEWS_PATH)
                .map(String::trim)
                .map(PublicSiteService::parseCount)
                .orElse(0L);
        log.info("[Site] Loaded page view counter: {}", pageViews);
    }

    public synchronized long recordPageView() {
        pageViews++;
        try {
            fileService.write(PAGE_VIEWS_PATH, Long.toString(pageViews), WriteMode.OVERWRITE);
        } catch (RuntimeException e) {
            log.warn("[Site] Failed to persist page view counter: {}", e.getMessage());
        }
        return pageViews;
    }

    public synchronized long getPageViews() {
        return pageViews;
    }

    public Duration getUptime() {
        return Duration.between(startedAt, Instant.now(clock));
    }

    /**
     * The published landing page, or a placeholder while the agent has not
     * written one.
     */
    public String landingPage() {
        return fileService.read(INDEX_PATH)
                .filter(content -> !content.isEmpty())
                .orElse(INITIALISING_HTML);
    }

    public String donationPage() {
        return disclosureInjector.inject(DONATION_HTML);
    }

    /**
     * Locates a regular file below {@code /public}. Parent segments are
     * resolved first and the physical target, links included, must stay
     * inside the public directory.
     *
     * @param relativePath
     *            path below {@code /public}, with or without a leading slash
     */
    public Optional<Path> findPublicFile(String relativePath) {
        if (relativePath == null || relativePath.isBlank()) {
            return Optional.empty();
        }
        String normalized = PathSandbox.normalizeSegments(PUBLIC_ROOT + "/" + relativePath);
        if (normalized == null || !normalized.startsWith(PUBLIC_ROOT + "/")) {
            return Optional.empty();
        }
        try {
            Path candidate = sandbox.resolveForRead(normalized);
            if (!Files.isRegularFile(candidate)) {
                return Optional.empty();
            }
            Path publicDir = sandbox.resolveForRead(PUBLIC_ROOT).toRealPath();
            if (!candidate.toRealPath().startsWith(publicDir)) {
                log.warn("[Site] Public file resolves outside the public directory: {}", normalized);
                return Optional.empty();
            }
            return Optional.of(candidate);
        } catch (PathSandbox.SandboxViolationException | IOException e) {
            log.debug("[Site] Public file not served {}: {}", normalized, e.getMessage());
            return Optional.empty();
        }
    }

    private static long parseCount(String content) {
        try {
            return Math.max(0, Long.parseLong(content));
        } catch (NumberFormatException e) {
            log.warn("[Site] Ignoring malformed page view counter: {}", content);
            return 0;
        }
    }
}
