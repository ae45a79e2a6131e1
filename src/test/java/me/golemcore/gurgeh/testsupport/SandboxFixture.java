package me.golemcore.gurgeh.testsupport;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.golemcore.gurgeh.domain.service.AgentFileService;
import me.golemcore.gurgeh.infrastructure.config.AgentProperties;
import me.golemcore.gurgeh.security.PathSandbox;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Real sandbox and file service confined to a temporary directory, with a
 * fixed clock.
 */
public final class SandboxFixture {

    public static final Instant FIXED_NOW = Instant.parse("2026-03-14T09:30:00Z");

    private final Path root;
    private final AgentProperties properties;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private PathSandbox sandbox;
    private AgentFileService fileService;

    private SandboxFixture(Path root, AgentProperties properties) {
        this.root = root;
        this.properties = properties;
        this.clock = Clock.fixed(FIXED_NOW, ZoneOffset.UTC);
        this.objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public static SandboxFixture create(Path tempDir) {
        AgentProperties properties = new AgentProperties();
        properties.setBaseDir(tempDir.resolve("root").toString());
        return new SandboxFixture(tempDir.resolve("root"), properties);
    }

    /**
     * Properties may be tweaked before the first call to {@link #sandbox()} or
     * {@link #fileService()}.
     */
    public AgentProperties properties() {
        return properties;
    }

    public PathSandbox sandbox() {
        if (sandbox == null) {
            sandbox = new PathSandbox(properties);
        }
        return sandbox;
    }

    public AgentFileService fileService() {
        if (fileService == null) {
            fileService = new AgentFileService(sandbox(), properties, clock);
        }
        return fileService;
    }

    public Clock clock() {
        return clock;
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    public Path physical(String logicalPath) {
        return root.resolve(logicalPath.substring(1));
    }

    public String readPhysical(String logicalPath) {
        try {
            return Files.readString(physical(logicalPath), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public void writePhysical(String logicalPath, String content) {
        try {
            Path path = physical(logicalPath);
            Files.createDirectories(path.getParent());
            Files.writeString(path, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
