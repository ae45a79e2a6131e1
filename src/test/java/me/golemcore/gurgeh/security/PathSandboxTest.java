package me.golemcore.gurgeh.security;

import me.golemcore.gurgeh.infrastructure.config.AgentProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PathSandboxTest {

    @TempDir
    Path tempDir;

    private Path root;
    private PathSandbox sandbox;

    @BeforeEach
    void setUp() {
        root = tempDir.resolve("root");
        AgentProperties properties = new AgentProperties();
        properties.setBaseDir(root.toString());
        sandbox = new PathSandbox(properties);
    }

    @Test
    void shouldNormalizeDotSegmentsAndBackslashes() {
        assertEquals("/self/journal.md", sandbox.normalize("/self/../self/./journal.md"));
        assertEquals("/self/notes/a.md", sandbox.normalize("\\self\\notes\\a.md"));
        assertEquals("/projects/app", sandbox.normalize("projects//app/"));
        assertEquals("/", sandbox.normalize("/self/.."));
    }

    @Test
    void shouldRejectTraversalAboveRoot() {
        assertThrows(PathSandbox.SandboxViolationException.class, () -> sandbox.normalize("/../etc/passwd"));
        assertThrows(PathSandbox.SandboxViolationException.class,
                () -> sandbox.normalize("/self/../../etc/passwd"));
    }

    @Test
    void shouldRejectEmptyPath() {
        assertThrows(PathSandbox.SandboxViolationException.class, () -> sandbox.normalize(""));
        assertThrows(PathSandbox.SandboxViolationException.class, () -> sandbox.normalize(null));
    }

    @Test
    void shouldMapAllowedWriteIntoRoot() {
        Path physical = sandbox.validate("/self/journal.md");

        assertEquals(root.resolve("self/journal.md").toAbsolutePath().normalize(), physical);
        assertTrue(sandbox.isConfined());
    }

    @Test
    void shouldBlockFoundingDocument() {
        PathSandbox.SandboxViolationException ex = assertThrows(PathSandbox.SandboxViolationException.class,
                () -> sandbox.validate("/founding-document.md"));
        assertTrue(ex.getMessage().contains("protected file"));
    }

    @Test
    void shouldBlockProtectedPrefixes() {
        assertThrows(PathSandbox.SandboxViolationException.class, () -> sandbox.validate("/etc/passwd"));
        assertThrows(PathSandbox.SandboxViolationException.class,
                () -> sandbox.validate("/opt/agent/src/Main.java"));
        assertThrows(PathSandbox.SandboxViolationException.class, () -> sandbox.validate("/usr/bin/env"));
    }

    @Test
    void shouldBlockPathsOutsideZones() {
        PathSandbox.SandboxViolationException ex = assertThrows(PathSandbox.SandboxViolationException.class,
                () -> sandbox.validate("/tmp/scratch.txt"));
        assertTrue(ex.getMessage().contains("outside allowed zones"));
    }

    @Test
    void shouldBlockTraversalDisguisedAsZonePath() {
        assertThrows(PathSandbox.SandboxViolationException.class,
                () -> sandbox.validate("/public/../etc/shadow"));
    }

    @Test
    void shouldTreatZoneDirectoryAsInsideZone() {
        assertTrue(sandbox.isInAllowedZone("/projects"));
        assertTrue(sandbox.isInAllowedZone("/projects/app/src"));
        assertFalse(sandbox.isInAllowedZone("/projectsX/app"));
        assertFalse(sandbox.isInAllowedZone("/../self"));
        assertFalse(sandbox.isInAllowedZone("/"));
    }

    @Test
    void shouldAllowReadsOutsideZones() {
        Path physical = sandbox.resolveForRead("/founding-document.md");

        assertEquals(root.resolve("founding-document.md").toAbsolutePath().normalize(), physical);
    }

    @Test
    void shouldBlockSymlinkEscape() throws IOException {
        Path outside = Files.createDirectories(tempDir.resolve("outside"));
        Path selfDir = Files.createDirectories(root.resolve("self"));
        Files.createSymbolicLink(selfDir.resolve("link"), outside);

        assertThrows(PathSandbox.SandboxViolationException.class,
                () -> sandbox.validate("/self/link/stolen.txt"));
        assertThrows(PathSandbox.SandboxViolationException.class,
                () -> sandbox.resolveForRead("/self/link/stolen.txt"));
    }

    @Test
    void shouldResolveSegmentsWithoutClampingAtRoot() {
        assertEquals("/etc", PathSandbox.normalizeSegments("/projects/app/../../etc"));
        assertEquals("/", PathSandbox.normalizeSegments("/projects/.."));
        assertNull(PathSandbox.normalizeSegments("/projects/../../etc"));
    }

    @Test
    void shouldConvertPhysicalPathBackToLogical() {
        Path physical = sandbox.validate("/public/index.html");

        assertEquals("/public/index.html", sandbox.toLogical(physical));
        assertNull(sandbox.toLogical(tempDir.resolve("elsewhere/file.txt")));
    }

    @Test
    void shouldMapOneToOneWhenRootIsFilesystemRoot() {
        AgentProperties properties = new AgentProperties();
        properties.setBaseDir("/");
        PathSandbox unconfined = new PathSandbox(properties);

        assertFalse(unconfined.isConfined());
        assertEquals(Paths.get("/self/journal.md"), unconfined.validate("/self/journal.md"));
        assertThrows(PathSandbox.SandboxViolationException.class, () -> unconfined.validate("/etc/hosts"));
    }
}
