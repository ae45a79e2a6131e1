package me.golemcore.gurgeh.tools;

import me.golemcore.gurgeh.domain.model.ToolResult;
import me.golemcore.gurgeh.testsupport.SandboxFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ListFilesToolTest {

    @TempDir
    Path tempDir;

    private SandboxFixture fixture;
    private ListFilesTool tool;

    @BeforeEach
    void setUp() {
        fixture = SandboxFixture.create(tempDir);
        tool = new ListFilesTool(fixture.sandbox(), fixture.fileService());
    }

    @Test
    void shouldListZoneDirectory() {
        fixture.writePhysical("/public/b.html", "b");
        fixture.writePhysical("/public/a.html", "a");

        ToolResult result = tool.execute(Map.of("directory", "/public")).join();

        assertTrue(result.isSuccess());
        assertEquals("a.html\nb.html", result.getOutput());
    }

    @Test
    void shouldReportEmptyDirectory() {
        ToolResult result = tool.execute(Map.of("directory", "/projects/nothing")).join();

        assertEquals("Directory empty or not found.", result.getOutput());
    }

    @Test
    void shouldDenyListingRoot() {
        ToolResult result = tool.execute(Map.of("directory", "/")).join();

        assertFalse(result.isSuccess());
        assertTrue(result.getError().startsWith("Access denied"));
    }

    @Test
    void shouldRejectNonStringDirectory() {
        ToolResult result = tool.execute(Map.of("directory", 42)).join();

        assertFalse(result.isSuccess());
    }
}
