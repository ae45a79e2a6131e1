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

class ReadFileToolTest {

    @TempDir
    Path tempDir;

    private SandboxFixture fixture;
    private ReadFileTool tool;

    @BeforeEach
    void setUp() {
        fixture = SandboxFixture.create(tempDir);
        tool = new ReadFileTool(fixture.sandbox(), fixture.fileService());
    }

    @Test
    void shouldDescribeRequiredPathParameter() {
        assertEquals("read_file", tool.getDefinition().getName());
        assertTrue(tool.getDefinition().getInputSchema().containsKey("required"));
    }

    @Test
    void shouldReadFileInsideZone() {
        fixture.writePhysical("/public/index.html", "<h1>hi</h1>");

        ToolResult result = tool.execute(Map.of("path", "/public/index.html")).join();

        assertTrue(result.isSuccess());
        assertEquals("<h1>hi</h1>", result.getOutput());
    }

    @Test
    void shouldReportMissingFileAsSuccess() {
        ToolResult result = tool.execute(Map.of("path", "/projects/none.txt")).join();

        assertTrue(result.isSuccess());
        assertEquals("File not found or empty.", result.getOutput());
    }

    @Test
    void shouldDenyReadsOutsideZones() {
        fixture.writePhysical("/founding-document.md", "charter");

        ToolResult outside = tool.execute(Map.of("path", "/founding-document.md")).join();
        ToolResult traversal = tool.execute(Map.of("path", "/public/../../etc/passwd")).join();

        assertFalse(outside.isSuccess());
        assertTrue(outside.getError().startsWith("Access denied"));
        assertFalse(traversal.isSuccess());
    }

    @Test
    void shouldRejectMissingPath() {
        ToolResult result = tool.execute(Map.of()).join();

        assertFalse(result.isSuccess());
        assertEquals("Error: Missing required parameter: path", result.toModelText());
    }
}
