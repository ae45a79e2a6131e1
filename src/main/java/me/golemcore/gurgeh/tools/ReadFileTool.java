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

package me.golemcore.gurgeh.tools;

import me.golemcore.gurgeh.domain.component.ToolComponent;
import me.golemcore.gurgeh.domain.model.ToolDefinition;
import me.golemcore.gurgeh.domain.model.ToolResult;
import me.golemcore.gurgeh.domain.service.AgentFileService;
import me.golemcore.gurgeh.security.PathSandbox;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Read-only tool for delegated workers: returns the content of a file inside
 * the agent's allowed zones.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReadFileTool implements ToolComponent {

    static final String NAME = "read_file";
    private static final String PARAM_PATH = "path";

    private final PathSandbox sandbox;
    private final AgentFileService fileService;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Read a file from the entity's filesystem. Paths are absolute, e.g. /public/index.html.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_PATH, Map.of(
                                        "type", "string",
                                        "description", "Absolute logical path of the file to read")),
                        "required", List.of(PARAM_PATH)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            Object path = parameters.get(PARAM_PATH);
            if (!(path instanceof String pathStr) || pathStr.isBlank()) {
                return ToolResult.failure("Missing required parameter: path");
            }
            if (!sandbox.isInAllowedZone(pathStr)) {
                log.warn("[Delegation] Worker read outside allowed zones: {}", pathStr);
                return ToolResult.failure("Access denied: workers can only read inside the agent's zones");
            }
            return fileService.read(pathStr)
                    .filter(content -> !content.isEmpty())
                    .map(ToolResult::success)
                    .orElseGet(() -> ToolResult.success("File not found or empty."));
        });
    }
}
