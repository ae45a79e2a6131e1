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
 * Read-only tool for delegated workers: lists a directory inside the agent's
 * allowed zones.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ListFilesTool implements ToolComponent {

    static final String NAME = "list_files";
    private static final String PARAM_DIRECTORY = "directory";

    private final PathSandbox sandbox;
    private final AgentFileService fileService;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("List the entries of a directory in the entity's filesystem, e.g. /public.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_DIRECTORY, Map.of(
                                        "type", "string",
                                        "description", "Absolute logical path of the directory")),
                        "required", List.of(PARAM_DIRECTORY)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            Object directory = parameters.get(PARAM_DIRECTORY);
            if (!(directory instanceof String dir) || dir.isBlank()) {
                return ToolResult.failure("Missing required parameter: directory");
            }
            if (!sandbox.isInAllowedZone(dir)) {
                log.warn("[Delegation] Worker list outside allowed zones: {}", dir);
                return ToolResult.failure("Access denied: workers can only list inside the agent's zones");
            }
            List<String> entries = fileService.list(dir);
            if (entries.isEmpty()) {
                return ToolResult.success("Directory empty or not found.");
            }
            return ToolResult.success(String.join("\n", entries));
        });
    }
}
