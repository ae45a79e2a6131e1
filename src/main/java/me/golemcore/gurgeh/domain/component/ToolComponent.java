package me.golemcore.gurgeh.domain.component;

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

import me.golemcore.gurgeh.domain.model.ToolDefinition;
import me.golemcore.gurgeh.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Component representing an executable tool that a delegated worker can
 * invoke. Tools expose their JSON Schema definition to the model via function
 * calling and implement the execution logic.
 */
public interface ToolComponent {

    /**
     * Returns the tool definition with JSON Schema for function calling.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool with the specified parameters and returns the result.
     *
     * @param parameters
     *            the execution parameters as a map
     * @return a future containing the tool execution result
     */
    CompletableFuture<ToolResult> execute(Map<String, Object> parameters);

    /**
     * Returns the unique name of this tool.
     *
     * @return the tool name
     */
    default String getToolName() {
        return getDefinition().getName();
    }
}
