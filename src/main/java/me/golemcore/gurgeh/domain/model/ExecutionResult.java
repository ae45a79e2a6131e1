package me.golemcore.gurgeh.domain.model;

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

import lombok.Builder;
import lombok.Data;

/**
 * Outcome of executing one approved action.
 */
@Data
@Builder
public class ExecutionResult {

    private Action action;
    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private String error;
    private String detail;

    public static ExecutionResult success(Action action) {
        return ExecutionResult.builder()
                .action(action)
                .success(true)
                .build();
    }

    public static ExecutionResult success(Action action, String detail) {
        return ExecutionResult.builder()
                .action(action)
                .success(true)
                .detail(detail)
                .build();
    }

    public static ExecutionResult failure(Action action, String error) {
        return ExecutionResult.builder()
                .action(action)
                .success(false)
                .error(error)
                .build();
    }
}
