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
 * Result of one delegated sub-task.
 */
@Data
@Builder
public class DelegationOutcome {

    private Action.Delegate task;
    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private boolean skipped;
    private String content;
    private String error;
    private LlmUsage usage;
    private double cost;
    private int turns;

    public static DelegationOutcome skipped(Action.Delegate task, String reason) {
        return DelegationOutcome.builder()
                .task(task)
                .success(false)
                .skipped(true)
                .error(reason)
                .usage(LlmUsage.empty())
                .build();
    }
}
