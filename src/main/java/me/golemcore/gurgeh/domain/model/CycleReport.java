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

import java.util.List;

/**
 * Summary of a completed (or aborted) awakening cycle.
 */
@Data
@Builder
public class CycleReport {

    private long awakeningNumber;
    private boolean completed;
    private String abortReason;
    private int proposedActions;
    private int approvedActions;
    private List<ExecutionResult> results;
    private LlmUsage usage;
    private boolean scheduleChanged;

    public static CycleReport aborted(long awakeningNumber, String reason) {
        return CycleReport.builder()
                .awakeningNumber(awakeningNumber)
                .completed(false)
                .abortReason(reason)
                .results(List.of())
                .build();
    }

    public long successCount() {
        return results == null ? 0 : results.stream().filter(ExecutionResult::isSuccess).count();
    }
}
