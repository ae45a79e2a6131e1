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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Record of one subprocess run. Persisted under
 * {@code /self/execution-logs/} whatever the outcome.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionLog {

    private String id;
    private long awakening;
    private Instant timestamp;
    private String command;
    private String workingDir;
    private Integer exitCode; // null when the process could not be reaped
    private String stdout;
    private String stderr;
    private long durationMs;
    private boolean timedOut;
    private ExitStatus status;

    @JsonIgnore
    public boolean isSuccess() {
        return status == ExitStatus.OK;
    }

    public enum ExitStatus {
        OK, NONZERO, TIMED_OUT
    }
}
