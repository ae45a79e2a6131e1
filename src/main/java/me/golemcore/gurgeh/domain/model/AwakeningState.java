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

import java.time.Instant;
import java.util.List;

/**
 * Everything gathered at the start of a cycle that the briefing is built
 * from.
 */
@Data
@Builder
public class AwakeningState {

    private long awakeningNumber;
    private Instant timestamp;
    private Long timeSinceLastMs;
    private String identity;
    private String journal;
    private String values;
    private String currentFocus;
    private String workHistory;
    private List<InboxMessage> inbox;
    private List<AgentTask> tasks;
    private List<ExecutionLog> recentExecutions;
    private EnergyLedger energy;
    private String activeSchedule;
}
