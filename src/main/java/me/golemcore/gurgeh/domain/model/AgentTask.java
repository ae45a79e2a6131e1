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

/**
 * Work item tracked in {@code /self/tasks/<id>.json}. Tasks are created either
 * by the operator or by the agent itself.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentTask {

    private String id;
    private String createdAt;
    private String updatedAt;
    private String createdBy; // operator, agent
    private String title;
    private String description;
    private String priority; // urgent, high, medium, low
    private String status; // suggested, accepted, in-progress, completed, declined
    private String category;
    private String agentNotes;
    private String completedAt;

    @JsonIgnore
    public boolean isOpen() {
        return !"completed".equals(status) && !"declined".equals(status);
    }

    public int priorityRank() {
        if (priority == null) {
            return 4;
        }
        return switch (priority) {
        case "urgent" -> 0;
        case "high" -> 1;
        case "medium" -> 2;
        case "low" -> 3;
        default -> 4;
        };
    }
}
