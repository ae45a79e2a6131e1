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
 * Audit entry produced by the policy engine for one proposed action.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecisionRecord {

    private String id;
    private Instant timestamp;
    private String actionType;
    private String description;
    private String harmAssessment;
    private Decision decision;
    private String reasoning;

    @JsonIgnore
    public boolean isBlocked() {
        return decision == Decision.BLOCK;
    }

    public enum Decision {
        PROCEED, DEFER, BLOCK
    }
}
