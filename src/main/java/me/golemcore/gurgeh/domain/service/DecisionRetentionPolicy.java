package me.golemcore.gurgeh.domain.service;

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

import me.golemcore.gurgeh.infrastructure.config.AgentProperties;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Decides when persisted decision records are compacted: every Nth persisted
 * record triggers a compaction down to the retention limit.
 */
@Component
public class DecisionRetentionPolicy {

    private final int cleanupEvery;
    private final int retentionLimit;
    private final AtomicLong persistedCount = new AtomicLong();

    public DecisionRetentionPolicy(AgentProperties properties) {
        this.cleanupEvery = Math.max(1, properties.getPolicy().getCleanupEvery());
        this.retentionLimit = properties.getPolicy().getDecisionRetentionLimit();
    }

    /**
     * Registers one persisted record.
     *
     * @return true when this record should trigger compaction
     */
    public boolean onRecordPersisted() {
        return persistedCount.incrementAndGet() % cleanupEvery == 0;
    }

    public int getRetentionLimit() {
        return retentionLimit;
    }
}
