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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Token usage reported by the reasoning backend for a single call or
 * accumulated across a worker loop.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LlmUsage {

    private int inputTokens;
    private int outputTokens;

    public static LlmUsage of(int inputTokens, int outputTokens) {
        return LlmUsage.builder()
                .inputTokens(inputTokens)
                .outputTokens(outputTokens)
                .build();
    }

    public static LlmUsage empty() {
        return new LlmUsage();
    }

    public int getTotalTokens() {
        return inputTokens + outputTokens;
    }

    /**
     * Adds the other usage to this one in place.
     */
    public LlmUsage add(LlmUsage other) {
        if (other != null) {
            inputTokens += other.inputTokens;
            outputTokens += other.outputTokens;
        }
        return this;
    }
}
