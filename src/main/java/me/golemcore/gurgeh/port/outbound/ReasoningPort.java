package me.golemcore.gurgeh.port.outbound;

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

import me.golemcore.gurgeh.domain.model.ReasoningResult;

import java.util.Optional;

/**
 * Port for the primary reasoning call of an awakening cycle.
 */
public interface ReasoningPort {

    /**
     * Sends the founding document as system prompt and the briefing as the
     * user message.
     *
     * @return the model response, or empty when the call failed after retries
     */
    Optional<ReasoningResult> reason(String systemPrompt, String userMessage, int maxOutputTokens);

    /**
     * False once an unrecoverable backend error (bad credentials) has been
     * seen, or when the backend is not configured.
     */
    boolean isAvailable();
}
