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

import me.golemcore.gurgeh.domain.model.FetchResult;

import java.util.Optional;

/**
 * Port for outbound HTTP GET requests limited to an allow-list of domains.
 */
public interface FetchPort {

    /**
     * @return the fetched body, or empty when the domain is not allowed or the
     *         request failed
     */
    Optional<FetchResult> fetch(String url);

    boolean isDomainAllowed(String url);
}
