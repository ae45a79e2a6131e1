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

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of action kinds the agent can propose. Each kind carries the tag
 * used in the model's action markup and whether its effects reach beyond the
 * agent's own files.
 */
public enum ActionKind {

    WRITE("write", false),
    SERVE("serve", true),
    THINK("think", false),
    CHECKPOINT("checkpoint", false),
    MESSAGE("message", true),
    FETCH("fetch", true),
    EXECUTE("execute", true),
    IMAGE("image", true),
    DELEGATE("delegate", true),
    SET_SCHEDULE("set-schedule", false);

    private final String tag;
    private final boolean externallyFacing;

    ActionKind(String tag, boolean externallyFacing) {
        this.tag = tag;
        this.externallyFacing = externallyFacing;
    }

    public String getTag() {
        return tag;
    }

    public boolean isExternallyFacing() {
        return externallyFacing;
    }

    public static Optional<ActionKind> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(kind -> kind.tag.equals(normalized))
                .findFirst();
    }
}
