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

import me.golemcore.gurgeh.domain.model.Action;
import me.golemcore.gurgeh.domain.model.ActionKind;
import me.golemcore.gurgeh.domain.model.DelegationTaskType;
import me.golemcore.gurgeh.domain.model.WriteMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts {@code <action type="..." ...>content</action>} blocks from the
 * reasoning text.
 *
 * <p>
 * Unknown action types are skipped with a warning. A malformed numeric
 * attribute is dropped with a warning and the action keeps a null value for
 * it; required-field checks are left to the policy engine.
 */
@Component
@Slf4j
public class ActionParser {

    private static final Pattern ACTION_PATTERN = Pattern.compile("<action\\s+([^>]*)>([\\s\\S]*?)</action>");
    private static final Pattern ATTR_PATTERN = Pattern.compile("(\\w+)=\"([^\"]*)\"");

    public List<Action> parse(String text) {
        List<Action> actions = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return actions;
        }

        Matcher matcher = ACTION_PATTERN.matcher(text);
        while (matcher.find()) {
            Map<String, String> attrs = parseAttributes(matcher.group(1));
            String content = matcher.group(2).trim();

            Optional<ActionKind> kind = ActionKind.fromTag(attrs.get("type"));
            if (kind.isEmpty()) {
                log.warn("[Parser] Skipping action with unknown type '{}'", attrs.get("type"));
                continue;
            }
            actions.add(build(kind.get(), attrs, content));
        }

        if (actions.isEmpty() && text.contains("<action")) {
            log.warn("[Parser] Found <action tags but could not parse any valid actions");
        }
        log.debug("[Parser] Parsed {} actions", actions.size());
        return actions;
    }

    private Action build(ActionKind kind, Map<String, String> attrs, String content) {
        return switch (kind) {
        case WRITE -> new Action.Write(attrs.get("path"), WriteMode.fromAttribute(attrs.get("mode")), content);
        case SERVE -> new Action.Serve(attrs.get("path"), content);
        case THINK -> new Action.Think(content);
        case CHECKPOINT -> new Action.Checkpoint(attrs.get("label"), content);
        case MESSAGE -> new Action.OutboundMessage(attrs.get("to"), content);
        case FETCH -> new Action.Fetch(attrs.get("url"), content);
        case EXECUTE -> new Action.Execute(blankToNull(content), parseTimeout(attrs.get("timeout")),
                attrs.get("workingDir"));
        case IMAGE -> new Action.Image(attrs.get("path"), attrs.get("aspectRatio"), blankToNull(content));
        case DELEGATE -> new Action.Delegate(attrs.get("path"), parseTaskType(attrs.get("taskType")),
                blankToNull(content));
        case SET_SCHEDULE -> new Action.SetSchedule(attrs.get("cron"), content);
        };
    }

    private static Map<String, String> parseAttributes(String attrString) {
        Map<String, String> attrs = new HashMap<>();
        Matcher matcher = ATTR_PATTERN.matcher(attrString);
        while (matcher.find()) {
            attrs.put(matcher.group(1), matcher.group(2));
        }
        return attrs;
    }

    private static Long parseTimeout(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            long timeout = Long.parseLong(value.trim());
            if (timeout <= 0) {
                log.warn("[Parser] Ignoring non-positive timeout '{}'", value);
                return null;
            }
            return timeout;
        } catch (NumberFormatException e) {
            log.warn("[Parser] Ignoring malformed timeout '{}'", value);
            return null;
        }
    }

    private static DelegationTaskType parseTaskType(String value) {
        return value == null ? null : DelegationTaskType.fromAttribute(value);
    }

    private static String blankToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
