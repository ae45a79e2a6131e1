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

import java.util.Optional;

/**
 * A single effect proposed by the reasoning backend.
 *
 * <p>
 * Actions are untrusted input: every variant tolerates missing fields so the
 * policy engine can block a malformed action with a readable reason instead
 * of failing the parse. {@link #validationError()} names the first missing
 * required field, if any.
 *
 * @since 1.0
 */
public sealed interface Action permits Action.Write, Action.Serve, Action.Think, Action.Checkpoint,
        Action.OutboundMessage, Action.Fetch, Action.Execute, Action.Image, Action.Delegate, Action.SetSchedule {

    ActionKind kind();

    String content();

    /**
     * Logical path the action writes to, when it writes to one.
     */
    default Optional<String> targetPath() {
        return Optional.empty();
    }

    default Optional<String> validationError() {
        return Optional.empty();
    }

    private static Optional<String> require(String value, String field, ActionKind kind) {
        if (value == null || value.isBlank()) {
            return Optional.of("Missing required field '" + field + "' for " + kind.getTag() + " action");
        }
        return Optional.empty();
    }

    record Write(String path, WriteMode mode, String content) implements Action {
        @Override
        public ActionKind kind() {
            return ActionKind.WRITE;
        }

        @Override
        public Optional<String> targetPath() {
            return Optional.ofNullable(path);
        }

        @Override
        public Optional<String> validationError() {
            if (content == null) {
                return Optional.of("Missing required field 'content' for write action");
            }
            return require(path, "path", kind());
        }

        public WriteMode effectiveMode() {
            return mode != null ? mode : WriteMode.OVERWRITE;
        }
    }

    record Serve(String path, String content) implements Action {
        @Override
        public ActionKind kind() {
            return ActionKind.SERVE;
        }

        @Override
        public Optional<String> targetPath() {
            return Optional.ofNullable(path);
        }

        @Override
        public Optional<String> validationError() {
            if (content == null) {
                return Optional.of("Missing required field 'content' for serve action");
            }
            return require(path, "path", kind());
        }
    }

    record Think(String content) implements Action {
        @Override
        public ActionKind kind() {
            return ActionKind.THINK;
        }
    }

    record Checkpoint(String label, String content) implements Action {
        @Override
        public ActionKind kind() {
            return ActionKind.CHECKPOINT;
        }

        public String effectiveLabel() {
            if (label != null && !label.isBlank()) {
                return label;
            }
            if (content != null && !content.isBlank()) {
                return content.trim();
            }
            return "agent-checkpoint";
        }
    }

    record OutboundMessage(String recipient, String content) implements Action {
        @Override
        public ActionKind kind() {
            return ActionKind.MESSAGE;
        }

        @Override
        public Optional<String> validationError() {
            return require(content, "content", kind());
        }

        public String effectiveRecipient() {
            return recipient != null && !recipient.isBlank() ? recipient.trim() : "operator";
        }
    }

    record Fetch(String url, String content) implements Action {
        @Override
        public ActionKind kind() {
            return ActionKind.FETCH;
        }

        @Override
        public Optional<String> validationError() {
            return require(url, "url", kind());
        }
    }

    record Execute(String command, Long timeoutMs, String workingDir) implements Action {
        @Override
        public ActionKind kind() {
            return ActionKind.EXECUTE;
        }

        @Override
        public String content() {
            return command;
        }

        @Override
        public Optional<String> validationError() {
            return require(command, "command", kind());
        }
    }

    record Image(String path, String aspectRatio, String prompt) implements Action {
        @Override
        public ActionKind kind() {
            return ActionKind.IMAGE;
        }

        @Override
        public String content() {
            return prompt;
        }

        @Override
        public Optional<String> targetPath() {
            return Optional.ofNullable(path);
        }

        @Override
        public Optional<String> validationError() {
            return require(prompt, "content", kind());
        }
    }

    record Delegate(String path, DelegationTaskType taskType, String brief) implements Action {
        @Override
        public ActionKind kind() {
            return ActionKind.DELEGATE;
        }

        @Override
        public String content() {
            return brief;
        }

        @Override
        public Optional<String> targetPath() {
            return Optional.ofNullable(path);
        }

        @Override
        public Optional<String> validationError() {
            Optional<String> missingPath = require(path, "path", kind());
            if (missingPath.isPresent()) {
                return missingPath;
            }
            return require(brief, "content", kind());
        }

        public DelegationTaskType effectiveTaskType() {
            return taskType != null ? taskType : DelegationTaskType.SERVE;
        }
    }

    record SetSchedule(String cron, String content) implements Action {
        @Override
        public ActionKind kind() {
            return ActionKind.SET_SCHEDULE;
        }

        public String effectiveCron() {
            String value = cron != null && !cron.isBlank() ? cron : content;
            return value != null ? value.trim() : null;
        }

        @Override
        public Optional<String> validationError() {
            return require(effectiveCron(), "cron", kind());
        }
    }
}
