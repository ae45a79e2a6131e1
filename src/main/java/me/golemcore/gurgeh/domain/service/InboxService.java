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

import me.golemcore.gurgeh.domain.model.InboxMessage;
import me.golemcore.gurgeh.domain.model.WriteMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Operator messages addressed to the agent. New messages land in
 * {@code /comms/inbox/}; once an awakening has seen them they are moved to
 * {@code /comms/read/} so the next briefing only shows what is new.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InboxService {

    static final String INBOX_DIR = "/comms/inbox";
    static final String READ_DIR = "/comms/read";

    private final AgentFileService fileService;
    private final Clock clock;

    /**
     * Stores an incoming message.
     *
     * @return the filename the message was stored under
     */
    public String receive(String from, String message) {
        Instant now = Instant.now(clock);
        String filename = "msg-" + now.toEpochMilli() + "-from-" + from.replaceAll("[^a-zA-Z0-9]", "_") + ".md";
        String content = "From: " + from + "\nReceived: " + now + "\n\n" + message;
        fileService.write(INBOX_DIR + "/" + filename, content, WriteMode.OVERWRITE);
        log.info("[Inbox] Message received from {}: {}", from, filename);
        return filename;
    }

    public List<InboxMessage> readUnread() {
        List<InboxMessage> messages = new ArrayList<>();
        for (String filename : fileService.list(INBOX_DIR)) {
            Optional<String> content = fileService.read(INBOX_DIR + "/" + filename);
            if (content.isEmpty() || content.get().isEmpty()) {
                continue;
            }
            messages.add(parse(filename, content.get()));
        }
        return messages;
    }

    /**
     * Moves the given messages out of the inbox. Failures are logged per
     * message and do not stop the rest.
     */
    public void markRead(List<InboxMessage> messages) {
        for (InboxMessage message : messages) {
            try {
                fileService.move(INBOX_DIR + "/" + message.filename(), READ_DIR + "/" + message.filename());
            } catch (RuntimeException e) {
                log.warn("[Inbox] Failed to mark {} as read: {}", message.filename(), e.getMessage());
            }
        }
        if (!messages.isEmpty()) {
            log.info("[Inbox] Marked {} messages as read", messages.size());
        }
    }

    static InboxMessage parse(String filename, String content) {
        String from = "unknown";
        String receivedAt = "unknown";
        for (String line : content.split("\n")) {
            if (line.startsWith("From:") && "unknown".equals(from)) {
                from = line.substring("From:".length()).trim();
            } else if (line.startsWith("Received:") && "unknown".equals(receivedAt)) {
                receivedAt = line.substring("Received:".length()).trim();
            }
        }
        int bodyStart = content.indexOf("\n\n");
        String body = bodyStart >= 0 ? content.substring(bodyStart + 2) : content;
        return new InboxMessage(filename, from, body, receivedAt);
    }
}
