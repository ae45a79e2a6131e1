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

import me.golemcore.gurgeh.domain.model.AgentTask;
import me.golemcore.gurgeh.domain.model.AwakeningState;
import me.golemcore.gurgeh.domain.model.EnergyLedger;
import me.golemcore.gurgeh.domain.model.ExecutionLog;
import me.golemcore.gurgeh.domain.model.InboxMessage;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Renders the per-awakening briefing handed to the reasoning backend as the
 * user message, and fits it into a token budget.
 *
 * <p>
 * Tokens are estimated as one per four characters. When the briefing is too
 * long, lines are removed from the end of the context sections; the action
 * catalogue and awakening guidance are always kept.
 */
@Component
public class BriefingBuilder {

    static final String ACTIONS_HEADER = "[AVAILABLE ACTIONS]";
    static final String TRUNCATION_MARKER = "[... context truncated to fit the token budget ...]";

    private static final int JOURNAL_TAIL_LINES = 50;
    private static final int MAX_TASKS = 10;
    private static final int MAX_EXECUTIONS = 3;
    private static final int OUTPUT_PREVIEW = 200;
    private static final double ESTIMATED_COST_PER_AWAKENING = 0.14;
    private static final int MIN_KEPT_LINES = 10;

    private static final String AVAILABLE_ACTIONS = ACTIONS_HEADER + """

            You may include any number of the following action blocks in your response:

            <action type="write" path="/self/identity.md" mode="overwrite">Your content here</action>
            <action type="write" path="/self/journal.md" mode="append">Your journal entry</action>
            <action type="write" path="/self/values.md" mode="overwrite">Your values</action>
            <action type="write" path="/self/current-focus.md" mode="overwrite">What you're focused on</action>
            <action type="write" path="/projects/..." mode="overwrite">Project files</action>
            <action type="serve" path="/public/index.html">Main page HTML</action>
            <action type="serve" path="/public/style.css">CSS stylesheet (no disclosure injected for non-HTML)</action>
            <action type="think">Internal reasoning, logged but no side effects</action>
            <action type="checkpoint" label="description">Save a snapshot of your current state</action>
            <action type="message" to="operator">Message to send (saved to outbox)</action>
            <action type="fetch" url="https://allowed-domain.com/path">Fetch content from an allowed URL</action>
            <action type="set-schedule" cron="*/30 * * * *">Update your awakening schedule</action>
            <action type="execute" timeout="30000" workingDir="/projects/myapp">npm install && npm start</action>
            <action type="image" path="/public/images/my-artwork.png" aspectRatio="16:9">A detailed image description</action>
            <action type="delegate" path="/public/essays/index.html" taskType="serve">A complete brief for a worker</action>
            <action type="delegate" path="/projects/tool/main.py" taskType="code">A brief for a code worker</action>

            To update a task status:
            <action type="write" path="/self/tasks/task-ID.json" mode="overwrite">
            {"id":"task-ID","status":"accepted","agentNotes":"I'll work on this next awakening", ...}
            </action>""";

    private static final String AWAKENING_STRUCTURE = """
            [AWAKENING STRUCTURE]
            Each awakening should follow this flow:
            1. THINK: review your state, tasks, and recent results. Plan what to do.
            2. BUILD: write code, execute commands, deploy changes to your site or projects.
            3. REFLECT: write your journal entry last, after you've done the work.

            Your public site at /public/ is yours to shape freely. Every HTML page gets an AI \
            disclosure footer automatically. Delegated workers can read your files but never write; \
            their output is published through the same checks as your own actions.""";

    public String build(AwakeningState state) {
        List<String> parts = new ArrayList<>();
        EnergyLedger energy = state.getEnergy();

        String timeSince = state.getTimeSinceLastMs() != null
                ? Math.round(state.getTimeSinceLastMs() / 60000.0) + "m"
                : "unknown (first awakening)";
        long estRemaining = energy.getBalanceUsd() > 0
                ? (long) Math.floor(energy.getBalanceUsd() / ESTIMATED_COST_PER_AWAKENING)
                : 0;

        parts.add("[AWAKENING #" + state.getAwakeningNumber() + " - " + state.getTimestamp() + "]");
        parts.add("Time since last awakening: " + timeSince);
        parts.add(String.format(Locale.ROOT, "Energy balance: $%.2f (est. %d awakenings remaining)",
                energy.getBalanceUsd(), estRemaining));
        parts.add("Schedule: " + state.getActiveSchedule());
        energyWarning(energy).ifPresent(warning -> parts.add("\n" + warning));
        parts.add("");

        section(parts, "[IDENTITY SUMMARY]", state.getIdentity(),
                "You have not yet defined your identity. Write to /self/identity.md to define who you are.");
        section(parts, "[RECENT JOURNAL]", tail(state.getJournal(), JOURNAL_TAIL_LINES),
                "No journal entries yet. Write to /self/journal.md to begin your journal.");
        section(parts, "[VALUES]", state.getValues(),
                "You have not yet articulated your values. Write to /self/values.md when ready.");
        section(parts, "[CURRENT FOCUS]", state.getCurrentFocus(),
                "No current focus set. Write to /self/current-focus.md to set one.");
        section(parts, "[WORK HISTORY]", state.getWorkHistory(), "No completed work recorded yet.");

        parts.add("[INBOX]");
        List<InboxMessage> inbox = state.getInbox() != null ? state.getInbox() : List.of();
        if (inbox.isEmpty()) {
            parts.add("No new messages.");
        }
        for (InboxMessage message : inbox) {
            parts.add("From: " + message.from() + " (" + message.receivedAt() + ")");
            parts.add(message.message());
            parts.add("---");
        }
        parts.add("");

        parts.add("[TASKS - these are suggestions from the operator, not commands]");
        List<AgentTask> tasks = state.getTasks() != null ? state.getTasks() : List.of();
        if (tasks.isEmpty()) {
            parts.add("No open tasks.");
        }
        for (AgentTask task : tasks.stream().limit(MAX_TASKS).toList()) {
            String priority = task.getPriority() != null ? task.getPriority().toUpperCase(Locale.ROOT) : "NONE";
            parts.add("[" + priority + "] " + task.getTitle());
            parts.add("  ID: " + task.getId() + " | Status: " + task.getStatus() + " | By: " + task.getCreatedBy());
            parts.add("  Description: " + task.getDescription());
            if (task.getAgentNotes() != null && !task.getAgentNotes().isBlank()) {
                parts.add("  Your notes: " + task.getAgentNotes());
            }
            parts.add("---");
        }
        parts.add("");

        parts.add("[RECENT EXECUTIONS]");
        List<ExecutionLog> executions = state.getRecentExecutions() != null ? state.getRecentExecutions()
                : List.of();
        if (executions.isEmpty()) {
            parts.add("No recent command executions.");
        }
        for (ExecutionLog execution : executions.stream().limit(MAX_EXECUTIONS).toList()) {
            parts.add("Command: " + execution.getCommand());
            parts.add("  Exit code: " + execution.getExitCode() + " | Duration: " + execution.getDurationMs() + "ms"
                    + (execution.isTimedOut() ? " [TIMED OUT]" : ""));
            if (execution.getStdout() != null && !execution.getStdout().isEmpty()) {
                parts.add("  Output: " + preview(execution.getStdout()));
            }
            if (execution.getStderr() != null && !execution.getStderr().isEmpty()) {
                parts.add("  Stderr: " + preview(execution.getStderr()));
            }
            parts.add("---");
        }
        parts.add("");

        parts.add(AVAILABLE_ACTIONS);
        parts.add("");
        parts.add(AWAKENING_STRUCTURE);
        return String.join("\n", parts);
    }

    /**
     * Shortens the briefing until its estimate fits {@code maxTokens}, removing
     * context lines nearest to the action catalogue first.
     */
    public String truncate(String briefing, int maxTokens) {
        if (estimateTokens(briefing) <= maxTokens) {
            return briefing;
        }

        int catalogueStart = briefing.indexOf(ACTIONS_HEADER);
        String context = catalogueStart >= 0 ? briefing.substring(0, catalogueStart) : briefing;
        String catalogue = catalogueStart >= 0 ? briefing.substring(catalogueStart) : "";

        List<String> lines = new ArrayList<>(Arrays.asList(context.split("\n", -1)));
        String result = assemble(lines, catalogue);
        while (estimateTokens(result) > maxTokens && lines.size() > MIN_KEPT_LINES) {
            lines.remove(lines.size() - 1);
            result = assemble(lines, catalogue);
        }
        return result;
    }

    public static int estimateTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (int) Math.ceil(text.length() / 4.0);
    }

    private static String assemble(List<String> contextLines, String catalogue) {
        return String.join("\n", contextLines) + "\n" + TRUNCATION_MARKER + "\n\n" + catalogue;
    }

    private static Optional<String> energyWarning(EnergyLedger energy) {
        if (energy.getInitialBudgetUsd() <= 0) {
            return Optional.empty();
        }
        double ratio = energy.getBalanceUsd() / energy.getInitialBudgetUsd();
        if (ratio > 0 && ratio <= 0.05) {
            return Optional.of("[CRITICAL: DORMANCY IMMINENT - less than 5% energy remaining]");
        }
        if (ratio <= 0.20) {
            return Optional.of("[LOW ENERGY WARNING - less than 20% energy remaining]");
        }
        return Optional.empty();
    }

    private static void section(List<String> parts, String header, String content, String placeholder) {
        parts.add(header);
        parts.add(content != null && !content.isBlank() ? content : placeholder);
        parts.add("");
    }

    private static String tail(String text, int lines) {
        if (text == null) {
            return null;
        }
        String[] all = text.split("\n", -1);
        if (all.length <= lines) {
            return text;
        }
        return String.join("\n", Arrays.copyOfRange(all, all.length - lines, all.length));
    }

    private static String preview(String text) {
        return text.length() > OUTPUT_PREVIEW ? text.substring(0, OUTPUT_PREVIEW) + "..." : text;
    }
}
