package me.golemcore.gurgeh.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentStatusResponse {
    private String name;
    private long awakenings;
    private String state;
    private double balanceUsd;
    private double totalSpentUsd;
    private double initialBudgetUsd;
    private String schedule;
    private String nextAwakening;
    private long uptimeSeconds;
    private long pageViews;
    private LastCycle lastCycle;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LastCycle {
        private long awakening;
        private boolean completed;
        private String abortReason;
        private int proposedActions;
        private int approvedActions;
        private long succeededActions;
        private boolean scheduleChanged;
    }
}
