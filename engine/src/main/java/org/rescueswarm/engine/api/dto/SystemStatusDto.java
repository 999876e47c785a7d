package org.rescueswarm.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.rescueswarm.engine.domain.model.SystemStatus;

/**
 * Read-only DTO for the aggregate dispatch state.
 */
public final class SystemStatusDto {

    @JsonProperty("total_victims")
    private final int totalVictims;

    @JsonProperty("available_responders")
    private final int availableResponders;

    @JsonProperty("enroute_responders")
    private final int enrouteResponders;

    @JsonProperty("average_survival_likelihood")
    private final double averageSurvivalLikelihood;

    @JsonProperty("system_load")
    private final double systemLoad;

    @JsonProperty("unassignable_victims")
    private final int unassignableVictims;

    @JsonProperty("last_plan_timed_out")
    private final boolean lastPlanTimedOut;

    private SystemStatusDto(SystemStatus status) {
        this.totalVictims = status.getTotalActiveVictims();
        this.availableResponders = status.getAvailableResponders();
        this.enrouteResponders = status.getEnrouteResponders();
        this.averageSurvivalLikelihood = status.getAverageSurvivalLikelihood();
        this.systemLoad = status.getSystemLoad();
        this.unassignableVictims = status.getUnassignableVictims();
        this.lastPlanTimedOut = status.isLastPlanTimedOut();
    }

    public static SystemStatusDto from(SystemStatus status) {
        return new SystemStatusDto(status);
    }

    public int getTotalVictims() {
        return totalVictims;
    }

    public int getAvailableResponders() {
        return availableResponders;
    }

    public int getEnrouteResponders() {
        return enrouteResponders;
    }

    public double getAverageSurvivalLikelihood() {
        return averageSurvivalLikelihood;
    }

    public double getSystemLoad() {
        return systemLoad;
    }

    public int getUnassignableVictims() {
        return unassignableVictims;
    }

    public boolean isLastPlanTimedOut() {
        return lastPlanTimedOut;
    }
}
