package org.rescueswarm.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.rescueswarm.engine.domain.model.Victim;

/**
 * Read-only DTO for a victim.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class VictimDto {

    @JsonProperty("id")
    private final String id;

    @JsonProperty("lat")
    private final double lat;

    @JsonProperty("lon")
    private final double lon;

    @JsonProperty("injury_level")
    private final String injuryLevel;

    @JsonProperty("survival_likelihood")
    private final double survivalLikelihood;

    @JsonProperty("time_detected")
    private final String timeDetected;

    @JsonProperty("priority_score")
    private final double priorityScore;

    @JsonProperty("status")
    private final String status;

    @JsonProperty("assigned_responder_id")
    private final String assignedResponderId;

    private VictimDto(Victim victim) {
        this.id = victim.getId();
        this.lat = victim.getLocation().getLatitude();
        this.lon = victim.getLocation().getLongitude();
        this.injuryLevel = victim.getInjuryLevel().getCode();
        this.survivalLikelihood = victim.getSurvivalLikelihood();
        this.timeDetected = victim.getDetectedAt().toString();
        this.priorityScore = victim.getPriorityScore();
        this.status = victim.getStatus().getCode();
        this.assignedResponderId = victim.getAssignedResponderId();
    }

    public static VictimDto from(Victim victim) {
        return new VictimDto(victim);
    }

    public String getId() {
        return id;
    }

    public double getLat() {
        return lat;
    }

    public double getLon() {
        return lon;
    }

    public String getInjuryLevel() {
        return injuryLevel;
    }

    public double getSurvivalLikelihood() {
        return survivalLikelihood;
    }

    public String getTimeDetected() {
        return timeDetected;
    }

    public double getPriorityScore() {
        return priorityScore;
    }

    public String getStatus() {
        return status;
    }

    public String getAssignedResponderId() {
        return assignedResponderId;
    }
}
