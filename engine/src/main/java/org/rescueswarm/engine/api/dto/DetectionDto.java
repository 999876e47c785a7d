package org.rescueswarm.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.rescueswarm.engine.domain.ValidationException;
import org.rescueswarm.engine.domain.model.Detection;
import org.rescueswarm.engine.domain.model.GeoPoint;
import org.rescueswarm.engine.domain.model.InjuryLevel;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * DTO for an incoming victim detection.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class DetectionDto {

    @JsonProperty("victim_candidate_id")
    private String victimCandidateId;

    @JsonProperty("lat")
    private Double lat;

    @JsonProperty("lon")
    private Double lon;

    @JsonProperty("injury_level")
    private String injuryLevel;

    @JsonProperty("survival_likelihood")
    private Double survivalLikelihood;

    // ISO-8601; defaults to receipt time when absent
    @JsonProperty("detected_at")
    private String detectedAt;

    /**
     * Convert to a domain detection.
     *
     * @throws ValidationException if a required field is missing or unparseable
     */
    public Detection toDomain(Instant receivedAt) {
        if (lat == null || lon == null) {
            throw new ValidationException("lat and lon are required");
        }
        if (survivalLikelihood == null) {
            throw new ValidationException("survival_likelihood is required");
        }
        InjuryLevel level = InjuryLevel.fromCode(injuryLevel);
        if (level == null) {
            throw new ValidationException("unknown injury_level: " + injuryLevel);
        }
        return new Detection(victimCandidateId, GeoPoint.of(lat, lon), level, survivalLikelihood,
                parseInstant(detectedAt, receivedAt));
    }

    static Instant parseInstant(String value, Instant fallback) {
        if (value == null || value.trim().isEmpty()) {
            return fallback;
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ValidationException("invalid timestamp: " + value);
        }
    }

    public String getVictimCandidateId() {
        return victimCandidateId;
    }

    public void setVictimCandidateId(String victimCandidateId) {
        this.victimCandidateId = victimCandidateId;
    }

    public Double getLat() {
        return lat;
    }

    public void setLat(Double lat) {
        this.lat = lat;
    }

    public Double getLon() {
        return lon;
    }

    public void setLon(Double lon) {
        this.lon = lon;
    }

    public String getInjuryLevel() {
        return injuryLevel;
    }

    public void setInjuryLevel(String injuryLevel) {
        this.injuryLevel = injuryLevel;
    }

    public Double getSurvivalLikelihood() {
        return survivalLikelihood;
    }

    public void setSurvivalLikelihood(Double survivalLikelihood) {
        this.survivalLikelihood = survivalLikelihood;
    }

    public String getDetectedAt() {
        return detectedAt;
    }

    public void setDetectedAt(String detectedAt) {
        this.detectedAt = detectedAt;
    }
}
