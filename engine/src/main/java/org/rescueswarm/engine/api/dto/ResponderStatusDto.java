package org.rescueswarm.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.rescueswarm.engine.domain.ValidationException;
import org.rescueswarm.engine.domain.model.GeoPoint;
import org.rescueswarm.engine.domain.model.ResponderStatus;
import org.rescueswarm.engine.domain.model.ResponderStatusUpdate;

/**
 * DTO for a responder status report.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ResponderStatusDto {

    @JsonProperty("responder_id")
    private String responderId;

    @JsonProperty("lat")
    private Double lat;

    @JsonProperty("lon")
    private Double lon;

    @JsonProperty("capacity")
    private Integer capacity;

    @JsonProperty("status")
    private String status;

    public ResponderStatusUpdate toDomain() {
        if (lat == null || lon == null) {
            throw new ValidationException("lat and lon are required");
        }
        if (capacity == null) {
            throw new ValidationException("capacity is required");
        }
        ResponderStatus parsed = ResponderStatus.fromCode(status);
        if (parsed == null) {
            throw new ValidationException("unknown responder status: " + status);
        }
        return new ResponderStatusUpdate(responderId, GeoPoint.of(lat, lon), capacity, parsed);
    }

    public String getResponderId() {
        return responderId;
    }

    public void setResponderId(String responderId) {
        this.responderId = responderId;
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

    public Integer getCapacity() {
        return capacity;
    }

    public void setCapacity(Integer capacity) {
        this.capacity = capacity;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }
}
