package org.rescueswarm.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.rescueswarm.engine.domain.model.GeoPoint;
import org.rescueswarm.engine.domain.model.RouteSolution;

import java.util.ArrayList;
import java.util.List;

/**
 * DTO for one responder's route.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RouteSolutionDto {

    @JsonProperty("responder_id")
    private String responderId;

    @JsonProperty("route")
    private List<String> route = new ArrayList<>();

    // [lat, lon] pairs: responder start, then each stop
    @JsonProperty("route_coordinates")
    private List<double[]> routeCoordinates = new ArrayList<>();

    @JsonProperty("total_distance_meters")
    private double totalDistanceMeters;

    @JsonProperty("estimated_duration_seconds")
    private double estimatedDurationSeconds;

    public static RouteSolutionDto from(RouteSolution solution) {
        RouteSolutionDto dto = new RouteSolutionDto();
        dto.responderId = solution.getResponderId();
        dto.route = new ArrayList<>(solution.getOrderedVictimIds());
        for (GeoPoint point : solution.getPath()) {
            dto.routeCoordinates.add(new double[] {point.getLatitude(), point.getLongitude()});
        }
        dto.totalDistanceMeters = solution.getTotalDistanceMeters();
        dto.estimatedDurationSeconds = solution.getEstimatedDurationSeconds();
        return dto;
    }

    public String getResponderId() {
        return responderId;
    }

    public void setResponderId(String responderId) {
        this.responderId = responderId;
    }

    public List<String> getRoute() {
        return route;
    }

    public void setRoute(List<String> route) {
        this.route = route;
    }

    public List<double[]> getRouteCoordinates() {
        return routeCoordinates;
    }

    public void setRouteCoordinates(List<double[]> routeCoordinates) {
        this.routeCoordinates = routeCoordinates;
    }

    public double getTotalDistanceMeters() {
        return totalDistanceMeters;
    }

    public void setTotalDistanceMeters(double totalDistanceMeters) {
        this.totalDistanceMeters = totalDistanceMeters;
    }

    public double getEstimatedDurationSeconds() {
        return estimatedDurationSeconds;
    }

    public void setEstimatedDurationSeconds(double estimatedDurationSeconds) {
        this.estimatedDurationSeconds = estimatedDurationSeconds;
    }
}
