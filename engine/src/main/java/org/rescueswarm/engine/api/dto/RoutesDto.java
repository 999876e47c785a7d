package org.rescueswarm.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.rescueswarm.engine.domain.model.RouteSolution;

import java.util.ArrayList;
import java.util.List;

/**
 * DTO wrapping a route set, as served on GET /routes and published to collaborators.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RoutesDto {

    @JsonProperty("routes")
    private List<RouteSolutionDto> routes = new ArrayList<>();

    @JsonProperty("total_routes")
    private int totalRoutes;

    @JsonProperty("generated_at")
    private String generatedAt;

    public static RoutesDto from(List<RouteSolution> solutions, String generatedAt) {
        RoutesDto dto = new RoutesDto();
        for (RouteSolution solution : solutions) {
            dto.routes.add(RouteSolutionDto.from(solution));
        }
        dto.totalRoutes = dto.routes.size();
        dto.generatedAt = generatedAt;
        return dto;
    }

    public List<RouteSolutionDto> getRoutes() {
        return routes;
    }

    public void setRoutes(List<RouteSolutionDto> routes) {
        this.routes = routes;
    }

    public int getTotalRoutes() {
        return totalRoutes;
    }

    public void setTotalRoutes(int totalRoutes) {
        this.totalRoutes = totalRoutes;
    }

    public String getGeneratedAt() {
        return generatedAt;
    }

    public void setGeneratedAt(String generatedAt) {
        this.generatedAt = generatedAt;
    }
}
