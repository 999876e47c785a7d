package org.rescueswarm.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.rescueswarm.engine.domain.model.RouteSolution;
import org.rescueswarm.engine.domain.model.SystemStatus;
import org.rescueswarm.engine.domain.model.Victim;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Read-only DTO bundling status, victims and active routes for a dashboard poll.
 */
public final class DashboardDto {

    @JsonProperty("system_status")
    private final SystemStatusDto systemStatus;

    @JsonProperty("victims")
    private final List<VictimDto> victims;

    @JsonProperty("routes")
    private final List<RouteSolutionDto> routes;

    @JsonProperty("generated_at")
    private final String generatedAt;

    private DashboardDto(SystemStatusDto systemStatus, List<VictimDto> victims, List<RouteSolutionDto> routes,
                         String generatedAt) {
        this.systemStatus = systemStatus;
        this.victims = Collections.unmodifiableList(victims);
        this.routes = Collections.unmodifiableList(routes);
        this.generatedAt = generatedAt;
    }

    public static DashboardDto from(SystemStatus status, List<Victim> victims, List<RouteSolution> routes,
                                    String generatedAt) {
        List<VictimDto> victimDtos = new ArrayList<>(victims.size());
        for (Victim victim : victims) {
            victimDtos.add(VictimDto.from(victim));
        }
        List<RouteSolutionDto> routeDtos = new ArrayList<>(routes.size());
        for (RouteSolution route : routes) {
            routeDtos.add(RouteSolutionDto.from(route));
        }
        return new DashboardDto(SystemStatusDto.from(status), victimDtos, routeDtos, generatedAt);
    }

    public SystemStatusDto getSystemStatus() {
        return systemStatus;
    }

    public List<VictimDto> getVictims() {
        return victims;
    }

    public List<RouteSolutionDto> getRoutes() {
        return routes;
    }

    public String getGeneratedAt() {
        return generatedAt;
    }
}
