package org.rescueswarm.engine.domain.model;

/**
 * Aggregate view of the dispatch state.
 */
public final class SystemStatus {

    private final int totalActiveVictims;
    private final int availableResponders;
    private final int enrouteResponders;
    private final double averageSurvivalLikelihood;
    private final int unassignableVictims;
    private final boolean lastPlanTimedOut;

    public SystemStatus(int totalActiveVictims, int availableResponders, int enrouteResponders,
                        double averageSurvivalLikelihood, int unassignableVictims, boolean lastPlanTimedOut) {
        this.totalActiveVictims = totalActiveVictims;
        this.availableResponders = availableResponders;
        this.enrouteResponders = enrouteResponders;
        this.averageSurvivalLikelihood = averageSurvivalLikelihood;
        this.unassignableVictims = unassignableVictims;
        this.lastPlanTimedOut = lastPlanTimedOut;
    }

    public int getTotalActiveVictims() {
        return totalActiveVictims;
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

    /**
     * Active victims per available responder; the divisor is floored at one.
     */
    public double getSystemLoad() {
        return (double) totalActiveVictims / Math.max(availableResponders, 1);
    }

    public int getUnassignableVictims() {
        return unassignableVictims;
    }

    public boolean isLastPlanTimedOut() {
        return lastPlanTimedOut;
    }

    @Override
    public String toString() {
        return String.format("SystemStatus{active=%d, available=%d, enroute=%d, avgSurvival=%.3f, load=%.2f, unassignable=%d}",
                totalActiveVictims, availableResponders, enrouteResponders,
                averageSurvivalLikelihood, getSystemLoad(), unassignableVictims);
    }
}
