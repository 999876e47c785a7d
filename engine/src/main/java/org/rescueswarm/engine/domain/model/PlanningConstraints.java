package org.rescueswarm.engine.domain.model;

/**
 * Per-pass route limits.
 */
public final class PlanningConstraints {

    private final double maxRouteDurationSeconds;
    private final int maxVictimsPerResponder;

    public PlanningConstraints(double maxRouteDurationSeconds, int maxVictimsPerResponder) {
        if (!(maxRouteDurationSeconds >= 0.0)) {
            throw new IllegalArgumentException("maxRouteDurationSeconds must be >= 0");
        }
        if (maxVictimsPerResponder < 0) {
            throw new IllegalArgumentException("maxVictimsPerResponder must be >= 0");
        }
        this.maxRouteDurationSeconds = maxRouteDurationSeconds;
        this.maxVictimsPerResponder = maxVictimsPerResponder;
    }

    public static PlanningConstraints from(DispatchConfig config) {
        return new PlanningConstraints(config.getMaxRouteDurationSeconds(), config.getMaxVictimsPerResponder());
    }

    public double getMaxRouteDurationSeconds() {
        return maxRouteDurationSeconds;
    }

    public int getMaxVictimsPerResponder() {
        return maxVictimsPerResponder;
    }

    /**
     * Effective stop limit for a responder: the pass cap bounded by the responder's own capacity.
     */
    public int capFor(Responder responder) {
        return Math.max(0, Math.min(maxVictimsPerResponder, responder.getCapacity()));
    }

    @Override
    public String toString() {
        return "PlanningConstraints{maxRouteDurationSeconds=" + maxRouteDurationSeconds
                + ", maxVictimsPerResponder=" + maxVictimsPerResponder + '}';
    }
}
