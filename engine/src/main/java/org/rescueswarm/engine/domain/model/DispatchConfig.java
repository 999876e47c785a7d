package org.rescueswarm.engine.domain.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable tuning values for merging, scoring and route planning.
 * Unknown keys are kept but ignored; missing keys fall back to the defaults.
 */
public final class DispatchConfig {

    private final Map<String, Double> values;

    // Registry keys
    public static final String MERGE_RADIUS_METERS = "merge_radius_meters";
    public static final String VICTIM_MAX_AGE_SECONDS = "victim_max_age_seconds";
    public static final String RETENTION_SECONDS = "retention_seconds";

    // Cost model keys
    public static final String TRAVEL_SPEED_MPS = "travel_speed_mps";

    // Planner keys
    public static final String MAX_ROUTE_DURATION_SECONDS = "max_route_duration_seconds";
    public static final String MAX_VICTIMS_PER_RESPONDER = "max_victims_per_responder";
    public static final String PLANNING_TIME_BUDGET_MS = "planning_time_budget_ms";

    // Scoring keys
    public static final String INJURY_MULTIPLIER_NONE = "injury_multiplier_none";
    public static final String INJURY_MULTIPLIER_MINOR = "injury_multiplier_minor";
    public static final String INJURY_MULTIPLIER_SEVERE = "injury_multiplier_severe";
    public static final String INJURY_MULTIPLIER_UNCONSCIOUS = "injury_multiplier_unconscious";
    public static final String URGENCY_HORIZON_HOURS = "urgency_horizon_hours";

    // 5 km/h over rubble
    public static final double DEFAULT_TRAVEL_SPEED_MPS = 5000.0 / 3600.0;

    private static final Map<String, Double> DEFAULTS;

    static {
        Map<String, Double> defaults = new LinkedHashMap<>();
        defaults.put(MERGE_RADIUS_METERS, 50.0);
        defaults.put(VICTIM_MAX_AGE_SECONDS, 6 * 3600.0);
        defaults.put(RETENTION_SECONDS, 24 * 3600.0);
        defaults.put(TRAVEL_SPEED_MPS, DEFAULT_TRAVEL_SPEED_MPS);
        defaults.put(MAX_ROUTE_DURATION_SECONDS, 5 * 3600.0);
        defaults.put(MAX_VICTIMS_PER_RESPONDER, 5.0);
        defaults.put(PLANNING_TIME_BUDGET_MS, 30_000.0);
        defaults.put(INJURY_MULTIPLIER_NONE, 1.0);
        defaults.put(INJURY_MULTIPLIER_MINOR, 1.1);
        defaults.put(INJURY_MULTIPLIER_SEVERE, 1.3);
        defaults.put(INJURY_MULTIPLIER_UNCONSCIOUS, 1.5);
        defaults.put(URGENCY_HORIZON_HOURS, 24.0);
        DEFAULTS = Collections.unmodifiableMap(defaults);
    }

    private DispatchConfig(Map<String, Double> values) {
        this.values = Collections.unmodifiableMap(new HashMap<>(values));
    }

    /**
     * Creates a DispatchConfig from a map of overrides on top of the defaults.
     */
    public static DispatchConfig fromMap(Map<String, Double> overrides) {
        Objects.requireNonNull(overrides, "overrides must not be null");
        Map<String, Double> merged = new HashMap<>(DEFAULTS);
        merged.putAll(overrides);
        return new DispatchConfig(merged);
    }

    /**
     * Creates a default configuration.
     */
    public static DispatchConfig defaults() {
        return new DispatchConfig(DEFAULTS);
    }

    /**
     * All known keys in declaration order.
     */
    public static Iterable<String> keys() {
        return DEFAULTS.keySet();
    }

    /**
     * Gets a configuration value by key.
     */
    public double get(String key) {
        Double value = values.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Unknown config key: " + key);
        }
        return value;
    }

    public double getOrDefault(String key, double defaultValue) {
        return values.getOrDefault(key, defaultValue);
    }

    /**
     * Returns a copy with one value replaced.
     */
    public DispatchConfig with(String key, double value) {
        Map<String, Double> copy = new HashMap<>(values);
        copy.put(key, value);
        return new DispatchConfig(copy);
    }

    public double getMergeRadiusMeters() {
        return getOrDefault(MERGE_RADIUS_METERS, 50.0);
    }

    public long getVictimMaxAgeSeconds() {
        return (long) getOrDefault(VICTIM_MAX_AGE_SECONDS, 6 * 3600.0);
    }

    public long getRetentionSeconds() {
        return (long) getOrDefault(RETENTION_SECONDS, 24 * 3600.0);
    }

    public double getTravelSpeedMetersPerSecond() {
        return getOrDefault(TRAVEL_SPEED_MPS, DEFAULT_TRAVEL_SPEED_MPS);
    }

    public double getMaxRouteDurationSeconds() {
        return getOrDefault(MAX_ROUTE_DURATION_SECONDS, 5 * 3600.0);
    }

    public int getMaxVictimsPerResponder() {
        return (int) getOrDefault(MAX_VICTIMS_PER_RESPONDER, 5.0);
    }

    public long getPlanningTimeBudgetMillis() {
        return (long) getOrDefault(PLANNING_TIME_BUDGET_MS, 30_000.0);
    }

    public double getUrgencyHorizonHours() {
        return getOrDefault(URGENCY_HORIZON_HOURS, 24.0);
    }

    public double getInjuryMultiplier(InjuryLevel level) {
        switch (level) {
            case UNCONSCIOUS:
                return getOrDefault(INJURY_MULTIPLIER_UNCONSCIOUS, 1.5);
            case SEVERE:
                return getOrDefault(INJURY_MULTIPLIER_SEVERE, 1.3);
            case MINOR:
                return getOrDefault(INJURY_MULTIPLIER_MINOR, 1.1);
            case NONE:
            default:
                return getOrDefault(INJURY_MULTIPLIER_NONE, 1.0);
        }
    }

    @Override
    public String toString() {
        return "DispatchConfig" + new TreeMap<>(values);
    }
}
