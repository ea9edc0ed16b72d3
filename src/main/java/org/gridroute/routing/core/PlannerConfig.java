package org.gridroute.routing.core;

import lombok.Builder;
import lombok.Value;
import org.gridroute.routing.cache.PathCache;

/**
 * Planner limits and cache sizing.
 *
 * <p>Builder fields left unset take the defaults below. {@link #defaults()} additionally
 * reads JVM system properties; blank or unparsable values fall back to the defaults.</p>
 *
 * <p>{@code exhaustiveWaypointLimit} bounds factorial work: {@code n} waypoints cost
 * {@code n!} orderings, each needing up to {@code n + 1} legs.</p>
 */
@Value
public class PlannerConfig {
    public static final int DEFAULT_EXHAUSTIVE_WAYPOINT_LIMIT = 8;
    public static final int DEFAULT_DIRECT_HEURISTIC_THRESHOLD = 10;
    public static final int DEFAULT_MAX_WAYPOINTS = 50;
    public static final int DEFAULT_PATH_CACHE_CAPACITY = PathCache.DEFAULT_CAPACITY;

    private static final String PROP_EXHAUSTIVE_WAYPOINT_LIMIT = "gridroute.planner.exhaustiveWaypointLimit";
    private static final String PROP_DIRECT_HEURISTIC_THRESHOLD = "gridroute.planner.directHeuristicThreshold";
    private static final String PROP_MAX_WAYPOINTS = "gridroute.planner.maxWaypoints";
    private static final String PROP_PATH_CACHE_CAPACITY = "gridroute.cache.capacity";

    /** Largest waypoint count planned exhaustively in {@link PlanningMode#OPTIMAL}. */
    int exhaustiveWaypointLimit;
    /** Waypoint counts above this always use {@link PlanningStrategy#DIRECT_HEURISTIC}. */
    int directHeuristicThreshold;
    /** Requests with more waypoints are rejected. */
    int maxWaypoints;
    /** Capacity of the path cache a {@link RouteCore} creates for itself. */
    int pathCacheCapacity;

    @Builder
    private PlannerConfig(
            Integer exhaustiveWaypointLimit,
            Integer directHeuristicThreshold,
            Integer maxWaypoints,
            Integer pathCacheCapacity
    ) {
        this.exhaustiveWaypointLimit = requireNonNegative(
                orDefault(exhaustiveWaypointLimit, DEFAULT_EXHAUSTIVE_WAYPOINT_LIMIT), "exhaustiveWaypointLimit");
        this.directHeuristicThreshold = requireNonNegative(
                orDefault(directHeuristicThreshold, DEFAULT_DIRECT_HEURISTIC_THRESHOLD), "directHeuristicThreshold");
        this.maxWaypoints = requireNonNegative(orDefault(maxWaypoints, DEFAULT_MAX_WAYPOINTS), "maxWaypoints");
        this.pathCacheCapacity = orDefault(pathCacheCapacity, DEFAULT_PATH_CACHE_CAPACITY);
        if (this.pathCacheCapacity <= 0) {
            throw new IllegalArgumentException("pathCacheCapacity must be positive, got " + this.pathCacheCapacity);
        }
    }

    /**
     * Loads configuration from system properties, falling back to built-in defaults.
     */
    public static PlannerConfig defaults() {
        return PlannerConfig.builder()
                .exhaustiveWaypointLimit(readInt(PROP_EXHAUSTIVE_WAYPOINT_LIMIT))
                .directHeuristicThreshold(readInt(PROP_DIRECT_HEURISTIC_THRESHOLD))
                .maxWaypoints(readInt(PROP_MAX_WAYPOINTS))
                .pathCacheCapacity(readInt(PROP_PATH_CACHE_CAPACITY))
                .build();
    }

    private static int orDefault(Integer value, int fallback) {
        return value == null ? fallback : value;
    }

    private static int requireNonNegative(int value, String field) {
        if (value < 0) {
            throw new IllegalArgumentException(field + " must be non-negative, got " + value);
        }
        return value;
    }

    private static Integer readInt(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
