package org.gridroute.routing.core;

import java.util.Objects;

/**
 * Maps a requested mode and waypoint count to the strategy that will run.
 *
 * <p>Decision table, first match wins:</p>
 * <ol>
 * <li>no waypoints: {@link PlanningStrategy#DIRECT}</li>
 * <li>{@link PlanningMode#FAST}, or more than {@code directHeuristicThreshold} waypoints:
 * {@link PlanningStrategy#DIRECT_HEURISTIC}</li>
 * <li>{@link PlanningMode#BALANCED}: {@link PlanningStrategy#MATRIX_HEURISTIC}</li>
 * <li>{@link PlanningMode#OPTIMAL} with at most {@code exhaustiveWaypointLimit} waypoints:
 * {@link PlanningStrategy#EXHAUSTIVE}</li>
 * <li>{@link PlanningMode#OPTIMAL} otherwise: {@link PlanningStrategy#MATRIX_HEURISTIC}</li>
 * </ol>
 */
public final class StrategySelector {
    private final int exhaustiveWaypointLimit;
    private final int directHeuristicThreshold;

    public StrategySelector(PlannerConfig config) {
        Objects.requireNonNull(config, "config");
        this.exhaustiveWaypointLimit = config.getExhaustiveWaypointLimit();
        this.directHeuristicThreshold = config.getDirectHeuristicThreshold();
    }

    /**
     * Selects a strategy.
     *
     * @param mode requested mode; {@code null} is treated as {@link PlanningMode#OPTIMAL}.
     * @param waypointCount number of waypoints (non-negative).
     * @return strategy to execute.
     */
    public PlanningStrategy select(PlanningMode mode, int waypointCount) {
        if (waypointCount < 0) {
            throw new IllegalArgumentException("waypointCount must be non-negative, got " + waypointCount);
        }
        PlanningMode effectiveMode = mode == null ? PlanningMode.OPTIMAL : mode;
        if (waypointCount == 0) {
            return PlanningStrategy.DIRECT;
        }
        if (effectiveMode == PlanningMode.FAST || waypointCount > directHeuristicThreshold) {
            return PlanningStrategy.DIRECT_HEURISTIC;
        }
        if (effectiveMode == PlanningMode.OPTIMAL && waypointCount <= exhaustiveWaypointLimit) {
            return PlanningStrategy.EXHAUSTIVE;
        }
        return PlanningStrategy.MATRIX_HEURISTIC;
    }
}
