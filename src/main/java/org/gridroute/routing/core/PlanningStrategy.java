package org.gridroute.routing.core;

/**
 * Waypoint-ordering strategy actually executed for a request.
 */
public enum PlanningStrategy {
    /** No waypoints: one shortest-path search from start to end. */
    DIRECT,
    /** Every visiting order is evaluated; globally optimal. */
    EXHAUSTIVE,
    /** Greedy nearest-waypoint order over a precomputed all-pairs leg table. */
    MATRIX_HEURISTIC,
    /** Greedy nearest-waypoint order with legs searched on demand. */
    DIRECT_HEURISTIC
}
