package org.gridroute.routing.core;

import lombok.Builder;
import lombok.Value;
import org.gridroute.routing.grid.Path;
import org.gridroute.routing.grid.Point;

import java.util.List;

/**
 * Client-facing route response.
 *
 * <p>When {@code reachable=false}, {@code path} is {@code null} and {@code totalDistance}
 * is {@link #NO_DISTANCE}.</p>
 */
@Value
@Builder
public class RouteResponse {
    public static final int NO_DISTANCE = -1;

    /** Whether a route visiting every waypoint exists. */
    boolean reachable;
    /** Stitched route from start to end. */
    Path path;
    /** Number of moves, {@code path.size() - 1}. */
    int totalDistance;
    /** Mode the request resolved to. */
    PlanningMode mode;
    /** Strategy that produced this response. */
    PlanningStrategy strategy;
    /** Number of waypoints in the request. */
    int waypointCount;
    /** Wall-clock planning time. */
    long computationNanos;

    /**
     * Route points, empty when unreachable.
     */
    public List<Point> points() {
        return path == null ? List.of() : path.points();
    }
}
