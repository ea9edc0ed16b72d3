package org.gridroute.routing.core;

import org.gridroute.routing.grid.Grid;
import org.gridroute.routing.grid.Path;
import org.gridroute.routing.grid.Point;

import java.util.List;
import java.util.Optional;

/**
 * Waypoint-ordering strategy.
 */
interface RoutePlanner {

    /**
     * Plans one route from {@code start} through every waypoint to {@code end}.
     *
     * @param grid validated grid.
     * @param start route origin.
     * @param end route destination.
     * @param waypoints non-empty list of unique waypoints; list order is the tie-break order.
     * @return stitched route, or empty when some required leg is unreachable.
     */
    Optional<Path> plan(Grid grid, Point start, Point end, List<Point> waypoints);

    /**
     * Strategy implemented by this planner.
     */
    PlanningStrategy strategy();
}
