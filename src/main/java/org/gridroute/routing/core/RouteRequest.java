package org.gridroute.routing.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.gridroute.routing.grid.Grid;
import org.gridroute.routing.grid.Point;

import java.util.List;

/**
 * Client-facing route request.
 *
 * <p>Callers holding the mode as text use {@link RouteRequestBuilder#modeName(String)}, which
 * parses it with {@link PlanningMode#fromName(String)}.</p>
 */
@Value
@Builder
public class RouteRequest {
    /** Obstacle grid to plan on. */
    Grid grid;
    /** Route origin. */
    Point start;
    /** Route destination. */
    Point end;
    /** Unique cells the route must visit, in any order. */
    @Singular
    List<Point> waypoints;
    /** Requested trade-off; {@code null} means {@link PlanningMode#OPTIMAL}. */
    PlanningMode mode;

    public static class RouteRequestBuilder {
        /**
         * Sets the mode from its case-insensitive name; {@code null} or blank means
         * {@link PlanningMode#OPTIMAL}.
         *
         * @throws RouteCoreException with {@link RouteCore#REASON_UNKNOWN_MODE} for any other name.
         */
        public RouteRequestBuilder modeName(String name) {
            return mode(PlanningMode.fromName(name));
        }
    }
}
