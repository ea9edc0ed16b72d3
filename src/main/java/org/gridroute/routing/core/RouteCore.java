package org.gridroute.routing.core;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.gridroute.routing.cache.PathCache;
import org.gridroute.routing.cache.PathCacheStats;
import org.gridroute.routing.grid.Grid;
import org.gridroute.routing.grid.Path;
import org.gridroute.routing.grid.Point;
import org.gridroute.routing.search.AStarSearch;
import org.gridroute.routing.search.ReachabilitySearch;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Main route-planning entry point.
 *
 * <p>Execution flow:</p>
 * <ul>
 * <li>Validate the request (endpoints and waypoints in bounds, on free cells, unique).</li>
 * <li>Pick a strategy with {@link StrategySelector}.</li>
 * <li>Run the strategy's planner, or a single A* search when there are no waypoints.</li>
 * <li>Report the stitched path, its distance, and the strategy used.</li>
 * </ul>
 *
 * <p>An unsolvable request yields {@code reachable=false}. Invalid requests throw
 * {@link RouteCoreException}. The facade keeps no per-request state; the only shared
 * mutable state is the {@link PathCache}, which is thread-safe, so one instance can serve
 * concurrent callers.</p>
 */
@Slf4j
public final class RouteCore {
    public static final String REASON_REQUEST_REQUIRED = "ROUTE_REQUEST_REQUIRED";
    public static final String REASON_GRID_REQUIRED = "ROUTE_GRID_REQUIRED";
    public static final String REASON_START_REQUIRED = "ROUTE_START_REQUIRED";
    public static final String REASON_END_REQUIRED = "ROUTE_END_REQUIRED";
    public static final String REASON_WAYPOINT_REQUIRED = "ROUTE_WAYPOINT_REQUIRED";
    public static final String REASON_POINT_OUT_OF_BOUNDS = "ROUTE_POINT_OUT_OF_BOUNDS";
    public static final String REASON_POINT_BLOCKED = "ROUTE_POINT_BLOCKED";
    public static final String REASON_DUPLICATE_WAYPOINT = "ROUTE_DUPLICATE_WAYPOINT";
    public static final String REASON_TOO_MANY_WAYPOINTS = "ROUTE_TOO_MANY_WAYPOINTS";
    public static final String REASON_UNKNOWN_MODE = "ROUTE_UNKNOWN_MODE";

    private final PlannerConfig config;
    private final PathCache pathCache;
    private final AStarSearch aStarSearch;
    private final StrategySelector strategySelector;
    private final Map<PlanningStrategy, RoutePlanner> planners = new EnumMap<>(PlanningStrategy.class);

    /**
     * Creates the facade.
     *
     * @param config planner limits; {@code null} loads {@link PlannerConfig#defaults()}.
     * @param pathCache shared path cache; {@code null} creates one sized by
     * {@link PlannerConfig#getPathCacheCapacity()}.
     */
    @Builder
    public RouteCore(PlannerConfig config, PathCache pathCache) {
        this.config = config == null ? PlannerConfig.defaults() : config;
        this.pathCache = pathCache == null ? new PathCache(this.config.getPathCacheCapacity()) : pathCache;
        this.aStarSearch = new AStarSearch(this.pathCache);
        this.strategySelector = new StrategySelector(this.config);

        RoutePlanner matrixPlanner = new MatrixHeuristicRoutePlanner(new ReachabilitySearch());
        planners.put(PlanningStrategy.MATRIX_HEURISTIC, matrixPlanner);
        planners.put(PlanningStrategy.DIRECT_HEURISTIC, new DirectHeuristicRoutePlanner(aStarSearch));
        planners.put(
                PlanningStrategy.EXHAUSTIVE,
                new ExhaustiveRoutePlanner(aStarSearch, this.config.getExhaustiveWaypointLimit(), matrixPlanner)
        );
    }

    /**
     * Creates a facade with default configuration and a private cache.
     */
    public static RouteCore withDefaults() {
        return RouteCore.builder().build();
    }

    /**
     * Plans one route.
     *
     * @param request route request.
     * @return response with path, distance and strategy, or an unreachable response.
     * @throws RouteCoreException when the request violates input contracts.
     */
    public RouteResponse plan(RouteRequest request) {
        validate(request);
        PlanningMode mode = request.getMode() == null ? PlanningMode.OPTIMAL : request.getMode();
        List<Point> waypoints = request.getWaypoints();
        PlanningStrategy strategy = strategySelector.select(mode, waypoints.size());

        long startedAt = System.nanoTime();
        Optional<Path> path = strategy == PlanningStrategy.DIRECT
                ? aStarSearch.find(request.getGrid(), request.getStart(), request.getEnd())
                : planners.get(strategy).plan(request.getGrid(), request.getStart(), request.getEnd(), waypoints);
        long elapsedNanos = System.nanoTime() - startedAt;

        if (strategy == PlanningStrategy.DIRECT) {
            log.debug("Direct path {} -> {} computed in {} ms",
                    request.getStart(), request.getEnd(), TimeUnit.NANOSECONDS.toMillis(elapsedNanos));
        } else {
            log.info("Route with {} waypoints planned using {} ({} mode) in {} ms, reachable={}",
                    waypoints.size(), strategy, mode, TimeUnit.NANOSECONDS.toMillis(elapsedNanos), path.isPresent());
        }

        return RouteResponse.builder()
                .reachable(path.isPresent())
                .path(path.orElse(null))
                .totalDistance(path.map(Path::totalDistance).orElse(RouteResponse.NO_DISTANCE))
                .mode(mode)
                .strategy(strategy)
                .waypointCount(waypoints.size())
                .computationNanos(elapsedNanos)
                .build();
    }

    /**
     * Drops every cached path. Administrative and test use only.
     */
    public void clearCache() {
        pathCache.clear();
    }

    public PathCacheStats cacheStats() {
        return pathCache.stats();
    }

    public PlannerConfig config() {
        return config;
    }

    private void validate(RouteRequest request) {
        if (request == null) {
            throw new RouteCoreException(REASON_REQUEST_REQUIRED, "route request must be provided");
        }
        Grid grid = request.getGrid();
        if (grid == null) {
            throw new RouteCoreException(REASON_GRID_REQUIRED, "grid must be provided");
        }
        if (request.getStart() == null) {
            throw new RouteCoreException(REASON_START_REQUIRED, "start must be provided");
        }
        if (request.getEnd() == null) {
            throw new RouteCoreException(REASON_END_REQUIRED, "end must be provided");
        }
        requireWalkable(grid, request.getStart(), "start");
        requireWalkable(grid, request.getEnd(), "end");

        List<Point> waypoints = request.getWaypoints();
        if (waypoints.size() > config.getMaxWaypoints()) {
            throw new RouteCoreException(
                    REASON_TOO_MANY_WAYPOINTS,
                    waypoints.size() + " waypoints exceed limit " + config.getMaxWaypoints()
            );
        }
        Set<Point> seen = new HashSet<>();
        for (int i = 0; i < waypoints.size(); i++) {
            Point waypoint = waypoints.get(i);
            if (waypoint == null) {
                throw new RouteCoreException(REASON_WAYPOINT_REQUIRED, "waypoints[" + i + "] must be non-null");
            }
            requireWalkable(grid, waypoint, "waypoints[" + i + "]");
            if (!seen.add(waypoint)) {
                throw new RouteCoreException(REASON_DUPLICATE_WAYPOINT, "duplicate waypoint " + waypoint);
            }
        }
    }

    private static void requireWalkable(Grid grid, Point point, String field) {
        if (!grid.inBounds(point)) {
            throw new RouteCoreException(
                    REASON_POINT_OUT_OF_BOUNDS,
                    field + " " + point + " outside " + grid.rows() + "x" + grid.columns() + " grid"
            );
        }
        if (!grid.isFree(point)) {
            throw new RouteCoreException(REASON_POINT_BLOCKED, field + " " + point + " is an obstacle");
        }
    }
}
