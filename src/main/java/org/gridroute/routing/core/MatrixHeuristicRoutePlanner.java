package org.gridroute.routing.core;

import org.gridroute.routing.grid.Grid;
import org.gridroute.routing.grid.Path;
import org.gridroute.routing.grid.Point;
import org.gridroute.routing.search.ReachabilitySearch;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Greedy nearest-waypoint ordering over a precomputed leg table.
 *
 * <p>One {@link ReachabilitySearch} runs from the start and from every waypoint towards all
 * other waypoints and the end, which fills the table in {@code n + 1} traversals. The route
 * then always moves to the unvisited waypoint with the shortest leg (ties go to the earlier
 * waypoint in request order) and finishes with the leg to the end.</p>
 *
 * <p>Nearest-neighbour construction only; no improvement pass follows, so the visiting order
 * can be longer than optimal.</p>
 */
final class MatrixHeuristicRoutePlanner implements RoutePlanner {
    private final ReachabilitySearch reachabilitySearch;

    MatrixHeuristicRoutePlanner(ReachabilitySearch reachabilitySearch) {
        this.reachabilitySearch = Objects.requireNonNull(reachabilitySearch, "reachabilitySearch");
    }

    @Override
    public Optional<Path> plan(Grid grid, Point start, Point end, List<Point> waypoints) {
        LegTable legs = buildLegTable(grid, start, end, waypoints);
        int waypointCount = legs.waypointCount();
        boolean[] visited = new boolean[legs.stopCount()];
        Path.Builder route = Path.builder();

        int current = 0;
        for (int step = 0; step < waypointCount; step++) {
            int nearest = -1;
            int nearestDistance = Integer.MAX_VALUE;
            for (int candidate = 1; candidate <= waypointCount; candidate++) {
                if (visited[candidate]) {
                    continue;
                }
                Path leg = legs.leg(current, candidate);
                if (leg != null && leg.totalDistance() < nearestDistance) {
                    nearest = candidate;
                    nearestDistance = leg.totalDistance();
                }
            }
            if (nearest < 0) {
                return Optional.empty();
            }
            route.appendLeg(legs.leg(current, nearest));
            visited[nearest] = true;
            current = nearest;
        }

        Path last = legs.leg(current, legs.endIndex());
        if (last == null) {
            return Optional.empty();
        }
        return Optional.of(route.appendLeg(last).build());
    }

    @Override
    public PlanningStrategy strategy() {
        return PlanningStrategy.MATRIX_HEURISTIC;
    }

    /**
     * Fills every leg the greedy walk can need: start and waypoints as sources, waypoints
     * and end as targets.
     */
    LegTable buildLegTable(Grid grid, Point start, Point end, List<Point> waypoints) {
        LegTable legs = new LegTable(start, waypoints, end);
        int endIndex = legs.endIndex();
        for (int from = 0; from < endIndex; from++) {
            List<Point> targets = new ArrayList<>(endIndex);
            for (int to = 1; to <= endIndex; to++) {
                if (to != from) {
                    targets.add(legs.stop(to));
                }
            }
            Map<Point, Path> reached = reachabilitySearch.reach(grid, legs.stop(from), targets);
            for (int to = 1; to <= endIndex; to++) {
                if (to != from) {
                    legs.put(from, to, reached.get(legs.stop(to)));
                }
            }
        }
        return legs;
    }
}
