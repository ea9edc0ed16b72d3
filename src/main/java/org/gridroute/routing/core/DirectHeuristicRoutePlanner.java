package org.gridroute.routing.core;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.gridroute.routing.grid.Grid;
import org.gridroute.routing.grid.Path;
import org.gridroute.routing.grid.Point;
import org.gridroute.routing.search.AStarSearch;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Greedy nearest-waypoint ordering with legs searched on demand.
 *
 * <p>Same visiting rule as {@link MatrixHeuristicRoutePlanner}: shortest leg first, ties to
 * the earlier waypoint. Instead of a full table, candidates are probed with {@link AStarSearch}
 * in ascending Manhattan distance, and probing stops once the best leg found is shorter than
 * the next candidate's Manhattan distance, which no leg to that candidate can undercut.
 * Repeated legs are served by the search's path cache.</p>
 *
 * <p>Nearest-neighbour construction only; no improvement pass follows.</p>
 */
final class DirectHeuristicRoutePlanner implements RoutePlanner {
    private final AStarSearch search;

    DirectHeuristicRoutePlanner(AStarSearch search) {
        this.search = Objects.requireNonNull(search, "search");
    }

    @Override
    public Optional<Path> plan(Grid grid, Point start, Point end, List<Point> waypoints) {
        LegTable legs = new LegTable(start, waypoints, end);
        int waypointCount = legs.waypointCount();
        IntArrayList unvisited = new IntArrayList(waypointCount);
        for (int stop = 1; stop <= waypointCount; stop++) {
            unvisited.add(stop);
        }
        Path.Builder route = Path.builder();

        int current = 0;
        while (!unvisited.isEmpty()) {
            Point from = legs.stop(current);
            unvisited.sort((int a, int b) -> {
                int byBound = Integer.compare(from.manhattanDistance(legs.stop(a)), from.manhattanDistance(legs.stop(b)));
                return byBound != 0 ? byBound : Integer.compare(a, b);
            });

            int nearest = -1;
            int nearestDistance = Integer.MAX_VALUE;
            for (int i = 0; i < unvisited.size(); i++) {
                int candidate = unvisited.getInt(i);
                if (nearest >= 0 && nearestDistance < from.manhattanDistance(legs.stop(candidate))) {
                    break;
                }
                Path leg = resolveLeg(grid, legs, current, candidate);
                if (leg == null) {
                    continue;
                }
                int distance = leg.totalDistance();
                if (distance < nearestDistance || (distance == nearestDistance && candidate < nearest)) {
                    nearest = candidate;
                    nearestDistance = distance;
                }
            }
            if (nearest < 0) {
                return Optional.empty();
            }
            route.appendLeg(legs.leg(current, nearest));
            unvisited.rem(nearest);
            current = nearest;
        }

        Path last = resolveLeg(grid, legs, current, legs.endIndex());
        if (last == null) {
            return Optional.empty();
        }
        return Optional.of(route.appendLeg(last).build());
    }

    @Override
    public PlanningStrategy strategy() {
        return PlanningStrategy.DIRECT_HEURISTIC;
    }

    private Path resolveLeg(Grid grid, LegTable legs, int from, int to) {
        if (!legs.isResolved(from, to)) {
            legs.put(from, to, search.find(grid, legs.stop(from), legs.stop(to)).orElse(null));
        }
        return legs.leg(from, to);
    }
}
