package org.gridroute.routing.core;

import lombok.extern.slf4j.Slf4j;
import org.gridroute.routing.grid.Grid;
import org.gridroute.routing.grid.Path;
import org.gridroute.routing.grid.Point;
import org.gridroute.routing.search.AStarSearch;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Globally optimal waypoint ordering by full permutation enumeration.
 *
 * <p>Orderings are generated iteratively in lexicographic order of waypoint indices. Each
 * ordered leg is searched at most once per call and reused across orderings. An ordering
 * is abandoned as soon as a leg is unreachable or its partial distance reaches the best
 * complete distance found so far. The first ordering with the minimum distance wins.</p>
 *
 * <p>Work grows factorially with the waypoint count. Above {@code waypointLimit} the call
 * is delegated to the fallback planner instead.</p>
 */
@Slf4j
final class ExhaustiveRoutePlanner implements RoutePlanner {
    private static final int ABANDONED = -1;

    private final AStarSearch search;
    private final int waypointLimit;
    private final RoutePlanner fallback;

    ExhaustiveRoutePlanner(AStarSearch search, int waypointLimit, RoutePlanner fallback) {
        this.search = Objects.requireNonNull(search, "search");
        this.fallback = Objects.requireNonNull(fallback, "fallback");
        if (waypointLimit < 0) {
            throw new IllegalArgumentException("waypointLimit must be non-negative, got " + waypointLimit);
        }
        this.waypointLimit = waypointLimit;
    }

    @Override
    public Optional<Path> plan(Grid grid, Point start, Point end, List<Point> waypoints) {
        if (waypoints.size() > waypointLimit) {
            log.warn("{} waypoints exceed exhaustive limit {}, falling back to {}",
                    waypoints.size(), waypointLimit, fallback.strategy());
            return fallback.plan(grid, start, end, waypoints);
        }

        LegTable legs = new LegTable(start, waypoints, end);
        int[] order = new int[waypoints.size()];
        for (int i = 0; i < order.length; i++) {
            order[i] = i + 1;
        }

        int bestDistance = Integer.MAX_VALUE;
        int[] bestOrder = null;
        do {
            int distance = evaluate(grid, legs, order, bestDistance);
            if (distance != ABANDONED && distance < bestDistance) {
                bestDistance = distance;
                bestOrder = order.clone();
            }
        } while (nextPermutation(order));

        if (bestOrder == null) {
            return Optional.empty();
        }
        Path.Builder route = Path.builder();
        int previous = 0;
        for (int stop : bestOrder) {
            route.appendLeg(legs.leg(previous, stop));
            previous = stop;
        }
        route.appendLeg(legs.leg(previous, legs.endIndex()));
        return Optional.of(route.build());
    }

    @Override
    public PlanningStrategy strategy() {
        return PlanningStrategy.EXHAUSTIVE;
    }

    /**
     * Returns the total distance of one ordering, or {@link #ABANDONED} when a leg is
     * unreachable or the ordering cannot beat {@code bound}.
     */
    private int evaluate(Grid grid, LegTable legs, int[] order, int bound) {
        int total = 0;
        int previous = 0;
        for (int stop : order) {
            Path leg = resolveLeg(grid, legs, previous, stop);
            if (leg == null) {
                return ABANDONED;
            }
            total += leg.totalDistance();
            if (total >= bound) {
                return ABANDONED;
            }
            previous = stop;
        }
        Path last = resolveLeg(grid, legs, previous, legs.endIndex());
        if (last == null) {
            return ABANDONED;
        }
        total += last.totalDistance();
        return total >= bound ? ABANDONED : total;
    }

    private Path resolveLeg(Grid grid, LegTable legs, int from, int to) {
        if (!legs.isResolved(from, to)) {
            legs.put(from, to, search.find(grid, legs.stop(from), legs.stop(to)).orElse(null));
        }
        return legs.leg(from, to);
    }

    /**
     * Advances {@code values} to the next lexicographic permutation in place.
     *
     * @return {@code false} when {@code values} was already the last permutation.
     */
    static boolean nextPermutation(int[] values) {
        int pivot = values.length - 2;
        while (pivot >= 0 && values[pivot] >= values[pivot + 1]) {
            pivot--;
        }
        if (pivot < 0) {
            return false;
        }
        int successor = values.length - 1;
        while (values[successor] <= values[pivot]) {
            successor--;
        }
        swap(values, pivot, successor);
        for (int left = pivot + 1, right = values.length - 1; left < right; left++, right--) {
            swap(values, left, right);
        }
        return true;
    }

    private static void swap(int[] values, int i, int j) {
        int tmp = values[i];
        values[i] = values[j];
        values[j] = tmp;
    }
}
