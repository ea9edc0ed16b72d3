package org.gridroute.routing.core;

import org.gridroute.routing.grid.Path;
import org.gridroute.routing.grid.Point;

import java.util.List;

/**
 * Per-request table of legs between route stops.
 *
 * <p>Stop index {@code 0} is the route start, {@code 1..n} are the waypoints in request
 * order and {@code n + 1} is the route end. Each ordered pair is resolved at most once;
 * a resolved pair with no leg is unreachable.</p>
 *
 * <p>Thread-confined: one table belongs to one planning call.</p>
 */
final class LegTable {
    private final Point[] stops;
    private final Path[][] legs;
    private final boolean[][] resolved;

    LegTable(Point start, List<Point> waypoints, Point end) {
        int stopCount = waypoints.size() + 2;
        this.stops = new Point[stopCount];
        stops[0] = start;
        for (int i = 0; i < waypoints.size(); i++) {
            stops[i + 1] = waypoints.get(i);
        }
        stops[stopCount - 1] = end;
        this.legs = new Path[stopCount][stopCount];
        this.resolved = new boolean[stopCount][stopCount];
    }

    int stopCount() {
        return stops.length;
    }

    int waypointCount() {
        return stops.length - 2;
    }

    int endIndex() {
        return stops.length - 1;
    }

    Point stop(int index) {
        return stops[index];
    }

    boolean isResolved(int from, int to) {
        return resolved[from][to];
    }

    /**
     * Records the outcome for one ordered pair.
     *
     * @param leg path, or {@code null} when unreachable.
     */
    void put(int from, int to, Path leg) {
        legs[from][to] = leg;
        resolved[from][to] = true;
    }

    /**
     * Returns the leg for a resolved pair, or {@code null} when unreachable or unresolved.
     */
    Path leg(int from, int to) {
        return legs[from][to];
    }
}
