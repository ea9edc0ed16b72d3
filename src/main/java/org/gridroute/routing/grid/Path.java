package org.gridroute.routing.grid;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable 4-connected cell path.
 *
 * <p>A path always holds at least one point and every consecutive pair of points is
 * 4-adjacent. Total distance is the number of moves, {@code size() - 1}.</p>
 */
public final class Path implements Iterable<Point> {
    private final List<Point> points;

    private Path(List<Point> points) {
        this.points = points;
    }

    /**
     * Creates a validated path.
     *
     * @param points ordered points, first is origin, last is destination.
     * @return immutable path.
     * @throws IllegalArgumentException when empty or when two consecutive points are not adjacent.
     */
    public static Path of(List<Point> points) {
        Objects.requireNonNull(points, "points");
        if (points.isEmpty()) {
            throw new IllegalArgumentException("path must contain at least one point");
        }
        for (int i = 1; i < points.size(); i++) {
            Point previous = Objects.requireNonNull(points.get(i - 1), "points[" + (i - 1) + "]");
            Point current = Objects.requireNonNull(points.get(i), "points[" + i + "]");
            if (!previous.isAdjacentTo(current)) {
                throw new IllegalArgumentException(
                        "path points " + (i - 1) + " and " + i + " are not adjacent: " + previous + " -> " + current
                );
            }
        }
        return new Path(List.copyOf(points));
    }

    public static Path of(Point... points) {
        return of(List.of(points));
    }

    /**
     * Single-cell path (origin equals destination).
     */
    public static Path singleton(Point point) {
        return new Path(List.of(Objects.requireNonNull(point, "point")));
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Point> points() {
        return points;
    }

    public int size() {
        return points.size();
    }

    /**
     * Number of unit moves along the path.
     */
    public int totalDistance() {
        return points.size() - 1;
    }

    public Point start() {
        return points.get(0);
    }

    public Point end() {
        return points.get(points.size() - 1);
    }

    public Point get(int index) {
        return points.get(index);
    }

    public boolean contains(Point point) {
        return points.contains(point);
    }

    @Override
    public Iterator<Point> iterator() {
        return points.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Path other)) {
            return false;
        }
        return points.equals(other.points);
    }

    @Override
    public int hashCode() {
        return points.hashCode();
    }

    @Override
    public String toString() {
        return "Path{distance=" + totalDistance() + ", points=" + points + "}";
    }

    /**
     * Accumulates legs into one route.
     *
     * <p>When the accumulated route ends where the next leg starts, the shared point is
     * written once. A leg starting next to the current end is appended as-is. Any other
     * leg would break adjacency and is rejected.</p>
     */
    public static final class Builder {
        private final ArrayList<Point> points = new ArrayList<>();

        private Builder() {
        }

        /**
         * Appends one leg using the shared-endpoint rule.
         *
         * @throws IllegalArgumentException when the leg starts neither at nor next to the
         * current end.
         */
        public Builder appendLeg(Path leg) {
            Objects.requireNonNull(leg, "leg");
            Point legStart = leg.start();
            int from = 0;
            if (!points.isEmpty()) {
                Point last = points.get(points.size() - 1);
                if (last.equals(legStart)) {
                    from = 1;
                } else if (!last.isAdjacentTo(legStart)) {
                    throw new IllegalArgumentException("leg starting at " + legStart + " does not join route ending at " + last);
                }
            }
            List<Point> legPoints = leg.points();
            points.addAll(legPoints.subList(from, legPoints.size()));
            return this;
        }

        public boolean isEmpty() {
            return points.isEmpty();
        }

        /**
         * Materializes the accumulated route.
         *
         * @throws IllegalStateException when no leg was appended.
         */
        public Path build() {
            if (points.isEmpty()) {
                throw new IllegalStateException("no legs appended");
            }
            return new Path(List.copyOf(points));
        }
    }
}
