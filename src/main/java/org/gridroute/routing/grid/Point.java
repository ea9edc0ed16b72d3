package org.gridroute.routing.grid;

/**
 * Immutable grid coordinate.
 *
 * @param x row index (non-negative).
 * @param y column index (non-negative).
 */
public record Point(int x, int y) {

    public Point {
        if (x < 0 || y < 0) {
            throw new IllegalArgumentException("point coordinates must be non-negative, got (" + x + ", " + y + ")");
        }
    }

    /**
     * Shorthand factory.
     */
    public static Point of(int x, int y) {
        return new Point(x, y);
    }

    /**
     * Manhattan (L1) distance to another point.
     */
    public int manhattanDistance(Point other) {
        return Math.abs(x - other.x) + Math.abs(y - other.y);
    }

    /**
     * Whether the two points differ by exactly one step along one axis.
     */
    public boolean isAdjacentTo(Point other) {
        return manhattanDistance(other) == 1;
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
