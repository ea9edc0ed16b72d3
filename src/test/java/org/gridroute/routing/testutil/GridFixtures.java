package org.gridroute.routing.testutil;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import org.gridroute.routing.grid.Grid;
import org.gridroute.routing.grid.Path;
import org.gridroute.routing.grid.Point;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Shared grid fixtures, an independent BFS distance oracle, and path assertions.
 */
public final class GridFixtures {
    public static final int UNREACHABLE = -1;

    private GridFixtures() {
    }

    /**
     * Builds a grid from ASCII rows: {@code '#'} is an obstacle, anything else is free.
     */
    public static Grid ascii(String... rows) {
        int[][] cells = new int[rows.length][];
        for (int x = 0; x < rows.length; x++) {
            cells[x] = new int[rows[x].length()];
            for (int y = 0; y < rows[x].length(); y++) {
                cells[x][y] = rows[x].charAt(y) == '#' ? 1 : 0;
            }
        }
        return Grid.of(cells);
    }

    /**
     * Random grid with roughly {@code obstacleRatio} blocked cells. Corners stay free.
     */
    public static Grid random(Random random, int rows, int columns, double obstacleRatio) {
        int[][] cells = new int[rows][columns];
        for (int x = 0; x < rows; x++) {
            for (int y = 0; y < columns; y++) {
                cells[x][y] = random.nextDouble() < obstacleRatio ? 1 : 0;
            }
        }
        cells[0][0] = 0;
        cells[rows - 1][columns - 1] = 0;
        cells[0][columns - 1] = 0;
        cells[rows - 1][0] = 0;
        return Grid.of(cells);
    }

    /**
     * Picks {@code count} distinct free cells, excluding the given points.
     */
    public static List<Point> randomFreePoints(Random random, Grid grid, int count, Point... excluded) {
        List<Point> free = new ArrayList<>();
        List<Point> skip = Arrays.asList(excluded);
        for (int x = 0; x < grid.rows(); x++) {
            for (int y = 0; y < grid.columns(); y++) {
                Point point = Point.of(x, y);
                if (grid.isFree(point) && !skip.contains(point)) {
                    free.add(point);
                }
            }
        }
        List<Point> picked = new ArrayList<>(count);
        for (int i = 0; i < count && !free.isEmpty(); i++) {
            picked.add(free.remove(random.nextInt(free.size())));
        }
        return picked;
    }

    /**
     * Plain BFS distance written independently of the production searches.
     *
     * @return number of moves, or {@link #UNREACHABLE}.
     */
    public static int bfsDistance(Grid grid, Point start, Point end) {
        if (!grid.isFree(start) || !grid.isFree(end)) {
            return UNREACHABLE;
        }
        int[] distance = new int[grid.rows() * grid.columns()];
        Arrays.fill(distance, UNREACHABLE);
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        int origin = start.x() * grid.columns() + start.y();
        distance[origin] = 0;
        queue.enqueue(origin);
        int[][] moves = {{1, 0}, {-1, 0}, {0, 1}, {0, -1}};
        while (!queue.isEmpty()) {
            int cell = queue.dequeueInt();
            int x = cell / grid.columns();
            int y = cell % grid.columns();
            if (x == end.x() && y == end.y()) {
                return distance[cell];
            }
            for (int[] move : moves) {
                int nx = x + move[0];
                int ny = y + move[1];
                if (grid.isFree(nx, ny)) {
                    int next = nx * grid.columns() + ny;
                    if (distance[next] == UNREACHABLE) {
                        distance[next] = distance[cell] + 1;
                        queue.enqueue(next);
                    }
                }
            }
        }
        return UNREACHABLE;
    }

    /**
     * Asserts endpoints, 4-adjacency of consecutive points, and that no point is blocked.
     */
    public static void assertValidPath(Grid grid, Path path, Point start, Point end) {
        assertNotNull(path, "path");
        assertEquals(start, path.start(), "path must start at start");
        assertEquals(end, path.end(), "path must end at end");
        for (int i = 0; i < path.size(); i++) {
            Point point = path.get(i);
            assertTrue(grid.isFree(point), "path crosses blocked or out-of-bounds cell " + point);
            if (i > 0) {
                assertEquals(1, path.get(i - 1).manhattanDistance(point),
                        "non-adjacent step " + path.get(i - 1) + " -> " + point);
            }
        }
        assertEquals(path.size() - 1, path.totalDistance());
    }

    /**
     * Asserts that every waypoint appears on the path.
     */
    public static void assertVisitsAll(Path path, List<Point> waypoints) {
        for (Point waypoint : waypoints) {
            assertTrue(path.contains(waypoint), "path misses waypoint " + waypoint);
        }
    }
}
