package org.gridroute.routing.search;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import org.gridroute.routing.cache.PathCache;
import org.gridroute.routing.grid.Grid;
import org.gridroute.routing.grid.Path;
import org.gridroute.routing.grid.Point;
import org.gridroute.routing.heuristic.GoalBoundHeuristic;
import org.gridroute.routing.heuristic.ManhattanHeuristic;

import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * Point-to-point shortest path search on a {@link Grid}.
 *
 * <p>Classic A* over unit-cost 4-directional moves with the Manhattan heuristic, which is
 * admissible and consistent here, so the first time the goal is polled its cost is optimal.</p>
 *
 * <p>Determinism: neighbors are expanded in the fixed {@link GridMoves} order and frontier
 * ties are broken by insertion sequence, so identical inputs always return the identical path.</p>
 *
 * <p>When constructed with a {@link PathCache}, reachable results are memoized by
 * {@code (grid fingerprint, start, end)}. Unreachable outcomes are not cached.</p>
 *
 * <p>Instances hold no per-query state and are safe to share between threads.</p>
 */
public final class AStarSearch {
    private static final int UNSEEN = Integer.MAX_VALUE;

    private final PathCache pathCache;

    /**
     * Creates a search that memoizes results in the given cache.
     *
     * @param pathCache shared cache, or {@code null} to disable memoization.
     */
    public AStarSearch(PathCache pathCache) {
        this.pathCache = pathCache;
    }

    /**
     * Creates a search without memoization.
     */
    public static AStarSearch uncached() {
        return new AStarSearch(null);
    }

    /**
     * Finds a minimum-move path.
     *
     * @param grid grid to search.
     * @param start origin cell.
     * @param end destination cell.
     * @return shortest path, or empty when either endpoint is blocked/outside the grid or
     * the destination is unreachable.
     */
    public Optional<Path> find(Grid grid, Point start, Point end) {
        Objects.requireNonNull(grid, "grid");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");

        if (!grid.isFree(start) || !grid.isFree(end)) {
            return Optional.empty();
        }
        if (start.equals(end)) {
            return Optional.of(Path.singleton(start));
        }
        if (pathCache == null) {
            return Optional.ofNullable(search(grid, start, end));
        }

        PathCache.Key key = PathCache.Key.of(grid, start, end);
        Optional<Path> cached = pathCache.lookup(key);
        if (cached.isPresent()) {
            return cached;
        }
        Path computed = search(grid, start, end);
        if (computed != null) {
            pathCache.offer(key, computed);
        }
        return Optional.ofNullable(computed);
    }

    private static Path search(Grid grid, Point start, Point end) {
        GoalBoundHeuristic heuristic = ManhattanHeuristic.toGoal(end);
        int startCell = grid.cellIndex(start);
        int endCell = grid.cellIndex(end);

        Int2IntOpenHashMap bestCost = new Int2IntOpenHashMap();
        bestCost.defaultReturnValue(UNSEEN);
        Int2IntOpenHashMap predecessor = new Int2IntOpenHashMap();
        predecessor.defaultReturnValue(GridMoves.NO_PREDECESSOR);
        PriorityQueue<FrontierEntry> frontier = new PriorityQueue<>();
        long sequence = 0L;

        bestCost.put(startCell, 0);
        frontier.add(new FrontierEntry(startCell, 0, heuristic.estimate(start.x(), start.y()), sequence++));

        while (!frontier.isEmpty()) {
            FrontierEntry entry = frontier.poll();
            int cell = entry.cellIndex();
            if (entry.gScore() > bestCost.get(cell)) {
                continue; // superseded by a cheaper push
            }
            if (cell == endCell) {
                return GridMoves.reconstruct(grid, predecessor, endCell);
            }

            int x = grid.rowOf(cell);
            int y = grid.columnOf(cell);
            int nextCost = entry.gScore() + 1;
            for (int direction = 0; direction < GridMoves.ROW_DELTA.length; direction++) {
                int nextX = x + GridMoves.ROW_DELTA[direction];
                int nextY = y + GridMoves.COLUMN_DELTA[direction];
                if (!grid.isFree(nextX, nextY)) {
                    continue;
                }
                int nextCell = grid.cellIndex(nextX, nextY);
                if (nextCost < bestCost.get(nextCell)) {
                    bestCost.put(nextCell, nextCost);
                    predecessor.put(nextCell, cell);
                    int priority = nextCost + heuristic.estimate(nextX, nextY);
                    frontier.add(new FrontierEntry(nextCell, nextCost, priority, sequence++));
                }
            }
        }
        return null;
    }
}
