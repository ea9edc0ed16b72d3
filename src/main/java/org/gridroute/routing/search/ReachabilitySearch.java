package org.gridroute.routing.search;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import org.gridroute.routing.grid.Grid;
import org.gridroute.routing.grid.Path;
import org.gridroute.routing.grid.Point;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One-to-many shortest paths from a single source.
 *
 * <p>Breadth-first traversal over free cells. Moves have unit cost, so dequeue order is
 * cost order and a target's path is final the first time it is dequeued. The traversal
 * stops as soon as every target is resolved.</p>
 *
 * <p>Stateless and safe to share between threads.</p>
 */
public final class ReachabilitySearch {
    private static final int NOT_VISITED = -2;

    /**
     * Computes shortest paths from {@code source} to each reachable target.
     *
     * @param grid grid to search.
     * @param source origin cell.
     * @param targets destination cells; duplicates collapse, blocked or out-of-bounds
     * targets are never reached.
     * @return map from each reached target to its path, in resolution order. Unreached
     * targets are absent.
     */
    public Map<Point, Path> reach(Grid grid, Point source, Collection<Point> targets) {
        Objects.requireNonNull(grid, "grid");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(targets, "targets");

        Map<Point, Path> resolved = new LinkedHashMap<>();
        if (targets.isEmpty() || !grid.isFree(source)) {
            return resolved;
        }

        IntOpenHashSet pending = new IntOpenHashSet(targets.size());
        for (Point target : targets) {
            if (grid.isFree(Objects.requireNonNull(target, "target"))) {
                pending.add(grid.cellIndex(target));
            }
        }

        int sourceCell = grid.cellIndex(source);
        Int2IntOpenHashMap predecessor = new Int2IntOpenHashMap();
        predecessor.defaultReturnValue(NOT_VISITED);
        predecessor.put(sourceCell, GridMoves.NO_PREDECESSOR);
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        queue.enqueue(sourceCell);

        while (!queue.isEmpty() && !pending.isEmpty()) {
            int cell = queue.dequeueInt();
            if (pending.remove(cell)) {
                resolved.put(grid.pointOf(cell), GridMoves.reconstruct(grid, predecessor, cell));
                if (pending.isEmpty()) {
                    break;
                }
            }

            int x = grid.rowOf(cell);
            int y = grid.columnOf(cell);
            for (int direction = 0; direction < GridMoves.ROW_DELTA.length; direction++) {
                int nextX = x + GridMoves.ROW_DELTA[direction];
                int nextY = y + GridMoves.COLUMN_DELTA[direction];
                if (!grid.isFree(nextX, nextY)) {
                    continue;
                }
                int nextCell = grid.cellIndex(nextX, nextY);
                if (predecessor.get(nextCell) == NOT_VISITED) {
                    predecessor.put(nextCell, cell);
                    queue.enqueue(nextCell);
                }
            }
        }
        return resolved;
    }
}
