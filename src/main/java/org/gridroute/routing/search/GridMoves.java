package org.gridroute.routing.search;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.experimental.UtilityClass;
import org.gridroute.routing.grid.Grid;
import org.gridroute.routing.grid.Path;
import org.gridroute.routing.grid.Point;

import java.util.ArrayList;
import java.util.List;

/**
 * Movement model and predecessor-chain helpers shared by grid searches.
 */
@UtilityClass
final class GridMoves {
    static final int NO_PREDECESSOR = -1;

    /**
     * Expansion order: +column, +row, -column, -row. Changing it changes which of several
     * equal-length paths a search returns.
     */
    static final int[] ROW_DELTA = {0, 1, 0, -1};
    static final int[] COLUMN_DELTA = {1, 0, -1, 0};

    /**
     * Walks a predecessor chain from {@code endCell} back to the root and returns it origin-first.
     */
    static Path reconstruct(Grid grid, Int2IntMap predecessor, int endCell) {
        IntArrayList reversed = new IntArrayList();
        int cell = endCell;
        while (cell != NO_PREDECESSOR) {
            reversed.add(cell);
            cell = predecessor.get(cell);
        }
        List<Point> points = new ArrayList<>(reversed.size());
        for (int i = reversed.size() - 1; i >= 0; i--) {
            points.add(grid.pointOf(reversed.getInt(i)));
        }
        return Path.of(points);
    }
}
