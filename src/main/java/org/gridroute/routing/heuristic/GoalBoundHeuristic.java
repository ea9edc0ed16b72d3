package org.gridroute.routing.heuristic;

/**
 * Remaining-cost estimator bound to one goal cell.
 *
 * <p>Hot path contract: {@link #estimate(int, int)} must not allocate.</p>
 */
@FunctionalInterface
public interface GoalBoundHeuristic {

    /**
     * Estimates remaining moves from a cell to the pre-bound goal.
     *
     * @param x row of the cell.
     * @param y column of the cell.
     * @return admissible lower bound on remaining moves.
     */
    int estimate(int x, int y);
}
