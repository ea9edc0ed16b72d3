package org.gridroute.routing.heuristic;

import org.gridroute.routing.grid.Point;

import java.util.Objects;

/**
 * Manhattan-distance heuristic for unit-cost 4-directional movement.
 *
 * <p>Admissible and consistent: one move changes the L1 distance to the goal by exactly one.</p>
 */
public final class ManhattanHeuristic implements GoalBoundHeuristic {
    private final int goalX;
    private final int goalY;

    private ManhattanHeuristic(Point goal) {
        this.goalX = goal.x();
        this.goalY = goal.y();
    }

    /**
     * Binds the heuristic to a goal cell.
     */
    public static ManhattanHeuristic toGoal(Point goal) {
        return new ManhattanHeuristic(Objects.requireNonNull(goal, "goal"));
    }

    @Override
    public int estimate(int x, int y) {
        return Math.abs(x - goalX) + Math.abs(y - goalY);
    }
}
