package org.gridroute.routing.heuristic;

import org.gridroute.routing.grid.Grid;
import org.gridroute.routing.grid.Point;
import org.gridroute.routing.testutil.GridFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("ManhattanHeuristic Tests")
class ManhattanHeuristicTest {

    @Test
    @DisplayName("Estimate is the L1 distance to the bound goal")
    void testEstimate() {
        GoalBoundHeuristic heuristic = ManhattanHeuristic.toGoal(Point.of(3, 4));
        assertEquals(0, heuristic.estimate(3, 4));
        assertEquals(7, heuristic.estimate(0, 0));
        assertEquals(3, heuristic.estimate(6, 4));
    }

    @Test
    @DisplayName("Goal is required")
    void testGoalRequired() {
        assertThrows(NullPointerException.class, () -> ManhattanHeuristic.toGoal(null));
    }

    @Test
    @DisplayName("Estimate never exceeds the true distance on obstacle grids")
    void testAdmissibleOnRandomGrids() {
        Random random = new Random(11L);
        for (int round = 0; round < 20; round++) {
            Grid grid = GridFixtures.random(random, 12, 12, 0.25);
            Point goal = Point.of(11, 11);
            GoalBoundHeuristic heuristic = ManhattanHeuristic.toGoal(goal);
            for (int x = 0; x < grid.rows(); x++) {
                for (int y = 0; y < grid.columns(); y++) {
                    int exact = GridFixtures.bfsDistance(grid, Point.of(x, y), goal);
                    if (exact != GridFixtures.UNREACHABLE) {
                        assertTrue(heuristic.estimate(x, y) <= exact, "inadmissible at (" + x + ", " + y + ")");
                    }
                }
            }
        }
    }
}
