package org.gridroute.routing.grid;

import org.gridroute.routing.testutil.GridFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Grid Tests")
class GridTest {

    @Test
    @DisplayName("Dimensions and cell states come from the matrix")
    void testDimensionsAndCells() {
        Grid grid = Grid.of(new int[][]{
                {0, 1, 0},
                {0, 0, 0}
        });
        assertEquals(2, grid.rows());
        assertEquals(3, grid.columns());
        assertEquals(6, grid.cellCount());
        assertEquals(CellState.OBSTACLE, grid.cellAt(Point.of(0, 1)));
        assertEquals(CellState.FREE, grid.cellAt(Point.of(1, 1)));
        assertFalse(grid.isFree(0, 1));
        assertTrue(grid.isFree(1, 2));
    }

    @Test
    @DisplayName("Out-of-bounds cells are never free")
    void testOutOfBoundsNotFree() {
        Grid grid = Grid.empty(2, 2);
        assertFalse(grid.isFree(-1, 0));
        assertFalse(grid.isFree(0, 2));
        assertFalse(grid.isFree(2, 0));
        assertFalse(grid.inBounds(Point.of(5, 5)));
        assertThrows(IndexOutOfBoundsException.class, () -> grid.cellAt(Point.of(2, 2)));
    }

    @Test
    @DisplayName("Ragged rows are rejected as not rectangular")
    void testRaggedRowsRejected() {
        GridContractException ex = assertThrows(
                GridContractException.class,
                () -> Grid.of(new int[][]{{0, 0, 0}, {0, 0}})
        );
        assertEquals(GridContractException.REASON_NOT_RECTANGULAR, ex.getReasonCode());
        assertTrue(ex.getMessage().startsWith("[" + GridContractException.REASON_NOT_RECTANGULAR + "]"));
    }

    @Test
    @DisplayName("Cell codes other than 0/1 are rejected")
    void testInvalidCellRejected() {
        GridContractException ex = assertThrows(
                GridContractException.class,
                () -> Grid.of(new int[][]{{0, 2}})
        );
        assertEquals(GridContractException.REASON_INVALID_CELL, ex.getReasonCode());
    }

    @Test
    @DisplayName("Empty matrices are rejected")
    void testEmptyRejected() {
        assertEquals(GridContractException.REASON_EMPTY,
                assertThrows(GridContractException.class, () -> Grid.of(new int[0][])).getReasonCode());
        assertEquals(GridContractException.REASON_EMPTY,
                assertThrows(GridContractException.class, () -> Grid.of(new int[][]{{}})).getReasonCode());
        assertEquals(GridContractException.REASON_EMPTY,
                assertThrows(GridContractException.class, () -> Grid.of(null)).getReasonCode());
    }

    @Test
    @DisplayName("Missing first row is reported as not rectangular")
    void testNullFirstRowRejected() {
        assertEquals(GridContractException.REASON_NOT_RECTANGULAR,
                assertThrows(GridContractException.class, () -> Grid.of(new int[][]{null, {0}})).getReasonCode());
    }

    @Test
    @DisplayName("Cell count beyond int range is rejected before touching cell data")
    void testTooLargeRejected() {
        GridContractException ex = assertThrows(GridContractException.class, () -> Grid.of(70_000, 70_000, null));
        assertEquals(GridContractException.REASON_TOO_LARGE, ex.getReasonCode());
    }

    @Test
    @DisplayName("Declared dimensions must match the cell data")
    void testDeclaredDimensionMismatch() {
        int[][] cells = {{0, 0}, {0, 0}};
        assertEquals(GridContractException.REASON_DIMENSION_MISMATCH,
                assertThrows(GridContractException.class, () -> Grid.of(3, 2, cells)).getReasonCode());
        assertEquals(GridContractException.REASON_NOT_RECTANGULAR,
                assertThrows(GridContractException.class, () -> Grid.of(2, 3, cells)).getReasonCode());
        assertEquals(2, Grid.of(2, 2, cells).rows());
    }

    @Test
    @DisplayName("Grid is isolated from later changes to the source matrix")
    void testDefensiveCopy() {
        int[][] cells = {{0, 0}, {0, 0}};
        Grid grid = Grid.of(cells);
        cells[0][1] = 1;
        assertTrue(grid.isFree(0, 1));
        assertArrayEquals(new int[]{0, 0}, grid.toCells()[0]);
    }

    @Test
    @DisplayName("Cell index and point conversions round-trip")
    void testCellIndexConversion() {
        Grid grid = Grid.empty(3, 4);
        Point point = Point.of(2, 3);
        int index = grid.cellIndex(point);
        assertEquals(11, index);
        assertEquals(point, grid.pointOf(index));
        assertEquals(2, grid.rowOf(index));
        assertEquals(3, grid.columnOf(index));
    }

    @Test
    @DisplayName("Obstacles past the first 64 cells are tracked")
    void testLargeGridBitmap() {
        int[][] cells = new int[10][13];
        cells[9][12] = 1;
        cells[5][0] = 1;
        Grid grid = Grid.of(cells);
        assertFalse(grid.isFree(9, 12));
        assertFalse(grid.isFree(5, 0));
        assertTrue(grid.isFree(9, 11));
        assertArrayEquals(cells[9], grid.toCells()[9]);
    }

    @Test
    @DisplayName("Fingerprints are equal exactly when content is equal")
    void testFingerprintEquality() {
        Grid a = GridFixtures.ascii("..#", "...");
        Grid b = GridFixtures.ascii("..#", "...");
        Grid c = GridFixtures.ascii("...", "..#");
        Grid transposedShape = GridFixtures.ascii("..", "..", "#.");

        assertEquals(a.fingerprint(), b.fingerprint());
        assertEquals(a.fingerprint().hashCode(), b.fingerprint().hashCode());
        assertEquals(a, b);
        assertNotEquals(a.fingerprint(), c.fingerprint());
        assertNotEquals(a.fingerprint(), transposedShape.fingerprint());
    }

    @Test
    @DisplayName("Same cell count with different shape yields different fingerprints")
    void testShapeInFingerprint() {
        assertNotEquals(Grid.empty(2, 3).fingerprint(), Grid.empty(3, 2).fingerprint());
        assertNotEquals(Grid.empty(1, 6).fingerprint(), Grid.empty(6, 1).fingerprint());
    }
}
