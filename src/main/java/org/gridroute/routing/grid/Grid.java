package org.gridroute.routing.grid;

import java.util.Objects;

/**
 * Immutable rectangular obstacle grid.
 *
 * <p>Cells are addressed either by {@link Point} or by a dense cell index
 * {@code x * columns + y}. Obstacle occupancy is stored as a packed bitmap, which also
 * backs the content {@link GridFingerprint} used for cache keys.</p>
 *
 * <p>Construction validates the shape and the cell codes and throws
 * {@link GridContractException} on malformed input. Callers cannot mutate a grid after
 * construction.</p>
 */
public final class Grid {
    private final int rows;
    private final int columns;
    private final long[] obstacleWords;
    private final GridFingerprint fingerprint;

    private Grid(int rows, int columns, long[] obstacleWords) {
        this.rows = rows;
        this.columns = columns;
        this.obstacleWords = obstacleWords;
        this.fingerprint = new GridFingerprint(rows, columns, obstacleWords);
    }

    /**
     * Builds a grid from raw cell codes, deriving dimensions from the matrix.
     *
     * @param cells row-major cell codes ({@code 0} free, {@code 1} obstacle).
     * @return validated grid.
     * @throws GridContractException when the matrix is empty, ragged, or holds invalid codes.
     */
    public static Grid of(int[][] cells) {
        if (cells == null || cells.length == 0) {
            throw new GridContractException(GridContractException.REASON_EMPTY, "grid must have at least one row and one column");
        }
        if (cells[0] == null) {
            throw new GridContractException(GridContractException.REASON_NOT_RECTANGULAR, "row 0 is missing");
        }
        if (cells[0].length == 0) {
            throw new GridContractException(GridContractException.REASON_EMPTY, "grid must have at least one row and one column");
        }
        return of(cells.length, cells[0].length, cells);
    }

    /**
     * Builds a grid from raw cell codes and declared dimensions.
     *
     * @param rows declared row count.
     * @param columns declared column count.
     * @param cells row-major cell codes.
     * @return validated grid.
     * @throws GridContractException when declared dimensions and cell data disagree.
     */
    public static Grid of(int rows, int columns, int[][] cells) {
        if (rows <= 0 || columns <= 0) {
            throw new GridContractException(
                    GridContractException.REASON_EMPTY,
                    "grid dimensions must be positive, got " + rows + "x" + columns
            );
        }
        long cellCount = (long) rows * columns;
        if (cellCount > Integer.MAX_VALUE) {
            throw new GridContractException(
                    GridContractException.REASON_TOO_LARGE,
                    "grid of " + rows + "x" + columns + " cells exceeds " + Integer.MAX_VALUE + " cells"
            );
        }
        if (cells == null || cells.length != rows) {
            throw new GridContractException(
                    GridContractException.REASON_DIMENSION_MISMATCH,
                    "declared rows " + rows + " but cell data has " + (cells == null ? 0 : cells.length)
            );
        }

        long[] words = new long[wordCount((int) cellCount)];
        for (int x = 0; x < rows; x++) {
            int[] row = cells[x];
            if (row == null || row.length != columns) {
                throw new GridContractException(
                        GridContractException.REASON_NOT_RECTANGULAR,
                        "row " + x + " has " + (row == null ? 0 : row.length) + " cells, expected " + columns
                );
            }
            for (int y = 0; y < columns; y++) {
                if (CellState.fromCode(row[y]) == CellState.OBSTACLE) {
                    int index = x * columns + y;
                    words[index >>> 6] |= 1L << index;
                }
            }
        }
        return new Grid(rows, columns, words);
    }

    /**
     * Builds an all-free grid.
     */
    public static Grid empty(int rows, int columns) {
        return of(rows, columns, new int[rows][columns]);
    }

    public int rows() {
        return rows;
    }

    public int columns() {
        return columns;
    }

    /**
     * Total number of cells.
     */
    public int cellCount() {
        return rows * columns;
    }

    /**
     * Content fingerprint identifying this grid's dimensions and cells.
     */
    public GridFingerprint fingerprint() {
        return fingerprint;
    }

    public boolean inBounds(int x, int y) {
        return x >= 0 && x < rows && y >= 0 && y < columns;
    }

    public boolean inBounds(Point point) {
        return inBounds(point.x(), point.y());
    }

    /**
     * Returns the state of one in-bounds cell.
     *
     * @throws IndexOutOfBoundsException when the point lies outside the grid.
     */
    public CellState cellAt(Point point) {
        Objects.requireNonNull(point, "point");
        if (!inBounds(point)) {
            throw new IndexOutOfBoundsException("point " + point + " outside " + rows + "x" + columns + " grid");
        }
        return isObstacleIndex(cellIndex(point.x(), point.y())) ? CellState.OBSTACLE : CellState.FREE;
    }

    /**
     * Whether the cell is inside the grid and walkable.
     */
    public boolean isFree(int x, int y) {
        return inBounds(x, y) && !isObstacleIndex(cellIndex(x, y));
    }

    public boolean isFree(Point point) {
        return isFree(point.x(), point.y());
    }

    /**
     * Whether a dense cell index is walkable. No bounds check.
     */
    public boolean isFreeIndex(int cellIndex) {
        return !isObstacleIndex(cellIndex);
    }

    public int cellIndex(int x, int y) {
        return x * columns + y;
    }

    public int cellIndex(Point point) {
        return cellIndex(point.x(), point.y());
    }

    public int rowOf(int cellIndex) {
        return cellIndex / columns;
    }

    public int columnOf(int cellIndex) {
        return cellIndex % columns;
    }

    public Point pointOf(int cellIndex) {
        return new Point(rowOf(cellIndex), columnOf(cellIndex));
    }

    /**
     * Copies the grid back into raw cell codes.
     */
    public int[][] toCells() {
        int[][] cells = new int[rows][columns];
        for (int x = 0; x < rows; x++) {
            for (int y = 0; y < columns; y++) {
                cells[x][y] = isObstacleIndex(cellIndex(x, y)) ? CellState.OBSTACLE.code() : CellState.FREE.code();
            }
        }
        return cells;
    }

    private boolean isObstacleIndex(int cellIndex) {
        return (obstacleWords[cellIndex >>> 6] & (1L << cellIndex)) != 0L;
    }

    private static int wordCount(int cellCount) {
        return (cellCount + 63) >>> 6;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Grid other)) {
            return false;
        }
        return fingerprint.equals(other.fingerprint);
    }

    @Override
    public int hashCode() {
        return fingerprint.hashCode();
    }

    @Override
    public String toString() {
        return "Grid{" + rows + "x" + columns + "}";
    }
}
