package org.gridroute.routing.grid;

import java.util.Arrays;

/**
 * Content identity of a {@link Grid}.
 *
 * <p>Equality compares dimensions and the full obstacle bitmap, so two fingerprints are
 * equal exactly when the grids hold the same cells. The hash is precomputed once and
 * only used for bucketing.</p>
 */
public final class GridFingerprint {
    private final int rows;
    private final int columns;
    private final long[] obstacleWords;
    private final int hash;

    GridFingerprint(int rows, int columns, long[] obstacleWords) {
        this.rows = rows;
        this.columns = columns;
        this.obstacleWords = obstacleWords;
        this.hash = 31 * (31 * rows + columns) + Arrays.hashCode(obstacleWords);
    }

    public int rows() {
        return rows;
    }

    public int columns() {
        return columns;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GridFingerprint other)) {
            return false;
        }
        return hash == other.hash
                && rows == other.rows
                && columns == other.columns
                && Arrays.equals(obstacleWords, other.obstacleWords);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "GridFingerprint{" + rows + "x" + columns + ", hash=" + Integer.toHexString(hash) + "}";
    }
}
