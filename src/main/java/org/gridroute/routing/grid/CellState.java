package org.gridroute.routing.grid;

/**
 * Cell occupancy values accepted by {@link Grid}.
 *
 * <p>Numeric codes follow the wire convention used by grid producers:
 * {@code 0} is walkable, {@code 1} is blocked.</p>
 */
public enum CellState {
    FREE(0),
    OBSTACLE(1);

    private final int code;

    CellState(int code) {
        this.code = code;
    }

    /**
     * Numeric code of this state.
     */
    public int code() {
        return code;
    }

    /**
     * Resolves a numeric cell code.
     *
     * @param code raw cell value.
     * @return matching state.
     * @throws GridContractException when the code is neither 0 nor 1.
     */
    public static CellState fromCode(int code) {
        if (code == FREE.code) {
            return FREE;
        }
        if (code == OBSTACLE.code) {
            return OBSTACLE;
        }
        throw new GridContractException(
                GridContractException.REASON_INVALID_CELL,
                "cell value must be 0 (free) or 1 (obstacle), got " + code
        );
    }
}
