package org.gridroute.routing.grid;

import org.gridroute.routing.RoutingContractException;

/**
 * Thrown when raw cell data cannot form a valid {@link Grid}.
 */
public final class GridContractException extends RoutingContractException {
    public static final String REASON_EMPTY = "GRID_EMPTY";
    public static final String REASON_NOT_RECTANGULAR = "GRID_NOT_RECTANGULAR";
    public static final String REASON_DIMENSION_MISMATCH = "GRID_DIMENSION_MISMATCH";
    public static final String REASON_TOO_LARGE = "GRID_TOO_LARGE";
    public static final String REASON_INVALID_CELL = "GRID_INVALID_CELL";

    public GridContractException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
