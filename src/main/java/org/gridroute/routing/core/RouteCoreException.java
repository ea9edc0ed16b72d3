package org.gridroute.routing.core;

import org.gridroute.routing.RoutingContractException;

/**
 * Invalid route request. Reason codes are the {@code REASON_*} constants on {@link RouteCore}.
 *
 * <p>An unsolvable but valid request is reported as an unreachable {@link RouteResponse},
 * never as this exception.</p>
 */
public final class RouteCoreException extends RoutingContractException {

    public RouteCoreException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
