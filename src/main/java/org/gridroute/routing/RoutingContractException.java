package org.gridroute.routing;

import lombok.Getter;

import java.util.Objects;

/**
 * Base for contract failures that carry a stable reason code.
 *
 * <p>The message is always {@code "[REASON_CODE] detail"}, so log lines and assertions can
 * match on the code alone.</p>
 */
@Getter
public abstract class RoutingContractException extends RuntimeException {
    private final String reasonCode;

    /**
     * @param reasonCode non-blank reason code.
     * @param message descriptive message.
     */
    protected RoutingContractException(String reasonCode, String message) {
        super("[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message"));
        this.reasonCode = reasonCode;
    }

    private static String requireReasonCode(String reasonCode) {
        Objects.requireNonNull(reasonCode, "reasonCode");
        if (reasonCode.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return reasonCode;
    }
}
