package org.gridroute.routing.core;

import java.util.Locale;

/**
 * Caller-requested trade-off between route quality and planning time.
 *
 * <p>{@code OPTIMAL} asks for the globally shortest visiting order when it is tractable.
 * {@code BALANCED} and {@code FAST} accept greedy ordering.</p>
 */
public enum PlanningMode {
    OPTIMAL,
    BALANCED,
    FAST;

    /**
     * Parses a mode name case-insensitively.
     *
     * @param name {@code optimal}, {@code balanced} or {@code fast}; {@code null} or blank
     * selects {@link #OPTIMAL}.
     * @return parsed mode.
     * @throws RouteCoreException with {@link RouteCore#REASON_UNKNOWN_MODE} for any other value.
     */
    public static PlanningMode fromName(String name) {
        if (name == null || name.isBlank()) {
            return OPTIMAL;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (PlanningMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        throw new RouteCoreException(RouteCore.REASON_UNKNOWN_MODE, "unknown planning mode: " + name);
    }
}
