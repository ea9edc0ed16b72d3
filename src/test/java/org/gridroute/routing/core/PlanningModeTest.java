package org.gridroute.routing.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("PlanningMode Tests")
class PlanningModeTest {

    @ParameterizedTest
    @CsvSource({
            "optimal, OPTIMAL",
            "Balanced, BALANCED",
            "FAST, FAST",
            "' fast ', FAST"
    })
    @DisplayName("Mode names parse case-insensitively")
    void testFromName(String name, PlanningMode expected) {
        assertEquals(expected, PlanningMode.fromName(name));
    }

    @Test
    @DisplayName("Missing mode defaults to OPTIMAL")
    void testDefault() {
        assertEquals(PlanningMode.OPTIMAL, PlanningMode.fromName(null));
        assertEquals(PlanningMode.OPTIMAL, PlanningMode.fromName("  "));
    }

    @Test
    @DisplayName("Unknown mode is a reason-coded failure")
    void testUnknownMode() {
        RouteCoreException ex = assertThrows(RouteCoreException.class, () -> PlanningMode.fromName("greedy"));
        assertEquals(RouteCore.REASON_UNKNOWN_MODE, ex.getReasonCode());
    }
}
