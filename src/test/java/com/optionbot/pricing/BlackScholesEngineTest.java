package com.optionbot.pricing;

import com.optionbot.model.OptionKind;
import com.optionbot.model.PricingResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BlackScholesEngineTest {
    private final BlackScholesEngine engine = new BlackScholesEngine();

    @Test
    void price_shouldMatchReferenceValuesAtTheMoney() {
        assertEquals(6.8887, engine.price(100, 100, 0.5, 0.2, 0.05, OptionKind.CALL).fairValue(), 1e-3);
        assertEquals(4.4197, engine.price(100, 100, 0.5, 0.2, 0.05, OptionKind.PUT).fairValue(), 1e-3);
        assertEquals(10.4506, engine.price(100, 100, 1.0, 0.2, 0.05, OptionKind.CALL).fairValue(), 1e-3);
        assertEquals(5.5735, engine.price(100, 100, 1.0, 0.2, 0.05, OptionKind.PUT).fairValue(), 1e-3);
    }

    @Test
    void price_shouldReportGreeksInQuotedUnits() {
        PricingResult call = engine.price(100, 100, 1.0, 0.2, 0.05, OptionKind.CALL);
        PricingResult put = engine.price(100, 100, 1.0, 0.2, 0.05, OptionKind.PUT);

        assertEquals(0.6368, call.delta(), 1e-3);
        assertEquals(-0.3632, put.delta(), 1e-3);
        // per volatility point
        assertEquals(0.3752, call.vega(), 1e-3);
        assertEquals(call.vega(), put.vega(), 1e-12);
        assertEquals(call.gamma(), put.gamma(), 1e-12);
        assertTrue(call.theta() < 0.0);
        assertFalse(call.degenerate());
    }

    @Test
    void price_shouldSatisfyPutCallParity() {
        double[][] cases = {
                {100, 90, 0.25, 0.35, 0.03},
                {42, 50, 2.0, 0.6, 0.01},
                {250, 250, 0.01, 0.15, 0.05},
                {10, 4, 0.7, 1.2, 0.0}
        };
        for (double[] c : cases) {
            double call = engine.price(c[0], c[1], c[2], c[3], c[4], OptionKind.CALL).fairValue();
            double put = engine.price(c[0], c[1], c[2], c[3], c[4], OptionKind.PUT).fairValue();
            double forward = c[0] - c[1] * Math.exp(-c[4] * c[2]);
            assertEquals(forward, call - put, 1e-6);
        }
    }

    @Test
    void price_shouldReturnIntrinsicWhenExpired() {
        PricingResult itmCall = engine.price(110, 100, 0.0, 0.2, 0.05, OptionKind.CALL);
        assertEquals(10.0, itmCall.fairValue(), 1e-12);
        assertEquals(1.0, itmCall.delta(), 0.0);
        assertEquals(0.0, itmCall.vega(), 0.0);
        assertEquals(0.0, itmCall.gamma(), 0.0);
        assertEquals(0.0, itmCall.theta(), 0.0);
        assertTrue(itmCall.degenerate());

        PricingResult otmPut = engine.price(110, 100, 0.0, 0.2, 0.05, OptionKind.PUT);
        assertEquals(0.0, otmPut.fairValue(), 0.0);
        assertEquals(0.0, otmPut.delta(), 0.0);

        PricingResult itmPut = engine.price(90, 100, 0.0, 0.2, 0.05, OptionKind.PUT);
        assertEquals(10.0, itmPut.fairValue(), 1e-12);
        assertEquals(-1.0, itmPut.delta(), 0.0);
    }

    @Test
    void price_shouldReturnIntrinsicWhenVolatilityIsZero() {
        PricingResult result = engine.price(120, 100, 0.5, 0.0, 0.05, OptionKind.CALL);
        assertEquals(20.0, result.fairValue(), 1e-12);
        assertTrue(result.degenerate());
    }

    @Test
    void price_shouldApproachIntrinsicAsTimeShrinks() {
        double nearExpiry = engine.price(110, 100, 1e-8, 0.2, 0.05, OptionKind.CALL).fairValue();
        assertEquals(10.0, nearExpiry, 1e-3);

        double otm = engine.price(90, 100, 1e-8, 0.2, 0.05, OptionKind.CALL).fairValue();
        assertEquals(0.0, otm, 1e-6);
    }

    @Test
    void price_shouldApproachIntrinsicAsVolatilityShrinksWithoutRates() {
        double call = engine.price(110, 100, 0.5, 1e-6, 0.0, OptionKind.CALL).fairValue();
        double put = engine.price(90, 100, 0.5, 1e-6, 0.0, OptionKind.PUT).fairValue();
        assertEquals(10.0, call, 1e-6);
        assertEquals(10.0, put, 1e-6);
    }

    @Test
    void price_shouldNeverReturnNegativeValues() {
        double[] spots = {1, 50, 100, 150, 1000};
        double[] vols = {0.01, 0.2, 1.0, 3.0};
        for (double spot : spots) {
            for (double vol : vols) {
                for (OptionKind kind : OptionKind.values()) {
                    PricingResult result = engine.price(spot, 100, 0.3, vol, 0.05, kind);
                    assertTrue(result.fairValue() >= 0.0, spot + " " + vol + " " + kind);
                    assertTrue(Double.isFinite(result.delta()));
                }
            }
        }
    }

    @Test
    void price_shouldRejectInvalidInputs() {
        assertThrows(IllegalArgumentException.class, () -> engine.price(0, 100, 0.5, 0.2, 0.05, OptionKind.CALL));
        assertThrows(IllegalArgumentException.class, () -> engine.price(100, -1, 0.5, 0.2, 0.05, OptionKind.CALL));
        assertThrows(IllegalArgumentException.class, () -> engine.price(100, 100, -0.1, 0.2, 0.05, OptionKind.CALL));
        assertThrows(IllegalArgumentException.class, () -> engine.price(100, 100, 0.5, Double.NaN, 0.05, OptionKind.CALL));
        assertThrows(IllegalArgumentException.class, () -> engine.price(100, 100, 0.5, 0.2, Double.POSITIVE_INFINITY, OptionKind.PUT));
        assertThrows(IllegalArgumentException.class, () -> engine.price(100, 100, 0.5, 0.2, 0.05, null));
    }
}
