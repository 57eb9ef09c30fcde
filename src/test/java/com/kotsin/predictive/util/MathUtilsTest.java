package com.kotsin.predictive.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MathUtilsTest {

    // ========== Safe Division Tests ==========

    @Test
    @DisplayName("safeDivide: zero, NaN and infinite denominators fall back to the default")
    void testSafeDivide_InvalidDenominators() {
        assertEquals(-1.0, MathUtils.safeDivide(10, 0, -1.0));
        assertEquals(-1.0, MathUtils.safeDivide(10, Double.NaN, -1.0));
        assertEquals(-1.0, MathUtils.safeDivide(10, Double.POSITIVE_INFINITY, -1.0));
        assertEquals(2.5, MathUtils.safeDivide(10, 4, -1.0), 1e-12);
    }

    @Test
    @DisplayName("safePercentageChange: zero base yields default")
    void testPercentageChange() {
        assertEquals(50.0, MathUtils.safePercentageChange(150, 100, 0.0), 1e-9);
        assertEquals(0.0, MathUtils.safePercentageChange(150, 0, 0.0));
    }

    // ========== Clamp Tests ==========

    @Test
    @DisplayName("clamp: NaN maps to min, infinities to the nearest bound")
    void testClamp() {
        assertEquals(0.0, MathUtils.clampUnit(Double.NaN));
        assertEquals(1.0, MathUtils.clampUnit(Double.POSITIVE_INFINITY));
        assertEquals(0.0, MathUtils.clampUnit(-3));
        assertEquals(0.4, MathUtils.clampUnit(0.4));
    }

    // ========== Statistics Tests ==========

    @Test
    @DisplayName("variance: population variance over full array and slices")
    void testVariance() {
        double[] values = {2, 4, 4, 4, 5, 5, 7, 9};
        assertEquals(5.0, MathUtils.mean(values), 1e-12);
        assertEquals(4.0, MathUtils.variance(values), 1e-12);
        assertEquals(2.0, MathUtils.populationStdDev(values, 0, values.length), 1e-12);
        assertEquals(0.0, MathUtils.variance(values, 3, 3));
        assertEquals(0.0, MathUtils.variance(new double[0]));
    }

    @Test
    @DisplayName("difference: first differences, empty below two values")
    void testDifference() {
        assertArrayEquals(new double[]{2, -1, 4}, MathUtils.difference(new double[]{1, 3, 2, 6}), 1e-12);
        assertEquals(0, MathUtils.difference(new double[]{5}).length);
    }

    @Test
    @DisplayName("format: locale independent decimals")
    void testFormat() {
        assertEquals("3.14", MathUtils.format2(3.14159));
        assertEquals("42.0", MathUtils.format1(42));
    }
}
