package com.cryptobot.ta.indicator;

import com.cryptobot.ta.model.PivotSet;
import com.cryptobot.ta.model.PivotType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PivotCalculatorTest {

    @Test
    void classicLevels() {
        PivotSet set = PivotCalculator.compute(PivotType.CLASSIC, 110.0, 90.0, 100.0);

        assertEquals(100.0, set.pivot, 1e-9);
        assertEquals(110.0, set.r1, 1e-9);
        assertEquals(120.0, set.r2, 1e-9);
        assertEquals(130.0, set.r3, 1e-9);
        assertEquals(90.0, set.s1, 1e-9);
        assertEquals(80.0, set.s2, 1e-9);
        assertEquals(70.0, set.s3, 1e-9);
    }

    @Test
    void fibonacciAndCamarillaLevels() {
        PivotSet fib = PivotCalculator.compute(PivotType.FIBONACCI, 110.0, 90.0, 100.0);
        PivotSet cam = PivotCalculator.compute(PivotType.CAMARILLA, 110.0, 90.0, 100.0);

        assertEquals(107.64, fib.r1, 1e-9);
        assertEquals(120.0, fib.r3, 1e-9);
        assertEquals(87.64, fib.s2, 1e-9);
        assertEquals(100.0 + 22.0 / 12.0, cam.r1, 1e-9);
        assertEquals(100.0 - 22.0 / 4.0, cam.s3, 1e-9);
    }

    @Test
    void woodieWeightsTheClose() {
        PivotSet set = PivotCalculator.compute(PivotType.WOODIE, 110.0, 90.0, 108.0);

        assertEquals(104.0, set.pivot, 1e-9);
        assertEquals(118.0, set.r1, 1e-9);
        assertEquals(98.0, set.s1, 1e-9);
    }

    @Test
    void levelsStayOrderedForSkewedCandles() {
        double[][] candles = {{110, 90, 109.9}, {110, 90, 90.1}, {1.0002, 0.9998, 1.0}, {50_000, 49_000, 49_999}};
        for (double[] c : candles) {
            for (PivotType type : PivotType.values()) {
                PivotSet set = PivotCalculator.compute(type, c[0], c[1], c[2]);
                assertTrue(set.r1 <= set.r2 + 1e-6 && set.r2 <= set.r3 + 1e-6, type + " resistances");
                assertTrue(set.s1 >= set.s2 - 1e-6 && set.s2 >= set.s3 - 1e-6, type + " supports");
            }
        }
    }

    @Test
    void computeProducesOneSetPerConfiguredType() {
        PivotCalculator calculator = new PivotCalculator(List.of(PivotType.CLASSIC, PivotType.WOODIE));

        List<PivotSet> sets = calculator.compute(TestCandles.wave(60));

        assertEquals(2, sets.size());
        assertSame(PivotType.CLASSIC, sets.get(0).type);
        assertSame(PivotType.WOODIE, sets.get(1).type);
        assertTrue(calculator.compute(TestCandles.flat(1, 10.0)).isEmpty());
    }
}
