package core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RiskSizerTest {

    private final RiskSizer sizer = new RiskSizer(0.10, 10_000);

    @Test
    void thinPoolsGetNothing() {
        assertEquals(0.0, sizer.size(50));
        assertEquals(0.0, sizer.size(100));
        assertEquals(0.0, sizer.size(-1));
        assertEquals(0.0, sizer.size(Double.NaN));
        assertEquals(0.0, sizer.size(Double.POSITIVE_INFINITY));
    }

    @Test
    void capByPoolShare() {
        assertEquals(50.0, sizer.size(5_000), 1e-9);
    }

    @Test
    void capByPortfolioFraction() {
        assertEquals(1_000.0, sizer.size(200_000), 1e-9);
        assertTrue(sizer.size(1e12) <= 0.10 * 10_000);
    }

    @Test
    void neverAboveEitherCap() {
        double[] pools = {101, 500, 10_000, 99_999, 100_000, 3e6};
        for (double l : pools) {
            double s = sizer.size(l);
            assertTrue(s <= 0.01 * l + 1e-9, "pool " + l);
            assertTrue(s <= 1_000 + 1e-9, "pool " + l);
            assertTrue(s >= 0);
        }
    }
}
