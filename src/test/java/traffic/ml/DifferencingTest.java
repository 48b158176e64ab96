package traffic.ml;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class DifferencingTest {

    @Test
    public void testIntegrateInvertsDiff() {
        double[] raw = SyntheticTraffic.generate(60, 11);
        Series x = Series.of(raw);
        for (int lag : new int[] {1, 7}) {
            Series d = Differencing.diff(x, lag);
            assertEquals(x.length() - lag, d.length());
            double[] seed = new double[lag];
            System.arraycopy(raw, 0, seed, 0, lag);
            assertArrayEquals(raw, Differencing.integrate(d, seed, lag).values(), 1e-9);
        }
    }

    @Test
    public void testSeasonalThenTrendBoundary() {
        int s = 7;
        double[] raw = new double[s + 2];
        for (int i = 0; i < raw.length; i++) raw[i] = i * i;
        Series enough = Series.of(raw);
        Series once = Differencing.diff(Differencing.diff(enough, s), 1);
        assertEquals(1, once.length());

        Series tooShort = enough.slice(0, s + 1);
        Series seasonal = Differencing.diff(tooShort, s);
        assertEquals(1, seasonal.length());
        assertThrows(InsufficientDataException.class, () -> Differencing.diff(seasonal, 1));
        assertThrows(InsufficientDataException.class, () -> Differencing.diff(enough.slice(0, s), s));
    }

    @Test
    public void testIntegrationOperator() {
        // (1 - B)(1 - B^2) = 1 - B - B^2 + B^3
        assertArrayEquals(new double[] {1, -1, -1, 1}, Differencing.integrationOperator(1, 1, 2), 1e-12);
        double[] x = {1, 4, 9, 16, 25, 36};
        assertArrayEquals(new double[] {0, 0, 0}, Differencing.difference(x, 2, 1, 1), 1e-12);
    }

    @Test
    public void testSeedMismatch() {
        assertThrows(IllegalArgumentException.class,
            () -> Differencing.integrate(Series.of(1, 2), new double[] {1}, 2));
    }
}
