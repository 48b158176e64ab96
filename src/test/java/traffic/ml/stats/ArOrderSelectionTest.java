package traffic.ml.stats;

import java.util.Random;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ArOrderSelectionTest {

    @Test
    public void testMaxOrder() {
        assertEquals(26, ArOrderSelection.select(series(500, 1, 0.5, 0)).getMaxOrder());
        assertEquals(4, ArOrderSelection.select(series(5, 1, 0.5, 0)).getMaxOrder());
    }

    @Test
    public void testFindsAr2() {
        ArOrderSelection selection = ArOrderSelection.select(series(1000, 3, 0.6, -0.3));
        assertTrue(selection.getSelectedOrder() >= 2);
        double[] aic = selection.getAic();
        assertTrue(aic[2] < aic[0] - 50);
        assertTrue(aic[2] < aic[1]);
    }

    @Test
    public void testSelectedOrderMinimisesAic() {
        ArOrderSelection selection = ArOrderSelection.select(series(400, 5, 0, 0));
        double[] aic = selection.getAic();
        for (double v : aic) assertTrue(aic[selection.getSelectedOrder()] <= v);
        assertEquals(0, aic[0], 1e-12);
    }

    private static double[] series(int n, long seed, double phi1, double phi2) {
        Random random = new Random(seed);
        double[] x = new double[n + 100];
        for (int t = 2; t < x.length; t++) x[t] = phi1 * x[t - 1] + phi2 * x[t - 2] + random.nextGaussian();
        double[] out = new double[n];
        System.arraycopy(x, 100, out, 0, n);
        return out;
    }
}
