package traffic.ml.stats;

import java.util.Random;

import org.junit.jupiter.api.Test;

import traffic.ml.DomainException;
import traffic.ml.InsufficientDataException;
import traffic.ml.NumericalException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ShapiroWilkTest {

    @Test
    public void testThreeEquallySpacedPoints() {
        TestStatistic sw = ShapiroWilk.test(new double[] {3, 1, 2});
        assertEquals(ShapiroWilk.NAME, sw.getName());
        assertEquals(1, sw.getStatistic(), 1e-12);
        assertEquals(1, sw.getPValue(), 1e-9);
    }

    @Test
    public void testCoefficientsAreAntisymmetricUnitVector() {
        for (int n : new int[] {4, 5, 6, 11, 50, 321}) {
            double[] a = ShapiroWilk.coefficients(n);
            double ss = 0;
            for (int i = 0; i < n; i++) {
                assertEquals(-a[n - 1 - i], a[i], 1e-12, "n=" + n);
                ss += a[i] * a[i];
            }
            assertEquals(1, ss, 1e-9, "n=" + n);
        }
    }

    @Test
    public void testNormalVersusSkewed() {
        Random random = new Random(42);
        double[] normal = new double[200];
        double[] skewed = new double[200];
        for (int i = 0; i < normal.length; i++) {
            normal[i] = 10 + 2 * random.nextGaussian();
            skewed[i] = -Math.log(random.nextDouble());
        }
        TestStatistic n = ShapiroWilk.test(normal);
        TestStatistic s = ShapiroWilk.test(skewed);
        assertTrue(n.getStatistic() > 0.97);
        assertTrue(n.getPValue() > 0.01);
        assertTrue(s.getStatistic() < n.getStatistic());
        assertTrue(s.getPValue() < 1e-4);
    }

    @Test
    public void testScaleInvariance() {
        Random random = new Random(7);
        double[] x = new double[40];
        double[] y = new double[40];
        for (int i = 0; i < x.length; i++) {
            x[i] = random.nextGaussian();
            y[i] = 1000 + 50 * x[i];
        }
        assertEquals(ShapiroWilk.test(x).getStatistic(), ShapiroWilk.test(y).getStatistic(), 1e-9);
    }

    @Test
    public void testDomain() {
        assertThrows(InsufficientDataException.class, () -> ShapiroWilk.test(new double[] {1, 2}));
        assertThrows(NumericalException.class, () -> ShapiroWilk.test(new double[] {5, 5, 5, 5}));
        assertThrows(DomainException.class, () -> ShapiroWilk.test(new double[5001]));
    }

    @Test
    public void testRecentUsesTrailingWindow() {
        Random random = new Random(11);
        double[] x = new double[6000];
        for (int i = 0; i < x.length; i++) x[i] = random.nextGaussian();
        TestStatistic recent = ShapiroWilk.testRecent(x);
        double[] tail = java.util.Arrays.copyOfRange(x, 1000, 6000);
        assertEquals(ShapiroWilk.test(tail).getStatistic(), recent.getStatistic(), 0);
        assertEquals(ShapiroWilk.test(new double[] {3, 1, 2}).getStatistic(),
            ShapiroWilk.testRecent(new double[] {3, 1, 2}).getStatistic(), 0);
    }
}
