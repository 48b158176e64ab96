package traffic.ml;

import java.time.Duration;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SarimaEstimatorTest {

    private final SarimaEstimator estimator = new SarimaEstimator();

    @Test
    public void testExactAr1Likelihood() {
        double phi = 0.6;
        double[] w = SyntheticTraffic.arma11(50, 1, phi, 0);
        Sarima.Filtered filtered = new Sarima(new SarimaOrder(1, 0, 0, 0, 0, 0, 0), new double[] {phi}).filter(w);
        double ss = (1 - phi * phi) * w[0] * w[0];
        for (int t = 1; t < w.length; t++) {
            double e = w[t] - phi * w[t - 1];
            ss += e * e;
        }
        double sigma2 = ss / w.length;
        assertEquals(sigma2, filtered.sigma2(), 1e-9);
        double expected = -0.5 * (w.length * (Math.log(2 * Math.PI * sigma2) + 1) - Math.log(1 - phi * phi));
        assertEquals(expected, filtered.logLikelihood(), 1e-9);
    }

    @Test
    public void testRecoversAr1() {
        Series x = Series.of(SyntheticTraffic.arma11(600, 2, 0.6, 0));
        FittedModel m = estimator.fit(x, new SarimaOrder(1, 0, 0, 0, 0, 0, 0));
        assertEquals(0.6, m.getCoefficients()[0], 0.1);
        double se = m.getStandardErrors()[0];
        assertTrue(se > 0.015 && se < 0.06, "se=" + se);
        assertEquals(1, m.getSigma2(), 0.2);
        assertEquals(2, m.getParameterCount());
        assertEquals(600, m.getObservations());
        assertEquals(1.0, m.getArMinRootModulus() * Math.abs(m.getCoefficients()[0]), 1e-6);
    }

    @Test
    public void testRecoversMa1() {
        Series x = Series.of(SyntheticTraffic.arma11(600, 3, 0, 0.5));
        FittedModel m = estimator.fit(x, new SarimaOrder(0, 0, 1, 0, 0, 0, 0));
        assertEquals(0.5, m.namedCoefficients().get("ma1"), 0.1);
        assertTrue(m.getMaMinRootModulus() > 1);
    }

    @Test
    public void testRecoversSeasonalMa() {
        double[] y = SyntheticTraffic.generate(400, 4);
        SarimaOrder order = new SarimaOrder(0, 1, 1, 0, 1, 1, 7);
        FittedModel m = estimator.fit(Series.of(y), order);
        assertEquals(-0.4, m.namedCoefficients().get("ma1"), 0.15);
        assertEquals(-0.6, m.namedCoefficients().get("sma1"), 0.15);
        assertEquals(400 - 8, m.getObservations());
        assertEquals(400 - 8, m.residuals().size());
        assertEquals(8, m.residuals().getOffset());
        assertEquals(9, m.getSigma2(), 3);
    }

    @Test
    public void testMaskedCoefficientStaysZero() {
        Series x = Series.of(SyntheticTraffic.arma11(500, 5, 0.5, 0));
        SarimaOrder order = new SarimaOrder(2, 0, 0, 0, 0, 0, 0, CoefficientMask.ofLabels("ar1"));
        FittedModel m = estimator.fit(x, order);
        assertEquals(0.0, m.getCoefficients()[0]);
        assertTrue(Double.isNaN(m.getStandardErrors()[0]));
        assertEquals(2, m.getParameterCount());
    }

    @Test
    public void testRootGating() {
        SarimaOrder ar = new SarimaOrder(1, 0, 0, 1, 0, 0, 7);
        assertThrows(NonStationaryFitException.class,
            () -> SarimaEstimator.checkRoots(new Sarima(ar, new double[] {0.5, 1.05})));
        assertThrows(NonStationaryFitException.class,
            () -> SarimaEstimator.checkRoots(new Sarima(ar, new double[] {-1.0, 0.2})));
        SarimaOrder ma = new SarimaOrder(0, 0, 1, 0, 0, 1, 7);
        assertThrows(NonInvertibleFitException.class,
            () -> SarimaEstimator.checkRoots(new Sarima(ma, new double[] {0.3, -1.2})));
        SarimaEstimator.checkRoots(new Sarima(ma, new double[] {0.3, -0.6}));
    }

    @Test
    public void testInsufficientData() {
        Series shortSeries = Series.of(SyntheticTraffic.generate(12, 6));
        assertThrows(InsufficientDataException.class,
            () -> estimator.fit(shortSeries, new SarimaOrder(0, 1, 1, 0, 1, 1, 7)));
    }

    @Test
    public void testTimeout() {
        SarimaEstimator hurried = new SarimaEstimator(5000, Duration.ofMillis(-1));
        Series x = Series.of(SyntheticTraffic.arma11(300, 7, 0.5, 0.2));
        assertThrows(ConvergenceException.class, () -> hurried.fit(x, new SarimaOrder(1, 0, 1, 0, 0, 0, 0)));
    }

    @Test
    public void testExpandPlacesFreeCoefficients() {
        SarimaOrder order = new SarimaOrder(2, 0, 1, 0, 0, 1, 7, CoefficientMask.ofLabels("ar2"));
        assertArrayEquals(new double[] {0.1, 0, 0.2, 0.3}, Sarima.expand(order, new double[] {0.1, 0.2, 0.3}), 0);
        Sarima s = Sarima.fromFree(order, new double[] {0.1, 0.2, 0.3});
        assertEquals(8, s.getTheta().length);
        assertEquals(0.2 * 0.3, s.getTheta()[7], 1e-12);
    }

    @Test
    public void testRootMessageNamesFactor() {
        SarimaOrder order = new SarimaOrder(0, 1, 1, 0, 1, 1, 7);
        NonInvertibleFitException e = assertThrows(NonInvertibleFitException.class,
            () -> SarimaEstimator.checkRoots(new Sarima(order, new double[] {0.3, -1.0})));
        assertTrue(e.getMessage().startsWith(order.toString()), e.getMessage());
        assertTrue(e.getMessage().contains("sma factor [-1.0]"), e.getMessage());
        assertTrue(e.getMessage().contains("1.000000"), e.getMessage());
        NonStationaryFitException s = assertThrows(NonStationaryFitException.class,
            () -> SarimaEstimator.checkRoots(new Sarima(new SarimaOrder(1, 0, 0, 0, 0, 0, 0), new double[] {1.25})));
        assertTrue(s.getMessage().contains("ar factor [1.25]") && s.getMessage().contains("0.800000"), s.getMessage());
    }

    @Test
    public void testReflectMaSkipsMaskedFactors() {
        SarimaOrder order = new SarimaOrder(0, 0, 1, 0, 0, 1, 7);
        assertArrayEquals(new double[] {-0.5, 0.25}, SarimaEstimator.reflectMa(order, new double[] {-2, 4}), 1e-10);
        SarimaOrder masked = new SarimaOrder(0, 0, 2, 0, 0, 0, 0, CoefficientMask.ofLabels("ma1"));
        assertArrayEquals(new double[] {4}, SarimaEstimator.reflectMa(masked, new double[] {4}), 0);
        double[] start = SarimaEstimator.admissible(masked, new double[] {4});
        assertTrue(new Sarima(masked, Sarima.expand(masked, start)).isInvertible());
    }

    @Test
    public void testOverdifferencedFitStaysInvertible() {
        // trend + weekly cycle + white noise: after both differences the MA factors sit at the unit circle
        Series x = Series.of(SyntheticTraffic.additive(321, 21, 3.0));
        SarimaOrder order = new SarimaOrder(0, 1, 1, 0, 1, 1, 7);
        FittedModel m = estimator.fit(x, order);
        double[] c = m.getCoefficients();
        assertTrue(c[0] > -1 && c[0] < -0.6, m.toString());
        assertTrue(c[1] > -1 && c[1] < -0.6, m.toString());
        assertTrue(new Sarima(order, c).isInvertible());
        assertTrue(m.getMaMinRootModulus() >= 1, m.toString());
    }
}
