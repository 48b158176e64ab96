package traffic.ml;

import java.util.Random;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class BoxCoxSelectorTest {

    private static Series squaredTrend(long seed) {
        Random random = new Random(seed);
        double[] y = new double[300];
        for (int t = 0; t < y.length; t++) {
            double root = 5 + 0.05 * t + 0.2 * random.nextGaussian();
            y[t] = root * root;
        }
        return Series.of(y);
    }

    private static Series exponentialTrend(long seed) {
        Random random = new Random(seed);
        double[] y = new double[300];
        for (int t = 0; t < y.length; t++) y[t] = Math.exp(2 + 0.01 * t + 0.05 * random.nextGaussian());
        return Series.of(y);
    }

    @Test
    public void testRecoversSquareRoot() {
        BoxCoxSelector.Selection s = new BoxCoxSelector(-2, 2).select(squaredTrend(1));
        assertEquals(0.5, s.getPowerLambda(), 0.15);
    }

    @Test
    public void testRecoversLog() {
        BoxCoxSelector.Selection s = new BoxCoxSelector(-2, 2).select(exponentialTrend(2));
        assertEquals(0, s.getPowerLambda(), 0.15);
    }

    @Test
    public void testRefinedLambdaBeatsGrid() {
        Series training = squaredTrend(3);
        double[] y = training.values();
        double sumLog = 0;
        for (double v : y) sumLog += Math.log(v);
        BoxCoxSelector.Selection s = new BoxCoxSelector(-2, 2).select(training);
        for (double lambda = -2; lambda <= 2; lambda += 0.01) {
            assertTrue(s.getMaxLogLikelihood() >= BoxCoxSelector.profileLogLikelihood(y, sumLog, lambda) - 1e-9);
        }
    }

    @Test
    public void testTieToleranceFavoursPower() {
        Series training = exponentialTrend(4);
        BoxCoxSelector.Selection s = new BoxCoxSelector(-2, 2, 0.01, 1.0).select(training);
        assertEquals(TransformSpec.Family.POWER, s.getChosen().getFamily());
        assertEquals(s.getPowerLambda(), s.getChosen().getLambda());
        assertArrayEquals(s.getChosen().apply(training).values(), s.getTransformed().values(), 1e-12);
    }

    @Test
    public void testChoiceFollowsNormality() {
        BoxCoxSelector.Selection s = new BoxCoxSelector(-2, 2).select(squaredTrend(5));
        boolean powerWins = s.getPowerNormality().getStatistic() >= s.getLogNormality().getStatistic();
        assertEquals(powerWins ? TransformSpec.Family.POWER : TransformSpec.Family.LOG, s.getChosen().getFamily());
    }

    @Test
    public void testRejectsNonPositiveAndConstant() {
        assertThrows(DomainException.class, () -> new BoxCoxSelector(-2, 2).select(Series.of(3, 4, 0, 5)));
        assertThrows(NumericalException.class, () -> new BoxCoxSelector(-2, 2).select(Series.of(4, 4, 4, 4, 4)));
        assertThrows(IllegalArgumentException.class, () -> new BoxCoxSelector(1, 1));
    }
}
