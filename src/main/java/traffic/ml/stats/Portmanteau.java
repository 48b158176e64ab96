package traffic.ml.stats;

import org.apache.commons.math3.distribution.ChiSquaredDistribution;

import traffic.ml.InsufficientDataException;

/**
 * Box-Pierce and Ljung-Box tests for joint absence of autocorrelation up to a lag.
 * Degrees of freedom are {@code lag - fitdf}.
 */
public final class Portmanteau {

    public static final String LJUNG_BOX = "Ljung-Box";
    public static final String BOX_PIERCE = "Box-Pierce";

    private Portmanteau() {
    }

    /** Q = n(n+2) Σ r_k² / (n-k); the small-sample variant. */
    public static TestStatistic ljungBox(double[] x, int lag, int fitdf) {
        int df = degreesOfFreedom(lag, fitdf);
        double[] r = Autocorrelation.acf(x, lag);
        int n = x.length;
        double sum = 0;
        for (int k = 1; k <= lag; k++) sum += r[k] * r[k] / (n - k);
        double q = n * (n + 2.0) * sum;
        return new TestStatistic(LJUNG_BOX, q, upperTail(q, df), df);
    }

    /** Q = n Σ r_k²; the large-sample variant. */
    public static TestStatistic boxPierce(double[] x, int lag, int fitdf) {
        int df = degreesOfFreedom(lag, fitdf);
        double[] r = Autocorrelation.acf(x, lag);
        double sum = 0;
        for (int k = 1; k <= lag; k++) sum += r[k] * r[k];
        double q = x.length * sum;
        return new TestStatistic(BOX_PIERCE, q, upperTail(q, df), df);
    }

    private static int degreesOfFreedom(int lag, int fitdf) {
        if (fitdf < 0) throw new IllegalArgumentException("fitdf must be >= 0");
        if (lag - fitdf < 1) {
            throw new InsufficientDataException("portmanteau lag " + lag + " leaves no degrees of freedom after "
                + fitdf + " fitted parameters");
        }
        return lag - fitdf;
    }

    private static double upperTail(double q, int df) {
        return 1 - new ChiSquaredDistribution(df).cumulativeProbability(q);
    }
}
