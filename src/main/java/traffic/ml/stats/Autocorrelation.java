package traffic.ml.stats;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.distribution.NormalDistribution;

import traffic.ml.InsufficientDataException;
import traffic.ml.NumericalException;

/**
 * Sample autocorrelation and partial autocorrelation functions.
 * <p>
 * Arrays returned here are indexed by lag; index 0 holds 1.
 */
public final class Autocorrelation {

    private Autocorrelation() {
    }

    /**
     * r_k = Σ (x_t - x̄)(x_{t-k} - x̄) / Σ (x_t - x̄)², k = 0..maxLag.
     */
    public static double[] acf(double[] x, int maxLag) {
        int n = x.length;
        if (maxLag < 1 || maxLag >= n) {
            throw new InsufficientDataException("ACF up to lag " + maxLag + " needs more than " + maxLag
                + " observations, got " + n);
        }
        double mean = 0;
        for (double v : x) mean += v;
        mean /= n;
        double denom = 0;
        for (double v : x) denom += (v - mean) * (v - mean);
        if (!(denom > 0)) throw new NumericalException("autocorrelation undefined for a constant series");
        double[] r = new double[maxLag + 1];
        r[0] = 1;
        for (int k = 1; k <= maxLag; k++) {
            double sum = 0;
            for (int t = k; t < n; t++) sum += (x[t] - mean) * (x[t - k] - mean);
            r[k] = sum / denom;
        }
        return r;
    }

    /** Partial autocorrelations by Durbin-Levinson, lags 0..maxLag. */
    public static double[] pacf(double[] x, int maxLag) {
        return levinson(acf(x, maxLag)).partial;
    }

    /**
     * Durbin-Levinson recursion on autocorrelations r[0..m]: partial autocorrelations and the
     * relative innovation variance of the order-k Yule-Walker fit, v[k] / γ(0).
     */
    static Levinson levinson(double[] r) {
        int m = r.length - 1;
        double[] partial = new double[m + 1];
        double[] variance = new double[m + 1];
        partial[0] = 1;
        variance[0] = 1;
        double[] prev = new double[0];
        for (int k = 1; k <= m; k++) {
            double num = r[k];
            double den = 1;
            for (int j = 1; j < k; j++) {
                num -= prev[j - 1] * r[k - j];
                den -= prev[j - 1] * r[j];
            }
            double kk = num / den;
            double[] cur = new double[k];
            for (int j = 1; j < k; j++) cur[j - 1] = prev[j - 1] - kk * prev[k - j - 1];
            cur[k - 1] = kk;
            partial[k] = kk;
            variance[k] = variance[k - 1] * (1 - kk * kk);
            prev = cur;
        }
        return new Levinson(partial, variance);
    }

    static final class Levinson {
        final double[] partial;
        final double[] variance;

        Levinson(double[] partial, double[] variance) {
            this.partial = partial;
            this.variance = variance;
        }
    }

    /** Half-width of the white-noise band: z(1 - α/2) / √n, 1.96/√n at α = 0.05. */
    public static double confidenceBound(int n, double significanceLevel) {
        double z = new NormalDistribution().inverseCumulativeProbability(1 - significanceLevel / 2);
        return z / Math.sqrt(n);
    }

    /** Lags in 1..values.length-1 whose value lies outside ±bound. */
    public static List<Integer> significantLags(double[] byLag, double bound) {
        List<Integer> lags = new ArrayList<>();
        for (int k = 1; k < byLag.length; k++) {
            if (Math.abs(byLag[k]) > bound) lags.add(k);
        }
        return lags;
    }
}
