package traffic.ml.stats;

import java.util.Arrays;

import org.apache.commons.math3.distribution.NormalDistribution;

import traffic.ml.DomainException;
import traffic.ml.InsufficientDataException;
import traffic.ml.NumericalException;

/**
 * Shapiro-Wilk normality test with Royston's (1995) coefficient and p-value approximations,
 * valid for 3 &lt;= n &lt;= 5000.
 */
public final class ShapiroWilk {

    public static final String NAME = "Shapiro-Wilk";
    public static final int MAX_OBSERVATIONS = 5000;

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution();

    private static final double[] C1 = {0, 0.221157, -0.147981, -2.071190, 4.434685, -2.706056};
    private static final double[] C2 = {0, 0.042981, -0.293762, -1.752461, 5.682633, -3.582633};
    private static final double[] C3 = {0.5440, -0.39978, 0.025054, -6.714e-4};
    private static final double[] C4 = {1.3822, -0.77857, 0.062767, -0.0020322};
    private static final double[] C5 = {-1.5861, -0.31082, -0.083751, 0.0038915};
    private static final double[] C6 = {-0.4803, -0.082676, 0.0030302};
    private static final double[] G = {-2.273, 0.459};

    private ShapiroWilk() {
    }

    /** Tests at most the last {@link #MAX_OBSERVATIONS} values of {@code sample}. */
    public static TestStatistic testRecent(double[] sample) {
        if (sample.length <= MAX_OBSERVATIONS) return test(sample);
        return test(Arrays.copyOfRange(sample, sample.length - MAX_OBSERVATIONS, sample.length));
    }

    public static TestStatistic test(double[] sample) {
        int n = sample.length;
        if (n < 3) throw new InsufficientDataException("Shapiro-Wilk needs at least 3 observations, got " + n);
        if (n > MAX_OBSERVATIONS) {
            throw new DomainException("Shapiro-Wilk is defined for at most " + MAX_OBSERVATIONS + " observations, got " + n);
        }
        double[] x = sample.clone();
        Arrays.sort(x);
        if (x[n - 1] - x[0] < 1e-12 * Math.max(1, Math.abs(x[0]))) {
            throw new NumericalException("Shapiro-Wilk undefined for a constant sample");
        }

        double[] a = coefficients(n);
        double mean = 0;
        for (double v : x) mean += v;
        mean /= n;
        double num = 0;
        double ss = 0;
        for (int i = 0; i < n; i++) {
            num += a[i] * x[i];
            ss += (x[i] - mean) * (x[i] - mean);
        }
        double w = Math.min(1.0, num * num / ss);
        return new TestStatistic(NAME, w, pValue(w, n), 0);
    }

    /** Antisymmetric weights a_1..a_n (a_i = -a_{n+1-i}). */
    static double[] coefficients(int n) {
        double[] a = new double[n];
        if (n == 3) {
            a[0] = -Math.sqrt(0.5);
            a[2] = Math.sqrt(0.5);
            return a;
        }
        double[] m = new double[n];
        double mm = 0;
        for (int i = 0; i < n; i++) {
            m[i] = STANDARD_NORMAL.inverseCumulativeProbability((i + 1 - 0.375) / (n + 0.25));
            mm += m[i] * m[i];
        }
        double u = 1 / Math.sqrt(n);
        double an = m[n - 1] / Math.sqrt(mm) + poly(C1, u);
        if (n > 5) {
            double an1 = m[n - 2] / Math.sqrt(mm) + poly(C2, u);
            double phi = (mm - 2 * m[n - 1] * m[n - 1] - 2 * m[n - 2] * m[n - 2])
                / (1 - 2 * an * an - 2 * an1 * an1);
            for (int i = 2; i < n - 2; i++) a[i] = m[i] / Math.sqrt(phi);
            a[n - 2] = an1;
            a[1] = -an1;
        } else {
            double phi = (mm - 2 * m[n - 1] * m[n - 1]) / (1 - 2 * an * an);
            for (int i = 1; i < n - 1; i++) a[i] = m[i] / Math.sqrt(phi);
        }
        a[n - 1] = an;
        a[0] = -an;
        return a;
    }

    static double pValue(double w, int n) {
        if (n == 3) {
            double p = 6 / Math.PI * (Math.asin(Math.sqrt(w)) - Math.asin(Math.sqrt(0.75)));
            return Math.max(0, Math.min(1, p));
        }
        double y = Math.log(1 - w);
        double mu;
        double sigma;
        if (n <= 11) {
            double gamma = poly(G, n);
            if (y >= gamma) return 1e-99;
            y = -Math.log(gamma - y);
            mu = poly(C3, n);
            sigma = Math.exp(poly(C4, n));
        } else {
            double ln = Math.log(n);
            mu = poly(C5, ln);
            sigma = Math.exp(poly(C6, ln));
        }
        return 1 - STANDARD_NORMAL.cumulativeProbability((y - mu) / sigma);
    }

    private static double poly(double[] c, double x) {
        double result = 0;
        double power = 1;
        for (double coefficient : c) {
            result += coefficient * power;
            power *= x;
        }
        return result;
    }
}
