package traffic.ml;

import java.util.Arrays;

/**
 * Lag differencing and its inverse on plain arrays and on {@link Series}.
 */
public final class Differencing {

    private Differencing() {
    }

    /** out[t - lag] = x[t] - x[t - lag]; consumes the first {@code lag} observations. */
    static double[] diff(double[] x, int lag) {
        if (lag >= x.length) return new double[0];
        double[] out = new double[x.length - lag];
        for (int i = lag; i < x.length; i++) {
            out[i - lag] = x[i] - x[i - lag];
        }
        return out;
    }

    /**
     * @throws InsufficientDataException when fewer than {@code lag + 1} observations remain
     */
    public static Series diff(Series series, int lag) {
        if (lag < 1) throw new IllegalArgumentException("lag must be >= 1");
        if (series.length() <= lag) {
            throw new InsufficientDataException("cannot difference " + series.length()
                + " observations at lag " + lag);
        }
        return Series.of(diff(series.values(), lag));
    }

    /**
     * Rebuild a series from its lag difference and the first {@code lag} original values by
     * cumulative summation. The result has {@code seed.length + differenced.length} values.
     */
    public static Series integrate(Series differenced, double[] seed, int lag) {
        if (seed.length != lag) {
            throw new IllegalArgumentException("need exactly " + lag + " seed values, got " + seed.length);
        }
        double[] out = Arrays.copyOf(seed, lag + differenced.length());
        for (int t = lag; t < out.length; t++) {
            out[t] = differenced.get(t - lag) + out[t - lag];
        }
        return Series.of(out);
    }

    /**
     * Coefficients of (1 - B)^d (1 - B^s)^D in ascending powers of B, leading 1 included.
     */
    static double[] integrationOperator(int d, int seasonalD, int s) {
        double[] op = {1};
        for (int i = 0; i < d; i++) op = Polynomials.multiply(op, lagOperator(1));
        for (int i = 0; i < seasonalD; i++) op = Polynomials.multiply(op, lagOperator(s));
        return op;
    }

    private static double[] lagOperator(int lag) {
        double[] op = new double[lag + 1];
        op[0] = 1;
        op[lag] = -1;
        return op;
    }

    /** Apply (1 - B)^d (1 - B^s)^D. */
    static double[] difference(double[] series, int d, int seasonalD, int s) {
        double[] z = series.clone();
        for (int i = 0; i < d; i++) z = diff(z, 1);
        for (int i = 0; i < seasonalD; i++) z = diff(z, s);
        return z;
    }
}
