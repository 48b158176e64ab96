package traffic.ml;

import java.util.Arrays;

/**
 * Ordered, evenly spaced, gap-free sequence of finite observations.
 * <p>
 * Immutable: every transform produces a new instance.
 */
public final class Series {

    private final double[] values;

    private Series(double[] values) {
        if (values == null || values.length == 0) {
            throw new InsufficientDataException("series must contain at least one observation");
        }
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                throw new DomainException("series value at index " + i + " is not finite: " + values[i]);
            }
        }
        this.values = values;
    }

    public static Series of(double... values) {
        return new Series(values == null ? null : values.clone());
    }

    public int length() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }

    public double last() {
        return values[values.length - 1];
    }

    /** Copy of the observations. */
    public double[] values() {
        return values.clone();
    }

    /** Sub-series [from, to). */
    public Series slice(int from, int to) {
        if (from < 0 || to > values.length || from >= to) {
            throw new IllegalArgumentException("invalid slice [" + from + ", " + to + ") of length " + values.length);
        }
        return new Series(Arrays.copyOfRange(values, from, to));
    }

    public Series concat(Series other) {
        double[] out = Arrays.copyOf(values, values.length + other.values.length);
        System.arraycopy(other.values, 0, out, values.length, other.values.length);
        return new Series(out);
    }

    public double min() {
        double m = values[0];
        for (double v : values) m = Math.min(m, v);
        return m;
    }

    public double mean() {
        double sum = 0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    /** Sample variance (n - 1 denominator); NaN for a single observation. */
    public double variance() {
        if (values.length < 2) return Double.NaN;
        double mean = mean();
        double ss = 0;
        for (double v : values) ss += (v - mean) * (v - mean);
        return ss / (values.length - 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Series)) return false;
        return Arrays.equals(values, ((Series) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "Series[length=" + values.length + "]";
    }
}
