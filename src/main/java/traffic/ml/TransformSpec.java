package traffic.ml;

import java.util.Objects;

/**
 * Variance-stabilizing transform chosen for a run.
 * <p>
 * Power (Box-Cox): y = (x^λ - 1) / λ for λ ≠ 0, y = log x for λ = 0.
 * Log: y = log x, λ is reported as 0.
 */
public final class TransformSpec {

    public enum Family { POWER, LOG }

    private final Family family;
    private final double lambda;

    private TransformSpec(Family family, double lambda) {
        if (!Double.isFinite(lambda)) throw new IllegalArgumentException("lambda must be finite");
        this.family = family;
        this.lambda = lambda;
    }

    public static TransformSpec power(double lambda) {
        return new TransformSpec(Family.POWER, lambda);
    }

    public static TransformSpec log() {
        return new TransformSpec(Family.LOG, 0);
    }

    public Family getFamily() { return family; }
    public double getLambda() { return lambda; }

    private boolean isLogarithmic() {
        return family == Family.LOG || lambda == 0;
    }

    public double apply(double x) {
        if (!(x > 0) || !Double.isFinite(x)) {
            throw new DomainException("transform requires strictly positive finite values, got " + x);
        }
        if (isLogarithmic()) return Math.log(x);
        return (Math.pow(x, lambda) - 1) / lambda;
    }

    public Series apply(Series series) {
        double[] out = series.values();
        for (int i = 0; i < out.length; i++) out[i] = apply(out[i]);
        return Series.of(out);
    }

    /**
     * Back to the original scale.
     *
     * @throws DomainException when y·λ + 1 is negative (or zero with λ &lt; 0)
     */
    public double inverse(double y) {
        if (isLogarithmic()) return Math.exp(y);
        double base = y * lambda + 1;
        if (base < 0 || (base == 0 && lambda < 0)) {
            throw new DomainException(String.format(
                "cannot invert power transform: y=%.6g, lambda=%.6g gives y*lambda+1=%.6g", y, lambda, base));
        }
        return Math.pow(base, 1 / lambda);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TransformSpec)) return false;
        TransformSpec that = (TransformSpec) o;
        return family == that.family && Double.compare(lambda, that.lambda) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(family, lambda);
    }

    @Override
    public String toString() {
        return family == Family.LOG ? "log" : String.format("power(lambda=%.4f)", lambda);
    }
}
