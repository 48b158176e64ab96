package traffic.ml;

import org.apache.commons.math3.analysis.solvers.LaguerreSolver;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.exception.MathIllegalStateException;

/**
 * Lag-operator polynomial helpers. Polynomials are coefficient arrays in ascending powers of B.
 */
final class Polynomials {

    /** Reflection coefficients at or above this magnitude put a root on or inside the unit circle. */
    static final double UNIT_ROOT_TOLERANCE = 1e-8;

    /** Evaluation budget for one Laguerre root search. */
    static final int ROOT_EVALUATIONS = 100_000;

    private Polynomials() {
    }

    static double[] multiply(double[] a, double[] b) {
        double[] out = new double[a.length + b.length - 1];
        for (int i = 0; i < a.length; i++) {
            if (a[i] == 0) continue;
            for (int j = 0; j < b.length; j++) {
                out[i + j] += a[i] * b[j];
            }
        }
        return out;
    }

    /** 1 - φ1 B^step - φ2 B^(2 step) - ... */
    static double[] arOperator(double[] phi, int step) {
        double[] op = new double[phi.length * step + 1];
        op[0] = 1;
        for (int i = 0; i < phi.length; i++) op[(i + 1) * step] = -phi[i];
        return op;
    }

    /** 1 + θ1 B^step + θ2 B^(2 step) + ... */
    static double[] maOperator(double[] theta, int step) {
        double[] op = new double[theta.length * step + 1];
        op[0] = 1;
        for (int i = 0; i < theta.length; i++) op[(i + 1) * step] = theta[i];
        return op;
    }

    /**
     * Coefficients φ of an operator written as 1 - φ1 B - φ2 B^2 - ..., i.e. the negated tail.
     */
    static double[] arCoefficients(double[] operator) {
        double[] phi = new double[operator.length - 1];
        for (int i = 1; i < operator.length; i++) phi[i - 1] = -operator[i];
        return phi;
    }

    /** Coefficients θ of an operator written as 1 + θ1 B + θ2 B^2 + ... */
    static double[] maCoefficients(double[] operator) {
        double[] theta = new double[operator.length - 1];
        System.arraycopy(operator, 1, theta, 0, theta.length);
        return theta;
    }

    /**
     * Whether 1 - φ1 z - ... - φp z^p has every root strictly outside the unit circle, via the
     * Schur-Cohn step-down (reverse Durbin-Levinson) recursion.
     */
    static boolean rootsOutsideUnitCircle(double[] phi) {
        double[] a = trimTrailingZeros(phi);
        for (int k = a.length; k >= 1; k--) {
            double kappa = a[k - 1];
            if (Math.abs(kappa) >= 1 - UNIT_ROOT_TOLERANCE) return false;
            double denom = 1 - kappa * kappa;
            double[] next = new double[k - 1];
            for (int j = 0; j < k - 1; j++) {
                next[j] = (a[j] + kappa * a[k - 2 - j]) / denom;
            }
            a = next;
        }
        return true;
    }

    /** MA operator 1 + θ1 z + ... is invertible iff 1 - (-θ1) z - ... is stationary. */
    static boolean maInvertible(double[] theta) {
        double[] negated = new double[theta.length];
        for (int i = 0; i < theta.length; i++) negated[i] = -theta[i];
        return rootsOutsideUnitCircle(negated);
    }

    /**
     * Smallest root modulus of the operator polynomial (ascending powers, leading 1);
     * +∞ when the operator is constant, NaN when the root search does not converge.
     */
    static double minRootModulus(double[] operator) {
        double[] c = trimTrailingZeros(operator);
        if (c.length < 2) return Double.POSITIVE_INFINITY;
        try {
            double min = Double.POSITIVE_INFINITY;
            for (Complex root : roots(c)) min = Math.min(min, root.abs());
            return min;
        } catch (MathIllegalStateException e) {
            return Double.NaN;
        }
    }

    /**
     * MA coefficients with every root inside the unit circle replaced by its reciprocal. The
     * Gaussian likelihood is unchanged by the reflection, only σ² rescales. Roots on the circle
     * stay where they are; when the root search fails the coefficients are returned as given.
     */
    static double[] invertMa(double[] theta) {
        if (maInvertible(theta)) return theta;
        double[] c = trimTrailingZeros(maOperator(theta, 1));
        Complex[] roots;
        try {
            roots = roots(c);
        } catch (MathIllegalStateException e) {
            return theta;
        }
        // rebuild Π (1 - z / r)
        Complex[] poly = {Complex.ONE};
        for (Complex r : roots) {
            Complex root = r.abs() < 1 ? r.reciprocal() : r;
            Complex[] next = new Complex[poly.length + 1];
            for (int i = 0; i < next.length; i++) {
                Complex term = i < poly.length ? poly[i] : Complex.ZERO;
                if (i > 0) term = term.subtract(poly[i - 1].divide(root));
                next[i] = term;
            }
            poly = next;
        }
        double[] out = new double[theta.length];
        for (int i = 1; i < poly.length && i <= out.length; i++) out[i - 1] = poly[i].getReal();
        return out;
    }

    /**
     * Scales φ_i by r^i, which moves every root of 1 - φ1 z - ... outward by 1/r, until the
     * operator is stationary. Zero coefficients stay zero.
     */
    static double[] shrinkToStationary(double[] phi) {
        double[] out = phi.clone();
        for (int iteration = 0; iteration < 500 && !rootsOutsideUnitCircle(out); iteration++) {
            double scale = 1;
            for (int i = 0; i < out.length; i++) {
                scale *= 0.95;
                out[i] *= scale;
            }
        }
        return out;
    }

    /** MA counterpart of {@link #shrinkToStationary(double[])}. */
    static double[] shrinkToInvertible(double[] theta) {
        double[] out = theta.clone();
        for (int iteration = 0; iteration < 500 && !maInvertible(out); iteration++) {
            double scale = 1;
            for (int i = 0; i < out.length; i++) {
                scale *= 0.95;
                out[i] *= scale;
            }
        }
        return out;
    }

    private static Complex[] roots(double[] coefficients) {
        return new LaguerreSolver().solveAllComplex(coefficients, 0, ROOT_EVALUATIONS);
    }

    private static double[] trimTrailingZeros(double[] c) {
        int n = c.length;
        while (n > 0 && c[n - 1] == 0) n--;
        if (n == c.length) return c;
        double[] out = new double[n];
        System.arraycopy(c, 0, out, 0, n);
        return out;
    }
}
