package traffic.ml;

import java.util.Arrays;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Seasonal Autoregressive Integrated Moving Average (SARIMA) operator with one concrete
 * coefficient vector.
 * <p>
 * Model: SARIMA(p,d,q)(P,D,Q)s
 * φ(B)Φ(B^s) ∇^d ∇_s^D y_t = θ(B)Θ(B^s) ε_t
 * <p>
 * The multiplicative AR and MA factors are expanded into single polynomials of degree
 * p + sP and q + sQ. Likelihoods are evaluated on the differenced series w = ∇^d ∇_s^D y.
 */
final class Sarima {

    private static final int MAX_DOUBLING_STEPS = 64;

    private final SarimaOrder order;
    private final double[] ar;         // φ₁..φₚ
    private final double[] ma;         // θ₁..θq
    private final double[] seasonalAr; // Φ₁..Φ_P
    private final double[] seasonalMa; // Θ₁..Θ_Q
    private final double[] phi;        // expanded φ(B)Φ(B^s)
    private final double[] theta;      // expanded θ(B)Θ(B^s)

    /** @param coefficients full vector in {@link SarimaOrder} layout, masked positions included */
    Sarima(SarimaOrder order, double[] coefficients) {
        if (coefficients.length != order.coefficientCount()) {
            throw new IllegalArgumentException("expected " + order.coefficientCount() + " coefficients, got "
                + coefficients.length);
        }
        this.order = order;
        int idx = 0;
        this.ar = new double[order.getP()];
        for (int i = 0; i < ar.length; i++) ar[i] = coefficients[idx++];
        this.ma = new double[order.getQ()];
        for (int i = 0; i < ma.length; i++) ma[i] = coefficients[idx++];
        this.seasonalAr = new double[order.getSeasonalP()];
        for (int i = 0; i < seasonalAr.length; i++) seasonalAr[i] = coefficients[idx++];
        this.seasonalMa = new double[order.getSeasonalQ()];
        for (int i = 0; i < seasonalMa.length; i++) seasonalMa[i] = coefficients[idx++];

        int s = order.getSeasonLength();
        this.phi = Polynomials.arCoefficients(Polynomials.multiply(
            Polynomials.arOperator(ar, 1), Polynomials.arOperator(seasonalAr, s)));
        this.theta = Polynomials.maCoefficients(Polynomials.multiply(
            Polynomials.maOperator(ma, 1), Polynomials.maOperator(seasonalMa, s)));
    }

    /** Build from the free coefficients only; masked positions are set to zero. */
    static Sarima fromFree(SarimaOrder order, double[] free) {
        return new Sarima(order, expand(order, free));
    }

    static double[] expand(SarimaOrder order, double[] free) {
        double[] full = new double[order.coefficientCount()];
        int[] idx = order.freeIndices();
        for (int i = 0; i < idx.length; i++) full[idx[i]] = free[i];
        return full;
    }

    SarimaOrder getOrder() { return order; }
    double[] getPhi() { return phi.clone(); }
    double[] getTheta() { return theta.clone(); }

    boolean isStationary() {
        return Polynomials.rootsOutsideUnitCircle(ar) && Polynomials.rootsOutsideUnitCircle(seasonalAr);
    }

    boolean isInvertible() {
        return Polynomials.maInvertible(ma) && Polynomials.maInvertible(seasonalMa);
    }

    /** Coefficients of one multiplicative factor, in that factor's own lag variable. */
    double[] factor(CoefficientMask.Kind kind) {
        switch (kind) {
            case AR: return ar.clone();
            case MA: return ma.clone();
            case SEASONAL_AR: return seasonalAr.clone();
            default: return seasonalMa.clone();
        }
    }

    /** First AR factor with a root on or inside the unit circle, or null. */
    CoefficientMask.Kind nonStationaryFactor() {
        if (!Polynomials.rootsOutsideUnitCircle(ar)) return CoefficientMask.Kind.AR;
        if (!Polynomials.rootsOutsideUnitCircle(seasonalAr)) return CoefficientMask.Kind.SEASONAL_AR;
        return null;
    }

    /** First MA factor with a root on or inside the unit circle, or null. */
    CoefficientMask.Kind nonInvertibleFactor() {
        if (!Polynomials.maInvertible(ma)) return CoefficientMask.Kind.MA;
        if (!Polynomials.maInvertible(seasonalMa)) return CoefficientMask.Kind.SEASONAL_MA;
        return null;
    }

    /** Smallest root modulus of one factor in its own lag variable. */
    double factorMinRootModulus(CoefficientMask.Kind kind) {
        double[] c = factor(kind);
        boolean isAr = kind == CoefficientMask.Kind.AR || kind == CoefficientMask.Kind.SEASONAL_AR;
        return Polynomials.minRootModulus(isAr ? Polynomials.arOperator(c, 1) : Polynomials.maOperator(c, 1));
    }

    /** Smallest modulus, in B, over the roots of φ(B)Φ(B^s). */
    double arMinRootModulus() {
        return combinedMinRootModulus(CoefficientMask.Kind.AR, CoefficientMask.Kind.SEASONAL_AR);
    }

    /** Smallest modulus, in B, over the roots of θ(B)Θ(B^s). */
    double maMinRootModulus() {
        return combinedMinRootModulus(CoefficientMask.Kind.MA, CoefficientMask.Kind.SEASONAL_MA);
    }

    // a root r of the seasonal factor in B^s gives roots of modulus |r|^(1/s) in B
    private double combinedMinRootModulus(CoefficientMask.Kind nonSeasonal, CoefficientMask.Kind seasonal) {
        double seasonalModulus = factorMinRootModulus(seasonal);
        if (order.getSeasonLength() > 1 && Double.isFinite(seasonalModulus)) {
            seasonalModulus = Math.pow(seasonalModulus, 1.0 / order.getSeasonLength());
        }
        double modulus = factorMinRootModulus(nonSeasonal);
        if (Double.isNaN(modulus) || Double.isNaN(seasonalModulus)) return Double.NaN;
        return Math.min(modulus, seasonalModulus);
    }

    /** Full AR operator including the integration part: φ(B)Φ(B^s)(1-B)^d(1-B^s)^D. */
    double[] integratedArCoefficients() {
        double[] op = Polynomials.multiply(Polynomials.arOperator(phi, 1),
            Differencing.integrationOperator(order.getD(), order.getSeasonalD(), order.getSeasonLength()));
        return Polynomials.arCoefficients(op);
    }

    /** ∇^d ∇_s^D y. */
    double[] difference(double[] series) {
        return Differencing.difference(series, order.getD(), order.getSeasonalD(), order.getSeasonLength());
    }

    /**
     * Conditional sum of squares objective 0.5·log(SS/n) on the differenced series, innovations
     * before the first fully conditioned index taken as zero.
     */
    double conditionalSumOfSquares(double[] z) {
        int start = phi.length;
        int used = z.length - start;
        if (used <= 0) return Double.POSITIVE_INFINITY;
        double[] innovations = new double[z.length];
        double ss = 0;
        for (int t = start; t < z.length; t++) {
            double pred = 0;
            for (int i = 0; i < phi.length; i++) pred += phi[i] * z[t - 1 - i];
            for (int j = 0; j < theta.length && t - 1 - j >= start; j++) pred += theta[j] * innovations[t - 1 - j];
            innovations[t] = z[t] - pred;
            ss += innovations[t] * innovations[t];
        }
        return 0.5 * Math.log(ss / used);
    }

    /**
     * Exact Gaussian likelihood of the (stationary) differenced series through a Kalman filter
     * on the state-space form with state dimension r = max(p', q' + 1), unit innovation variance.
     *
     * @throws NumericalException when the AR part is not stationary enough for a finite state
     *                            covariance, or a prediction variance collapses
     */
    Filtered filter(double[] w) {
        int r = Math.max(phi.length, theta.length + 1);
        double[] t = new double[r];
        System.arraycopy(phi, 0, t, 0, phi.length);
        double[] rv = new double[r];
        rv[0] = 1;
        System.arraycopy(theta, 0, rv, 1, theta.length);

        double[][] p = stationaryCovariance(t, rv);
        double[] a = new double[r];
        double[][] m = new double[r][r];
        double[] column = new double[r];
        double[] residuals = new double[w.length];
        double sumLog = 0;
        double ssq = 0;

        for (int k = 0; k < w.length; k++) {
            double f = p[0][0];
            if (!(f > 0) || !Double.isFinite(f)) {
                throw new NumericalException("prediction variance " + f + " at step " + k);
            }
            double v = w[k] - a[0];
            sumLog += Math.log(f);
            ssq += v * v / f;
            residuals[k] = v / Math.sqrt(f);

            // update
            for (int i = 0; i < r; i++) column[i] = p[i][0];
            for (int i = 0; i < r; i++) {
                a[i] += column[i] * v / f;
                for (int j = 0; j < r; j++) p[i][j] -= column[i] * column[j] / f;
            }

            // predict: a = T a, P = T P T' + R R'
            double a0 = a[0];
            for (int i = 0; i < r - 1; i++) a[i] = t[i] * a0 + a[i + 1];
            a[r - 1] = t[r - 1] * a0;
            for (int i = 0; i < r; i++) {
                for (int j = 0; j < r; j++) {
                    m[i][j] = t[i] * p[0][j] + (i + 1 < r ? p[i + 1][j] : 0);
                }
            }
            for (int i = 0; i < r; i++) {
                for (int j = 0; j < r; j++) {
                    p[i][j] = m[i][0] * t[j] + (j + 1 < r ? m[i][j + 1] : 0) + rv[i] * rv[j];
                }
            }
        }
        return new Filtered(w.length, sumLog, ssq, residuals);
    }

    /** Solve P = T P T' + R R' by doubling: P ← P + A P A', A ← A². */
    private static double[][] stationaryCovariance(double[] t, double[] rv) {
        int r = t.length;
        double[][] transition = new double[r][r];
        for (int i = 0; i < r; i++) {
            transition[i][0] = t[i];
            if (i + 1 < r) transition[i][i + 1] = 1;
        }
        RealMatrix a = MatrixUtils.createRealMatrix(transition);
        RealMatrix rm = MatrixUtils.createColumnRealMatrix(rv);
        RealMatrix p = rm.multiply(rm.transpose());
        for (int step = 0; step < MAX_DOUBLING_STEPS; step++) {
            RealMatrix increment = a.multiply(p).multiply(a.transpose());
            p = p.add(increment);
            double norm = increment.getNorm();
            if (!Double.isFinite(norm)) break;
            if (norm <= 1e-13 * p.getNorm()) return p.getData();
            a = a.multiply(a);
        }
        throw new NumericalException("state covariance did not converge; AR part is not stationary");
    }

    /** Output of one Kalman filter pass. */
    static final class Filtered {
        private final int n;
        private final double sumLogF;
        private final double ssq;
        private final double[] residuals;

        Filtered(int n, double sumLogF, double ssq, double[] residuals) {
            this.n = n;
            this.sumLogF = sumLogF;
            this.ssq = ssq;
            this.residuals = residuals;
        }

        double sigma2() {
            return ssq / n;
        }

        /** Objective minimized by the optimizer: 0.5·(log σ̂² + Σ log F / n). */
        double concentrated() {
            return 0.5 * (Math.log(sigma2()) + sumLogF / n);
        }

        double logLikelihood() {
            return -0.5 * (n * (Math.log(2 * Math.PI * sigma2()) + 1) + sumLogF);
        }

        /** Standardized innovations v_t / √F_t, with variance σ². */
        double[] residuals() {
            return residuals.clone();
        }
    }

    @Override
    public String toString() {
        return order + " ar=" + Arrays.toString(ar) + " ma=" + Arrays.toString(ma)
            + " sar=" + Arrays.toString(seasonalAr) + " sma=" + Arrays.toString(seasonalMa);
    }
}
