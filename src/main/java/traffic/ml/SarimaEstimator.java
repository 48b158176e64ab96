package traffic.ml;

import java.time.Duration;
import java.util.Arrays;
import java.util.function.ToDoubleFunction;

import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimpleBounds;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.BOBYQAOptimizer;
import org.apache.commons.math3.optim.univariate.BrentOptimizer;
import org.apache.commons.math3.optim.univariate.SearchInterval;
import org.apache.commons.math3.optim.univariate.UnivariateObjectiveFunction;
import org.apache.commons.math3.optim.univariate.UnivariatePointValuePair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maximum-likelihood SARIMA estimation (CSS-ML).
 * <p>
 * Conditional sum of squares supplies starting values, the exact Kalman-filter likelihood is
 * then maximized over the free coefficients. Masked coefficients stay at zero. The fitted AR
 * operator must be stationary and the MA operator invertible.
 */
public class SarimaEstimator implements CandidateEstimator {

    private static final Logger log = LoggerFactory.getLogger(SarimaEstimator.class);

    private static final double COEFFICIENT_BOUND = 2.0;
    private static final double PENALTY = 1e10;
    private static final double HESSIAN_STEP = 1e-4;

    private final int maxEvaluations;
    private final Duration timeout;

    /**
     * @param maxEvaluations objective evaluations allowed per optimizer run
     * @param timeout        wall-clock budget per candidate
     */
    public SarimaEstimator(int maxEvaluations, Duration timeout) {
        if (maxEvaluations < 10) throw new IllegalArgumentException("maxEvaluations must be >= 10");
        this.maxEvaluations = maxEvaluations;
        this.timeout = timeout;
    }

    public SarimaEstimator() {
        this(5000, Duration.ofSeconds(60));
    }

    @Override
    public FittedModel fit(Series training, SarimaOrder order) {
        long deadline = System.nanoTime() + timeout.toNanos();
        double[] z = Differencing.difference(training.values(), order.getD(), order.getSeasonalD(),
            order.getSeasonLength());
        int free = order.freeCoefficientCount();
        int arDegree = order.getP() + order.getSeasonLength() * order.getSeasonalP();
        if (z.length - arDegree < free + 3) {
            throw new InsufficientDataException(order + " needs at least " + (arDegree + free + 3)
                + " observations after differencing, got " + z.length);
        }

        double[] start = new double[free];
        double[] css = free == 0 ? start : minimize(x -> {
            checkDeadline(deadline, order);
            double v = Sarima.fromFree(order, x).conditionalSumOfSquares(z);
            return Double.isFinite(v) ? v : PENALTY;
        }, start, order, "CSS");

        double[] mlStart = admissible(order, clamp(css));
        if (!Arrays.equals(mlStart, clamp(css))) {
            log.debug("{} CSS start {} moved into the stationary and invertible region", order, Arrays.toString(css));
        }
        log.debug("{} ML start {}", order, Arrays.toString(mlStart));

        double[] ml = free == 0 ? css : minimize(x -> {
            checkDeadline(deadline, order);
            Sarima m = Sarima.fromFree(order, reflectMa(order, x));
            if (!m.isStationary() || !m.isInvertible()) return PENALTY;
            try {
                double v = m.filter(z).concentrated();
                return Double.isFinite(v) ? v : PENALTY;
            } catch (NumericalException e) {
                return PENALTY;
            }
        }, mlStart, order, "ML");
        ml = reflectMa(order, ml);

        Sarima model = Sarima.fromFree(order, ml);
        checkRoots(model);
        Sarima.Filtered filtered;
        try {
            filtered = model.filter(z);
        } catch (NumericalException e) {
            throw new ConvergenceException(order + ": likelihood undefined at the optimum: " + e.getMessage(), e);
        }
        if (!(filtered.sigma2() > 0)) {
            throw new ConvergenceException(order + ": degenerate innovation variance " + filtered.sigma2());
        }

        double[] freeErrors = standardErrors(ml, z, order);
        double[] errors = new double[order.coefficientCount()];
        Arrays.fill(errors, Double.NaN);
        int[] idx = order.freeIndices();
        for (int i = 0; i < idx.length; i++) errors[idx[i]] = freeErrors[i];

        FittedModel fitted = new FittedModel(order, Sarima.expand(order, ml), errors, filtered.logLikelihood(),
            filtered.sigma2(), z.length, training, model.arMinRootModulus(), model.maMinRootModulus());
        log.debug("Fitted {}", fitted);
        return fitted;
    }

    /**
     * @throws NonStationaryFitException when an AR factor has a root inside or on the unit circle
     * @throws NonInvertibleFitException when an MA factor has a root inside or on the unit circle
     */
    static void checkRoots(Sarima model) {
        CoefficientMask.Kind ar = model.nonStationaryFactor();
        if (ar != null) {
            throw new NonStationaryFitException(String.format(
                "%s: %s factor %s is not stationary, min root modulus %.6f (must exceed 1)", model.getOrder(),
                ar.getPrefix(), Arrays.toString(model.factor(ar)), model.factorMinRootModulus(ar)));
        }
        CoefficientMask.Kind ma = model.nonInvertibleFactor();
        if (ma != null) {
            throw new NonInvertibleFitException(String.format(
                "%s: %s factor %s is not invertible, min root modulus %.6f (must exceed 1)", model.getOrder(),
                ma.getPrefix(), Arrays.toString(model.factor(ma)), model.factorMinRootModulus(ma)));
        }
    }

    /**
     * Reflects the MA roots inside the unit circle of every MA factor with no masked coefficient.
     * Factors with masked coefficients are left alone, since reflection would fill the masked lags.
     */
    static double[] reflectMa(SarimaOrder order, double[] free) {
        double[] full = Sarima.expand(order, free);
        boolean[] isFree = freePositions(order);
        int p = order.getP();
        int q = order.getQ();
        reflect(full, isFree, p, q);
        reflect(full, isFree, p + q + order.getSeasonalP(), order.getSeasonalQ());
        return collapse(order, full);
    }

    private static void reflect(double[] full, boolean[] isFree, int from, int count) {
        if (count == 0) return;
        for (int i = from; i < from + count; i++) {
            if (!isFree[i]) return;
        }
        double[] inverted = Polynomials.invertMa(Arrays.copyOfRange(full, from, from + count));
        System.arraycopy(inverted, 0, full, from, count);
    }

    /** Shrinks every factor of a starting point into the stationary and invertible region. */
    static double[] admissible(SarimaOrder order, double[] free) {
        double[] full = Sarima.expand(order, free);
        int p = order.getP();
        int q = order.getQ();
        int sp = order.getSeasonalP();
        int sq = order.getSeasonalQ();
        replace(full, 0, Polynomials.shrinkToStationary(Arrays.copyOfRange(full, 0, p)));
        replace(full, p, Polynomials.shrinkToInvertible(Arrays.copyOfRange(full, p, p + q)));
        replace(full, p + q, Polynomials.shrinkToStationary(Arrays.copyOfRange(full, p + q, p + q + sp)));
        replace(full, p + q + sp, Polynomials.shrinkToInvertible(Arrays.copyOfRange(full, p + q + sp, p + q + sp + sq)));
        return collapse(order, full);
    }

    private static void replace(double[] full, int from, double[] block) {
        System.arraycopy(block, 0, full, from, block.length);
    }

    private static boolean[] freePositions(SarimaOrder order) {
        boolean[] isFree = new boolean[order.coefficientCount()];
        for (int i : order.freeIndices()) isFree[i] = true;
        return isFree;
    }

    private static double[] collapse(SarimaOrder order, double[] full) {
        int[] idx = order.freeIndices();
        double[] free = new double[idx.length];
        for (int i = 0; i < idx.length; i++) free[i] = full[idx[i]];
        return free;
    }

    private double[] minimize(ToDoubleFunction<double[]> objective, double[] start, SarimaOrder order,
                              String stage) {
        try {
            if (start.length == 1) {
                BrentOptimizer brent = new BrentOptimizer(1e-10, 1e-12);
                UnivariatePointValuePair result = brent.optimize(
                    new MaxEval(maxEvaluations),
                    new UnivariateObjectiveFunction(x -> objective.applyAsDouble(new double[] {x})),
                    GoalType.MINIMIZE,
                    // a lone AR or MA coefficient is admissible only inside (-1, 1)
                    new SearchInterval(-1, 1, Math.max(-0.99, Math.min(0.99, start[0]))));
                if (result.getValue() >= PENALTY) {
                    throw new ConvergenceException(order + ": " + stage + " found no admissible point");
                }
                return new double[] {result.getPoint()};
            }
            double[] lower = new double[start.length];
            double[] upper = new double[start.length];
            Arrays.fill(lower, -COEFFICIENT_BOUND);
            Arrays.fill(upper, COEFFICIENT_BOUND);
            BOBYQAOptimizer opt = new BOBYQAOptimizer(2 * start.length + 1, 0.1, 1e-6);
            PointValuePair result = opt.optimize(
                new MaxEval(maxEvaluations),
                new ObjectiveFunction(objective::applyAsDouble),
                GoalType.MINIMIZE,
                new InitialGuess(clamp(start)),
                new SimpleBounds(lower, upper));
            if (result.getValue() >= PENALTY) {
                throw new ConvergenceException(order + ": " + stage + " found no admissible point");
            }
            return result.getPoint();
        } catch (TooManyEvaluationsException e) {
            throw new ConvergenceException(order + ": " + stage + " exceeded " + maxEvaluations + " evaluations", e);
        } catch (MathIllegalStateException e) {
            throw new ConvergenceException(order + ": " + stage + " optimizer failed: " + e.getMessage(), e);
        }
    }

    private void checkDeadline(long deadline, SarimaOrder order) {
        if (System.nanoTime() > deadline) {
            throw new ConvergenceException(order + ": timed out after " + timeout.toMillis() + " ms");
        }
    }

    private static double[] clamp(double[] x) {
        double[] out = x.clone();
        for (int i = 0; i < out.length; i++) {
            out[i] = Math.max(-COEFFICIENT_BOUND + 1e-3, Math.min(COEFFICIENT_BOUND - 1e-3, out[i]));
        }
        return out;
    }

    /**
     * Square roots of the diagonal of the inverse numerical Hessian of -logL; NaN where the
     * Hessian cannot be formed or inverted.
     */
    private static double[] standardErrors(double[] x, double[] z, SarimaOrder order) {
        int k = x.length;
        double[] out = new double[k];
        Arrays.fill(out, Double.NaN);
        if (k == 0) return out;
        ToDoubleFunction<double[]> f = v -> -Sarima.fromFree(order, v).filter(z).logLikelihood();
        try {
            double f0 = f.applyAsDouble(x);
            double[][] h = new double[k][k];
            for (int i = 0; i < k; i++) {
                double hi = HESSIAN_STEP * Math.max(1, Math.abs(x[i]));
                h[i][i] = (f.applyAsDouble(shift(x, i, hi, -1, 0)) - 2 * f0
                    + f.applyAsDouble(shift(x, i, -hi, -1, 0))) / (hi * hi);
                for (int j = 0; j < i; j++) {
                    double hj = HESSIAN_STEP * Math.max(1, Math.abs(x[j]));
                    double v = (f.applyAsDouble(shift(x, i, hi, j, hj)) - f.applyAsDouble(shift(x, i, hi, j, -hj))
                        - f.applyAsDouble(shift(x, i, -hi, j, hj)) + f.applyAsDouble(shift(x, i, -hi, j, -hj)))
                        / (4 * hi * hj);
                    h[i][j] = v;
                    h[j][i] = v;
                }
            }
            RealMatrix inverse = new LUDecomposition(MatrixUtils.createRealMatrix(h)).getSolver().getInverse();
            for (int i = 0; i < k; i++) {
                double variance = inverse.getEntry(i, i);
                out[i] = variance > 0 ? Math.sqrt(variance) : Double.NaN;
            }
        } catch (NumericalException | SingularMatrixException e) {
            log.warn("{}: standard errors unavailable: {}", order, e.getMessage());
        }
        return out;
    }

    private static double[] shift(double[] x, int i, double di, int j, double dj) {
        double[] out = x.clone();
        out[i] += di;
        if (j >= 0) out[j] += dj;
        return out;
    }
}
