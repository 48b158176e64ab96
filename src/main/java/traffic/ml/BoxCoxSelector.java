package traffic.ml;

import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.univariate.BrentOptimizer;
import org.apache.commons.math3.optim.univariate.SearchInterval;
import org.apache.commons.math3.optim.univariate.UnivariateObjectiveFunction;
import org.apache.commons.math3.optim.univariate.UnivariatePointValuePair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import traffic.ml.stats.ShapiroWilk;
import traffic.ml.stats.TestStatistic;

/**
 * Chooses a variance-stabilizing transform.
 * <p>
 * λ maximizes the Box-Cox profile log-likelihood of a linear-trend regression,
 * L(λ) = -n/2 · log(RSS(λ)/n) + (λ - 1) · Σ log y, searched on a grid and refined with Brent.
 * The power transform is then compared with the plain log transform by Shapiro-Wilk W: the
 * power transform wins unless its W trails the log transform's by more than the tie tolerance.
 */
public class BoxCoxSelector {

    private static final Logger log = LoggerFactory.getLogger(BoxCoxSelector.class);

    private final double lower;
    private final double upper;
    private final double gridStep;
    private final double tieTolerance;

    public BoxCoxSelector(double lower, double upper, double gridStep, double tieTolerance) {
        if (!(lower < upper)) throw new IllegalArgumentException("lambda range must satisfy lower < upper");
        if (!(gridStep > 0)) throw new IllegalArgumentException("gridStep must be > 0");
        if (tieTolerance < 0) throw new IllegalArgumentException("tieTolerance must be >= 0");
        this.lower = lower;
        this.upper = upper;
        this.gridStep = gridStep;
        this.tieTolerance = tieTolerance;
    }

    public BoxCoxSelector(double lower, double upper) {
        this(lower, upper, 0.01, 0.0);
    }

    /**
     * @throws DomainException    when any observation is zero or negative
     * @throws NumericalException when the series is constant or the profile likelihood has no
     *                            distinguishable optimum
     */
    public Selection select(Series training) {
        if (training.min() <= 0) {
            throw new DomainException("Box-Cox and log transforms need strictly positive data, minimum is "
                + training.min());
        }
        if (!(training.variance() > 0)) {
            throw new NumericalException("Box-Cox needs at least two distinct observations");
        }
        double[] y = training.values();
        double sumLog = 0;
        for (double v : y) sumLog += Math.log(v);
        final double logSum = sumLog;

        int steps = (int) Math.round((upper - lower) / gridStep);
        double bestLambda = lower;
        double best = Double.NEGATIVE_INFINITY;
        double worst = Double.POSITIVE_INFINITY;
        for (int i = 0; i <= steps; i++) {
            double lambda = Math.min(upper, lower + i * gridStep);
            double ll = profileLogLikelihood(y, logSum, lambda);
            if (!Double.isFinite(ll)) {
                throw new NumericalException("Box-Cox log-likelihood is not finite at lambda=" + lambda);
            }
            if (ll > best) {
                best = ll;
                bestLambda = lambda;
            }
            worst = Math.min(worst, ll);
        }
        if (best - worst <= 1e-9 * (1 + Math.abs(best))) {
            throw new NumericalException("Box-Cox log-likelihood is flat over [" + lower + ", " + upper + "]");
        }

        double lo = Math.max(lower, bestLambda - gridStep);
        double hi = Math.min(upper, bestLambda + gridStep);
        UnivariatePointValuePair refined = new BrentOptimizer(1e-10, 1e-12).optimize(
            new MaxEval(500),
            new UnivariateObjectiveFunction(lambda -> profileLogLikelihood(y, logSum, lambda)),
            GoalType.MAXIMIZE,
            new SearchInterval(lo, hi, bestLambda));
        double lambda = refined.getValue() >= best ? refined.getPoint() : bestLambda;

        TransformSpec power = TransformSpec.power(lambda);
        TransformSpec logSpec = TransformSpec.log();
        Series powerSeries = power.apply(training);
        Series logSeries = logSpec.apply(training);
        TestStatistic powerNormality = ShapiroWilk.testRecent(powerSeries.values());
        TestStatistic logNormality = ShapiroWilk.testRecent(logSeries.values());
        boolean preferPower = powerNormality.getStatistic() >= logNormality.getStatistic() - tieTolerance;
        TransformSpec chosen = preferPower ? power : logSpec;
        log.info("Box-Cox lambda={} (W={}), log (W={}) -> {}", String.format("%.4f", lambda),
            String.format("%.5f", powerNormality.getStatistic()), String.format("%.5f", logNormality.getStatistic()),
            chosen);
        return new Selection(chosen, lambda, Math.max(best, refined.getValue()),
            preferPower ? powerSeries : logSeries, powerNormality, logNormality);
    }

    static double profileLogLikelihood(double[] y, double sumLog, double lambda) {
        double[] z = new double[y.length];
        for (int i = 0; i < y.length; i++) {
            z[i] = lambda == 0 ? Math.log(y[i]) : (Math.pow(y[i], lambda) - 1) / lambda;
        }
        double rss = LinearRegression.onTime(z).getResidualSumOfSquares();
        return -0.5 * y.length * Math.log(rss / y.length) + (lambda - 1) * sumLog;
    }

    public static final class Selection {
        private final TransformSpec chosen;
        private final double powerLambda;
        private final double maxLogLikelihood;
        private final Series transformed;
        private final TestStatistic powerNormality;
        private final TestStatistic logNormality;

        Selection(TransformSpec chosen, double powerLambda, double maxLogLikelihood, Series transformed,
                  TestStatistic powerNormality, TestStatistic logNormality) {
            this.chosen = chosen;
            this.powerLambda = powerLambda;
            this.maxLogLikelihood = maxLogLikelihood;
            this.transformed = transformed;
            this.powerNormality = powerNormality;
            this.logNormality = logNormality;
        }

        public TransformSpec getChosen() { return chosen; }
        /** Profile-likelihood λ, whether or not the power transform was chosen. */
        public double getPowerLambda() { return powerLambda; }
        public double getMaxLogLikelihood() { return maxLogLikelihood; }
        /** Training series under the chosen transform. */
        public Series getTransformed() { return transformed; }
        public TestStatistic getPowerNormality() { return powerNormality; }
        public TestStatistic getLogNormality() { return logNormality; }
    }
}
