package traffic.ml;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive SARIMA prediction on the transformed scale, then the inverse transform.
 * <p>
 * The point forecast runs the fully integrated operator φ(B)Φ(B^s)(1-B)^d(1-B^s)^D forward,
 * seeded by the last observations and residuals, with future innovations set to zero.
 * Standard errors come from the ψ-weights: Var(h) = σ² Σ_{j&lt;h} ψ_j².
 */
public class Forecaster {

    private static final Logger log = LoggerFactory.getLogger(Forecaster.class);

    private final double intervalMultiplier;

    public Forecaster(double intervalMultiplier) {
        if (!(intervalMultiplier > 0)) throw new IllegalArgumentException("intervalMultiplier must be > 0");
        this.intervalMultiplier = intervalMultiplier;
    }

    public Forecaster() {
        this(2.0);
    }

    /**
     * @throws IllegalStateException when the model did not pass diagnostics
     * @throws DomainException       when a bound falls where the transform cannot be inverted
     */
    public Forecast forecast(DiagnosticsEngine.Report report, int horizon, TransformSpec transform) {
        if (!report.isPassed()) {
            throw new IllegalStateException(report.getModel().getOrder() + " failed diagnostics: "
                + report.failedGatingChecks());
        }
        return project(report.getModel(), horizon, transform);
    }

    Forecast project(FittedModel model, int horizon, TransformSpec transform) {
        if (horizon < 1) throw new IllegalArgumentException("horizon must be >= 1");
        Sarima sarima = model.sarima();
        double[] phi = sarima.integratedArCoefficients();
        double[] theta = sarima.getTheta();
        double[] history = model.getTraining().values();
        ResidualSet residuals = model.residuals();
        int n = history.length;

        double[] y = new double[n + horizon];
        double[] e = new double[n + horizon];
        System.arraycopy(history, 0, y, 0, n);
        for (int t = 0; t < n; t++) e[t] = residuals.has(t) ? residuals.get(t) : 0;

        for (int t = n; t < n + horizon; t++) {
            double pred = 0;
            for (int i = 1; i <= phi.length && t - i >= 0; i++) pred += phi[i - 1] * y[t - i];
            for (int j = 1; j <= theta.length && t - j >= 0; j++) pred += theta[j - 1] * e[t - j];
            y[t] = pred;
        }

        double[] psi = psiWeights(phi, theta, horizon);
        List<Forecast.Point> points = new ArrayList<>(horizon);
        double cumulative = 0;
        for (int h = 1; h <= horizon; h++) {
            cumulative += psi[h - 1] * psi[h - 1];
            double se = Math.sqrt(model.getSigma2() * cumulative);
            double mean = y[n + h - 1];
            double lower = mean - intervalMultiplier * se;
            double upper = mean + intervalMultiplier * se;
            points.add(new Forecast.Point(h, mean, se, lower, upper,
                transform.inverse(mean), transform.inverse(lower), transform.inverse(upper)));
        }
        log.info("Forecast {} steps with {}: {}", horizon, model.getOrder(), points);
        return new Forecast(model.getOrder(), transform, intervalMultiplier, points);
    }

    /** ψ_0 = 1, ψ_j = θ_j + Σ_{i=1}^{min(j,p)} φ_i ψ_{j-i}. */
    static double[] psiWeights(double[] phi, double[] theta, int count) {
        double[] psi = new double[count];
        psi[0] = 1;
        for (int j = 1; j < count; j++) {
            double v = j <= theta.length ? theta[j - 1] : 0;
            for (int i = 1; i <= Math.min(j, phi.length); i++) v += phi[i - 1] * psi[j - i];
            psi[j] = v;
        }
        return psi;
    }
}
