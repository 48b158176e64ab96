package traffic.ml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import traffic.ml.stats.ArOrderSelection;
import traffic.ml.stats.Portmanteau;
import traffic.ml.stats.ShapiroWilk;
import traffic.ml.stats.TestStatistic;

/**
 * Residual diagnostics for fitted models.
 * <p>
 * Gating checks: Ljung-Box and Box-Pierce on residuals (fitdf = estimated coefficients) and
 * McLeod-Li (Ljung-Box on squared residuals, fitdf = 0). Reported only: Shapiro-Wilk normality
 * and the AR order selected for the residuals (0 expected).
 */
public class DiagnosticsEngine {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticsEngine.class);

    static final String MCLEOD_LI = "McLeod-Li";
    static final String RESIDUAL_AR_ORDER = "Residual AR order";

    private final int lag;
    private final double significanceLevel;

    public DiagnosticsEngine(int lag, double significanceLevel) {
        if (lag < 1) throw new IllegalArgumentException("diagnostics lag must be >= 1");
        if (!(significanceLevel > 0 && significanceLevel < 1)) {
            throw new IllegalArgumentException("significance level must be in (0, 1)");
        }
        this.lag = lag;
        this.significanceLevel = significanceLevel;
    }

    public List<Report> diagnose(List<FittedModel> models) {
        List<Report> reports = new ArrayList<>(models.size());
        for (FittedModel model : models) reports.add(diagnose(model));
        return reports;
    }

    /**
     * @throws InsufficientDataException when the residuals are too short for the lag horizon or
     *                                   the lag leaves no degrees of freedom
     */
    public Report diagnose(FittedModel model) {
        ResidualSet residualSet = model.residuals();
        double[] residuals = residualSet.values();
        if (residuals.length <= lag) {
            throw new InsufficientDataException("diagnostics at lag " + lag + " need more than " + lag
                + " residuals, " + model.getOrder() + " has " + residuals.length);
        }
        int fitdf = model.getOrder().freeCoefficientCount();
        List<Check> checks = new ArrayList<>();
        checks.add(pValueCheck(ShapiroWilk.testRecent(residuals), false));
        checks.add(pValueCheck(Portmanteau.ljungBox(residuals, lag, fitdf), true));
        checks.add(pValueCheck(Portmanteau.boxPierce(residuals, lag, fitdf), true));
        TestStatistic mcLeodLi = Portmanteau.ljungBox(residualSet.squared(), lag, 0);
        checks.add(pValueCheck(new TestStatistic(MCLEOD_LI, mcLeodLi.getStatistic(), mcLeodLi.getPValue(),
            mcLeodLi.getDegreesOfFreedom()), true));

        ArOrderSelection ar = ArOrderSelection.select(residuals);
        boolean whiteNoise = ar.getSelectedOrder() == 0;
        checks.add(new Check(new TestStatistic(RESIDUAL_AR_ORDER, ar.getSelectedOrder(), Double.NaN, 0),
            whiteNoise, false, "selected order 0 of 0.." + ar.getMaxOrder()));

        Report report = new Report(model, checks);
        if (report.isPassed()) {
            log.info("{} passed diagnostics", model.getOrder());
        } else {
            for (Check c : report.failedGatingChecks()) {
                log.warn("{} failed {}: {}", model.getOrder(), c.getName(), c);
            }
        }
        return report;
    }

    private Check pValueCheck(TestStatistic statistic, boolean gating) {
        return new Check(statistic, !statistic.rejects(significanceLevel), gating,
            "p >= " + significanceLevel);
    }

    /** One test outcome with its pass rule. */
    public static final class Check {
        private final TestStatistic statistic;
        private final boolean passed;
        private final boolean gating;
        private final String threshold;

        Check(TestStatistic statistic, boolean passed, boolean gating, String threshold) {
            this.statistic = statistic;
            this.passed = passed;
            this.gating = gating;
            this.threshold = threshold;
        }

        public String getName() { return statistic.getName(); }
        public TestStatistic getStatistic() { return statistic; }
        public boolean isPassed() { return passed; }
        /** Whether failing this check disqualifies the model. */
        public boolean isGating() { return gating; }
        /** Pass condition, e.g. {@code p >= 0.05}. */
        public String getThreshold() { return threshold; }

        @Override
        public String toString() {
            return statistic + (passed ? " PASS" : " FAIL") + " (" + threshold + (gating ? "" : ", advisory") + ")";
        }
    }

    public static final class Report {
        private final FittedModel model;
        private final List<Check> checks;
        private final boolean passed;

        Report(FittedModel model, List<Check> checks) {
            this.model = model;
            this.checks = Collections.unmodifiableList(checks);
            boolean ok = true;
            for (Check c : checks) if (c.gating && !c.passed) ok = false;
            this.passed = ok;
        }

        public FittedModel getModel() { return model; }
        public List<Check> getChecks() { return checks; }
        public boolean isPassed() { return passed; }

        public List<Check> failedGatingChecks() {
            List<Check> failed = new ArrayList<>();
            for (Check c : checks) if (c.gating && !c.passed) failed.add(c);
            return failed;
        }

        public Check check(String name) {
            for (Check c : checks) if (c.getName().equals(name)) return c;
            throw new IllegalArgumentException("no check named " + name);
        }
    }
}
