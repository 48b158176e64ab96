package traffic.ml;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies a {@link DifferencingSpec} step by step, recording the variance after each
 * difference so over-differencing can be spotted.
 */
public class StationarityReducer {

    private static final Logger log = LoggerFactory.getLogger(StationarityReducer.class);

    private final int minimumLength;
    private final double minimumVarianceReduction;

    /**
     * @param minimumLength            observations that must remain after all differencing
     * @param minimumVarianceReduction a step that shrinks variance by less than this fraction
     *                                 (or grows it) counts as over-differencing
     */
    public StationarityReducer(int minimumLength, double minimumVarianceReduction) {
        if (minimumLength < 1) throw new IllegalArgumentException("minimumLength must be >= 1");
        this.minimumLength = minimumLength;
        this.minimumVarianceReduction = minimumVarianceReduction;
    }

    public StationarityReducer() {
        this(1, 0.0);
    }

    public Result reduce(Series series, DifferencingSpec spec) {
        int remaining = series.length() - spec.totalLag();
        if (remaining < minimumLength) {
            throw new InsufficientDataException(String.format(
                "differencing %s leaves %d of %d observations, at least %d required",
                spec, Math.max(remaining, 0), series.length(), minimumLength));
        }
        List<Integer> lags = new ArrayList<>();
        List<Double> variances = new ArrayList<>();
        variances.add(series.variance());
        Series current = series;
        for (DifferencingSpec.Step step : spec.getSteps()) {
            for (int i = 0; i < step.getOrder(); i++) {
                current = Differencing.diff(current, step.getLag());
                lags.add(step.getLag());
                variances.add(current.variance());
            }
        }
        VarianceTrace trace = new VarianceTrace(lags, variances);
        trace.firstOverdifferencedStep(minimumVarianceReduction).ifPresent(step -> log.warn(
            "Possible over-differencing at step {} (lag {}): variance {} -> {}",
            step + 1, trace.getLags().get(step), trace.varianceBefore(step), trace.varianceAfter(step)));
        log.info("Differenced {} -> {} observations, variance trace {}", series.length(), current.length(),
            trace.getVariances());
        return new Result(current, spec, trace);
    }

    public static final class Result {
        private final Series stationary;
        private final DifferencingSpec spec;
        private final VarianceTrace trace;

        Result(Series stationary, DifferencingSpec spec, VarianceTrace trace) {
            this.stationary = stationary;
            this.spec = spec;
            this.trace = trace;
        }

        public Series getStationary() { return stationary; }
        public DifferencingSpec getSpec() { return spec; }
        public VarianceTrace getTrace() { return trace; }
    }

    /**
     * Variance before any differencing followed by the variance after each individual
     * difference (an order-2 step contributes two entries).
     */
    public static final class VarianceTrace {
        private final List<Integer> lags;
        private final List<Double> variances;

        VarianceTrace(List<Integer> lags, List<Double> variances) {
            this.lags = Collections.unmodifiableList(lags);
            this.variances = Collections.unmodifiableList(variances);
        }

        public List<Integer> getLags() { return lags; }
        public List<Double> getVariances() { return variances; }

        public double varianceBefore(int step) {
            return variances.get(step);
        }

        public double varianceAfter(int step) {
            return variances.get(step + 1);
        }

        /** Index of the first difference that failed to cut variance by the given fraction. */
        public OptionalInt firstOverdifferencedStep(double minimumReduction) {
            for (int i = 0; i < lags.size(); i++) {
                double before = varianceBefore(i);
                double after = varianceAfter(i);
                if (Double.isNaN(before) || Double.isNaN(after)) continue;
                if (after > before * (1 - minimumReduction)) return OptionalInt.of(i);
            }
            return OptionalInt.empty();
        }

        @Override
        public String toString() {
            return "VarianceTrace" + Arrays.toString(variances.toArray());
        }
    }
}
