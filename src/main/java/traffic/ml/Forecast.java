package traffic.ml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * n-step-ahead forecast: transformed-scale mean, standard error and bounds, plus the same
 * mean and bounds mapped back to the original scale.
 */
public final class Forecast {

    public static final class Point {
        private final int step;
        private final double mean;
        private final double standardError;
        private final double lower;
        private final double upper;
        private final double originalMean;
        private final double originalLower;
        private final double originalUpper;

        Point(int step, double mean, double standardError, double lower, double upper,
              double originalMean, double originalLower, double originalUpper) {
            this.step = step;
            this.mean = mean;
            this.standardError = standardError;
            this.lower = lower;
            this.upper = upper;
            this.originalMean = originalMean;
            this.originalLower = originalLower;
            this.originalUpper = originalUpper;
        }

        /** 1-based step beyond the end of the fitting series. */
        public int getStep() { return step; }
        public double getMean() { return mean; }
        public double getStandardError() { return standardError; }
        public double getLower() { return lower; }
        public double getUpper() { return upper; }
        public double getOriginalMean() { return originalMean; }
        public double getOriginalLower() { return originalLower; }
        public double getOriginalUpper() { return originalUpper; }

        @Override
        public String toString() {
            return String.format("h=%d %.2f [%.2f, %.2f]", step, originalMean, originalLower, originalUpper);
        }
    }

    private final SarimaOrder order;
    private final TransformSpec transform;
    private final double intervalMultiplier;
    private final List<Point> points;

    Forecast(SarimaOrder order, TransformSpec transform, double intervalMultiplier, List<Point> points) {
        this.order = order;
        this.transform = transform;
        this.intervalMultiplier = intervalMultiplier;
        this.points = Collections.unmodifiableList(new ArrayList<>(points));
    }

    public SarimaOrder getOrder() { return order; }
    public TransformSpec getTransform() { return transform; }
    /** Bounds are mean ± this many standard errors on the transformed scale. */
    public double getIntervalMultiplier() { return intervalMultiplier; }
    public List<Point> getPoints() { return points; }

    public int horizon() {
        return points.size();
    }

    public double[] originalMeans() {
        double[] out = new double[points.size()];
        for (int i = 0; i < out.length; i++) out[i] = points.get(i).originalMean;
        return out;
    }
}
