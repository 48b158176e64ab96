package traffic.ml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered (lag, order) differencing steps, applied first to last.
 */
public final class DifferencingSpec {

    public static final class Step {
        private final int lag;
        private final int order;

        public Step(int lag, int order) {
            if (lag < 1 || order < 1) throw new IllegalArgumentException("lag and order must be >= 1");
            this.lag = lag;
            this.order = order;
        }

        public int getLag() { return lag; }
        public int getOrder() { return order; }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Step)) return false;
            Step s = (Step) o;
            return lag == s.lag && order == s.order;
        }

        @Override
        public int hashCode() {
            return Objects.hash(lag, order);
        }

        @Override
        public String toString() {
            return "(lag=" + lag + ", order=" + order + ")";
        }
    }

    private final List<Step> steps;

    private DifferencingSpec(List<Step> steps) {
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
    }

    public static DifferencingSpec of(List<Step> steps) {
        return new DifferencingSpec(steps);
    }

    /** Seasonal difference once, then a lag-1 difference once. */
    public static DifferencingSpec seasonalThenTrend(int seasonalPeriod) {
        List<Step> steps = new ArrayList<>();
        steps.add(new Step(seasonalPeriod, 1));
        steps.add(new Step(1, 1));
        return new DifferencingSpec(steps);
    }

    public List<Step> getSteps() { return steps; }

    /** Total observations consumed. */
    public int totalLag() {
        int total = 0;
        for (Step s : steps) total += s.lag * s.order;
        return total;
    }

    /** Non-seasonal differencing order d (sum of lag-1 orders). */
    public int trendOrder() {
        int d = 0;
        for (Step s : steps) if (s.lag == 1) d += s.order;
        return d;
    }

    /** Seasonal differencing order D at the given period. */
    public int seasonalOrder(int seasonalPeriod) {
        int d = 0;
        for (Step s : steps) if (s.lag == seasonalPeriod && seasonalPeriod > 1) d += s.order;
        return d;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DifferencingSpec && steps.equals(((DifferencingSpec) o).steps);
    }

    @Override
    public int hashCode() {
        return steps.hashCode();
    }

    @Override
    public String toString() {
        return steps.toString();
    }
}
