package traffic.ml;

import java.io.Reader;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

/**
 * Run configuration. Immutable; build with {@link #builder()} or read from JSON with
 * {@link #fromJson(Reader)} (missing keys keep their defaults).
 */
public final class ForecastConfig {

    private final double lambdaLower;
    private final double lambdaUpper;
    private final double lambdaGridStep;
    private final double normalityTieTolerance;
    private final int seasonalPeriod;
    private final DifferencingSpec differencing;
    private final double minimumVarianceReduction;
    private final int analysisLag;
    private final List<SarimaOrder> candidateOrders;
    private final int maxNonSeasonalOrder;
    private final int maxSeasonalOrder;
    private final double significanceLevel;
    private final int diagnosticsLag;
    private final int forecastHorizon;
    private final double intervalMultiplier;
    private final int maxEvaluations;
    private final Duration candidateTimeout;
    private final int threads;

    private ForecastConfig(Builder b) {
        if (!(b.lambdaLower < b.lambdaUpper)) throw new IllegalArgumentException("transform range must be increasing");
        if (b.seasonalPeriod < 2) throw new IllegalArgumentException("seasonalPeriod must be >= 2");
        if (!(b.significanceLevel > 0 && b.significanceLevel < 1)) {
            throw new IllegalArgumentException("significanceLevel must be in (0, 1)");
        }
        if (b.forecastHorizon < 1) throw new IllegalArgumentException("forecastHorizon must be >= 1");
        if (b.diagnosticsLag < 1) throw new IllegalArgumentException("diagnosticsLag must be >= 1");
        if (b.analysisLag < 1) throw new IllegalArgumentException("analysisLag must be >= 1");
        if (b.threads < 1) throw new IllegalArgumentException("threads must be >= 1");
        this.lambdaLower = b.lambdaLower;
        this.lambdaUpper = b.lambdaUpper;
        this.lambdaGridStep = b.lambdaGridStep;
        this.normalityTieTolerance = b.normalityTieTolerance;
        this.seasonalPeriod = b.seasonalPeriod;
        this.differencing = b.differencing != null ? b.differencing : DifferencingSpec.seasonalThenTrend(b.seasonalPeriod);
        this.minimumVarianceReduction = b.minimumVarianceReduction;
        this.analysisLag = b.analysisLag;
        this.candidateOrders = Collections.unmodifiableList(new ArrayList<>(b.candidateOrders));
        this.maxNonSeasonalOrder = b.maxNonSeasonalOrder;
        this.maxSeasonalOrder = b.maxSeasonalOrder;
        this.significanceLevel = b.significanceLevel;
        this.diagnosticsLag = b.diagnosticsLag;
        this.forecastHorizon = b.forecastHorizon;
        this.intervalMultiplier = b.intervalMultiplier;
        this.maxEvaluations = b.maxEvaluations;
        this.candidateTimeout = b.candidateTimeout;
        this.threads = b.threads;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ForecastConfig defaults() {
        return builder().build();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.lambdaLower = lambdaLower;
        b.lambdaUpper = lambdaUpper;
        b.lambdaGridStep = lambdaGridStep;
        b.normalityTieTolerance = normalityTieTolerance;
        b.seasonalPeriod = seasonalPeriod;
        b.differencing = differencing;
        b.minimumVarianceReduction = minimumVarianceReduction;
        b.analysisLag = analysisLag;
        b.candidateOrders = new ArrayList<>(candidateOrders);
        b.maxNonSeasonalOrder = maxNonSeasonalOrder;
        b.maxSeasonalOrder = maxSeasonalOrder;
        b.significanceLevel = significanceLevel;
        b.diagnosticsLag = diagnosticsLag;
        b.forecastHorizon = forecastHorizon;
        b.intervalMultiplier = intervalMultiplier;
        b.maxEvaluations = maxEvaluations;
        b.candidateTimeout = candidateTimeout;
        b.threads = threads;
        return b;
    }

    public double getLambdaLower() { return lambdaLower; }
    public double getLambdaUpper() { return lambdaUpper; }
    public double getLambdaGridStep() { return lambdaGridStep; }
    public double getNormalityTieTolerance() { return normalityTieTolerance; }
    public int getSeasonalPeriod() { return seasonalPeriod; }
    public DifferencingSpec getDifferencing() { return differencing; }
    public double getMinimumVarianceReduction() { return minimumVarianceReduction; }
    /** Largest ACF lag examined; differencing must leave more observations than this. */
    public int getAnalysisLag() { return analysisLag; }
    /** Empty when candidates are to be generated from ACF/PACF spikes. */
    public List<SarimaOrder> getCandidateOrders() { return candidateOrders; }
    public int getMaxNonSeasonalOrder() { return maxNonSeasonalOrder; }
    public int getMaxSeasonalOrder() { return maxSeasonalOrder; }
    public double getSignificanceLevel() { return significanceLevel; }
    public int getDiagnosticsLag() { return diagnosticsLag; }
    public int getForecastHorizon() { return forecastHorizon; }
    public double getIntervalMultiplier() { return intervalMultiplier; }
    public int getMaxEvaluations() { return maxEvaluations; }
    public Duration getCandidateTimeout() { return candidateTimeout; }
    public int getThreads() { return threads; }

    public static final class Builder {
        private double lambdaLower = -2;
        private double lambdaUpper = 2;
        private double lambdaGridStep = 0.01;
        private double normalityTieTolerance = 0;
        private int seasonalPeriod = 7;
        private DifferencingSpec differencing;
        private double minimumVarianceReduction = 0;
        private int analysisLag = 100;
        private List<SarimaOrder> candidateOrders = new ArrayList<>();
        private int maxNonSeasonalOrder = 2;
        private int maxSeasonalOrder = 2;
        private double significanceLevel = 0.05;
        private int diagnosticsLag = 18;
        private int forecastHorizon = 14;
        private double intervalMultiplier = 2;
        private int maxEvaluations = 5000;
        private Duration candidateTimeout = Duration.ofSeconds(60);
        private int threads = Runtime.getRuntime().availableProcessors();

        private Builder() {
        }

        public Builder transformSearchRange(double lower, double upper) {
            this.lambdaLower = lower;
            this.lambdaUpper = upper;
            return this;
        }

        public Builder lambdaGridStep(double step) { this.lambdaGridStep = step; return this; }
        public Builder normalityTieTolerance(double tolerance) { this.normalityTieTolerance = tolerance; return this; }
        public Builder seasonalPeriod(int period) { this.seasonalPeriod = period; return this; }
        /** Defaults to one seasonal difference followed by one lag-1 difference. */
        public Builder differencing(DifferencingSpec spec) { this.differencing = spec; return this; }
        public Builder minimumVarianceReduction(double ratio) { this.minimumVarianceReduction = ratio; return this; }
        public Builder analysisLag(int lag) { this.analysisLag = lag; return this; }

        public Builder candidateOrders(List<SarimaOrder> orders) {
            this.candidateOrders = new ArrayList<>(orders);
            return this;
        }

        public Builder maxNonSeasonalOrder(int order) { this.maxNonSeasonalOrder = order; return this; }
        public Builder maxSeasonalOrder(int order) { this.maxSeasonalOrder = order; return this; }
        public Builder significanceLevel(double level) { this.significanceLevel = level; return this; }
        public Builder diagnosticsLag(int lag) { this.diagnosticsLag = lag; return this; }
        public Builder forecastHorizon(int horizon) { this.forecastHorizon = horizon; return this; }
        public Builder intervalMultiplier(double multiplier) { this.intervalMultiplier = multiplier; return this; }
        public Builder maxEvaluations(int evaluations) { this.maxEvaluations = evaluations; return this; }
        public Builder candidateTimeout(Duration timeout) { this.candidateTimeout = timeout; return this; }
        public Builder threads(int threads) { this.threads = threads; return this; }

        public ForecastConfig build() {
            return new ForecastConfig(this);
        }
    }

    /**
     * Read a configuration document such as
     * <pre>
     * {"seasonalPeriod": 7, "forecastHorizon": 14,
     *  "candidateOrders": [{"p":1,"d":1,"q":1,"P":0,"D":1,"Q":2,"s":7,"fixed":["ma1"]}]}
     * </pre>
     *
     * @throws IllegalArgumentException on malformed JSON or invalid values
     */
    public static ForecastConfig fromJson(Reader reader) {
        Document doc;
        try {
            doc = new Gson().fromJson(reader, Document.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("invalid configuration JSON: " + e.getMessage(), e);
        }
        return doc == null ? defaults() : doc.apply(builder()).build();
    }

    /** JSON shape of a configuration; null fields keep builder defaults. */
    static final class Document {
        double[] transformSearchRange;
        Double lambdaGridStep;
        Double normalityTieTolerance;
        Integer seasonalPeriod;
        List<StepDocument> differencing;
        Double minimumVarianceReduction;
        Integer analysisLag;
        List<OrderDocument> candidateOrders;
        Integer maxNonSeasonalOrder;
        Integer maxSeasonalOrder;
        Double significanceLevel;
        Integer diagnosticsLag;
        Integer forecastHorizon;
        Double intervalMultiplier;
        Integer maxEvaluations;
        Long candidateTimeoutSeconds;
        Integer threads;

        Builder apply(Builder b) {
            if (transformSearchRange != null) {
                if (transformSearchRange.length != 2) {
                    throw new IllegalArgumentException("transformSearchRange must have two values");
                }
                b.transformSearchRange(transformSearchRange[0], transformSearchRange[1]);
            }
            if (lambdaGridStep != null) b.lambdaGridStep(lambdaGridStep);
            if (normalityTieTolerance != null) b.normalityTieTolerance(normalityTieTolerance);
            if (seasonalPeriod != null) b.seasonalPeriod(seasonalPeriod);
            if (differencing != null) {
                List<DifferencingSpec.Step> steps = new ArrayList<>();
                for (StepDocument s : differencing) steps.add(new DifferencingSpec.Step(s.lag, s.order));
                b.differencing(DifferencingSpec.of(steps));
            }
            if (minimumVarianceReduction != null) b.minimumVarianceReduction(minimumVarianceReduction);
            if (analysisLag != null) b.analysisLag(analysisLag);
            if (candidateOrders != null) {
                List<SarimaOrder> orders = new ArrayList<>();
                for (OrderDocument o : candidateOrders) orders.add(o.toOrder());
                b.candidateOrders(orders);
            }
            if (maxNonSeasonalOrder != null) b.maxNonSeasonalOrder(maxNonSeasonalOrder);
            if (maxSeasonalOrder != null) b.maxSeasonalOrder(maxSeasonalOrder);
            if (significanceLevel != null) b.significanceLevel(significanceLevel);
            if (diagnosticsLag != null) b.diagnosticsLag(diagnosticsLag);
            if (forecastHorizon != null) b.forecastHorizon(forecastHorizon);
            if (intervalMultiplier != null) b.intervalMultiplier(intervalMultiplier);
            if (maxEvaluations != null) b.maxEvaluations(maxEvaluations);
            if (candidateTimeoutSeconds != null) b.candidateTimeout(Duration.ofSeconds(candidateTimeoutSeconds));
            if (threads != null) b.threads(threads);
            return b;
        }
    }

    static final class StepDocument {
        int lag;
        int order = 1;
    }

    static final class OrderDocument {
        int p, d, q, P, D, Q, s;
        List<String> fixed;

        SarimaOrder toOrder() {
            CoefficientMask mask = fixed == null || fixed.isEmpty()
                ? CoefficientMask.none()
                : CoefficientMask.ofLabels(fixed.toArray(new String[0]));
            return new SarimaOrder(p, d, q, P, D, Q, s, mask);
        }
    }
}
