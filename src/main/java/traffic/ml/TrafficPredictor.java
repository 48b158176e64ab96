package traffic.ml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the forecasting pipeline on a partitioned traffic series: transform selection,
 * differencing, candidate search, residual diagnostics, forecast and back-test.
 */
public class TrafficPredictor {

    private static final Logger log = LoggerFactory.getLogger(TrafficPredictor.class);

    private final ForecastConfig config;
    private final CandidateEstimator estimator;

    public TrafficPredictor(ForecastConfig config, CandidateEstimator estimator) {
        this.config = config;
        this.estimator = estimator;
    }

    public TrafficPredictor(ForecastConfig config) {
        this(config, new SarimaEstimator(config.getMaxEvaluations(), config.getCandidateTimeout()));
    }

    public ForecastConfig getConfig() { return config; }

    /**
     * Models are fitted on the transformed training segment; the validation segment, when
     * present, is only used to score the forecast on the original scale.
     *
     * @throws ModelingException when a pipeline stage cannot proceed; per-candidate failures are
     *                           recorded in the run instead
     */
    public ForecastRun run(Partition partition) {
        Series training = partition.getTraining();
        log.info("Training on {} observations ({} discarded, validation {})", training.length(),
            partition.getDiscardedPrefix(), partition.hasValidation() ? partition.getValidation().length() : 0);

        BoxCoxSelector.Selection selection = new BoxCoxSelector(config.getLambdaLower(), config.getLambdaUpper(),
            config.getLambdaGridStep(), config.getNormalityTieTolerance()).select(training);
        Series transformed = selection.getTransformed();

        StationarityReducer.Result reduction = new StationarityReducer(config.getAnalysisLag() + 1,
            config.getMinimumVarianceReduction()).reduce(transformed, config.getDifferencing());

        List<SarimaOrder> candidates = config.getCandidateOrders();
        if (candidates.isEmpty()) {
            DifferencingSpec spec = reduction.getSpec();
            int s = config.getSeasonalPeriod();
            candidates = new CandidateGenerator(config.getMaxNonSeasonalOrder(), config.getMaxSeasonalOrder(),
                config.getSignificanceLevel())
                .generate(reduction.getStationary(), spec.trendOrder(), spec.seasonalOrder(s), s);
        }

        ModelSearchEngine.SearchResult search;
        try (ModelSearchEngine engine = new ModelSearchEngine(estimator, config.getThreads())) {
            search = engine.search(transformed, candidates);
        }
        if (search.getRanked().isEmpty()) {
            throw new ConvergenceException("no candidate could be fitted: " + search.getFailures());
        }

        List<DiagnosticsEngine.Report> reports =
            new DiagnosticsEngine(config.getDiagnosticsLag(), config.getSignificanceLevel()).diagnose(search.getRanked());
        DiagnosticsEngine.Report selected = null;
        for (DiagnosticsEngine.Report r : reports) {
            if (r.isPassed()) {
                selected = r;
                break;
            }
        }
        if (selected == null) {
            log.warn("None of {} fitted models passed diagnostics; no forecast produced", reports.size());
            return new ForecastRun(selection, reduction, candidates, search, reports, null, null, null);
        }
        log.info("Selected {}", selected.getModel());

        Forecast forecast = new Forecaster(config.getIntervalMultiplier())
            .forecast(selected, config.getForecastHorizon(), selection.getChosen());
        ForecastAccuracy accuracy = null;
        if (partition.hasValidation()) {
            accuracy = ForecastAccuracy.evaluate(forecast, partition.getValidation());
            log.info("Back-test: {}", accuracy);
        }
        return new ForecastRun(selection, reduction, candidates, search, reports, selected, forecast, accuracy);
    }

    /**
     * Load a series from a CSV with one row per period. The first column must be numeric;
     * header, comment and malformed lines are skipped.
     */
    public static Series readCsv(Path path) throws IOException {
        List<String> lines = Files.readAllLines(path);
        List<Double> values = new ArrayList<>();
        for (String raw : lines) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            String[] parts = line.split("[,;\t]+");
            try {
                values.add(Double.parseDouble(parts[0].trim()));
            } catch (NumberFormatException e) {
                log.debug("Skipping line '{}'", line);
            }
        }
        if (values.isEmpty()) throw new InsufficientDataException("no numeric values in " + path);
        return Series.of(values.stream().mapToDouble(Double::doubleValue).toArray());
    }
}
