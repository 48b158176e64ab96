package traffic;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Paths;

import traffic.ml.DiagnosticsEngine;
import traffic.ml.FittedModel;
import traffic.ml.Forecast;
import traffic.ml.ForecastConfig;
import traffic.ml.ForecastRun;
import traffic.ml.ModelSearchEngine;
import traffic.ml.ModelingException;
import traffic.ml.Partition;
import traffic.ml.Series;
import traffic.ml.TrafficPredictor;

/**
 * Command line demo: forecast daily traffic volumes.
 * <p>
 * Usage: {@code Main [series.csv [config.json]]}. Without arguments a synthetic series is used.
 * The last {@code forecastHorizon} values are held out to back-test the forecast.
 */
public class Main {

    public static void main(String[] args) {
        try {
            Series series = args.length > 0 && !args[0].trim().isEmpty()
                ? TrafficPredictor.readCsv(Paths.get(args[0].trim()))
                : Series.of(SampleData.dailyVolumes());
            ForecastConfig config = ForecastConfig.defaults();
            if (args.length > 1) {
                try (Reader reader = Files.newBufferedReader(Paths.get(args[1].trim()))) {
                    config = ForecastConfig.fromJson(reader);
                }
            }
            int horizon = config.getForecastHorizon();
            Partition partition = Partition.split(series, 0, series.length() - horizon, horizon);
            print(new TrafficPredictor(config).run(partition));
        } catch (IOException e) {
            System.err.println("Input error: " + e.getMessage());
            System.exit(1);
        } catch (ModelingException | IllegalArgumentException e) {
            String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            System.err.println("Forecast failed: " + msg);
            System.exit(2);
        }
    }

    static void print(ForecastRun run) {
        System.out.println("=== Transform ===");
        System.out.printf("Chosen %s (power lambda %.2f, Shapiro-Wilk W power %.4f / log %.4f)%n",
            run.getTransform(), run.getTransformSelection().getPowerLambda(),
            run.getTransformSelection().getPowerNormality().getStatistic(),
            run.getTransformSelection().getLogNormality().getStatistic());
        System.out.println();

        System.out.println("=== Differencing ===");
        System.out.println(run.getReduction().getSpec() + " variances " + format(run.getReduction().getTrace()
            .getVariances().stream().mapToDouble(Double::doubleValue).toArray(), 10));
        System.out.println();

        System.out.println("=== Candidates (" + run.getCandidates().size() + ") ===");
        int rank = 1;
        for (FittedModel m : run.getSearch().getRanked()) {
            System.out.printf("%2d. %s AICc=%.3f%n", rank++, m.getOrder(), m.getAicc());
        }
        for (ModelSearchEngine.CandidateFailure f : run.getSearch().getFailures()) {
            System.out.println("    rejected " + f);
        }
        System.out.println();

        System.out.println("=== Diagnostics ===");
        for (DiagnosticsEngine.Report r : run.getReports()) {
            System.out.println(r.getModel().getOrder() + (r.isPassed() ? " PASS" : " FAIL"));
            for (DiagnosticsEngine.Check c : r.getChecks()) System.out.println("    " + c);
        }
        System.out.println();

        if (!run.getForecast().isPresent()) {
            System.out.println("No model passed diagnostics; no forecast.");
            return;
        }
        Forecast forecast = run.getForecast().get();
        System.out.println("=== Forecast with " + run.getSelected().get().getModel() + " ===");
        for (Forecast.Point p : forecast.getPoints()) System.out.println("    " + p);
        run.getAccuracy().ifPresent(a -> System.out.println("Back-test: " + a));
    }

    private static String format(double[] a, int max) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < Math.min(a.length, max); i++) {
            if (i > 0) sb.append(", ");
            sb.append(String.format("%.2f", a[i]));
        }
        if (a.length > max) sb.append("...");
        sb.append("]");
        return sb.toString();
    }
}
