package traffic;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import io.javalin.Javalin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import traffic.ml.DiagnosticsEngine;
import traffic.ml.FittedModel;
import traffic.ml.Forecast;
import traffic.ml.ForecastAccuracy;
import traffic.ml.ForecastConfig;
import traffic.ml.ForecastRun;
import traffic.ml.ModelSearchEngine;
import traffic.ml.ModelingException;
import traffic.ml.Partition;
import traffic.ml.Series;
import traffic.ml.TrafficPredictor;

/**
 * HTTP adapter for the forecasting engine.
 * Run with: mvn exec:java -Dexec.mainClass="traffic.WebApp"
 * <p>
 * {@code POST /api/forecast} takes {@code {"values": [...], "holdout": 14, "config": {...}}};
 * {@code holdout} trailing values are kept back for the back-test and {@code config} uses the
 * same keys as a configuration file.
 */
public class WebApp {

    private static final Logger log = LoggerFactory.getLogger(WebApp.class);

    private static final Gson GSON = new GsonBuilder().serializeSpecialFloatingPointValues().create();

    private static int getPort() {
        String env = System.getenv("PORT");
        if (env != null && !env.isBlank()) {
            try {
                return Integer.parseInt(env.trim());
            } catch (NumberFormatException e) {
                log.warn("Ignoring invalid PORT '{}'", env);
            }
        }
        return 7000;
    }

    public static void main(String[] args) {
        int port = getPort();
        Javalin app = Javalin.create().start("0.0.0.0", port);

        app.post("/api/forecast", ctx -> {
            Response response = forecast(ctx.body());
            sendJson(ctx, response.status, response.body);
        });

        app.get("/api/sample", ctx -> sendJson(ctx, 200, SampleData.dailyVolumes()));

        app.get("/api/health", ctx -> {
            Map<String, Object> h = new LinkedHashMap<>();
            h.put("status", "ok");
            h.put("port", port);
            sendJson(ctx, 200, h);
        });

        log.info("Traffic forecast web app on http://localhost:{}", port);
    }

    private static void sendJson(io.javalin.http.Context ctx, int status, Object body) {
        ctx.status(status).contentType("application/json").result(GSON.toJson(body));
    }

    static String toJson(Object body) {
        return GSON.toJson(body);
    }

    static final class Response {
        final int status;
        final Map<String, Object> body;

        Response(int status, Map<String, Object> body) {
            this.status = status;
            this.body = body;
        }
    }

    /** Handle a forecast request body; errors become {@code {"error": message}}. */
    static Response forecast(String body) {
        return forecast(body, TrafficPredictor::new);
    }

    static Response forecast(String body, Function<ForecastConfig, TrafficPredictor> predictors) {
        try {
            if (body == null || body.isBlank()) return error(400, "Missing request body");
            JsonElement parsed = JsonParser.parseString(body);
            if (!parsed.isJsonObject()) return error(400, "Request body must be a JSON object");
            JsonObject req = parsed.getAsJsonObject();

            JsonElement valuesElement = req.get("values");
            if (valuesElement == null || !valuesElement.isJsonArray()) {
                return error(400, "Missing or invalid 'values' array");
            }
            JsonArray valuesArray = valuesElement.getAsJsonArray();
            if (valuesArray.isEmpty()) return error(400, "Empty 'values' array");
            double[] values = new double[valuesArray.size()];
            for (int i = 0; i < values.length; i++) {
                JsonElement v = valuesArray.get(i);
                if (!v.isJsonPrimitive() || !v.getAsJsonPrimitive().isNumber()) {
                    return error(400, "All values must be numbers");
                }
                values[i] = v.getAsDouble();
            }

            ForecastConfig config = ForecastConfig.defaults();
            if (req.has("config") && req.get("config").isJsonObject()) {
                config = ForecastConfig.fromJson(new StringReader(req.get("config").toString()));
            }
            int holdout = 0;
            if (req.has("holdout")) {
                JsonElement h = req.get("holdout");
                if (!h.isJsonPrimitive() || !h.getAsJsonPrimitive().isNumber()
                    || h.getAsDouble() != Math.rint(h.getAsDouble())) {
                    return error(400, "'holdout' must be an integer");
                }
                holdout = (int) h.getAsDouble();
            }
            if (holdout < 0 || holdout >= values.length) return error(400, "'holdout' must be in [0, values)");

            Series series = Series.of(values);
            Partition partition = Partition.split(series, 0, values.length - holdout, holdout);
            ForecastRun run = predictors.apply(config).run(partition);
            return new Response(200, describe(run));
        } catch (JsonParseException e) {
            return error(400, "Invalid JSON: " + e.getMessage());
        } catch (IllegalArgumentException e) {
            return error(400, e.getMessage());
        } catch (ModelingException e) {
            log.warn("Forecast request failed: {}", e.getMessage());
            return error(422, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        } catch (IllegalStateException e) {
            log.error("Forecast request failed unexpectedly", e);
            return error(500, "Internal error: " + e.getMessage());
        }
    }

    private static Response error(int status, String message) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("error", message);
        return new Response(status, out);
    }

    static Map<String, Object> describe(ForecastRun run) {
        Map<String, Object> out = new LinkedHashMap<>();

        Map<String, Object> transform = new LinkedHashMap<>();
        transform.put("family", run.getTransform().getFamily().name());
        transform.put("lambda", run.getTransform().getLambda());
        transform.put("powerLambda", run.getTransformSelection().getPowerLambda());
        transform.put("powerShapiroWilk", run.getTransformSelection().getPowerNormality().getStatistic());
        transform.put("logShapiroWilk", run.getTransformSelection().getLogNormality().getStatistic());
        out.put("transform", transform);

        Map<String, Object> differencing = new LinkedHashMap<>();
        differencing.put("lags", run.getReduction().getTrace().getLags());
        differencing.put("variances", run.getReduction().getTrace().getVariances());
        out.put("differencing", differencing);

        List<Map<String, Object>> models = new ArrayList<>();
        for (DiagnosticsEngine.Report report : run.getReports()) {
            FittedModel m = report.getModel();
            Map<String, Object> model = new LinkedHashMap<>();
            model.put("order", m.getOrder().toString());
            model.put("aicc", m.getAicc());
            model.put("logLikelihood", m.getLogLikelihood());
            model.put("sigma2", m.getSigma2());
            model.put("coefficients", m.namedCoefficients());
            model.put("passed", report.isPassed());
            List<Map<String, Object>> checks = new ArrayList<>();
            for (DiagnosticsEngine.Check c : report.getChecks()) {
                Map<String, Object> check = new LinkedHashMap<>();
                check.put("name", c.getName());
                check.put("statistic", c.getStatistic().getStatistic());
                check.put("pValue", c.getStatistic().getPValue());
                check.put("passed", c.isPassed());
                check.put("gating", c.isGating());
                checks.add(check);
            }
            model.put("checks", checks);
            models.add(model);
        }
        out.put("models", models);

        List<Map<String, Object>> rejected = new ArrayList<>();
        for (ModelSearchEngine.CandidateFailure f : run.getSearch().getFailures()) {
            Map<String, Object> failure = new LinkedHashMap<>();
            failure.put("order", f.getOrder().toString());
            failure.put("kind", f.getKind());
            failure.put("reason", f.getReason());
            rejected.add(failure);
        }
        out.put("rejected", rejected);

        run.getSelected().ifPresent(r -> out.put("selected", r.getModel().getOrder().toString()));
        run.getForecast().ifPresent(forecast -> {
            List<Map<String, Object>> points = new ArrayList<>();
            for (Forecast.Point p : forecast.getPoints()) {
                Map<String, Object> point = new LinkedHashMap<>();
                point.put("step", p.getStep());
                point.put("mean", p.getOriginalMean());
                point.put("lower", p.getOriginalLower());
                point.put("upper", p.getOriginalUpper());
                points.add(point);
            }
            out.put("forecast", points);
        });
        run.getAccuracy().ifPresent(a -> out.put("accuracy", accuracy(a)));
        return out;
    }

    private static Map<String, Object> accuracy(ForecastAccuracy a) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("compared", a.getCompared());
        out.put("rmse", a.getRmse());
        out.put("mae", a.getMae());
        out.put("mape", a.getMape());
        out.put("coverage", a.getCoverage());
        return out;
    }
}
