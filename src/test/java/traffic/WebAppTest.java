package traffic;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import traffic.ml.TrafficPredictor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class WebAppTest {

    private static final String SINGLE_CANDIDATE =
        "\"config\": {\"threads\": 1, \"candidateOrders\": [{\"p\":0,\"d\":1,\"q\":1,\"P\":0,\"D\":1,\"Q\":1,\"s\":7}]}";

    @Test
    public void testRejectsMalformedRequests() {
        assertEquals(400, WebApp.forecast("").status);
        assertEquals(400, WebApp.forecast("[1, 2, 3]").status);
        assertEquals(400, WebApp.forecast("{\"values\": []}").status);
        assertEquals(400, WebApp.forecast("{\"holdout\": 2}").status);
        assertEquals(400, WebApp.forecast("{\"values\": [1, \"two\", 3]}").status);
        assertEquals(400, WebApp.forecast("{\"values\": [1, 2").status);
        assertEquals(400, WebApp.forecast("{\"values\": [1, 2, 3], \"holdout\": 3}").status);
        assertEquals(400, WebApp.forecast("{\"values\": [1, 2, 3], \"holdout\": {\"n\": 1}}").status);
        assertEquals(400, WebApp.forecast("{\"values\": [1, 2, 3], \"holdout\": \"one\"}").status);
        assertEquals(400, WebApp.forecast("{\"values\": [1, 2, 3], \"holdout\": 1.5}").status);

        WebApp.Response bad = WebApp.forecast("{\"values\": [1, 2, 3], \"config\": {\"significanceLevel\": 2}}");
        assertEquals(400, bad.status);
        assertTrue(bad.body.containsKey("error"));
    }

    @Test
    public void testModelingFailureIsUnprocessable() {
        WebApp.Response response = WebApp.forecast("{\"values\": [10, 12, 0, 14, 9]}");
        assertEquals(422, response.status);
        assertTrue(String.valueOf(response.body.get("error")).contains("positive"));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testForecastSampleData() {
        String values = Arrays.toString(SampleData.dailyVolumes());
        WebApp.Response response = WebApp.forecast("{\"values\": " + values + ", \"holdout\": 14, " + SINGLE_CANDIDATE + "}");
        assertEquals(200, response.status, String.valueOf(response.body));

        Map<String, Object> body = response.body;
        assertTrue(body.containsKey("transform"));
        Map<String, Object> differencing = (Map<String, Object>) body.get("differencing");
        assertEquals(Arrays.asList(7, 1), differencing.get("lags"));

        List<Map<String, Object>> models = (List<Map<String, Object>>) body.get("models");
        List<Object> rejected = (List<Object>) body.get("rejected");
        assertEquals(1, models.size() + rejected.size());
        if (!models.isEmpty()) {
            assertTrue(models.get(0).containsKey("order"));
            assertFalse(((List<Object>) models.get(0).get("checks")).isEmpty());
        }
        if (body.containsKey("forecast")) {
            assertEquals(14, ((List<Object>) body.get("forecast")).size());
            assertTrue(body.containsKey("selected"));
            assertTrue(body.containsKey("accuracy"));
        }
        String json = WebApp.toJson(body);
        assertTrue(json.startsWith("{\"transform\""));
    }

    @Test
    public void testJsonKeepsNonFiniteValues() {
        String json = WebApp.toJson(java.util.Collections.singletonMap("pValue", Double.NaN));
        assertEquals("{\"pValue\":NaN}", json);
    }

    @Test
    public void testInternalFailureIsServerError() {
        String values = Arrays.toString(SampleData.dailyVolumes());
        WebApp.Response response = WebApp.forecast("{\"values\": " + values + ", " + SINGLE_CANDIDATE + "}",
            config -> new TrafficPredictor(config, (training, order) -> {
                throw new IllegalStateException("estimator state corrupted");
            }));
        assertEquals(500, response.status);
        assertTrue(String.valueOf(response.body.get("error")).startsWith("Internal error"));
    }
}
