package traffic.ml;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class ForecastAccuracyTest {

    private static Forecast.Point point(int step, double mean, double lower, double upper) {
        return new Forecast.Point(step, mean, 1, lower, upper, mean, lower, upper);
    }

    @Test
    public void testMetrics() {
        Forecast forecast = new Forecast(new SarimaOrder(0, 1, 1, 0, 1, 1, 7), TransformSpec.power(1), 2,
            Arrays.asList(point(1, 100, 90, 110), point(2, 200, 190, 210), point(3, 50, 45, 55)));
        ForecastAccuracy a = ForecastAccuracy.evaluate(forecast, Series.of(110, 180, 50, 999));
        assertEquals(3, a.getCompared());
        assertEquals(Math.sqrt((100 + 400 + 0) / 3.0), a.getRmse(), 1e-12);
        assertEquals(10, a.getMae(), 1e-12);
        assertEquals(100 * (10.0 / 110 + 20.0 / 180) / 3, a.getMape(), 1e-12);
        assertEquals(2.0 / 3, a.getCoverage(), 1e-12);
    }

    @Test
    public void testShortValidation() {
        Forecast forecast = new Forecast(new SarimaOrder(0, 1, 0, 0, 0, 0, 0), TransformSpec.log(), 2,
            Arrays.asList(point(1, 10, 8, 12), point(2, 10, 7, 13)));
        ForecastAccuracy a = ForecastAccuracy.evaluate(forecast, Series.of(6));
        assertEquals(1, a.getCompared());
        assertEquals(0, a.getCoverage());
        assertEquals(4, a.getMae(), 1e-12);
    }
}
