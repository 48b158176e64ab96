package traffic.ml;

/**
 * Back-test of an original-scale forecast against held-out observations.
 */
public final class ForecastAccuracy {

    private final int compared;
    private final double rmse;
    private final double mae;
    private final double mape;
    private final double coverage;

    private ForecastAccuracy(int compared, double rmse, double mae, double mape, double coverage) {
        this.compared = compared;
        this.rmse = rmse;
        this.mae = mae;
        this.mape = mape;
        this.coverage = coverage;
    }

    /** Compares the first min(horizon, actual length) steps. */
    public static ForecastAccuracy evaluate(Forecast forecast, Series actual) {
        int n = Math.min(forecast.horizon(), actual.length());
        double se = 0;
        double ae = 0;
        double ape = 0;
        int covered = 0;
        for (int i = 0; i < n; i++) {
            Forecast.Point p = forecast.getPoints().get(i);
            double err = actual.get(i) - p.getOriginalMean();
            se += err * err;
            ae += Math.abs(err);
            ape += actual.get(i) == 0 ? Double.NaN : Math.abs(err / actual.get(i));
            if (actual.get(i) >= p.getOriginalLower() && actual.get(i) <= p.getOriginalUpper()) covered++;
        }
        return new ForecastAccuracy(n, Math.sqrt(se / n), ae / n, 100 * ape / n, (double) covered / n);
    }

    public int getCompared() { return compared; }
    public double getRmse() { return rmse; }
    public double getMae() { return mae; }
    /** Mean absolute percentage error, in percent. */
    public double getMape() { return mape; }
    /** Fraction of held-out values inside the forecast bounds. */
    public double getCoverage() { return coverage; }

    @Override
    public String toString() {
        return String.format("n=%d RMSE=%.3f MAE=%.3f MAPE=%.2f%% coverage=%.2f", compared, rmse, mae, mape, coverage);
    }
}
