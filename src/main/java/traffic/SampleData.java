package traffic;

import java.util.Random;

/**
 * Synthetic daily traffic volumes for the demo and the sample endpoint: a base level with a
 * slow trend and weekly cycle, plus seasonal ARIMA noise so that the series needs both a
 * weekly and a lag-1 difference.
 */
final class SampleData {

    static final int DAYS = 335;
    static final long SEED = 7L;

    private SampleData() {
    }

    static double[] dailyVolumes() {
        return dailyVolumes(DAYS, SEED);
    }

    static double[] dailyVolumes(int days, long seed) {
        Random random = new Random(seed);
        double theta = -0.4;
        double seasonalTheta = -0.6;
        double[] e = new double[days];
        double[] noise = new double[days];
        for (int t = 0; t < days; t++) {
            e[t] = 4.0 * random.nextGaussian();
            // (1-B)(1-B^7) x_t = (1 + θB)(1 + ΘB^7) e_t
            double w = e[t] + theta * at(e, t - 1) + seasonalTheta * at(e, t - 7) + theta * seasonalTheta * at(e, t - 8);
            noise[t] = w + at(noise, t - 1) + at(noise, t - 7) - at(noise, t - 8);
        }
        double[] out = new double[days];
        for (int t = 0; t < days; t++) {
            double weekly = 60 * Math.sin(2 * Math.PI * t / 7.0);
            out[t] = Math.max(1.0, 1200 + 0.3 * t + weekly + noise[t]);
        }
        return out;
    }

    private static double at(double[] a, int i) {
        return i < 0 ? 0 : a[i];
    }
}
