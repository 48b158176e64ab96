package traffic.ml;

import java.util.Random;

/**
 * Daily volumes: level + trend + weekly sinusoid, plus either SARIMA(0,1,1)(0,1,1)7 noise with
 * θ = -0.4, Θ = -0.6 or independent noise.
 */
final class SyntheticTraffic {

    static final int PERIOD = 7;

    private SyntheticTraffic() {
    }

    static double[] generate(int length, long seed) {
        return generate(length, seed, 3.0);
    }

    static double[] generate(int length, long seed, double noiseSd) {
        Random random = new Random(seed);
        double theta = -0.4;
        double seasonalTheta = -0.6;
        double[] e = new double[length];
        double[] noise = new double[length];
        for (int t = 0; t < length; t++) {
            e[t] = noiseSd * random.nextGaussian();
            double w = e[t] + theta * at(e, t - 1) + seasonalTheta * at(e, t - PERIOD)
                + theta * seasonalTheta * at(e, t - PERIOD - 1);
            noise[t] = w + at(noise, t - 1) + at(noise, t - PERIOD) - at(noise, t - PERIOD - 1);
        }
        double[] out = new double[length];
        for (int t = 0; t < length; t++) {
            out[t] = 500 + 0.2 * t + 10 * Math.sin(2 * Math.PI * t / PERIOD) + noise[t];
        }
        return out;
    }

    /** Level + trend + weekly sinusoid + independent N(0, noiseSd) noise. */
    static double[] additive(int length, long seed, double noiseSd) {
        Random random = new Random(seed);
        double[] out = new double[length];
        for (int t = 0; t < length; t++) {
            out[t] = 500 + 0.2 * t + 10 * Math.sin(2 * Math.PI * t / PERIOD) + noiseSd * random.nextGaussian();
        }
        return out;
    }

    /** Independent N(mean, sd) draws. */
    static double[] whiteNoise(int length, long seed, double mean, double sd) {
        Random random = new Random(seed);
        double[] out = new double[length];
        for (int i = 0; i < length; i++) out[i] = mean + sd * random.nextGaussian();
        return out;
    }

    /** x_t = φ x_{t-1} + θ e_{t-1} + e_t with unit-variance innovations and a burn-in of 200. */
    static double[] arma11(int length, long seed, double phi, double theta) {
        Random random = new Random(seed);
        int burn = 200;
        double x = 0;
        double prevE = 0;
        double[] out = new double[length];
        for (int t = 0; t < length + burn; t++) {
            double e = random.nextGaussian();
            x = phi * x + theta * prevE + e;
            prevE = e;
            if (t >= burn) out[t - burn] = x;
        }
        return out;
    }

    private static double at(double[] a, int i) {
        return i < 0 ? 0 : a[i];
    }
}
