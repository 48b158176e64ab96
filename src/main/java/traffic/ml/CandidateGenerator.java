package traffic.ml;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import traffic.ml.stats.Autocorrelation;

/**
 * Proposes candidate SARIMA orders from the ACF/PACF of the differenced series.
 * <p>
 * Non-seasonal PACF spikes (lags below the period) bound p, ACF spikes bound q; spikes at
 * multiples of the period bound P and Q. Every order in the resulting grid is proposed, and
 * when the highest lag of a polynomial is a spike, a masked variant fixes the non-spiking
 * lags between the lowest and highest spike to zero.
 */
public class CandidateGenerator {

    private static final Logger log = LoggerFactory.getLogger(CandidateGenerator.class);

    private final int maxNonSeasonalOrder;
    private final int maxSeasonalOrder;
    private final double significanceLevel;

    public CandidateGenerator(int maxNonSeasonalOrder, int maxSeasonalOrder, double significanceLevel) {
        if (maxNonSeasonalOrder < 0 || maxSeasonalOrder < 0) {
            throw new IllegalArgumentException("maximum orders must be >= 0");
        }
        this.maxNonSeasonalOrder = maxNonSeasonalOrder;
        this.maxSeasonalOrder = maxSeasonalOrder;
        this.significanceLevel = significanceLevel;
    }

    public List<SarimaOrder> generate(Series stationary, int d, int seasonalD, int s) {
        boolean seasonal = s >= 2;
        int nonSeasonalLimit = seasonal ? Math.min(maxNonSeasonalOrder, s - 1) : maxNonSeasonalOrder;
        int seasonalLimit = seasonal ? maxSeasonalOrder : 0;
        int maxLag = Math.max(Math.max(nonSeasonalLimit, seasonalLimit * s), 1);
        double[] x = stationary.values();
        double[] acf = Autocorrelation.acf(x, maxLag);
        double[] pacf = Autocorrelation.pacf(x, maxLag);
        double bound = Autocorrelation.confidenceBound(x.length, significanceLevel);

        Set<Integer> arSpikes = spikes(pacf, bound, nonSeasonalLimit, 1);
        Set<Integer> maSpikes = spikes(acf, bound, nonSeasonalLimit, 1);
        Set<Integer> sarSpikes = spikes(pacf, bound, seasonalLimit, s);
        Set<Integer> smaSpikes = spikes(acf, bound, seasonalLimit, s);
        log.info("Spikes outside ±{}: PACF {} ACF {} seasonal PACF {} seasonal ACF {}",
            String.format("%.4f", bound), arSpikes, maSpikes, sarSpikes, smaSpikes);

        int seasonLength = seasonal ? s : 0;
        Set<SarimaOrder> candidates = new LinkedHashSet<>();
        for (int p = 0; p <= highest(arSpikes); p++) {
            for (int q = 0; q <= highest(maSpikes); q++) {
                for (int sp = 0; sp <= highest(sarSpikes); sp++) {
                    for (int sq = 0; sq <= highest(smaSpikes); sq++) {
                        SarimaOrder order = new SarimaOrder(p, d, q, sp, seasonalD, sq, seasonLength);
                        candidates.add(order);
                        Set<CoefficientMask.Term> fixed = new HashSet<>();
                        fixed.addAll(gaps(CoefficientMask.Kind.AR, p, arSpikes));
                        fixed.addAll(gaps(CoefficientMask.Kind.MA, q, maSpikes));
                        fixed.addAll(gaps(CoefficientMask.Kind.SEASONAL_AR, sp, sarSpikes));
                        fixed.addAll(gaps(CoefficientMask.Kind.SEASONAL_MA, sq, smaSpikes));
                        if (!fixed.isEmpty()) candidates.add(order.withMask(CoefficientMask.of(fixed)));
                    }
                }
            }
        }
        log.info("Generated {} candidate orders", candidates.size());
        return new ArrayList<>(candidates);
    }

    /** Polynomial lags (1..limit, lag × step) whose value lies outside the band. */
    private static Set<Integer> spikes(double[] byLag, double bound, int limit, int step) {
        Set<Integer> out = new LinkedHashSet<>();
        for (int k = 1; k <= limit; k++) {
            if (Math.abs(byLag[k * step]) > bound) out.add(k);
        }
        return out;
    }

    private static int highest(Set<Integer> spikes) {
        int max = 0;
        for (int k : spikes) max = Math.max(max, k);
        return max;
    }

    private static List<CoefficientMask.Term> gaps(CoefficientMask.Kind kind, int order, Set<Integer> spikes) {
        List<CoefficientMask.Term> out = new ArrayList<>();
        if (order < 2 || !spikes.contains(order)) return out;
        int lowest = order;
        for (int k : spikes) lowest = Math.min(lowest, k);
        for (int lag = lowest + 1; lag < order; lag++) {
            if (!spikes.contains(lag)) out.add(new CoefficientMask.Term(kind, lag));
        }
        return out;
    }
}
