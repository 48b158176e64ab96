package traffic.ml;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collectors;

import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fits every candidate order independently, in parallel on a private thread pool, and ranks the
 * successful fits by AICc. Candidates that fail are recorded, never abort the search.
 */
public class ModelSearchEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ModelSearchEngine.class);

    /** Ascending AICc, then fewer parameters, then the order's text for a stable result. */
    static final Comparator<FittedModel> RANKING = Comparator.comparingDouble(FittedModel::getAicc)
        .thenComparingInt(FittedModel::getParameterCount)
        .thenComparing(m -> m.getOrder().toString());

    private final CandidateEstimator estimator;
    private final ForkJoinPool forkJoinPool;

    public ModelSearchEngine(CandidateEstimator estimator, int threadPoolSize) {
        if (threadPoolSize < 1) throw new IllegalArgumentException("threadPoolSize must be >= 1");
        this.estimator = estimator;
        this.forkJoinPool = new ForkJoinPool(threadPoolSize);
    }

    public SearchResult search(Series training, Collection<SarimaOrder> candidates) {
        if (candidates.isEmpty()) throw new IllegalArgumentException("no candidate orders to search");
        List<SarimaOrder> distinct = new ArrayList<>(new LinkedHashSet<>(candidates));
        List<Attempt> attempts = submitAndJoin(
            () -> distinct.parallelStream().map(order -> attempt(training, order)).collect(Collectors.toList()));

        List<FittedModel> ranked = new ArrayList<>();
        List<CandidateFailure> failures = new ArrayList<>();
        for (Attempt a : attempts) {
            if (a.model != null) {
                ranked.add(a.model);
            } else {
                failures.add(a.failure);
            }
        }
        ranked.sort(RANKING);
        for (int i = 0; i < ranked.size(); i++) {
            FittedModel m = ranked.get(i);
            log.info("#{} {} AICc={} logLik={}", i + 1, m.getOrder(), String.format("%.3f", m.getAicc()),
                String.format("%.3f", m.getLogLikelihood()));
        }
        return new SearchResult(ranked, failures);
    }

    private Attempt attempt(Series training, SarimaOrder order) {
        try {
            return new Attempt(estimator.fit(training, order), null);
        } catch (ModelingException e) {
            log.warn("Rejected {}: {}", order, e.getMessage());
            return new Attempt(null, new CandidateFailure(order, e));
        } catch (MathIllegalStateException | MathIllegalArgumentException | MathArithmeticException e) {
            ConvergenceException failure = new ConvergenceException(order + ": numerical routine failed: "
                + e.getMessage(), e);
            log.warn("Rejected {}: {}", order, failure.getMessage());
            return new Attempt(null, new CandidateFailure(order, failure));
        }
    }

    private <T> T submitAndJoin(Callable<T> callable) {
        try {
            return forkJoinPool.submit(callable).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("model search interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("model search failed", e.getCause());
        }
    }

    @Override
    public void close() {
        forkJoinPool.shutdown();
    }

    private static final class Attempt {
        final FittedModel model;
        final CandidateFailure failure;

        Attempt(FittedModel model, CandidateFailure failure) {
            this.model = model;
            this.failure = failure;
        }
    }

    /** A candidate excluded from the ranking, with the reason. */
    public static final class CandidateFailure {
        private final SarimaOrder order;
        private final String kind;
        private final String reason;

        CandidateFailure(SarimaOrder order, ModelingException cause) {
            this.order = order;
            this.kind = cause.getClass().getSimpleName();
            this.reason = cause.getMessage();
        }

        public SarimaOrder getOrder() { return order; }
        /** Simple name of the exception type, e.g. {@code NonInvertibleFitException}. */
        public String getKind() { return kind; }
        public String getReason() { return reason; }

        @Override
        public String toString() {
            return order + " rejected (" + kind + "): " + reason;
        }
    }

    public static final class SearchResult {
        private final List<FittedModel> ranked;
        private final List<CandidateFailure> failures;

        SearchResult(List<FittedModel> ranked, List<CandidateFailure> failures) {
            this.ranked = Collections.unmodifiableList(ranked);
            this.failures = Collections.unmodifiableList(failures);
        }

        /** Successful fits, best first. */
        public List<FittedModel> getRanked() { return ranked; }
        public List<CandidateFailure> getFailures() { return failures; }

        public FittedModel best() {
            if (ranked.isEmpty()) throw new IllegalStateException("every candidate was rejected: " + failures);
            return ranked.get(0);
        }
    }
}
