package traffic.ml;

/**
 * Fits one candidate order to a training series.
 */
@FunctionalInterface
public interface CandidateEstimator {

    /**
     * @throws EstimationException when the candidate cannot be estimated or violates the root conditions
     */
    FittedModel fit(Series training, SarimaOrder order);
}
