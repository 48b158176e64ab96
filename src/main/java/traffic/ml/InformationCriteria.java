package traffic.ml;

/**
 * Akaike and Bayesian information criteria.
 */
public final class InformationCriteria {

    private InformationCriteria() {
    }

    public static double aic(double logLikelihood, int parameters) {
        return -2 * logLikelihood + 2 * parameters;
    }

    /**
     * AICc = AIC + 2k(k+1)/(n-k-1).
     *
     * @throws InsufficientDataException when n - k - 1 &lt;= 0
     */
    public static double aicc(double logLikelihood, int parameters, int observations) {
        int denom = observations - parameters - 1;
        if (denom <= 0) {
            throw new InsufficientDataException("AICc needs more than " + (parameters + 1)
                + " observations, got " + observations);
        }
        return aic(logLikelihood, parameters) + 2.0 * parameters * (parameters + 1) / denom;
    }

    public static double bic(double logLikelihood, int parameters, int observations) {
        return -2 * logLikelihood + parameters * Math.log(observations);
    }
}
