package traffic.ml;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a successful maximum-likelihood fit. Immutable; refitting produces a new instance.
 */
public final class FittedModel {

    private final SarimaOrder order;
    private final double[] coefficients;
    private final double[] standardErrors;
    private final double logLikelihood;
    private final double sigma2;
    private final int observations;
    private final int parameterCount;
    private final double aic;
    private final double aicc;
    private final double bic;
    private final double arMinRootModulus;
    private final double maMinRootModulus;
    private final Series training;

    FittedModel(SarimaOrder order, double[] coefficients, double[] standardErrors, double logLikelihood,
                double sigma2, int observations, Series training, double arMinRootModulus,
                double maMinRootModulus) {
        this.order = order;
        this.coefficients = coefficients.clone();
        this.standardErrors = standardErrors.clone();
        this.logLikelihood = logLikelihood;
        this.sigma2 = sigma2;
        this.observations = observations;
        this.parameterCount = order.freeCoefficientCount() + 1; // + innovation variance
        this.aic = InformationCriteria.aic(logLikelihood, parameterCount);
        this.aicc = InformationCriteria.aicc(logLikelihood, parameterCount, observations);
        this.bic = InformationCriteria.bic(logLikelihood, parameterCount, observations);
        this.arMinRootModulus = arMinRootModulus;
        this.maMinRootModulus = maMinRootModulus;
        this.training = training;
    }

    public SarimaOrder getOrder() { return order; }
    public CoefficientMask getMask() { return order.getMask(); }
    public double getLogLikelihood() { return logLikelihood; }
    /** Innovation variance σ². */
    public double getSigma2() { return sigma2; }
    /** Effective sample size after differencing. */
    public int getObservations() { return observations; }
    /** Estimated coefficients plus the innovation variance. */
    public int getParameterCount() { return parameterCount; }
    public double getAic() { return aic; }
    public double getAicc() { return aicc; }
    public double getBic() { return bic; }
    public double getArMinRootModulus() { return arMinRootModulus; }
    public double getMaMinRootModulus() { return maMinRootModulus; }
    public Series getTraining() { return training; }

    /** Full coefficient vector; masked positions are exactly zero. */
    public double[] getCoefficients() {
        return coefficients.clone();
    }

    /** Standard errors aligned with {@link #getCoefficients()}; NaN for masked or undetermined ones. */
    public double[] getStandardErrors() {
        return standardErrors.clone();
    }

    /** Coefficients keyed by label ({@code ar1}, {@code sma1}, ...). */
    public Map<String, Double> namedCoefficients() {
        Map<String, Double> out = new LinkedHashMap<>();
        List<CoefficientMask.Term> terms = order.terms();
        for (int i = 0; i < terms.size(); i++) out.put(terms.get(i).toString(), coefficients[i]);
        return out;
    }

    Sarima sarima() {
        return new Sarima(order, coefficients);
    }

    /** Recomputes the one-step prediction errors on the training series. */
    public ResidualSet residuals() {
        Sarima model = sarima();
        double[] w = model.difference(training.values());
        return new ResidualSet(model.filter(w).residuals(), order.differencingLag(), training.length());
    }

    @Override
    public String toString() {
        return String.format("%s logLik=%.3f AICc=%.3f sigma2=%.5g %s",
            order, logLikelihood, aicc, sigma2, namedCoefficients());
    }
}
