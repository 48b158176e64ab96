package traffic.ml;

/**
 * Failure of a single candidate fit. The search engine records these per candidate
 * and keeps going.
 */
public abstract class EstimationException extends ModelingException {

    protected EstimationException(String message) {
        super(message);
    }

    protected EstimationException(String message, Throwable cause) {
        super(message, cause);
    }
}
