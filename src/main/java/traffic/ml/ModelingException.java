package traffic.ml;

/**
 * Root of every failure raised by the forecasting engine.
 */
public class ModelingException extends RuntimeException {

    public ModelingException(String message) {
        super(message);
    }

    public ModelingException(String message, Throwable cause) {
        super(message, cause);
    }
}
