package traffic.ml;

/** The optimizer did not reach a stationary point (evaluation budget or timeout exhausted). */
public class ConvergenceException extends EstimationException {

    public ConvergenceException(String message) {
        super(message);
    }

    public ConvergenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
