package traffic.ml;

/** The fitted MA operator has a root inside or on the unit circle. */
public class NonInvertibleFitException extends EstimationException {

    public NonInvertibleFitException(String message) {
        super(message);
    }
}
