package traffic.ml;

/** The fitted AR operator has a root inside or on the unit circle. */
public class NonStationaryFitException extends EstimationException {

    public NonStationaryFitException(String message) {
        super(message);
    }
}
