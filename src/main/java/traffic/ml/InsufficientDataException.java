package traffic.ml;

/** Not enough observations for the requested lag, differencing or diagnostic horizon. */
public class InsufficientDataException extends ModelingException {

    public InsufficientDataException(String message) {
        super(message);
    }
}
