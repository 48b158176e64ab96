package traffic.ml;

/** Degenerate likelihood surface, or a zero/negative variance where a positive one is required. */
public class NumericalException extends ModelingException {

    public NumericalException(String message) {
        super(message);
    }
}
