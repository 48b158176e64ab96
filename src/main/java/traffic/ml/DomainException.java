package traffic.ml;

/** Transform preconditions violated: non-positive input, non-finite values, invalid inverse region. */
public class DomainException extends ModelingException {

    public DomainException(String message) {
        super(message);
    }
}
