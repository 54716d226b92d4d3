package FSA.Model;

/**
 * Raised when an operation that assumes a deterministic (and possibly complete) automaton
 * receives one that is not.
 */
public class PreconditionFailedException extends AutomatonException {
    public PreconditionFailedException(String message) {
        super(message);
    }
}
