package FSA.Model;

/**
 * Base class of every contract violation raised by the automaton core.
 * All of them are recoverable by the caller; none leaves an automaton half-modified.
 */
public abstract class AutomatonException extends RuntimeException {
    protected AutomatonException(String message) {
        super(message);
    }
}
