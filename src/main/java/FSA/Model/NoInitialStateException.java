package FSA.Model;

public class NoInitialStateException extends AutomatonException {
    public NoInitialStateException(String automatonName) {
        super("Automaton '" + automatonName + "' has no initial state.");
    }
}
