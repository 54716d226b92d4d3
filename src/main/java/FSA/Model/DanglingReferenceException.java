package FSA.Model;

public class DanglingReferenceException extends AutomatonException {
    public DanglingReferenceException(String transitionId, String kind, String id) {
        super("Transition '" + transitionId + "' references unknown " + kind + " '" + id + "'.");
    }
}
