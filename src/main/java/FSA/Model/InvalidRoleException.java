package FSA.Model;

public class InvalidRoleException extends AutomatonException {
    public InvalidRoleException(String role) {
        super("Invalid state type '" + role + "'. Choose one of 'initial', 'final' or 'normal'.");
    }
}
