package FSA.Model;

public class DuplicateIdentifierException extends AutomatonException {
    public DuplicateIdentifierException(String kind, String id) {
        super(kind + " with id '" + id + "' already exists.");
    }
}
