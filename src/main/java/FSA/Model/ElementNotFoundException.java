package FSA.Model;

public class ElementNotFoundException extends AutomatonException {
    public ElementNotFoundException(String kind, String id) {
        super(kind + " with id '" + id + "' not found.");
    }
}
