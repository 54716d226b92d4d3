package FSA.Model;

import java.util.Objects;

/**
 * A state of an {@link Automaton}. Being initial and being final are independent facets.
 * Facets are changed through the owning automaton so that its views stay consistent.
 */
public final class State {
    private final String id;
    private String label;
    private boolean initial;
    private boolean fin;

    public State(String id, String label, boolean initial, boolean fin) {
        this.id = Objects.requireNonNull(id, "id");
        this.label = label == null ? id : label;
        this.initial = initial;
        this.fin = fin;
    }

    public State(String id, String label, StateRole role) {
        this(id, label, role == StateRole.INITIAL, role == StateRole.FINAL);
    }

    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label == null ? id : label;
    }

    public boolean isInitial() {
        return initial;
    }

    public boolean isFinal() {
        return fin;
    }

    void setInitial(boolean initial) {
        this.initial = initial;
    }

    void setFinal(boolean fin) {
        this.fin = fin;
    }

    State copy() {
        return new State(id, label, initial, fin);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(id);
        if (!label.equals(id)) {
            sb.append(" (").append(label).append(')');
        }
        if (initial) {
            sb.append(" [initial]");
        }
        if (fin) {
            sb.append(" [final]");
        }
        return sb.toString();
    }
}
