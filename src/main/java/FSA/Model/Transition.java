package FSA.Model;

import java.util.Objects;

/**
 * Directed, labeled edge. Endpoints and symbol are referenced by id and always resolve inside
 * the owning automaton.
 */
public record Transition(String id, String source, String destination, String symbol) {
    public Transition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(symbol, "symbol");
    }

    @Override
    public String toString() {
        return id + ": " + source + " --" + symbol + "--> " + destination;
    }
}
