package FSA.Model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * A finite automaton (deterministic or not) over a finite alphabet.
 * <p>
 * Symbols, states and transitions are kept in insertion order and indexed by id. Every add operation
 * validates its argument against the current contents before mutating anything, and removals cascade to
 * the transitions that reference the removed element. The initial and final views are computed from the
 * per-state facets on every call.
 * <p>
 * Instances are not thread-safe.
 */
public class Automaton {
    private final String name;
    private final Map<String, Symbol> symbols = new LinkedHashMap<>();
    private final Map<String, State> states = new LinkedHashMap<>();
    private final Map<String, Transition> transitions = new LinkedHashMap<>();

    public Automaton(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String getName() {
        return name;
    }

    // --- symbols ---

    public Symbol addSymbol(String id, String value) {
        return addSymbol(new Symbol(id, value));
    }

    public Symbol addSymbol(Symbol symbol) {
        if (symbols.containsKey(symbol.id())) {
            throw new DuplicateIdentifierException("Symbol", symbol.id());
        }
        symbols.put(symbol.id(), symbol);
        return symbol;
    }

    public void removeSymbol(String id) {
        if (symbols.remove(id) == null) {
            throw new ElementNotFoundException("Symbol", id);
        }
        transitions.values().removeIf(t -> t.symbol().equals(id));
    }

    public Symbol getSymbol(String id) {
        Symbol symbol = symbols.get(id);
        if (symbol == null) {
            throw new ElementNotFoundException("Symbol", id);
        }
        return symbol;
    }

    public boolean containsSymbol(String id) {
        return symbols.containsKey(id);
    }

    /**
     * @return the first symbol displaying {@code value}, or null
     */
    public Symbol symbolForValue(String value) {
        for (Symbol s : symbols.values()) {
            if (s.value().equals(value)) {
                return s;
            }
        }
        return null;
    }

    public Collection<Symbol> getSymbols() {
        return Collections.unmodifiableCollection(symbols.values());
    }

    /**
     * @return distinct symbol values in lexicographic order
     */
    public List<String> symbolValues() {
        TreeSet<String> values = new TreeSet<>();
        for (Symbol s : symbols.values()) {
            values.add(s.value());
        }
        return new ArrayList<>(values);
    }

    // --- states ---

    public State addState(String id, String label, boolean initial, boolean fin) {
        return addState(new State(id, label, initial, fin));
    }

    public State addState(String id, String label, StateRole role) {
        return addState(new State(id, label, role));
    }

    public State addState(State state) {
        if (states.containsKey(state.getId())) {
            throw new DuplicateIdentifierException("State", state.getId());
        }
        states.put(state.getId(), state);
        return state;
    }

    /**
     * Removes the state, every transition entering or leaving it, and hence its membership in the
     * initial and final views.
     */
    public void removeState(String id) {
        if (states.remove(id) == null) {
            throw new ElementNotFoundException("State", id);
        }
        transitions.values().removeIf(t -> t.source().equals(id) || t.destination().equals(id));
    }

    public State getState(String id) {
        State state = states.get(id);
        if (state == null) {
            throw new ElementNotFoundException("State", id);
        }
        return state;
    }

    public boolean containsState(String id) {
        return states.containsKey(id);
    }

    public Collection<State> getStates() {
        return Collections.unmodifiableCollection(states.values());
    }

    public int size() {
        return states.size();
    }

    public void setInitial(String id, boolean initial) {
        getState(id).setInitial(initial);
    }

    public void setFinal(String id, boolean fin) {
        getState(id).setFinal(fin);
    }

    /**
     * Replaces both facets of a state by the given single-tag role.
     */
    public void setRole(String id, String role) {
        StateRole parsed = StateRole.parse(role);
        State state = getState(id);
        state.setInitial(parsed == StateRole.INITIAL);
        state.setFinal(parsed == StateRole.FINAL);
    }

    public List<State> getInitialStates() {
        List<State> result = new ArrayList<>();
        for (State s : states.values()) {
            if (s.isInitial()) {
                result.add(s);
            }
        }
        return result;
    }

    public List<State> getFinalStates() {
        List<State> result = new ArrayList<>();
        for (State s : states.values()) {
            if (s.isFinal()) {
                result.add(s);
            }
        }
        return result;
    }

    /**
     * Picks an id not used by any state: {@code base} if free, otherwise {@code base1}, {@code base2}, ...
     */
    public String freshStateId(String base) {
        String candidate = base;
        int i = 1;
        while (states.containsKey(candidate)) {
            candidate = base + i++;
        }
        return candidate;
    }

    // --- transitions ---

    public Transition addTransition(String id, String source, String destination, String symbol) {
        return addTransition(new Transition(id, source, destination, symbol));
    }

    public Transition addTransition(Transition transition) {
        if (transitions.containsKey(transition.id())) {
            throw new DuplicateIdentifierException("Transition", transition.id());
        }
        if (!states.containsKey(transition.source())) {
            throw new DanglingReferenceException(transition.id(), "source state", transition.source());
        }
        if (!states.containsKey(transition.destination())) {
            throw new DanglingReferenceException(transition.id(), "destination state", transition.destination());
        }
        if (!symbols.containsKey(transition.symbol())) {
            throw new DanglingReferenceException(transition.id(), "symbol", transition.symbol());
        }
        transitions.put(transition.id(), transition);
        return transition;
    }

    /**
     * Adds a transition under a generated id ({@code t<n>}, skipping ids already taken).
     */
    public Transition addTransition(String source, String destination, String symbol) {
        int n = transitions.size();
        while (transitions.containsKey("t" + n)) {
            n++;
        }
        return addTransition("t" + n, source, destination, symbol);
    }

    public void removeTransition(String id) {
        if (transitions.remove(id) == null) {
            throw new ElementNotFoundException("Transition", id);
        }
    }

    public Transition getTransition(String id) {
        Transition transition = transitions.get(id);
        if (transition == null) {
            throw new ElementNotFoundException("Transition", id);
        }
        return transition;
    }

    public Collection<Transition> getTransitions() {
        return Collections.unmodifiableCollection(transitions.values());
    }

    public TransitionIndex transitionIndex() {
        return new TransitionIndex(this);
    }

    /**
     * @return an independent deep copy under a new name
     */
    public Automaton copy(String newName) {
        Automaton copy = new Automaton(newName);
        copy.symbols.putAll(symbols);
        for (State s : states.values()) {
            copy.states.put(s.getId(), s.copy());
        }
        copy.transitions.putAll(transitions);
        return copy;
    }

    @Override
    public String toString() {
        return "Automaton(name=" + name + ", states=" + states.size() + ", transitions=" + transitions.size() + ")";
    }
}
