package FSA;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import FSA.Model.Automaton;
import FSA.Model.State;
import FSA.Model.StateRole;
import FSA.Model.Symbol;
import FSA.Model.Transition;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * JSON documents holding one automaton:
 * <pre>
 * {"name": ..., "alphabet": [{id, value}], "states": [{id, label, type, initial, final}],
 *  "transitions": [{id, source, dest, symbol}]}
 * </pre>
 * {@code type} is the single-tag role; explicit {@code initial}/{@code final} flags take precedence when
 * present. The French keys of older files ({@code nom}, {@code etats}, {@code val}, {@code symbole}) are
 * accepted on read.
 */
public class JsonFormat {
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static class SymbolJson {
        @JsonProperty("id")
        String id;

        @JsonProperty("value")
        @JsonAlias("val")
        String value;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static class StateJson {
        @JsonProperty("id")
        String id;

        @JsonProperty("label")
        String label;

        @JsonProperty("type")
        String type;

        @JsonProperty("initial")
        Boolean initial;

        @JsonProperty("final")
        Boolean fin;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static class TransitionJson {
        @JsonProperty("id")
        String id;

        @JsonProperty("source")
        String source;

        @JsonProperty("dest")
        String dest;

        @JsonProperty("symbol")
        @JsonAlias("symbole")
        String symbol;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class AutomatonJson {
        @JsonProperty("name")
        @JsonAlias("nom")
        String name;

        @JsonProperty("alphabet")
        List<SymbolJson> alphabet = new ArrayList<>();

        @JsonProperty("states")
        @JsonAlias("etats")
        List<StateJson> states = new ArrayList<>();

        @JsonProperty("transitions")
        List<TransitionJson> transitions = new ArrayList<>();
    }

    private JsonFormat() {}

    /**
     * Reads and validates an automaton. Every element goes through the model's add operations, so
     * duplicates and dangling references are rejected with the model's exceptions.
     */
    public static Automaton read(InputStream is) throws IOException {
        final AutomatonJson doc = MAPPER.readValue(is, AutomatonJson.class);
        final Automaton automaton = new Automaton(require(doc.name, "name", "automaton"));
        for (SymbolJson s : nonNull(doc.alphabet)) {
            automaton.addSymbol(require(s.id, "id", "symbol"), require(s.value, "value", "symbol " + s.id));
        }
        for (StateJson s : nonNull(doc.states)) {
            String id = require(s.id, "id", "state");
            StateRole role = s.type == null ? StateRole.NORMAL : StateRole.parse(s.type);
            boolean initial = s.initial != null ? s.initial : role == StateRole.INITIAL;
            boolean fin = s.fin != null ? s.fin : role == StateRole.FINAL;
            automaton.addState(id, s.label, initial, fin);
        }
        for (TransitionJson t : nonNull(doc.transitions)) {
            String id = require(t.id, "id", "transition");
            automaton.addTransition(id,
                require(t.source, "source", "transition " + id),
                require(t.dest, "dest", "transition " + id),
                require(t.symbol, "symbol", "transition " + id));
        }
        return automaton;
    }

    public static Automaton read(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return read(is);
        }
    }

    public static void write(Automaton automaton, OutputStream os) throws IOException {
        MAPPER.writeValue(os, toJson(automaton));
    }

    public static void write(Automaton automaton, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream os = Files.newOutputStream(path)) {
            write(automaton, os);
        }
    }

    public static String writeString(Automaton automaton) throws IOException {
        return MAPPER.writeValueAsString(toJson(automaton));
    }

    private static AutomatonJson toJson(Automaton automaton) {
        AutomatonJson doc = new AutomatonJson();
        doc.name = automaton.getName();
        for (Symbol s : automaton.getSymbols()) {
            SymbolJson js = new SymbolJson();
            js.id = s.id();
            js.value = s.value();
            doc.alphabet.add(js);
        }
        for (State s : automaton.getStates()) {
            StateJson js = new StateJson();
            js.id = s.getId();
            js.label = s.getLabel();
            js.type = StateRole.of(s).label();
            js.initial = s.isInitial();
            js.fin = s.isFinal();
            doc.states.add(js);
        }
        for (Transition t : automaton.getTransitions()) {
            TransitionJson jt = new TransitionJson();
            jt.id = t.id();
            jt.source = t.source();
            jt.dest = t.destination();
            jt.symbol = t.symbol();
            doc.transitions.add(jt);
        }
        return doc;
    }

    private static String require(String value, String field, String owner) throws IOException {
        if (value == null) {
            throw new IOException("Missing field '" + field + "' in " + owner + ".");
        }
        return value;
    }

    private static <T> List<T> nonNull(List<T> list) {
        return list == null ? List.of() : list;
    }
}
