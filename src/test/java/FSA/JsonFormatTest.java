package FSA;

import FSA.Model.Automaton;
import FSA.Model.DanglingReferenceException;
import FSA.Model.DuplicateIdentifierException;
import FSA.Model.InvalidRoleException;
import FSA.Model.State;
import FSA.Model.Transition;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

public class JsonFormatTest {
  private static Automaton getJsonResource(String resourcePath) throws IOException {
    try (InputStream is = Objects.requireNonNull(
        JsonFormatTest.class.getClassLoader().getResourceAsStream(resourcePath))) {
      return JsonFormat.read(is);
    }
  }

  private static Automaton fromString(String json) throws IOException {
    return JsonFormat.read(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  void testRead() throws IOException {
    Automaton a = getJsonResource("exemple1.json");
    Assertions.assertEquals("exemple1", a.getName());
    Assertions.assertEquals(4, a.size());
    Assertions.assertEquals(List.of("a", "b"), a.symbolValues());
    Assertions.assertEquals(4, a.getTransitions().size());

    Assertions.assertTrue(a.getState("q0").isInitial());
    Assertions.assertFalse(a.getState("q0").isFinal());
    Assertions.assertTrue(a.getState("q2").isFinal());
    State both = a.getState("q3");
    Assertions.assertTrue(both.isInitial());
    Assertions.assertTrue(both.isFinal());
    Assertions.assertEquals("seen a", a.getState("q1").getLabel());
    Assertions.assertEquals(2, a.getInitialStates().size());
  }

  @Test
  void testReadLegacyKeys() throws IOException {
    Automaton a = getJsonResource("legacy.json");
    Assertions.assertEquals("legacy", a.getName());
    Assertions.assertEquals(List.of("0", "1"), a.symbolValues());
    Assertions.assertTrue(LanguageOperations.simulate(a, "100"));
    Assertions.assertFalse(LanguageOperations.simulate(a, "0"));
  }

  @Test
  void testRoundTrip() throws IOException {
    Automaton original = getJsonResource("exemple1.json");
    ByteArrayOutputStream os = new ByteArrayOutputStream();
    JsonFormat.write(original, os);
    String json = os.toString(StandardCharsets.UTF_8);
    Assertions.assertTrue(json.contains("\"type\" : \"initial\""));
    Assertions.assertEquals(json, JsonFormat.writeString(original));

    Automaton copy = fromString(json);
    Assertions.assertEquals(original.getName(), copy.getName());
    Assertions.assertEquals(original.size(), copy.size());
    for (State s : original.getStates()) {
      State c = copy.getState(s.getId());
      Assertions.assertEquals(s.getLabel(), c.getLabel());
      Assertions.assertEquals(s.isInitial(), c.isInitial());
      Assertions.assertEquals(s.isFinal(), c.isFinal());
    }
    Assertions.assertEquals(List.copyOf(original.getTransitions()), List.copyOf(copy.getTransitions()));
    for (Transition t : copy.getTransitions()) {
      Assertions.assertEquals(original.getTransition(t.id()), t);
    }
  }

  @Test
  void testInvalidDocuments() {
    Assertions.assertThrows(InvalidRoleException.class, () -> fromString(
        "{\"name\":\"x\",\"states\":[{\"id\":\"q0\",\"type\":\"initial_final\"}]}"));
    Assertions.assertThrows(DuplicateIdentifierException.class, () -> fromString(
        "{\"name\":\"x\",\"states\":[{\"id\":\"q0\"},{\"id\":\"q0\"}]}"));
    Assertions.assertThrows(DanglingReferenceException.class, () -> fromString(
        "{\"name\":\"x\",\"states\":[{\"id\":\"q0\"}],"
            + "\"transitions\":[{\"id\":\"t0\",\"source\":\"q0\",\"dest\":\"q1\",\"symbol\":\"s\"}]}"));
    Assertions.assertThrows(IOException.class, () -> fromString("{\"alphabet\":[]}"));
    Assertions.assertThrows(IOException.class, () -> fromString("{\"name\":"));
  }
}
