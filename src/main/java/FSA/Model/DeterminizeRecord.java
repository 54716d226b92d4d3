package FSA.Model;

public record DeterminizeRecord(MacroState inputState, String outputState) {

  @Override
  public String toString() {
    return outputState + ": " + inputState;
  }
}
