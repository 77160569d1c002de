package SymDFA.Model;

/**
 * State of a product automaton: one component state per operand.
 */
public record StatePair<S, T>(S left, T right) {

  @Override
  public String toString() {
    return "(" + left + ", " + right + ")";
  }
}
