package SymDFA.Model;

/**
 * Breadcrumb of a breadth-first word search: the state reached, and how it was reached.
 * The root record has no parent and no symbol.
 */
public record SearchRecord<S, I>(S state, SearchRecord<S, I> parent, I symbol) {

  public static <S, I> SearchRecord<S, I> root(S state) {
    return new SearchRecord<>(state, null, null);
  }

  public SearchRecord<S, I> step(I symbol, S successor) {
    return new SearchRecord<>(successor, this, symbol);
  }

  @Override
  public String toString() {
    return symbol + " -> " + state;
  }
}
