package p2m;

public interface FormulaNodeInterface {
  <V> V accept(FormulaVisitor<V> visitor, V value);

  <V> V visitChildren(FormulaVisitor<V> visitor, V value);
}
