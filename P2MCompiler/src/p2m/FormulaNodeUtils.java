package p2m;

import java.util.Optional;

public final class FormulaNodeUtils {
  public static <V> V accept(FormulaNodeInterface obj, FormulaVisitor<V> visitor, V value) {
    return obj.accept(visitor, value);
  }

  public static <V> V accept(
      Iterable<? extends FormulaNodeInterface> obj, FormulaVisitor<V> visitor, V value) {
    for (FormulaNodeInterface o : obj) {
      value = accept(o, visitor, value);
    }
    return value;
  }

  public static <V> V accept(
      Optional<? extends FormulaNodeInterface> obj, FormulaVisitor<V> visitor, V value) {
    return obj.map(o -> accept(o, visitor, value)).orElse(value);
  }

  private FormulaNodeUtils() {}
}
