package p2m;

import p2m.processor.FormulaChild;
import p2m.processor.FormulaNode;

/**
 * An expression that should yield exactly 0 or 1.
 *
 * <p>There is no way to check that a formula is a true indicator, so wrapping one is purely an
 * assertion made by the caller. Renders exactly like its body.
 */
@FormulaNode
public final class Indicator extends Expression implements Indicator_FormulaNode {
  private final Expression body;

  private Indicator(Expression body) {
    super(Type.INDICATOR);
    this.body = body;
  }

  public static Indicator assume(Expression expression) {
    if (expression.type() == Type.INDICATOR) return expression.cast();

    return new Indicator(expression);
  }

  @FormulaChild
  @Override
  public Expression body() {
    return body;
  }

  @Override
  public boolean isAtomic() {
    return body.isAtomic();
  }
}
