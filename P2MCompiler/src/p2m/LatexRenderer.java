package p2m;

// Serializes an expression tree to LaTeX. Every operand embedded in an operator position is
// wrapped in \left( \right) unless it is atomic; slots delimited by LaTeX syntax use braces.
final class LatexRenderer extends VoidDefaultFormulaVisitor {
  private final StringBuilder out = new StringBuilder();

  private LatexRenderer() {}

  static String render(Expression expression) {
    LatexRenderer renderer = new LatexRenderer();
    expression.accept(renderer, null);
    return renderer.out.toString();
  }

  private void emit(Expression expression) {
    expression.accept(this, null);
  }

  private void emitGrouped(Expression expression) {
    out.append("\\left(");
    emit(expression);
    out.append("\\right)");
  }

  private void emitOperand(Expression expression) {
    if (expression.isAtomic()) {
      emit(expression);
    } else {
      emitGrouped(expression);
    }
  }

  private void emitBraced(Expression expression) {
    out.append('{');
    emit(expression);
    out.append('}');
  }

  @Override
  public void visitImpl(Expression.Atom node) {
    out.append(node.text());
  }

  @Override
  public void visitImpl(Indicator node) {
    emit(node.body());
  }

  @Override
  public void visitImpl(Expression.Sum node) {
    for (int i = 0; i < node.terms().size(); i++) {
      if (i > 0) out.append('+');
      emitOperand(node.terms().get(i));
    }
  }

  @Override
  public void visitImpl(Expression.Difference node) {
    emitOperand(node.minuend());
    out.append('-');
    emitOperand(node.subtrahend());
  }

  @Override
  public void visitImpl(Expression.Product node) {
    node.factors().forEach(this::emitGrouped);
  }

  @Override
  public void visitImpl(Expression.Fraction node) {
    out.append("\\frac");
    emitBraced(node.numerator());
    emitBraced(node.denominator());
  }

  @Override
  public void visitImpl(Expression.Power node) {
    emitOperand(node.base());
    out.append('^');
    emitBraced(node.exponent());
  }

  @Override
  public void visitImpl(Expression.Root node) {
    out.append("\\sqrt");
    if (node.degree().isPresent()) {
      out.append('[');
      emit(node.degree().get());
      out.append(']');
    }
    emitBraced(node.radicand());
  }

  @Override
  public void visitImpl(Expression.Factorial node) {
    emitOperand(node.operand());
    out.append('!');
  }

  @Override
  public void visitImpl(Expression.Floor node) {
    out.append("\\left\\lfloor ");
    emit(node.operand());
    out.append("\\right\\rfloor");
  }

  @Override
  public void visitImpl(Expression.Ceiling node) {
    out.append("\\left\\lceil ");
    emit(node.operand());
    out.append("\\right\\rceil");
  }

  @Override
  public void visitImpl(Expression.Application node) {
    emitOperand(node.function());
    emitGrouped(node.argument());
  }

  @Override
  public void visitImpl(Expression.BigOperator node) {
    out.append(node.symbol().latex());
    out.append("_{").append(node.indexLetter()).append('=');
    emit(node.lo());
    out.append("}^");
    emitBraced(node.hi());
    emitGrouped(node.body());
  }
}
