package p2m;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.HashMap;
import java.util.Map;

import com.google.common.collect.ImmutableMap;

// Evaluates a formula numerically so tests can check what the LaTeX means, not just how it reads.
final class FormulaEvaluator extends DefaultFormulaVisitor<BigDecimal> {
  private static final MathContext MC = new MathContext(120);
  private static final BigDecimal PI =
      new BigDecimal(
          "3.1415926535897932384626433832795028841971693993751058209749445923078164062862089986"
              + "280348253421170679");
  private static final BigDecimal TWO_PI = PI.multiply(BigDecimal.valueOf(2));
  private static final BigDecimal SNAP = new BigDecimal("1e-40");

  private final Map<String, BigDecimal> bindings;

  private FormulaEvaluator(Map<String, BigDecimal> bindings) {
    this.bindings = new HashMap<>(bindings);
  }

  static BigDecimal evaluate(Expression expression) {
    return evaluate(expression, ImmutableMap.of());
  }

  static BigDecimal evaluate(Expression expression, Map<String, BigDecimal> bindings) {
    return new FormulaEvaluator(bindings).eval(expression);
  }

  static BigDecimal evaluate(Expression expression, String variable, long value) {
    return evaluate(expression, ImmutableMap.of(variable, BigDecimal.valueOf(value)));
  }

  // Indicators must come out as exactly 0 or 1.
  static int evaluateIndicator(Expression expression, Map<String, BigDecimal> bindings) {
    BigDecimal value = evaluate(expression, bindings);
    if (value.compareTo(BigDecimal.ZERO) == 0) return 0;
    if (value.compareTo(BigDecimal.ONE) == 0) return 1;
    throw new AssertionError(String.format("%s evaluated to %s", expression, value));
  }

  static int evaluateIndicator(Expression expression) {
    return evaluateIndicator(expression, ImmutableMap.of());
  }

  static int evaluateIndicator(Expression expression, String variable, long value) {
    return evaluateIndicator(expression, ImmutableMap.of(variable, BigDecimal.valueOf(value)));
  }

  private BigDecimal eval(Expression expression) {
    return expression.accept(this, null);
  }

  @Override
  public BigDecimal visit(Expression.Atom node, BigDecimal value) {
    String text = node.text();
    if (text.equals("\\pi")) return PI;
    if (bindings.containsKey(text)) return bindings.get(text);
    try {
      return new BigDecimal(text);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Unbound atom: " + text, ex);
    }
  }

  @Override
  public BigDecimal visit(Indicator node, BigDecimal value) {
    return eval(node.body());
  }

  @Override
  public BigDecimal visit(Expression.Sum node, BigDecimal value) {
    BigDecimal sum = BigDecimal.ZERO;
    for (Expression term : node.terms()) {
      sum = sum.add(eval(term), MC);
    }
    return sum;
  }

  @Override
  public BigDecimal visit(Expression.Difference node, BigDecimal value) {
    return eval(node.minuend()).subtract(eval(node.subtrahend()), MC);
  }

  @Override
  public BigDecimal visit(Expression.Product node, BigDecimal value) {
    BigDecimal product = BigDecimal.ONE;
    for (Expression factor : node.factors()) {
      product = product.multiply(eval(factor), MC);
    }
    return product;
  }

  @Override
  public BigDecimal visit(Expression.Fraction node, BigDecimal value) {
    return eval(node.numerator()).divide(eval(node.denominator()), MC);
  }

  @Override
  public BigDecimal visit(Expression.Power node, BigDecimal value) {
    BigDecimal base = eval(node.base());
    BigDecimal exponent = eval(node.exponent());
    if (isInteger(exponent) && exponent.abs().compareTo(BigDecimal.valueOf(1000)) <= 0) {
      return base.pow(exponent.intValueExact(), MC);
    }
    return new BigDecimal(Math.pow(base.doubleValue(), exponent.doubleValue()), MC);
  }

  @Override
  public BigDecimal visit(Expression.Root node, BigDecimal value) {
    BigDecimal radicand = eval(node.radicand());
    if (!node.degree().isPresent()) {
      return radicand.sqrt(MC);
    }
    double degree = eval(node.degree().get()).doubleValue();
    return new BigDecimal(Math.pow(radicand.doubleValue(), 1 / degree), MC);
  }

  @Override
  public BigDecimal visit(Expression.Factorial node, BigDecimal value) {
    BigDecimal operand = eval(node.operand());
    if (!isInteger(operand) || operand.signum() < 0) {
      throw new IllegalArgumentException("Factorial of " + operand);
    }
    BigInteger result = BigInteger.ONE;
    for (int i = 2; i <= operand.intValueExact(); i++) {
      result = result.multiply(BigInteger.valueOf(i));
    }
    return new BigDecimal(result);
  }

  @Override
  public BigDecimal visit(Expression.Floor node, BigDecimal value) {
    return eval(node.operand()).setScale(0, RoundingMode.FLOOR);
  }

  @Override
  public BigDecimal visit(Expression.Ceiling node, BigDecimal value) {
    return eval(node.operand()).setScale(0, RoundingMode.CEILING);
  }

  @Override
  public BigDecimal visit(Expression.Application node, BigDecimal value) {
    String function = node.function().<Expression.Atom>cast().text();
    BigDecimal argument = eval(node.argument());
    switch (function) {
      case "\\cos":
        return cos(argument);
      case "\\arctan":
        return new BigDecimal(Math.atan(argument.doubleValue()), MC);
      default:
        throw new IllegalArgumentException("Unknown function: " + function);
    }
  }

  @Override
  public BigDecimal visit(Expression.BigOperator node, BigDecimal value) {
    BigDecimal lo = eval(node.lo());
    BigDecimal hi = eval(node.hi());
    boolean isSum = node.symbol() == Expression.BigOperator.Symbol.SUM;

    BigDecimal previous = bindings.get(node.indexLetter());
    BigDecimal result = isSum ? BigDecimal.ZERO : BigDecimal.ONE;
    for (BigDecimal k = lo; k.compareTo(hi) <= 0; k = k.add(BigDecimal.ONE)) {
      bindings.put(node.indexLetter(), k);
      BigDecimal body = eval(node.body());
      result = isSum ? result.add(body, MC) : result.multiply(body, MC);
    }

    if (previous == null) {
      bindings.remove(node.indexLetter());
    } else {
      bindings.put(node.indexLetter(), previous);
    }
    return result;
  }

  // Exact at multiples of pi, where the indicator formulas need cos^2 to be exactly 1.
  private static BigDecimal cos(BigDecimal x) {
    BigDecimal turns = x.divide(TWO_PI, MC).setScale(0, RoundingMode.FLOOR);
    BigDecimal reduced = x.subtract(turns.multiply(TWO_PI, MC), MC);
    if (reduced.abs().compareTo(SNAP) < 0
        || reduced.subtract(TWO_PI).abs().compareTo(SNAP) < 0) {
      return BigDecimal.ONE;
    }
    if (reduced.subtract(PI).abs().compareTo(SNAP) < 0) {
      return BigDecimal.ONE.negate();
    }
    return new BigDecimal(Math.cos(reduced.doubleValue()), MC);
  }

  private static boolean isInteger(BigDecimal value) {
    return value.signum() == 0 || value.stripTrailingZeros().scale() <= 0;
  }
}
