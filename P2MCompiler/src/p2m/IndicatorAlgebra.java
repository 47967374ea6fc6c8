package p2m;

import static p2m.Expression.apply;
import static p2m.Expression.atom;
import static p2m.Expression.ceiling;
import static p2m.Expression.difference;
import static p2m.Expression.factorial;
import static p2m.Expression.floor;
import static p2m.Expression.fraction;
import static p2m.Expression.power;
import static p2m.Expression.product;

import java.util.Arrays;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Arithmetic encodings of logic, comparisons and number theory.
 *
 * <p>Every operation is pure: it only builds a new tree. Operands documented as indicators are
 * assumed to yield exactly 0 or 1, and divisors are assumed nonzero; neither is checked.
 */
public final class IndicatorAlgebra {
  private static final Expression ZERO = atom(0);
  private static final Expression ONE = atom(1);
  private static final Expression TWO = atom(2);
  private static final Expression FOUR = atom(4);
  private static final Expression TEN = atom(10);
  private static final Expression PI = atom("\\pi");
  private static final Expression COS = atom("\\cos");
  private static final Expression ARCTAN = atom("\\arctan");

  public static final String DEFAULT_DIVISOR_INDEX = "i";
  public static final String DEFAULT_RANGE_INDEX = "k";

  // e1(e2(...(en)))
  public static Expression compose(List<? extends Expression> expressions) {
    Preconditions.checkArgument(!expressions.isEmpty(), "Must provide at least one expression");

    Expression whole = expressions.get(expressions.size() - 1);
    for (int i = expressions.size() - 2; i >= 0; i--) {
      whole = apply(expressions.get(i), whole);
    }
    return whole;
  }

  public static Indicator logicalAnd(Indicator... indicators) {
    return logicalAnd(Arrays.asList(indicators));
  }

  public static Indicator logicalAnd(List<Indicator> indicators) {
    Preconditions.checkArgument(!indicators.isEmpty(), "Must provide at least one indicator");

    return Indicator.assume(product(indicators));
  }

  public static Indicator logicalNot(Indicator indicator) {
    return Indicator.assume(difference(ONE, indicator));
  }

  // De Morgan: not(and(not(x1), ..., not(xn)))
  public static Indicator logicalOr(Indicator... indicators) {
    return logicalOr(Arrays.asList(indicators));
  }

  public static Indicator logicalOr(List<Indicator> indicators) {
    Preconditions.checkArgument(!indicators.isEmpty(), "Must provide at least one indicator");

    return logicalNot(
        logicalAnd(
            indicators
                .stream()
                .map(IndicatorAlgebra::logicalNot)
                .collect(ImmutableList.toImmutableList())));
  }

  // 4 arctan^2(a - b) / pi^2 lies in [0, 1) and is 0 only when a = b.
  public static Indicator areNotEqual(Expression a, Expression b) {
    Expression arctan = apply(ARCTAN, difference(a, b));
    return Indicator.assume(
        ceiling(fraction(product(FOUR, power(arctan, TWO)), power(PI, TWO))));
  }

  public static Indicator areEqual(Expression a, Expression b) {
    return logicalNot(areNotEqual(a, b));
  }

  // a == |a|, with |a| written as sqrt(a^2).
  public static Indicator isNonNegative(Expression a) {
    return areEqual(Expression.sqrt(power(a, TWO)), a);
  }

  public static Indicator lessThanOrEqual(Expression a, Expression b) {
    return isNonNegative(difference(b, a));
  }

  public static Indicator lessThan(Expression a, Expression b) {
    return logicalNot(lessThanOrEqual(b, a));
  }

  public static Indicator biggerThanOrEqual(Expression a, Expression b) {
    return lessThanOrEqual(b, a);
  }

  public static Indicator biggerThan(Expression a, Expression b) {
    return lessThan(b, a);
  }

  // cos^2(pi a) is 1 exactly at the integers and strictly below 1 elsewhere.
  public static Indicator isInteger(Expression a) {
    return Indicator.assume(floor(power(apply(COS, product(PI, a)), TWO)));
  }

  public static Indicator isNatural(Expression a) {
    return isNatural(a, false);
  }

  public static Indicator isNatural(Expression a, boolean includeZero) {
    Indicator sign = includeZero ? isNonNegative(a) : biggerThan(a, ZERO);
    return logicalAnd(isInteger(a), sign);
  }

  // a | b, for nonzero a.
  public static Indicator divides(Expression a, Expression b) {
    return isInteger(fraction(b, a));
  }

  public static Indicator doesNotDivide(Expression a, Expression b) {
    return logicalNot(divides(a, b));
  }

  // a mod b, for nonzero b.
  public static Expression getMod(Expression a, Expression b) {
    return difference(a, product(b, floor(fraction(a, b))));
  }

  public static Indicator isPrimeDivisors(Expression a) {
    return isPrimeDivisors(a, DEFAULT_DIVISOR_INDEX);
  }

  // No integer in [2, a - 1] divides a.
  public static Indicator isPrimeDivisors(Expression a, String indexLetter) {
    checkIndexLetter(indexLetter);

    Expression noDivisors =
        Expression.bigProduct(
            indexLetter, TWO, difference(a, ONE), doesNotDivide(atom(indexLetter), a));
    return logicalAnd(isNatural(a), isNatural(noDivisors, false));
  }

  // Wilson's theorem: a > 1 is prime iff a | (a - 1)! + 1.
  public static Indicator isPrimeWilson(Expression a) {
    Expression wilson = fraction(Expression.sum(factorial(difference(a, ONE)), ONE), a);
    return logicalAnd(lessThan(ONE, a), isInteger(wilson));
  }

  // The b-th digit after the decimal point, for b >= 1.
  public static Expression getPostDecimalPointDigit(Expression a, Expression b) {
    Expression shifted = floor(product(power(TEN, b), a));
    Expression shiftedOneLess = floor(product(power(TEN, difference(b, ONE)), a));
    return difference(shifted, product(TEN, shiftedOneLess));
  }

  public static Expression countInRange(Expression lo, Expression hi, Indicator indicator) {
    return countInRange(lo, hi, indicator, DEFAULT_RANGE_INDEX);
  }

  public static Expression countInRange(
      Expression lo, Expression hi, Indicator indicator, String indexLetter) {
    checkIndexLetter(indexLetter);

    return Expression.bigSum(indexLetter, lo, hi, indicator);
  }

  public static Indicator allInRange(Expression lo, Expression hi, Indicator indicator) {
    return allInRange(lo, hi, indicator, DEFAULT_RANGE_INDEX);
  }

  // A product of indicators, so a single miss zeroes it. An empty range yields 1.
  public static Indicator allInRange(
      Expression lo, Expression hi, Indicator indicator, String indexLetter) {
    checkIndexLetter(indexLetter);

    return Indicator.assume(Expression.bigProduct(indexLetter, lo, hi, indicator));
  }

  public static Indicator isRangeAtLeastExp(
      Expression lo, Expression hi, Expression n, Indicator indicator) {
    return isRangeAtLeastExp(lo, hi, n, indicator, DEFAULT_RANGE_INDEX);
  }

  // floor((n / count)^(1/n)); the count must be nonzero.
  public static Indicator isRangeAtLeastExp(
      Expression lo, Expression hi, Expression n, Indicator indicator, String indexLetter) {
    Expression count = countInRange(lo, hi, indicator, indexLetter);
    return Indicator.assume(floor(Expression.root(fraction(n, count), n)));
  }

  private static void checkIndexLetter(String indexLetter) {
    Preconditions.checkArgument(
        indexLetter.length() == 1 && Character.isLowerCase(indexLetter.charAt(0)),
        "Invalid index letter \"%s\"",
        indexLetter);
  }

  private IndicatorAlgebra() {}
}
