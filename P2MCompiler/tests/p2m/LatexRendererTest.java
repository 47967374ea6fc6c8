package p2m;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static p2m.Expression.apply;
import static p2m.Expression.atom;
import static p2m.Expression.ceiling;
import static p2m.Expression.difference;
import static p2m.Expression.factorial;
import static p2m.Expression.floor;
import static p2m.Expression.fraction;
import static p2m.Expression.power;
import static p2m.Expression.product;
import static p2m.Expression.sum;

import org.junit.jupiter.api.Test;

public class LatexRendererTest {

  private static void assertRenders(Expression expression, String latex) {
    assertThat(expression.toString()).isEqualTo(latex);
  }

  @Test
  public void atoms() {
    assertRenders(atom(42), "42");
    assertRenders(atom("\\pi"), "\\pi");
    assertThat(atom("3.5").isAtomic()).isTrue();
    assertThat(atom("x").isAtomic()).isTrue();
    assertThat(atom("\\pi").isAtomic()).isTrue();
    assertThat(atom("-1").isAtomic()).isFalse();
    assertThat(atom("xy").isAtomic()).isFalse();
    assertThat(atom("x+1").isAtomic()).isFalse();
    assertThrows(IllegalArgumentException.class, () -> atom(""));
  }

  @Test
  public void nonAtomicOperandsAreGrouped() {
    assertRenders(difference(atom(1), sum(atom("x"), atom(1))), "1-\\left(x+1\\right)");
    assertRenders(difference(atom("a"), atom("b")), "a-b");
    assertRenders(difference(atom("x+1"), atom(-2)), "\\left(x+1\\right)-\\left(-2\\right)");
    assertRenders(
        power(difference(atom("a"), atom("b")), atom(2)), "\\left(a-b\\right)^{2}");
    assertRenders(factorial(difference(atom("n"), atom(1))), "\\left(n-1\\right)!");
    assertRenders(factorial(atom("n")), "n!");
  }

  @Test
  public void productFactorsAreAlwaysGrouped() {
    assertRenders(product(atom(4), atom("x")), "\\left(4\\right)\\left(x\\right)");
  }

  @Test
  public void delimitedSlotsUseBraces() {
    assertRenders(fraction(sum(atom("a"), atom(1)), atom("b")), "\\frac{a+1}{b}");
    assertRenders(Expression.sqrt(power(atom("a"), atom(2))), "\\sqrt{a^{2}}");
    assertRenders(Expression.root(atom("x"), atom("n")), "\\sqrt[n]{x}");
    assertRenders(power(atom(10), difference(atom("b"), atom(1))), "10^{b-1}");
  }

  @Test
  public void rounding() {
    assertRenders(floor(atom("x")), "\\left\\lfloor x\\right\\rfloor");
    assertRenders(ceiling(fraction(atom(1), atom(2))), "\\left\\lceil \\frac{1}{2}\\right\\rceil");
  }

  @Test
  public void sumTerms() {
    assertRenders(sum(atom("x"), atom(2), atom("\\pi")), "x+2+\\pi");
    assertRenders(
        sum(atom("x"), difference(atom("a"), atom("b"))), "x+\\left(a-b\\right)");
    assertRenders(
        sum(floor(atom("x")), atom(1)), "\\left(\\left\\lfloor x\\right\\rfloor\\right)+1");
    assertThrows(IllegalArgumentException.class, () -> sum(atom("x")));
  }

  @Test
  public void functionArgumentsAreGrouped() {
    assertRenders(apply(atom("\\cos"), atom("x")), "\\cos\\left(x\\right)");
    assertRenders(
        apply(sum(atom("f"), atom("g")), atom("x")), "\\left(f+g\\right)\\left(x\\right)");
    assertRenders(
        apply(apply(atom("f"), atom("y")), atom("x")),
        "\\left(f\\left(y\\right)\\right)\\left(x\\right)");
  }

  @Test
  public void bigOperators() {
    assertRenders(
        Expression.bigSum("k", atom(1), atom(10), atom("k")),
        "\\sum_{k=1}^{10}\\left(k\\right)");
    assertRenders(
        Expression.bigProduct("i", atom(2), difference(atom("a"), atom(1)), atom("i")),
        "\\prod_{i=2}^{a-1}\\left(i\\right)");
  }

  @Test
  public void indicatorsRenderLikeTheirBody() {
    Indicator indicator = Indicator.assume(sum(atom("x"), atom(1)));
    assertRenders(indicator, "x+1");
    assertRenders(difference(atom(1), indicator), "1-\\left(x+1\\right)");
    assertThat(Indicator.assume(indicator)).isSameInstanceAs(indicator);
  }

  @Test
  public void areNotEqualFormula() {
    assertRenders(
        IndicatorAlgebra.areNotEqual(atom("a"), atom("b")),
        "\\left\\lceil \\frac{\\left(4\\right)\\left(\\left(\\arctan\\left(a-b\\right)\\right)^{2}"
            + "\\right)}{\\pi^{2}}\\right\\rceil");
  }

  @Test
  public void isIntegerFormula() {
    assertRenders(
        IndicatorAlgebra.isInteger(atom("x")),
        "\\left\\lfloor \\left(\\cos\\left(\\left(\\pi\\right)\\left(x\\right)\\right)\\right)^{2}"
            + "\\right\\rfloor");
  }

  @Test
  public void structuralEquality() {
    assertThat(sum(atom("x"), atom(1))).isEqualTo(sum(atom("x"), atom("1")));
    assertThat(sum(atom("x"), atom(1))).isNotEqualTo(sum(atom(1), atom("x")));
    assertThat(Indicator.assume(atom("x"))).isNotEqualTo(atom("x"));
  }
}
