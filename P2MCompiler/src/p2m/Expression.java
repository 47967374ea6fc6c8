package p2m;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import p2m.processor.FormulaChild;
import p2m.processor.FormulaNode;

// Immutable tree of a closed-form formula. Rendering happens only in LatexRenderer.
public abstract class Expression implements FormulaNodeInterface {

  public enum Type {
    // Leaves
    ATOM,

    // Arithmetic
    SUM,
    DIFFERENCE,
    PRODUCT,
    FRACTION,
    POWER,
    ROOT,
    FACTORIAL,

    // Rounding
    FLOOR,
    CEILING,

    // Functions and ranges
    APPLICATION,
    BIG_OPERATOR,

    // Caller-asserted 0/1 values
    INDICATOR;
  }

  private final Type type;
  private String latex = null;

  Expression(Type type) {
    this.type = type;
  }

  public final Type type() {
    return type;
  }

  // Atomic expressions can be embedded in any operator position without grouping.
  public boolean isAtomic() {
    return false;
  }

  @SuppressWarnings("unchecked")
  public <T extends Expression> T cast() {
    return (T) this;
  }

  @Override
  public final String toString() {
    if (latex == null) {
      latex = LatexRenderer.render(this);
    }
    return latex;
  }

  @Override
  public boolean equals(Object o) {
    if (o == null || o.getClass() != getClass()) return false;

    return toString().equals(o.toString());
  }

  @Override
  public int hashCode() {
    return toString().hashCode();
  }

  public static Atom atom(String text) {
    return new Atom(text);
  }

  public static Atom atom(long number) {
    return new Atom(Long.toString(number));
  }

  public static Expression sum(Expression... terms) {
    return new Sum(ImmutableList.copyOf(terms));
  }

  public static Expression difference(Expression minuend, Expression subtrahend) {
    return new Difference(minuend, subtrahend);
  }

  public static Expression product(Expression... factors) {
    return product(Arrays.asList(factors));
  }

  public static Expression product(List<? extends Expression> factors) {
    return new Product(ImmutableList.copyOf(factors));
  }

  public static Expression fraction(Expression numerator, Expression denominator) {
    return new Fraction(numerator, denominator);
  }

  public static Expression power(Expression base, Expression exponent) {
    return new Power(base, exponent);
  }

  public static Expression sqrt(Expression radicand) {
    return new Root(radicand, Optional.empty());
  }

  public static Expression root(Expression radicand, Expression degree) {
    return new Root(radicand, Optional.of(degree));
  }

  public static Expression factorial(Expression operand) {
    return new Factorial(operand);
  }

  public static Expression floor(Expression operand) {
    return new Floor(operand);
  }

  public static Expression ceiling(Expression operand) {
    return new Ceiling(operand);
  }

  public static Expression apply(Expression function, Expression argument) {
    return new Application(function, argument);
  }

  public static Expression bigSum(
      String indexLetter, Expression lo, Expression hi, Expression body) {
    return new BigOperator(BigOperator.Symbol.SUM, indexLetter, lo, hi, body);
  }

  public static Expression bigProduct(
      String indexLetter, Expression lo, Expression hi, Expression body) {
    return new BigOperator(BigOperator.Symbol.PRODUCT, indexLetter, lo, hi, body);
  }

  @FormulaNode
  public static final class Atom extends Expression implements Expression_Atom_FormulaNode {
    // Unsigned decimals, single letters and single LaTeX commands.
    private static final Pattern ATOMIC =
        Pattern.compile("[0-9]+(\\.[0-9]+)?|[A-Za-z]|\\\\[A-Za-z]+");

    private final String text;

    private Atom(String text) {
      super(Type.ATOM);
      Preconditions.checkArgument(!text.isEmpty(), "empty atom");
      this.text = text;
    }

    public String text() {
      return text;
    }

    @Override
    public boolean isAtomic() {
      return ATOMIC.matcher(text).matches();
    }
  }

  @FormulaNode
  public static final class Sum extends Expression implements Expression_Sum_FormulaNode {
    private final ImmutableList<Expression> terms;

    private Sum(ImmutableList<Expression> terms) {
      super(Type.SUM);
      Preconditions.checkArgument(terms.size() >= 2, "a sum needs at least two terms");
      this.terms = terms;
    }

    @FormulaChild
    @Override
    public ImmutableList<Expression> terms() {
      return terms;
    }
  }

  @FormulaNode
  public static final class Difference extends Expression
      implements Expression_Difference_FormulaNode {
    private final Expression minuend;
    private final Expression subtrahend;

    private Difference(Expression minuend, Expression subtrahend) {
      super(Type.DIFFERENCE);
      this.minuend = minuend;
      this.subtrahend = subtrahend;
    }

    @FormulaChild
    @Override
    public Expression minuend() {
      return minuend;
    }

    @FormulaChild
    @Override
    public Expression subtrahend() {
      return subtrahend;
    }
  }

  @FormulaNode
  public static final class Product extends Expression implements Expression_Product_FormulaNode {
    private final ImmutableList<Expression> factors;

    private Product(ImmutableList<Expression> factors) {
      super(Type.PRODUCT);
      Preconditions.checkArgument(!factors.isEmpty(), "a product needs at least one factor");
      this.factors = factors;
    }

    @FormulaChild
    @Override
    public ImmutableList<Expression> factors() {
      return factors;
    }
  }

  @FormulaNode
  public static final class Fraction extends Expression
      implements Expression_Fraction_FormulaNode {
    private final Expression numerator;
    private final Expression denominator;

    private Fraction(Expression numerator, Expression denominator) {
      super(Type.FRACTION);
      this.numerator = numerator;
      this.denominator = denominator;
    }

    @FormulaChild
    @Override
    public Expression numerator() {
      return numerator;
    }

    @FormulaChild
    @Override
    public Expression denominator() {
      return denominator;
    }
  }

  @FormulaNode
  public static final class Power extends Expression implements Expression_Power_FormulaNode {
    private final Expression base;
    private final Expression exponent;

    private Power(Expression base, Expression exponent) {
      super(Type.POWER);
      this.base = base;
      this.exponent = exponent;
    }

    @FormulaChild
    @Override
    public Expression base() {
      return base;
    }

    @FormulaChild
    @Override
    public Expression exponent() {
      return exponent;
    }
  }

  @FormulaNode
  public static final class Root extends Expression implements Expression_Root_FormulaNode {
    private final Expression radicand;
    private final Optional<Expression> degree;

    private Root(Expression radicand, Optional<Expression> degree) {
      super(Type.ROOT);
      this.radicand = radicand;
      this.degree = degree;
    }

    @FormulaChild
    @Override
    public Expression radicand() {
      return radicand;
    }

    // Absent for the square root.
    @FormulaChild
    @Override
    public Optional<Expression> degree() {
      return degree;
    }
  }

  @FormulaNode
  public static final class Factorial extends Expression
      implements Expression_Factorial_FormulaNode {
    private final Expression operand;

    private Factorial(Expression operand) {
      super(Type.FACTORIAL);
      this.operand = operand;
    }

    @FormulaChild
    @Override
    public Expression operand() {
      return operand;
    }
  }

  @FormulaNode
  public static final class Floor extends Expression implements Expression_Floor_FormulaNode {
    private final Expression operand;

    private Floor(Expression operand) {
      super(Type.FLOOR);
      this.operand = operand;
    }

    @FormulaChild
    @Override
    public Expression operand() {
      return operand;
    }
  }

  @FormulaNode
  public static final class Ceiling extends Expression implements Expression_Ceiling_FormulaNode {
    private final Expression operand;

    private Ceiling(Expression operand) {
      super(Type.CEILING);
      this.operand = operand;
    }

    @FormulaChild
    @Override
    public Expression operand() {
      return operand;
    }
  }

  // A function applied to a single argument, e.g. \cos\left(x\right).
  @FormulaNode
  public static final class Application extends Expression
      implements Expression_Application_FormulaNode {
    private final Expression function;
    private final Expression argument;

    private Application(Expression function, Expression argument) {
      super(Type.APPLICATION);
      this.function = function;
      this.argument = argument;
    }

    @FormulaChild
    @Override
    public Expression function() {
      return function;
    }

    @FormulaChild
    @Override
    public Expression argument() {
      return argument;
    }
  }

  // \sum or \prod of a body over the integers lo..hi bound to a single index letter.
  @FormulaNode
  public static final class BigOperator extends Expression
      implements Expression_BigOperator_FormulaNode {

    public enum Symbol {
      SUM("\\sum"),
      PRODUCT("\\prod");

      private final String latex;

      Symbol(String latex) {
        this.latex = latex;
      }

      public String latex() {
        return latex;
      }
    }

    private final Symbol symbol;
    private final String indexLetter;
    private final Expression lo;
    private final Expression hi;
    private final Expression body;

    private BigOperator(
        Symbol symbol, String indexLetter, Expression lo, Expression hi, Expression body) {
      super(Type.BIG_OPERATOR);
      this.symbol = symbol;
      this.indexLetter = indexLetter;
      this.lo = lo;
      this.hi = hi;
      this.body = body;
    }

    public Symbol symbol() {
      return symbol;
    }

    public String indexLetter() {
      return indexLetter;
    }

    @FormulaChild
    @Override
    public Expression lo() {
      return lo;
    }

    @FormulaChild
    @Override
    public Expression hi() {
      return hi;
    }

    @FormulaChild
    @Override
    public Expression body() {
      return body;
    }
  }
}
