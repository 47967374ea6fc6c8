package p2m;

import com.google.common.collect.ImmutableList;

// The expression types parameters can be bound to by name. Each contributes a constructor
// operation registered under its type name.
public enum ExpressionType {
  EXPRESSION("Expression") {
    @Override
    public Expression lift(Expression expression) {
      return expression;
    }
  },
  INDICATOR("Indicator") {
    @Override
    public Expression lift(Expression expression) {
      return Indicator.assume(expression);
    }
  };

  private static final String CONSTRUCTOR_PARAMETER = "expression";

  private final String typeName;
  private final Operation constructor;

  ExpressionType(String typeName) {
    this.typeName = typeName;
    this.constructor =
        Operation.create(
            typeName,
            ImmutableList.of(Parameter.raw(CONSTRUCTOR_PARAMETER, String.class, Number.class)),
            args -> lift(Expression.atom(args.scalarText(CONSTRUCTOR_PARAMETER))));
  }

  public String typeName() {
    return typeName;
  }

  // Converts a built argument into a value of this type.
  public abstract Expression lift(Expression expression);

  public Operation constructor() {
    return constructor;
  }
}
