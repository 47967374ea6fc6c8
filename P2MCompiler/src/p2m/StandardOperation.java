package p2m;

import static p2m.Parameter.expression;
import static p2m.Parameter.expressions;
import static p2m.Parameter.raw;

import java.util.Locale;

import com.google.common.collect.ImmutableList;

// The built-in operation catalog. Each constant registers under its lower-cased name.
public enum StandardOperation {
  COMPOSE(
      args -> IndicatorAlgebra.compose(args.expressions("expressions")),
      expressions("expressions", "Expression")),
  LOGICAL_AND(
      args -> IndicatorAlgebra.logicalAnd(args.indicators("indicators")),
      expressions("indicators", "Indicator")),
  LOGICAL_NOT(
      args -> IndicatorAlgebra.logicalNot(args.indicator("indicator")),
      expression("indicator", "Indicator")),
  LOGICAL_OR(
      args -> IndicatorAlgebra.logicalOr(args.indicators("indicators")),
      expressions("indicators", "Indicator")),
  ARE_NOT_EQUAL(
      args -> IndicatorAlgebra.areNotEqual(args.expression("a"), args.expression("b")),
      expression("a", "Expression"),
      expression("b", "Expression")),
  ARE_EQUAL(
      args -> IndicatorAlgebra.areEqual(args.expression("a"), args.expression("b")),
      expression("a", "Expression"),
      expression("b", "Expression")),
  IS_NON_NEGATIVE(
      args -> IndicatorAlgebra.isNonNegative(args.expression("a")),
      expression("a", "Expression")),
  LESS_THAN_OR_EQUAL(
      args -> IndicatorAlgebra.lessThanOrEqual(args.expression("a"), args.expression("b")),
      expression("a", "Expression"),
      expression("b", "Expression")),
  LESS_THAN(
      args -> IndicatorAlgebra.lessThan(args.expression("a"), args.expression("b")),
      expression("a", "Expression"),
      expression("b", "Expression")),
  BIGGER_THAN_OR_EQUAL(
      args -> IndicatorAlgebra.biggerThanOrEqual(args.expression("a"), args.expression("b")),
      expression("a", "Expression"),
      expression("b", "Expression")),
  BIGGER_THAN(
      args -> IndicatorAlgebra.biggerThan(args.expression("a"), args.expression("b")),
      expression("a", "Expression"),
      expression("b", "Expression")),
  IS_INTEGER(
      args -> IndicatorAlgebra.isInteger(args.expression("a")), expression("a", "Expression")),
  IS_NATURAL(
      args -> IndicatorAlgebra.isNatural(args.expression("a"), args.bool("include_zero")),
      expression("a", "Expression"),
      raw("include_zero", Boolean.class).withDefault(false)),
  DIVIDES(
      args -> IndicatorAlgebra.divides(args.expression("a"), args.expression("b")),
      expression("a", "Expression"),
      expression("b", "Expression")),
  DOES_NOT_DIVIDE(
      args -> IndicatorAlgebra.doesNotDivide(args.expression("a"), args.expression("b")),
      expression("a", "Expression"),
      expression("b", "Expression")),
  GET_MOD(
      args -> IndicatorAlgebra.getMod(args.expression("a"), args.expression("b")),
      expression("a", "Expression"),
      expression("b", "Expression")),
  IS_PRIME_DIVISORS(
      args -> IndicatorAlgebra.isPrimeDivisors(args.expression("a"), args.string("index_letter")),
      expression("a", "Expression"),
      raw("index_letter", String.class).withDefault(IndicatorAlgebra.DEFAULT_DIVISOR_INDEX)),
  IS_PRIME_WILSON(
      args -> IndicatorAlgebra.isPrimeWilson(args.expression("a")),
      expression("a", "Expression")),
  GET_POST_DECIMAL_POINT_DIGIT(
      args ->
          IndicatorAlgebra.getPostDecimalPointDigit(args.expression("a"), args.expression("b")),
      expression("a", "Expression"),
      expression("b", "Expression")),
  ALL_IN_RANGE(
      args ->
          IndicatorAlgebra.allInRange(
              args.expression("lo"),
              args.expression("hi"),
              args.indicator("indicator"),
              args.string("index_letter")),
      expression("lo", "Expression"),
      expression("hi", "Expression"),
      expression("indicator", "Indicator"),
      raw("index_letter", String.class).withDefault(IndicatorAlgebra.DEFAULT_RANGE_INDEX)),
  COUNT_IN_RANGE(
      args ->
          IndicatorAlgebra.countInRange(
              args.expression("lo"),
              args.expression("hi"),
              args.indicator("indicator"),
              args.string("index_letter")),
      expression("lo", "Expression"),
      expression("hi", "Expression"),
      expression("indicator", "Indicator"),
      raw("index_letter", String.class).withDefault(IndicatorAlgebra.DEFAULT_RANGE_INDEX)),
  IS_RANGE_AT_LEAST_EXP(
      args ->
          IndicatorAlgebra.isRangeAtLeastExp(
              args.expression("lo"),
              args.expression("hi"),
              args.expression("n"),
              args.indicator("indicator"),
              args.string("index_letter")),
      expression("lo", "Expression"),
      expression("hi", "Expression"),
      expression("n", "Expression"),
      expression("indicator", "Indicator"),
      raw("index_letter", String.class).withDefault(IndicatorAlgebra.DEFAULT_RANGE_INDEX));

  private final Operation operation;

  StandardOperation(Operation.Invoker invoker, Parameter... parameters) {
    this.operation =
        Operation.create(toOperationName(name()), ImmutableList.copyOf(parameters), invoker);
  }

  // IS_INTEGER -> is_integer, whatever the default locale.
  static String toOperationName(String constantName) {
    return constantName.toLowerCase(Locale.ROOT);
  }

  public String operationName() {
    return operation.name();
  }

  public Operation operation() {
    return operation;
  }
}
