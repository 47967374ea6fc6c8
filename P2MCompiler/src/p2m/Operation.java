package p2m;

import java.util.Optional;
import java.util.stream.Collectors;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

// A named, pure function from resolved arguments to an expression.
@AutoValue
public abstract class Operation {

  @FunctionalInterface
  public interface Invoker {
    // Precondition failures surface as IllegalArgumentException.
    Expression invoke(Arguments args);
  }

  public abstract String name();

  public abstract ImmutableList<Parameter> parameters();

  public abstract Invoker invoker();

  @Memoized
  ImmutableMap<String, Parameter> parametersByName() {
    return Maps.uniqueIndex(parameters(), Parameter::name);
  }

  public Optional<Parameter> parameter(String name) {
    return Optional.ofNullable(parametersByName().get(name));
  }

  public final Expression invoke(Arguments args) {
    return invoker().invoke(args);
  }

  public static Operation create(
      String name, ImmutableList<Parameter> parameters, Invoker invoker) {
    return new AutoValue_Operation(name, parameters, invoker);
  }

  @Override
  public final String toString() {
    return String.format(
        "%s(%s)",
        name(),
        parameters().stream().map(Parameter::name).collect(Collectors.joining(", ")));
  }
}
