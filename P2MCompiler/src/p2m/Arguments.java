package p2m;

import java.util.Map;

import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

// Resolved arguments of one operation call, keyed by parameter name.
public final class Arguments {
  private final ImmutableMap<String, Object> values;

  private Arguments(ImmutableMap<String, Object> values) {
    this.values = values;
  }

  public static Arguments of(Map<String, ?> values) {
    return new Arguments(ImmutableMap.copyOf(values));
  }

  private <T> T get(String name, Class<T> clazz) {
    Object value = values.get(name);
    Verify.verifyNotNull(value, "no argument %s", name);
    Verify.verify(clazz.isInstance(value), "argument %s is not a %s", name, clazz.getSimpleName());
    return clazz.cast(value);
  }

  public Expression expression(String name) {
    return get(name, Expression.class);
  }

  public Indicator indicator(String name) {
    return Indicator.assume(expression(name));
  }

  public ImmutableList<Expression> expressions(String name) {
    ImmutableList<?> list = get(name, ImmutableList.class);
    return list.stream().map(Expression.class::cast).collect(ImmutableList.toImmutableList());
  }

  public ImmutableList<Indicator> indicators(String name) {
    return expressions(name)
        .stream()
        .map(Indicator::assume)
        .collect(ImmutableList.toImmutableList());
  }

  public String string(String name) {
    return get(name, String.class);
  }

  public boolean bool(String name) {
    return get(name, Boolean.class);
  }

  // Text of a scalar raw argument (a string or a number as written).
  public String scalarText(String name) {
    return get(name, Object.class).toString();
  }
}
