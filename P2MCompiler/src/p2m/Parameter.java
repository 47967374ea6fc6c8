package p2m;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

// One declared parameter of an Operation.
@AutoValue
public abstract class Parameter {

  public enum Kind {
    // A literal or a nested call, built recursively.
    EXPRESSION,
    // A primitive value, passed through verbatim.
    RAW;
  }

  public abstract String name();

  public abstract Kind kind();

  // The name of the ExpressionType an EXPRESSION parameter is bound to.
  public abstract Optional<String> typeName();

  // Takes a list of expressions rather than a single one.
  public abstract boolean variadic();

  // Java types a RAW parameter accepts.
  public abstract ImmutableSet<Class<?>> rawTypes();

  public abstract Optional<Object> defaultValue();

  public final boolean isExpression() {
    return kind() == Kind.EXPRESSION;
  }

  public final boolean isRaw() {
    return kind() == Kind.RAW;
  }

  public final boolean acceptsRaw(Object value) {
    return rawTypes().stream().anyMatch(t -> t.isInstance(value));
  }

  public final Parameter withDefault(Object defaultValue) {
    Preconditions.checkState(isRaw(), "only raw parameters have defaults: %s", name());
    Preconditions.checkArgument(acceptsRaw(defaultValue), "bad default for %s", name());
    return toBuilder().setDefaultValue(defaultValue).build();
  }

  public static Parameter expression(String name, String typeName) {
    return builder(name, Kind.EXPRESSION).setTypeName(typeName).build();
  }

  public static Parameter expressions(String name, String typeName) {
    return builder(name, Kind.EXPRESSION).setTypeName(typeName).setVariadic(true).build();
  }

  public static Parameter raw(String name, Class<?>... rawTypes) {
    Preconditions.checkArgument(rawTypes.length > 0, "no raw types for %s", name);
    return builder(name, Kind.RAW).setRawTypes(ImmutableSet.copyOf(rawTypes)).build();
  }

  private static Builder builder(String name, Kind kind) {
    return new AutoValue_Parameter.Builder()
        .setName(name)
        .setKind(kind)
        .setVariadic(false)
        .setRawTypes(ImmutableSet.of());
  }

  abstract Builder toBuilder();

  @AutoValue.Builder
  abstract static class Builder {
    abstract Builder setName(String name);

    abstract Builder setKind(Kind kind);

    abstract Builder setTypeName(String typeName);

    abstract Builder setVariadic(boolean variadic);

    abstract Builder setRawTypes(ImmutableSet<Class<?>> rawTypes);

    abstract Builder setDefaultValue(Object defaultValue);

    abstract Parameter build();
  }
}
