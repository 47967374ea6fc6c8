package p2m;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableMap;

/**
 * Immutable catalog of operations and expression types, indexed by name.
 *
 * <p>Operation names share one flat namespace. Adding the same operation instance twice is a no-op;
 * adding any other operation under a taken name is a {@link ConfigurationException}, even one with
 * equal parameters and invoker.
 */
public final class OperationRegistry {
  private static final Supplier<OperationRegistry> STANDARD =
      Suppliers.memoize(OperationRegistry::buildStandard);

  // Built on first use; thread-safe.
  public static OperationRegistry standard() {
    return STANDARD.get();
  }

  private static OperationRegistry buildStandard() {
    Builder builder = builder();
    for (ExpressionType type : ExpressionType.values()) {
      builder.addType(type);
    }
    for (StandardOperation op : StandardOperation.values()) {
      builder.addOperation(op.operation());
    }
    return builder.build();
  }

  private final ImmutableMap<String, Operation> operationsByName;
  private final ImmutableMap<String, ExpressionType> typesByName;

  private OperationRegistry(
      ImmutableMap<String, Operation> operationsByName,
      ImmutableMap<String, ExpressionType> typesByName) {
    this.operationsByName = operationsByName;
    this.typesByName = typesByName;
  }

  public Optional<Operation> operation(String name) {
    return Optional.ofNullable(operationsByName.get(name));
  }

  public Optional<ExpressionType> type(String typeName) {
    return Optional.ofNullable(typesByName.get(typeName));
  }

  // The type an EXPRESSION parameter is bound to. Resolved at build time, so always present.
  public ExpressionType typeOf(Parameter parameter) {
    return typesByName.get(parameter.typeName().get());
  }

  public Collection<Operation> operations() {
    return operationsByName.values();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private final Map<String, Operation> operationsByName = new LinkedHashMap<>();
    private final Map<String, ExpressionType> typesByName = new LinkedHashMap<>();

    private Builder() {}

    // Registers the type and its constructor, named after the type.
    public Builder addType(ExpressionType type) {
      ExpressionType prev = typesByName.get(type.typeName());
      if (prev != null && prev != type) {
        throw new ConfigurationException(
            String.format("Type \"%s\" is not unique", type.typeName()));
      }

      typesByName.put(type.typeName(), type);
      return addOperation(type.constructor());
    }

    public Builder addOperation(Operation operation) {
      Operation prev = operationsByName.get(operation.name());
      if (prev == operation) return this;
      if (prev != null) {
        throw new ConfigurationException(
            String.format("Operation \"%s\" is not unique", operation.name()));
      }

      operationsByName.put(operation.name(), operation);
      return this;
    }

    public OperationRegistry build() {
      for (Operation operation : operationsByName.values()) {
        for (Parameter parameter : operation.parameters()) {
          if (!parameter.isExpression()) continue;

          String typeName = parameter.typeName().orElse("");
          if (!typesByName.containsKey(typeName)) {
            throw new ConfigurationException(
                String.format(
                    "Parameter \"%s\" of \"%s\" has unknown type \"%s\"",
                    parameter.name(), operation.name(), typeName));
          }
        }
      }

      return new OperationRegistry(
          ImmutableMap.copyOf(operationsByName), ImmutableMap.copyOf(typesByName));
    }
  }
}
