package p2m;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

/**
 * Builds an expression from a call graph such as
 *
 * <pre>
 * {"logical_and": {"indicators": [
 *     {"is_integer": {"a": "n"}},
 *     {"bigger_than": {"a": "n", "b": 0}}]}}
 * </pre>
 *
 * <p>Operation names are resolved against an {@link OperationRegistry}. Expression arguments are
 * either scalars, taken as literal formula text, or single-entry maps naming a nested call. Raw
 * arguments are passed through as strings, numbers or booleans.
 *
 * <p>Instances hold no mutable state and may be shared between threads.
 */
public final class CallGraphCompiler {
  private final OperationRegistry registry;
  private final CompilerOptions options;

  public CallGraphCompiler(OperationRegistry registry) {
    this(registry, CompilerOptions.defaults());
  }

  public CallGraphCompiler(OperationRegistry registry, CompilerOptions options) {
    this.registry = registry;
    this.options = options;
  }

  // The root must be a single-entry map {operation: arguments}.
  public Expression compile(JsonElement root) throws CompilerException {
    if (!root.isJsonObject() || root.getAsJsonObject().size() != 1) {
      throw new CompilerException(
          CompilerException.Kind.MALFORMED_INPUT,
          CallPath.root(),
          "input must be a map with a single entry");
    }

    Map.Entry<String, JsonElement> entry = root.getAsJsonObject().entrySet().iterator().next();
    return compile(entry.getKey(), entry.getValue());
  }

  public Expression compile(String operationName, JsonElement arguments)
      throws CompilerException {
    return build(operationName, arguments, CallPath.root().operation(operationName), 1);
  }

  private Expression build(String operationName, JsonElement arguments, CallPath path, int depth)
      throws CompilerException {
    if (depth > options.maxDepth()) {
      throw new CompilerException(
          CompilerException.Kind.NESTING_TOO_DEEP,
          path,
          String.format("calls are nested more than %d deep", options.maxDepth()));
    }

    Optional<Operation> maybeOperation = registry.operation(operationName);
    if (!maybeOperation.isPresent()) {
      throw new CompilerException(
          CompilerException.Kind.OPERATION_NOT_FOUND,
          path,
          String.format("Operation \"%s\" not found", operationName));
    }
    Operation operation = maybeOperation.get();

    if (!arguments.isJsonObject()) {
      throw new CompilerException(
          CompilerException.Kind.MALFORMED_ARGUMENT,
          path,
          String.format("Arguments for \"%s\" must be a map", operationName));
    }
    JsonObject argumentMap = arguments.getAsJsonObject();

    for (String argName : argumentMap.keySet()) {
      if (!operation.parameter(argName).isPresent()) {
        throw new CompilerException(
            CompilerException.Kind.UNKNOWN_ARGUMENT,
            path.argument(argName),
            String.format(
                "Argument \"%s\" not found for operation \"%s\"", argName, operationName));
      }
    }

    Map<String, Object> values = new HashMap<>();
    for (Parameter parameter : operation.parameters()) {
      CallPath argPath = path.argument(parameter.name());
      JsonElement value = argumentMap.get(parameter.name());
      if (value == null) {
        if (!parameter.defaultValue().isPresent()) {
          throw new CompilerException(
              CompilerException.Kind.MISSING_ARGUMENT,
              argPath,
              String.format(
                  "Argument \"%s\" is required by operation \"%s\"",
                  parameter.name(), operationName));
        }
        values.put(parameter.name(), parameter.defaultValue().get());
        continue;
      }

      if (parameter.isRaw()) {
        values.put(parameter.name(), rawArgument(parameter, value, argPath));
      } else if (parameter.variadic()) {
        values.put(parameter.name(), expressionArguments(parameter, value, argPath, depth));
      } else {
        values.put(parameter.name(), expressionArgument(parameter, value, argPath, depth));
      }
    }

    try {
      return operation.invoke(Arguments.of(values));
    } catch (IllegalArgumentException ex) {
      throw new CompilerException(CompilerException.Kind.VALIDATION, path, ex.getMessage());
    }
  }

  private Expression expressionArgument(
      Parameter parameter, JsonElement value, CallPath path, int depth) throws CompilerException {
    ExpressionType type = registry.typeOf(parameter);

    if (value.isJsonPrimitive()) {
      JsonPrimitive primitive = value.getAsJsonPrimitive();
      if (primitive.isBoolean() || primitive.getAsString().isEmpty()) {
        throw new CompilerException(
            CompilerException.Kind.MALFORMED_ARGUMENT,
            path,
            "expected formula text, a number or a nested call");
      }
      return type.lift(Expression.atom(primitive.getAsString()));
    }

    if (!value.isJsonObject()) {
      throw new CompilerException(
          CompilerException.Kind.MALFORMED_ARGUMENT,
          path,
          "expected formula text, a number or a nested call");
    }

    JsonObject call = value.getAsJsonObject();
    if (call.size() != 1) {
      throw new CompilerException(
          CompilerException.Kind.MALFORMED_ARGUMENT,
          path,
          String.format("Argument \"%s\" must have a single entry", parameter.name()));
    }

    Map.Entry<String, JsonElement> entry = call.entrySet().iterator().next();
    Expression nested =
        build(entry.getKey(), entry.getValue(), path.operation(entry.getKey()), depth + 1);
    return type.lift(nested);
  }

  private ImmutableList<Expression> expressionArguments(
      Parameter parameter, JsonElement value, CallPath path, int depth) throws CompilerException {
    if (!value.isJsonArray()) {
      throw new CompilerException(
          CompilerException.Kind.MALFORMED_ARGUMENT,
          path,
          String.format("Argument \"%s\" must be a list", parameter.name()));
    }

    JsonArray array = value.getAsJsonArray();
    ImmutableList.Builder<Expression> elements = ImmutableList.builder();
    for (int i = 0; i < array.size(); i++) {
      elements.add(expressionArgument(parameter, array.get(i), path.element(i), depth));
    }
    return elements.build();
  }

  private static Object rawArgument(Parameter parameter, JsonElement value, CallPath path)
      throws CompilerException {
    Object raw = value;
    if (value.isJsonPrimitive()) {
      JsonPrimitive primitive = value.getAsJsonPrimitive();
      if (primitive.isBoolean()) {
        raw = primitive.getAsBoolean();
      } else if (primitive.isNumber()) {
        raw = primitive.getAsNumber();
      } else {
        raw = primitive.getAsString();
      }
    }

    if (!parameter.acceptsRaw(raw)) {
      throw new CompilerException(
          CompilerException.Kind.MALFORMED_ARGUMENT,
          path,
          String.format("Argument \"%s\" has the wrong type", parameter.name()));
    }
    return raw;
  }
}
