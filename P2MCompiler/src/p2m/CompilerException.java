package p2m;

import java.io.PrintStream;

// A problem with the call graph being compiled. Nothing is produced when one is thrown.
public class CompilerException extends Exception {
  private static final long serialVersionUID = 1L;

  public enum Category {
    RESOLUTION,
    SHAPE,
    VALIDATION;
  }

  public enum Kind {
    OPERATION_NOT_FOUND(Category.RESOLUTION),
    UNKNOWN_ARGUMENT(Category.RESOLUTION),
    MISSING_ARGUMENT(Category.RESOLUTION),
    MALFORMED_ARGUMENT(Category.SHAPE),
    MALFORMED_INPUT(Category.SHAPE),
    NESTING_TOO_DEEP(Category.SHAPE),
    VALIDATION(Category.VALIDATION);

    private final Category category;

    Kind(Category category) {
      this.category = category;
    }

    public Category category() {
      return category;
    }
  }

  private final Kind kind;
  private final CallPath path;
  private final String errorMsg;

  public CompilerException(Kind kind, CallPath path, String errorMsg) {
    super(String.format("%s: %s", path, errorMsg));
    this.kind = kind;
    this.path = path;
    this.errorMsg = errorMsg;
  }

  public Kind kind() {
    return kind;
  }

  public Category category() {
    return kind.category();
  }

  public CallPath path() {
    return path;
  }

  public void print() {
    print(System.err);
  }

  public void print(PrintStream out) {
    out.println(String.format("ERROR: %s %s", path, errorMsg));
  }
}
