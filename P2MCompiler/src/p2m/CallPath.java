package p2m;

// Where in the call graph something happened, e.g. logical_and.indicators[1].bigger_than.b
public final class CallPath {
  private static final CallPath ROOT = new CallPath("");

  public static CallPath root() {
    return ROOT;
  }

  private final String path;

  private CallPath(String path) {
    this.path = path;
  }

  public CallPath operation(String operationName) {
    return child(operationName);
  }

  public CallPath argument(String argumentName) {
    return child(argumentName);
  }

  public CallPath element(int index) {
    return new CallPath(String.format("%s[%d]", path, index));
  }

  private CallPath child(String name) {
    return new CallPath(path.isEmpty() ? name : path + "." + name);
  }

  public boolean isRoot() {
    return path.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof CallPath)) return false;

    CallPath that = (CallPath) o;
    return this.path.equals(that.path);
  }

  @Override
  public int hashCode() {
    return path.hashCode();
  }

  @Override
  public String toString() {
    return isRoot() ? "<root>" : path;
  }
}
