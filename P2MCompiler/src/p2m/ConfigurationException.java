package p2m;

// A defect in an operation catalog, found while building an OperationRegistry.
public class ConfigurationException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  public ConfigurationException(String message) {
    super(message);
  }
}
