package funcstructs.core;

/** Raised when a generator is constructed with parameters outside its domain. */
public class InvalidParameterException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public InvalidParameterException(String message) {
    super(message);
  }

  public static int requireNonNegative(int value, String name) {
    if (value < 0) {
      throw new InvalidParameterException(name + " must be non-negative, got " + value);
    }
    return value;
  }

  public static int requirePositive(int value, String name) {
    if (value < 1) {
      throw new InvalidParameterException(name + " must be positive, got " + value);
    }
    return value;
  }
}
