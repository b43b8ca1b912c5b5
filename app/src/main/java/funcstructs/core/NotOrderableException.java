package funcstructs.core;

/** Raised when the elements of a word cannot be placed in a total order. */
public class NotOrderableException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public NotOrderableException(String message, Throwable cause) {
    super(message, cause);
  }
}
