package raman.tools;

/**
 * Thrown when a frame selection would leave a dataset without any frame.
 */
public class EmptySelectionException extends ProcessingException {

  private static final long serialVersionUID = -2871603397517786042L;

  public EmptySelectionException(String message) {
    super(message);
  }
}
