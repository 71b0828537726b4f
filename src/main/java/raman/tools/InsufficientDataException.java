package raman.tools;

/**
 * Thrown when an algorithm gets too few points, rows or frames to work with.
 */
public class InsufficientDataException extends ProcessingException {

  private static final long serialVersionUID = 8849021150437925602L;

  public InsufficientDataException(String message) {
    super(message);
  }
}
