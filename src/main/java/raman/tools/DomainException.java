package raman.tools;

/**
 * Thrown when a numeric operation is undefined for its input, e.g. an integration window that
 * does not overlap the data or an interpolation at an undefined position.
 */
public class DomainException extends ProcessingException {

  private static final long serialVersionUID = -5427316613068840013L;

  public DomainException(String message) {
    super(message);
  }
}
