package raman.tools;

/**
 * Thrown when arrays or matrices do not have the lengths or dimensions an operation requires
 * (unequal frame lengths, odd column counts, a reshape that does not divide the data evenly).
 */
public class ShapeMismatchException extends ProcessingException {

  private static final long serialVersionUID = 3358815032912003147L;

  public ShapeMismatchException(String message) {
    super(message);
  }
}
