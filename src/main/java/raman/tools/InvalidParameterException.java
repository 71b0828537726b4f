package raman.tools;

/**
 * Thrown when a transformer is configured with parameters that contradict each other or the
 * dataset, e.g. a subtrahend frame that is also listed among its minuends.
 */
public class InvalidParameterException extends ProcessingException {

  private static final long serialVersionUID = 2231949107658824436L;

  public InvalidParameterException(String message) {
    super(message);
  }
}
