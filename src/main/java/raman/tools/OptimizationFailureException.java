package raman.tools;

/**
 * Thrown when the alignment search does not converge to a shift value.
 */
public class OptimizationFailureException extends ProcessingException {

  private static final long serialVersionUID = -7716354240098125413L;

  public OptimizationFailureException(String message) {
    super(message);
  }

  public OptimizationFailureException(String message, Throwable cause) {
    super(message, cause);
  }
}
