package raman.tools;

/**
 * Base of all checked errors raised while decoding, transforming or replaying a dataset.
 * Each subclass stands for one failure kind so that callers (and tests) can tell an out-of-range
 * frame number apart from, say, a degenerate integration window.
 */
public class ProcessingException extends Exception {

  private static final long serialVersionUID = 4108812279462733270L;

  public ProcessingException(String message) {
    super(message);
  }

  public ProcessingException(String message, Throwable cause) {
    super(message, cause);
  }
}
