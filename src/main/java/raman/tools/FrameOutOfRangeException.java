package raman.tools;

/**
 * Thrown when a 1-based frame number is zero or larger than the number of frames in a dataset.
 */
public class FrameOutOfRangeException extends ProcessingException {

  private static final long serialVersionUID = 6630194483218551507L;

  public FrameOutOfRangeException(String message) {
    super(message);
  }
}
