package raman.tools;

/**
 * Wraps the failure of a single pipeline step. The message names the step (1-based) and the
 * transformer tag; {@link #getCause()} holds the original error.
 */
public class PipelineException extends ProcessingException {

  private static final long serialVersionUID = -1923405127738645521L;

  private final int step;
  private final String transformation;

  public PipelineException(int step, String transformation, ProcessingException cause) {
    super("step " + step + " (" + transformation + ") failed: " + cause.getMessage(), cause);
    this.step = step;
    this.transformation = transformation;
  }

  /**
   * @return 1-based position of the failed transformer in its pipeline
   */
  public int getStep() {
    return step;
  }

  /**
   * @return tag of the failed transformer, e.g. "SubtractTransform"
   */
  public String getTransformation() {
    return transformation;
  }
}
