package raman.tools.input;

/**
 * View of one frame of a {@link Dataset}: the x column (wavelength or shift) and the y column
 * (intensity) of a single spectral scan. The arrays are the dataset's own columns, so writing to
 * them changes the dataset.
 */
public class Frame {

  private final int index;
  private final double[] x;
  private final double[] y;

  Frame(int index, double[] x, double[] y) {
    this.index = index;
    this.x = x;
    this.y = y;
  }

  /**
   * @return 0-based position of the frame in the dataset
   */
  public int getIndex() {
    return index;
  }

  /**
   * @return 1-based frame number as used on the command line and in provenance logs
   */
  public int getNumber() {
    return index + 1;
  }

  public double[] getX() {
    return x;
  }

  public double[] getY() {
    return y;
  }

  public int size() {
    return x.length;
  }
}
