package raman.tools.input;

import java.util.List;

/**
 * Decoder of an instrument data file. Implementations turn a vendor format into a shared
 * wavelength axis and one intensity array per acquired frame, each as long as the axis.
 */
public interface FrameSource {

  /**
   * @return wavelength of every detector pixel, in acquisition order
   */
  double[] getWavelengths();

  /**
   * @return raw counts per frame, each array as long as {@link #getWavelengths()}
   */
  List<long[]> getFrames();

  /**
   * @return free text describing the acquisition, kept as the dataset's previous comments
   */
  String getDescription();
}
