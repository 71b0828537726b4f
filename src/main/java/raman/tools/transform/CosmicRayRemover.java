package raman.tools.transform;

import raman.tools.InsufficientDataException;
import raman.tools.utils.ImageUtils;

/**
 * Cosmic ray detection and repair by Laplacian edge detection, after P. G. van Dokkum (2001),
 * "Cosmic-Ray Rejection by Laplacian Edge Detection", PASP 113, 1420.
 *
 * The image is indexed [pixel][frame]: a cosmic ray shows up as a sharp positive peak that is
 * narrow both along the spectrum and across frames. Each iteration
 * <ol>
 *   <li>computes the Laplacian edge map of the current image,</li>
 *   <li>divides it by twice the expected noise, sqrt(gain * median5x5 + readnoise^2) / gain,
 *   giving the significance map S,</li>
 *   <li>subtracts the 5x5 median of S from S, giving S',</li>
 *   <li>builds the fine structure image median3x3 - median7x7(median3x3),</li>
 *   <li>flags pixels with S' &gt; siglim and Laplacian / fine structure &gt; flim, and replaces
 *   them by their 3x3 median.</li>
 * </ol>
 * Pixels that are never flagged keep their exact input value.
 */
public class CosmicRayRemover {

  private final double siglim;
  private final double flim;
  private final double gain;
  private final double readnoise;

  private boolean[][] mask;

  /**
   * @param siglim threshold of the background-corrected significance S'
   * @param flim threshold of the ratio of Laplacian to fine structure
   * @param gain detector gain, electrons per count
   * @param readnoise detector read noise, electrons
   */
  public CosmicRayRemover(double siglim, double flim, double gain, double readnoise) {
    this.siglim = siglim;
    this.flim = flim;
    this.gain = gain;
    this.readnoise = readnoise;
  }

  /**
   * Remove cosmic rays from an image.
   *
   * @param image data as [pixel][frame] (not modified)
   * @param iterations number of detection and repair passes
   * @return repaired copy of the image
   * @throws InsufficientDataException if the image has fewer than 2 rows or 2 columns
   */
  public double[][] despike(double[][] image, int iterations) throws InsufficientDataException {
    int rows = image.length;
    int cols = rows == 0 ? 0 : image[0].length;
    if (rows < 2 || cols < 2) {
      throw new InsufficientDataException(
          "spectral dataset must have at least 2 rows and 2 columns, got " + rows + " and " + cols);
    }

    double[][] data = new double[rows][];
    for (int i = 0; i < rows; ++i) {
      data[i] = image[i].clone();
    }
    mask = new boolean[rows][cols];

    for (int iter = 0; iter < iterations; ++iter) {
      double[][] laplacian = ImageUtils.laplacianEdgeMap(data);

      double[][] median5 = ImageUtils.medianFilter(data, 5);
      double[][] significance = new double[rows][cols];
      for (int i = 0; i < rows; ++i) {
        for (int j = 0; j < cols; ++j) {
          double noise = Math.sqrt(gain * median5[i][j] + readnoise * readnoise) / gain;
          significance[i][j] = laplacian[i][j] / (2. * noise);
        }
      }
      double[][] significanceMedian = ImageUtils.medianFilter(significance, 5);

      double[][] median3 = ImageUtils.medianFilter(data, 3);
      double[][] median7 = ImageUtils.medianFilter(median3, 7);

      for (int i = 0; i < rows; ++i) {
        for (int j = 0; j < cols; ++j) {
          double correctedSignificance = significance[i][j] - significanceMedian[i][j];
          double fineStructure = median3[i][j] - median7[i][j];
          if (correctedSignificance > siglim && laplacian[i][j] / fineStructure > flim) {
            mask[i][j] = true;
            data[i][j] = median3[i][j];
          }
        }
      }
    }
    return data;
  }

  /**
   * @return pixels replaced in the last call to {@link #despike(double[][], int)}, [pixel][frame];
   * null before the first call
   */
  public boolean[][] getMask() {
    return mask;
  }
}
