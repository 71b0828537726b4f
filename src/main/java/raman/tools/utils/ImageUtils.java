package raman.tools.utils;

import java.util.Arrays;

/**
 * Filters over two-dimensional images stored as [row][column] arrays, used by the cosmic-ray
 * removal. Every filter reads neighbours beyond the image border through {@link #mirrorIndex},
 * so border pixels see a reflected copy of their surroundings rather than zeros or wrapped data.
 */
public class ImageUtils {

  private ImageUtils() {
  }

  /**
   * Map an arbitrary index onto [0, length) by reflecting at both borders, duplicating the border
   * element: -1 maps to 0, -2 to 1, length to length - 1, length + 1 to length - 2.
   * Indices further out keep reflecting back and forth, so any offset is valid.
   *
   * @param index index to map, may be negative
   * @param length number of elements along the axis (positive)
   * @return index within the array
   */
  public static int mirrorIndex(int index, int length) {
    int period = 2 * length;
    int folded = index % period;
    if (folded < 0) {
      folded += period;
    }
    return folded < length ? folded : period - 1 - folded;
  }

  /**
   * Read an image value with mirrored boundary handling.
   *
   * @param image image data, [row][column]
   * @param row row index, may lie outside the image
   * @param col column index, may lie outside the image
   * @return value at the mirrored position
   */
  public static double mirroredGet(double[][] image, int row, int col) {
    int rows = image.length;
    int cols = image[0].length;
    return image[mirrorIndex(row, rows)][mirrorIndex(col, cols)];
  }

  /**
   * Sliding-window median filter with a square, odd-sized window. The window values are sorted
   * and the middle element taken; there is no averaging for even counts since the count is odd.
   *
   * @param image image to filter (not modified)
   * @param windowSize odd edge length of the window, e.g. 3, 5 or 7
   * @return new image holding the filtered values
   */
  public static double[][] medianFilter(double[][] image, int windowSize) {
    if (windowSize < 1 || windowSize % 2 == 0) {
      throw new IllegalArgumentException("median window size must be odd, got " + windowSize);
    }
    int rows = image.length;
    int cols = rows == 0 ? 0 : image[0].length;
    int half = windowSize / 2;
    double[] window = new double[windowSize * windowSize];
    double[][] filtered = new double[rows][cols];
    for (int i = 0; i < rows; ++i) {
      for (int j = 0; j < cols; ++j) {
        int k = 0;
        for (int di = -half; di <= half; ++di) {
          for (int dj = -half; dj <= half; ++dj) {
            window[k++] = mirroredGet(image, i + di, j + dj);
          }
        }
        Arrays.sort(window);
        filtered[i][j] = window[window.length / 2];
      }
    }
    return filtered;
  }

  /**
   * Laplacian edge map computed as if the image were upsampled by a factor of 2: each pixel is
   * split into four subpixels, each compared against the two axis neighbours it borders, using
   * the kernel
   * <pre>
   *   0 -1  0
   *  -1  4 -1
   *   0 -1  0
   * </pre>
   * Only positive subpixel responses are kept and summed, so sharp positive peaks give large
   * values and smooth slopes or dips give (close to) zero.
   *
   * @param image image data, [row][column] (not modified)
   * @return edge map of the same shape
   */
  public static double[][] laplacianEdgeMap(double[][] image) {
    int rows = image.length;
    int cols = rows == 0 ? 0 : image[0].length;
    double[][] edges = new double[rows][cols];
    for (int i = 0; i < rows; ++i) {
      for (int j = 0; j < cols; ++j) {
        double center = 2. * image[i][j];
        double up = mirroredGet(image, i - 1, j);
        double down = mirroredGet(image, i + 1, j);
        double left = mirroredGet(image, i, j - 1);
        double right = mirroredGet(image, i, j + 1);
        double[] subpixels = {
            center - up - left,
            center - up - right,
            center - down - left,
            center - down - right
        };
        double sum = 0.;
        for (double subpixel : subpixels) {
          if (subpixel > 0.) {
            sum += subpixel;
          }
        }
        edges[i][j] = sum;
      }
    }
    return edges;
  }
}
