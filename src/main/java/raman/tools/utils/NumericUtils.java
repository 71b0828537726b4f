package raman.tools.utils;

import java.util.Arrays;
import java.util.OptionalInt;
import raman.tools.DomainException;
import raman.tools.InsufficientDataException;
import raman.tools.ShapeMismatchException;

/**
 * Class containing methods to serve as math functions on spectral data: interpolation between
 * grids, nearest-value lookup, trapezoidal integration and rank statistics.
 * All methods are static and leave their input arrays untouched.
 */
public class NumericUtils {

  private NumericUtils() {
  }

  /**
   * Linearly interpolate the y-value at position x between the points (x0, y0) and (x1, y1).
   * The result is undefined (NaN or infinite) if x0 == x1.
   *
   * @param x position to interpolate at
   * @param x0 x-value of first point
   * @param x1 x-value of second point
   * @param y0 y-value of first point
   * @param y1 y-value of second point
   * @return interpolated y-value
   */
  public static double lininterp(double x, double x0, double x1, double y0, double y1) {
    double dx = x1 - x0;
    return (y1 * (x - x0) + y0 * (x1 - x)) / dx;
  }

  /**
   * Linearly interpolate the curve given by (xs, ys) onto the points of another grid.
   * For each grid value the segment [x0, x1) of xs containing it is used; a grid value equal to the
   * last value of xs gets the last y-value. Grid values outside the range of xs produce NaN.
   * The grid itself does not need to be sorted, but xs must increase monotonically.
   *
   * @param xs monotonically increasing x-values of the curve
   * @param ys y-values of the curve, same length as xs
   * @param grid positions to interpolate at
   * @return interpolated values, one per grid point
   */
  public static double[] linearResample(double[] xs, double[] ys, double[] grid) {
    double[] resampled = new double[grid.length];
    int n = Math.min(xs.length, ys.length);
    if (n < 2) {
      Arrays.fill(resampled, Double.NaN);
      return resampled;
    }
    for (int i = 0; i < grid.length; ++i) {
      double xi = grid[i];
      int upper = firstIndexAbove(xs, n, xi);
      int lower = upper - 1;
      if (lower >= 0 && upper < n) {
        resampled[i] = lininterp(xi, xs[lower], xs[upper], ys[lower], ys[upper]);
      } else if (xi == xs[n - 1]) {
        resampled[i] = ys[n - 1];
      } else {
        resampled[i] = Double.NaN;
      }
    }
    return resampled;
  }

  // binary search for the first index whose value is strictly greater than target
  private static int firstIndexAbove(double[] xs, int n, double target) {
    int low = 0;
    int high = n;
    while (low < high) {
      int mid = (low + high) >>> 1;
      // NaN on either side never counts as "above"
      if (xs[mid] > target) {
        high = mid;
      } else {
        low = mid + 1;
      }
    }
    return low;
  }

  /**
   * Get the index of the value in xs closest to target. NaN values are never chosen unless
   * every value is NaN, in which case nothing is returned.
   *
   * @param xs values to search
   * @param target value to look for
   * @return index of the nearest value, or empty if xs is empty or contains only NaN
   */
  public static OptionalInt nearestIndex(double[] xs, double target) {
    int best = -1;
    double bestDistance = Double.POSITIVE_INFINITY;
    for (int i = 0; i < xs.length; ++i) {
      double distance = Math.abs(xs[i] - target);
      if (Double.isNaN(distance)) {
        continue;
      }
      if (best < 0 || distance < bestDistance) {
        best = i;
        bestDistance = distance;
      }
    }
    return best < 0 ? OptionalInt.empty() : OptionalInt.of(best);
  }

  /**
   * Integrate y over the interval [min(left, right), max(left, right)] with the trapezoidal rule.
   * The window is clipped to the range of the data; where its bounds do not fall on the x-grid,
   * the y-values at the bounds are interpolated linearly so the first and last trapezoids are
   * narrower.
   *
   * If localBaseline is set, the straight line between the (interpolated) values at the window
   * bounds is subtracted, i.e. its trapezoidal area is removed from the result.
   *
   * @param xs x-values, monotonically increasing
   * @param ys y-values, same length as xs
   * @param left one bound of the integration window
   * @param right other bound of the integration window
   * @param localBaseline true if the line between the window bounds should be subtracted
   * @return area under the curve in the window
   * @throws ShapeMismatchException if xs and ys differ in length
   * @throws InsufficientDataException if fewer than two points are given
   * @throws DomainException if the window does not overlap the data or a baseline end point is
   * undefined
   */
  public static double trapz(double[] xs, double[] ys, double left, double right,
      boolean localBaseline)
      throws ShapeMismatchException, InsufficientDataException, DomainException {

    double lower = Math.min(left, right);
    double upper = Math.max(left, right);

    if (xs.length != ys.length) {
      throw new ShapeMismatchException("x and y must have the same length, got "
          + xs.length + " and " + ys.length);
    }
    int n = xs.length - 1;
    if (n < 1) {
      throw new InsufficientDataException("x and y must contain at least 2 elements");
    }
    if (xs[0] >= upper || xs[n] <= lower) {
      throw new DomainException("integration window [" + lower + ", " + upper
          + "] out of bounds of data range [" + xs[0] + ", " + xs[n] + "]");
    }

    double area = 0.;
    if (localBaseline) {
      double[] ends = linearResample(xs, ys, new double[]{lower, upper});
      if (Double.isNaN(ends[0]) || Double.isNaN(ends[1])) {
        throw new DomainException("local baseline undefined, integration window ["
            + lower + ", " + upper + "] out of bounds");
      }
      area -= singleTrapezoid(lower, upper, ends[0], ends[1]);
    }

    boolean insideWindow = false;
    for (int j = 1; j <= n; ++j) {
      double x0 = xs[j - 1];
      double x1 = xs[j];
      double y0 = ys[j - 1];
      double y1 = ys[j];

      if (x1 <= lower) {
        continue;
      }
      if (!insideWindow) {
        // first segment reaching into the window, cut it at the lower bound
        if (x0 < lower) {
          y0 = lininterp(lower, x0, x1, y0, y1);
          x0 = lower;
        }
        insideWindow = true;
      }

      boolean lastSegment = false;
      if (x1 >= upper) {
        if (x1 != upper) {
          y1 = lininterp(upper, x0, x1, y0, y1);
        }
        x1 = upper;
        lastSegment = true;
      }

      area += singleTrapezoid(x0, x1, y0, y1);

      if (lastSegment) {
        break;
      }
    }
    return area;
  }

  private static double singleTrapezoid(double x0, double x1, double y0, double y1) {
    return 0.5 * Math.abs(x1 - x0) * (y1 + y0);
  }

  /**
   * Get a quantile of the non-NaN values of an array, using the nearest-rank convention:
   * the sorted values are indexed at q * (n - 1), rounding half up.
   *
   * @param values data to get the quantile of (not modified)
   * @param q quantile between 0 and 1 (0.5 is the median)
   * @return value at the given quantile
   * @throws DomainException if q is outside [0, 1] or no non-NaN value exists
   */
  public static double quantileNearest(double[] values, double q) throws DomainException {
    if (!(q >= 0. && q <= 1.)) {
      throw new DomainException("quantile must be between 0 and 1, got " + q);
    }
    double[] sorted = Arrays.stream(values).filter(v -> !Double.isNaN(v)).sorted().toArray();
    if (sorted.length == 0) {
      throw new DomainException("cannot get quantile of empty or all-NaN data");
    }
    double position = q * (sorted.length - 1);
    int below = (int) Math.floor(position);
    int index = (position - below < 0.5) ? below : (int) Math.ceil(position);
    return sorted[index];
  }

  /**
   * Index of the largest non-NaN value in an array, the first one if there are several.
   *
   * @param values data to search
   * @return index of the maximum, or -1 if there are no non-NaN values
   */
  public static int argmax(double[] values) {
    int index = -1;
    for (int i = 0; i < values.length; ++i) {
      if (Double.isNaN(values[i])) {
        continue;
      }
      if (index < 0 || values[i] > values[index]) {
        index = i;
      }
    }
    return index;
  }
}
