package raman.tools.utils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.apache.commons.math3.util.Pair;

/**
 * Piecewise spline through a set of anchor points, used to model a spectral baseline.
 * The first and the last segment are straight lines; interior segments are non-uniform
 * Catmull-Rom curves (cubic Hermite with tangents taken from the neighbouring anchors), so the
 * curve passes through every anchor, bends smoothly inside and stays linear towards the edges.
 *
 * Anchors are sorted by x on construction. The spline is defined on the closed range from the
 * first to the last anchor.
 */
public class BaselineSpline {

  private final double[] xs;
  private final double[] ys;

  /**
   * Build the spline from (x, y) anchor points.
   *
   * @param points anchor points, at least two
   */
  public BaselineSpline(List<Pair<Double, Double>> points) {
    if (points.size() < 2) {
      throw new IllegalArgumentException("a spline needs at least 2 anchor points, got "
          + points.size());
    }
    List<Pair<Double, Double>> sorted = new ArrayList<>(points);
    sorted.sort(Comparator.comparingDouble(Pair::getFirst));
    xs = new double[sorted.size()];
    ys = new double[sorted.size()];
    for (int i = 0; i < sorted.size(); ++i) {
      xs[i] = sorted.get(i).getFirst();
      ys[i] = sorted.get(i).getSecond();
    }
  }

  /**
   * Evaluate the spline.
   *
   * @param x position to sample
   * @param outside value to return if x lies outside the anchor range
   * @return spline value at x
   */
  public double sample(double x, double outside) {
    int n = xs.length;
    if (x == xs[n - 1]) {
      return ys[n - 1];
    }
    int segment = -1;
    for (int i = 0; i < n - 1; ++i) {
      if (xs[i] <= x && x < xs[i + 1]) {
        segment = i;
        break;
      }
    }
    if (segment < 0) {
      return outside;
    }

    double s = (x - xs[segment]) / (xs[segment + 1] - xs[segment]);
    if (segment == 0 || segment == n - 2) {
      return ys[segment] + s * (ys[segment + 1] - ys[segment]);
    }
    return catmullRom(segment, s);
  }

  /**
   * Sample the spline at every given position, using 0 outside the anchor range.
   *
   * @param positions x-values to sample at
   * @return spline values
   */
  public double[] sample(double[] positions) {
    double[] values = new double[positions.length];
    for (int i = 0; i < positions.length; ++i) {
      values[i] = sample(positions[i], 0.);
    }
    return values;
  }

  // cubic Hermite segment between anchors k and k+1, tangents from anchors k-1 and k+2
  private double catmullRom(int k, double s) {
    double t0 = xs[k - 1];
    double t1 = xs[k];
    double t2 = xs[k + 1];
    double t3 = xs[k + 2];
    double width = t2 - t1;
    double m0 = (ys[k + 1] - ys[k - 1]) / (t2 - t0) * width;
    double m1 = (ys[k + 2] - ys[k]) / (t3 - t1) * width;

    double s2 = s * s;
    double s3 = s2 * s;
    return ys[k] * (2 * s3 - 3 * s2 + 1)
        + m0 * (s3 - 2 * s2 + s)
        + ys[k + 1] * (3 * s2 - 2 * s3)
        + m1 * (s3 - s2);
  }
}
