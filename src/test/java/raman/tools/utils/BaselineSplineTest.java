package raman.tools.utils;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.List;
import org.apache.commons.math3.util.Pair;
import org.junit.Test;

public class BaselineSplineTest {

  @Test
  public void collinearAnchorsGiveStraightLine() {
    List<Pair<Double, Double>> points = Arrays.asList(
        new Pair<>(0., 0.), new Pair<>(1., 2.), new Pair<>(2., 4.), new Pair<>(3., 6.));
    BaselineSpline spline = new BaselineSpline(points);
    for (double x = 0.; x <= 3.; x += 0.25) {
      assertEquals(2 * x, spline.sample(x, Double.NaN), 1E-12);
    }
  }

  @Test
  public void anchorsAreSortedAndHit() {
    List<Pair<Double, Double>> points = Arrays.asList(
        new Pair<>(4., 1.), new Pair<>(0., 3.), new Pair<>(2., 5.), new Pair<>(1., -1.));
    BaselineSpline spline = new BaselineSpline(points);
    assertEquals(3., spline.sample(0., Double.NaN), 1E-12);
    assertEquals(-1., spline.sample(1., Double.NaN), 1E-12);
    assertEquals(5., spline.sample(2., Double.NaN), 1E-12);
    assertEquals(1., spline.sample(4., Double.NaN), 1E-12);
  }

  @Test
  public void outsideAnchorRange() {
    BaselineSpline spline = new BaselineSpline(
        Arrays.asList(new Pair<>(1., 1.), new Pair<>(2., 2.)));
    double[] sampled = spline.sample(new double[]{0., 1.5, 2., 3.});
    assertEquals(0., sampled[0], 0.);
    assertEquals(1.5, sampled[1], 1E-12);
    assertEquals(2., sampled[2], 0.);
    assertEquals(0., sampled[3], 0.);
    assertEquals(-7., spline.sample(3., -7.), 0.);
  }

  @Test
  public void lastAnchorIsInclusive() {
    BaselineSpline spline = new BaselineSpline(
        Arrays.asList(new Pair<>(0., 1.), new Pair<>(5., 3.), new Pair<>(10., 7.)));
    assertEquals(7., spline.sample(10., Double.NaN), 0.);
    assertEquals(1., spline.sample(0., Double.NaN), 0.);
    assertEquals(-1., spline.sample(Math.nextUp(10.), -1.), 0.);
    assertEquals(-1., spline.sample(Math.nextDown(0.), -1.), 0.);
  }

  @Test(expected = IllegalArgumentException.class)
  public void singleAnchorIsRejected() {
    new BaselineSpline(Arrays.asList(new Pair<>(1., 1.)));
  }
}
