package raman.tools.transform;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.junit.Test;
import raman.tools.InvalidParameterException;
import raman.tools.OptimizationFailureException;
import raman.tools.ShapeMismatchException;
import raman.tools.input.Dataset;
import raman.tools.test.TestUtils;

public class AlignTransformTest {

  private static double[] gaussian(double[] x, double center) {
    double[] y = new double[x.length];
    for (int i = 0; i < x.length; ++i) {
      double d = x[i] - center;
      y[i] = Math.exp(-d * d / 2.);
    }
    return y;
  }

  @Test
  public void findsShiftOfDisplacedPeak() throws Exception {
    double[] x = TestUtils.range(-5., 0.1, 101);
    Dataset dataset = TestUtils.fromColumns(x, gaussian(x, 0.), x, gaussian(x, 0.3));
    double dx = AlignTransform.findShift(dataset.getFrame(0), dataset.getFrame(1), 0.5, 500);
    // overlap of linearly resampled frames only resolves shifts to one grid step
    assertEquals(-0.3, dx, 0.1);
  }

  @Test(expected = OptimizationFailureException.class)
  public void evaluationLimitExceeded() throws Exception {
    double[] x = TestUtils.range(-5., 0.1, 101);
    Dataset dataset = TestUtils.fromColumns(x, gaussian(x, 0.), x, gaussian(x, 0.3));
    AlignTransform.findShift(dataset.getFrame(0), dataset.getFrame(1), 0.5, 1);
  }

  @Test(expected = ShapeMismatchException.class)
  public void framesOfDifferentLength() throws Exception {
    Dataset reference = TestUtils.fromColumns(new double[]{0, 1, 2}, new double[]{0, 1, 0});
    Dataset other = TestUtils.fromColumns(new double[]{0, 1}, new double[]{1, 0});
    AlignTransform.findShift(reference.getFrame(0), other.getFrame(0), 0.5, 500);
  }

  @Test
  public void alignsFramesOntoReferenceGrid() throws Exception {
    double[] x = TestUtils.range(-5., 0.1, 101);
    double[] shiftedX = TestUtils.range(-4.97, 0.1, 101);
    double[] reference = gaussian(x, 0.);
    Dataset dataset = TestUtils.fromColumns(x, reference, shiftedX, gaussian(shiftedX, 0.04));
    new AlignTransform(0.1).transform(dataset);
    assertArrayEquals(x, dataset.getFrame(1).getX(), 0.);
    double[] aligned = dataset.getFrame(1).getY();
    for (int i = 10; i < 90; ++i) {
      assertEquals(reference[i], aligned[i], 2E-2);
    }
  }

  @Test(expected = InvalidParameterException.class)
  public void zeroSearchBoundFails() throws Exception {
    new AlignTransform(0.).transform(TestUtils.dummyDataset());
  }
}
