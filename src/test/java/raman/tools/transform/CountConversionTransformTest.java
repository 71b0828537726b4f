package raman.tools.transform;

import static org.junit.Assert.assertArrayEquals;

import org.junit.Test;
import raman.tools.input.Dataset;
import raman.tools.test.TestUtils;

public class CountConversionTransformTest {

  @Test
  public void dividesByBinWidthExposureAndFactor() throws Exception {
    Dataset dataset = TestUtils.fromColumns(new double[]{0, 2, 4}, new double[]{10, 20, 30});
    new CountConversionTransform(2., 0.5).transform(dataset);
    assertArrayEquals(new double[]{5, 10, 15}, dataset.getFrame(0).getY(), 1E-12);
  }

  @Test
  public void lastBinReusesPreviousWidth() throws Exception {
    Dataset dataset = TestUtils.fromColumns(
        new double[]{0, 2, 4}, new double[]{2, 2, 2},
        new double[]{0, 1, 3}, new double[]{2, 2, 2});
    new CountConversionTransform(1., 1.).transform(dataset);
    assertArrayEquals(new double[]{1, 1, 1}, dataset.getFrame(0).getY(), 1E-12);
    assertArrayEquals(new double[]{2, 1, 1}, dataset.getFrame(1).getY(), 1E-12);
  }
}
