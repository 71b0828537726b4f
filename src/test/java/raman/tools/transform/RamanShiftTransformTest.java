package raman.tools.transform;

import static org.junit.Assert.assertEquals;

import org.junit.Test;
import raman.tools.input.Dataset;
import raman.tools.test.TestUtils;

public class RamanShiftTransformTest {

  @Test
  public void convertsWavelengthsToShift() throws Exception {
    Dataset dataset = TestUtils.fromColumns(
        new double[]{500., 550.}, new double[]{1, 2},
        new double[]{500., 550.}, new double[]{3, 4});
    new RamanShiftTransform(500., 1., null).transform(dataset);
    assertEquals(0., dataset.getFrame(0).getX()[0], 1E-9);
    assertEquals(1E7 / 500. - 1E7 / 550., dataset.getFrame(1).getX()[1], 1E-9);
    // intensities untouched
    assertEquals(4., dataset.getFrame(1).getY()[1], 0.);
  }

  @Test
  public void refractiveIndexAndCorrection() {
    RamanShiftTransform shift = new RamanShiftTransform(500., 2., 10.);
    assertEquals((1E7 / 500. - 1E7 / 400.) / 2. + 10., shift.toShift(400.), 1E-9);
  }
}
