package raman.tools.transform;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.junit.Test;
import raman.tools.input.Dataset;
import raman.tools.test.TestUtils;

public class AverageTransformTest {

  @Test
  public void averagesIntensitiesRowByRow() throws Exception {
    Dataset dataset = TestUtils.fromColumns(
        new double[]{1, 2}, new double[]{1, 2},
        new double[]{5, 6}, new double[]{3, 4});
    new AverageTransform().transform(dataset);
    assertEquals(1, dataset.getFrameCount());
    assertArrayEquals(new double[]{1, 2}, dataset.getFrame(0).getX(), 0.);
    assertArrayEquals(new double[]{2, 3}, dataset.getFrame(0).getY(), 1E-12);
  }

  @Test
  public void dummyMatrixAverage() throws Exception {
    Dataset dataset = TestUtils.dummyDataset();
    new AverageTransform().transform(dataset);
    // mean of columns 2, 4, 6 and 8 of row 1
    assertEquals(15., dataset.getFrame(0).getY()[0], 1E-12);
    assertEquals(11., dataset.getFrame(0).getX()[0], 0.);
  }

  @Test
  public void emptyDatasetStaysEmpty() throws Exception {
    Dataset dataset = new Dataset();
    new AverageTransform().transform(dataset);
    assertEquals(0, dataset.getFrameCount());
  }
}
