package raman.tools.transform;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import org.junit.Test;
import raman.tools.FrameOutOfRangeException;
import raman.tools.input.Dataset;
import raman.tools.test.TestUtils;

public class OffsetTransformTest {

  @Test
  public void offsetsOnlyTargetFrames() throws Exception {
    Dataset dataset = TestUtils.dummyDataset();
    new OffsetTransform(2.0, false, Arrays.asList(1, 4)).transform(dataset);
    double[][] expected = TestUtils.dummyRows();
    double[][] rows = dataset.toRows();
    for (int i = 0; i < rows.length; ++i) {
      for (int j = 0; j < rows[i].length; ++j) {
        double shift = (j == 1 || j == 7) ? 2. : 0.;
        assertEquals(expected[i][j] + shift, rows[i][j], 0.);
      }
    }
  }

  @Test
  public void percentileZeroMovesMinimumToZero() throws Exception {
    Dataset dataset = TestUtils.fromColumns(
        new double[]{1, 2, 3}, new double[]{5, 3, 9},
        new double[]{1, 2, 3}, new double[]{-2, 0, 1});
    new OffsetTransform(0., true, null).transform(dataset);
    assertEquals(2., dataset.getFrame(0).getY()[0], 0.);
    assertEquals(0., dataset.getFrame(0).getY()[1], 0.);
    assertEquals(0., dataset.getFrame(1).getY()[0], 0.);
    assertEquals(3., dataset.getFrame(1).getY()[2], 0.);
  }

  @Test(expected = FrameOutOfRangeException.class)
  public void targetFrameOutOfRange() throws Exception {
    new OffsetTransform(1., false, Arrays.asList(5)).transform(TestUtils.dummyDataset());
  }
}
