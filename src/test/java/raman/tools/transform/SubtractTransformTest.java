package raman.tools.transform;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;
import raman.tools.FrameOutOfRangeException;
import raman.tools.InvalidParameterException;
import raman.tools.input.Dataset;
import raman.tools.test.TestUtils;

public class SubtractTransformTest {

  @Test
  public void subtractsFromAllOtherFrames() throws Exception {
    Dataset dataset = TestUtils.fromColumns(
        new double[]{0, 1, 2}, new double[]{1, 1, 1},
        new double[]{0, 1, 2}, new double[]{3, 4, 5},
        new double[]{0, 1, 2}, new double[]{1, 2, 3});
    new SubtractTransform(1, null, false).transform(dataset);
    assertEquals(2, dataset.getFrameCount());
    assertArrayEquals(new double[]{2, 3, 4}, dataset.getFrame(0).getY(), 1E-12);
    assertArrayEquals(new double[]{0, 1, 2}, dataset.getFrame(1).getY(), 1E-12);
  }

  @Test
  public void resamplesOntoSubtrahendGrid() throws Exception {
    Dataset dataset = TestUtils.fromColumns(
        new double[]{0, 2, 4}, new double[]{0, 2, 4},
        new double[]{0.5, 1.5, 2.5}, new double[]{1, 1, 1});
    new SubtractTransform(2, Collections.singletonList(1), false).transform(dataset);
    assertEquals(1, dataset.getFrameCount());
    assertArrayEquals(new double[]{0.5, 1.5, 2.5}, dataset.getFrame(0).getX(), 0.);
    assertArrayEquals(new double[]{-0.5, 0.5, 1.5}, dataset.getFrame(0).getY(), 1E-12);
  }

  @Test
  public void directModeIgnoresGrids() throws Exception {
    Dataset dataset = TestUtils.fromColumns(
        new double[]{0, 2, 4}, new double[]{0, 2, 4},
        new double[]{5, 6, 7}, new double[]{1, 1, 1});
    new SubtractTransform(2, null, true).transform(dataset);
    assertArrayEquals(new double[]{0, 2, 4}, dataset.getFrame(0).getX(), 0.);
    assertArrayEquals(new double[]{-1, 1, 3}, dataset.getFrame(0).getY(), 1E-12);
  }

  @Test(expected = InvalidParameterException.class)
  public void subtrahendAmongMinuendsFails() throws Exception {
    new SubtractTransform(1, Collections.singletonList(1), false)
        .transform(TestUtils.dummyDataset());
  }

  @Test(expected = FrameOutOfRangeException.class)
  public void subtrahendOutOfRange() throws Exception {
    new SubtractTransform(7, Arrays.asList(1, 2), false).transform(TestUtils.dummyDataset());
  }
}
