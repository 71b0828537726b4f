package raman.tools.transform;

import static org.junit.Assert.assertArrayEquals;

import java.util.Collections;
import org.apache.commons.math3.util.Pair;
import org.junit.Test;
import raman.tools.DomainException;
import raman.tools.FrameOutOfRangeException;
import raman.tools.input.Dataset;
import raman.tools.test.TestUtils;

public class NormalizeTransformTest {

  private static Dataset twoFrames() {
    return TestUtils.fromColumns(
        new double[]{0, 1, 2, 3}, new double[]{1, 2, 4, 8},
        new double[]{0, 1, 2, 3}, new double[]{2, 2, 2, 2});
  }

  @Test
  public void byIntensityAtNearestX() throws Exception {
    Dataset dataset = twoFrames();
    new NormalizeTransform(2.1, null, false, null, null).transform(dataset);
    assertArrayEquals(new double[]{0.25, 0.5, 1, 2}, dataset.getFrame(0).getY(), 1E-12);
    assertArrayEquals(new double[]{1, 1, 1, 1}, dataset.getFrame(1).getY(), 1E-12);
  }

  @Test
  public void byAreaOfTargetFrame() throws Exception {
    Dataset dataset = twoFrames();
    new NormalizeTransform(0., 3., false, Collections.singletonList(2), null)
        .transform(dataset);
    assertArrayEquals(new double[]{1, 2, 4, 8}, dataset.getFrame(0).getY(), 0.);
    assertArrayEquals(new double[]{1. / 3, 1. / 3, 1. / 3, 1. / 3},
        dataset.getFrame(1).getY(), 1E-12);
  }

  @Test
  public void filterRangeLeavesFramesUnchanged() throws Exception {
    Dataset dataset = twoFrames();
    new NormalizeTransform(2., null, false, null, new Pair<>(0., 1.)).transform(dataset);
    assertArrayEquals(new double[]{1, 2, 4, 8}, dataset.getFrame(0).getY(), 0.);
  }

  @Test(expected = DomainException.class)
  public void undefinedXAxisFails() throws Exception {
    Dataset dataset = TestUtils.fromColumns(
        new double[]{Double.NaN, Double.NaN}, new double[]{1, 2});
    new NormalizeTransform(2., null, false, null, null).transform(dataset);
  }

  @Test(expected = FrameOutOfRangeException.class)
  public void targetFrameOutOfRange() throws Exception {
    new NormalizeTransform(2., null, false, Collections.singletonList(3), null)
        .transform(twoFrames());
  }
}
