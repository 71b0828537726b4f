package raman.tools.transform;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.apache.commons.math3.util.Pair;
import org.junit.Test;
import raman.tools.input.Dataset;
import raman.tools.test.TestUtils;

public class BaselineTransformTest {

  private static final List<Pair<Double, Double>> LINE =
      Arrays.asList(new Pair<>(0., 0.), new Pair<>(10., 10.));

  @Test
  public void subtractsBaselineFromEveryFrame() throws Exception {
    double[] x = {0, 5, 10, 12};
    Dataset dataset = TestUtils.fromColumns(x, new double[]{5, 10, 15, 17},
        x, new double[]{0, 5, 10, 12});
    new BaselineTransform(LINE, false).transform(dataset);
    assertArrayEquals(new double[]{5, 5, 5, 17}, dataset.getFrame(0).getY(), 1E-12);
    assertArrayEquals(new double[]{0, 0, 0, 12}, dataset.getFrame(1).getY(), 1E-12);
  }

  @Test
  public void storeAddsBaselineFrame() throws Exception {
    double[] x = {0, 5, 10};
    Dataset dataset = TestUtils.fromColumns(x, new double[]{5, 10, 15});
    new BaselineTransform(LINE, true).transform(dataset);
    assertEquals(2, dataset.getFrameCount());
    assertArrayEquals(new double[]{5, 10, 15}, dataset.getFrame(0).getY(), 0.);
    assertArrayEquals(x, dataset.getFrame(1).getX(), 0.);
    assertArrayEquals(new double[]{0, 5, 10}, dataset.getFrame(1).getY(), 1E-12);
  }

  @Test
  public void singlePointDoesNothing() throws Exception {
    Dataset dataset = TestUtils.dummyDataset();
    new BaselineTransform(Collections.singletonList(new Pair<>(20., 5.)), false)
        .transform(dataset);
    assertArrayEquals(TestUtils.dummyRows(), dataset.toRows());
  }
}
