package raman.tools.transform;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import org.apache.commons.math3.util.Pair;
import org.junit.Test;
import raman.tools.ConfigParseException;
import raman.tools.InsufficientDataException;
import raman.tools.PipelineException;
import raman.tools.input.Dataset;
import raman.tools.input.InputArguments;
import raman.tools.test.TestUtils;

public class PipelineTest {

  private static String commented(String text) {
    StringBuilder out = new StringBuilder();
    for (String line : text.split("\n")) {
      out.append("# ").append(line).append('\n');
    }
    return out.toString();
  }

  @Test
  public void defaultPipelineSurvivesProvenanceRoundTrip() throws Exception {
    Pipeline pipeline = new Pipeline(TransformerFactory.defaultTransformers());
    String log = pipeline.toProvenance();
    Pipeline parsed = Pipeline.fromProvenance(log);
    assertEquals(6, parsed.size());
    assertEquals(log, parsed.toProvenance());
    assertEquals(log, Pipeline.fromProvenance(commented(log)).toProvenance());
  }

  @Test
  public void everyTransformerSurvivesProvenanceRoundTrip() throws Exception {
    Pipeline pipeline = new Pipeline(Arrays.asList(
        new AlignTransform(0.3),
        new AppendTransform("/tmp/other.csv", "#", ";", true),
        new BaselineTransform(Arrays.asList(new Pair<>(1., 2.), new Pair<>(3., 4.)), true),
        new CalibrationTransform(Arrays.asList(new Pair<>(100., 101.5))),
        new DespikeTransform(5., 2., 1.2, 4., 3),
        new IntegrateTransform(Arrays.asList(new Pair<>(500., 600.)), true),
        new MaskTransform(Arrays.asList(new Pair<>(2, 10), new Pair<>(3, 11))),
        new NormalizeTransform(1000., 1100., true, Arrays.asList(1, 2), new Pair<>(5., 6.)),
        new NormalizeTransform(1000., null, false, null, null),
        new SelectTransform(Arrays.asList(1, 3), true),
        new SubtractTransform(2, Arrays.asList(1, 3), true),
        new RamanShiftTransform(785., 1., null)));
    String log = pipeline.toProvenance();
    Pipeline parsed = Pipeline.fromProvenance(log);
    assertEquals(pipeline.size(), parsed.size());
    assertEquals(log, parsed.toProvenance());
  }

  @Test
  public void inputArgumentSegmentIsIgnored() throws Exception {
    Dataset dataset = TestUtils.dummyDataset();
    new InputArguments("scan.csv", "#", ",").writeMetadata(dataset);
    new Pipeline(Arrays.asList(new AverageTransform(), new ReshapeTransform(4)))
        .apply(dataset);
    Pipeline parsed = Pipeline.fromProvenance(dataset.getMetadata());
    assertEquals(2, parsed.size());
    assertEquals(TransformerFactory.AVERAGE, parsed.getTransformers().get(0).getKind());
    assertEquals(4, ((ReshapeTransform) parsed.getTransformers().get(1)).getRows());
  }

  @Test(expected = ConfigParseException.class)
  public void unknownTransformationFails() throws Exception {
    Pipeline.fromProvenance("transformation: SmoothTransform\nwidth: 3\n---\n");
  }

  @Test(expected = ConfigParseException.class)
  public void malformedTransformationTagFails() throws Exception {
    Pipeline.fromProvenance("transformation: ReshapeTransform\nrows: 4\n---\n"
        + "transformation: Select_Transform\nframes: [1]\n---\n");
  }

  @Test(expected = ConfigParseException.class)
  public void transformationTagWithTrailingTextFails() throws Exception {
    Pipeline.fromProvenance("transformation: AverageTransform \n---\n");
  }

  @Test(expected = ConfigParseException.class)
  public void missingRequiredKeyFails() throws Exception {
    Pipeline.fromProvenance("transformation: ReshapeTransform\n---\n");
  }

  @Test(expected = ConfigParseException.class)
  public void wrongValueTypeFails() throws Exception {
    Pipeline.fromProvenance("transformation: ReshapeTransform\nrows: many\n---\n");
  }

  @Test
  public void failingStepStopsPipeline() throws Exception {
    Dataset dataset = TestUtils.fromColumns(
        new double[]{1, 2}, new double[]{1, 2}, new double[]{1, 2}, new double[]{3, 4});
    Pipeline pipeline = new Pipeline(Arrays.asList(
        new OffsetTransform(1., false, null),
        new FinningTransform(2.5, 4),
        new AverageTransform()));
    try {
      pipeline.apply(dataset);
      fail("finning two frames should fail");
    } catch (PipelineException e) {
      assertEquals(2, e.getStep());
      assertEquals("FinningTransform", e.getTransformation());
      assertTrue(e.getCause() instanceof InsufficientDataException);
    }
    // the offset was applied and logged, nothing after it
    assertEquals(2., dataset.getFrame(0).getY()[0], 0.);
    assertEquals(2, dataset.getFrameCount());
    assertTrue(dataset.getMetadata().contains("OffsetTransform"));
    assertFalse(dataset.getMetadata().contains("FinningTransform"));
  }

  @Test
  public void appliedStepsAreLoggedInOrder() throws Exception {
    Dataset dataset = TestUtils.dummyDataset();
    new Pipeline(Arrays.asList(new OffsetTransform(1., false, null), new AverageTransform()))
        .apply(dataset);
    String log = dataset.getMetadata();
    assertTrue(log.startsWith("transformation: OffsetTransform\n"));
    assertTrue(log.indexOf("OffsetTransform") < log.indexOf("AverageTransform"));
    assertTrue(log.endsWith("transformation: AverageTransform\n---\n"));
  }
}
