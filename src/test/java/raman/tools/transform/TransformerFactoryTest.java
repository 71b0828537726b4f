package raman.tools.transform;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.util.List;
import org.apache.commons.math3.util.Pair;
import org.junit.Test;
import picocli.CommandLine;

public class TransformerFactoryTest {

  @Test
  public void everyKindCreatesItsOwnTransformer() {
    for (TransformerFactory kind : TransformerFactory.values()) {
      Transformer transformer = kind.createTransformer();
      assertEquals(kind, transformer.getKind());
      assertEquals(kind, TransformerFactory.fromTag(kind.getTag()));
      assertEquals(kind, TransformerFactory.fromCommandName(kind.getCommandName()));
    }
    assertNull(TransformerFactory.fromTag("NoSuchTransform"));
    assertNull(TransformerFactory.fromCommandName("default"));
  }

  @Test
  public void defaultTransformersInOrder() {
    List<Transformer> transformers = TransformerFactory.defaultTransformers();
    assertEquals(6, transformers.size());
    assertEquals(TransformerFactory.RESHAPE, transformers.get(0).getKind());
    assertEquals(1340, ((ReshapeTransform) transformers.get(0)).getRows());
    assertEquals(TransformerFactory.COUNT_CONVERSION, transformers.get(5).getKind());
  }

  @Test
  public void commandLineArgumentsFillTransformer() {
    OffsetTransform offset = new OffsetTransform();
    new CommandLine(offset).parseArgs("0.05", "-p", "-t", "1,3");
    assertEquals(0.05, offset.getOffset(), 0.);
    assertEquals(true, offset.isPercentile());
    assertEquals(2, offset.getTargetFrames().size());
    assertEquals(3, (int) offset.getTargetFrames().get(1));

    IntegrateTransform integrate = new IntegrateTransform();
    new CommandLine(integrate).parseArgs("100,200", "300, 400", "-l");
    Pair<Double, Double> second = integrate.getBounds().get(1);
    assertEquals(300., second.getFirst(), 0.);
    assertEquals(400., second.getSecond(), 0.);
    assertEquals(true, integrate.isLocalBaseline());
  }

  @Test(expected = CommandLine.ParameterException.class)
  public void malformedPairIsRejected() {
    new CommandLine(new MaskTransform()).parseArgs("1;2");
  }
}
