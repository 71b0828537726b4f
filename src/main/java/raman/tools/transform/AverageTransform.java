package raman.tools.transform;

import java.util.Collections;
import java.util.Map;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import picocli.CommandLine.Command;
import raman.tools.ShapeMismatchException;
import raman.tools.input.Dataset;

/**
 * Replaces all frames by a single frame: the x-axis of the first frame and, per row, the mean of
 * the intensities of all frames.
 */
@Command(name = "average", description = "Average all frames into one.")
public class AverageTransform implements Transformer {

  @Override
  public TransformerFactory getKind() {
    return TransformerFactory.AVERAGE;
  }

  @Override
  public Map<String, Object> getConfig() {
    return Collections.emptyMap();
  }

  @Override
  public void transform(Dataset dataset) throws ShapeMismatchException {
    int frames = dataset.getFrameCount();
    if (frames == 0) {
      return;
    }
    int rows = dataset.getRowCount();
    double[] x = dataset.getFrame(0).getX().clone();
    double[] mean = new double[rows];
    double[] row = new double[frames];
    Mean meanCalc = new Mean();
    for (int i = 0; i < rows; ++i) {
      for (int k = 0; k < frames; ++k) {
        row[k] = dataset.getFrame(k).getY()[i];
      }
      mean[i] = meanCalc.evaluate(row);
    }
    dataset.setColumns(new double[][]{x, mean});
  }
}
