package raman.tools.transform;

import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import raman.tools.ConfigParseException;
import raman.tools.DomainException;
import raman.tools.InsufficientDataException;
import raman.tools.input.Dataset;
import raman.tools.utils.NumericUtils;

/**
 * Removes spikes by comparing repeated scans of the same sample. For every pixel the intensities
 * of all frames are compared: while the largest exceeds the median by more than threshold times
 * the sample standard deviation, it is replaced by the median and the statistics recomputed.
 * Needs at least three frames.
 */
@Command(name = "finning", description = "Remove spikes by comparing frames pixel by pixel.")
public class FinningTransform implements Transformer {

  public static final String THRESHOLD = "threshold";
  public static final String ITERATIONS = "iterations";

  public static final int DEFAULT_ITERATIONS = 100;

  @Parameters(index = "0",
      description = "Multiple of standard deviation which flags point as spike.")
  private double threshold;

  @Option(names = {"-i", "--iterations"},
      description = "Maximum number of iterations the finning algorithm runs.")
  private int iterations;

  public FinningTransform() {
    this(0., DEFAULT_ITERATIONS);
  }

  public FinningTransform(double threshold, int iterations) {
    this.threshold = threshold;
    this.iterations = iterations;
  }

  static FinningTransform fromConfig(TransformerConfig config) throws ConfigParseException {
    return new FinningTransform(config.getDouble(THRESHOLD),
        config.getInt(ITERATIONS, DEFAULT_ITERATIONS));
  }

  public double getThreshold() {
    return threshold;
  }

  public int getIterations() {
    return iterations;
  }

  @Override
  public TransformerFactory getKind() {
    return TransformerFactory.FINNING;
  }

  @Override
  public Map<String, Object> getConfig() {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put(THRESHOLD, threshold);
    config.put(ITERATIONS, iterations);
    return config;
  }

  @Override
  public void transform(Dataset dataset) throws InsufficientDataException, DomainException {
    int frames = dataset.getFrameCount();
    if (frames < 3) {
      throw new InsufficientDataException("Not enough scans to perform finning, got " + frames
          + ", need at least 3.");
    }
    double[] intensities = new double[frames];
    for (int i = 0; i < dataset.getRowCount(); ++i) {
      for (int k = 0; k < frames; ++k) {
        intensities[k] = dataset.getFrame(k).getY()[i];
      }
      finPixel(intensities);
      for (int k = 0; k < frames; ++k) {
        dataset.getFrame(k).getY()[i] = intensities[k];
      }
    }
  }

  // clamps outliers of one pixel across frames in place
  private void finPixel(double[] intensities) throws DomainException {
    double median = NumericUtils.quantileNearest(intensities, 0.5);
    double std = new DescriptiveStatistics(intensities).getStandardDeviation();
    int n = NumericUtils.argmax(intensities);
    int replaced = 0;
    while (n >= 0 && intensities[n] > median + threshold * std) {
      ++replaced;
      intensities[n] = median;
      median = NumericUtils.quantileNearest(intensities, 0.5);
      std = new DescriptiveStatistics(intensities).getStandardDeviation();
      n = NumericUtils.argmax(intensities);
      if (replaced > iterations) {
        break;
      }
    }
  }
}
