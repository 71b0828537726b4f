package raman.tools.transform;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import org.apache.commons.math3.util.Pair;
import org.apache.log4j.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import raman.tools.ConfigParseException;
import raman.tools.DomainException;
import raman.tools.ProcessingException;
import raman.tools.input.Dataset;
import raman.tools.input.Frame;
import raman.tools.utils.NumericUtils;

/**
 * Divides the intensities of each selected frame by a reference value: the intensity at the
 * x-value nearest to xi, or, if xj is given, the integral of the frame between xi and xj
 * (optionally above the straight line between the two ends).
 *
 * A filter range can be recorded but has no effect yet: frames with a filter range are left
 * unchanged.
 */
@Command(name = "normalize", description = "Normalize frames to an intensity or an area.")
public class NormalizeTransform implements Transformer {

  private static final Logger logger = Logger.getLogger(NormalizeTransform.class);

  public static final String XI = "xi";
  public static final String XJ = "xj";
  public static final String LOCAL_BASELINE = "local_baseline";
  public static final String TARGET_FRAMES = "target_frames";
  public static final String FILTER_RANGE = "filter_range";

  @Parameters(index = "0", description = "Normalize data by this intensity at this x-value.")
  private double xi;

  @Parameters(index = "1", arity = "0..1",
      description = "If provided, integrate data between xi and xj and normalize to area.")
  private Double xj;

  @Option(names = {"-l", "--local-baseline"},
      description = "Subtract a straight line between xi and xj before integrating.")
  private boolean localBaseline;

  @Option(names = {"-t", "--target-frames"}, split = ",",
      description = "Select frames to normalize")
  private List<Integer> targetFrames;

  @Option(names = {"-f", "--filter-range"}, converter = DoublePairConverter.class,
      description = "Select a region to filter")
  private Pair<Double, Double> filterRange;

  public NormalizeTransform() {
    this(0., null, false, null, null);
  }

  /**
   * @param xi x-value to normalize to, or start of the integration window
   * @param xj end of the integration window, or null to normalize to a single intensity
   * @param localBaseline true to integrate above the line between the window ends
   * @param targetFrames 1-based frames to normalize, or null for all
   * @param filterRange recorded filter range, or null
   */
  public NormalizeTransform(double xi, Double xj, boolean localBaseline,
      List<Integer> targetFrames, Pair<Double, Double> filterRange) {
    this.xi = xi;
    this.xj = xj;
    this.localBaseline = localBaseline;
    this.targetFrames = targetFrames == null ? null : new ArrayList<>(targetFrames);
    this.filterRange = filterRange;
  }

  static NormalizeTransform fromConfig(TransformerConfig config) throws ConfigParseException {
    return new NormalizeTransform(
        config.getDouble(XI),
        config.getOptionalDouble(XJ),
        config.getBoolean(LOCAL_BASELINE, false),
        config.getOptionalIntList(TARGET_FRAMES),
        config.getOptionalDoublePair(FILTER_RANGE));
  }

  public double getXi() {
    return xi;
  }

  public Double getXj() {
    return xj;
  }

  public List<Integer> getTargetFrames() {
    return targetFrames;
  }

  @Override
  public TransformerFactory getKind() {
    return TransformerFactory.NORMALIZE;
  }

  @Override
  public Map<String, Object> getConfig() {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put(XI, xi);
    config.put(XJ, xj);
    config.put(LOCAL_BASELINE, localBaseline);
    config.put(TARGET_FRAMES, targetFrames == null ? null : new ArrayList<>(targetFrames));
    config.put(FILTER_RANGE, TransformerConfig.pairToMap(filterRange));
    return config;
  }

  @Override
  public void transform(Dataset dataset) throws ProcessingException {
    List<Frame> frames = dataset.getSelectedFrames(targetFrames);
    if (filterRange != null) {
      logger.warn("filter range " + filterRange.getFirst() + "," + filterRange.getSecond()
          + " is not supported yet, frames are not normalized");
      return;
    }
    for (Frame frame : frames) {
      double norm = normalizationValue(frame);
      double[] y = frame.getY();
      for (int i = 0; i < y.length; ++i) {
        y[i] /= norm;
      }
    }
  }

  private double normalizationValue(Frame frame) throws ProcessingException {
    if (xj == null) {
      OptionalInt index = NumericUtils.nearestIndex(frame.getX(), xi);
      if (!index.isPresent()) {
        throw new DomainException("could not find " + xi + " in frame " + frame.getNumber());
      }
      return frame.getY()[index.getAsInt()];
    }
    return NumericUtils.trapz(frame.getX(), frame.getY(), xi, xj, localBaseline);
  }
}
