package raman.tools.transform;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import raman.tools.ConfigParseException;
import raman.tools.DomainException;
import raman.tools.FrameOutOfRangeException;
import raman.tools.input.Dataset;
import raman.tools.input.Frame;
import raman.tools.utils.NumericUtils;

/**
 * Shifts the intensities of selected frames: either adds a constant, or, in percentile mode,
 * subtracts the given quantile of each frame's own intensities (e.g. 0.05 removes a dark offset
 * while keeping the lowest 5 % of points at or below zero).
 */
@Command(name = "offset", description = "Add a constant or subtract a quantile.")
public class OffsetTransform implements Transformer {

  public static final String OFFSET = "offset";
  public static final String PERCENTILE = "percentile";
  public static final String TARGET_FRAMES = "target_frames";

  @Parameters(index = "0", description = "Offset data by this value")
  private double offset;

  @Option(names = {"-p", "--percentile"},
      description = "Subtract the quantile (between 0 and 1) given as offset instead.")
  private boolean percentile;

  @Option(names = {"-t", "--target-frames"}, split = ",",
      description = "Apply offset to these frames.")
  private List<Integer> targetFrames;

  public OffsetTransform() {
    this(0., false, null);
  }

  /**
   * @param offset constant to add, or quantile to subtract in percentile mode
   * @param percentile true for percentile mode
   * @param targetFrames 1-based frames to change, or null for all
   */
  public OffsetTransform(double offset, boolean percentile, List<Integer> targetFrames) {
    this.offset = offset;
    this.percentile = percentile;
    this.targetFrames = targetFrames == null ? null : new ArrayList<>(targetFrames);
  }

  static OffsetTransform fromConfig(TransformerConfig config) throws ConfigParseException {
    return new OffsetTransform(
        config.getDouble(OFFSET),
        config.getBoolean(PERCENTILE, false),
        config.getOptionalIntList(TARGET_FRAMES));
  }

  public double getOffset() {
    return offset;
  }

  public boolean isPercentile() {
    return percentile;
  }

  public List<Integer> getTargetFrames() {
    return targetFrames;
  }

  @Override
  public TransformerFactory getKind() {
    return TransformerFactory.OFFSET;
  }

  @Override
  public Map<String, Object> getConfig() {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put(OFFSET, offset);
    config.put(PERCENTILE, percentile);
    config.put(TARGET_FRAMES, targetFrames == null ? null : new ArrayList<>(targetFrames));
    return config;
  }

  @Override
  public void transform(Dataset dataset) throws FrameOutOfRangeException, DomainException {
    for (Frame frame : dataset.getSelectedFrames(targetFrames)) {
      double[] y = frame.getY();
      double shift = percentile ? -NumericUtils.quantileNearest(y, offset) : offset;
      for (int i = 0; i < y.length; ++i) {
        y[i] += shift;
      }
    }
  }
}
