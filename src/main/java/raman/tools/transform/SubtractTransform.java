package raman.tools.transform;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import raman.tools.ConfigParseException;
import raman.tools.InvalidParameterException;
import raman.tools.ProcessingException;
import raman.tools.input.Dataset;
import raman.tools.input.Frame;
import raman.tools.utils.NumericUtils;

/**
 * Subtracts one frame (the subtrahend) from others (the minuends, all other frames by default).
 * Each minuend is first resampled onto the subtrahend's x-axis, whose values it then takes over;
 * in direct mode the intensities are subtracted row by row regardless of the x-axes.
 * Only the minuend frames remain in the dataset.
 */
@Command(name = "subtract", description = "Subtract one frame from others.")
public class SubtractTransform implements Transformer {

  public static final String SUBTRAHEND = "subtrahend";
  public static final String MINUENDS = "minuends";
  public static final String DIRECT = "direct";

  @Parameters(index = "0", description = "Number of the frame to subtract")
  private int subtrahend;

  @Option(names = {"-m", "--minuends"}, split = ",",
      description = "Frame(s) to subtract from (if none given, subtract from all other frames)")
  private List<Integer> minuends;

  @Option(names = {"-d", "--direct"},
      description = "Subtract frame intensities without interpolating on same grid first")
  private boolean direct;

  public SubtractTransform() {
    this(1, null, false);
  }

  /**
   * @param subtrahend 1-based number of the frame to subtract
   * @param minuends 1-based numbers of the frames to subtract from, or null for all others
   * @param direct true to subtract without resampling
   */
  public SubtractTransform(int subtrahend, List<Integer> minuends, boolean direct) {
    this.subtrahend = subtrahend;
    this.minuends = minuends == null ? null : new ArrayList<>(minuends);
    this.direct = direct;
  }

  static SubtractTransform fromConfig(TransformerConfig config) throws ConfigParseException {
    return new SubtractTransform(
        config.getInt(SUBTRAHEND),
        config.getOptionalIntList(MINUENDS),
        config.getBoolean(DIRECT, false));
  }

  public int getSubtrahend() {
    return subtrahend;
  }

  public List<Integer> getMinuends() {
    return minuends;
  }

  public boolean isDirect() {
    return direct;
  }

  @Override
  public TransformerFactory getKind() {
    return TransformerFactory.SUBTRACT;
  }

  @Override
  public Map<String, Object> getConfig() {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put(SUBTRAHEND, subtrahend);
    config.put(MINUENDS, minuends == null ? null : new ArrayList<>(minuends));
    config.put(DIRECT, direct);
    return config;
  }

  @Override
  public void transform(Dataset dataset) throws ProcessingException {
    double[][] selected;
    if (minuends != null) {
      if (minuends.contains(subtrahend)) {
        throw new InvalidParameterException(
            "the minuend frames must not contain the subtrahend frame " + subtrahend);
      }
      selected = dataset.selectFrames(minuends, false);
    } else {
      selected = dataset.selectFrames(Collections.singletonList(subtrahend), true);
    }
    dataset.verifyFramesInBounds(Collections.singletonList(subtrahend));
    Frame reference = dataset.getFrame(subtrahend - 1);
    double[] grid = reference.getX();
    double[] subY = reference.getY();

    double[][] result = new double[selected.length][];
    for (int n = 0; n < selected.length; n += 2) {
      double[] ys = direct
          ? selected[n + 1]
          : NumericUtils.linearResample(selected[n], selected[n + 1], grid);
      double[] difference = new double[ys.length];
      for (int i = 0; i < ys.length; ++i) {
        difference[i] = ys[i] - subY[i];
      }
      result[n] = direct ? selected[n].clone() : grid.clone();
      result[n + 1] = difference;
    }
    dataset.setColumns(result);
  }
}
