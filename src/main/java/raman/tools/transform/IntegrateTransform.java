package raman.tools.transform;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.util.Pair;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import raman.tools.ConfigParseException;
import raman.tools.ProcessingException;
import raman.tools.input.Dataset;
import raman.tools.input.Frame;
import raman.tools.utils.NumericUtils;

/**
 * Integrates every frame over one or more x-ranges and replaces the dataset by the results: one
 * row per frame, and per range a column pair of the frame number and the integral.
 */
@Command(name = "integrate", description = "Integrate frames between bounds.")
public class IntegrateTransform implements Transformer {

  public static final String BOUNDS = "bounds";
  public static final String LOCAL_BASELINE = "local_baseline";

  @Parameters(arity = "1..*", converter = DoublePairConverter.class,
      description = "Left and right integration bound, separated by comma.")
  private List<Pair<Double, Double>> bounds;

  @Option(names = {"-l", "--local-baseline"},
      description = "Subtract a straight line between the bounds before integrating.")
  private boolean localBaseline;

  public IntegrateTransform() {
    this(new ArrayList<>(), false);
  }

  /**
   * @param bounds (left, right) integration windows
   * @param localBaseline true to subtract the line between the window ends
   */
  public IntegrateTransform(List<Pair<Double, Double>> bounds, boolean localBaseline) {
    this.bounds = new ArrayList<>(bounds);
    this.localBaseline = localBaseline;
  }

  static IntegrateTransform fromConfig(TransformerConfig config) throws ConfigParseException {
    return new IntegrateTransform(config.getDoublePairs(BOUNDS),
        config.getBoolean(LOCAL_BASELINE, false));
  }

  public List<Pair<Double, Double>> getBounds() {
    return bounds;
  }

  public boolean isLocalBaseline() {
    return localBaseline;
  }

  @Override
  public TransformerFactory getKind() {
    return TransformerFactory.INTEGRATE;
  }

  @Override
  public Map<String, Object> getConfig() {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put(BOUNDS, TransformerConfig.pairsToMaps(bounds));
    config.put(LOCAL_BASELINE, localBaseline);
    return config;
  }

  @Override
  public void transform(Dataset dataset) throws ProcessingException {
    int frames = dataset.getFrameCount();
    double[][] integrals = new double[2 * bounds.size()][frames];
    for (Frame frame : dataset.getFrames()) {
      int k = frame.getIndex();
      for (int b = 0; b < bounds.size(); ++b) {
        Pair<Double, Double> bound = bounds.get(b);
        integrals[2 * b][k] = frame.getNumber();
        integrals[2 * b + 1][k] = NumericUtils.trapz(frame.getX(), frame.getY(),
            bound.getFirst(), bound.getSecond(), localBaseline);
      }
    }
    dataset.setColumns(integrals);
  }
}
