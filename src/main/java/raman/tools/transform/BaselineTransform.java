package raman.tools.transform;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.util.Pair;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import raman.tools.ConfigParseException;
import raman.tools.ShapeMismatchException;
import raman.tools.input.Dataset;
import raman.tools.input.Frame;
import raman.tools.utils.BaselineSpline;

/**
 * Removes a background drawn through anchor points. A {@link BaselineSpline} through the points is
 * sampled at every x-value of every frame and subtracted from the intensities; outside the anchor
 * range nothing is subtracted. In store mode the dataset is left alone and the baseline, sampled
 * on the first frame's x-axis, is appended as an extra frame instead.
 */
@Command(name = "baseline", description = "Subtract (or store) a spline baseline.")
public class BaselineTransform implements Transformer {

  public static final String POINTS = "points";
  public static final String STORE = "store";

  @Option(names = {"-p", "--points"}, arity = "1..*", converter = DoublePairConverter.class,
      description = "x,y points to draw spline baseline.")
  private List<Pair<Double, Double>> points;

  @Option(names = {"-s", "--store"},
      description = "Add baseline to dataset instead of subtracting it.")
  private boolean store;

  public BaselineTransform() {
    this(new ArrayList<>(), false);
  }

  /**
   * @param points (x, y) anchor points of the baseline
   * @param store true to append the baseline as a frame instead of subtracting it
   */
  public BaselineTransform(List<Pair<Double, Double>> points, boolean store) {
    this.points = new ArrayList<>(points);
    this.store = store;
  }

  static BaselineTransform fromConfig(TransformerConfig config) throws ConfigParseException {
    return new BaselineTransform(config.getDoublePairs(POINTS), config.getBoolean(STORE, false));
  }

  public List<Pair<Double, Double>> getPoints() {
    return points;
  }

  public boolean isStore() {
    return store;
  }

  @Override
  public TransformerFactory getKind() {
    return TransformerFactory.BASELINE;
  }

  @Override
  public Map<String, Object> getConfig() {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put(POINTS, TransformerConfig.pairsToMaps(points));
    config.put(STORE, store);
    return config;
  }

  @Override
  public void transform(Dataset dataset) throws ShapeMismatchException {
    if (points.size() < 2 || dataset.getFrameCount() == 0) {
      return;
    }
    BaselineSpline spline = new BaselineSpline(points);

    if (store) {
      double[] x = dataset.getFrame(0).getX().clone();
      double[] baseline = spline.sample(x);
      double[][] columns = dataset.getColumns();
      double[][] extended = new double[columns.length + 2][];
      System.arraycopy(columns, 0, extended, 0, columns.length);
      extended[columns.length] = x;
      extended[columns.length + 1] = baseline;
      dataset.setColumns(extended);
      return;
    }

    for (Frame frame : dataset.getFrames()) {
      double[] baseline = spline.sample(frame.getX());
      double[] y = frame.getY();
      for (int i = 0; i < y.length; ++i) {
        y[i] -= baseline[i];
      }
    }
  }
}
