package raman.tools.transform;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.apache.commons.math3.util.Pair;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import raman.tools.ConfigParseException;
import raman.tools.input.Dataset;
import raman.tools.input.Frame;

/**
 * Corrects the x-axes of all frames with a linear map fitted through reference points, each
 * pairing a measured x-value with its true value. One point only gives an offset; two or more are
 * fitted by least squares; without points nothing changes.
 */
@Command(name = "calibration", description = "Calibrate x-axes against reference points.")
public class CalibrationTransform implements Transformer {

  public static final String POINTS = "points";

  @Option(names = {"-p", "--points"}, arity = "1..*", converter = DoublePairConverter.class,
      description = "raw,true reference data points for calibration.")
  private List<Pair<Double, Double>> points;

  public CalibrationTransform() {
    this(new ArrayList<>());
  }

  /**
   * @param points (measured, true) x-value pairs
   */
  public CalibrationTransform(List<Pair<Double, Double>> points) {
    this.points = new ArrayList<>(points);
  }

  static CalibrationTransform fromConfig(TransformerConfig config) throws ConfigParseException {
    return new CalibrationTransform(config.getDoublePairs(POINTS));
  }

  public List<Pair<Double, Double>> getPoints() {
    return points;
  }

  @Override
  public TransformerFactory getKind() {
    return TransformerFactory.CALIBRATION;
  }

  @Override
  public Map<String, Object> getConfig() {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put(POINTS, TransformerConfig.pairsToMaps(points));
    return config;
  }

  /**
   * Fit the calibration line through the reference points.
   *
   * @param points (measured, true) pairs
   * @return slope and intercept, or null if there are no points
   */
  static Pair<Double, Double> fitLine(List<Pair<Double, Double>> points) {
    if (points.isEmpty()) {
      return null;
    }
    if (points.size() == 1) {
      Pair<Double, Double> point = points.get(0);
      return new Pair<>(1., point.getSecond() - point.getFirst());
    }
    SimpleRegression regression = new SimpleRegression();
    for (Pair<Double, Double> point : points) {
      regression.addData(point.getFirst(), point.getSecond());
    }
    return new Pair<>(regression.getSlope(), regression.getIntercept());
  }

  @Override
  public void transform(Dataset dataset) {
    Pair<Double, Double> line = fitLine(points);
    if (line == null) {
      return;
    }
    double slope = line.getFirst();
    double intercept = line.getSecond();
    for (Frame frame : dataset.getFrames()) {
      double[] x = frame.getX();
      for (int i = 0; i < x.length; ++i) {
        x[i] = x[i] * slope + intercept;
      }
    }
  }
}
