package raman.tools.transform;

import java.util.LinkedHashMap;
import java.util.Map;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import raman.tools.ConfigParseException;
import raman.tools.input.Dataset;
import raman.tools.input.Frame;

/**
 * Converts detector counts to photoelectrons per second and x-axis unit: every intensity is
 * divided by the local x-step, the exposure time and the count-to-photoelectron factor.
 * The x-step of a row is the distance to the next row; the last row reuses the step before it.
 */
@Command(name = "count-conversion",
    description = "Convert counts to photoelectrons per second and x-unit.")
public class CountConversionTransform implements Transformer {

  public static final String EXPOSURE = "exposure";
  public static final String CONVERSION_FACTOR = "conversion_factor";

  // from the PyLoN detector calibration certificate
  public static final double DEFAULT_CONVERSION_FACTOR = 1.42857;

  @Parameters(index = "0", description = "CCD exposure time in seconds.")
  private double exposure;

  @Option(names = {"-c", "--conversion-factor"},
      description = "Count to photoelectron conversion factor.")
  private double conversionFactor;

  public CountConversionTransform() {
    this(300., DEFAULT_CONVERSION_FACTOR);
  }

  public CountConversionTransform(double exposure, double conversionFactor) {
    this.exposure = exposure;
    this.conversionFactor = conversionFactor;
  }

  static CountConversionTransform fromConfig(TransformerConfig config)
      throws ConfigParseException {
    return new CountConversionTransform(config.getDouble(EXPOSURE),
        config.getDouble(CONVERSION_FACTOR, DEFAULT_CONVERSION_FACTOR));
  }

  public double getExposure() {
    return exposure;
  }

  public double getConversionFactor() {
    return conversionFactor;
  }

  @Override
  public TransformerFactory getKind() {
    return TransformerFactory.COUNT_CONVERSION;
  }

  @Override
  public Map<String, Object> getConfig() {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put(EXPOSURE, exposure);
    config.put(CONVERSION_FACTOR, conversionFactor);
    return config;
  }

  @Override
  public void transform(Dataset dataset) {
    double prevDx = 1.;
    for (Frame frame : dataset.getFrames()) {
      double[] x = frame.getX();
      double[] y = frame.getY();
      int last = y.length - 1;
      for (int i = 0; i <= last; ++i) {
        double dx;
        if (i == last) {
          dx = prevDx;
        } else {
          dx = Math.abs(x[i + 1] - x[i]);
          prevDx = dx;
        }
        y[i] /= dx * exposure * conversionFactor;
      }
    }
  }
}
