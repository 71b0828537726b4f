package raman.tools.transform;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.IntStream;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import raman.tools.ConfigParseException;
import raman.tools.input.Dataset;

/**
 * Converts the x-axes of all frames from wavelength (nm) to Raman shift (1/cm) relative to the
 * laser line:
 * <pre>
 *   shift = (1e7 / laser_wavelength - 1e7 / x) / refractive_index + correction
 * </pre>
 */
@Command(name = "shift", description = "Convert wavelengths to Raman shift.")
public class RamanShiftTransform implements Transformer {

  public static final String WAVELENGTH = "wavelength";
  public static final String REFRACTIVE_INDEX = "refractive_index";
  public static final String CORRECTION = "correction";

  // refractive index of air
  public static final double DEFAULT_REFRACTIVE_INDEX = 1.000264;

  private static final double NM_PER_CM = 1E7;

  @Parameters(index = "0", description = "Laser wavelength in nm.")
  private double wavelength;

  @Option(names = {"-r", "--refractive-index"},
      description = "Refractive index of the medium the wavelengths were measured in.")
  private double refractiveIndex;

  @Option(names = {"-c", "--correction"},
      description = "Optional corrective offset added to calculated wavenumbers.")
  private Double correction;

  public RamanShiftTransform() {
    this(0., DEFAULT_REFRACTIVE_INDEX, null);
  }

  /**
   * @param wavelength laser wavelength in nm
   * @param refractiveIndex refractive index of the medium
   * @param correction offset added to the result, null for none
   */
  public RamanShiftTransform(double wavelength, double refractiveIndex, Double correction) {
    this.wavelength = wavelength;
    this.refractiveIndex = refractiveIndex;
    this.correction = correction;
  }

  static RamanShiftTransform fromConfig(TransformerConfig config) throws ConfigParseException {
    return new RamanShiftTransform(
        config.getDouble(WAVELENGTH),
        config.getDouble(REFRACTIVE_INDEX, DEFAULT_REFRACTIVE_INDEX),
        config.getOptionalDouble(CORRECTION));
  }

  public double getWavelength() {
    return wavelength;
  }

  public double getRefractiveIndex() {
    return refractiveIndex;
  }

  public Double getCorrection() {
    return correction;
  }

  @Override
  public TransformerFactory getKind() {
    return TransformerFactory.SHIFT;
  }

  @Override
  public Map<String, Object> getConfig() {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put(WAVELENGTH, wavelength);
    config.put(REFRACTIVE_INDEX, refractiveIndex);
    config.put(CORRECTION, correction);
    return config;
  }

  /**
   * @param x wavelength in nm
   * @return Raman shift in 1/cm
   */
  public double toShift(double x) {
    double offset = correction == null ? 0. : correction;
    return (NM_PER_CM / wavelength - NM_PER_CM / x) / refractiveIndex + offset;
  }

  @Override
  public void transform(Dataset dataset) {
    // every value depends on its input only
    IntStream.range(0, dataset.getFrameCount()).parallel().forEach(k -> {
      double[] x = dataset.getFrame(k).getX();
      for (int i = 0; i < x.length; ++i) {
        x[i] = toShift(x[i]);
      }
    });
  }
}
