package raman.tools.transform;

import java.util.LinkedHashMap;
import java.util.Map;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import raman.tools.ConfigParseException;
import raman.tools.InsufficientDataException;
import raman.tools.input.Configuration;
import raman.tools.input.Dataset;

/**
 * Removes cosmic rays from the intensities of all frames with a {@link CosmicRayRemover}. The
 * intensity columns are treated as one image of pixels by frames; the x-axes are not touched.
 */
@Command(name = "despike", description = "Remove cosmic rays by Laplacian edge detection.")
public class DespikeTransform implements Transformer {

  public static final String SIGLIM = "siglim";
  public static final String FLIM = "flim";
  public static final String GAIN = "gain";
  public static final String READNOISE = "readnoise";
  public static final String ITERATIONS = "iterations";

  @Parameters(index = "0", description = "Significance threshold of a cosmic ray.")
  private double siglim;

  @Parameters(index = "1",
      description = "Threshold of the ratio of Laplacian to fine structure of a cosmic ray.")
  private double flim;

  @Option(names = {"--gain"}, description = "Detector gain (electrons per count).")
  private double gain;

  @Option(names = {"--readnoise"}, description = "Detector read noise (electrons).")
  private double readnoise;

  @Option(names = {"-i", "--iterations"}, description = "Number of detection passes.")
  private int iterations;

  public DespikeTransform() {
    this(0., 0.);
  }

  /**
   * Create a despike transformer using the configured detector constants.
   *
   * @param siglim significance threshold
   * @param flim fine structure threshold
   */
  public DespikeTransform(double siglim, double flim) {
    this(siglim, flim, Configuration.getInstance().getDespikeGain(),
        Configuration.getInstance().getDespikeReadNoise(),
        Configuration.getInstance().getDespikeIterations());
  }

  public DespikeTransform(double siglim, double flim, double gain, double readnoise,
      int iterations) {
    this.siglim = siglim;
    this.flim = flim;
    this.gain = gain;
    this.readnoise = readnoise;
    this.iterations = iterations;
  }

  static DespikeTransform fromConfig(TransformerConfig config) throws ConfigParseException {
    Configuration defaults = Configuration.getInstance();
    return new DespikeTransform(
        config.getDouble(SIGLIM),
        config.getDouble(FLIM),
        config.getDouble(GAIN, defaults.getDespikeGain()),
        config.getDouble(READNOISE, defaults.getDespikeReadNoise()),
        config.getInt(ITERATIONS, defaults.getDespikeIterations()));
  }

  public double getSiglim() {
    return siglim;
  }

  public double getFlim() {
    return flim;
  }

  public int getIterations() {
    return iterations;
  }

  @Override
  public TransformerFactory getKind() {
    return TransformerFactory.DESPIKE;
  }

  @Override
  public Map<String, Object> getConfig() {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put(SIGLIM, siglim);
    config.put(FLIM, flim);
    config.put(GAIN, gain);
    config.put(READNOISE, readnoise);
    config.put(ITERATIONS, iterations);
    return config;
  }

  @Override
  public void transform(Dataset dataset) throws InsufficientDataException {
    int rows = dataset.getRowCount();
    int frames = dataset.getFrameCount();
    double[][] image = new double[rows][frames];
    for (int k = 0; k < frames; ++k) {
      double[] y = dataset.getFrame(k).getY();
      for (int i = 0; i < rows; ++i) {
        image[i][k] = y[i];
      }
    }

    CosmicRayRemover remover = new CosmicRayRemover(siglim, flim, gain, readnoise);
    double[][] despiked = remover.despike(image, iterations);

    for (int k = 0; k < frames; ++k) {
      double[] y = dataset.getFrame(k).getY();
      for (int i = 0; i < rows; ++i) {
        y[i] = despiked[i][k];
      }
    }
  }
}
