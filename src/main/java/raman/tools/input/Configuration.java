package raman.tools.input;

import java.io.File;
import java.net.MalformedURLException;
import java.net.URL;
import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.XMLConfiguration;
import org.apache.log4j.Logger;

/**
 * Configuration file holding the default values used when the command line does not specify
 * them. These include the comment character and delimiter of delimited text input and output,
 * the wait for data on standard input, the despike noise model constants, the alignment search
 * bounds and the size of exported plots.
 *
 * Values only act as defaults for newly constructed transformers; once a transformer exists its
 * parameters are fixed and written to the provenance log, so a replayed log does not depend on the
 * configuration in effect.
 */
public class Configuration {

  private static Configuration instance;

  public static final String DEFAULT_CONFIG_PATH = "raman-tools-config.xml";
  private static final Logger logger = Logger.getLogger(Configuration.class);

  private String loadedConfigPath = "(built-in defaults)";

  private String inputCommentChar = "#";
  private String inputDelimiter = ",";
  private long stdinTimeoutMillis = 1000;

  private String outputDelimiter = ",";
  private String applicationName = "Raman CLI Tools";

  private double despikeGain = 1.0;
  private double despikeReadNoise = 6.0;
  private int despikeIterations = 4;

  private double alignCostMaxAbs = 0.1;
  private int alignMaxEvaluations = 500;

  private int plotWidth = 1280;
  private int plotHeight = 800;

  private Configuration(URL configLocation) {
    logger.info("Attempting reading in config file from " + configLocation);
    try {
      XMLConfiguration config = new XMLConfiguration();
      // "," is a valid delimiter value, not a list separator
      config.setDelimiterParsingDisabled(true);
      config.load(configLocation);

      inputCommentChar = config.getString("Input.CommentChar", inputCommentChar);
      inputDelimiter = config.getString("Input.Delimiter", inputDelimiter);
      stdinTimeoutMillis = config.getLong("Input.StdinTimeoutMillis", stdinTimeoutMillis);

      outputDelimiter = config.getString("Output.Delimiter", outputDelimiter);
      applicationName = config.getString("Output.ApplicationName", applicationName);

      despikeGain = config.getDouble("Despike.Gain", despikeGain);
      despikeReadNoise = config.getDouble("Despike.ReadNoise", despikeReadNoise);
      despikeIterations = config.getInt("Despike.Iterations", despikeIterations);

      alignCostMaxAbs = config.getDouble("Align.CostMaxAbs", alignCostMaxAbs);
      alignMaxEvaluations = config.getInt("Align.MaxEvaluations", alignMaxEvaluations);

      plotWidth = config.getInt("Plot.Width", plotWidth);
      plotHeight = config.getInt("Plot.Height", plotHeight);

      loadedConfigPath = configLocation.toString();
      logger.info("Successfully loaded in configuration: " + loadedConfigPath);
    } catch (ConfigurationException e) {
      logger.error("Error encountered while reading XML file, load failed, using defaults", e);
    }
  }

  /**
   * Gets the current instance of the configuration, or creates one if none exists. A file named
   * {@value #DEFAULT_CONFIG_PATH} in the working directory takes precedence over the copy
   * embedded in the jar.
   *
   * @return the current configuration instance
   */
  synchronized public static Configuration getInstance() {
    return getInstance(System.getProperty("user.dir") + File.separator + DEFAULT_CONFIG_PATH);
  }

  /**
   * Gets the current instance of the configuration, or creates one from a specified file if none
   * exists. If the file does not exist the embedded configuration is read instead.
   *
   * @param configLocation configuration file location to read from
   * @return the current configuration instance
   */
  synchronized public static Configuration getInstance(String configLocation) {
    if (instance == null) {
      instance = new Configuration(resolve(configLocation));
    }
    return instance;
  }

  /**
   * Replace the current instance by one read from the given file. Used when the configuration
   * file is named explicitly on the command line.
   *
   * @param configLocation configuration file location to read from
   * @return the new configuration instance
   */
  synchronized public static Configuration reload(String configLocation) {
    instance = new Configuration(resolve(configLocation));
    return instance;
  }

  private static URL resolve(String configLocation) {
    File config = new File(configLocation);
    if (config.exists()) {
      try {
        return config.toURI().toURL();
      } catch (MalformedURLException e) {
        logger.warn("Could not build a URL for " + configLocation + ", using embedded config", e);
      }
    } else {
      logger.debug("No config file at " + configLocation + ", using embedded config");
    }
    return Configuration.class.getClassLoader().getResource(DEFAULT_CONFIG_PATH);
  }

  /**
   * @return location the configuration was read from
   */
  public String getLoadedConfigPath() {
    return loadedConfigPath;
  }

  /**
   * Prefix marking comment lines of delimited text input.
   * The property is defined from Configuration.Input.CommentChar
   *
   * @return comment prefix, "#" if not specified
   */
  public String getInputCommentChar() {
    return inputCommentChar;
  }

  /**
   * The property is defined from Configuration.Input.Delimiter
   *
   * @return field delimiter of delimited text input, "," if not specified
   */
  public String getInputDelimiter() {
    return inputDelimiter;
  }

  /**
   * How long to wait for the first line when reading from standard input before giving up.
   * The property is defined from Configuration.Input.StdinTimeoutMillis
   *
   * @return timeout in milliseconds
   */
  public long getStdinTimeoutMillis() {
    return stdinTimeoutMillis;
  }

  /**
   * The property is defined from Configuration.Output.Delimiter
   *
   * @return field delimiter of written datasets
   */
  public String getOutputDelimiter() {
    return outputDelimiter;
  }

  /**
   * Name written in the first header line of every output file.
   * The property is defined from Configuration.Output.ApplicationName
   *
   * @return application name
   */
  public String getApplicationName() {
    return applicationName;
  }

  public double getDespikeGain() {
    return despikeGain;
  }

  public double getDespikeReadNoise() {
    return despikeReadNoise;
  }

  public int getDespikeIterations() {
    return despikeIterations;
  }

  /**
   * Default bound of the alignment shift search, in x-axis units.
   * The property is defined from Configuration.Align.CostMaxAbs
   *
   * @return absolute search bound
   */
  public double getAlignCostMaxAbs() {
    return alignCostMaxAbs;
  }

  /**
   * Cost evaluations the alignment optimizer may spend on one frame before it is considered to
   * have failed.
   * The property is defined from Configuration.Align.MaxEvaluations
   *
   * @return evaluation limit
   */
  public int getAlignMaxEvaluations() {
    return alignMaxEvaluations;
  }

  public int getPlotWidth() {
    return plotWidth;
  }

  public int getPlotHeight() {
    return plotHeight;
  }
}
