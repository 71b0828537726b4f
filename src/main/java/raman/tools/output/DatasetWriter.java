package raman.tools.output;

import java.io.IOException;
import java.io.Writer;
import raman.tools.input.Configuration;
import raman.tools.input.Dataset;

/**
 * Writes a dataset as delimited text. The header names the program and version, followed by the
 * provenance log and the previous comments, every line prefixed with "# "; the body holds one line
 * per matrix row.
 */
public class DatasetWriter {

  private static final String COMMENT_PREFIX = "# ";

  private final String delimiter;
  private final String applicationName;

  public DatasetWriter() {
    this(Configuration.getInstance().getOutputDelimiter(),
        Configuration.getInstance().getApplicationName());
  }

  /**
   * @param delimiter field delimiter of the body
   * @param applicationName name written in the first header line
   */
  public DatasetWriter(String delimiter, String applicationName) {
    this.delimiter = delimiter;
    this.applicationName = applicationName;
  }

  /**
   * @return version from the jar manifest, "development" when not run from a jar
   */
  public static String getVersion() {
    String version = DatasetWriter.class.getPackage().getImplementationVersion();
    return version == null ? "development" : version;
  }

  /**
   * @return first header line, without comment prefix and line end
   */
  public String getApplicationInfo() {
    return applicationName + " version " + getVersion() + ".";
  }

  /**
   * Write the dataset. The writer is flushed but not closed.
   *
   * @param dataset dataset to write
   * @param out destination
   * @throws IOException if writing fails
   */
  public void write(Dataset dataset, Writer out) throws IOException {
    out.write(COMMENT_PREFIX + getApplicationInfo() + "\n");
    out.write(COMMENT_PREFIX + Dataset.SEGMENT_DELIMITER + "\n");
    writeCommented(dataset.getMetadata(), out);
    writeCommented(dataset.getPreviousComments(), out);

    double[][] rows = dataset.toRows();
    StringBuilder line = new StringBuilder();
    for (double[] row : rows) {
      line.setLength(0);
      for (int j = 0; j < row.length; ++j) {
        if (j > 0) {
          line.append(delimiter);
        }
        line.append(row[j]);
      }
      out.write(line.append('\n').toString());
    }
    out.flush();
  }

  private static void writeCommented(String text, Writer out) throws IOException {
    if (text.isEmpty()) {
      return;
    }
    for (String line : text.split("\\r?\\n")) {
      out.write(COMMENT_PREFIX + line + "\n");
    }
  }
}
