package raman.tools.transform;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import raman.tools.ConfigParseException;
import raman.tools.ProcessingException;
import raman.tools.ShapeMismatchException;
import raman.tools.input.Configuration;
import raman.tools.input.Dataset;
import raman.tools.input.DelimitedTextReader;

/**
 * Concatenates the data of another delimited text file (or of standard input) with the dataset,
 * either as additional frames (new columns) or as additional rows. The other file's comments are
 * added to the dataset's previous comments.
 */
@Command(name = "append", description = "Append data of another file as new frames or rows.")
public class AppendTransform implements Transformer {

  public static final String FILEPATH = "filepath";
  public static final String COMMENT = "comment";
  public static final String DELIMITER = "delimiter";
  public static final String HORIZONTAL = "horizontal";

  @Parameters(index = "0", arity = "0..1",
      description = "File to append; standard input if omitted.")
  private String filepath;

  @Option(names = {"-c", "--comment"}, description = "The character starting a comment.")
  private String comment;

  @Option(names = {"-d", "--delimiter"}, description = "The delimiting character.")
  private String delimiter;

  @Option(names = {"--horizontal"},
      description = "Append data horizontally (as rows), e.g. to add scans.")
  private boolean horizontal;

  public AppendTransform() {
    this(null, Configuration.getInstance().getInputCommentChar(),
        Configuration.getInstance().getInputDelimiter(), false);
  }

  /**
   * @param filepath file to append, or null for standard input
   * @param comment comment prefix of that file
   * @param delimiter field delimiter of that file
   * @param horizontal true to append rows, false to append frames
   */
  public AppendTransform(String filepath, String comment, String delimiter, boolean horizontal) {
    this.filepath = filepath;
    this.comment = comment;
    this.delimiter = delimiter;
    this.horizontal = horizontal;
  }

  static AppendTransform fromConfig(TransformerConfig config) throws ConfigParseException {
    Configuration defaults = Configuration.getInstance();
    return new AppendTransform(
        config.getString(FILEPATH, null),
        config.getString(COMMENT, defaults.getInputCommentChar()),
        config.getString(DELIMITER, defaults.getInputDelimiter()),
        config.getBoolean(HORIZONTAL, false));
  }

  public String getFilepath() {
    return filepath;
  }

  public boolean isHorizontal() {
    return horizontal;
  }

  @Override
  public TransformerFactory getKind() {
    return TransformerFactory.APPEND;
  }

  @Override
  public Map<String, Object> getConfig() {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put(FILEPATH, filepath);
    config.put(COMMENT, comment);
    config.put(DELIMITER, delimiter);
    config.put(HORIZONTAL, horizontal);
    return config;
  }

  @Override
  public void transform(Dataset dataset) throws ProcessingException {
    Dataset other;
    try {
      other = new DelimitedTextReader(comment, delimiter)
          .readPathOrStandardInput(filepath == null ? null : Paths.get(filepath));
    } catch (IOException e) {
      throw new ProcessingException("could not read data to append from "
          + (filepath == null ? "standard input" : filepath) + ": " + e.getMessage(), e);
    }
    append(dataset, other, horizontal);
  }

  /**
   * Concatenate the matrix of one dataset with that of another and take over its comments.
   *
   * @param dataset dataset to extend
   * @param other dataset to add
   * @param asRows true to add the other matrix below, false to add it to the right
   * @throws ShapeMismatchException if the matrices do not fit together
   */
  static void append(Dataset dataset, Dataset other, boolean asRows)
      throws ShapeMismatchException {
    double[][] columns = dataset.getColumns();
    double[][] added = other.getColumns();
    double[][] joined;
    if (columns.length == 0) {
      joined = added;
    } else if (added.length == 0) {
      joined = columns;
    } else if (asRows) {
      if (added.length != columns.length) {
        throw new ShapeMismatchException("cannot append rows of " + added.length
            + " columns to a dataset of " + columns.length + " columns");
      }
      joined = new double[columns.length][];
      int rows = dataset.getRowCount();
      for (int j = 0; j < columns.length; ++j) {
        joined[j] = new double[rows + other.getRowCount()];
        System.arraycopy(columns[j], 0, joined[j], 0, rows);
        System.arraycopy(added[j], 0, joined[j], rows, other.getRowCount());
      }
    } else {
      if (other.getRowCount() != dataset.getRowCount()) {
        throw new ShapeMismatchException("cannot append frames of " + other.getRowCount()
            + " rows to a dataset of " + dataset.getRowCount() + " rows");
      }
      joined = new double[columns.length + added.length][];
      System.arraycopy(columns, 0, joined, 0, columns.length);
      System.arraycopy(added, 0, joined, columns.length, added.length);
    }
    dataset.setColumns(joined);
    dataset.addPreviousComments("\n" + other.getPreviousComments());
  }
}
