package raman.tools.input;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;
import org.apache.log4j.Logger;
import raman.tools.ShapeMismatchException;

/**
 * Reads datasets from delimited text: comment lines (kept as previous comments) followed by a body
 * of rows whose columns alternate between the x- and y-axis of each frame.
 */
public class DelimitedTextReader {

  private static final Logger logger = Logger.getLogger(DelimitedTextReader.class);

  private final String commentChar;
  private final String delimiter;

  /**
   * Create a reader with the comment prefix and delimiter from the configuration.
   */
  public DelimitedTextReader() {
    this(Configuration.getInstance().getInputCommentChar(),
        Configuration.getInstance().getInputDelimiter());
  }

  /**
   * @param commentChar prefix of comment lines, e.g. "#"
   * @param delimiter field separator, e.g. ","
   */
  public DelimitedTextReader(String commentChar, String delimiter) {
    this.commentChar = commentChar;
    this.delimiter = delimiter;
  }

  /**
   * Read a dataset from a file.
   *
   * @param path file to read
   * @return dataset holding the file's body and comments
   * @throws IOException if the file cannot be read or holds a value that is not a number
   * @throws ShapeMismatchException if rows differ in width or the width is odd
   */
  public Dataset read(Path path) throws IOException, ShapeMismatchException {
    String text = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    return parse(text, path.toAbsolutePath().normalize().toString());
  }

  /**
   * Read a dataset from a stream that may never deliver data, such as standard input of an
   * interactive terminal. If nothing arrives before the timeout the dataset is empty.
   *
   * @param stream stream to read until its end
   * @param timeoutMillis time to wait for the end of the stream
   * @return dataset holding the stream's body and comments
   * @throws IOException if reading fails or a value is not a number
   * @throws ShapeMismatchException if rows differ in width or the width is odd
   */
  public Dataset read(InputStream stream, long timeoutMillis)
      throws IOException, ShapeMismatchException {
    return parse(readWithTimeout(stream, timeoutMillis), null);
  }

  /**
   * Read a dataset from a file, or from standard input if no file is given.
   *
   * @param path file to read, may be null
   * @return dataset holding the body and comments of the input
   * @throws IOException if reading fails or a value is not a number
   * @throws ShapeMismatchException if rows differ in width or the width is odd
   */
  public Dataset readPathOrStandardInput(Path path) throws IOException, ShapeMismatchException {
    if (path != null) {
      return read(path);
    }
    return read(System.in, Configuration.getInstance().getStdinTimeoutMillis());
  }

  static String readWithTimeout(InputStream stream, long timeoutMillis) throws IOException {
    ExecutorService executor = Executors.newSingleThreadExecutor(runnable -> {
      Thread thread = new Thread(runnable, "input-reader");
      // a blocked read must not keep the program alive
      thread.setDaemon(true);
      return thread;
    });
    Future<String> future = executor.submit(() -> {
      ByteArrayOutputStream buffer = new ByteArrayOutputStream();
      byte[] chunk = new byte[8192];
      int count;
      while ((count = stream.read(chunk)) != -1) {
        buffer.write(chunk, 0, count);
      }
      return new String(buffer.toByteArray(), StandardCharsets.UTF_8);
    });
    try {
      return future.get(timeoutMillis, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      logger.warn("No data received on standard input within " + timeoutMillis
          + " ms, proceeding with empty input data");
      future.cancel(true);
      return "";
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException("interrupted while reading input", e);
    } catch (ExecutionException e) {
      throw new IOException("could not read input data", e.getCause());
    } finally {
      executor.shutdownNow();
    }
  }

  /**
   * Turn delimited text into a dataset.
   *
   * @param text full input text
   * @param sourceName absolute path of the input file, or null for standard input
   * @return dataset holding the body and comments of the text
   * @throws IOException if a value is not a number
   * @throws ShapeMismatchException if rows differ in width or the width is odd
   */
  public Dataset parse(String text, String sourceName) throws IOException, ShapeMismatchException {
    StringBuilder comments = new StringBuilder();
    List<double[]> rows = new ArrayList<>();
    Pattern splitter = Pattern.compile(Pattern.quote(delimiter));

    String[] lines = text.split("\\r?\\n");
    for (int lineNumber = 0; lineNumber < lines.length; ++lineNumber) {
      String line = lines[lineNumber];
      if (line.startsWith(commentChar)) {
        comments.append(line).append('\n');
        continue;
      }
      if (line.trim().isEmpty()) {
        continue;
      }
      String[] fields = splitter.split(line, -1);
      double[] row = new double[fields.length];
      for (int j = 0; j < fields.length; ++j) {
        try {
          row[j] = Double.parseDouble(fields[j].trim());
        } catch (NumberFormatException e) {
          throw new IOException("line " + (lineNumber + 1) + ", field " + (j + 1)
              + ": not a number: '" + fields[j].trim() + "'", e);
        }
      }
      rows.add(row);
    }

    Dataset dataset = Dataset.fromRows(rows.toArray(new double[0][]));
    if (comments.length() > 0) {
      String header = sourceName == null
          ? "comments from input:\n"
          : "comments from input file " + sourceName + ":\n";
      dataset.addPreviousComments(header + comments);
    }
    return dataset;
  }
}
