package raman.tools.transform;

import java.util.LinkedHashMap;
import java.util.Map;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import raman.tools.ConfigParseException;
import raman.tools.ShapeMismatchException;
import raman.tools.input.Dataset;

/**
 * Re-flows the (x, y) pairs of the dataset into frames of a new length, e.g. to split a file in
 * which several scans were stored one after the other in a single column pair. The pairs are
 * read frame by frame, top to bottom, and written in the same order.
 */
@Command(name = "reshape", description = "Re-flow the data into frames of a new row count.")
public class ReshapeTransform implements Transformer {

  public static final String ROWS = "rows";

  @Parameters(index = "0", description = "New number of rows")
  private int rows;

  public ReshapeTransform() {
    this(0);
  }

  public ReshapeTransform(int rows) {
    this.rows = rows;
  }

  static ReshapeTransform fromConfig(TransformerConfig config) throws ConfigParseException {
    return new ReshapeTransform(config.getInt(ROWS));
  }

  public int getRows() {
    return rows;
  }

  @Override
  public TransformerFactory getKind() {
    return TransformerFactory.RESHAPE;
  }

  @Override
  public Map<String, Object> getConfig() {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put(ROWS, rows);
    return config;
  }

  @Override
  public void transform(Dataset dataset) throws ShapeMismatchException {
    if (rows <= 0) {
      throw new ShapeMismatchException("number of reshaped rows must be positive, got " + rows);
    }
    int oldRows = dataset.getRowCount();
    long pairs = (long) oldRows * dataset.getFrameCount();
    if (pairs % rows != 0) {
      throw new ShapeMismatchException("Cannot reshape " + pairs + " data points into frames of "
          + rows + " rows.");
    }
    int newFrames = (int) (pairs / rows);

    double[][] reshaped = new double[2 * newFrames][rows];
    int a = 0;
    int b = 0;
    for (int k = 0; k < newFrames; ++k) {
      for (int i = 0; i < rows; ++i) {
        reshaped[2 * k][i] = dataset.getFrame(b).getX()[a];
        reshaped[2 * k + 1][i] = dataset.getFrame(b).getY()[a];
        ++a;
        if (a == oldRows) {
          a = 0;
          ++b;
        }
      }
    }
    dataset.setColumns(reshaped);
  }
}
