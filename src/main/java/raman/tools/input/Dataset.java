package raman.tools.input;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import raman.tools.EmptySelectionException;
import raman.tools.FrameOutOfRangeException;
import raman.tools.ShapeMismatchException;
import raman.tools.utils.ProvenanceUtils;

/**
 * Holds a spectroscopic measurement as a matrix of frame pairs together with the text describing
 * where it came from.
 *
 * The matrix always has an even number of columns. Column 2k holds the x-axis (wavelength or
 * Raman shift) of frame k + 1 and column 2k + 1 its y-axis (intensity); every column has the same
 * number of rows. Frames are numbered from 1 wherever a user names them, from 0 internally.
 *
 * Data is stored column by column so that a {@link Frame} can expose its two columns directly.
 * Transformers change the matrix in place or replace it through {@link #setColumns(double[][])}.
 *
 * The metadata is the provenance log: one segment per applied transformation, each terminated by
 * a {@value #SEGMENT_DELIMITER} line. Previous comments are text copied from the input file and are
 * never interpreted.
 */
public class Dataset {

  public static final String SEGMENT_DELIMITER = ProvenanceUtils.DELIMITER;

  private double[][] columns;
  private int rows;
  private final StringBuilder metadata;
  private final StringBuilder previousComments;

  /**
   * Create a dataset without data or text.
   */
  public Dataset() {
    columns = new double[0][];
    rows = 0;
    metadata = new StringBuilder();
    previousComments = new StringBuilder();
  }

  /**
   * Create a dataset from a column-major matrix. The arrays are used as given, not copied.
   *
   * @param columns data as [column][row]
   * @throws ShapeMismatchException if the column count is odd or the columns differ in length
   */
  public Dataset(double[][] columns) throws ShapeMismatchException {
    this();
    setColumns(columns);
  }

  /**
   * Create a dataset from a row-major matrix, as read from a delimited text body.
   *
   * @param rowData data as [row][column]
   * @return new dataset holding a copy of the data
   * @throws ShapeMismatchException if rows differ in length or the column count is odd
   */
  public static Dataset fromRows(double[][] rowData) throws ShapeMismatchException {
    int width = rowData.length == 0 ? 0 : rowData[0].length;
    double[][] cols = new double[width][rowData.length];
    for (int i = 0; i < rowData.length; ++i) {
      if (rowData[i].length != width) {
        throw new ShapeMismatchException("row " + (i + 1) + " has " + rowData[i].length
            + " values, expected " + width);
      }
      for (int j = 0; j < width; ++j) {
        cols[j][i] = rowData[i][j];
      }
    }
    Dataset dataset = new Dataset(cols);
    dataset.rows = rowData.length;
    return dataset;
  }

  /**
   * Build a dataset from an instrument file decoder. Every frame becomes a column pair of the
   * shared wavelength axis and the frame's counts; the decoder's description becomes the previous
   * comments.
   *
   * @param source decoded instrument file
   * @return new dataset
   * @throws ShapeMismatchException if a frame is not as long as the wavelength axis
   */
  public static Dataset fromFrameSource(FrameSource source) throws ShapeMismatchException {
    double[] wavelengths = source.getWavelengths();
    List<long[]> frames = source.getFrames();
    double[][] cols = new double[2 * frames.size()][];
    for (int k = 0; k < frames.size(); ++k) {
      long[] counts = frames.get(k);
      if (counts.length != wavelengths.length) {
        throw new ShapeMismatchException("frame " + (k + 1) + " has " + counts.length
            + " values but there are " + wavelengths.length + " wavelengths");
      }
      double[] y = new double[counts.length];
      for (int i = 0; i < counts.length; ++i) {
        y[i] = counts[i];
      }
      cols[2 * k] = wavelengths.clone();
      cols[2 * k + 1] = y;
    }
    Dataset dataset = new Dataset(cols);
    if (frames.isEmpty()) {
      dataset.rows = wavelengths.length;
    }
    String description = source.getDescription();
    if (description != null && !description.isEmpty()) {
      dataset.addPreviousComments(description);
    }
    return dataset;
  }

  /**
   * @return data as [column][row]; the arrays are the dataset's own
   */
  public double[][] getColumns() {
    return columns;
  }

  /**
   * Replace the whole matrix. The arrays are used as given, not copied.
   *
   * @param replacement data as [column][row]
   * @throws ShapeMismatchException if the column count is odd or the columns differ in length
   */
  public void setColumns(double[][] replacement) throws ShapeMismatchException {
    if (replacement.length % 2 != 0) {
      throw new ShapeMismatchException("dataset needs an even number of columns, got "
          + replacement.length);
    }
    int length = replacement.length == 0 ? 0 : replacement[0].length;
    for (int j = 1; j < replacement.length; ++j) {
      if (replacement[j].length != length) {
        throw new ShapeMismatchException("column " + (j + 1) + " has " + replacement[j].length
            + " rows, expected " + length);
      }
    }
    columns = replacement;
    rows = length;
  }

  /**
   * @return copy of the data as [row][column]
   */
  public double[][] toRows() {
    double[][] rowData = new double[rows][columns.length];
    for (int j = 0; j < columns.length; ++j) {
      for (int i = 0; i < rows; ++i) {
        rowData[i][j] = columns[j][i];
      }
    }
    return rowData;
  }

  public int getRowCount() {
    return rows;
  }

  public int getColumnCount() {
    return columns.length;
  }

  public int getFrameCount() {
    return columns.length / 2;
  }

  /**
   * @param index 0-based frame index
   * @return view on the frame's two columns
   */
  public Frame getFrame(int index) {
    return new Frame(index, columns[2 * index], columns[2 * index + 1]);
  }

  /**
   * @return views on every frame, in column order
   */
  public List<Frame> getFrames() {
    List<Frame> frames = new ArrayList<>();
    for (int k = 0; k < getFrameCount(); ++k) {
      frames.add(getFrame(k));
    }
    return frames;
  }

  /**
   * Frames to operate on: the listed ones (1-based, in ascending order without repeats) or every
   * frame if no list is given.
   *
   * @param frameNumbers 1-based frame numbers, or null for all frames
   * @return views on the selected frames
   * @throws FrameOutOfRangeException if a number is 0 or beyond the frame count
   */
  public List<Frame> getSelectedFrames(Collection<Integer> frameNumbers)
      throws FrameOutOfRangeException {
    if (frameNumbers == null) {
      return getFrames();
    }
    verifyFramesInBounds(frameNumbers);
    List<Frame> frames = new ArrayList<>();
    for (int number : new TreeSet<>(frameNumbers)) {
      frames.add(getFrame(number - 1));
    }
    return frames;
  }

  /**
   * Check that every frame number names an existing frame.
   *
   * @param frameNumbers 1-based frame numbers
   * @throws FrameOutOfRangeException if a number is 0 or beyond the frame count
   */
  public void verifyFramesInBounds(Collection<Integer> frameNumbers)
      throws FrameOutOfRangeException {
    int frameCount = getFrameCount();
    for (int number : frameNumbers) {
      if (number < 1 || number > frameCount) {
        throw new FrameOutOfRangeException("frame " + number + " out of range, dataset has "
            + frameCount + " frames");
      }
    }
  }

  /**
   * Get the columns of a subset of frames, keeping their order. The dataset is not changed.
   *
   * @param frameNumbers 1-based numbers of the frames to keep (or to drop if invert is set)
   * @param invert true to keep every frame except the listed ones
   * @return new matrix as [column][row]; the column arrays are shared with this dataset
   * @throws FrameOutOfRangeException if a number is 0 or beyond the frame count
   * @throws EmptySelectionException if no frame would remain
   */
  public double[][] selectFrames(Collection<Integer> frameNumbers, boolean invert)
      throws FrameOutOfRangeException, EmptySelectionException {
    verifyFramesInBounds(frameNumbers);
    Set<Integer> listed = new TreeSet<>(frameNumbers);
    List<double[]> kept = new ArrayList<>();
    for (int k = 0; k < getFrameCount(); ++k) {
      if (listed.contains(k + 1) != invert) {
        kept.add(columns[2 * k]);
        kept.add(columns[2 * k + 1]);
      }
    }
    if (kept.isEmpty()) {
      throw new EmptySelectionException("frame selection " + listed
          + (invert ? " (inverted)" : "") + " leaves no frames");
    }
    return kept.toArray(new double[0][]);
  }

  /**
   * @return provenance log accumulated so far
   */
  public String getMetadata() {
    return metadata.toString();
  }

  /**
   * Add one segment to the provenance log, followed by the segment delimiter line.
   *
   * @param segment text of the segment, without the delimiter
   */
  public void appendMetadata(String segment) {
    metadata.append(segment);
    if (segment.length() > 0 && !segment.endsWith("\n")) {
      metadata.append('\n');
    }
    metadata.append(SEGMENT_DELIMITER).append('\n');
  }

  /**
   * @return comments carried over from the input, verbatim
   */
  public String getPreviousComments() {
    return previousComments.toString();
  }

  /**
   * @param comments text to keep, one or more lines
   */
  public void addPreviousComments(String comments) {
    previousComments.append(comments);
    if (comments.length() > 0 && !comments.endsWith("\n")) {
      previousComments.append('\n');
    }
  }
}
