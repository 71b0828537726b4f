package raman.tools.input;

import java.util.LinkedHashMap;
import java.util.Map;
import raman.tools.ConfigParseException;
import raman.tools.utils.ProvenanceUtils;

/**
 * Describes where the input of a run came from: the file (or standard input), and the comment
 * prefix and delimiter used to read it. Written as the first segment of every provenance log so a
 * run can be repeated from its output file alone.
 */
public class InputArguments {

  public static final String SEGMENT_HEADER = "preprocessor: arguments";

  private final String filepath;
  private final String comment;
  private final String delimiter;

  /**
   * @param filepath input file, or null for standard input
   * @param comment comment prefix of the input
   * @param delimiter field delimiter of the input
   */
  public InputArguments(String filepath, String comment, String delimiter) {
    this.filepath = filepath;
    this.comment = comment;
    this.delimiter = delimiter;
  }

  /**
   * Find the input argument segment in a provenance log and read it back.
   *
   * @param log provenance log, with or without comment prefixes
   * @return the arguments the log was produced with
   * @throws ConfigParseException if the log has no input argument segment or it does not parse
   */
  public static InputArguments fromProvenance(String log) throws ConfigParseException {
    String plain = ProvenanceUtils.stripCommentPrefix(log);
    for (String segment : ProvenanceUtils.splitSegments(plain)) {
      if (!segment.contains(SEGMENT_HEADER)) {
        continue;
      }
      Map<String, Object> values = ProvenanceUtils.fromYaml(segment);
      Configuration config = Configuration.getInstance();
      Object path = values.get("filepath");
      return new InputArguments(
          path == null ? null : path.toString(),
          stringOrDefault(values.get("comment"), config.getInputCommentChar()),
          stringOrDefault(values.get("delimiter"), config.getInputDelimiter()));
    }
    throw new ConfigParseException("Unable to parse input arguments from provenance log, missing '"
        + SEGMENT_HEADER + "' segment");
  }

  private static String stringOrDefault(Object value, String fallback) {
    return value == null ? fallback : value.toString();
  }

  /**
   * @return the segment text, starting with {@value #SEGMENT_HEADER}
   */
  public String toProvenance() {
    Map<String, Object> values = new LinkedHashMap<>();
    values.put("filepath", filepath);
    values.put("comment", comment);
    values.put("delimiter", delimiter);
    return SEGMENT_HEADER + "\n" + ProvenanceUtils.toYaml(values);
  }

  /**
   * Start the dataset's provenance log with this segment.
   *
   * @param dataset dataset read with these arguments
   */
  public void writeMetadata(Dataset dataset) {
    dataset.appendMetadata(toProvenance());
  }

  public String getFilepath() {
    return filepath;
  }

  public String getComment() {
    return comment;
  }

  public String getDelimiter() {
    return delimiter;
  }
}
