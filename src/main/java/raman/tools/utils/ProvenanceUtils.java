package raman.tools.utils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.DumperOptions.FlowStyle;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import raman.tools.ConfigParseException;

/**
 * Reading and writing of provenance logs: the YAML segments, separated by "---" lines, that
 * describe the input arguments and every applied transformation of a dataset. In written files
 * each log line carries a comment prefix, which is removed again before parsing.
 */
public class ProvenanceUtils {

  public static final String DELIMITER = "---";

  private ProvenanceUtils() {
  }

  private static Yaml dumper() {
    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(FlowStyle.BLOCK);
    options.setIndent(2);
    return new Yaml(options);
  }

  private static Yaml loader() {
    return new Yaml(new SafeConstructor(new LoaderOptions()));
  }

  /**
   * Write key/value pairs as a block-style YAML mapping, in map iteration order.
   *
   * @param values mapping to write; values may be numbers, strings, booleans, lists, maps or null
   * @return YAML text ending in a newline
   */
  public static String toYaml(Map<String, Object> values) {
    return dumper().dump(values);
  }

  /**
   * Read a YAML mapping.
   *
   * @param segment YAML text of one segment
   * @return the mapping's keys and values
   * @throws ConfigParseException if the text is not valid YAML, not a mapping, or has a key
   * that is not a string; the message quotes the segment
   */
  public static Map<String, Object> fromYaml(String segment) throws ConfigParseException {
    Object parsed;
    try {
      parsed = loader().load(segment);
    } catch (YAMLException e) {
      throw new ConfigParseException("Offending YAML input:\n" + segment, e);
    }
    if (!(parsed instanceof Map)) {
      throw new ConfigParseException("YAML input is not a key/value mapping:\n" + segment);
    }
    Map<String, Object> mapping = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : ((Map<?, ?>) parsed).entrySet()) {
      if (!(entry.getKey() instanceof String)) {
        throw new ConfigParseException("YAML key " + entry.getKey() + " is not a string:\n"
            + segment);
      }
      mapping.put((String) entry.getKey(), entry.getValue());
    }
    return mapping;
  }

  /**
   * Remove one leading "# " (or a bare "#") from every line, so the header of a written dataset
   * file turns back into plain YAML. Lines without the prefix are kept unchanged.
   *
   * @param text header text
   * @return text without comment prefixes
   */
  public static String stripCommentPrefix(String text) {
    StringBuilder stripped = new StringBuilder();
    for (String line : text.split("\\r?\\n", -1)) {
      if (line.startsWith("# ")) {
        line = line.substring(2);
      } else if (line.startsWith("#")) {
        line = line.substring(1);
      }
      stripped.append(line).append('\n');
    }
    return stripped.toString();
  }

  /**
   * Split a log at its "---" lines.
   *
   * @param log provenance log without comment prefixes
   * @return segments in log order, without the delimiter lines
   */
  public static List<String> splitSegments(String log) {
    List<String> segments = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    for (String line : log.split("\\r?\\n")) {
      if (line.trim().equals(DELIMITER)) {
        segments.add(current.toString());
        current.setLength(0);
      } else {
        current.append(line).append('\n');
      }
    }
    segments.add(current.toString());
    return segments;
  }
}
