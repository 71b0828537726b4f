package raman.tools.transform;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.util.Pair;
import raman.tools.ConfigParseException;

/**
 * Typed access to the key/value configuration of one transformer, as read from a provenance
 * segment. Missing optional keys fall back to the given defaults; missing required keys and values
 * of the wrong type raise a {@link ConfigParseException} that quotes the segment.
 *
 * The inverse helpers ({@link #pairToMap(Pair)}, {@link #pairsToMaps(List)}) produce the
 * representation transformers use when they write their configuration: pairs become mappings with
 * the keys "a" and "b".
 */
public class TransformerConfig {

  private final Map<String, Object> values;
  private final String segment;

  /**
   * @param values parsed key/value pairs
   * @param segment source text, quoted in error messages
   */
  public TransformerConfig(Map<String, Object> values, String segment) {
    this.values = values;
    this.segment = segment;
  }

  public boolean containsKey(String key) {
    return values.get(key) != null;
  }

  private ConfigParseException error(String key, String problem) {
    return new ConfigParseException("key '" + key + "' " + problem + " in:\n" + segment);
  }

  private Object required(String key) throws ConfigParseException {
    Object value = values.get(key);
    if (value == null) {
      throw error(key, "is missing");
    }
    return value;
  }

  private double toDouble(String key, Object value) throws ConfigParseException {
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    throw error(key, "must be a number, got '" + value + "'");
  }

  private int toInt(String key, Object value) throws ConfigParseException {
    if (value instanceof Integer || value instanceof Long) {
      return ((Number) value).intValue();
    }
    throw error(key, "must be an integer, got '" + value + "'");
  }

  public double getDouble(String key) throws ConfigParseException {
    return toDouble(key, required(key));
  }

  public double getDouble(String key, double fallback) throws ConfigParseException {
    Object value = values.get(key);
    return value == null ? fallback : toDouble(key, value);
  }

  /**
   * @param key key to read
   * @return the value, or null if the key is missing or null
   * @throws ConfigParseException if the value is not a number
   */
  public Double getOptionalDouble(String key) throws ConfigParseException {
    Object value = values.get(key);
    return value == null ? null : toDouble(key, value);
  }

  public int getInt(String key) throws ConfigParseException {
    return toInt(key, required(key));
  }

  public int getInt(String key, int fallback) throws ConfigParseException {
    Object value = values.get(key);
    return value == null ? fallback : toInt(key, value);
  }

  public boolean getBoolean(String key, boolean fallback) throws ConfigParseException {
    Object value = values.get(key);
    if (value == null) {
      return fallback;
    }
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    throw error(key, "must be true or false, got '" + value + "'");
  }

  public String getString(String key, String fallback) {
    Object value = values.get(key);
    return value == null ? fallback : value.toString();
  }

  /**
   * @param key key to read
   * @return list of integers, or null if the key is missing or null
   * @throws ConfigParseException if the value is not a list of integers
   */
  public List<Integer> getOptionalIntList(String key) throws ConfigParseException {
    Object value = values.get(key);
    if (value == null) {
      return null;
    }
    if (!(value instanceof List)) {
      throw error(key, "must be a list, got '" + value + "'");
    }
    List<Integer> list = new ArrayList<>();
    for (Object element : (List<?>) value) {
      list.add(toInt(key, element));
    }
    return list;
  }

  public List<Integer> getIntList(String key) throws ConfigParseException {
    required(key);
    return getOptionalIntList(key);
  }

  /**
   * Read a list of (a, b) mappings as pairs of doubles. A missing key gives an empty list.
   *
   * @param key key to read
   * @return pairs in list order
   * @throws ConfigParseException if an element is not a mapping with numeric "a" and "b"
   */
  public List<Pair<Double, Double>> getDoublePairs(String key) throws ConfigParseException {
    List<Pair<Double, Double>> pairs = new ArrayList<>();
    for (Map<?, ?> element : mapList(key)) {
      pairs.add(new Pair<>(toDouble(key, element.get("a")), toDouble(key, element.get("b"))));
    }
    return pairs;
  }

  /**
   * Read a list of (a, b) mappings as pairs of integers. A missing key gives an empty list.
   *
   * @param key key to read
   * @return pairs in list order
   * @throws ConfigParseException if an element is not a mapping with integer "a" and "b"
   */
  public List<Pair<Integer, Integer>> getIntPairs(String key) throws ConfigParseException {
    List<Pair<Integer, Integer>> pairs = new ArrayList<>();
    for (Map<?, ?> element : mapList(key)) {
      pairs.add(new Pair<>(toInt(key, element.get("a")), toInt(key, element.get("b"))));
    }
    return pairs;
  }

  /**
   * Read a single (a, b) mapping as a pair of doubles.
   *
   * @param key key to read
   * @return the pair, or null if the key is missing or null
   * @throws ConfigParseException if the value is not a mapping with numeric "a" and "b"
   */
  public Pair<Double, Double> getOptionalDoublePair(String key) throws ConfigParseException {
    Object value = values.get(key);
    if (value == null) {
      return null;
    }
    if (!(value instanceof Map)) {
      throw error(key, "must be a mapping with keys a and b, got '" + value + "'");
    }
    Map<?, ?> map = (Map<?, ?>) value;
    return new Pair<>(toDouble(key, map.get("a")), toDouble(key, map.get("b")));
  }

  private List<Map<?, ?>> mapList(String key) throws ConfigParseException {
    Object value = values.get(key);
    if (value == null) {
      return Collections.emptyList();
    }
    if (!(value instanceof List)) {
      throw error(key, "must be a list, got '" + value + "'");
    }
    List<Map<?, ?>> maps = new ArrayList<>();
    for (Object element : (List<?>) value) {
      if (!(element instanceof Map)) {
        throw error(key, "must hold mappings with keys a and b, got '" + element + "'");
      }
      maps.add((Map<?, ?>) element);
    }
    return maps;
  }

  /**
   * @param pair pair to write, may be null
   * @return mapping {a: first, b: second}, or null
   */
  public static Map<String, Object> pairToMap(Pair<?, ?> pair) {
    if (pair == null) {
      return null;
    }
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("a", pair.getFirst());
    map.put("b", pair.getSecond());
    return map;
  }

  /**
   * @param pairs pairs to write
   * @return list of {a: first, b: second} mappings
   */
  public static List<Map<String, Object>> pairsToMaps(List<? extends Pair<?, ?>> pairs) {
    List<Map<String, Object>> maps = new ArrayList<>();
    for (Pair<?, ?> pair : pairs) {
      maps.add(pairToMap(pair));
    }
    return maps;
  }
}
