package raman.tools.transform;

import org.apache.commons.math3.util.Pair;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;

/**
 * Parses command line values of the form "a,b" into a pair of integers, e.g. a "frame,pixel"
 * position.
 */
public class IntPairConverter implements ITypeConverter<Pair<Integer, Integer>> {

  @Override
  public Pair<Integer, Integer> convert(String value) {
    int comma = value.indexOf(',');
    if (comma < 0) {
      throw new TypeConversionException("expected two integers separated by a comma, got '"
          + value + "'");
    }
    try {
      return new Pair<>(Integer.parseInt(value.substring(0, comma).trim()),
          Integer.parseInt(value.substring(comma + 1).trim()));
    } catch (NumberFormatException e) {
      throw new TypeConversionException("not a pair of integers: '" + value + "'");
    }
  }
}
