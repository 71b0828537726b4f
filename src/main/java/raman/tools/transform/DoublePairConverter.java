package raman.tools.transform;

import org.apache.commons.math3.util.Pair;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;

/**
 * Parses command line values of the form "a,b" into a pair of doubles, e.g. "1500.5,120".
 */
public class DoublePairConverter implements ITypeConverter<Pair<Double, Double>> {

  @Override
  public Pair<Double, Double> convert(String value) {
    int comma = value.indexOf(',');
    if (comma < 0) {
      throw new TypeConversionException("expected two numbers separated by a comma, got '"
          + value + "'");
    }
    try {
      return new Pair<>(Double.parseDouble(value.substring(0, comma).trim()),
          Double.parseDouble(value.substring(comma + 1).trim()));
    } catch (NumberFormatException e) {
      throw new TypeConversionException("not a pair of numbers: '" + value + "'");
    }
  }
}
