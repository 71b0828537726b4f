package raman.tools.transform;

import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.univariate.BrentOptimizer;
import org.apache.commons.math3.optim.univariate.SearchInterval;
import org.apache.commons.math3.optim.univariate.UnivariateObjectiveFunction;
import org.apache.commons.math3.optim.univariate.UnivariateOptimizer;
import org.apache.commons.math3.optim.univariate.UnivariatePointValuePair;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import raman.tools.ConfigParseException;
import raman.tools.InvalidParameterException;
import raman.tools.OptimizationFailureException;
import raman.tools.ProcessingException;
import raman.tools.ShapeMismatchException;
import raman.tools.input.Configuration;
import raman.tools.input.Dataset;
import raman.tools.input.Frame;
import raman.tools.utils.NumericUtils;

/**
 * Aligns every frame to the first one by shifting it along the x-axis.
 *
 * For each frame a shift dx within [-cost_max_abs, cost_max_abs] is searched with Brent's method,
 * minimizing the negative overlap of the shifted frame with the reference frame, i.e. the negated
 * sum of ref[i] * shifted[i] over all points where both are defined. The frame is then resampled
 * from its shifted grid onto the reference grid, and its x-axis replaced by the reference x-axis.
 * Overlap rewards matching band positions; a squared difference is easily dominated by intensity
 * differences between frames.
 */
@Command(name = "align", description = "Align frames to the first frame by shifting along x.")
public class AlignTransform implements Transformer {

  public static final String COST_MAX_ABS = "cost_max_abs";

  private static final double RELATIVE_TOLERANCE = 1E-10;
  private static final double ABSOLUTE_TOLERANCE = 1E-12;

  @Option(names = {"-c", "--cost-max-abs"},
      description = "Largest shift (absolute value, x-axis units) to try.")
  private double costMaxAbs;

  public AlignTransform() {
    this(Configuration.getInstance().getAlignCostMaxAbs());
  }

  /**
   * @param costMaxAbs bound of the shift search interval; its sign is ignored
   */
  public AlignTransform(double costMaxAbs) {
    this.costMaxAbs = costMaxAbs;
  }

  static AlignTransform fromConfig(TransformerConfig config) throws ConfigParseException {
    return new AlignTransform(
        config.getDouble(COST_MAX_ABS, Configuration.getInstance().getAlignCostMaxAbs()));
  }

  public double getCostMaxAbs() {
    return costMaxAbs;
  }

  @Override
  public TransformerFactory getKind() {
    return TransformerFactory.ALIGN;
  }

  @Override
  public Map<String, Object> getConfig() {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put(COST_MAX_ABS, costMaxAbs);
    return config;
  }

  @Override
  public void transform(Dataset dataset) throws ProcessingException {
    double bound = Math.abs(costMaxAbs);
    if (!(bound > 0.)) {
      throw new InvalidParameterException("alignment needs a positive search bound, got "
          + costMaxAbs);
    }
    if (dataset.getFrameCount() < 2) {
      return;
    }
    Frame reference = dataset.getFrame(0);
    int maxEvaluations = Configuration.getInstance().getAlignMaxEvaluations();

    for (int k = 1; k < dataset.getFrameCount(); ++k) {
      Frame frame = dataset.getFrame(k);
      double dx = findShift(reference, frame, bound, maxEvaluations);
      double[] shiftedGrid = shiftGrid(frame.getX(), dx);
      double[] aligned = NumericUtils.linearResample(shiftedGrid, frame.getY(), reference.getX());
      System.arraycopy(reference.getX(), 0, frame.getX(), 0, frame.size());
      System.arraycopy(aligned, 0, frame.getY(), 0, frame.size());
    }
  }

  /**
   * Find the shift of a frame that maximizes its overlap with the reference frame.
   *
   * @param reference frame to align to
   * @param frame frame to shift
   * @param bound largest absolute shift to consider
   * @param maxEvaluations cost evaluations allowed before giving up
   * @return best shift, to be added to the frame's x-axis
   * @throws ShapeMismatchException if the frames differ in length
   * @throws OptimizationFailureException if the search does not converge
   */
  static double findShift(Frame reference, Frame frame, double bound, int maxEvaluations)
      throws ShapeMismatchException, OptimizationFailureException {
    if (reference.size() != frame.size()) {
      throw new ShapeMismatchException("frames that shall be aligned must be of same length, got "
          + reference.size() + " and " + frame.size());
    }
    UnivariateFunction cost = dx -> overlapCost(reference, frame, dx);

    UnivariateOptimizer optimizer = new BrentOptimizer(RELATIVE_TOLERANCE, ABSOLUTE_TOLERANCE);
    try {
      UnivariatePointValuePair optimum = optimizer.optimize(
          new MaxEval(maxEvaluations),
          new UnivariateObjectiveFunction(cost),
          GoalType.MINIMIZE,
          new SearchInterval(-bound, bound, 0.));
      double dx = optimum.getPoint();
      if (Double.isNaN(dx)) {
        throw new OptimizationFailureException("frame alignment of frame " + frame.getNumber()
            + " failed, optimization did not return a shift");
      }
      return dx;
    } catch (TooManyEvaluationsException e) {
      throw new OptimizationFailureException("frame alignment of frame " + frame.getNumber()
          + " failed, no convergence within " + maxEvaluations + " evaluations", e);
    }
  }

  private static double overlapCost(Frame reference, Frame frame, double dx) {
    double[] shifted = NumericUtils.linearResample(shiftGrid(frame.getX(), dx), frame.getY(),
        reference.getX());
    double[] ref = reference.getY();
    double sum = 0.;
    for (int i = 0; i < ref.length; ++i) {
      double term = -(ref[i] * shifted[i]);
      if (!Double.isNaN(term)) {
        sum += term;
      }
    }
    return sum;
  }

  private static double[] shiftGrid(double[] grid, double dx) {
    double[] shifted = new double[grid.length];
    for (int i = 0; i < grid.length; ++i) {
      shifted[i] = grid[i] + dx;
    }
    return shifted;
  }
}
