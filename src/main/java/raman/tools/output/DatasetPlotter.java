package raman.tools.output;

import java.io.File;
import java.io.IOException;
import org.apache.log4j.Logger;
import org.jfree.chart.ChartFactory;
import org.jfree.chart.ChartUtils;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;
import raman.tools.input.Configuration;
import raman.tools.input.Dataset;
import raman.tools.input.Frame;

/**
 * Exports a dataset as a line chart with one series per frame.
 */
public class DatasetPlotter {

  private static final Logger logger = Logger.getLogger(DatasetPlotter.class);

  private final int width;
  private final int height;

  public DatasetPlotter() {
    this(Configuration.getInstance().getPlotWidth(), Configuration.getInstance().getPlotHeight());
  }

  public DatasetPlotter(int width, int height) {
    this.width = width;
    this.height = height;
  }

  /**
   * Collect the frames of a dataset as chart series named "Frame 1", "Frame 2", ...
   * Points with an undefined x- or y-value are left out.
   *
   * @param dataset data to plot
   * @return one series per frame
   */
  public static XYSeriesCollection toSeries(Dataset dataset) {
    XYSeriesCollection collection = new XYSeriesCollection();
    for (Frame frame : dataset.getFrames()) {
      // keep data order, x-axes need not be sorted after some transformations
      XYSeries series = new XYSeries("Frame " + frame.getNumber(), false);
      double[] x = frame.getX();
      double[] y = frame.getY();
      for (int i = 0; i < x.length; ++i) {
        if (Double.isNaN(x[i]) || Double.isNaN(y[i])) {
          continue;
        }
        series.add(x[i], y[i]);
      }
      collection.addSeries(series);
    }
    return collection;
  }

  /**
   * @param dataset data to plot
   * @param title chart title
   * @return line chart of all frames
   */
  public static JFreeChart createChart(Dataset dataset, String title) {
    return ChartFactory.createXYLineChart(title, "x", "intensity", toSeries(dataset),
        PlotOrientation.VERTICAL, true, false, false);
  }

  /**
   * Write the chart of a dataset as PNG image.
   *
   * @param dataset data to plot
   * @param title chart title
   * @param file destination file
   * @throws IOException if the image cannot be written
   */
  public void savePng(Dataset dataset, String title, File file) throws IOException {
    logger.info("Writing plot of " + dataset.getFrameCount() + " frames to "
        + file.getAbsolutePath());
    ChartUtils.saveChartAsPNG(file, createChart(dataset, title), width, height);
  }
}
