package raman.tools.transform;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.apache.commons.math3.util.Pair;
import org.apache.log4j.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import raman.tools.ConfigParseException;
import raman.tools.input.Dataset;

/**
 * Replaces manually flagged intensities, given as (frame, pixel) positions counted from 1, by the
 * mean intensity of the frames that are not flagged at the same pixel. Positions outside the
 * dataset and pixels flagged in every frame are skipped with a warning.
 */
@Command(name = "mask", description = "Replace masked pixels by the mean of the other frames.")
public class MaskTransform implements Transformer {

  private static final Logger logger = Logger.getLogger(MaskTransform.class);

  public static final String MASK = "mask";

  @Parameters(arity = "1..*", converter = IntPairConverter.class,
      description = "frame,pixel pairs of pixels that shall be masked")
  private List<Pair<Integer, Integer>> mask;

  public MaskTransform() {
    this(new ArrayList<>());
  }

  /**
   * @param mask (frame, pixel) positions to replace, 1-based
   */
  public MaskTransform(List<Pair<Integer, Integer>> mask) {
    this.mask = new ArrayList<>(mask);
  }

  static MaskTransform fromConfig(TransformerConfig config) throws ConfigParseException {
    return new MaskTransform(config.getIntPairs(MASK));
  }

  public List<Pair<Integer, Integer>> getMask() {
    return mask;
  }

  @Override
  public TransformerFactory getKind() {
    return TransformerFactory.MASK;
  }

  @Override
  public Map<String, Object> getConfig() {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put(MASK, TransformerConfig.pairsToMaps(mask));
    return config;
  }

  @Override
  public void transform(Dataset dataset) {
    int frames = dataset.getFrameCount();
    int rows = dataset.getRowCount();

    // pixel index -> masked frame indices, both 0-based
    Map<Integer, Set<Integer>> masked = new TreeMap<>();
    for (Pair<Integer, Integer> position : mask) {
      int frame = position.getFirst();
      int pixel = position.getSecond();
      if (frame < 1 || frame > frames || pixel < 1 || pixel > rows) {
        logger.warn("frame,pixel = " + frame + "," + pixel + " is out of bounds, skipping");
        continue;
      }
      masked.computeIfAbsent(pixel - 1, p -> new TreeSet<>()).add(frame - 1);
    }

    for (Map.Entry<Integer, Set<Integer>> entry : masked.entrySet()) {
      int pixel = entry.getKey();
      Set<Integer> maskedFrames = entry.getValue();
      double sum = 0.;
      int count = 0;
      for (int k = 0; k < frames; ++k) {
        if (!maskedFrames.contains(k)) {
          sum += dataset.getFrame(k).getY()[pixel];
          ++count;
        }
      }
      if (count == 0) {
        logger.warn("no data left for pixel " + (pixel + 1) + ", skipping");
        continue;
      }
      double mean = sum / count;
      for (int k : maskedFrames) {
        dataset.getFrame(k).getY()[pixel] = mean;
      }
    }
  }
}
