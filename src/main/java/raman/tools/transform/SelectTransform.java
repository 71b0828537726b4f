package raman.tools.transform;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import raman.tools.ConfigParseException;
import raman.tools.EmptySelectionException;
import raman.tools.FrameOutOfRangeException;
import raman.tools.ShapeMismatchException;
import raman.tools.input.Dataset;

/**
 * Keeps only the listed frames, or with invert set, drops them and keeps the rest.
 */
@Command(name = "select", description = "Keep (or discard) frames.")
public class SelectTransform implements Transformer {

  public static final String FRAMES = "frames";
  public static final String INVERT = "invert";

  @Parameters(arity = "1..*", description = "Numbers of frames to keep (counts starts at 1).")
  private List<Integer> frames;

  @Option(names = {"-i", "--invert"},
      description = "Discard selected frames and leave the non-selected.")
  private boolean invert;

  public SelectTransform() {
    this(new ArrayList<>(), false);
  }

  public SelectTransform(List<Integer> frames, boolean invert) {
    this.frames = new ArrayList<>(frames);
    this.invert = invert;
  }

  static SelectTransform fromConfig(TransformerConfig config) throws ConfigParseException {
    return new SelectTransform(config.getIntList(FRAMES), config.getBoolean(INVERT, false));
  }

  public List<Integer> getFrames() {
    return frames;
  }

  public boolean isInvert() {
    return invert;
  }

  @Override
  public TransformerFactory getKind() {
    return TransformerFactory.SELECT;
  }

  @Override
  public Map<String, Object> getConfig() {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put(FRAMES, new ArrayList<>(frames));
    config.put(INVERT, invert);
    return config;
  }

  @Override
  public void transform(Dataset dataset)
      throws FrameOutOfRangeException, EmptySelectionException, ShapeMismatchException {
    dataset.setColumns(dataset.selectFrames(frames, invert));
  }
}
