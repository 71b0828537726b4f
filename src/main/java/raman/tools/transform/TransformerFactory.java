package raman.tools.transform;

import java.util.ArrayList;
import java.util.List;
import raman.tools.ConfigParseException;

/**
 * Enumerated type defining each kind of transformer, so that the command line and the provenance
 * parser share one list of everything that can be applied to a dataset.
 *
 * Every constant knows its provenance tag (the name written after "transformation:"), the command
 * name used on the command line, how to create a transformer with default parameters (to be
 * filled in by the command line parser) and how to rebuild one from a provenance entry.
 * If adding a new transformer, it has to be registered here to be reachable from either.
 */
public enum TransformerFactory {

  ALIGN("AlignTransform", "align") {
    @Override
    public Transformer createTransformer() {
      return new AlignTransform();
    }

    @Override
    public Transformer fromConfig(TransformerConfig config) throws ConfigParseException {
      return AlignTransform.fromConfig(config);
    }
  },
  APPEND("AppendTransform", "append") {
    @Override
    public Transformer createTransformer() {
      return new AppendTransform();
    }

    @Override
    public Transformer fromConfig(TransformerConfig config) throws ConfigParseException {
      return AppendTransform.fromConfig(config);
    }
  },
  AVERAGE("AverageTransform", "average") {
    @Override
    public Transformer createTransformer() {
      return new AverageTransform();
    }

    @Override
    public Transformer fromConfig(TransformerConfig config) {
      return new AverageTransform();
    }
  },
  BASELINE("BaselineTransform", "baseline") {
    @Override
    public Transformer createTransformer() {
      return new BaselineTransform();
    }

    @Override
    public Transformer fromConfig(TransformerConfig config) throws ConfigParseException {
      return BaselineTransform.fromConfig(config);
    }
  },
  CALIBRATION("CalibrationTransform", "calibration") {
    @Override
    public Transformer createTransformer() {
      return new CalibrationTransform();
    }

    @Override
    public Transformer fromConfig(TransformerConfig config) throws ConfigParseException {
      return CalibrationTransform.fromConfig(config);
    }
  },
  COUNT_CONVERSION("CountConversionTransform", "count-conversion") {
    @Override
    public Transformer createTransformer() {
      return new CountConversionTransform();
    }

    @Override
    public Transformer fromConfig(TransformerConfig config) throws ConfigParseException {
      return CountConversionTransform.fromConfig(config);
    }
  },
  DESPIKE("DespikeTransform", "despike") {
    @Override
    public Transformer createTransformer() {
      return new DespikeTransform();
    }

    @Override
    public Transformer fromConfig(TransformerConfig config) throws ConfigParseException {
      return DespikeTransform.fromConfig(config);
    }
  },
  FINNING("FinningTransform", "finning") {
    @Override
    public Transformer createTransformer() {
      return new FinningTransform();
    }

    @Override
    public Transformer fromConfig(TransformerConfig config) throws ConfigParseException {
      return FinningTransform.fromConfig(config);
    }
  },
  INTEGRATE("IntegrateTransform", "integrate") {
    @Override
    public Transformer createTransformer() {
      return new IntegrateTransform();
    }

    @Override
    public Transformer fromConfig(TransformerConfig config) throws ConfigParseException {
      return IntegrateTransform.fromConfig(config);
    }
  },
  MASK("MaskTransform", "mask") {
    @Override
    public Transformer createTransformer() {
      return new MaskTransform();
    }

    @Override
    public Transformer fromConfig(TransformerConfig config) throws ConfigParseException {
      return MaskTransform.fromConfig(config);
    }
  },
  NORMALIZE("NormalizeTransform", "normalize") {
    @Override
    public Transformer createTransformer() {
      return new NormalizeTransform();
    }

    @Override
    public Transformer fromConfig(TransformerConfig config) throws ConfigParseException {
      return NormalizeTransform.fromConfig(config);
    }
  },
  OFFSET("OffsetTransform", "offset") {
    @Override
    public Transformer createTransformer() {
      return new OffsetTransform();
    }

    @Override
    public Transformer fromConfig(TransformerConfig config) throws ConfigParseException {
      return OffsetTransform.fromConfig(config);
    }
  },
  RESHAPE("ReshapeTransform", "reshape") {
    @Override
    public Transformer createTransformer() {
      return new ReshapeTransform();
    }

    @Override
    public Transformer fromConfig(TransformerConfig config) throws ConfigParseException {
      return ReshapeTransform.fromConfig(config);
    }
  },
  SELECT("SelectTransform", "select") {
    @Override
    public Transformer createTransformer() {
      return new SelectTransform();
    }

    @Override
    public Transformer fromConfig(TransformerConfig config) throws ConfigParseException {
      return SelectTransform.fromConfig(config);
    }
  },
  SHIFT("RamanShiftTransform", "shift") {
    @Override
    public Transformer createTransformer() {
      return new RamanShiftTransform();
    }

    @Override
    public Transformer fromConfig(TransformerConfig config) throws ConfigParseException {
      return RamanShiftTransform.fromConfig(config);
    }
  },
  SUBTRACT("SubtractTransform", "subtract") {
    @Override
    public Transformer createTransformer() {
      return new SubtractTransform();
    }

    @Override
    public Transformer fromConfig(TransformerConfig config) throws ConfigParseException {
      return SubtractTransform.fromConfig(config);
    }
  };

  private final String tag;
  private final String commandName;

  TransformerFactory(String tag, String commandName) {
    this.tag = tag;
    this.commandName = commandName;
  }

  /**
   * @return new transformer with default parameters
   */
  public abstract Transformer createTransformer();

  /**
   * Rebuild a transformer of this kind from its provenance entry.
   *
   * @param config parsed provenance entry
   * @return transformer with the recorded parameters
   * @throws ConfigParseException if a required parameter is missing or has the wrong type
   */
  public abstract Transformer fromConfig(TransformerConfig config) throws ConfigParseException;

  /**
   * @return name written after "transformation:" in provenance logs
   */
  public String getTag() {
    return tag;
  }

  /**
   * @return name of the command selecting this transformer on the command line
   */
  public String getCommandName() {
    return commandName;
  }

  /**
   * @param tag provenance tag, e.g. "OffsetTransform"
   * @return matching kind, or null if the tag is unknown
   */
  public static TransformerFactory fromTag(String tag) {
    for (TransformerFactory kind : values()) {
      if (kind.tag.equals(tag)) {
        return kind;
      }
    }
    return null;
  }

  /**
   * @param commandName command line name, e.g. "count-conversion"
   * @return matching kind, or null if the name is unknown
   */
  public static TransformerFactory fromCommandName(String commandName) {
    for (TransformerFactory kind : values()) {
      if (kind.commandName.equals(commandName)) {
        return kind;
      }
    }
    return null;
  }

  /**
   * The standard preprocessing of raw detector data: reshape to the detector's 1340 pixels, remove
   * cosmic rays across frames, average, remove the dark offset, convert to Raman shift for a
   * 532.1 nm laser and convert counts to photoelectrons per second for 300 s exposures.
   *
   * @return new transformer instances, in application order
   */
  public static List<Transformer> defaultTransformers() {
    List<Transformer> transformers = new ArrayList<>();
    transformers.add(new ReshapeTransform(1340));
    transformers.add(new FinningTransform(2.5, 4));
    transformers.add(new AverageTransform());
    transformers.add(new OffsetTransform(0.05, true, null));
    transformers.add(new RamanShiftTransform(532.1, RamanShiftTransform.DEFAULT_REFRACTIVE_INDEX,
        0.0));
    transformers.add(new CountConversionTransform(300.,
        CountConversionTransform.DEFAULT_CONVERSION_FACTOR));
    return transformers;
  }
}
