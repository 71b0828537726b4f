package raman.tools.transform;

import java.util.LinkedHashMap;
import java.util.Map;
import raman.tools.ProcessingException;
import raman.tools.input.Dataset;
import raman.tools.utils.ProvenanceUtils;

/**
 * A single processing step of a {@link Pipeline}. Each implementation owns its parameters, changes
 * a dataset's matrix in {@link #transform(Dataset)} and describes itself through
 * {@link #getConfig()}, so that the step can be recorded in the dataset's provenance log and
 * rebuilt from it later through {@link TransformerFactory#fromConfig(TransformerConfig)}.
 */
public interface Transformer {

  /**
   * Key of the provenance entry naming the kind of transformer.
   */
  String TRANSFORMATION_KEY = "transformation";

  /**
   * Change the dataset's matrix. Does not touch the provenance log.
   *
   * @param dataset dataset to modify in place
   * @throws ProcessingException if the data or the parameters do not allow the transformation;
   * the dataset may be partially modified
   */
  void transform(Dataset dataset) throws ProcessingException;

  /**
   * @return the kind of this transformer
   */
  TransformerFactory getKind();

  /**
   * Parameters of this transformer under their provenance keys, in a fixed order. Pairs are
   * written as {a, b} mappings, unset optional values as null.
   *
   * @return ordered key/value pairs
   */
  Map<String, Object> getConfig();

  /**
   * @return provenance segment: the transformation tag followed by the configuration, as YAML
   */
  default String configToString() {
    Map<String, Object> entry = new LinkedHashMap<>();
    entry.put(TRANSFORMATION_KEY, getKind().getTag());
    entry.putAll(getConfig());
    return ProvenanceUtils.toYaml(entry);
  }

  /**
   * Record this transformer in the dataset's provenance log.
   *
   * @param dataset dataset this transformer was applied to
   */
  default void writeMetadata(Dataset dataset) {
    dataset.appendMetadata(configToString());
  }

  /**
   * Transform the dataset, then record the transformation in its provenance log.
   *
   * @param dataset dataset to modify in place
   * @throws ProcessingException if the transformation fails; nothing is recorded in that case
   */
  default void apply(Dataset dataset) throws ProcessingException {
    transform(dataset);
    writeMetadata(dataset);
  }
}
