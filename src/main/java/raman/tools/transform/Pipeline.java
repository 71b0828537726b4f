package raman.tools.transform;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.log4j.Logger;
import raman.tools.ConfigParseException;
import raman.tools.PipelineException;
import raman.tools.ProcessingException;
import raman.tools.input.Dataset;
import raman.tools.utils.ProvenanceUtils;

/**
 * Ordered sequence of transformers applied to one dataset. Each step transforms the data and then
 * appends its configuration to the dataset's provenance log; the first failing step stops the run.
 *
 * A pipeline can be rebuilt from the provenance log of a dataset it produced, reproducing the
 * same transformers with the same parameters in the same order.
 */
public class Pipeline {

  private static final Logger logger = Logger.getLogger(Pipeline.class);

  private static final Pattern TRANSFORMATION_ENTRY =
      Pattern.compile("(?m)^" + Transformer.TRANSFORMATION_KEY + ":");

  private static final Pattern TRANSFORMATION_TAG =
      Pattern.compile("(?m)^" + Transformer.TRANSFORMATION_KEY + ": ([a-zA-Z]*)$");

  private final List<Transformer> transformers;

  public Pipeline() {
    transformers = new ArrayList<>();
  }

  public Pipeline(List<Transformer> transformers) {
    this.transformers = new ArrayList<>(transformers);
  }

  /**
   * Rebuild a pipeline from a provenance log. Segments without a transformation entry (such as
   * the input arguments) are ignored.
   *
   * @param log provenance log, with or without the comment prefixes of a written file
   * @return pipeline of the logged transformers, in log order
   * @throws ConfigParseException if a segment has a malformed or unknown transformation tag or its
   * parameters cannot be read
   */
  public static Pipeline fromProvenance(String log) throws ConfigParseException {
    List<Transformer> parsed = new ArrayList<>();
    String plain = ProvenanceUtils.stripCommentPrefix(log);
    for (String segment : ProvenanceUtils.splitSegments(plain)) {
      if (!TRANSFORMATION_ENTRY.matcher(segment).find()) {
        continue;
      }
      Matcher matcher = TRANSFORMATION_TAG.matcher(segment);
      if (!matcher.find()) {
        throw new ConfigParseException("No transformer declared in:\n" + segment);
      }
      String tag = matcher.group(1);
      TransformerFactory kind = TransformerFactory.fromTag(tag);
      if (kind == null) {
        throw new ConfigParseException("Input string matches no known transformer:\n" + segment);
      }
      Map<String, Object> values = ProvenanceUtils.fromYaml(segment);
      parsed.add(kind.fromConfig(new TransformerConfig(values, segment)));
    }
    return new Pipeline(parsed);
  }

  /**
   * @param transformer step to run after the current last one
   */
  public void add(Transformer transformer) {
    transformers.add(transformer);
  }

  /**
   * @param more steps to run after the current last one, in order
   */
  public void addAll(List<Transformer> more) {
    transformers.addAll(more);
  }

  /**
   * @return the steps of this pipeline, in order
   */
  public List<Transformer> getTransformers() {
    return Collections.unmodifiableList(transformers);
  }

  public int size() {
    return transformers.size();
  }

  /**
   * Run every step on the dataset, in order.
   *
   * @param dataset dataset to transform in place; its provenance log grows by one segment per
   * successful step
   * @throws PipelineException if a step fails; the dataset keeps the state left by the steps
   * before it
   */
  public void apply(Dataset dataset) throws PipelineException {
    for (int i = 0; i < transformers.size(); ++i) {
      Transformer transformer = transformers.get(i);
      String tag = transformer.getKind().getTag();
      logger.debug("applying step " + (i + 1) + " of " + transformers.size() + ": " + tag);
      try {
        transformer.apply(dataset);
      } catch (ProcessingException e) {
        PipelineException failure = new PipelineException(i + 1, tag, e);
        logger.error(failure.getMessage());
        throw failure;
      }
    }
  }

  /**
   * @return provenance log this pipeline writes, without input arguments
   */
  public String toProvenance() {
    StringBuilder log = new StringBuilder();
    for (Transformer transformer : transformers) {
      log.append(transformer.configToString());
      log.append(ProvenanceUtils.DELIMITER).append('\n');
    }
    return log.toString();
  }
}
