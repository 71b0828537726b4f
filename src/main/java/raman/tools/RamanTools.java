package raman.tools;

import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import org.apache.log4j.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.IVersionProvider;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import raman.tools.input.Configuration;
import raman.tools.input.Dataset;
import raman.tools.input.DelimitedTextReader;
import raman.tools.input.InputArguments;
import raman.tools.output.DatasetPlotter;
import raman.tools.output.DatasetWriter;
import raman.tools.transform.Pipeline;
import raman.tools.transform.Transformer;
import raman.tools.transform.TransformerFactory;

/**
 * Command line launcher. Reads a dataset from a file or standard input, applies the transformers
 * named on the command line in the order given and writes the result, with its provenance log, to
 * standard output or a file.
 *
 * <pre>
 *   raman-tools [FILE] [OPTIONS] COMMAND [ARGS] COMMAND [ARGS] ...
 * </pre>
 * Every argument naming a transformer command starts a new group; the arguments up to the next
 * command name belong to that transformer. Nothing is written if any step fails.
 */
@Command(name = "raman-tools", mixinStandardHelpOptions = true,
    versionProvider = RamanTools.VersionProvider.class,
    description = "Preprocess spectroscopic datasets of (x, y) column pairs.",
    footer = {"", "Commands: align, append, average, baseline, calibration, count-conversion,",
        "  default, despike, finning, integrate, mask, normalize, offset, reshape, select,",
        "  shift, subtract. Use COMMAND --help for the arguments of a command."})
public class RamanTools implements Callable<Integer> {

  private static final Logger logger = Logger.getLogger(RamanTools.class);

  public static final String DEFAULT_COMMAND = "default";

  @Parameters(index = "0", arity = "0..1",
      description = "Input file; data is read from standard input if omitted.")
  private String filepath;

  @Option(names = {"-c", "--comment"}, description = "The character starting a comment.")
  private String comment;

  @Option(names = {"-d", "--delimiter"}, description = "The delimiting character.")
  private String delimiter;

  @Option(names = {"-o", "--output"}, description = "Output file; standard output if omitted.")
  private File output;

  @Option(names = {"--pipeline-from"},
      description = "Replay the transformations recorded in a previously written file.")
  private File pipelineFrom;

  @Option(names = {"--plot"}, description = "Also export the result as PNG chart.")
  private File plot;

  @Option(names = {"--config"}, description = "Configuration XML file.")
  private String configPath;

  private List<List<String>> transformerArgs = new ArrayList<>();

  static class VersionProvider implements IVersionProvider {
    @Override
    public String[] getVersion() {
      return new String[]{"Raman CLI Tools version " + DatasetWriter.getVersion()};
    }
  }

  public static void main(String[] args) {
    System.exit(run(args));
  }

  /**
   * Run the launcher without exiting the JVM.
   *
   * @param args command line arguments
   * @return exit code, 0 on success
   */
  public static int run(String[] args) {
    List<List<String>> groups = splitArguments(args);
    RamanTools launcher = new RamanTools();
    launcher.transformerArgs = groups.subList(1, groups.size());
    return new CommandLine(launcher).execute(groups.get(0).toArray(new String[0]));
  }

  /**
   * Split the command line into groups at every transformer command name. The first group holds
   * the launcher's own arguments and may be empty.
   *
   * @param args command line arguments
   * @return argument groups in command line order
   */
  static List<List<String>> splitArguments(String[] args) {
    List<List<String>> groups = new ArrayList<>();
    List<String> current = new ArrayList<>();
    groups.add(current);
    for (String arg : args) {
      if (isCommandName(arg)) {
        current = new ArrayList<>();
        groups.add(current);
      }
      current.add(arg);
    }
    return groups;
  }

  private static boolean isCommandName(String arg) {
    return DEFAULT_COMMAND.equals(arg) || TransformerFactory.fromCommandName(arg) != null;
  }

  /**
   * Build the transformers of the command groups.
   *
   * @param groups argument groups, each starting with a command name
   * @return transformers in command line order
   * @throws ParameterException if the arguments of a command do not parse
   */
  static List<Transformer> parseTransformers(List<List<String>> groups) {
    List<Transformer> transformers = new ArrayList<>();
    for (List<String> group : groups) {
      String name = group.get(0);
      if (DEFAULT_COMMAND.equals(name)) {
        transformers.addAll(TransformerFactory.defaultTransformers());
        continue;
      }
      Transformer transformer = TransformerFactory.fromCommandName(name).createTransformer();
      List<String> rest = group.subList(1, group.size());
      new CommandLine(transformer).parseArgs(rest.toArray(new String[0]));
      transformers.add(transformer);
    }
    return transformers;
  }

  @Override
  public Integer call() {
    if (configPath != null) {
      Configuration.reload(configPath);
    }
    Configuration config = Configuration.getInstance();

    for (List<String> group : transformerArgs) {
      if (group.contains("-h") || group.contains("--help")) {
        String name = group.get(0);
        if (DEFAULT_COMMAND.equals(name)) {
          System.out.println(new Pipeline(TransformerFactory.defaultTransformers())
              .toProvenance());
        } else {
          CommandLine.usage(TransformerFactory.fromCommandName(name).createTransformer(),
              System.out);
        }
        return 0;
      }
    }

    try {
      Pipeline pipeline = new Pipeline();
      if (pipelineFrom != null) {
        String log = new String(Files.readAllBytes(pipelineFrom.toPath()), StandardCharsets.UTF_8);
        pipeline.addAll(Pipeline.fromProvenance(log).getTransformers());
        if (filepath == null) {
          InputArguments recorded = InputArguments.fromProvenance(log);
          filepath = recorded.getFilepath();
          comment = comment == null ? recorded.getComment() : comment;
          delimiter = delimiter == null ? recorded.getDelimiter() : delimiter;
        }
        logger.info("Replaying " + pipeline.size() + " transformations from " + pipelineFrom);
      }
      pipeline.addAll(parseTransformers(transformerArgs));

      String commentChar = comment == null ? config.getInputCommentChar() : comment;
      String fieldDelimiter = delimiter == null ? config.getInputDelimiter() : delimiter;
      Dataset dataset = new DelimitedTextReader(commentChar, fieldDelimiter)
          .readPathOrStandardInput(filepath == null ? null : Paths.get(filepath));
      new InputArguments(filepath, commentChar, fieldDelimiter).writeMetadata(dataset);

      pipeline.apply(dataset);

      DatasetWriter writer = new DatasetWriter();
      if (output == null) {
        Writer out = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
        writer.write(dataset, out);
      } else {
        try (Writer out = Files.newBufferedWriter(output.toPath(), StandardCharsets.UTF_8)) {
          writer.write(dataset, out);
        }
      }
      if (plot != null) {
        String title = filepath == null ? "standard input" : new File(filepath).getName();
        new DatasetPlotter().savePng(dataset, title, plot);
      }
      return 0;
    } catch (ParameterException e) {
      logger.error(e.getMessage());
      e.getCommandLine().usage(System.err);
      return 1;
    } catch (PipelineException e) {
      // already logged by the pipeline
      return 1;
    } catch (ProcessingException | IOException e) {
      logger.error(e.getMessage());
      return 1;
    }
  }
}
