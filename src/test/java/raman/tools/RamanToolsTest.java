package raman.tools;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import picocli.CommandLine.ParameterException;
import raman.tools.transform.OffsetTransform;
import raman.tools.transform.SelectTransform;
import raman.tools.transform.Transformer;

public class RamanToolsTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private File writeInput() throws Exception {
    File input = folder.newFile("scan.csv");
    String text = "# two frames\n1,10,1,20\n2,11,2,21\n3,12,3,22\n";
    Files.write(input.toPath(), text.getBytes(StandardCharsets.UTF_8));
    return input;
  }

  private static String read(File file) throws Exception {
    return new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
  }

  private static List<String> dataLines(String text) {
    List<String> lines = new ArrayList<>();
    for (String line : text.split("\n")) {
      if (!line.startsWith("#")) {
        lines.add(line);
      }
    }
    return lines;
  }

  @Test
  public void splitArgumentsAtCommandNames() {
    List<List<String>> groups = RamanTools.splitArguments(new String[]{
        "scan.csv", "-o", "out.csv", "offset", "2", "-t", "1", "select", "1", "default"});
    assertEquals(4, groups.size());
    assertEquals(Arrays.asList("scan.csv", "-o", "out.csv"), groups.get(0));
    assertEquals(Arrays.asList("offset", "2", "-t", "1"), groups.get(1));
    assertEquals(Arrays.asList("select", "1"), groups.get(2));
    assertEquals(Arrays.asList("default"), groups.get(3));
  }

  @Test
  public void noCommandsGiveSingleGroup() {
    List<List<String>> groups = RamanTools.splitArguments(new String[0]);
    assertEquals(1, groups.size());
    assertTrue(groups.get(0).isEmpty());
  }

  @Test
  public void parseTransformersInCommandLineOrder() {
    List<List<String>> groups = RamanTools.splitArguments(new String[]{
        "offset", "-p", "0.1", "select", "2", "-i", "default"});
    List<Transformer> transformers =
        RamanTools.parseTransformers(groups.subList(1, groups.size()));
    assertEquals(8, transformers.size());
    OffsetTransform offset = (OffsetTransform) transformers.get(0);
    assertEquals(0.1, offset.getOffset(), 0.);
    assertTrue(offset.isPercentile());
    SelectTransform select = (SelectTransform) transformers.get(1);
    assertTrue(select.isInvert());
    assertEquals(Arrays.asList(2), select.getFrames());
  }

  @Test(expected = ParameterException.class)
  public void missingCommandArgumentIsRejected() {
    List<List<String>> groups = RamanTools.splitArguments(new String[]{"offset"});
    RamanTools.parseTransformers(groups.subList(1, groups.size()));
  }

  @Test
  public void transformsFileAndWritesProvenance() throws Exception {
    File input = writeInput();
    File output = new File(folder.getRoot(), "out.csv");
    int code = RamanTools.run(new String[]{
        input.getAbsolutePath(), "-o", output.getAbsolutePath(),
        "offset", "1", "-t", "2", "select", "2"});
    assertEquals(0, code);
    String text = read(output);
    assertTrue(text.contains("# preprocessor: arguments\n"));
    assertTrue(text.contains("# transformation: OffsetTransform\n"));
    assertTrue(text.contains("# transformation: SelectTransform\n"));
    assertTrue(text.contains("# # two frames\n"));
    assertEquals(Arrays.asList("1.0,21.0", "2.0,22.0", "3.0,23.0"), dataLines(text));
  }

  @Test
  public void replaysPipelineFromWrittenFile() throws Exception {
    File input = writeInput();
    File first = new File(folder.getRoot(), "first.csv");
    File second = new File(folder.getRoot(), "second.csv");
    assertEquals(0, RamanTools.run(new String[]{
        input.getAbsolutePath(), "-o", first.getAbsolutePath(), "average", "offset", "5"}));
    assertEquals(0, RamanTools.run(new String[]{
        "--pipeline-from", first.getAbsolutePath(), "-o", second.getAbsolutePath()}));
    assertEquals(dataLines(read(first)), dataLines(read(second)));
    assertEquals(Arrays.asList("1.0,20.0", "2.0,21.0", "3.0,22.0"), dataLines(read(second)));
  }

  @Test
  public void failingStepWritesNothing() throws Exception {
    File input = writeInput();
    File output = new File(folder.getRoot(), "out.csv");
    int code = RamanTools.run(new String[]{
        input.getAbsolutePath(), "-o", output.getAbsolutePath(), "finning", "2.5"});
    assertEquals(1, code);
    assertFalse(output.exists());
  }

  @Test
  public void badCommandArgumentsGiveErrorCode() throws Exception {
    File input = writeInput();
    assertEquals(1, RamanTools.run(new String[]{input.getAbsolutePath(), "reshape", "x"}));
  }
}
