package raman.tools.input;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import raman.tools.ShapeMismatchException;

public class DelimitedTextReaderTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void parse_readsBodyAndComments() throws Exception {
    DelimitedTextReader reader = new DelimitedTextReader("#", ",");
    Dataset dataset = reader.parse("# measured today\n1,2,3,4\n\n5, 6,7,8\n", null);
    assertEquals(2, dataset.getRowCount());
    assertEquals(2, dataset.getFrameCount());
    assertEquals(6., dataset.getFrame(0).getY()[1], 0.);
    assertEquals("comments from input:\n# measured today\n", dataset.getPreviousComments());
  }

  @Test
  public void parse_otherDelimiter() throws Exception {
    DelimitedTextReader reader = new DelimitedTextReader("%", "\t");
    Dataset dataset = reader.parse("% header\n1\t2\n", null);
    assertEquals(1, dataset.getRowCount());
    assertEquals(2., dataset.getFrame(0).getY()[0], 0.);
  }

  @Test(expected = IOException.class)
  public void parse_rejectsNonNumbers() throws Exception {
    new DelimitedTextReader("#", ",").parse("1,abc\n", null);
  }

  @Test(expected = ShapeMismatchException.class)
  public void parse_rejectsOddColumnCount() throws Exception {
    new DelimitedTextReader("#", ",").parse("1,2,3\n", null);
  }

  @Test
  public void read_fileNamesSourceInComments() throws Exception {
    File file = folder.newFile("frames.csv");
    Files.write(file.toPath(), "# note\n1,2\n3,4\n".getBytes(StandardCharsets.UTF_8));
    Dataset dataset = new DelimitedTextReader("#", ",").read(file.toPath());
    assertEquals(2, dataset.getRowCount());
    assertTrue(dataset.getPreviousComments().startsWith(
        "comments from input file " + file.getAbsolutePath()));
  }

  @Test
  public void readWithTimeout_readsCompleteStream() throws Exception {
    ByteArrayInputStream stream =
        new ByteArrayInputStream("1,2\n".getBytes(StandardCharsets.UTF_8));
    assertEquals("1,2\n", DelimitedTextReader.readWithTimeout(stream, 5000));
  }

  @Test
  public void readWithTimeout_silentStreamGivesEmptyInput() throws Exception {
    PipedOutputStream source = new PipedOutputStream();
    PipedInputStream stream = new PipedInputStream(source);
    assertEquals("", DelimitedTextReader.readWithTimeout(stream, 50));
    Dataset dataset = new DelimitedTextReader("#", ",").read(stream, 50);
    assertEquals(0, dataset.getFrameCount());
    source.close();
  }
}
