package perf.report.aggregation.filter;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import perf.report.common.exception.ConfigurationException;
import perf.report.common.symbol.SymbolTable;

import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static perf.report.aggregation.SampleFixtures.MAIN;
import static perf.report.aggregation.SampleFixtures.onCpu;
import static perf.report.aggregation.SampleFixtures.symbols;

public class FilterFileParserTest {
  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  private final SymbolTable symbols = symbols();

  @Test
  public void testGlobalWindowIsApplied() throws IOException {
    SampleFilter.Builder builder = SampleFilter.newBuilder();
    FilterFileParser parser = new FilterFileParser();
    parser.parse(new StringReader("# window of interest\nCLOCK monotonic\n\nGLOBAL_BEGIN 1000\nGLOBAL_END\t2000\n"),
        "filter.txt", builder);
    SampleFilter filter = builder.build();

    Assert.assertEquals("monotonic", parser.getClock());
    Assert.assertTrue(filter.hasTimeWindow());
    Assert.assertFalse(filter.admit(onCpu(100, 101, 999, 1, MAIN), symbols));
    Assert.assertTrue(filter.admit(onCpu(100, 101, 1000, 1, MAIN), symbols));
    Assert.assertTrue(filter.admit(onCpu(100, 101, 2000, 1, MAIN), symbols));
    Assert.assertFalse(filter.admit(onCpu(100, 101, 2001, 1, MAIN), symbols));
  }

  @Test
  public void testFilterFileOnDisk() throws IOException {
    File file = tmp.newFile("filter.txt");
    Files.write(file.toPath(), "GLOBAL_BEGIN 5\n".getBytes(StandardCharsets.UTF_8));
    SampleFilter.Builder builder = SampleFilter.newBuilder();
    new FilterFileParser().parse(file.toPath(), builder);
    SampleFilter filter = builder.build();
    Assert.assertFalse(filter.admit(onCpu(100, 101, 4, 1, MAIN), symbols));
    Assert.assertTrue(filter.admit(onCpu(100, 101, Long.MAX_VALUE, 1, MAIN), symbols));
  }

  @Test
  public void testErrorsCarryLocation() throws IOException {
    assertRejected("GLOBAL_BEGIN 10\nGLOBAL_BEGIN 20\n", "filter.txt:2:");
    assertRejected("GLOBAL_BEGIN ten\n", "invalid timestamp ten");
    assertRejected("GLOBAL_BEGIN\n", "filter.txt:1:");
    assertRejected("GLOBAL_BEGIN 1 2\n", "filter.txt:1:");
    assertRejected("\nTHREAD_BEGIN 10\n", "unknown keyword THREAD_BEGIN");
    assertRejected("GLOBAL_BEGIN -1\n", "negative timestamp");
    assertRejected("CLOCK perf\nCLOCK monotonic\n", "CLOCK is already set");
  }

  @Test(expected = ConfigurationException.class)
  public void testBeginAfterEndFailsOnBuild() throws IOException {
    SampleFilter.Builder builder = SampleFilter.newBuilder();
    new FilterFileParser().parse(new StringReader("GLOBAL_BEGIN 20\nGLOBAL_END 10\n"), "filter.txt", builder);
    builder.build();
  }

  @Test(expected = ConfigurationException.class)
  public void testMissingFileIsConfigurationError() {
    new FilterFileParser().parse(tmp.getRoot().toPath().resolve("absent.txt"), SampleFilter.newBuilder());
  }

  private void assertRejected(String content, String expectedMessage) throws IOException {
    try {
      new FilterFileParser().parse(new StringReader(content), "filter.txt", SampleFilter.newBuilder());
      Assert.fail("expected rejection of: " + content);
    } catch (ConfigurationException e) {
      assertThat(e.getMessage(), containsString(expectedMessage));
    }
  }
}
