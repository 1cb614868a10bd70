package perf.report.metrics;

import org.junit.Assert;
import org.junit.Test;

public class MetricsTest {
  @Test
  public void testLoadOfMetricNameClassToEnsureNonDuplicatesOfMetricNames() {
    // Loading the enum runs its static block, which throws on duplicate metric names
    MetricName[] values = MetricName.values();
    Assert.assertTrue(values.length > 0);
  }

  @Test
  public void testEventTagEncodingWithCommonNonSpecialChars() {
    String actual = new EventTag("cpu-clock:u").toString();
    String expected = "ev.cpu.2Dclock.3Au";
    Assert.assertEquals(expected, actual);
  }

  @Test
  public void testLibraryTagUsesBaseNameOfLibraryPath() {
    Assert.assertEquals("lib.libc.2Eso", new LibraryTag("/system/lib64/libc.so").toString());
    Assert.assertEquals("lib.app.20process", new LibraryTag("app process").toString());
  }

  @Test
  public void testMultipleTagsAreJoinedWithUnderscore() {
    Assert.assertEquals("a_b.2Ec", Util.encodeTags("a", "b.c"));
  }
}
