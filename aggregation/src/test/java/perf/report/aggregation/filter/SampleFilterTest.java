package perf.report.aggregation.filter;

import org.junit.Assert;
import org.junit.Test;
import perf.report.common.exception.ConfigurationException;
import perf.report.common.sample.Sample;
import perf.report.common.symbol.SymbolTable;

import java.util.Arrays;
import java.util.Collections;

import static perf.report.aggregation.SampleFixtures.MAIN;
import static perf.report.aggregation.SampleFixtures.onCpu;
import static perf.report.aggregation.SampleFixtures.symbols;

public class SampleFilterTest {
  private final SymbolTable symbols = symbols();
  private final Sample appWorker = onCpu(100, 101, 1000, 1, MAIN);
  private final Sample appAsyncTask = onCpu(100, 102, 2000, 1, MAIN);
  private final Sample serverWorker = onCpu(200, 201, 3000, 1, MAIN);

  @Test
  public void testAcceptAllAdmitsEverything() {
    Assert.assertTrue(SampleFilter.ACCEPT_ALL.admit(appWorker, symbols));
    Assert.assertTrue(SampleFilter.ACCEPT_ALL.admit(serverWorker, symbols));
    Assert.assertFalse(SampleFilter.ACCEPT_ALL.hasTimeWindow());
  }

  @Test
  public void testExcludeTakesPrecedenceOverInclude() {
    SampleFilter filter = SampleFilter.newBuilder()
        .includePids(Collections.singletonList(100))
        .excludeTids(Collections.singletonList(101))
        .build();
    Assert.assertFalse(filter.admit(appWorker, symbols));
    Assert.assertTrue(filter.admit(appAsyncTask, symbols));
    Assert.assertFalse(filter.admit(serverWorker, symbols));
  }

  @Test
  public void testNameExcludeRejectsBeforeIdInclude() {
    SampleFilter filter = SampleFilter.newBuilder()
        .includeTids(Arrays.asList(101, 201))
        .excludeProcessName("system")
        .build();
    Assert.assertTrue(filter.admit(appWorker, symbols));
    Assert.assertFalse(filter.admit(serverWorker, symbols));
  }

  @Test
  public void testIncludeKindsMustAllMatch() {
    SampleFilter filter = SampleFilter.newBuilder()
        .includeProcessName("example")
        .includeThreadName("^Worker$")
        .includeThreadName("AsyncTask")
        .build();
    Assert.assertTrue(filter.admit(appWorker, symbols));
    Assert.assertTrue(filter.admit(appAsyncTask, symbols));
    // thread name matches but process name does not
    Assert.assertFalse(filter.admit(serverWorker, symbols));
  }

  @Test
  public void testNamePatternsMatchAnywhereInName() {
    SampleFilter filter = SampleFilter.newBuilder().includeThreadName("sync").build();
    Assert.assertTrue(filter.admit(appAsyncTask, symbols));
    Assert.assertFalse(filter.admit(appWorker, symbols));
  }

  @Test
  public void testProcessNameFallsBackToMainThreadName() {
    SymbolTable noProcessTable = new SymbolTable()
        .addThread(300, 300, "surfaceflinger")
        .addThread(301, 300, "binder:300_1");
    SampleFilter filter = SampleFilter.newBuilder().includeProcessName("surface").build();
    Assert.assertTrue(filter.admit(onCpu(300, 301, 0, 1, MAIN), noProcessTable));
    Assert.assertFalse(filter.admit(onCpu(400, 401, 0, 1, MAIN), noProcessTable));
  }

  @Test
  public void testTimeWindowIsInclusive() {
    SampleFilter filter = SampleFilter.newBuilder().globalBegin(1000).globalEnd(2000).build();
    Assert.assertTrue(filter.hasTimeWindow());
    Assert.assertTrue(filter.admit(appWorker, symbols));
    Assert.assertTrue(filter.admit(appAsyncTask, symbols));
    Assert.assertFalse(filter.admit(serverWorker, symbols));
    Assert.assertFalse(filter.admit(onCpu(100, 101, 999, 1, MAIN), symbols));
  }

  @Test
  public void testTimeWindowAppliesAfterIncludes() {
    SampleFilter filter = SampleFilter.newBuilder()
        .includePids(Collections.singletonList(200))
        .globalEnd(2500)
        .build();
    Assert.assertFalse(filter.admit(appWorker, symbols));
    Assert.assertFalse(filter.admit(serverWorker, symbols));
    Assert.assertTrue(filter.admit(onCpu(200, 201, 2500, 1, MAIN), symbols));
  }

  @Test(expected = ConfigurationException.class)
  public void testInvalidRegexIsRejected() {
    SampleFilter.newBuilder().excludeThreadName("Worker[");
  }

  @Test(expected = ConfigurationException.class)
  public void testBeginAfterEndIsRejected() {
    SampleFilter.newBuilder().globalBegin(10).globalEnd(5).build();
  }

  @Test(expected = ConfigurationException.class)
  public void testDuplicateBeginIsRejected() {
    SampleFilter.newBuilder().globalBegin(10).globalBegin(20);
  }
}
