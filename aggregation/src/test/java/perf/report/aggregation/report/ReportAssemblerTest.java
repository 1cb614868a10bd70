package perf.report.aggregation.report;

import org.junit.Assert;
import org.junit.Test;
import perf.report.aggregation.AggregatedSamples;
import perf.report.aggregation.SampleAggregator;
import perf.report.aggregation.annotate.AddressResolver;
import perf.report.aggregation.annotate.AnnotationMerger;
import perf.report.aggregation.annotate.DeobfuscationMap;
import perf.report.aggregation.annotate.SourceLine;
import perf.report.aggregation.callgraph.CallGraphBuilder;
import perf.report.aggregation.callgraph.CallTreeTraverser;
import perf.report.aggregation.callgraph.InterpreterFrameFilter;
import perf.report.aggregation.event.EventStreamMerger;
import perf.report.aggregation.thread.ThreadGrouping;
import perf.report.common.sample.Sample;
import perf.report.common.symbol.SymbolTable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.CoreMatchers.hasItems;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static perf.report.aggregation.SampleFixtures.APK;
import static perf.report.aggregation.SampleFixtures.LIBC_INIT;
import static perf.report.aggregation.SampleFixtures.MAIN;
import static perf.report.aggregation.SampleFixtures.MEMCPY;
import static perf.report.aggregation.SampleFixtures.OBFUSCATED;
import static perf.report.aggregation.SampleFixtures.START_THREAD;
import static perf.report.aggregation.SampleFixtures.WORKER_RUN;
import static perf.report.aggregation.SampleFixtures.assertSubtreeInvariant;
import static perf.report.aggregation.SampleFixtures.onCpu;
import static perf.report.aggregation.SampleFixtures.symbols;

public class ReportAssemblerTest {
  private final SymbolTable symbols = symbols();

  @Test
  public void testThreadsBelowThresholdAndEmptyProcessesAreDropped() {
    FinalizedReport report = assemble(Arrays.asList(
        onCpu(100, 101, 1, 995, LIBC_INIT, MAIN, WORKER_RUN),
        onCpu(200, 201, 2, 5, START_THREAD, MEMCPY)), 1);

    FinalizedEvent event = report.getEvents().get(0);
    Assert.assertEquals(1, event.getProcesses().size());
    Assert.assertEquals(100, event.getProcesses().get(0).getPid());
    Assert.assertEquals(995, event.getEventCount());
    Assert.assertFalse(report.getThreadNames().containsKey(201));
    Assert.assertFalse(report.getProcessNames().containsKey(200));
    Assert.assertEquals("com.example.app", report.getProcessNames().get(100));
    assertThat(report.getFunctionMap().keySet(), not(hasItems(MEMCPY)));
    assertThat(report.getFunctionMap().keySet(), hasItems(LIBC_INIT, MAIN, WORKER_RUN));
    assertReferentialIntegrity(report);
  }

  @Test
  public void testZeroPercentKeepsEverything() {
    FinalizedReport report = assemble(Arrays.asList(
        onCpu(100, 101, 1, 995, LIBC_INIT, MAIN, WORKER_RUN),
        onCpu(200, 201, 2, 5, START_THREAD, MEMCPY)), 0);
    Assert.assertEquals(2, report.getEvents().get(0).getProcesses().size());
    Assert.assertEquals(1000, report.getEvents().get(0).getEventCount());
    Assert.assertEquals("Worker", report.getThreadNames().get(201));
    assertReferentialIntegrity(report);
  }

  @Test
  public void testProcessesAndThreadsOrderedByEventCount() {
    FinalizedReport report = assemble(Arrays.asList(
        onCpu(100, 101, 1, 10, MAIN),
        onCpu(100, 102, 2, 20, MAIN),
        onCpu(100, 103, 3, 20, MAIN),
        onCpu(200, 201, 4, 60, MAIN)), 0);

    List<FinalizedProcess> processes = report.getEvents().get(0).getProcesses();
    Assert.assertEquals(200, processes.get(0).getPid());
    Assert.assertEquals(100, processes.get(1).getPid());
    Assert.assertEquals(50, processes.get(1).getEventCount());
    Assert.assertEquals(3, processes.get(1).getSampleCount());

    List<Integer> tids = new ArrayList<>();
    for (FinalizedThread thread : processes.get(1).getThreads()) {
      tids.add(thread.getTid());
    }
    Assert.assertEquals(Arrays.asList(102, 103, 101), tids);
  }

  @Test
  public void testTopLevelFunctionsSortedByName() {
    FinalizedReport report = assemble(Arrays.asList(
        onCpu(100, 101, 1, 1, MAIN, WORKER_RUN),
        onCpu(100, 101, 2, 1, START_THREAD, WORKER_RUN),
        onCpu(100, 101, 3, 1, LIBC_INIT, MAIN)), 0);

    FinalizedThread thread = report.getEvents().get(0).getProcesses().get(0).getThreads().get(0);
    List<String> topNames = new ArrayList<>();
    for (FinalizedCallNode node : thread.getCallGraph().children()) {
      topNames.add(report.getFunctionMap().get(node.getFunctionId()).getName());
    }
    Assert.assertEquals(Arrays.asList("__libc_init", "__start_thread", "com.example.app.Main.main"), topNames);
    Assert.assertEquals(CallGraphBuilder.ROOT_FUNCTION_ID, thread.getCallGraph().getFunctionId());
  }

  @Test
  public void testTopLevelOrderDoesNotDependOnSampleOrder() {
    List<Sample> samples = Arrays.asList(
        onCpu(100, 101, 1, 1, MAIN, WORKER_RUN),
        onCpu(100, 101, 2, 2, START_THREAD, WORKER_RUN),
        onCpu(100, 101, 3, 3, LIBC_INIT, MAIN));
    List<Sample> reversed = new ArrayList<>(samples);
    Collections.reverse(reversed);

    FinalizedReport report = assemble(samples, 0);
    FinalizedReport reversedReport = assemble(reversed, 0);
    Assert.assertEquals(report.getEvents().get(0).getProcesses().get(0).getThreads().get(0).getCallGraph().children(),
        reversedReport.getEvents().get(0).getProcesses().get(0).getThreads().get(0).getCallGraph().children());
  }

  @Test
  public void testCallGraphsKeepSubtreeInvariant() {
    FinalizedReport report = assemble(Arrays.asList(
        onCpu(100, 101, 1, 3, LIBC_INIT, MAIN, WORKER_RUN, MEMCPY),
        onCpu(100, 101, 2, 4, LIBC_INIT, MAIN, WORKER_RUN),
        onCpu(100, 101, 3, 5, LIBC_INIT, MAIN, MEMCPY)), 0);

    FinalizedThread thread = report.getEvents().get(0).getProcesses().get(0).getThreads().get(0);
    assertSubtreeInvariant(thread.getCallGraph());
    assertSubtreeInvariant(thread.getReverseCallGraph());
    Assert.assertEquals(thread.getEventCount(), thread.getCallGraph().getSubtreeEventCount());
    Assert.assertEquals(12, thread.getEventCount());
    Assert.assertEquals(2, thread.getReverseCallGraph().childCount());
  }

  @Test
  public void testFunctionStatisticsGroupedByLibrary() {
    FinalizedReport report = assemble(Arrays.asList(
        onCpu(100, 101, 1, 3, LIBC_INIT, MAIN, WORKER_RUN, MEMCPY),
        onCpu(100, 101, 2, 4, LIBC_INIT, MAIN, WORKER_RUN)), 0);

    FinalizedThread thread = report.getEvents().get(0).getProcesses().get(0).getThreads().get(0);
    Assert.assertEquals(2, thread.getLibs().size());
    FinalizedLibrary apk = thread.getLibs().get(1);
    Assert.assertEquals("/data/app/com.example.app/base.apk", report.getLibList().get(apk.getLibIndex()));
    FinalizedFunction workerRun = apk.getFunctions().get(1);
    Assert.assertEquals(WORKER_RUN, workerRun.getFunctionId());
    Assert.assertEquals(1, workerRun.getSampleCount());
    Assert.assertEquals(4, workerRun.getEventCount());
    Assert.assertEquals(7, workerRun.getSubtreeEventCount());
  }

  @Test
  public void testSourceLinesAndDeobfuscatedNames() {
    AddressResolver resolver = mock(AddressResolver.class);
    when(resolver.resolveSourceLine(anyInt(), anyLong())).thenReturn(Optional.empty());
    when(resolver.resolveSourceLine(APK, 0x1000L + OBFUSCATED * 0x100L))
        .thenReturn(Optional.of(new SourceLine("com/example/Worker.java", 42, "    doWork();")));
    DeobfuscationMap map = name -> "a.b.c".equals(name) ? Optional.of("com.example.Worker.doWork") : Optional.empty();

    AnnotationMerger merger = new AnnotationMerger(resolver, map, true, false, 100);
    FinalizedReport report = assemble(Arrays.asList(
        onCpu(100, 101, 1, 3, MAIN, OBFUSCATED),
        onCpu(100, 101, 2, 4, MAIN, OBFUSCATED, MEMCPY)), 0, merger);

    Assert.assertEquals("com.example.Worker.doWork", report.getFunctionMap().get(OBFUSCATED).getName());
    Assert.assertEquals(1, report.getSourceFiles().size());
    SourceFile file = report.getSourceFiles().get(0);
    Assert.assertEquals("com/example/Worker.java", file.getPath());
    Assert.assertEquals("    doWork();", file.getCode().get(42));

    FinalizedFunction obfuscated = findFunction(report, OBFUSCATED);
    Assert.assertEquals(Collections.singletonList(new SourceLineHit(0, 42, 3, 7)), obfuscated.getSourceLines());
    assertReferentialIntegrity(report);
  }

  @Test
  public void testEmptyAggregationGivesEmptyReport() {
    FinalizedReport report = assemble(Collections.emptyList(), 0.01);
    Assert.assertTrue(report.getEvents().isEmpty());
    Assert.assertTrue(report.getFunctionMap().isEmpty());
    Assert.assertTrue(report.getLibList().isEmpty());
  }

  private FinalizedReport assemble(List<Sample> samples, double minFuncPercent) {
    return assemble(samples, minFuncPercent, new AnnotationMerger(AddressResolver.NONE, DeobfuscationMap.NONE,
        false, false, 100));
  }

  private FinalizedReport assemble(List<Sample> samples, double minFuncPercent, AnnotationMerger merger) {
    SampleAggregator aggregator = new SampleAggregator(EventStreamMerger.perEventType(symbols),
        ThreadGrouping.identity().bind(symbols, samples), InterpreterFrameFilter.showAll(), merger.isAddressTrackingNeeded());
    samples.forEach(aggregator::aggregate);
    AggregatedSamples aggregated = aggregator.finalizeEntity();
    try (AnnotationMerger m = merger) {
      return new ReportAssembler(symbols, m, minFuncPercent)
          .assemble(aggregated, Collections.singletonList("capture.json"), samples.size());
    }
  }

  private static FinalizedFunction findFunction(FinalizedReport report, int functionId) {
    for (FinalizedLibrary lib : report.getEvents().get(0).getProcesses().get(0).getThreads().get(0).getLibs()) {
      for (FinalizedFunction function : lib.getFunctions()) {
        if (function.getFunctionId() == functionId) {
          return function;
        }
      }
    }
    throw new AssertionError("function " + functionId + " not reported");
  }

  static void assertReferentialIntegrity(FinalizedReport report) {
    for (FunctionEntry entry : report.getFunctionMap().values()) {
      Assert.assertTrue(entry.getLibIndex() >= 0 && entry.getLibIndex() < report.getLibList().size());
    }
    for (FinalizedEvent event : report.getEvents()) {
      for (FinalizedProcess process : event.getProcesses()) {
        Assert.assertTrue(report.getProcessNames().containsKey(process.getPid()));
        for (FinalizedThread thread : process.getThreads()) {
          Assert.assertTrue(report.getThreadNames().containsKey(thread.getTid()));
          for (FinalizedLibrary lib : thread.getLibs()) {
            Assert.assertTrue(lib.getLibIndex() < report.getLibList().size());
            for (FinalizedFunction function : lib.getFunctions()) {
              Assert.assertTrue(report.getFunctionMap().containsKey(function.getFunctionId()));
              for (SourceLineHit hit : function.getSourceLines()) {
                Assert.assertTrue(hit.getFileIndex() < report.getSourceFiles().size());
              }
            }
          }
          CallTreeTraverser<FinalizedCallNode> traverser = new CallTreeTraverser<>(node -> {
            if (node.getFunctionId() != CallGraphBuilder.ROOT_FUNCTION_ID) {
              Assert.assertTrue(report.getFunctionMap().containsKey(node.getFunctionId()));
            }
          });
          traverser.traverse(thread.getCallGraph());
          traverser.traverse(thread.getReverseCallGraph());
        }
      }
    }
  }
}
