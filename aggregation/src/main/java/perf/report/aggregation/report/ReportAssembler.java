package perf.report.aggregation.report;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.SharedMetricRegistries;
import perf.report.aggregation.AggregatedSamples;
import perf.report.aggregation.ReportOptions;
import perf.report.aggregation.annotate.AnnotationMerger;
import perf.report.aggregation.annotate.FunctionAnnotation;
import perf.report.aggregation.annotate.LineHit;
import perf.report.aggregation.bucket.EventBucket;
import perf.report.aggregation.bucket.FunctionStats;
import perf.report.aggregation.bucket.ProcessBucket;
import perf.report.aggregation.bucket.ThreadBucket;
import perf.report.aggregation.callgraph.CallGraphBuilder;
import perf.report.aggregation.callgraph.CallGraphNode;
import perf.report.aggregation.callgraph.CallTreeTraverser;
import perf.report.common.symbol.FunctionSymbol;
import perf.report.common.symbol.SymbolTable;
import perf.report.common.symbol.ThreadInfo;
import perf.report.aggregation.thread.ThreadKey;
import perf.report.metrics.EventTag;
import perf.report.metrics.MetricName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Turns aggregated buckets into a {@link FinalizedReport}: drops threads and functions below the minimum percent of
 * their event, orders processes and threads, converts call graphs and builds the side tables.
 * <p>
 * Works in two passes. The first decides what is kept and collects every referenced function, so library indexes
 * are known before the second pass builds the nested structure.
 */
public class ReportAssembler {
  private static final Logger logger = LoggerFactory.getLogger(ReportAssembler.class);

  private static final Comparator<ThreadBucket> THREAD_ORDER =
      Comparator.comparingLong(ThreadBucket::getEventCount).reversed()
          .thenComparingInt(t -> t.getKey().getTid());

  private final SymbolTable symbols;
  private final AnnotationMerger annotationMerger;
  private final double minFuncPercent;

  private final MetricRegistry metricRegistry = SharedMetricRegistries.getOrCreate(ReportOptions.METRIC_REGISTRY);
  private final Meter mtrThreadElided = metricRegistry.meter(MetricName.Report_Thread_Elided.get());
  private final Meter mtrProcessElided = metricRegistry.meter(MetricName.Report_Process_Elided.get());
  private final Meter mtrFunctionElided = metricRegistry.meter(MetricName.Report_Function_Elided.get());

  public ReportAssembler(SymbolTable symbols, AnnotationMerger annotationMerger, double minFuncPercent) {
    this.symbols = symbols;
    this.annotationMerger = annotationMerger;
    this.minFuncPercent = minFuncPercent;
  }

  public FinalizedReport assemble(AggregatedSamples aggregated, List<String> captures, long admittedSampleCount) {
    List<KeptEvent> keptEvents = new ArrayList<>();
    SortedSet<Integer> referencedFunctions = new TreeSet<>();
    SortedSet<Integer> referencedLibs = new TreeSet<>();

    for (EventBucket event : aggregated.getEvents()) {
      KeptEvent kept = selectKept(aggregated.getEventName(event), event);
      if (kept.processes.isEmpty()) {
        logger.debug("Event {} has nothing left to report", kept.name);
        continue;
      }
      keptEvents.add(kept);
      for (List<ThreadBucket> threads : kept.processes.values()) {
        for (ThreadBucket thread : threads) {
          collectReferences(thread, kept.functionLimit, referencedFunctions, referencedLibs);
        }
      }
    }

    for (int functionId : referencedFunctions) {
      referencedLibs.add(functionSymbol(functionId).getLibId());
    }
    List<String> libList = new ArrayList<>(referencedLibs.size());
    Map<Integer, Integer> libIndexes = new HashMap<>();
    for (int libId : referencedLibs) {
      libIndexes.put(libId, libList.size());
      String libName = symbols.getLibraryName(libId);
      libList.add(libName == null ? "unknown" : libName);
    }

    SourceFiles sourceFiles = new SourceFiles();
    SortedMap<Integer, String> threadNames = new TreeMap<>();
    SortedMap<Integer, String> processNames = new TreeMap<>();
    List<FinalizedEvent> events = new ArrayList<>(keptEvents.size());

    for (KeptEvent kept : keptEvents) {
      List<FinalizedProcess> processes = new ArrayList<>(kept.processes.size());
      for (Map.Entry<Integer, List<ThreadBucket>> process : kept.processes.entrySet()) {
        List<FinalizedThread> threads = new ArrayList<>(process.getValue().size());
        long processEvents = 0, processSamples = 0;
        for (ThreadBucket thread : process.getValue()) {
          threads.add(finalizeThread(thread, kept.functionLimit, libIndexes, sourceFiles));
          threadNames.putIfAbsent(thread.getKey().getTid(), thread.getKey().getName());
          processEvents += thread.getEventCount();
          processSamples += thread.getSampleCount();
        }
        processNames.putIfAbsent(process.getKey(), processName(process.getKey()));
        processes.add(new FinalizedProcess(process.getKey(), processEvents, processSamples, threads));
      }
      processes.sort(Comparator.comparingLong(FinalizedProcess::getEventCount).reversed()
          .thenComparingInt(FinalizedProcess::getPid));

      long eventCount = 0;
      for (FinalizedProcess process : processes) {
        eventCount += process.getEventCount();
      }
      events.add(new FinalizedEvent(kept.name, eventCount, processes));
    }

    SortedMap<Integer, FunctionEntry> functionMap = new TreeMap<>();
    for (int functionId : referencedFunctions) {
      FunctionSymbol function = functionSymbol(functionId);
      functionMap.put(functionId, new FunctionEntry(libIndexes.get(function.getLibId()),
          annotationMerger.getDisplayName(function), annotationMerger.getDisassembly(function)));
    }

    if (logger.isDebugEnabled()) {
      logger.debug("Assembled report of " + events.size() + " events, " + threadNames.size() + " threads, "
          + functionMap.size() + " functions in " + libList.size() + " libraries");
    }
    return new FinalizedReport(threadNames, processNames, libList, functionMap, sourceFiles.build(), events,
        new ReportMetadata(captures, admittedSampleCount, aggregated.getSampleCount()));
  }

  /**
   * Drops threads below the limit (and threads without weight), then processes left without threads.
   */
  private KeptEvent selectKept(String name, EventBucket event) {
    double limit = event.getEventCount() * minFuncPercent * 0.01;
    KeptEvent kept = new KeptEvent(name, limit);
    Meter mtrEventThreadElided = metricRegistry.meter(
        MetricRegistry.name(MetricName.Report_Thread_Elided.get(), new EventTag(name).toString()));
    for (ProcessBucket process : event.getProcesses()) {
      List<ThreadBucket> threads = new ArrayList<>();
      for (ThreadBucket thread : process.getThreads()) {
        if (thread.getEventCount() == 0 || thread.getEventCount() < limit) {
          mtrThreadElided.mark();
          mtrEventThreadElided.mark();
          continue;
        }
        threads.add(thread);
      }
      if (threads.isEmpty()) {
        mtrProcessElided.mark();
        continue;
      }
      threads.sort(THREAD_ORDER);
      kept.processes.put(process.getPid(), threads);
    }
    return kept;
  }

  private void collectReferences(ThreadBucket thread, double functionLimit,
                                 SortedSet<Integer> referencedFunctions, SortedSet<Integer> referencedLibs) {
    CallTreeTraverser<CallGraphNode> traverser = new CallTreeTraverser<>(node -> {
      if (node.getFunctionId() != CallGraphBuilder.ROOT_FUNCTION_ID) {
        referencedFunctions.add(node.getFunctionId());
      }
    });
    traverser.traverse(thread.getCallGraph().getRoot());
    traverser.traverse(thread.getCallGraph().getReverseRoot());

    for (Map.Entry<Integer, SortedMap<Integer, FunctionStats>> lib : thread.getFunctionsByLib().entrySet()) {
      for (FunctionStats stats : lib.getValue().values()) {
        if (stats.getSubtreeEventCount() >= functionLimit) {
          referencedFunctions.add(stats.getFunctionId());
          referencedLibs.add(lib.getKey());
        }
      }
    }
  }

  private FinalizedThread finalizeThread(ThreadBucket thread, double functionLimit,
                                         Map<Integer, Integer> libIndexes, SourceFiles sourceFiles) {
    List<FinalizedLibrary> libs = new ArrayList<>();
    for (Map.Entry<Integer, SortedMap<Integer, FunctionStats>> lib : thread.getFunctionsByLib().entrySet()) {
      List<FinalizedFunction> functions = new ArrayList<>();
      for (FunctionStats stats : lib.getValue().values()) {
        if (stats.getSubtreeEventCount() < functionLimit) {
          mtrFunctionElided.mark();
          continue;
        }
        functions.add(finalizeFunction(stats, sourceFiles));
      }
      if (!functions.isEmpty()) {
        libs.add(new FinalizedLibrary(libIndexes.get(lib.getKey()), functions));
      }
    }

    Comparator<CallGraphNode> topLevelOrder = Comparator
        .comparing((CallGraphNode node) -> annotationMerger.getDisplayName(functionSymbol(node.getFunctionId())))
        .thenComparingInt(CallGraphNode::getFunctionId);
    return new FinalizedThread(thread.getKey().getTid(), thread.getEventCount(), thread.getSampleCount(), libs,
        convert(thread.getCallGraph().getRoot(), topLevelOrder),
        convert(thread.getCallGraph().getReverseRoot(), null));
  }

  private FinalizedFunction finalizeFunction(FunctionStats stats, SourceFiles sourceFiles) {
    FunctionAnnotation annotation = annotationMerger.annotate(functionSymbol(stats.getFunctionId()), stats.getAddressHits());
    List<SourceLineHit> sourceLines = new ArrayList<>(annotation.getLineHits().size());
    for (LineHit hit : annotation.getLineHits()) {
      int fileIndex = sourceFiles.record(hit.getSourceLine().getPath(), hit.getSourceLine().getLine(),
          hit.getSourceLine().getText());
      sourceLines.add(new SourceLineHit(fileIndex, hit.getSourceLine().getLine(), hit.getEventCount(),
          hit.getSubtreeEventCount()));
    }
    return new FinalizedFunction(stats.getFunctionId(), stats.getSampleCount(), stats.getEventCount(),
        stats.getSubtreeEventCount(), sourceLines, annotation.getAddressHits());
  }

  /**
   * Copies an accumulated tree without recursion. Children of the root are ordered by rootChildOrder when given,
   * deeper levels keep encounter order.
   */
  static FinalizedCallNode convert(CallGraphNode root, Comparator<CallGraphNode> rootChildOrder) {
    FinalizedCallNode finalizedRoot = new FinalizedCallNode(root.getFunctionId(), root.getEventCount(),
        root.getSubtreeEventCount());
    Deque<CallGraphNode> sources = new ArrayDeque<>();
    Deque<FinalizedCallNode> targets = new ArrayDeque<>();
    sources.push(root);
    targets.push(finalizedRoot);
    while (!sources.isEmpty()) {
      CallGraphNode source = sources.pop();
      FinalizedCallNode target = targets.pop();
      List<CallGraphNode> children = new ArrayList<>(source.children());
      if (source == root && rootChildOrder != null) {
        children.sort(rootChildOrder);
      }
      for (CallGraphNode child : children) {
        FinalizedCallNode finalizedChild = new FinalizedCallNode(child.getFunctionId(), child.getEventCount(),
            child.getSubtreeEventCount());
        target.addChild(finalizedChild);
        sources.push(child);
        targets.push(finalizedChild);
      }
    }
    return finalizedRoot;
  }

  private FunctionSymbol functionSymbol(int functionId) {
    FunctionSymbol function = symbols.getFunction(functionId);
    if (function == null) {
      throw new IllegalStateException("No symbol for function id " + functionId);
    }
    return function;
  }

  private String processName(int pid) {
    String name = symbols.getProcessName(pid);
    if (name != null) {
      return name;
    }
    ThreadInfo mainThread = symbols.getThread(pid);
    return mainThread == null ? ThreadKey.UNKNOWN_THREAD_NAME : mainThread.getName();
  }

  private static class KeptEvent {
    private final String name;
    private final double functionLimit;
    private final Map<Integer, List<ThreadBucket>> processes = new LinkedHashMap<>();

    private KeptEvent(String name, double functionLimit) {
      this.name = name;
      this.functionLimit = functionLimit;
    }
  }

  /**
   * Source file table, files indexed in order of first reference.
   */
  private static class SourceFiles {
    private final Map<String, Integer> indexes = new HashMap<>();
    private final List<String> paths = new ArrayList<>();
    private final List<SortedMap<Integer, String>> code = new ArrayList<>();

    int record(String path, int line, String text) {
      Integer index = indexes.get(path);
      if (index == null) {
        index = paths.size();
        indexes.put(path, index);
        paths.add(path);
        code.add(new TreeMap<>());
      }
      SortedMap<Integer, String> lines = code.get(index);
      if (text != null || !lines.containsKey(line)) {
        lines.put(line, text);
      }
      return index;
    }

    List<SourceFile> build() {
      List<SourceFile> result = new ArrayList<>(paths.size());
      for (int i = 0; i < paths.size(); i++) {
        result.add(new SourceFile(paths.get(i), code.get(i)));
      }
      return result;
    }
  }
}
