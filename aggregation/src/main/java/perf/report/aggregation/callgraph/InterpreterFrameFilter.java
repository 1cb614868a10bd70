package perf.report.aggregation.callgraph;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.SharedMetricRegistries;
import perf.report.aggregation.ReportOptions;
import perf.report.common.sample.Frame;
import perf.report.common.symbol.SymbolTable;
import perf.report.metrics.LibraryTag;
import perf.report.metrics.MetricName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Elides frames of managed-runtime interpreter libraries (libart.so and friends) from call chains. Only frames are
 * removed, the sample keeps its weight. When every frame of a chain belongs to the interpreter the leaf frame is
 * kept so the weight still lands on a node.
 */
public class InterpreterFrameFilter {
  private static final InterpreterFrameFilter SHOW_ALL = new InterpreterFrameFilter(Collections.emptyMap());

  /**
   * lib id -> elided frames meter of that library
   */
  private final Map<Integer, Meter> interpreterLibs;
  private final Set<Integer> interpreterLibIds;
  private final Meter mtrElided = SharedMetricRegistries.getOrCreate(ReportOptions.METRIC_REGISTRY)
      .meter(MetricRegistry.name(MetricName.Frame_Interpreter_Elided.get()));

  private InterpreterFrameFilter(Map<Integer, Meter> interpreterLibs) {
    this.interpreterLibs = interpreterLibs;
    this.interpreterLibIds = interpreterLibs.keySet();
  }

  public static InterpreterFrameFilter showAll() {
    return SHOW_ALL;
  }

  /**
   * @param libraryBaseNames file names (without directory) of interpreter libraries
   */
  public static InterpreterFrameFilter hiding(Set<String> libraryBaseNames, SymbolTable symbols) {
    MetricRegistry metricRegistry = SharedMetricRegistries.getOrCreate(ReportOptions.METRIC_REGISTRY);
    Map<Integer, Meter> libs = new HashMap<>();
    for (Map.Entry<Integer, String> library : symbols.getLibraries().entrySet()) {
      if (libraryBaseNames.contains(baseName(library.getValue()))) {
        libs.put(library.getKey(), metricRegistry.meter(MetricRegistry.name(MetricName.Frame_Interpreter_Elided.get(),
            new LibraryTag(library.getValue()).toString())));
      }
    }
    return new InterpreterFrameFilter(libs);
  }

  public List<Frame> filter(List<Frame> callChain) {
    if (interpreterLibIds.isEmpty() || !containsInterpreterFrame(callChain)) {
      return callChain;
    }

    List<Frame> result = new ArrayList<>(callChain.size());
    int leafIdx = callChain.size() - 1;
    for (int i = 0; i <= leafIdx; i++) {
      Frame frame = callChain.get(i);
      Meter mtrLibElided = interpreterLibs.get(frame.getLibId());
      if (mtrLibElided == null || (i == leafIdx && result.isEmpty())) {
        result.add(frame);
      } else {
        mtrLibElided.mark();
      }
    }
    mtrElided.mark(callChain.size() - result.size());
    return result;
  }

  private boolean containsInterpreterFrame(List<Frame> callChain) {
    for (Frame frame : callChain) {
      if (interpreterLibIds.contains(frame.getLibId())) {
        return true;
      }
    }
    return false;
  }

  private static String baseName(String path) {
    int idx = path.lastIndexOf('/');
    return idx < 0 ? path : path.substring(idx + 1);
  }
}
