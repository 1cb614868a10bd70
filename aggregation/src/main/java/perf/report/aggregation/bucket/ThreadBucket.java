package perf.report.aggregation.bucket;

import perf.report.aggregation.callgraph.CallGraphBuilder;
import perf.report.aggregation.thread.ThreadKey;
import perf.report.common.sample.Frame;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Samples of one (event, process, thread) bucket: counts, call graphs and per library function statistics.
 */
public class ThreadBucket {
  private final ThreadKey key;
  private final CallGraphBuilder callGraph = new CallGraphBuilder();
  private final SortedMap<Integer, SortedMap<Integer, FunctionStats>> functionsByLib = new TreeMap<>();
  private long eventCount = 0;
  private long sampleCount = 0;

  public ThreadBucket(ThreadKey key) {
    this.key = key;
  }

  /**
   * @param callChain root to leaf, interpreter frames already elided
   * @param trackAddresses whether per address hits are needed for annotations
   */
  public void add(List<Frame> callChain, long weight, boolean trackAddresses) {
    eventCount += weight;
    sampleCount++;

    Set<Integer> hitFunctionIds = new HashSet<>();
    int leafIdx = callChain.size() - 1;
    // leaf first, so a recursive function is counted at its innermost frame
    for (int i = leafIdx; i >= 0; i--) {
      Frame frame = callChain.get(i);
      if (!hitFunctionIds.add(frame.getFunctionId())) {
        continue;
      }
      boolean leaf = i == leafIdx;
      FunctionStats stats = functionsByLib.computeIfAbsent(frame.getLibId(), l -> new TreeMap<>())
          .computeIfAbsent(frame.getFunctionId(), f -> new FunctionStats(f, frame.getLibId()));
      stats.addHit(weight, leaf);
      if (trackAddresses) {
        stats.addAddressHit(frame.getAddress(), leaf ? weight : 0, weight);
      }
    }

    callGraph.addCallChain(callChain, weight);
  }

  public ThreadKey getKey() {
    return key;
  }

  public long getEventCount() {
    return eventCount;
  }

  public long getSampleCount() {
    return sampleCount;
  }

  public CallGraphBuilder getCallGraph() {
    return callGraph;
  }

  /**
   * @return lib id -> (function id -> stats), both levels in id order
   */
  public SortedMap<Integer, SortedMap<Integer, FunctionStats>> getFunctionsByLib() {
    return Collections.unmodifiableSortedMap(functionsByLib);
  }
}
