package perf.report.aggregation.report;

import java.util.Collections;
import java.util.List;

public class FinalizedThread {
  private final int tid;
  private final long eventCount;
  private final long sampleCount;
  private final List<FinalizedLibrary> libs;
  private final FinalizedCallNode callGraph;
  private final FinalizedCallNode reverseCallGraph;

  public FinalizedThread(int tid, long eventCount, long sampleCount, List<FinalizedLibrary> libs,
                         FinalizedCallNode callGraph, FinalizedCallNode reverseCallGraph) {
    this.tid = tid;
    this.eventCount = eventCount;
    this.sampleCount = sampleCount;
    this.libs = Collections.unmodifiableList(libs);
    this.callGraph = callGraph;
    this.reverseCallGraph = reverseCallGraph;
  }

  public int getTid() {
    return tid;
  }

  public long getEventCount() {
    return eventCount;
  }

  public long getSampleCount() {
    return sampleCount;
  }

  public List<FinalizedLibrary> getLibs() {
    return libs;
  }

  public FinalizedCallNode getCallGraph() {
    return callGraph;
  }

  public FinalizedCallNode getReverseCallGraph() {
    return reverseCallGraph;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof FinalizedThread)) {
      return false;
    }

    FinalizedThread other = (FinalizedThread) o;
    return this.tid == other.tid
        && this.eventCount == other.eventCount
        && this.sampleCount == other.sampleCount
        && this.libs.equals(other.libs)
        && this.callGraph.equals(other.callGraph)
        && this.reverseCallGraph.equals(other.reverseCallGraph);
  }

  @Override
  public int hashCode() {
    return 31 * tid + Long.hashCode(eventCount);
  }
}
