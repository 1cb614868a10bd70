package perf.report.aggregation.report;

import java.util.Collections;
import java.util.List;

public class FinalizedProcess {
  private final int pid;
  private final long eventCount;
  private final long sampleCount;
  private final List<FinalizedThread> threads;

  public FinalizedProcess(int pid, long eventCount, long sampleCount, List<FinalizedThread> threads) {
    this.pid = pid;
    this.eventCount = eventCount;
    this.sampleCount = sampleCount;
    this.threads = Collections.unmodifiableList(threads);
  }

  public int getPid() {
    return pid;
  }

  public long getEventCount() {
    return eventCount;
  }

  public long getSampleCount() {
    return sampleCount;
  }

  /**
   * Ordered by event count descending, then tid.
   */
  public List<FinalizedThread> getThreads() {
    return threads;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof FinalizedProcess)) {
      return false;
    }

    FinalizedProcess other = (FinalizedProcess) o;
    return this.pid == other.pid
        && this.eventCount == other.eventCount
        && this.sampleCount == other.sampleCount
        && this.threads.equals(other.threads);
  }

  @Override
  public int hashCode() {
    return 31 * pid + Long.hashCode(eventCount);
  }
}
