package perf.report.common.sample;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Decoded sample record as produced by a {@link SampleSource}. Never mutated once built.
 */
public final class Sample {
  private final int eventTypeId;
  private final int pid;
  private final int tid;
  private final long timestamp;
  private final long period;
  private final boolean offCpu;

  /**
   * Root to leaf. Last element is the frame which was executing (or blocked) when the sample was taken.
   */
  private final List<Frame> callChain;

  public Sample(int eventTypeId, int pid, int tid, long timestamp, long period, boolean offCpu, List<Frame> callChain) {
    Preconditions.checkNotNull(callChain, "callChain");
    Preconditions.checkArgument(!callChain.isEmpty(), "sample of tid %s at %s has an empty call chain", tid, timestamp);
    Preconditions.checkArgument(period >= 0, "sample of tid %s at %s has negative period %s", tid, timestamp, period);
    this.eventTypeId = eventTypeId;
    this.pid = pid;
    this.tid = tid;
    this.timestamp = timestamp;
    this.period = period;
    this.offCpu = offCpu;
    this.callChain = ImmutableList.copyOf(callChain);
  }

  public int getEventTypeId() {
    return eventTypeId;
  }

  public int getPid() {
    return pid;
  }

  public int getTid() {
    return tid;
  }

  public long getTimestamp() {
    return timestamp;
  }

  /**
   * Event weight of this sample, e.g. nanoseconds of cpu-clock or of time spent switched out.
   */
  public long getPeriod() {
    return period;
  }

  public boolean isOffCpu() {
    return offCpu;
  }

  public List<Frame> getCallChain() {
    return callChain;
  }

  public Frame getLeaf() {
    return callChain.get(callChain.size() - 1);
  }

  @Override
  public String toString() {
    return "Sample{pid=" + pid + ", tid=" + tid + ", time=" + timestamp + ", period=" + period
        + ", offCpu=" + offCpu + ", depth=" + callChain.size() + "}";
  }
}
