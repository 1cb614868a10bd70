package perf.report.aggregation.report;

import java.util.Collections;
import java.util.List;

public class FinalizedEvent {
  private final String eventName;
  private final long eventCount;
  private final List<FinalizedProcess> processes;

  public FinalizedEvent(String eventName, long eventCount, List<FinalizedProcess> processes) {
    this.eventName = eventName;
    this.eventCount = eventCount;
    this.processes = Collections.unmodifiableList(processes);
  }

  public String getEventName() {
    return eventName;
  }

  public long getEventCount() {
    return eventCount;
  }

  /**
   * Ordered by event count descending, then pid.
   */
  public List<FinalizedProcess> getProcesses() {
    return processes;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof FinalizedEvent)) {
      return false;
    }

    FinalizedEvent other = (FinalizedEvent) o;
    return this.eventName.equals(other.eventName)
        && this.eventCount == other.eventCount
        && this.processes.equals(other.processes);
  }

  @Override
  public int hashCode() {
    return eventName.hashCode() * 31 + Long.hashCode(eventCount);
  }
}
