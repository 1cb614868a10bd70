package perf.report.aggregation.bucket;

import perf.report.aggregation.event.EventStream;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

public class EventBucket {
  private final EventStream stream;
  private final SortedMap<Integer, ProcessBucket> processes = new TreeMap<>();

  public EventBucket(EventStream stream) {
    this.stream = stream;
  }

  public ProcessBucket getOrAddProcess(int pid) {
    return processes.computeIfAbsent(pid, ProcessBucket::new);
  }

  public EventStream getStream() {
    return stream;
  }

  public Collection<ProcessBucket> getProcesses() {
    return Collections.unmodifiableCollection(processes.values());
  }

  public long getEventCount() {
    long result = 0;
    for (ProcessBucket process : processes.values()) {
      result += process.getEventCount();
    }
    return result;
  }
}
