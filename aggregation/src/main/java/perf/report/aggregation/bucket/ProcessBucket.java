package perf.report.aggregation.bucket;

import perf.report.aggregation.thread.ThreadKey;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

public class ProcessBucket {
  private final int pid;
  private final SortedMap<Integer, ThreadBucket> threads = new TreeMap<>();

  public ProcessBucket(int pid) {
    this.pid = pid;
  }

  public ThreadBucket getOrAddThread(ThreadKey key) {
    return threads.computeIfAbsent(key.getTid(), tid -> new ThreadBucket(key));
  }

  public int getPid() {
    return pid;
  }

  public Collection<ThreadBucket> getThreads() {
    return Collections.unmodifiableCollection(threads.values());
  }

  public long getEventCount() {
    long result = 0;
    for (ThreadBucket thread : threads.values()) {
      result += thread.getEventCount();
    }
    return result;
  }
}
