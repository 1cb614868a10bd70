package perf.report.aggregation.thread;

import java.util.Objects;

/**
 * Display identity of a thread bucket. For aggregated buckets pid and tid are those of the group's representative
 * thread and name is the group label.
 */
public final class ThreadKey {
  public static final String UNKNOWN_THREAD_NAME = "unknown";

  private final int pid;
  private final int tid;
  private final String name;

  public ThreadKey(int pid, int tid, String name) {
    this.pid = pid;
    this.tid = tid;
    this.name = Objects.requireNonNull(name);
  }

  public int getPid() {
    return pid;
  }

  public int getTid() {
    return tid;
  }

  public String getName() {
    return name;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof ThreadKey)) {
      return false;
    }

    ThreadKey other = (ThreadKey) o;
    return this.pid == other.pid
        && this.tid == other.tid
        && this.name.equals(other.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(pid, tid, name);
  }

  @Override
  public String toString() {
    return name + "(" + pid + "/" + tid + ")";
  }
}
