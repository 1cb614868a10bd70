package perf.report.common.symbol;

import java.util.Objects;

public final class ThreadInfo {
  private final int tid;
  private final int pid;
  private final String name;

  public ThreadInfo(int tid, int pid, String name) {
    this.tid = tid;
    this.pid = pid;
    this.name = Objects.requireNonNull(name);
  }

  public int getTid() {
    return tid;
  }

  public int getPid() {
    return pid;
  }

  public String getName() {
    return name;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof ThreadInfo)) {
      return false;
    }

    ThreadInfo other = (ThreadInfo) o;
    return this.tid == other.tid
        && this.pid == other.pid
        && this.name.equals(other.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(tid, pid, name);
  }

  @Override
  public String toString() {
    return name + "(" + pid + "/" + tid + ")";
  }
}
