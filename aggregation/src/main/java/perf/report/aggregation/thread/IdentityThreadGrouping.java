package perf.report.aggregation.thread;

import perf.report.common.sample.Sample;
import perf.report.common.symbol.SymbolTable;
import perf.report.common.symbol.ThreadInfo;

class IdentityThreadGrouping implements ThreadGrouping {
  static final IdentityThreadGrouping INSTANCE = new IdentityThreadGrouping();

  @Override
  public Mapper bind(SymbolTable symbols, Iterable<Sample> admitted) {
    return (pid, tid) -> identityKey(symbols, pid, tid);
  }

  static ThreadKey identityKey(SymbolTable symbols, int pid, int tid) {
    ThreadInfo thread = symbols.getThread(tid);
    return new ThreadKey(pid, tid, thread == null ? ThreadKey.UNKNOWN_THREAD_NAME : thread.getName());
  }

  @Override
  public String toString() {
    return "identity";
  }
}
