package perf.report.aggregation.thread;

import perf.report.common.sample.Sample;
import perf.report.common.symbol.SymbolTable;

import java.util.List;

/**
 * Policy deciding which thread bucket a sample of (pid, tid) lands in. Selected once per run and bound to the
 * merged symbol table of all captures, and to the samples admitted by the filter, before the first sample is
 * aggregated.
 */
public interface ThreadGrouping {

  /**
   * @param admitted every sample which will be aggregated, representatives are only elected among their threads
   */
  Mapper bind(SymbolTable symbols, Iterable<Sample> admitted);

  interface Mapper {
    ThreadKey keyFor(int pid, int tid);
  }

  /**
   * Every thread is its own bucket.
   */
  static ThreadGrouping identity() {
    return IdentityThreadGrouping.INSTANCE;
  }

  /**
   * Threads sharing a name share a bucket, within processes sharing a name.
   */
  static ThreadGrouping byName() {
    return ByNameThreadGrouping.INSTANCE;
  }

  /**
   * Threads whose name fully matches a pattern share the bucket of the first such pattern, within processes sharing
   * a name.
   */
  static ThreadGrouping byPatterns(List<String> patterns) {
    return new PatternListThreadGrouping(patterns);
  }
}
