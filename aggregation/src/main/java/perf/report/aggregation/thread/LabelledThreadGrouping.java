package perf.report.aggregation.thread;

import perf.report.common.sample.Sample;
import perf.report.common.symbol.SymbolTable;
import perf.report.common.symbol.ThreadInfo;

import java.util.HashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Base of policies which merge threads carrying the same label. Threads only merge within processes of the same
 * name (or the same pid, when the process name is unknown). The representative of a group is its member with the
 * smallest tid among the threads which had admitted samples, so bucket identity neither depends on sample arrival
 * order nor names a thread the filter rejected.
 */
abstract class LabelledThreadGrouping implements ThreadGrouping {

  /**
   * @return group label of the thread, null if the thread stays in its own bucket
   */
  protected abstract String labelOf(ThreadInfo thread);

  @Override
  public Mapper bind(SymbolTable symbols, Iterable<Sample> admitted) {
    SortedMap<Integer, Integer> pidsByTid = new TreeMap<>();
    for (Sample sample : admitted) {
      pidsByTid.putIfAbsent(sample.getTid(), sample.getPid());
    }

    Map<String, Map<String, ThreadKey>> representatives = new HashMap<>();
    Map<Integer, ThreadKey> keysByTid = new HashMap<>();
    // ascending tid, first member of a group is its representative
    for (Map.Entry<Integer, Integer> admittedThread : pidsByTid.entrySet()) {
      int tid = admittedThread.getKey();
      int pid = admittedThread.getValue();
      ThreadInfo thread = symbols.getThread(tid);
      String label = thread == null ? null : labelOf(thread);
      if (label != null) {
        ThreadKey key = representatives.computeIfAbsent(processScope(symbols, pid), s -> new HashMap<>())
            .computeIfAbsent(label, l -> new ThreadKey(pid, tid, l));
        keysByTid.put(tid, key);
      }
    }

    return (pid, tid) -> {
      ThreadKey key = keysByTid.get(tid);
      return key != null ? key : IdentityThreadGrouping.identityKey(symbols, pid, tid);
    };
  }

  private static String processScope(SymbolTable symbols, int pid) {
    String processName = symbols.getProcessName(pid);
    return processName != null ? "name:" + processName : "pid:" + pid;
  }
}
