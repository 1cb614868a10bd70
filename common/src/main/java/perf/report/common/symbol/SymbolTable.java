package perf.report.common.symbol;

import perf.report.common.exception.ConfigurationException;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Integer keyed tables of a capture: event types, libraries, functions, processes and threads.
 * <p>
 * Ids are expected to be stable across every capture merged into one report. Re-defining an id with a different
 * meaning, either within a capture or while merging captures, raises a {@link ConfigurationException} instead of
 * silently replacing the earlier definition.
 */
public class SymbolTable {
  private final SortedMap<Integer, String> eventTypes = new TreeMap<>();
  private final SortedMap<Integer, String> libraries = new TreeMap<>();
  private final SortedMap<Integer, FunctionSymbol> functions = new TreeMap<>();
  private final SortedMap<Integer, String> processes = new TreeMap<>();
  private final SortedMap<Integer, ThreadInfo> threads = new TreeMap<>();

  public SymbolTable addEventType(int id, String name) {
    put(eventTypes, id, name, "event type");
    return this;
  }

  public SymbolTable addLibrary(int id, String name) {
    put(libraries, id, name, "library");
    return this;
  }

  public SymbolTable addFunction(int id, int libId, String name) {
    put(functions, id, new FunctionSymbol(id, libId, name), "function");
    return this;
  }

  public SymbolTable addProcess(int pid, String name) {
    put(processes, pid, name, "process");
    return this;
  }

  public SymbolTable addThread(int tid, int pid, String name) {
    put(threads, tid, new ThreadInfo(tid, pid, name), "thread");
    return this;
  }

  /**
   * Merges every definition of other into this table.
   * @throws ConfigurationException if both tables define an id differently
   */
  public SymbolTable mergeFrom(SymbolTable other) {
    other.eventTypes.forEach((k, v) -> put(eventTypes, k, v, "event type"));
    other.libraries.forEach((k, v) -> put(libraries, k, v, "library"));
    other.functions.forEach((k, v) -> put(functions, k, v, "function"));
    other.processes.forEach((k, v) -> put(processes, k, v, "process"));
    other.threads.forEach((k, v) -> put(threads, k, v, "thread"));
    return this;
  }

  /**
   * Checks that every function refers to a known library.
   */
  public void validate() {
    for (FunctionSymbol function : functions.values()) {
      if (!libraries.containsKey(function.getLibId())) {
        throw new ConfigurationException("function " + function + " refers to unknown library id " + function.getLibId());
      }
    }
  }

  /**
   * @return event type name, null if unknown
   */
  public String getEventTypeName(int id) {
    return eventTypes.get(id);
  }

  /**
   * @return library name, null if unknown
   */
  public String getLibraryName(int id) {
    return libraries.get(id);
  }

  /**
   * @return function symbol, null if unknown
   */
  public FunctionSymbol getFunction(int id) {
    return functions.get(id);
  }

  /**
   * @return process name, null if unknown
   */
  public String getProcessName(int pid) {
    return processes.get(pid);
  }

  /**
   * @return thread, null if unknown
   */
  public ThreadInfo getThread(int tid) {
    return threads.get(tid);
  }

  public Collection<ThreadInfo> getThreads() {
    return Collections.unmodifiableCollection(threads.values());
  }

  public Map<Integer, String> getLibraries() {
    return Collections.unmodifiableMap(libraries);
  }

  private static <V> void put(Map<Integer, V> table, int id, V value, String kind) {
    Objects.requireNonNull(value, kind + " " + id);
    V existing = table.putIfAbsent(id, value);
    if (existing != null && !existing.equals(value)) {
      throw new ConfigurationException("Conflicting definitions for " + kind + " id " + id + ": " + existing + " vs " + value);
    }
  }
}
