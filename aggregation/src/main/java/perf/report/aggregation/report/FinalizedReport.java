package perf.report.aggregation.report;

import java.util.Collections;
import java.util.List;
import java.util.SortedMap;

/**
 * The immutable report handed to report consumers: nested event/process/thread structure plus the side tables
 * every index in that structure resolves against.
 */
public class FinalizedReport {
  private final SortedMap<Integer, String> threadNames;
  private final SortedMap<Integer, String> processNames;
  private final List<String> libList;
  private final SortedMap<Integer, FunctionEntry> functionMap;
  private final List<SourceFile> sourceFiles;
  private final List<FinalizedEvent> events;
  private final ReportMetadata metadata;

  public FinalizedReport(SortedMap<Integer, String> threadNames,
                         SortedMap<Integer, String> processNames,
                         List<String> libList,
                         SortedMap<Integer, FunctionEntry> functionMap,
                         List<SourceFile> sourceFiles,
                         List<FinalizedEvent> events,
                         ReportMetadata metadata) {
    this.threadNames = Collections.unmodifiableSortedMap(threadNames);
    this.processNames = Collections.unmodifiableSortedMap(processNames);
    this.libList = Collections.unmodifiableList(libList);
    this.functionMap = Collections.unmodifiableSortedMap(functionMap);
    this.sourceFiles = Collections.unmodifiableList(sourceFiles);
    this.events = Collections.unmodifiableList(events);
    this.metadata = metadata;
  }

  /**
   * tid -> display name of every reported thread bucket.
   */
  public SortedMap<Integer, String> getThreadNames() {
    return threadNames;
  }

  /**
   * pid -> name of every reported process.
   */
  public SortedMap<Integer, String> getProcessNames() {
    return processNames;
  }

  public List<String> getLibList() {
    return libList;
  }

  /**
   * function id -> entry, for every function referenced by a call graph node or a function statistic.
   */
  public SortedMap<Integer, FunctionEntry> getFunctionMap() {
    return functionMap;
  }

  public List<SourceFile> getSourceFiles() {
    return sourceFiles;
  }

  public List<FinalizedEvent> getEvents() {
    return events;
  }

  public ReportMetadata getMetadata() {
    return metadata;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof FinalizedReport)) {
      return false;
    }

    FinalizedReport other = (FinalizedReport) o;
    return this.threadNames.equals(other.threadNames)
        && this.processNames.equals(other.processNames)
        && this.libList.equals(other.libList)
        && this.functionMap.equals(other.functionMap)
        && this.sourceFiles.equals(other.sourceFiles)
        && this.events.equals(other.events)
        && this.metadata.equals(other.metadata);
  }

  @Override
  public int hashCode() {
    return events.hashCode();
  }
}
