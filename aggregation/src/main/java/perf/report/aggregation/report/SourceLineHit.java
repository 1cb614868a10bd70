package perf.report.aggregation.report;

/**
 * Line level annotation of a function within one thread. fileIndex points into {@link FinalizedReport#getSourceFiles()}.
 */
public final class SourceLineHit {
  private final int fileIndex;
  private final int line;
  private final long eventCount;
  private final long subtreeEventCount;

  public SourceLineHit(int fileIndex, int line, long eventCount, long subtreeEventCount) {
    this.fileIndex = fileIndex;
    this.line = line;
    this.eventCount = eventCount;
    this.subtreeEventCount = subtreeEventCount;
  }

  public int getFileIndex() {
    return fileIndex;
  }

  public int getLine() {
    return line;
  }

  public long getEventCount() {
    return eventCount;
  }

  public long getSubtreeEventCount() {
    return subtreeEventCount;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof SourceLineHit)) {
      return false;
    }

    SourceLineHit other = (SourceLineHit) o;
    return this.fileIndex == other.fileIndex
        && this.line == other.line
        && this.eventCount == other.eventCount
        && this.subtreeEventCount == other.subtreeEventCount;
  }

  @Override
  public int hashCode() {
    return 31 * (31 * fileIndex + line) + Long.hashCode(subtreeEventCount);
  }

  @Override
  public String toString() {
    return fileIndex + ":" + line + "[" + eventCount + "/" + subtreeEventCount + "]";
  }
}
