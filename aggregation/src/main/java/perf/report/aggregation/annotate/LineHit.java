package perf.report.aggregation.annotate;

/**
 * Event counts accumulated at one source line, summed over every address resolving to it.
 */
public final class LineHit {
  private final SourceLine sourceLine;
  private final long eventCount;
  private final long subtreeEventCount;

  public LineHit(SourceLine sourceLine, long eventCount, long subtreeEventCount) {
    this.sourceLine = sourceLine;
    this.eventCount = eventCount;
    this.subtreeEventCount = subtreeEventCount;
  }

  public SourceLine getSourceLine() {
    return sourceLine;
  }

  public long getEventCount() {
    return eventCount;
  }

  public long getSubtreeEventCount() {
    return subtreeEventCount;
  }

  LineHit plus(long eventCount, long subtreeEventCount) {
    return new LineHit(sourceLine, this.eventCount + eventCount, this.subtreeEventCount + subtreeEventCount);
  }

  @Override
  public String toString() {
    return sourceLine + "[" + eventCount + "/" + subtreeEventCount + "]";
  }
}
