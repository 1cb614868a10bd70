package perf.report.aggregation.report;

import perf.report.aggregation.annotate.AddressHit;

import java.util.Collections;
import java.util.List;

/**
 * Statistics of one function within one thread of the report.
 */
public class FinalizedFunction {
  private final int functionId;
  private final long sampleCount;
  private final long eventCount;
  private final long subtreeEventCount;
  private final List<SourceLineHit> sourceLines;
  private final List<AddressHit> addressHits;

  public FinalizedFunction(int functionId, long sampleCount, long eventCount, long subtreeEventCount,
                           List<SourceLineHit> sourceLines, List<AddressHit> addressHits) {
    this.functionId = functionId;
    this.sampleCount = sampleCount;
    this.eventCount = eventCount;
    this.subtreeEventCount = subtreeEventCount;
    this.sourceLines = Collections.unmodifiableList(sourceLines);
    this.addressHits = Collections.unmodifiableList(addressHits);
  }

  public int getFunctionId() {
    return functionId;
  }

  public long getSampleCount() {
    return sampleCount;
  }

  public long getEventCount() {
    return eventCount;
  }

  public long getSubtreeEventCount() {
    return subtreeEventCount;
  }

  public List<SourceLineHit> getSourceLines() {
    return sourceLines;
  }

  public List<AddressHit> getAddressHits() {
    return addressHits;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof FinalizedFunction)) {
      return false;
    }

    FinalizedFunction other = (FinalizedFunction) o;
    return this.functionId == other.functionId
        && this.sampleCount == other.sampleCount
        && this.eventCount == other.eventCount
        && this.subtreeEventCount == other.subtreeEventCount
        && this.sourceLines.equals(other.sourceLines)
        && this.addressHits.equals(other.addressHits);
  }

  @Override
  public int hashCode() {
    return 31 * functionId + Long.hashCode(subtreeEventCount);
  }
}
