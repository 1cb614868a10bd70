package perf.report.aggregation.report;

import java.util.Collections;
import java.util.List;

public class ReportMetadata {
  private final List<String> captures;
  private final long admittedSampleCount;
  private final long aggregatedSampleCount;

  public ReportMetadata(List<String> captures, long admittedSampleCount, long aggregatedSampleCount) {
    this.captures = Collections.unmodifiableList(captures);
    this.admittedSampleCount = admittedSampleCount;
    this.aggregatedSampleCount = aggregatedSampleCount;
  }

  /**
   * Names of the input captures, in input order.
   */
  public List<String> getCaptures() {
    return captures;
  }

  /**
   * Samples which passed the filter.
   */
  public long getAdmittedSampleCount() {
    return admittedSampleCount;
  }

  /**
   * Admitted samples which the trace mode assigned to some event.
   */
  public long getAggregatedSampleCount() {
    return aggregatedSampleCount;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof ReportMetadata)) {
      return false;
    }

    ReportMetadata other = (ReportMetadata) o;
    return this.captures.equals(other.captures)
        && this.admittedSampleCount == other.admittedSampleCount
        && this.aggregatedSampleCount == other.aggregatedSampleCount;
  }

  @Override
  public int hashCode() {
    return captures.hashCode() * 31 + Long.hashCode(admittedSampleCount);
  }
}
