package perf.report.aggregation;

import perf.report.aggregation.bucket.EventBucket;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Result of a finalized {@link SampleAggregator}: event buckets in report order with their names.
 */
public class AggregatedSamples {
  private final Map<EventBucket, String> eventNames;
  private final long sampleCount;

  AggregatedSamples(Map<EventBucket, String> eventNames, long sampleCount) {
    this.eventNames = Collections.unmodifiableMap(eventNames);
    this.sampleCount = sampleCount;
  }

  public List<EventBucket> getEvents() {
    return new ArrayList<>(eventNames.keySet());
  }

  public String getEventName(EventBucket event) {
    return eventNames.get(event);
  }

  /**
   * Number of samples which landed in some event bucket.
   */
  public long getSampleCount() {
    return sampleCount;
  }
}
