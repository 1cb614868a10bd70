package perf.report.aggregation;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.SharedMetricRegistries;
import perf.report.aggregation.bucket.EventBucket;
import perf.report.aggregation.callgraph.InterpreterFrameFilter;
import perf.report.aggregation.event.EventStream;
import perf.report.aggregation.event.EventStreamMerger;
import perf.report.aggregation.thread.ThreadGrouping;
import perf.report.aggregation.thread.ThreadKey;
import perf.report.common.sample.Frame;
import perf.report.common.sample.Sample;
import perf.report.metrics.MetricName;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Groups admitted samples into event, process and thread buckets and feeds each bucket's call graph.
 * Samples must be added from a single thread, in a deterministic order.
 */
public class SampleAggregator extends FinalizableBuilder<AggregatedSamples> {
  private final EventStreamMerger eventStreamMerger;
  private final ThreadGrouping.Mapper threadMapper;
  private final InterpreterFrameFilter frameFilter;
  private final boolean trackAddresses;
  private final SortedMap<EventStream, EventBucket> events = new TreeMap<>();
  private long sampleCount = 0;

  private final Meter mtrUnassigned = SharedMetricRegistries.getOrCreate(ReportOptions.METRIC_REGISTRY)
      .meter(MetricRegistry.name(MetricName.Sample_Unassigned.get()));

  public SampleAggregator(EventStreamMerger eventStreamMerger, ThreadGrouping.Mapper threadMapper,
                          InterpreterFrameFilter frameFilter, boolean trackAddresses) {
    this.eventStreamMerger = eventStreamMerger;
    this.threadMapper = threadMapper;
    this.frameFilter = frameFilter;
    this.trackAddresses = trackAddresses;
  }

  public void aggregate(Sample sample) {
    ensureEntityIsWriteable();
    EventStream stream = eventStreamMerger.assign(sample);
    if (stream == null) {
      mtrUnassigned.mark();
      return;
    }

    ThreadKey threadKey = threadMapper.keyFor(sample.getPid(), sample.getTid());
    List<Frame> callChain = frameFilter.filter(sample.getCallChain());
    events.computeIfAbsent(stream, EventBucket::new)
        .getOrAddProcess(threadKey.getPid())
        .getOrAddThread(threadKey)
        .add(callChain, sample.getPeriod(), trackAddresses);
    sampleCount++;
  }

  @Override
  protected AggregatedSamples buildFinalizedEntity() {
    Map<EventBucket, String> namedEvents = new LinkedHashMap<>();
    for (EventBucket event : events.values()) {
      namedEvents.put(event, eventStreamMerger.getEventName(event.getStream()));
    }
    return new AggregatedSamples(namedEvents, sampleCount);
  }
}
