package perf.report.aggregation.event;

import perf.report.common.sample.Sample;
import perf.report.common.symbol.SymbolTable;

import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Assigns samples to event streams according to a {@link TraceOffCpuMode}, or to one stream per event type when
 * no mode applies.
 * <p>
 * Names of on-cpu, off-cpu and mixed streams are taken from the event types of the samples seen, so they are only
 * final after every sample has been assigned. Not thread safe.
 */
public class EventStreamMerger {
  private static final String UNKNOWN_EVENT_NAME = "unknown";

  private final TraceOffCpuMode mode;
  private final SymbolTable symbols;
  private final SortedSet<Integer> onCpuEventTypes = new TreeSet<>();
  private final SortedSet<Integer> offCpuEventTypes = new TreeSet<>();

  private EventStreamMerger(TraceOffCpuMode mode, SymbolTable symbols) {
    this.mode = mode;
    this.symbols = symbols;
  }

  public static EventStreamMerger forMode(TraceOffCpuMode mode, SymbolTable symbols) {
    if (mode == null) {
      throw new IllegalArgumentException("mode");
    }
    return new EventStreamMerger(mode, symbols);
  }

  public static EventStreamMerger perEventType(SymbolTable symbols) {
    return new EventStreamMerger(null, symbols);
  }

  /**
   * @return mode of this merger, null when every event type is its own stream
   */
  public TraceOffCpuMode getMode() {
    return mode;
  }

  /**
   * @return stream which the sample counts towards, null if the mode drops this kind of sample
   */
  public EventStream assign(Sample sample) {
    if (sample.isOffCpu()) {
      offCpuEventTypes.add(sample.getEventTypeId());
    } else {
      onCpuEventTypes.add(sample.getEventTypeId());
    }

    if (mode == null) {
      return EventStream.ofEventType(sample.getEventTypeId());
    }
    switch (mode) {
      case ON_CPU:
        return sample.isOffCpu() ? null : EventStream.ON_CPU;
      case OFF_CPU:
        return sample.isOffCpu() ? EventStream.OFF_CPU : null;
      case ON_OFF_CPU:
        return sample.isOffCpu() ? EventStream.OFF_CPU : EventStream.ON_CPU;
      case MIXED_ON_OFF_CPU:
        return EventStream.MIXED;
      default:
        throw new IllegalStateException("Unhandled trace-offcpu mode " + mode);
    }
  }

  public String getEventName(EventStream stream) {
    switch (stream.getKind()) {
      case EVENT_TYPE:
        return nameOf(stream.getEventTypeId());
      case ON_CPU:
        return nameOfFirst(onCpuEventTypes);
      case OFF_CPU:
        return nameOfFirst(offCpuEventTypes);
      case MIXED:
        // mixed stream is reported under the on-cpu event, it only falls back to off-cpu if nothing ran on cpu
        return onCpuEventTypes.isEmpty() ? nameOfFirst(offCpuEventTypes) : nameOfFirst(onCpuEventTypes);
      default:
        throw new IllegalStateException("Unhandled stream kind " + stream.getKind());
    }
  }

  private String nameOfFirst(SortedSet<Integer> eventTypes) {
    return eventTypes.isEmpty() ? UNKNOWN_EVENT_NAME : nameOf(eventTypes.first());
  }

  private String nameOf(int eventTypeId) {
    String name = symbols.getEventTypeName(eventTypeId);
    return name == null ? UNKNOWN_EVENT_NAME + "-" + eventTypeId : name;
  }
}
