package perf.report.aggregation.event;

import java.util.Objects;

/**
 * Identity of an event of the report. Streams sort in report order: on-cpu (or mixed) first, then off-cpu, then
 * plain event types by id.
 */
public final class EventStream implements Comparable<EventStream> {
  public enum Kind {
    ON_CPU, MIXED, OFF_CPU, EVENT_TYPE
  }

  public static final EventStream ON_CPU = new EventStream(Kind.ON_CPU, -1);
  public static final EventStream OFF_CPU = new EventStream(Kind.OFF_CPU, -1);
  public static final EventStream MIXED = new EventStream(Kind.MIXED, -1);

  private final Kind kind;
  private final int eventTypeId;

  private EventStream(Kind kind, int eventTypeId) {
    this.kind = kind;
    this.eventTypeId = eventTypeId;
  }

  public static EventStream ofEventType(int eventTypeId) {
    return new EventStream(Kind.EVENT_TYPE, eventTypeId);
  }

  public Kind getKind() {
    return kind;
  }

  /**
   * @return event type id for {@link Kind#EVENT_TYPE} streams, -1 otherwise
   */
  public int getEventTypeId() {
    return eventTypeId;
  }

  @Override
  public int compareTo(EventStream other) {
    int result = kind.compareTo(other.kind);
    return result != 0 ? result : Integer.compare(eventTypeId, other.eventTypeId);
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof EventStream)) {
      return false;
    }

    EventStream other = (EventStream) o;
    return this.kind == other.kind && this.eventTypeId == other.eventTypeId;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, eventTypeId);
  }

  @Override
  public String toString() {
    return kind == Kind.EVENT_TYPE ? "event-type-" + eventTypeId : kind.name();
  }
}
