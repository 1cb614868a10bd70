package perf.report.metrics;

/**
 * Metric tag identifying an event stream of a report, e.g. "ev.cpu.2Dclock.3Au" for "cpu-clock:u".
 */
public class EventTag {
  public static final EventTag EMPTY = new EventTag("");
  private static final String prefix = "ev.";

  private final String value;

  public EventTag(final String eventName) {
    this.value = prefix + Util.encodeTags(eventName);
  }

  @Override
  public String toString() {
    return value;
  }
}
