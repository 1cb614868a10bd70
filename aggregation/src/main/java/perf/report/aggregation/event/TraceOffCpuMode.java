package perf.report.aggregation.event;

import perf.report.common.exception.ConfigurationException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * How on-cpu and off-cpu samples of a capture recorded with off-cpu tracing are turned into events.
 */
public enum TraceOffCpuMode {
  /** only on-cpu samples, one event */
  ON_CPU("on-cpu"),
  /** only off-cpu samples, one event */
  OFF_CPU("off-cpu"),
  /** on-cpu event first, off-cpu event second */
  ON_OFF_CPU("on-off-cpu"),
  /** one event carrying on-cpu and off-cpu time */
  MIXED_ON_OFF_CPU("mixed-on-off-cpu");

  private final String option;

  TraceOffCpuMode(String option) {
    this.option = option;
  }

  public String getOption() {
    return option;
  }

  public static TraceOffCpuMode fromOption(String option) {
    for (TraceOffCpuMode mode : values()) {
      if (mode.option.equals(option)) {
        return mode;
      }
    }
    throw new ConfigurationException("Unknown trace-offcpu mode '" + option + "', expected one of "
        + Arrays.stream(values()).map(TraceOffCpuMode::getOption).collect(Collectors.joining(", ")));
  }
}
