package perf.report.aggregation.filter;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import perf.report.common.exception.ConfigurationException;
import perf.report.common.sample.Sample;
import perf.report.common.symbol.SymbolTable;
import perf.report.common.symbol.ThreadInfo;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Immutable sample predicate built from include/exclude rules and a global time window.
 * <p>
 * Precedence: pid/tid excludes, then name excludes, then includes (every configured kind of include must match at
 * least one of its rules), then the time window. Name patterns are regular expressions which only need to match
 * part of the name.
 */
public class SampleFilter {
  public static final SampleFilter ACCEPT_ALL = newBuilder().build();

  private final Set<Integer> includePids;
  private final Set<Integer> excludePids;
  private final Set<Integer> includeTids;
  private final Set<Integer> excludeTids;
  private final List<Pattern> includeProcessNames;
  private final List<Pattern> excludeProcessNames;
  private final List<Pattern> includeThreadNames;
  private final List<Pattern> excludeThreadNames;
  private final Long globalBegin;
  private final Long globalEnd;

  private SampleFilter(Builder builder) {
    this.includePids = ImmutableSet.copyOf(builder.includePids);
    this.excludePids = ImmutableSet.copyOf(builder.excludePids);
    this.includeTids = ImmutableSet.copyOf(builder.includeTids);
    this.excludeTids = ImmutableSet.copyOf(builder.excludeTids);
    this.includeProcessNames = ImmutableList.copyOf(builder.includeProcessNames);
    this.excludeProcessNames = ImmutableList.copyOf(builder.excludeProcessNames);
    this.includeThreadNames = ImmutableList.copyOf(builder.includeThreadNames);
    this.excludeThreadNames = ImmutableList.copyOf(builder.excludeThreadNames);
    this.globalBegin = builder.globalBegin;
    this.globalEnd = builder.globalEnd;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * @param symbols used to resolve process and thread names of the sample
   */
  public boolean admit(Sample sample, SymbolTable symbols) {
    if (excludePids.contains(sample.getPid()) || excludeTids.contains(sample.getTid())) {
      return false;
    }

    String processName = null;
    String threadName = null;
    if (!excludeProcessNames.isEmpty() || !includeProcessNames.isEmpty()) {
      processName = processName(sample, symbols);
      if (anyMatch(excludeProcessNames, processName)) {
        return false;
      }
    }
    if (!excludeThreadNames.isEmpty() || !includeThreadNames.isEmpty()) {
      threadName = threadName(sample.getTid(), symbols);
      if (anyMatch(excludeThreadNames, threadName)) {
        return false;
      }
    }

    if (!includePids.isEmpty() && !includePids.contains(sample.getPid())) {
      return false;
    }
    if (!includeTids.isEmpty() && !includeTids.contains(sample.getTid())) {
      return false;
    }
    if (!includeProcessNames.isEmpty() && !anyMatch(includeProcessNames, processName)) {
      return false;
    }
    if (!includeThreadNames.isEmpty() && !anyMatch(includeThreadNames, threadName)) {
      return false;
    }

    if (globalBegin != null && sample.getTimestamp() < globalBegin) {
      return false;
    }
    return globalEnd == null || sample.getTimestamp() <= globalEnd;
  }

  public boolean hasTimeWindow() {
    return globalBegin != null || globalEnd != null;
  }

  private static String processName(Sample sample, SymbolTable symbols) {
    String name = symbols.getProcessName(sample.getPid());
    if (name == null) {
      // main thread carries the process name when the capture has no process table entry
      name = threadName(sample.getPid(), symbols);
    }
    return name;
  }

  private static String threadName(int tid, SymbolTable symbols) {
    ThreadInfo thread = symbols.getThread(tid);
    return thread == null ? "" : thread.getName();
  }

  private static boolean anyMatch(List<Pattern> patterns, String name) {
    for (Pattern pattern : patterns) {
      if (pattern.matcher(name).find()) {
        return true;
      }
    }
    return false;
  }

  public static class Builder {
    private final Set<Integer> includePids = new HashSet<>();
    private final Set<Integer> excludePids = new HashSet<>();
    private final Set<Integer> includeTids = new HashSet<>();
    private final Set<Integer> excludeTids = new HashSet<>();
    private final List<Pattern> includeProcessNames = new ArrayList<>();
    private final List<Pattern> excludeProcessNames = new ArrayList<>();
    private final List<Pattern> includeThreadNames = new ArrayList<>();
    private final List<Pattern> excludeThreadNames = new ArrayList<>();
    private Long globalBegin;
    private Long globalEnd;

    private Builder() {
    }

    public Builder includePids(Collection<Integer> pids) {
      includePids.addAll(pids);
      return this;
    }

    public Builder excludePids(Collection<Integer> pids) {
      excludePids.addAll(pids);
      return this;
    }

    public Builder includeTids(Collection<Integer> tids) {
      includeTids.addAll(tids);
      return this;
    }

    public Builder excludeTids(Collection<Integer> tids) {
      excludeTids.addAll(tids);
      return this;
    }

    public Builder includeProcessName(String regex) {
      includeProcessNames.add(compile(regex, "include-process-name"));
      return this;
    }

    public Builder excludeProcessName(String regex) {
      excludeProcessNames.add(compile(regex, "exclude-process-name"));
      return this;
    }

    public Builder includeThreadName(String regex) {
      includeThreadNames.add(compile(regex, "include-thread-name"));
      return this;
    }

    public Builder excludeThreadName(String regex) {
      excludeThreadNames.add(compile(regex, "exclude-thread-name"));
      return this;
    }

    public Builder globalBegin(long timestamp) {
      if (globalBegin != null) {
        throw new ConfigurationException("Global begin timestamp is already set to " + globalBegin);
      }
      globalBegin = timestamp;
      return this;
    }

    public Builder globalEnd(long timestamp) {
      if (globalEnd != null) {
        throw new ConfigurationException("Global end timestamp is already set to " + globalEnd);
      }
      globalEnd = timestamp;
      return this;
    }

    public SampleFilter build() {
      if (globalBegin != null && globalEnd != null && globalBegin > globalEnd) {
        throw new ConfigurationException("Global begin " + globalBegin + " is after global end " + globalEnd);
      }
      return new SampleFilter(this);
    }

    private static Pattern compile(String regex, String rule) {
      try {
        return Pattern.compile(regex);
      } catch (PatternSyntaxException e) {
        throw new ConfigurationException("Invalid " + rule + " pattern: " + regex, e);
      }
    }
  }
}
