package perf.report.aggregation;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import perf.report.aggregation.event.TraceOffCpuMode;
import perf.report.aggregation.thread.ThreadGrouping;

import java.util.Objects;
import java.util.Set;

/**
 * Options of one report run which are not sample filters.
 */
public class ReportOptions {
  public static final String METRIC_REGISTRY = "perf-report-metric-registry";

  public static final Set<String> DEFAULT_INTERPRETER_LIBRARIES = ImmutableSet.of("libart.so", "libartd.so");
  public static final double DEFAULT_MIN_FUNC_PERCENT = 0.01;
  public static final long DEFAULT_ANNOTATION_CACHE_SIZE = 100_000;

  private final TraceOffCpuMode traceOffCpuMode;
  private final ThreadGrouping threadGrouping;
  private final boolean showInterpreterFrames;
  private final Set<String> interpreterLibraries;
  private final double minFuncPercent;
  private final boolean addSourceCode;
  private final boolean addDisassembly;
  private final int loaderThreads;
  private final long annotationCacheSize;

  private ReportOptions(Builder builder) {
    this.traceOffCpuMode = builder.traceOffCpuMode;
    this.threadGrouping = builder.threadGrouping;
    this.showInterpreterFrames = builder.showInterpreterFrames;
    this.interpreterLibraries = ImmutableSet.copyOf(builder.interpreterLibraries);
    this.minFuncPercent = builder.minFuncPercent;
    this.addSourceCode = builder.addSourceCode;
    this.addDisassembly = builder.addDisassembly;
    this.loaderThreads = builder.loaderThreads;
    this.annotationCacheSize = builder.annotationCacheSize;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static ReportOptions defaults() {
    return newBuilder().build();
  }

  /**
   * @return selected mode, null to pick one from the samples seen
   */
  public TraceOffCpuMode getTraceOffCpuMode() {
    return traceOffCpuMode;
  }

  public ThreadGrouping getThreadGrouping() {
    return threadGrouping;
  }

  public boolean isShowInterpreterFrames() {
    return showInterpreterFrames;
  }

  public Set<String> getInterpreterLibraries() {
    return interpreterLibraries;
  }

  public double getMinFuncPercent() {
    return minFuncPercent;
  }

  public boolean isAddSourceCode() {
    return addSourceCode;
  }

  public boolean isAddDisassembly() {
    return addDisassembly;
  }

  /**
   * @return size of the capture loader pool, 0 to size it by the number of captures
   */
  public int getLoaderThreads() {
    return loaderThreads;
  }

  public long getAnnotationCacheSize() {
    return annotationCacheSize;
  }

  public static class Builder {
    private TraceOffCpuMode traceOffCpuMode = null;
    private ThreadGrouping threadGrouping = ThreadGrouping.identity();
    private boolean showInterpreterFrames = false;
    private Set<String> interpreterLibraries = DEFAULT_INTERPRETER_LIBRARIES;
    private double minFuncPercent = DEFAULT_MIN_FUNC_PERCENT;
    private boolean addSourceCode = false;
    private boolean addDisassembly = false;
    private int loaderThreads = 0;
    private long annotationCacheSize = DEFAULT_ANNOTATION_CACHE_SIZE;

    private Builder() {
    }

    public Builder traceOffCpuMode(TraceOffCpuMode traceOffCpuMode) {
      this.traceOffCpuMode = traceOffCpuMode;
      return this;
    }

    public Builder threadGrouping(ThreadGrouping threadGrouping) {
      this.threadGrouping = Objects.requireNonNull(threadGrouping);
      return this;
    }

    public Builder showInterpreterFrames(boolean showInterpreterFrames) {
      this.showInterpreterFrames = showInterpreterFrames;
      return this;
    }

    public Builder interpreterLibraries(Set<String> interpreterLibraries) {
      this.interpreterLibraries = Objects.requireNonNull(interpreterLibraries);
      return this;
    }

    public Builder minFuncPercent(double minFuncPercent) {
      Preconditions.checkArgument(minFuncPercent >= 0 && minFuncPercent <= 100,
          "min func percent must be within [0, 100], got %s", minFuncPercent);
      this.minFuncPercent = minFuncPercent;
      return this;
    }

    public Builder addSourceCode(boolean addSourceCode) {
      this.addSourceCode = addSourceCode;
      return this;
    }

    public Builder addDisassembly(boolean addDisassembly) {
      this.addDisassembly = addDisassembly;
      return this;
    }

    public Builder loaderThreads(int loaderThreads) {
      Preconditions.checkArgument(loaderThreads >= 0, "loader threads must not be negative, got %s", loaderThreads);
      this.loaderThreads = loaderThreads;
      return this;
    }

    public Builder annotationCacheSize(long annotationCacheSize) {
      Preconditions.checkArgument(annotationCacheSize > 0, "annotation cache size must be positive, got %s", annotationCacheSize);
      this.annotationCacheSize = annotationCacheSize;
      return this;
    }

    public ReportOptions build() {
      return new ReportOptions(this);
    }
  }
}
