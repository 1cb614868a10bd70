package perf.report.aggregation;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.SharedMetricRegistries;
import com.google.common.collect.Iterables;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import perf.report.aggregation.annotate.AddressResolver;
import perf.report.aggregation.annotate.AnnotationMerger;
import perf.report.aggregation.annotate.DeobfuscationMap;
import perf.report.aggregation.callgraph.InterpreterFrameFilter;
import perf.report.aggregation.event.EventStreamMerger;
import perf.report.aggregation.event.TraceOffCpuMode;
import perf.report.aggregation.filter.SampleFilter;
import perf.report.aggregation.report.FinalizedReport;
import perf.report.aggregation.report.ReportAssembler;
import perf.report.aggregation.thread.ThreadGrouping;
import perf.report.common.exception.ConfigurationException;
import perf.report.common.sample.Frame;
import perf.report.common.sample.Sample;
import perf.report.common.sample.SampleSource;
import perf.report.common.symbol.FunctionSymbol;
import perf.report.common.symbol.SymbolTable;
import perf.report.metrics.MetricName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs the whole pipeline for a set of captures: symbol merge, parallel load and filter, sequential aggregation in
 * capture order, annotation and assembly.
 */
public class ReportGenerator {
  private static final Logger logger = LoggerFactory.getLogger(ReportGenerator.class);

  private final ReportOptions options;
  private final SampleFilter filter;
  private final AddressResolver addressResolver;
  private final DeobfuscationMap deobfuscationMap;

  private final MetricRegistry metricRegistry = SharedMetricRegistries.getOrCreate(ReportOptions.METRIC_REGISTRY);
  private final Meter mtrLoadComplete = metricRegistry.meter(MetricName.Capture_Load_Complete.get());
  private final Meter mtrLoadFailure = metricRegistry.meter(MetricName.Capture_Load_Failure.get());
  private final Meter mtrAdmitted = metricRegistry.meter(MetricName.Sample_Admitted.get());
  private final Meter mtrRejected = metricRegistry.meter(MetricName.Sample_Rejected.get());

  public ReportGenerator(ReportOptions options, SampleFilter filter,
                         AddressResolver addressResolver, DeobfuscationMap deobfuscationMap) {
    this.options = options;
    this.filter = filter;
    this.addressResolver = addressResolver;
    this.deobfuscationMap = deobfuscationMap;
  }

  /**
   * @throws ConfigurationException if captures disagree on their symbols or have frames inconsistent with them
   * @throws IOException if any capture cannot be read
   */
  public FinalizedReport generate(List<? extends SampleSource> sources) throws IOException {
    SymbolTable symbols = mergeSymbols(sources);
    List<List<Sample>> admitted = loadAll(sources, symbols);

    long admittedCount = 0;
    boolean offCpuSeen = false;
    for (List<Sample> samples : admitted) {
      admittedCount += samples.size();
      for (Sample sample : samples) {
        offCpuSeen |= sample.isOffCpu();
      }
    }

    EventStreamMerger merger = selectMerger(symbols, offCpuSeen);
    InterpreterFrameFilter frameFilter = options.isShowInterpreterFrames()
        ? InterpreterFrameFilter.showAll()
        : InterpreterFrameFilter.hiding(options.getInterpreterLibraries(), symbols);

    List<String> captureNames = new ArrayList<>(sources.size());
    for (SampleSource source : sources) {
      captureNames.add(source.getName());
    }

    try (AnnotationMerger annotationMerger = new AnnotationMerger(addressResolver, deobfuscationMap,
        options.isAddSourceCode(), options.isAddDisassembly(), options.getAnnotationCacheSize())) {
      ThreadGrouping.Mapper threadMapper = options.getThreadGrouping()
          .bind(symbols, Iterables.filter(Iterables.concat(admitted), sample -> merger.assign(sample) != null));
      SampleAggregator aggregator = new SampleAggregator(merger, threadMapper, frameFilter,
          annotationMerger.isAddressTrackingNeeded());
      for (List<Sample> samples : admitted) {
        for (Sample sample : samples) {
          aggregator.aggregate(sample);
        }
      }
      AggregatedSamples aggregated = aggregator.finalizeEntity();
      logger.info("Aggregated " + aggregated.getSampleCount() + " of " + admittedCount + " admitted samples from "
          + sources.size() + " captures into " + aggregated.getEvents().size() + " events");

      return new ReportAssembler(symbols, annotationMerger, options.getMinFuncPercent())
          .assemble(aggregated, captureNames, admittedCount);
    }
  }

  private EventStreamMerger selectMerger(SymbolTable symbols, boolean offCpuSeen) {
    if (options.getTraceOffCpuMode() != null) {
      return EventStreamMerger.forMode(options.getTraceOffCpuMode(), symbols);
    }
    if (offCpuSeen) {
      logger.info("Captures contain off-cpu samples, reporting them mixed with on-cpu samples");
      return EventStreamMerger.forMode(TraceOffCpuMode.MIXED_ON_OFF_CPU, symbols);
    }
    return EventStreamMerger.perEventType(symbols);
  }

  /**
   * Merges the symbols of every source, in order, into one validated table.
   *
   * @throws ConfigurationException if a source redefines an id with different content
   */
  public static SymbolTable mergeSymbols(List<? extends SampleSource> sources) throws IOException {
    SymbolTable symbols = new SymbolTable();
    for (SampleSource source : sources) {
      try {
        symbols.mergeFrom(source.getSymbols());
      } catch (ConfigurationException e) {
        throw new ConfigurationException("Capture " + source.getName() + " is inconsistent with earlier captures: "
            + e.getMessage(), e);
      }
    }
    symbols.validate();
    return symbols;
  }

  private List<List<Sample>> loadAll(List<? extends SampleSource> sources, SymbolTable symbols) throws IOException {
    if (sources.isEmpty()) {
      return new ArrayList<>();
    }
    int threads = options.getLoaderThreads() > 0
        ? options.getLoaderThreads()
        : Math.min(sources.size(), Runtime.getRuntime().availableProcessors());
    ExecutorService loaderPool = Executors.newFixedThreadPool(threads,
        new ThreadFactoryBuilder().setNameFormat("capture-loader-%d").setDaemon(true).build());
    try {
      List<Future<List<Sample>>> loads = new ArrayList<>(sources.size());
      for (SampleSource source : sources) {
        loads.add(loaderPool.submit(() -> load(source, symbols)));
      }

      List<List<Sample>> result = new ArrayList<>(sources.size());
      for (int i = 0; i < loads.size(); i++) {
        result.add(await(loads.get(i), sources.get(i)));
      }
      return result;
    } finally {
      loaderPool.shutdownNow();
    }
  }

  private List<Sample> load(SampleSource source, SymbolTable symbols) throws IOException {
    List<Sample> admitted = new ArrayList<>();
    source.readSamples(sample -> {
      for (Frame frame : sample.getCallChain()) {
        FunctionSymbol function = symbols.getFunction(frame.getFunctionId());
        if (function == null) {
          throw new ConfigurationException("Capture " + source.getName() + " has a sample referring to undefined function id "
              + frame.getFunctionId() + ": " + sample);
        }
        if (function.getLibId() != frame.getLibId()) {
          throw new ConfigurationException("Capture " + source.getName() + " has a frame of function " + function
              + " under library id " + frame.getLibId() + ", but the function is defined in library id "
              + function.getLibId() + ": " + sample);
        }
      }
      if (filter.admit(sample, symbols)) {
        mtrAdmitted.mark();
        admitted.add(sample);
      } else {
        mtrRejected.mark();
      }
    });
    if (logger.isDebugEnabled()) {
      logger.debug("Loaded " + admitted.size() + " admitted samples from " + source.getName());
    }
    return admitted;
  }

  private List<Sample> await(Future<List<Sample>> load, SampleSource source) throws IOException {
    try {
      List<Sample> samples = load.get();
      mtrLoadComplete.mark();
      return samples;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      mtrLoadFailure.mark();
      throw new IOException("Interrupted while loading capture " + source.getName(), e);
    } catch (ExecutionException e) {
      mtrLoadFailure.mark();
      Throwable cause = e.getCause();
      if (cause instanceof IOException) {
        throw (IOException) cause;
      }
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      throw new IOException("Failed to load capture " + source.getName(), cause);
    }
  }
}
