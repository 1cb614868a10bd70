package perf.report.aggregation.annotate;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.SharedMetricRegistries;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import perf.report.aggregation.ReportOptions;
import perf.report.common.symbol.FunctionSymbol;
import perf.report.metrics.MetricName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Attaches display names, source line hits and disassembly to the functions of a report.
 * <p>
 * Owns the resolution caches of one report run: resolutions are cached per (library, address) and disassembly per
 * function until {@link #close()}. Every resolver failure is downgraded to a miss.
 */
public class AnnotationMerger implements Closeable {
  private static final Logger logger = LoggerFactory.getLogger(AnnotationMerger.class);

  private static final Comparator<SourceLine> LINE_ORDER =
      Comparator.comparing(SourceLine::getPath).thenComparingInt(SourceLine::getLine);

  private final AddressResolver resolver;
  private final DeobfuscationMap deobfuscationMap;
  private final boolean addSourceCode;
  private final boolean addDisassembly;

  private final LoadingCache<AddressKey, Optional<SourceLine>> lineCache;
  private final LoadingCache<FunctionSymbol, Optional<List<DisassemblyLine>>> disassemblyCache;
  private final Map<Integer, String> displayNames = new HashMap<>();

  private final MetricRegistry metricRegistry = SharedMetricRegistries.getOrCreate(ReportOptions.METRIC_REGISTRY);
  private final Meter mtrLineMiss = metricRegistry.meter(MetricName.Annotation_Line_Miss.get());
  private final Meter mtrDisassemblyMiss = metricRegistry.meter(MetricName.Annotation_Disassembly_Miss.get());
  private final Meter mtrResolverFailure = metricRegistry.meter(MetricName.Annotation_Resolver_Failure.get());
  private final Meter mtrDeobfuscated = metricRegistry.meter(MetricName.Annotation_Deobfuscated.get());

  public AnnotationMerger(AddressResolver resolver, DeobfuscationMap deobfuscationMap,
                          boolean addSourceCode, boolean addDisassembly, long cacheSize) {
    this.resolver = Objects.requireNonNull(resolver);
    this.deobfuscationMap = Objects.requireNonNull(deobfuscationMap);
    this.addSourceCode = addSourceCode;
    this.addDisassembly = addDisassembly;
    this.lineCache = CacheBuilder.newBuilder()
        .maximumSize(cacheSize)
        .build(CacheLoader.<AddressKey, Optional<SourceLine>>from(this::resolveSourceLine));
    this.disassemblyCache = CacheBuilder.newBuilder()
        .maximumSize(cacheSize)
        .build(CacheLoader.<FunctionSymbol, Optional<List<DisassemblyLine>>>from(this::disassemble));
  }

  public boolean isAddressTrackingNeeded() {
    return addSourceCode || addDisassembly;
  }

  /**
   * Name shown for the function. Deobfuscation only ever changes this name, never the function id.
   */
  public String getDisplayName(FunctionSymbol function) {
    return displayNames.computeIfAbsent(function.getId(), id -> {
      Optional<String> original = deobfuscationMap.deobfuscate(function.getName());
      if (original.isPresent()) {
        mtrDeobfuscated.mark();
        return original.get();
      }
      return function.getName();
    });
  }

  /**
   * @param addressHits address -> {eventCount, subtreeEventCount} of the function within one thread
   */
  public FunctionAnnotation annotate(FunctionSymbol function, SortedMap<Long, long[]> addressHits) {
    if (addressHits.isEmpty() || !isAddressTrackingNeeded()) {
      return FunctionAnnotation.EMPTY;
    }

    List<LineHit> lineHits = Collections.emptyList();
    if (addSourceCode) {
      SortedMap<SourceLine, LineHit> byLine = new TreeMap<>(LINE_ORDER);
      for (Map.Entry<Long, long[]> hit : addressHits.entrySet()) {
        Optional<SourceLine> sourceLine = lineCache.getUnchecked(new AddressKey(function.getLibId(), hit.getKey()));
        if (sourceLine.isPresent()) {
          long[] counts = hit.getValue();
          byLine.merge(sourceLine.get(), new LineHit(sourceLine.get(), counts[0], counts[1]),
              (existing, added) -> existing.plus(added.getEventCount(), added.getSubtreeEventCount()));
        }
      }
      lineHits = new ArrayList<>(byLine.values());
    }

    List<AddressHit> hits = Collections.emptyList();
    List<DisassemblyLine> disassembly = getDisassembly(function);
    if (!disassembly.isEmpty()) {
      Set<Long> instructionAddresses = new HashSet<>();
      for (DisassemblyLine line : disassembly) {
        instructionAddresses.add(line.getAddress());
      }
      hits = new ArrayList<>(addressHits.size());
      for (Map.Entry<Long, long[]> hit : addressHits.entrySet()) {
        if (instructionAddresses.contains(hit.getKey())) {
          hits.add(new AddressHit(hit.getKey(), hit.getValue()[0], hit.getValue()[1]));
        }
      }
    }

    return new FunctionAnnotation(lineHits, hits);
  }

  /**
   * @return disassembly of the function, empty when disassembly is off or no artifact covers the function
   */
  public List<DisassemblyLine> getDisassembly(FunctionSymbol function) {
    if (!addDisassembly) {
      return Collections.emptyList();
    }
    return disassemblyCache.getUnchecked(function).orElse(Collections.emptyList());
  }

  @Override
  public void close() {
    lineCache.invalidateAll();
    disassemblyCache.invalidateAll();
    displayNames.clear();
  }

  private Optional<SourceLine> resolveSourceLine(AddressKey key) {
    try {
      Optional<SourceLine> result = Objects.requireNonNull(resolver.resolveSourceLine(key.libId, key.address));
      if (!result.isPresent()) {
        mtrLineMiss.mark();
      }
      return result;
    } catch (RuntimeException e) {
      mtrResolverFailure.mark();
      mtrLineMiss.mark();
      logger.debug("Source line resolution failed for lib " + key.libId + " at 0x" + Long.toHexString(key.address), e);
      return Optional.empty();
    }
  }

  private Optional<List<DisassemblyLine>> disassemble(FunctionSymbol function) {
    try {
      Optional<List<DisassemblyLine>> result = Objects.requireNonNull(resolver.disassemble(function.getLibId(), function));
      if (!result.isPresent() || result.get().isEmpty()) {
        mtrDisassemblyMiss.mark();
        return Optional.empty();
      }
      return Optional.of(Collections.unmodifiableList(new ArrayList<>(result.get())));
    } catch (RuntimeException e) {
      mtrResolverFailure.mark();
      mtrDisassemblyMiss.mark();
      logger.debug("Disassembly failed for function " + function, e);
      return Optional.empty();
    }
  }

  private static final class AddressKey {
    private final int libId;
    private final long address;

    private AddressKey(int libId, long address) {
      this.libId = libId;
      this.address = address;
    }

    @Override
    public boolean equals(Object o) {
      if (o == this) {
        return true;
      }
      if (!(o instanceof AddressKey)) {
        return false;
      }
      AddressKey other = (AddressKey) o;
      return this.libId == other.libId && this.address == other.address;
    }

    @Override
    public int hashCode() {
      return 31 * libId + Long.hashCode(address);
    }
  }
}
