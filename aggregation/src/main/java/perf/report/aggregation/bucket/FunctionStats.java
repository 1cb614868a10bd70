package perf.report.aggregation.bucket;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Per thread statistics of one function. A sample counts at most once towards a function's subtree count, even if
 * the function appears several times in its chain.
 */
public class FunctionStats {
  private final int functionId;
  private final int libId;
  private long sampleCount = 0;
  private long eventCount = 0;
  private long subtreeEventCount = 0;

  /**
   * address -> {eventCount, subtreeEventCount}, null unless address tracking is on
   */
  private SortedMap<Long, long[]> addressHits = null;

  public FunctionStats(int functionId, int libId) {
    this.functionId = functionId;
    this.libId = libId;
  }

  void addHit(long weight, boolean leaf) {
    subtreeEventCount += weight;
    if (leaf) {
      eventCount += weight;
      sampleCount++;
    }
  }

  void addAddressHit(long address, long eventCount, long subtreeEventCount) {
    if (addressHits == null) {
      addressHits = new TreeMap<>();
    }
    long[] counts = addressHits.computeIfAbsent(address, a -> new long[2]);
    counts[0] += eventCount;
    counts[1] += subtreeEventCount;
  }

  public int getFunctionId() {
    return functionId;
  }

  public int getLibId() {
    return libId;
  }

  /**
   * Number of samples in which this function was the leaf frame.
   */
  public long getSampleCount() {
    return sampleCount;
  }

  public long getEventCount() {
    return eventCount;
  }

  public long getSubtreeEventCount() {
    return subtreeEventCount;
  }

  /**
   * @return address -> {eventCount, subtreeEventCount} in address order, empty if addresses were not tracked
   */
  public SortedMap<Long, long[]> getAddressHits() {
    return addressHits == null ? Collections.emptySortedMap() : Collections.unmodifiableSortedMap(addressHits);
  }
}
