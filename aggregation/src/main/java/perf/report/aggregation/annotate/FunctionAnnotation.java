package perf.report.aggregation.annotate;

import java.util.Collections;
import java.util.List;

public class FunctionAnnotation {
  public static final FunctionAnnotation EMPTY = new FunctionAnnotation(Collections.emptyList(), Collections.emptyList());

  private final List<LineHit> lineHits;
  private final List<AddressHit> addressHits;

  public FunctionAnnotation(List<LineHit> lineHits, List<AddressHit> addressHits) {
    this.lineHits = Collections.unmodifiableList(lineHits);
    this.addressHits = Collections.unmodifiableList(addressHits);
  }

  /**
   * Ordered by source path, then line.
   */
  public List<LineHit> getLineHits() {
    return lineHits;
  }

  /**
   * Ordered by address. Empty when the function has no disassembly.
   */
  public List<AddressHit> getAddressHits() {
    return addressHits;
  }
}
