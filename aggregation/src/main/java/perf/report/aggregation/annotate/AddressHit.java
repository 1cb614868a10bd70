package perf.report.aggregation.annotate;

public final class AddressHit {
  private final long address;
  private final long eventCount;
  private final long subtreeEventCount;

  public AddressHit(long address, long eventCount, long subtreeEventCount) {
    this.address = address;
    this.eventCount = eventCount;
    this.subtreeEventCount = subtreeEventCount;
  }

  public long getAddress() {
    return address;
  }

  public long getEventCount() {
    return eventCount;
  }

  public long getSubtreeEventCount() {
    return subtreeEventCount;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof AddressHit)) {
      return false;
    }

    AddressHit other = (AddressHit) o;
    return this.address == other.address
        && this.eventCount == other.eventCount
        && this.subtreeEventCount == other.subtreeEventCount;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(address) * 31 + Long.hashCode(subtreeEventCount);
  }

  @Override
  public String toString() {
    return "0x" + Long.toHexString(address) + "[" + eventCount + "/" + subtreeEventCount + "]";
  }
}
