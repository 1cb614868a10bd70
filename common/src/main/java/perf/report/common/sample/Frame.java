package perf.report.common.sample;

/**
 * One stack frame of a sample's call chain. Library and function are references into the capture's
 * {@link perf.report.common.symbol.SymbolTable}.
 */
public final class Frame {
  private final int libId;
  private final int functionId;
  private final long address;

  public Frame(int libId, int functionId, long address) {
    this.libId = libId;
    this.functionId = functionId;
    this.address = address;
  }

  public int getLibId() {
    return libId;
  }

  public int getFunctionId() {
    return functionId;
  }

  /**
   * Address of the frame relative to the library file, as understood by the address resolver.
   */
  public long getAddress() {
    return address;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof Frame)) {
      return false;
    }

    Frame other = (Frame) o;
    return this.libId == other.libId
        && this.functionId == other.functionId
        && this.address == other.address;
  }

  @Override
  public int hashCode() {
    final int PRIME = 31;
    int result = 1;
    result = result * PRIME + libId;
    result = result * PRIME + functionId;
    result = result * PRIME + Long.hashCode(address);
    return result;
  }

  @Override
  public String toString() {
    return "lib=" + libId + ", fn=" + functionId + ", addr=0x" + Long.toHexString(address);
  }
}
