package perf.report.aggregation.annotate;

import java.util.Objects;

public final class DisassemblyLine {
  private final String text;
  private final long address;

  public DisassemblyLine(String text, long address) {
    this.text = Objects.requireNonNull(text);
    this.address = address;
  }

  public String getText() {
    return text;
  }

  public long getAddress() {
    return address;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof DisassemblyLine)) {
      return false;
    }

    DisassemblyLine other = (DisassemblyLine) o;
    return this.address == other.address && this.text.equals(other.text);
  }

  @Override
  public int hashCode() {
    return Objects.hash(text, address);
  }

  @Override
  public String toString() {
    return "0x" + Long.toHexString(address) + ": " + text;
  }
}
