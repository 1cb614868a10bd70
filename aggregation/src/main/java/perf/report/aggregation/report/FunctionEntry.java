package perf.report.aggregation.report;

import perf.report.aggregation.annotate.DisassemblyLine;

import java.util.Collections;
import java.util.List;

/**
 * Function table entry of the report.
 */
public class FunctionEntry {
  private final int libIndex;
  private final String name;
  private final List<DisassemblyLine> disassembly;

  public FunctionEntry(int libIndex, String name, List<DisassemblyLine> disassembly) {
    this.libIndex = libIndex;
    this.name = name;
    this.disassembly = Collections.unmodifiableList(disassembly);
  }

  public int getLibIndex() {
    return libIndex;
  }

  /**
   * Display name, deobfuscated where a mapping exists.
   */
  public String getName() {
    return name;
  }

  /**
   * Empty unless disassembly was requested and found.
   */
  public List<DisassemblyLine> getDisassembly() {
    return disassembly;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof FunctionEntry)) {
      return false;
    }

    FunctionEntry other = (FunctionEntry) o;
    return this.libIndex == other.libIndex
        && this.name.equals(other.name)
        && this.disassembly.equals(other.disassembly);
  }

  @Override
  public int hashCode() {
    return 31 * libIndex + name.hashCode();
  }

  @Override
  public String toString() {
    return name + "@" + libIndex;
  }
}
