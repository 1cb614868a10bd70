package perf.report.aggregation.report;

import java.util.Collections;
import java.util.List;

public class FinalizedLibrary {
  /**
   * Index into {@link FinalizedReport#getLibList()}.
   */
  private final int libIndex;
  private final List<FinalizedFunction> functions;

  public FinalizedLibrary(int libIndex, List<FinalizedFunction> functions) {
    this.libIndex = libIndex;
    this.functions = Collections.unmodifiableList(functions);
  }

  public int getLibIndex() {
    return libIndex;
  }

  public List<FinalizedFunction> getFunctions() {
    return functions;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof FinalizedLibrary)) {
      return false;
    }

    FinalizedLibrary other = (FinalizedLibrary) o;
    return this.libIndex == other.libIndex
        && this.functions.equals(other.functions);
  }

  @Override
  public int hashCode() {
    return 31 * libIndex + functions.size();
  }
}
