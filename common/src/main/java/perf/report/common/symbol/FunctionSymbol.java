package perf.report.common.symbol;

import java.util.Objects;

public final class FunctionSymbol {
  private final int id;
  private final int libId;
  private final String name;

  public FunctionSymbol(int id, int libId, String name) {
    this.id = id;
    this.libId = libId;
    this.name = Objects.requireNonNull(name);
  }

  public int getId() {
    return id;
  }

  public int getLibId() {
    return libId;
  }

  /**
   * Raw symbol name as captured, before any deobfuscation.
   */
  public String getName() {
    return name;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof FunctionSymbol)) {
      return false;
    }

    FunctionSymbol other = (FunctionSymbol) o;
    return this.id == other.id
        && this.libId == other.libId
        && this.name.equals(other.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, libId, name);
  }

  @Override
  public String toString() {
    return id + ":" + name + "@" + libId;
  }
}
