package perf.report.metrics;

public class LibraryTag {
  private static final String prefix = "lib.";

  private final String value;

  public LibraryTag(final String libraryName) {
    this.value = prefix + Util.encodeTags(baseName(libraryName));
  }

  private static String baseName(String path) {
    int idx = path.lastIndexOf('/');
    return idx < 0 ? path : path.substring(idx + 1);
  }

  @Override
  public String toString() {
    return value;
  }
}
