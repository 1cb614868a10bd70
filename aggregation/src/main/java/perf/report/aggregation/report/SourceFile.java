package perf.report.aggregation.report;

import java.util.Collections;
import java.util.SortedMap;

public class SourceFile {
  private final String path;

  /**
   * line -> text, only for annotated lines. Text is null when the file was not found in any source directory.
   */
  private final SortedMap<Integer, String> code;

  public SourceFile(String path, SortedMap<Integer, String> code) {
    this.path = path;
    this.code = Collections.unmodifiableSortedMap(code);
  }

  public String getPath() {
    return path;
  }

  public SortedMap<Integer, String> getCode() {
    return code;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof SourceFile)) {
      return false;
    }

    SourceFile other = (SourceFile) o;
    return this.path.equals(other.path)
        && this.code.equals(other.code);
  }

  @Override
  public int hashCode() {
    return path.hashCode();
  }
}
