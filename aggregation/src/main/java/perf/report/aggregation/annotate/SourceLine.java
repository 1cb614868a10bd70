package perf.report.aggregation.annotate;

import java.util.Objects;

/**
 * A resolved source position. Text is the content of the line, null when the source file could not be found.
 */
public final class SourceLine {
  private final String path;
  private final int line;
  private final String text;

  public SourceLine(String path, int line, String text) {
    this.path = Objects.requireNonNull(path);
    this.line = line;
    this.text = text;
  }

  public String getPath() {
    return path;
  }

  public int getLine() {
    return line;
  }

  public String getText() {
    return text;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof SourceLine)) {
      return false;
    }

    SourceLine other = (SourceLine) o;
    return this.line == other.line
        && this.path.equals(other.path)
        && Objects.equals(this.text, other.text);
  }

  @Override
  public int hashCode() {
    return Objects.hash(path, line, text);
  }

  @Override
  public String toString() {
    return path + ":" + line;
  }
}
