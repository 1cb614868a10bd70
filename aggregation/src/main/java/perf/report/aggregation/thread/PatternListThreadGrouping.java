package perf.report.aggregation.thread;

import com.google.common.collect.ImmutableList;
import perf.report.common.exception.ConfigurationException;
import perf.report.common.symbol.ThreadInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Labels a thread with the first pattern, in configured order, which matches its whole name. The pattern string
 * itself becomes the bucket name.
 */
class PatternListThreadGrouping extends LabelledThreadGrouping {
  private final List<Pattern> patterns;

  PatternListThreadGrouping(List<String> regexes) {
    List<Pattern> compiled = new ArrayList<>(regexes.size());
    for (String regex : regexes) {
      try {
        compiled.add(Pattern.compile(regex));
      } catch (PatternSyntaxException e) {
        throw new ConfigurationException("Invalid aggregate-threads pattern: " + regex, e);
      }
    }
    this.patterns = ImmutableList.copyOf(compiled);
  }

  @Override
  protected String labelOf(ThreadInfo thread) {
    for (Pattern pattern : patterns) {
      if (pattern.matcher(thread.getName()).matches()) {
        return pattern.pattern();
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return "by-patterns" + patterns;
  }
}
