package perf.report.aggregation.filter;

import com.google.common.base.Splitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import perf.report.common.exception.ConfigurationException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Parses a filter file into a {@link SampleFilter.Builder}. Recognized lines:
 * <pre>
 *   GLOBAL_BEGIN &lt;timestamp&gt;
 *   GLOBAL_END &lt;timestamp&gt;
 *   CLOCK &lt;clock name&gt;
 * </pre>
 * Blank lines and lines starting with '#' are skipped. Anything else is a {@link ConfigurationException}.
 */
public class FilterFileParser {
  private static final Logger logger = LoggerFactory.getLogger(FilterFileParser.class);
  private static final Splitter TOKENIZER = Splitter.on(' ').trimResults().omitEmptyStrings();

  private String clock;

  public void parse(Path filterFile, SampleFilter.Builder builder) {
    try (Reader reader = Files.newBufferedReader(filterFile, StandardCharsets.UTF_8)) {
      parse(reader, filterFile.toString(), builder);
    } catch (IOException e) {
      throw new ConfigurationException("Could not read filter file " + filterFile, e);
    }
  }

  public void parse(Reader reader, String sourceName, SampleFilter.Builder builder) throws IOException {
    BufferedReader in = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
    String line;
    int lineNo = 0;
    while ((line = in.readLine()) != null) {
      lineNo++;
      String trimmed = line.replace('\t', ' ').trim();
      if (trimmed.isEmpty() || trimmed.startsWith("#")) {
        continue;
      }
      List<String> tokens = TOKENIZER.splitToList(trimmed);
      if (tokens.size() != 2) {
        throw error(sourceName, lineNo, "expected '<KEYWORD> <value>' but found '" + trimmed + "'");
      }
      String keyword = tokens.get(0);
      String value = tokens.get(1);
      switch (keyword) {
        case "GLOBAL_BEGIN":
          long begin = parseTimestamp(value, sourceName, lineNo);
          apply(() -> builder.globalBegin(begin), sourceName, lineNo);
          break;
        case "GLOBAL_END":
          long end = parseTimestamp(value, sourceName, lineNo);
          apply(() -> builder.globalEnd(end), sourceName, lineNo);
          break;
        case "CLOCK":
          if (clock != null) {
            throw error(sourceName, lineNo, "CLOCK is already set to " + clock);
          }
          clock = value;
          break;
        default:
          throw error(sourceName, lineNo, "unknown keyword " + keyword);
      }
    }
    if (logger.isDebugEnabled()) {
      logger.debug("Parsed " + lineNo + " lines of filter file " + sourceName + (clock == null ? "" : ", clock=" + clock));
    }
  }

  /**
   * @return clock named by the last parsed filter file, null if none was named
   */
  public String getClock() {
    return clock;
  }

  private static void apply(Runnable builderUpdate, String sourceName, int lineNo) {
    try {
      builderUpdate.run();
    } catch (ConfigurationException e) {
      throw error(sourceName, lineNo, e.getMessage());
    }
  }

  private static long parseTimestamp(String value, String sourceName, int lineNo) {
    try {
      long timestamp = Long.parseLong(value);
      if (timestamp < 0) {
        throw error(sourceName, lineNo, "negative timestamp " + value);
      }
      return timestamp;
    } catch (NumberFormatException e) {
      throw new ConfigurationException(sourceName + ":" + lineNo + ": invalid timestamp " + value, e);
    }
  }

  private static ConfigurationException error(String sourceName, int lineNo, String message) {
    return new ConfigurationException(sourceName + ":" + lineNo + ": " + message);
  }
}
