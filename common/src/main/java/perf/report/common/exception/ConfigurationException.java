package perf.report.common.exception;

/**
 * Raised for invalid report configuration or inconsistent input captures. Always detected before any sample is
 * aggregated.
 */
public class ConfigurationException extends RuntimeException {
  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
