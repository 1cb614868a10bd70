package perf.report.aggregation.annotate;

import java.util.Optional;

/**
 * Restores original names of functions whose names were shrunk before capture.
 */
@FunctionalInterface
public interface DeobfuscationMap {
  DeobfuscationMap NONE = name -> Optional.empty();

  /**
   * @return original name, empty if the map has no entry for this name
   */
  Optional<String> deobfuscate(String obfuscatedName);
}
