package perf.report.common.sample;

import perf.report.common.symbol.SymbolTable;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * A single input capture, already decoded into samples and id-keyed symbol tables.
 */
public interface SampleSource {

  /**
   * Human readable identity of the capture, usually its file path.
   */
  String getName();

  /**
   * Symbol tables of this capture. Must be available before {@link #readSamples(Consumer)} is called.
   */
  SymbolTable getSymbols() throws IOException;

  /**
   * Streams every sample of the capture, in capture order, to the consumer.
   */
  void readSamples(Consumer<Sample> consumer) throws IOException;
}
