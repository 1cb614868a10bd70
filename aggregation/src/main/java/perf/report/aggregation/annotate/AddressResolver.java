package perf.report.aggregation.annotate;

import perf.report.common.symbol.FunctionSymbol;

import java.util.List;
import java.util.Optional;

/**
 * Maps library addresses to source lines and functions to their disassembly, typically backed by a binary cache
 * built ahead of the report run. Misses are expressed as empty results, never as exceptions.
 */
public interface AddressResolver {
  AddressResolver NONE = new AddressResolver() {
    @Override
    public Optional<SourceLine> resolveSourceLine(int libId, long address) {
      return Optional.empty();
    }

    @Override
    public Optional<List<DisassemblyLine>> disassemble(int libId, FunctionSymbol function) {
      return Optional.empty();
    }
  };

  Optional<SourceLine> resolveSourceLine(int libId, long address);

  /**
   * @return instructions of the function in address order, empty if no binary artifact is available for it
   */
  Optional<List<DisassemblyLine>> disassemble(int libId, FunctionSymbol function);
}
