package perf.report.reporter.annotate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import perf.report.aggregation.annotate.AddressResolver;
import perf.report.aggregation.annotate.DisassemblyLine;
import perf.report.aggregation.annotate.SourceLine;
import perf.report.common.exception.ConfigurationException;
import perf.report.common.symbol.FunctionSymbol;
import perf.report.common.symbol.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Address resolver backed by an annotations index inside a binary cache directory:
 * <pre>
 * {@code
 * {"libraries": {"/system/lib64/libc.so": {
 *     "lines": [[4096, "bionic/libc/bionic/libc_init_dynamic.cpp", 120]],
 *     "functions": {"__libc_init": [["stp x29, x30, [sp, #-16]!", 4096]]}}}}
 * }
 * </pre>
 * A line entry covers every address from its own up to the next entry of the library. Libraries are matched by the
 * name the capture gives them.
 */
public class BinaryCacheAddressResolver implements AddressResolver {
    private static final Logger logger = LoggerFactory.getLogger(BinaryCacheAddressResolver.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    private final SymbolTable symbols;
    private final SourceFileFinder sourceFileFinder;
    private final Map<String, LibraryIndex> libraries;

    BinaryCacheAddressResolver(SymbolTable symbols, SourceFileFinder sourceFileFinder, Map<String, LibraryIndex> libraries) {
        this.symbols = symbols;
        this.sourceFileFinder = sourceFileFinder;
        this.libraries = libraries;
    }

    /**
     * @param symbols merged symbols of the captures being reported, used to name libraries
     */
    public static BinaryCacheAddressResolver load(Path annotationsFile, SymbolTable symbols,
                                                  SourceFileFinder sourceFileFinder) throws IOException {
        if (!Files.isRegularFile(annotationsFile)) {
            throw new ConfigurationException("Binary cache has no annotations index at " + annotationsFile);
        }
        JsonNode root = mapper.readTree(annotationsFile.toFile());
        JsonNode libs = root == null ? null : root.get("libraries");
        if (libs == null || !libs.isObject()) {
            throw new ConfigurationException("Annotations index " + annotationsFile + " has no libraries object");
        }

        Map<String, LibraryIndex> libraries = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = libs.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> lib = fields.next();
            libraries.put(lib.getKey(), LibraryIndex.parse(lib.getKey(), lib.getValue()));
        }
        logger.info("Loaded annotations of " + libraries.size() + " libraries from " + annotationsFile);
        return new BinaryCacheAddressResolver(symbols, sourceFileFinder, libraries);
    }

    @Override
    public Optional<SourceLine> resolveSourceLine(int libId, long address) {
        LibraryIndex lib = library(libId);
        if (lib == null) {
            return Optional.empty();
        }
        Map.Entry<Long, LineEntry> entry = lib.lines.floorEntry(address);
        if (entry == null) {
            return Optional.empty();
        }
        LineEntry line = entry.getValue();
        String text = sourceFileFinder.readLine(line.path, line.line).orElse(null);
        return Optional.of(new SourceLine(line.path, line.line, text));
    }

    @Override
    public Optional<List<DisassemblyLine>> disassemble(int libId, FunctionSymbol function) {
        LibraryIndex lib = library(libId);
        if (lib == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(lib.functions.get(function.getName()));
    }

    private LibraryIndex library(int libId) {
        String name = symbols.getLibraryName(libId);
        return name == null ? null : libraries.get(name);
    }

    static class LibraryIndex {
        private final NavigableMap<Long, LineEntry> lines = new TreeMap<>();
        private final Map<String, List<DisassemblyLine>> functions = new HashMap<>();

        static LibraryIndex parse(String libName, JsonNode node) {
            LibraryIndex index = new LibraryIndex();
            JsonNode lines = node.path("lines");
            for (JsonNode line : lines) {
                if (!line.isArray() || line.size() != 3) {
                    throw new ConfigurationException("Bad line entry " + line + " of library " + libName);
                }
                index.lines.put(line.get(0).asLong(), new LineEntry(line.get(1).asText(), line.get(2).asInt()));
            }
            Iterator<Map.Entry<String, JsonNode>> functions = node.path("functions").fields();
            while (functions.hasNext()) {
                Map.Entry<String, JsonNode> function = functions.next();
                List<DisassemblyLine> instructions = new ArrayList<>(function.getValue().size());
                for (JsonNode instruction : function.getValue()) {
                    if (!instruction.isArray() || instruction.size() != 2) {
                        throw new ConfigurationException("Bad instruction " + instruction + " of " + function.getKey());
                    }
                    instructions.add(new DisassemblyLine(instruction.get(0).asText(), instruction.get(1).asLong()));
                }
                instructions.sort((a, b) -> Long.compare(a.getAddress(), b.getAddress()));
                index.functions.put(function.getKey(), Collections.unmodifiableList(instructions));
            }
            return index;
        }
    }

    private static class LineEntry {
        private final String path;
        private final int line;

        private LineEntry(String path, int line) {
            this.path = path;
            this.line = line;
        }
    }
}
