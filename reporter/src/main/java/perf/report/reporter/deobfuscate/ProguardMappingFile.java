package perf.report.reporter.deobfuscate;

import com.google.common.base.Splitter;
import perf.report.aggregation.annotate.DeobfuscationMap;
import perf.report.common.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deobfuscation map read from a ProGuard/R8 mapping file:
 * <pre>
 * com.example.Worker -> a.b:
 *     int count -> a
 *     1:4:void run(java.lang.String):12:15 -> c
 * </pre>
 * Function names are looked up as {@code obfClass.obfMethod}, optionally followed by an argument list which is kept
 * as is. A method the mapping does not list still gets its class name restored.
 */
public class ProguardMappingFile implements DeobfuscationMap {
    private static final Logger logger = LoggerFactory.getLogger(ProguardMappingFile.class);

    private static final Pattern CLASS_LINE = Pattern.compile("^(\\S+) -> (\\S+):$");
    private static final Pattern METHOD_LINE = Pattern.compile("^(?:\\d+:\\d+:)?\\S+ (\\S+)\\(.*\\)(?::\\d+(?::\\d+)?)?$");
    private static final Splitter ARROW = Splitter.on(" -> ").trimResults();

    /**
     * obfuscated class name -> its mapping
     */
    private final Map<String, ClassMapping> classes;

    private ProguardMappingFile(Map<String, ClassMapping> classes) {
        this.classes = classes;
    }

    public static ProguardMappingFile load(Path mappingFile) {
        try (Reader reader = Files.newBufferedReader(mappingFile, StandardCharsets.UTF_8)) {
            return parse(reader, mappingFile.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Could not read proguard mapping file " + mappingFile, e);
        }
    }

    public static ProguardMappingFile parse(Reader reader, String sourceName) throws IOException {
        BufferedReader in = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        Map<String, ClassMapping> classes = new HashMap<>();
        ClassMapping current = null;
        int methods = 0;
        String line;
        int lineNo = 0;
        while ((line = in.readLine()) != null) {
            lineNo++;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }

            if (!Character.isWhitespace(line.charAt(0))) {
                Matcher matcher = CLASS_LINE.matcher(trimmed);
                if (!matcher.matches()) {
                    throw error(sourceName, lineNo, "expected '<class> -> <obfuscated class>:' but found '" + trimmed + "'");
                }
                current = new ClassMapping(matcher.group(1));
                classes.put(matcher.group(2), current);
                continue;
            }

            if (current == null) {
                throw error(sourceName, lineNo, "member line outside of a class");
            }
            List<String> sides = ARROW.splitToList(trimmed);
            if (sides.size() != 2) {
                throw error(sourceName, lineNo, "expected '<member> -> <obfuscated name>' but found '" + trimmed + "'");
            }
            Matcher method = METHOD_LINE.matcher(sides.get(0));
            if (method.matches()) {
                // overloads sharing an obfuscated name keep the first original name
                current.methods.putIfAbsent(sides.get(1), method.group(1));
                methods++;
            }
        }
        logger.info("Loaded " + classes.size() + " classes and " + methods + " methods from proguard mapping " + sourceName);
        return new ProguardMappingFile(classes);
    }

    @Override
    public Optional<String> deobfuscate(String obfuscatedName) {
        int argsStart = obfuscatedName.indexOf('(');
        String qualifiedName = argsStart < 0 ? obfuscatedName : obfuscatedName.substring(0, argsStart);
        String args = argsStart < 0 ? "" : obfuscatedName.substring(argsStart);

        int methodStart = qualifiedName.lastIndexOf('.');
        if (methodStart <= 0) {
            return Optional.empty();
        }
        ClassMapping mapping = classes.get(qualifiedName.substring(0, methodStart));
        if (mapping == null) {
            return Optional.empty();
        }
        String method = qualifiedName.substring(methodStart + 1);
        String originalMethod = mapping.methods.getOrDefault(method, method);
        return Optional.of(mapping.originalName + "." + originalMethod + args);
    }

    public int getClassCount() {
        return classes.size();
    }

    private static ConfigurationException error(String sourceName, int lineNo, String message) {
        return new ConfigurationException("Malformed proguard mapping " + sourceName + " line " + lineNo + ": " + message);
    }

    private static class ClassMapping {
        private final String originalName;
        private final Map<String, String> methods = new HashMap<>();

        private ClassMapping(String originalName) {
            this.originalName = originalName;
        }
    }
}
