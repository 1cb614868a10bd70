package perf.report.reporter.annotate;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.io.MoreFiles;
import com.google.common.util.concurrent.UncheckedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Finds the source file a debug-info path refers to inside a set of source directories: the path itself when it
 * exists, else the path relative to a source directory, else the indexed file sharing the longest path suffix.
 */
public class SourceFileFinder {
    private static final Logger logger = LoggerFactory.getLogger(SourceFileFinder.class);

    public static final SourceFileFinder NONE = new SourceFileFinder(Collections.emptyList(), Collections.emptyMap());

    private final List<Path> sourceDirs;

    /**
     * file name -> every indexed file carrying that name
     */
    private final Map<String, List<Path>> filesByName;

    private final Map<String, Optional<Path>> located = new HashMap<>();
    private final LoadingCache<Path, List<String>> fileLines = CacheBuilder.newBuilder()
        .maximumSize(256)
        .build(CacheLoader.<Path, List<String>>from(SourceFileFinder::readLines));

    private SourceFileFinder(List<Path> sourceDirs, Map<String, List<Path>> filesByName) {
        this.sourceDirs = sourceDirs;
        this.filesByName = filesByName;
    }

    public static SourceFileFinder index(List<Path> sourceDirs) throws IOException {
        Map<String, List<Path>> filesByName = new HashMap<>();
        for (Path dir : sourceDirs) {
            if (!Files.isDirectory(dir)) {
                logger.warn("Source directory " + dir + " does not exist, skipping it");
                continue;
            }
            try (Stream<Path> files = Files.walk(dir)) {
                files.filter(Files::isRegularFile)
                    .sorted()
                    .forEach(f -> filesByName.computeIfAbsent(f.getFileName().toString(), n -> new ArrayList<>()).add(f));
            }
        }
        logger.info("Indexed " + filesByName.values().stream().mapToInt(List::size).sum() + " source files");
        return new SourceFileFinder(new ArrayList<>(sourceDirs), filesByName);
    }

    public synchronized Optional<Path> locate(String path) {
        return located.computeIfAbsent(path, this::search);
    }

    /**
     * @return text of the 1-based line, empty when the file is not found or is shorter
     */
    public Optional<String> readLine(String path, int line) {
        Optional<Path> file = locate(path);
        if (!file.isPresent() || line < 1) {
            return Optional.empty();
        }
        try {
            List<String> lines = fileLines.getUnchecked(file.get());
            return line <= lines.size() ? Optional.of(lines.get(line - 1)) : Optional.empty();
        } catch (UncheckedExecutionException e) {
            logger.debug("Could not read source file " + file.get(), e.getCause());
            return Optional.empty();
        }
    }

    private Optional<Path> search(String path) {
        Path requested = Paths.get(path);
        if (requested.isAbsolute() && Files.isRegularFile(requested)) {
            return Optional.of(requested);
        }
        for (Path dir : sourceDirs) {
            Path candidate = dir.resolve(requested.isAbsolute() ? requested.toString().substring(1) : path);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }

        Path fileName = requested.getFileName();
        List<Path> sameName = fileName == null ? null : filesByName.get(fileName.toString());
        if (sameName == null) {
            return Optional.empty();
        }
        Path best = null;
        int bestLength = 0;
        for (Path candidate : sameName) {
            int length = commonSuffixLength(candidate, requested);
            if (length > bestLength) {
                best = candidate;
                bestLength = length;
            }
        }
        return Optional.ofNullable(best);
    }

    private static int commonSuffixLength(Path a, Path b) {
        int i = a.getNameCount() - 1;
        int j = b.getNameCount() - 1;
        int length = 0;
        while (i >= 0 && j >= 0 && a.getName(i).equals(b.getName(j))) {
            length++;
            i--;
            j--;
        }
        return length;
    }

    private static List<String> readLines(Path file) {
        try {
            return MoreFiles.asCharSource(file, StandardCharsets.UTF_8).readLines();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
