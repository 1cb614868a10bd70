package perf.report.reporter;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import perf.report.aggregation.ReportOptions;
import perf.report.aggregation.event.TraceOffCpuMode;
import perf.report.aggregation.filter.FilterFileParser;
import perf.report.aggregation.filter.SampleFilter;
import perf.report.aggregation.thread.ThreadGrouping;
import perf.report.common.exception.ConfigurationException;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Command line of a report run. Values given here win over the ones of the configuration file.
 */
public class ReportCommand {
    private static final Logger logger = LoggerFactory.getLogger(ReportCommand.class);
    private static final Splitter ID_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    static final String DEFAULT_CAPTURE = "perf.json";

    private final CommandLine cmd;

    private ReportCommand(CommandLine cmd) {
        this.cmd = cmd;
    }

    public static ReportCommand parse(String... args) {
        CommandLineParser parser = new DefaultParser();
        try {
            return new ReportCommand(parser.parse(options(), args));
        } catch (ParseException e) {
            throw new ConfigurationException("Invalid command line: " + e.getMessage(), e);
        }
    }

    public static Options options() {
        Options options = new Options();
        options.addOption(Option.builder("c")
            .longOpt("conf")
            .hasArg()
            .optionalArg(false)
            .desc("specifies json file to be used as configuration of the report run")
            .argName("json file")
            .build());
        options.addOption(Option.builder("i")
            .longOpt("record_file")
            .hasArgs()
            .desc("captures to report, aggregated in the order given (default " + DEFAULT_CAPTURE + ")")
            .argName("capture files")
            .build());
        options.addOption(Option.builder("o")
            .longOpt("report_path")
            .hasArg()
            .desc("path of the json report")
            .argName("file")
            .build());
        options.addOption(Option.builder()
            .longOpt("min_func_percent")
            .hasArg()
            .desc("functions below this percentage of their event are left out of the report")
            .argName("percent")
            .build());
        options.addOption(Option.builder()
            .longOpt("aggregate-by-thread-name")
            .desc("aggregate threads sharing a name")
            .build());
        options.addOption(Option.builder()
            .longOpt("aggregate-threads")
            .hasArgs()
            .desc("aggregate threads whose names match the same regex")
            .argName("regex")
            .build());
        options.addOption(Option.builder()
            .longOpt("trace-offcpu")
            .hasArg()
            .desc("how samples of off-cpu tracing captures are reported: on-cpu, off-cpu, on-off-cpu, mixed-on-off-cpu")
            .argName("mode")
            .build());
        options.addOption(Option.builder()
            .longOpt("show-art-frames")
            .desc("keep frames of the interpreter libraries in call chains")
            .build());
        options.addOption(Option.builder()
            .longOpt("add_source_code")
            .desc("annotate functions with source lines")
            .build());
        options.addOption(Option.builder()
            .longOpt("source_dirs")
            .hasArgs()
            .desc("directories to search source files in")
            .argName("dirs")
            .build());
        options.addOption(Option.builder()
            .longOpt("add_disassembly")
            .desc("annotate functions with their disassembly")
            .build());
        options.addOption(Option.builder()
            .longOpt("binary_cache")
            .hasArg()
            .desc("binary cache directory holding the annotations index")
            .argName("dir")
            .build());
        options.addOption(Option.builder()
            .longOpt("proguard-mapping-file")
            .hasArg()
            .desc("proguard mapping file used to restore obfuscated java names")
            .argName("file")
            .build());
        options.addOption(Option.builder()
            .longOpt("pid")
            .hasArgs()
            .desc("same as --include-pid")
            .argName("pids")
            .build());
        options.addOption(Option.builder()
            .longOpt("include-pid")
            .hasArgs()
            .desc("only report samples of these processes")
            .argName("pids")
            .build());
        options.addOption(Option.builder()
            .longOpt("exclude-pid")
            .hasArgs()
            .desc("drop samples of these processes")
            .argName("pids")
            .build());
        options.addOption(Option.builder()
            .longOpt("tid")
            .hasArgs()
            .desc("same as --include-tid")
            .argName("tids")
            .build());
        options.addOption(Option.builder()
            .longOpt("include-tid")
            .hasArgs()
            .desc("only report samples of these threads")
            .argName("tids")
            .build());
        options.addOption(Option.builder()
            .longOpt("exclude-tid")
            .hasArgs()
            .desc("drop samples of these threads")
            .argName("tids")
            .build());
        options.addOption(Option.builder()
            .longOpt("include-process-name")
            .hasArgs()
            .desc("only report processes whose name contains a match of one of these regexes")
            .argName("regex")
            .build());
        options.addOption(Option.builder()
            .longOpt("exclude-process-name")
            .hasArgs()
            .desc("drop processes whose name contains a match of one of these regexes")
            .argName("regex")
            .build());
        options.addOption(Option.builder()
            .longOpt("include-thread-name")
            .hasArgs()
            .desc("only report threads whose name contains a match of one of these regexes")
            .argName("regex")
            .build());
        options.addOption(Option.builder()
            .longOpt("exclude-thread-name")
            .hasArgs()
            .desc("drop threads whose name contains a match of one of these regexes")
            .argName("regex")
            .build());
        options.addOption(Option.builder()
            .longOpt("filter-file")
            .hasArg()
            .desc("file of GLOBAL_BEGIN/GLOBAL_END/CLOCK lines restricting the reported time window")
            .argName("file")
            .build());
        options.addOption(Option.builder("h")
            .longOpt("help")
            .desc("print this help")
            .build());
        return options;
    }

    public static void printUsage(PrintWriter out) {
        new HelpFormatter().printHelp(out, HelpFormatter.DEFAULT_WIDTH, "perf-report",
            "Aggregates captured samples into a json call graph report.", options(),
            HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null, true);
        out.flush();
    }

    public boolean isHelp() {
        return cmd.hasOption("help");
    }

    public String getConfigPath() {
        return cmd.getOptionValue("conf");
    }

    public List<Path> getCaptureFiles() {
        String[] files = cmd.getOptionValues("record_file");
        return toPaths(files == null ? new String[]{DEFAULT_CAPTURE} : files);
    }

    public Path getReportPath(Configuration config) {
        return Paths.get(cmd.getOptionValue("report_path", config.getReportPath()));
    }

    public Path getBinaryCache() {
        String dir = cmd.getOptionValue("binary_cache");
        return dir == null ? null : Paths.get(dir);
    }

    public List<Path> getSourceDirs() {
        String[] dirs = cmd.getOptionValues("source_dirs");
        return dirs == null ? Collections.emptyList() : toPaths(dirs);
    }

    public Path getProguardMappingFile() {
        String file = cmd.getOptionValue("proguard-mapping-file");
        return file == null ? null : Paths.get(file);
    }

    public ReportOptions buildReportOptions(Configuration config) {
        ReportOptions.Builder builder = ReportOptions.newBuilder()
            .threadGrouping(threadGrouping())
            .showInterpreterFrames(cmd.hasOption("show-art-frames"))
            .interpreterLibraries(ImmutableSet.copyOf(config.getInterpreterLibraries()))
            .addSourceCode(cmd.hasOption("add_source_code"))
            .addDisassembly(cmd.hasOption("add_disassembly"))
            .loaderThreads(config.getLoaderThreads())
            .annotationCacheSize(config.getAnnotationCacheSize());

        if (cmd.hasOption("trace-offcpu")) {
            builder.traceOffCpuMode(TraceOffCpuMode.fromOption(cmd.getOptionValue("trace-offcpu")));
        }

        double minFuncPercent = config.getMinFuncPercent();
        if (cmd.hasOption("min_func_percent")) {
            String value = cmd.getOptionValue("min_func_percent");
            try {
                minFuncPercent = Double.parseDouble(value);
            } catch (NumberFormatException e) {
                throw new ConfigurationException("--min_func_percent expects a number, got " + value, e);
            }
        }
        try {
            builder.minFuncPercent(minFuncPercent);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("--min_func_percent " + e.getMessage(), e);
        }
        return builder.build();
    }

    public SampleFilter buildSampleFilter() {
        SampleFilter.Builder builder = SampleFilter.newBuilder()
            .includePids(ids("pid"))
            .includePids(ids("include-pid"))
            .excludePids(ids("exclude-pid"))
            .includeTids(ids("tid"))
            .includeTids(ids("include-tid"))
            .excludeTids(ids("exclude-tid"));
        for (String regex : values("include-process-name")) {
            builder.includeProcessName(regex);
        }
        for (String regex : values("exclude-process-name")) {
            builder.excludeProcessName(regex);
        }
        for (String regex : values("include-thread-name")) {
            builder.includeThreadName(regex);
        }
        for (String regex : values("exclude-thread-name")) {
            builder.excludeThreadName(regex);
        }

        if (cmd.hasOption("filter-file")) {
            FilterFileParser parser = new FilterFileParser();
            parser.parse(Paths.get(cmd.getOptionValue("filter-file")), builder);
            if (parser.getClock() != null) {
                logger.info("Filter file timestamps are in clock " + parser.getClock());
            }
        }
        return builder.build();
    }

    private ThreadGrouping threadGrouping() {
        boolean byName = cmd.hasOption("aggregate-by-thread-name");
        List<String> patterns = values("aggregate-threads");
        if (byName && !patterns.isEmpty()) {
            throw new ConfigurationException("--aggregate-by-thread-name and --aggregate-threads can not be used together");
        }
        if (byName) {
            return ThreadGrouping.byName();
        }
        return patterns.isEmpty() ? ThreadGrouping.identity() : ThreadGrouping.byPatterns(patterns);
    }

    private List<String> values(String option) {
        String[] values = cmd.getOptionValues(option);
        return values == null ? Collections.emptyList() : Arrays.asList(values);
    }

    /**
     * Ids may be given as separate arguments, comma separated, or both.
     */
    private List<Integer> ids(String option) {
        List<Integer> ids = new ArrayList<>();
        for (String value : values(option)) {
            for (String id : ID_SPLITTER.split(value)) {
                try {
                    ids.add(Integer.parseInt(id));
                } catch (NumberFormatException e) {
                    throw new ConfigurationException("--" + option + " expects integer ids, got " + id, e);
                }
            }
        }
        return ids;
    }

    private static List<Path> toPaths(String[] values) {
        List<Path> paths = new ArrayList<>(values.length);
        for (String value : values) {
            paths.add(Paths.get(value));
        }
        return paths;
    }
}
