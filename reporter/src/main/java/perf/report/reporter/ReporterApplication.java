package perf.report.reporter;

import com.codahale.metrics.SharedMetricRegistries;
import com.codahale.metrics.Slf4jReporter;
import perf.report.aggregation.ReportGenerator;
import perf.report.aggregation.ReportOptions;
import perf.report.aggregation.annotate.AddressResolver;
import perf.report.aggregation.annotate.DeobfuscationMap;
import perf.report.aggregation.report.FinalizedReport;
import perf.report.common.exception.ConfigurationException;
import perf.report.reporter.annotate.BinaryCacheAddressResolver;
import perf.report.reporter.annotate.SourceFileFinder;
import perf.report.reporter.capture.JsonCaptureReader;
import perf.report.reporter.deobfuscate.ProguardMappingFile;
import perf.report.reporter.json.ReportJsonWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

public class ReporterApplication {
    private static final Logger logger = LoggerFactory.getLogger(ReporterApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_IO_FAILURE = 1;
    static final int EXIT_BAD_CONFIGURATION = 2;

    public static void main(String[] args) {
        int status = run(args);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    static int run(String[] args) {
        try {
            ReportCommand command = ReportCommand.parse(args);
            if (command.isHelp()) {
                ReportCommand.printUsage(new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
                return EXIT_OK;
            }
            Configuration config = command.getConfigPath() == null
                ? ReporterConfigManager.loadDefaultConfig()
                : ReporterConfigManager.loadConfig(command.getConfigPath());

            Path reportPath = command.getReportPath(config);
            generate(command, config, reportPath);
            if (config.isMetricsLogEnabled()) {
                logMetrics();
            }
            return EXIT_OK;
        } catch (ConfigurationException e) {
            logger.error(e.getMessage(), e);
            return EXIT_BAD_CONFIGURATION;
        } catch (IOException e) {
            logger.error("Report run failed: " + e.getMessage(), e);
            return EXIT_IO_FAILURE;
        }
    }

    static FinalizedReport generate(ReportCommand command, Configuration config, Path reportPath) throws IOException {
        ReportOptions options = command.buildReportOptions(config);
        List<JsonCaptureReader> captures = new ArrayList<>();
        for (Path captureFile : command.getCaptureFiles()) {
            captures.add(new JsonCaptureReader(captureFile));
        }

        ReportGenerator generator = new ReportGenerator(options, command.buildSampleFilter(),
            addressResolver(command, config, options, captures), deobfuscationMap(command));
        FinalizedReport report = generator.generate(captures);
        new ReportJsonWriter().write(report, reportPath);
        return report;
    }

    private static AddressResolver addressResolver(ReportCommand command, Configuration config, ReportOptions options,
                                                   List<JsonCaptureReader> captures) throws IOException {
        if (!options.isAddSourceCode() && !options.isAddDisassembly()) {
            return AddressResolver.NONE;
        }
        Path binaryCache = command.getBinaryCache();
        if (binaryCache == null) {
            logger.warn("No --binary_cache given, source code and disassembly annotations will be empty");
            return AddressResolver.NONE;
        }
        SourceFileFinder sourceFileFinder = options.isAddSourceCode()
            ? SourceFileFinder.index(command.getSourceDirs())
            : SourceFileFinder.NONE;
        return BinaryCacheAddressResolver.load(binaryCache.resolve(config.getAnnotationsFileName()),
            ReportGenerator.mergeSymbols(captures), sourceFileFinder);
    }

    private static DeobfuscationMap deobfuscationMap(ReportCommand command) {
        Path mappingFile = command.getProguardMappingFile();
        return mappingFile == null ? DeobfuscationMap.NONE : ProguardMappingFile.load(mappingFile);
    }

    private static void logMetrics() {
        Slf4jReporter.forRegistry(SharedMetricRegistries.getOrCreate(ReportOptions.METRIC_REGISTRY))
            .outputTo(LoggerFactory.getLogger("perf.report.metrics"))
            .convertRatesTo(TimeUnit.SECONDS)
            .convertDurationsTo(TimeUnit.MILLISECONDS)
            .build()
            .report();
    }
}
