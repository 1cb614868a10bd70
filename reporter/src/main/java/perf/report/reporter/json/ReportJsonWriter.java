package perf.report.reporter.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import perf.report.aggregation.report.FinalizedReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

public class ReportJsonWriter {
    private static final Logger logger = LoggerFactory.getLogger(ReportJsonWriter.class);

    private final ObjectMapper mapper;

    public ReportJsonWriter() {
        this.mapper = new ObjectMapper();
        this.mapper.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
        ReportSerializers.registerSerializers(mapper);
    }

    public void write(FinalizedReport report, Path reportFile) throws IOException {
        Path parent = reportFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(reportFile))) {
            write(report, out);
        }
        logger.info("Wrote report of " + report.getEvents().size() + " events to " + reportFile);
    }

    /**
     * Writes the report without closing the stream.
     */
    public void write(FinalizedReport report, OutputStream out) throws IOException {
        mapper.writeValue(out, report);
        out.flush();
    }

    public String writeAsString(FinalizedReport report) throws IOException {
        return mapper.writeValueAsString(report);
    }
}
