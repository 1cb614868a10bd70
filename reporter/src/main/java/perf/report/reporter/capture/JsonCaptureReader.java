package perf.report.reporter.capture;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.google.common.collect.ImmutableSet;
import perf.report.common.exception.ConfigurationException;
import perf.report.common.sample.Frame;
import perf.report.common.sample.Sample;
import perf.report.common.sample.SampleSource;
import perf.report.common.symbol.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Reads a capture decoded to json:
 * <pre>
 * {@code
 * {"eventTypes":[{"id":0,"name":"cpu-clock:u"}],
 *  "libraries":[{"id":0,"name":"/system/lib64/libc.so"}],
 *  "functions":[{"id":0,"libId":0,"name":"__libc_init"}],
 *  "processes":[{"pid":10,"name":"app"}],
 *  "threads":[{"tid":11,"pid":10,"name":"Worker"}],
 *  "samples":[{"eventType":0,"pid":10,"tid":11,"time":1000,"period":5,"offCpu":false,"callChain":[[0,0,4096]]}]}
 * }
 * </pre>
 * Call chain entries are [libId, functionId, address], root first. Sections may appear in any order, unknown
 * sections are ignored. Samples are streamed, the file is never held in memory as a whole.
 */
public class JsonCaptureReader implements SampleSource {
    private static final Logger logger = LoggerFactory.getLogger(JsonCaptureReader.class);
    private static final JsonFactory jsonFactory = new JsonFactory();
    private static final Set<String> SYMBOL_SECTIONS = ImmutableSet.of("eventTypes", "libraries", "functions", "processes", "threads");

    private final Path captureFile;
    private SymbolTable symbols;

    public JsonCaptureReader(Path captureFile) {
        this.captureFile = captureFile;
    }

    @Override
    public String getName() {
        return captureFile.toString();
    }

    @Override
    public synchronized SymbolTable getSymbols() throws IOException {
        if (symbols == null) {
            SymbolTable table = new SymbolTable();
            read(table, null);
            symbols = table;
        }
        return symbols;
    }

    @Override
    public void readSamples(Consumer<Sample> consumer) throws IOException {
        read(null, consumer);
    }

    /**
     * One pass over the file. Symbol sections go to table if given, samples to consumer if given, everything else
     * is skipped.
     */
    private void read(SymbolTable table, Consumer<Sample> consumer) throws IOException {
        try (JsonParser parser = jsonFactory.createParser(captureFile.toFile())) {
            expect(parser, parser.nextToken(), JsonToken.START_OBJECT);
            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                String section = parser.getCurrentName();
                JsonToken value = parser.nextToken();
                boolean wanted = "samples".equals(section) ? consumer != null : table != null && SYMBOL_SECTIONS.contains(section);
                if (!wanted) {
                    parser.skipChildren();
                    continue;
                }
                expect(parser, value, JsonToken.START_ARRAY);
                int count = 0;
                while (parser.nextToken() == JsonToken.START_OBJECT) {
                    if (consumer != null) {
                        consumer.accept(readSample(parser));
                    } else {
                        readSymbol(parser, section, table);
                    }
                    count++;
                }
                expect(parser, parser.currentToken(), JsonToken.END_ARRAY);
                if (logger.isDebugEnabled()) {
                    logger.debug("Read " + count + " " + section + " from " + captureFile);
                }
            }
            expect(parser, parser.currentToken(), JsonToken.END_OBJECT);
        }
    }

    private void readSymbol(JsonParser parser, String section, SymbolTable table) throws IOException {
        Integer id = null;
        Integer owner = null;
        String name = null;
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
            String field = parser.getCurrentName();
            parser.nextToken();
            switch (field) {
                case "id":
                case "tid":
                    id = parser.getIntValue();
                    break;
                case "pid":
                    if ("processes".equals(section)) {
                        id = parser.getIntValue();
                    } else {
                        owner = parser.getIntValue();
                    }
                    break;
                case "libId":
                    owner = parser.getIntValue();
                    break;
                case "name":
                    name = parser.getValueAsString();
                    break;
                default:
                    parser.skipChildren();
            }
        }
        if (id == null || name == null) {
            throw malformed(parser, section + " entry needs an id and a name");
        }

        switch (section) {
            case "eventTypes":
                table.addEventType(id, name);
                break;
            case "libraries":
                table.addLibrary(id, name);
                break;
            case "functions":
                table.addFunction(id, required(parser, owner, "libId"), name);
                break;
            case "processes":
                table.addProcess(id, name);
                break;
            case "threads":
                table.addThread(id, required(parser, owner, "pid"), name);
                break;
            default:
                throw malformed(parser, "unknown section " + section);
        }
    }

    private Sample readSample(JsonParser parser) throws IOException {
        int eventType = 0, pid = -1, tid = -1;
        long time = 0, period = 1;
        boolean offCpu = false;
        List<Frame> callChain = new ArrayList<>();
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
            String field = parser.getCurrentName();
            JsonToken value = parser.nextToken();
            switch (field) {
                case "eventType":
                    eventType = parser.getIntValue();
                    break;
                case "pid":
                    pid = parser.getIntValue();
                    break;
                case "tid":
                    tid = parser.getIntValue();
                    break;
                case "time":
                    time = parser.getLongValue();
                    break;
                case "period":
                    period = parser.getLongValue();
                    break;
                case "offCpu":
                    offCpu = value == JsonToken.VALUE_TRUE;
                    break;
                case "callChain":
                    expect(parser, value, JsonToken.START_ARRAY);
                    while (parser.nextToken() == JsonToken.START_ARRAY) {
                        callChain.add(readFrame(parser));
                    }
                    break;
                default:
                    parser.skipChildren();
            }
        }
        if (tid < 0 || pid < 0) {
            throw malformed(parser, "sample needs pid and tid");
        }
        try {
            return new Sample(eventType, pid, tid, time, period, offCpu, callChain);
        } catch (IllegalArgumentException e) {
            throw malformed(parser, e.getMessage());
        }
    }

    private Frame readFrame(JsonParser parser) throws IOException {
        expect(parser, parser.nextToken(), JsonToken.VALUE_NUMBER_INT);
        int libId = parser.getIntValue();
        expect(parser, parser.nextToken(), JsonToken.VALUE_NUMBER_INT);
        int functionId = parser.getIntValue();
        expect(parser, parser.nextToken(), JsonToken.VALUE_NUMBER_INT);
        long address = parser.getLongValue();
        expect(parser, parser.nextToken(), JsonToken.END_ARRAY);
        return new Frame(libId, functionId, address);
    }

    private int required(JsonParser parser, Integer value, String field) {
        if (value == null) {
            throw malformed(parser, "missing " + field);
        }
        return value;
    }

    private void expect(JsonParser parser, JsonToken actual, JsonToken expected) {
        if (actual != expected) {
            throw malformed(parser, "expected " + expected + " but found " + actual);
        }
    }

    private ConfigurationException malformed(JsonParser parser, String message) {
        return new ConfigurationException("Malformed capture " + captureFile + " at line "
            + parser.getCurrentLocation().getLineNr() + ": " + message);
    }
}
