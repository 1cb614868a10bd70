package perf.report.reporter.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import perf.report.aggregation.annotate.AddressHit;
import perf.report.aggregation.annotate.DisassemblyLine;
import perf.report.aggregation.report.FinalizedCallNode;
import perf.report.aggregation.report.FinalizedEvent;
import perf.report.aggregation.report.FinalizedFunction;
import perf.report.aggregation.report.FinalizedLibrary;
import perf.report.aggregation.report.FinalizedProcess;
import perf.report.aggregation.report.FinalizedReport;
import perf.report.aggregation.report.FinalizedThread;
import perf.report.aggregation.report.FunctionEntry;
import perf.report.aggregation.report.ReportMetadata;
import perf.report.aggregation.report.SourceFile;
import perf.report.aggregation.report.SourceLineHit;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Map;

/**
 * Serializers writing a {@link FinalizedReport} in the compact layout report viewers read. Short keys are used for
 * everything repeated per function or per call graph node.
 */
public class ReportSerializers {

    public static void registerSerializers(ObjectMapper om) {
        SimpleModule module = new SimpleModule("reportSerializers", new Version(1, 0, 0, null, null, null));
        module.addSerializer(FinalizedReport.class, new ReportSerializer());
        module.addSerializer(FinalizedEvent.class, new EventSerializer());
        module.addSerializer(FinalizedProcess.class, new ProcessSerializer());
        module.addSerializer(FinalizedThread.class, new ThreadSerializer());
        module.addSerializer(FinalizedLibrary.class, new LibrarySerializer());
        module.addSerializer(FinalizedFunction.class, new FunctionSerializer());
        module.addSerializer(FinalizedCallNode.class, new CallNodeSerializer());
        module.addSerializer(FunctionEntry.class, new FunctionEntrySerializer());
        module.addSerializer(SourceFile.class, new SourceFileSerializer());
        module.addSerializer(ReportMetadata.class, new MetadataSerializer());
        om.registerModule(module);
    }

    static class ReportSerializer extends StdSerializer<FinalizedReport> {

        public ReportSerializer() {
            super(FinalizedReport.class);
        }

        @Override
        public void serialize(FinalizedReport value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeStartObject();
            gen.writeObjectFieldStart("threadNames");
            for (Map.Entry<Integer, String> thread : value.getThreadNames().entrySet()) {
                gen.writeStringField(String.valueOf(thread.getKey()), thread.getValue());
            }
            gen.writeEndObject();

            gen.writeObjectFieldStart("processNames");
            for (Map.Entry<Integer, String> process : value.getProcessNames().entrySet()) {
                gen.writeStringField(String.valueOf(process.getKey()), process.getValue());
            }
            gen.writeEndObject();

            gen.writeArrayFieldStart("libList");
            for (String lib : value.getLibList()) {
                gen.writeString(lib);
            }
            gen.writeEndArray();

            gen.writeObjectFieldStart("functionMap");
            for (Map.Entry<Integer, FunctionEntry> function : value.getFunctionMap().entrySet()) {
                serializers.defaultSerializeField(String.valueOf(function.getKey()), function.getValue(), gen);
            }
            gen.writeEndObject();

            serializers.defaultSerializeField("sourceFiles", value.getSourceFiles(), gen);
            serializers.defaultSerializeField("sampleInfo", value.getEvents(), gen);
            serializers.defaultSerializeField("metadata", value.getMetadata(), gen);
            gen.writeEndObject();
        }
    }

    static class EventSerializer extends StdSerializer<FinalizedEvent> {

        public EventSerializer() {
            super(FinalizedEvent.class);
        }

        @Override
        public void serialize(FinalizedEvent value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeStartObject();
            gen.writeStringField("eventName", value.getEventName());
            gen.writeNumberField("eventCount", value.getEventCount());
            serializers.defaultSerializeField("processes", value.getProcesses(), gen);
            gen.writeEndObject();
        }
    }

    static class ProcessSerializer extends StdSerializer<FinalizedProcess> {

        public ProcessSerializer() {
            super(FinalizedProcess.class);
        }

        @Override
        public void serialize(FinalizedProcess value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeStartObject();
            gen.writeNumberField("pid", value.getPid());
            gen.writeNumberField("eventCount", value.getEventCount());
            gen.writeNumberField("sampleCount", value.getSampleCount());
            serializers.defaultSerializeField("threads", value.getThreads(), gen);
            gen.writeEndObject();
        }
    }

    static class ThreadSerializer extends StdSerializer<FinalizedThread> {

        public ThreadSerializer() {
            super(FinalizedThread.class);
        }

        @Override
        public void serialize(FinalizedThread value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeStartObject();
            gen.writeNumberField("tid", value.getTid());
            gen.writeNumberField("eventCount", value.getEventCount());
            gen.writeNumberField("sampleCount", value.getSampleCount());
            serializers.defaultSerializeField("libs", value.getLibs(), gen);
            serializers.defaultSerializeField("g", value.getCallGraph(), gen);
            serializers.defaultSerializeField("rg", value.getReverseCallGraph(), gen);
            gen.writeEndObject();
        }
    }

    static class LibrarySerializer extends StdSerializer<FinalizedLibrary> {

        public LibrarySerializer() {
            super(FinalizedLibrary.class);
        }

        @Override
        public void serialize(FinalizedLibrary value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeStartObject();
            gen.writeNumberField("libId", value.getLibIndex());
            serializers.defaultSerializeField("functions", value.getFunctions(), gen);
            gen.writeEndObject();
        }
    }

    static class FunctionSerializer extends StdSerializer<FinalizedFunction> {

        public FunctionSerializer() {
            super(FinalizedFunction.class);
        }

        @Override
        public void serialize(FinalizedFunction value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeStartObject();
            gen.writeNumberField("f", value.getFunctionId());
            gen.writeArrayFieldStart("c");
            gen.writeNumber(value.getSampleCount());
            gen.writeNumber(value.getEventCount());
            gen.writeNumber(value.getSubtreeEventCount());
            gen.writeEndArray();

            if (!value.getSourceLines().isEmpty()) {
                gen.writeArrayFieldStart("s");
                for (SourceLineHit line : value.getSourceLines()) {
                    gen.writeStartObject();
                    gen.writeNumberField("f", line.getFileIndex());
                    gen.writeNumberField("l", line.getLine());
                    gen.writeNumberField("e", line.getEventCount());
                    gen.writeNumberField("s", line.getSubtreeEventCount());
                    gen.writeEndObject();
                }
                gen.writeEndArray();
            }

            if (!value.getAddressHits().isEmpty()) {
                gen.writeArrayFieldStart("a");
                for (AddressHit hit : value.getAddressHits()) {
                    gen.writeStartObject();
                    gen.writeNumberField("a", hit.getAddress());
                    gen.writeNumberField("e", hit.getEventCount());
                    gen.writeNumberField("s", hit.getSubtreeEventCount());
                    gen.writeEndObject();
                }
                gen.writeEndArray();
            }
            gen.writeEndObject();
        }
    }

    /**
     * Writes the tree without recursion, call chains can be deeper than the serializer stack allows.
     */
    static class CallNodeSerializer extends StdSerializer<FinalizedCallNode> {

        public CallNodeSerializer() {
            super(FinalizedCallNode.class);
        }

        @Override
        public void serialize(FinalizedCallNode value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            Deque<Iterator<FinalizedCallNode>> pending = new ArrayDeque<>();
            pending.push(openNode(value, gen));
            while (!pending.isEmpty()) {
                Iterator<FinalizedCallNode> children = pending.peek();
                if (children.hasNext()) {
                    pending.push(openNode(children.next(), gen));
                } else {
                    gen.writeEndArray();
                    gen.writeEndObject();
                    pending.pop();
                }
            }
        }

        private static Iterator<FinalizedCallNode> openNode(FinalizedCallNode node, JsonGenerator gen) throws IOException {
            gen.writeStartObject();
            gen.writeNumberField("f", node.getFunctionId());
            gen.writeNumberField("e", node.getEventCount());
            gen.writeNumberField("s", node.getSubtreeEventCount());
            gen.writeArrayFieldStart("c");
            return node.children().iterator();
        }
    }

    static class FunctionEntrySerializer extends StdSerializer<FunctionEntry> {

        public FunctionEntrySerializer() {
            super(FunctionEntry.class);
        }

        @Override
        public void serialize(FunctionEntry value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeStartObject();
            gen.writeNumberField("l", value.getLibIndex());
            gen.writeStringField("f", value.getName());
            if (!value.getDisassembly().isEmpty()) {
                gen.writeArrayFieldStart("d");
                for (DisassemblyLine line : value.getDisassembly()) {
                    gen.writeStartArray();
                    gen.writeString(line.getText());
                    gen.writeNumber(line.getAddress());
                    gen.writeEndArray();
                }
                gen.writeEndArray();
            }
            gen.writeEndObject();
        }
    }

    static class SourceFileSerializer extends StdSerializer<SourceFile> {

        public SourceFileSerializer() {
            super(SourceFile.class);
        }

        @Override
        public void serialize(SourceFile value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeStartObject();
            gen.writeStringField("path", value.getPath());
            gen.writeObjectFieldStart("code");
            for (Map.Entry<Integer, String> line : value.getCode().entrySet()) {
                gen.writeStringField(String.valueOf(line.getKey()), line.getValue());
            }
            gen.writeEndObject();
            gen.writeEndObject();
        }
    }

    static class MetadataSerializer extends StdSerializer<ReportMetadata> {

        public MetadataSerializer() {
            super(ReportMetadata.class);
        }

        @Override
        public void serialize(ReportMetadata value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeStartObject();
            gen.writeArrayFieldStart("captures");
            for (String capture : value.getCaptures()) {
                gen.writeString(capture);
            }
            gen.writeEndArray();
            gen.writeNumberField("admittedSamples", value.getAdmittedSampleCount());
            gen.writeNumberField("aggregatedSamples", value.getAggregatedSampleCount());
            gen.writeEndObject();
        }
    }
}
