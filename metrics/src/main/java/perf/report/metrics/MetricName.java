package perf.report.metrics;

import java.util.HashSet;
import java.util.Set;

public enum MetricName {
  Capture_Load_Complete("capture.load.complete"),
  Capture_Load_Failure("capture.load.failure"),

  Sample_Admitted("sample.admitted"),
  Sample_Rejected("sample.rejected"),
  Sample_Unassigned("sample.unassigned"),

  Frame_Interpreter_Elided("frame.interpreter.elided"),

  Report_Thread_Elided("report.thread.elided"),
  Report_Process_Elided("report.process.elided"),
  Report_Function_Elided("report.function.elided"),

  Annotation_Line_Miss("annotation.line.miss"),
  Annotation_Disassembly_Miss("annotation.disassembly.miss"),
  Annotation_Resolver_Failure("annotation.resolver.failure"),
  Annotation_Deobfuscated("annotation.deobfuscated");

  private static final Set<String> _metrics = new HashSet<>();
  static {
    for(MetricName mName: values()) {
      String name = mName.get();
      if(_metrics.contains(name)) {
        throw new Error("Cannot have metrics with duplicate names");
      }
      _metrics.add(name);
    }
  }

  private String name;

  MetricName(String name) {
    this.name = name;
  }

  public String get() {
    return name;
  }
}
