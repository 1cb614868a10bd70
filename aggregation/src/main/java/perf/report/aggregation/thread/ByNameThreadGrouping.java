package perf.report.aggregation.thread;

import perf.report.common.symbol.ThreadInfo;

class ByNameThreadGrouping extends LabelledThreadGrouping {
  static final ByNameThreadGrouping INSTANCE = new ByNameThreadGrouping();

  @Override
  protected String labelOf(ThreadInfo thread) {
    return thread.getName();
  }

  @Override
  public String toString() {
    return "by-name";
  }
}
