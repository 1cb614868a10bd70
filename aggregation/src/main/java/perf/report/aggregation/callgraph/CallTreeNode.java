package perf.report.aggregation.callgraph;

/**
 * A node of a call tree, either still accumulating or finalized.
 */
public interface CallTreeNode<T extends CallTreeNode<T>> {

  int getFunctionId();

  long getEventCount();

  long getSubtreeEventCount();

  int childCount();

  Iterable<T> children();
}
