package perf.report.aggregation.callgraph;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Node of a call graph still being accumulated. Children are kept in encounter order.
 * Not thread safe: a node is only ever written by the thread bucket owning its tree.
 */
public class CallGraphNode implements CallTreeNode<CallGraphNode> {
  /**
   * A function id reference into the symbol table, {@link CallGraphBuilder#ROOT_FUNCTION_ID} for roots.
   */
  private final int functionId;

  /**
   * Callees (or callers, in a reverse call graph) keyed by function id.
   */
  private final Map<Integer, CallGraphNode> children = new LinkedHashMap<>(4);

  /**
   * Weight of samples whose chain ends at this node.
   */
  private long eventCount = 0;

  /**
   * Weight of samples whose chain passes through this node, this node's own weight included.
   */
  private long subtreeEventCount = 0;

  public CallGraphNode(int functionId) {
    this.functionId = functionId;
  }

  public CallGraphNode getOrAddChild(int childFunctionId) {
    CallGraphNode child = children.get(childFunctionId);
    if (child == null) {
      child = new CallGraphNode(childFunctionId);
      children.put(childFunctionId, child);
    }
    return child;
  }

  public void addEventCount(long weight) {
    this.eventCount += weight;
  }

  public void addSubtreeEventCount(long weight) {
    this.subtreeEventCount += weight;
  }

  @Override
  public int getFunctionId() {
    return functionId;
  }

  @Override
  public long getEventCount() {
    return eventCount;
  }

  @Override
  public long getSubtreeEventCount() {
    return subtreeEventCount;
  }

  @Override
  public int childCount() {
    return children.size();
  }

  @Override
  public Collection<CallGraphNode> children() {
    return children.values();
  }
}
