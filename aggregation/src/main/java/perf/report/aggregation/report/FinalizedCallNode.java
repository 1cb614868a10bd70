package perf.report.aggregation.report;

import perf.report.aggregation.callgraph.CallTreeNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable call graph node of a finalized report. Children are only appended while the assembler converts an
 * accumulated tree, the node is read-only afterwards.
 */
public class FinalizedCallNode implements CallTreeNode<FinalizedCallNode> {
  private final int functionId;
  private final long eventCount;
  private final long subtreeEventCount;
  private final List<FinalizedCallNode> children;

  public FinalizedCallNode(int functionId, long eventCount, long subtreeEventCount) {
    this(functionId, eventCount, subtreeEventCount, new ArrayList<>());
  }

  public FinalizedCallNode(int functionId, long eventCount, long subtreeEventCount, List<FinalizedCallNode> children) {
    this.functionId = functionId;
    this.eventCount = eventCount;
    this.subtreeEventCount = subtreeEventCount;
    this.children = children;
  }

  void addChild(FinalizedCallNode child) {
    children.add(child);
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
  public List<FinalizedCallNode> children() {
    return Collections.unmodifiableList(children);
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof FinalizedCallNode)) {
      return false;
    }

    FinalizedCallNode other = (FinalizedCallNode) o;
    return this.functionId == other.functionId
        && this.eventCount == other.eventCount
        && this.subtreeEventCount == other.subtreeEventCount
        && this.children.equals(other.children);
  }

  @Override
  public int hashCode() {
    return Objects.hash(functionId, eventCount, subtreeEventCount, children.size());
  }

  @Override
  public String toString() {
    return "f=" + functionId + ",e=" + eventCount + ",s=" + subtreeEventCount + ",c=" + children.size();
  }
}
