package perf.report.aggregation.callgraph;

import perf.report.common.sample.Frame;

import java.util.List;

/**
 * Accumulates the call graph (root frame first) and the reverse call graph (leaf frame first) of one thread bucket.
 * Both trees hang off synthetic roots whose subtree count is the total weight added.
 */
public class CallGraphBuilder {
  public static final int ROOT_FUNCTION_ID = -1;

  private final CallGraphNode root = new CallGraphNode(ROOT_FUNCTION_ID);
  private final CallGraphNode reverseRoot = new CallGraphNode(ROOT_FUNCTION_ID);

  /**
   * @param callChain root to leaf, not empty
   * @param weight event weight of the sample
   */
  public void addCallChain(List<Frame> callChain, long weight) {
    CallGraphNode node = root;
    node.addSubtreeEventCount(weight);
    for (Frame frame : callChain) {
      node = node.getOrAddChild(frame.getFunctionId());
      node.addSubtreeEventCount(weight);
    }
    node.addEventCount(weight);

    node = reverseRoot;
    node.addSubtreeEventCount(weight);
    for (int i = callChain.size() - 1; i >= 0; i--) {
      node = node.getOrAddChild(callChain.get(i).getFunctionId());
      node.addSubtreeEventCount(weight);
    }
    node.addEventCount(weight);
  }

  public CallGraphNode getRoot() {
    return root;
  }

  public CallGraphNode getReverseRoot() {
    return reverseRoot;
  }
}
