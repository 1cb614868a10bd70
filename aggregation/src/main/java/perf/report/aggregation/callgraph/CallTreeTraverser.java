package perf.report.aggregation.callgraph;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.function.Consumer;

/**
 * A generic traverser for a call tree. The supplied consumer is called for every node in DFS pre-order.
 * Uses an explicit stack, call chains of a few thousand frames are common for recursive code.
 */
public class CallTreeTraverser<T extends CallTreeNode<T>> {

  private final Consumer<T> consumer;

  public CallTreeTraverser(Consumer<T> consumer) {
    this.consumer = consumer;
  }

  /**
   * node must not be null and must be ensured while building the tree.
   * @param node
   */
  public void traverse(T node) {
    Deque<Iterator<T>> stack = new ArrayDeque<>();
    consumer.accept(node);
    stack.push(node.children().iterator());
    while (!stack.isEmpty()) {
      Iterator<T> children = stack.peek();
      if (!children.hasNext()) {
        stack.pop();
        continue;
      }
      T child = children.next();
      consumer.accept(child);
      stack.push(child.children().iterator());
    }
  }
}
