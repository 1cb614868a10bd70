package perf.report.aggregation.callgraph;

import org.junit.Assert;
import org.junit.Test;
import perf.report.common.sample.Frame;
import perf.report.common.symbol.SymbolTable;

import java.util.Collections;
import java.util.List;

import static perf.report.aggregation.SampleFixtures.ART_EXECUTE;
import static perf.report.aggregation.SampleFixtures.LIBC_INIT;
import static perf.report.aggregation.SampleFixtures.MAIN;
import static perf.report.aggregation.SampleFixtures.MEMCPY;
import static perf.report.aggregation.SampleFixtures.RECURSE;
import static perf.report.aggregation.SampleFixtures.WORKER_RUN;
import static perf.report.aggregation.SampleFixtures.assertSubtreeInvariant;
import static perf.report.aggregation.SampleFixtures.chain;
import static perf.report.aggregation.SampleFixtures.symbols;

public class CallGraphBuilderTest {

  @Test
  public void testSelfAndSubtreeAccounting() {
    CallGraphBuilder builder = new CallGraphBuilder();
    builder.addCallChain(chain(LIBC_INIT, MAIN, WORKER_RUN), 5);
    builder.addCallChain(chain(LIBC_INIT, MAIN), 3);
    builder.addCallChain(chain(LIBC_INIT, MAIN, MEMCPY), 2);

    CallGraphNode root = builder.getRoot();
    Assert.assertEquals(10, root.getSubtreeEventCount());
    Assert.assertEquals(0, root.getEventCount());

    CallGraphNode main = root.getOrAddChild(LIBC_INIT).getOrAddChild(MAIN);
    Assert.assertEquals(3, main.getEventCount());
    Assert.assertEquals(10, main.getSubtreeEventCount());
    Assert.assertEquals(5, main.getOrAddChild(WORKER_RUN).getEventCount());
    assertSubtreeInvariant(root);
  }

  @Test
  public void testReverseGraphStartsAtLeaf() {
    CallGraphBuilder builder = new CallGraphBuilder();
    builder.addCallChain(chain(LIBC_INIT, MAIN, MEMCPY), 2);
    builder.addCallChain(chain(LIBC_INIT, WORKER_RUN, MEMCPY), 4);

    CallGraphNode reverseRoot = builder.getReverseRoot();
    Assert.assertEquals(1, reverseRoot.childCount());
    CallGraphNode memcpy = reverseRoot.children().iterator().next();
    Assert.assertEquals(MEMCPY, memcpy.getFunctionId());
    Assert.assertEquals(6, memcpy.getSubtreeEventCount());
    Assert.assertEquals(2, memcpy.childCount());
    Assert.assertEquals(4, memcpy.getOrAddChild(WORKER_RUN).getOrAddChild(LIBC_INIT).getEventCount());
    assertSubtreeInvariant(reverseRoot);
  }

  @Test
  public void testRecursionCreatesNestedNodes() {
    CallGraphBuilder builder = new CallGraphBuilder();
    builder.addCallChain(chain(MAIN, RECURSE, RECURSE, RECURSE), 7);
    CallGraphNode node = builder.getRoot().getOrAddChild(MAIN);
    for (int depth = 0; depth < 3; depth++) {
      node = node.getOrAddChild(RECURSE);
      Assert.assertEquals(7, node.getSubtreeEventCount());
    }
    Assert.assertEquals(7, node.getEventCount());
    assertSubtreeInvariant(builder.getRoot());
  }

  @Test
  public void testInterpreterFramesAreElidedWithoutLosingWeight() {
    SymbolTable symbols = symbols();
    InterpreterFrameFilter filter = InterpreterFrameFilter.hiding(Collections.singleton("libart.so"), symbols);

    List<Frame> filtered = filter.filter(chain(LIBC_INIT, ART_EXECUTE, MAIN, ART_EXECUTE, WORKER_RUN));
    Assert.assertEquals(chain(LIBC_INIT, MAIN, WORKER_RUN), filtered);

    List<Frame> onlyInterpreter = filter.filter(chain(ART_EXECUTE, ART_EXECUTE));
    Assert.assertEquals(1, onlyInterpreter.size());
    Assert.assertEquals(ART_EXECUTE, onlyInterpreter.get(0).getFunctionId());

    CallGraphBuilder builder = new CallGraphBuilder();
    builder.addCallChain(filtered, 4);
    builder.addCallChain(onlyInterpreter, 6);
    Assert.assertEquals(10, builder.getRoot().getSubtreeEventCount());
    assertSubtreeInvariant(builder.getRoot());
  }

  @Test
  public void testShowAllKeepsChain() {
    List<Frame> callChain = chain(LIBC_INIT, ART_EXECUTE, MAIN);
    Assert.assertSame(callChain, InterpreterFrameFilter.showAll().filter(callChain));
  }
}
