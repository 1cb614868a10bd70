package perf.report.aggregation.bucket;

import org.junit.Assert;
import org.junit.Test;
import perf.report.aggregation.thread.ThreadKey;

import java.util.SortedMap;

import static perf.report.aggregation.SampleFixtures.APK;
import static perf.report.aggregation.SampleFixtures.LIBC;
import static perf.report.aggregation.SampleFixtures.LIBC_INIT;
import static perf.report.aggregation.SampleFixtures.MAIN;
import static perf.report.aggregation.SampleFixtures.MEMCPY;
import static perf.report.aggregation.SampleFixtures.RECURSE;
import static perf.report.aggregation.SampleFixtures.address;
import static perf.report.aggregation.SampleFixtures.chain;

public class ThreadBucketTest {

  @Test
  public void testRecursiveFunctionCountsOncePerSample() {
    ThreadBucket bucket = new ThreadBucket(new ThreadKey(100, 101, "Worker"));
    bucket.add(chain(LIBC_INIT, MAIN, RECURSE, RECURSE, RECURSE), 5, false);
    bucket.add(chain(LIBC_INIT, MAIN, RECURSE, MEMCPY), 2, false);

    Assert.assertEquals(7, bucket.getEventCount());
    Assert.assertEquals(2, bucket.getSampleCount());

    FunctionStats recurse = bucket.getFunctionsByLib().get(APK).get(RECURSE);
    Assert.assertEquals(7, recurse.getSubtreeEventCount());
    Assert.assertEquals(5, recurse.getEventCount());
    Assert.assertEquals(1, recurse.getSampleCount());

    FunctionStats main = bucket.getFunctionsByLib().get(APK).get(MAIN);
    Assert.assertEquals(7, main.getSubtreeEventCount());
    Assert.assertEquals(0, main.getEventCount());
    Assert.assertEquals(0, main.getSampleCount());

    FunctionStats memcpy = bucket.getFunctionsByLib().get(LIBC).get(MEMCPY);
    Assert.assertEquals(2, memcpy.getEventCount());
    Assert.assertTrue(memcpy.getAddressHits().isEmpty());
  }

  @Test
  public void testAddressHitsSplitSelfAndSubtree() {
    ThreadBucket bucket = new ThreadBucket(new ThreadKey(100, 101, "Worker"));
    bucket.add(chain(MAIN, RECURSE, RECURSE), 3, true);
    bucket.add(chain(MAIN), 4, true);

    SortedMap<Long, long[]> mainHits = bucket.getFunctionsByLib().get(APK).get(MAIN).getAddressHits();
    Assert.assertArrayEquals(new long[]{4, 7}, mainHits.get(address(MAIN)));

    SortedMap<Long, long[]> recurseHits = bucket.getFunctionsByLib().get(APK).get(RECURSE).getAddressHits();
    Assert.assertEquals(1, recurseHits.size());
    Assert.assertArrayEquals(new long[]{3, 3}, recurseHits.get(address(RECURSE)));
  }

  @Test
  public void testLibrariesAndFunctionsAreInIdOrder() {
    ThreadBucket bucket = new ThreadBucket(new ThreadKey(100, 101, "Worker"));
    bucket.add(chain(RECURSE, MEMCPY), 1, false);
    bucket.add(chain(MAIN, LIBC_INIT), 1, false);

    Assert.assertArrayEquals(new Object[]{LIBC, APK}, bucket.getFunctionsByLib().keySet().toArray());
    Assert.assertArrayEquals(new Object[]{MAIN, RECURSE}, bucket.getFunctionsByLib().get(APK).keySet().toArray());
  }
}
