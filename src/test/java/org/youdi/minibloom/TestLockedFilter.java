package org.youdi.minibloom;

import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

public class TestLockedFilter {

  private static final int THREADS = 4;
  private static final int KEYS_PER_THREAD = 2000;

  @Test
  public void testConcurrentAdds() throws Exception {
    MembershipFilter<String> filter =
        Filters.synchronizedFilter(Filters.<String>simpleWithFalsePositiveRate(10000, 0.01));
    ExecutorService pool = Executors.newFixedThreadPool(THREADS);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int t = 0; t < THREADS; t++) {
        final int id = t;
        futures.add(pool.submit(() -> {
          for (int i = 0; i < KEYS_PER_THREAD; i++) {
            filter.add("t" + id + "-" + i);
            Assert.assertTrue(filter.contains("t" + id + "-" + i));
          }
        }));
      }
      for (Future<?> f : futures) {
        f.get();
      }
    } finally {
      pool.shutdownNow();
    }

    Assert.assertEquals(THREADS * KEYS_PER_THREAD, filter.getNumberOfAddedElements());
    for (int t = 0; t < THREADS; t++) {
      for (int i = 0; i < KEYS_PER_THREAD; i++) {
        Assert.assertTrue(filter.contains("t" + t + "-" + i));
      }
    }
  }

  @Test
  public void testConcurrentAddRemove() throws Exception {
    CountingFilter<String> filter =
        Filters.synchronizedCountingFilter(Filters.<String>counting(1 << 16, 4, 10000));
    ExecutorService pool = Executors.newFixedThreadPool(THREADS);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int t = 0; t < THREADS; t++) {
        final int id = t;
        futures.add(pool.submit(() -> {
          for (int i = 0; i < KEYS_PER_THREAD; i++) {
            String key = "t" + id + "-" + i;
            filter.add(key);
            filter.add(key);
            Assert.assertTrue(filter.remove(key));
          }
        }));
      }
      for (Future<?> f : futures) {
        f.get();
      }
    } finally {
      pool.shutdownNow();
    }

    int[] counters = filter.getCounters();
    for (int i = 0; i < counters.length; i++) {
      Assert.assertEquals(counters[i] > 0, filter.getBit(i));
    }
    for (int t = 0; t < THREADS; t++) {
      for (int i = 0; i < KEYS_PER_THREAD; i++) {
        Assert.assertTrue(filter.count("t" + t + "-" + i) >= 1);
      }
    }
  }

  @Test
  public void testCopyStaysLocked() {
    CountingFilter<String> filter =
        Filters.synchronizedCountingFilter(Filters.<String>counting(1024, 3, 10));
    filter.add("hello");
    CountingFilter<String> copy = filter.copy();
    Assert.assertTrue(copy instanceof LockedCountingFilter);
    Assert.assertEquals(1, copy.count("hello"));
    Assert.assertEquals(filter.getFilterConfig(), copy.getFilterConfig());
    Assert.assertTrue(filter.toString().startsWith("CountingBloomFilter"));
  }
}
