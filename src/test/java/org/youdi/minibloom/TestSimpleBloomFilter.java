package org.youdi.minibloom;

import org.junit.Assert;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class TestSimpleBloomFilter {

  static String findAbsent(MembershipFilter<String> filter) {
    for (int i = 0; ; i++) {
      String candidate = "absent-" + i;
      if (!filter.contains(candidate)) {
        return candidate;
      }
    }
  }

  @Test
  public void testHelloNihao() {
    SimpleBloomFilter<String> filter = Filters.simpleWithFalsePositiveRate(64, 0.05);
    Assert.assertEquals(5, filter.getNumberOfHashes());
    Assert.assertEquals(462, filter.getSizeOfBitArray());

    filter.add("hello");
    filter.add("nihao");
    Assert.assertTrue(filter.contains("hello"));
    Assert.assertTrue(filter.contains("nihao"));
    Assert.assertTrue(filter.containsAll(Arrays.asList("nihao", "hello")));
    Assert.assertEquals(2, filter.getNumberOfAddedElements());
  }

  @Test
  public void testNoFalseNegatives() {
    SimpleBloomFilter<String> filter = Filters.simpleWithFalsePositiveRate(1000, 0.01);
    List<String> keys = new ArrayList<>();
    for (int i = 0; i < 1000; i++) {
      keys.add("key-" + i);
    }
    filter.addAll(keys);
    for (String key : keys) {
      Assert.assertTrue(filter.contains(key));
    }
    Assert.assertEquals(1000, filter.getNumberOfAddedElements());
  }

  @Test
  public void testFalsePositiveRateIsBounded() {
    SimpleBloomFilter<Integer> filter = Filters.simpleWithFalsePositiveRate(2000, 0.01);
    for (int i = 0; i < 2000; i++) {
      filter.add(i);
    }
    int falsePositives = 0;
    for (int i = 2000; i < 12000; i++) {
      if (filter.contains(i)) {
        falsePositives++;
      }
    }
    // Expected about 1%, leave plenty of room.
    Assert.assertTrue("falsePositives=" + falsePositives, falsePositives < 500);
  }

  @Test
  public void testAddReportsNovelty() {
    SimpleBloomFilter<String> filter = Filters.simple(1024, 3, 100);
    Assert.assertTrue(filter.add("hello"));
    Assert.assertFalse(filter.add("hello"));
    Assert.assertEquals(2, filter.getNumberOfAddedElements());
  }

  @Test
  public void testElementAndBytesAgree() {
    SimpleBloomFilter<String> filter = Filters.simple(1024, 4, 100);
    filter.add("hello");
    Assert.assertTrue(filter.contains("hello".getBytes(StandardCharsets.UTF_8)));

    filter.add("world".getBytes(StandardCharsets.UTF_8));
    Assert.assertTrue(filter.contains("world"));
  }

  @Test
  public void testCharsetChangesEncoding() {
    Config conf = Config.getDefault().setCharset(StandardCharsets.UTF_16);
    SimpleBloomFilter<String> filter = Filters.simple(FilterConfig.create(1024, 4, 100), conf);
    filter.add("hello");
    Assert.assertTrue(filter.contains("hello".getBytes(StandardCharsets.UTF_16)));
    Assert.assertEquals(StandardCharsets.UTF_16, filter.getConfig().getCharset());
  }

  @Test
  public void testOtherDigest() {
    Config conf = Config.getDefault().setDigestAlgorithm("SHA-1");
    SimpleBloomFilter<String> filter = Filters.simple(FilterConfig.create(2048, 12, 100), conf);
    filter.add("hello");
    Assert.assertTrue(filter.contains("hello"));
    Assert.assertEquals("SHA-1", filter.getConfig().getDigestAlgorithm());
  }

  @Test
  public void testClear() {
    SimpleBloomFilter<String> filter = Filters.simpleWithFalsePositiveRate(64, 0.05);
    filter.addAll(Arrays.asList("hello", "nihao", "atguigu"));
    Assert.assertTrue(filter.getBitSet().cardinality() > 0);

    filter.clear();
    Assert.assertEquals(0, filter.getNumberOfAddedElements());
    Assert.assertTrue(filter.getBitSet().isEmpty());
    for (int i = 0; i < filter.getSizeOfBitArray(); i++) {
      Assert.assertFalse(filter.getBit(i));
    }
    Assert.assertFalse(filter.contains("hello"));
    Assert.assertEquals(462, filter.getSizeOfBitArray());

    filter.clear();
    Assert.assertEquals(0, filter.getNumberOfAddedElements());
  }

  @Test
  public void testContainsAllIsConjunction() {
    SimpleBloomFilter<String> filter = Filters.simple(4096, 4, 100);
    filter.addAll(Arrays.asList("a", "b", "c"));
    String absent = findAbsent(filter);

    Assert.assertTrue(filter.containsAll(Arrays.asList("a", "b", "c")));
    Assert.assertFalse(filter.containsAll(Arrays.asList("a", absent, "c")));
    Assert.assertTrue(filter.containsAll(Collections.<String>emptyList()));
  }

  @Test
  public void testAddAllMatchesSequentialAdd() {
    List<String> keys = Arrays.asList("x", "y", "z", "x");
    SimpleBloomFilter<String> bulk = Filters.simple(512, 3, 10);
    SimpleBloomFilter<String> single = Filters.simple(512, 3, 10);

    Assert.assertTrue(bulk.addAll(keys));
    for (String key : keys) {
      single.add(key);
    }
    Assert.assertEquals(single.getBitSet(), bulk.getBitSet());
    Assert.assertEquals(single.getNumberOfAddedElements(), bulk.getNumberOfAddedElements());
    Assert.assertFalse(bulk.addAll(keys));
  }

  @Test
  public void testNullElementRejected() {
    SimpleBloomFilter<String> filter = Filters.simple(1024, 3, 100);
    try {
      filter.add((String) null);
      Assert.fail("null element should be rejected");
    } catch (NullPointerException e) {
      // expected
    }
    try {
      filter.contains((String) null);
      Assert.fail("null element should be rejected");
    } catch (NullPointerException e) {
      // expected
    }
    Assert.assertEquals(0, filter.getNumberOfAddedElements());
    Assert.assertFalse(filter.contains("null"));
  }

  @Test
  public void testGetBitOutOfRange() {
    SimpleBloomFilter<String> filter = Filters.simple(100, 3, 10);
    try {
      filter.getBit(100);
      Assert.fail();
    } catch (IndexOutOfBoundsException e) {
      // expected
    }
    try {
      filter.getBit(-1);
      Assert.fail();
    } catch (IndexOutOfBoundsException e) {
      // expected
    }
  }

  @Test
  public void testCopyIsDeep() {
    SimpleBloomFilter<String> source = Filters.simple(4096, 4, 100);
    source.add("hello");
    SimpleBloomFilter<String> copy = source.copy();

    Assert.assertEquals(source.getFilterConfig(), copy.getFilterConfig());
    Assert.assertEquals(source.getBitSet(), copy.getBitSet());
    Assert.assertEquals(1, copy.getNumberOfAddedElements());
    Assert.assertTrue(copy.contains("hello"));

    String absent = findAbsent(source);
    copy.add(absent);
    Assert.assertFalse(source.contains(absent));

    copy.clear();
    Assert.assertTrue(source.contains("hello"));
  }

  @Test
  public void testCopyOfAdoptsNewSizing() {
    Config conf = Config.getDefault().setDigestAlgorithm("SHA-256");
    SimpleBloomFilter<String> source = Filters.simple(FilterConfig.create(256, 3, 50), conf);
    source.add("hello");

    SimpleBloomFilter<String> copy = SimpleBloomFilter.copyOf(1024, 5, source);
    Assert.assertEquals(1024, copy.getSizeOfBitArray());
    Assert.assertEquals(5, copy.getNumberOfHashes());
    Assert.assertEquals(50, copy.getExpectedNumberOfElements());
    Assert.assertEquals("SHA-256", copy.getConfig().getDigestAlgorithm());
    Assert.assertEquals(source.getBitSet(), copy.getBitSet());
    Assert.assertEquals(1, copy.getNumberOfAddedElements());
  }

  @Test
  public void testProbabilities() {
    SimpleBloomFilter<String> filter = Filters.simpleWithFalsePositiveRate(64, 0.05);
    Assert.assertEquals(0.0, filter.currentFalsePositiveProbability(), 0.0);
    Assert.assertEquals(filter.getFilterConfig().expectedFalsePositiveProbability(),
                        filter.expectedFalsePositiveProbability(), 0.0);
    filter.add("hello");
    Assert.assertEquals(filter.falsePositiveProbability(1), filter.currentFalsePositiveProbability(),
                        0.0);
    Assert.assertTrue(filter.currentFalsePositiveProbability() > 0);
    Assert.assertTrue(filter.currentFalsePositiveProbability()
                      < filter.expectedFalsePositiveProbability());
  }

  @Test
  public void testToString() {
    SimpleBloomFilter<String> filter = Filters.simpleWithFalsePositiveRate(64, 0.05);
    filter.add("hello");
    String s = filter.toString();
    Assert.assertTrue(s, s.startsWith("SimpleBloomFilter"));
    Assert.assertTrue(s, s.contains("size of bit array : 462"));
    Assert.assertTrue(s, s.contains("number of hashes : 5"));
    Assert.assertTrue(s, s.contains("expected number of elements : 64"));
    Assert.assertTrue(s, s.contains("number of added elements : 1"));
    Assert.assertTrue(s, s.contains("current false positive probability"));
  }

  @Test
  public void testBitsPerElementFactory() {
    SimpleBloomFilter<String> filter = Filters.simpleWithBitsPerElement(9.5, 10, 3);
    Assert.assertEquals(95, filter.getSizeOfBitArray());
    Assert.assertEquals(3, filter.getNumberOfHashes());
    Assert.assertEquals(10, filter.getExpectedNumberOfElements());
  }
}
