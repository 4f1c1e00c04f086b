package org.youdi.minibloom;

import org.apache.log4j.Logger;
import org.youdi.minibloom.Config.OverflowPolicy;

import java.util.BitSet;

/**
 * Counting Bloom filter: a {@link BitStore} paired with a {@link CounterStore} of the same size.
 * A bit is set exactly when its counter is non-zero.
 * <p>
 * Counters are 8 bits wide. Under {@link OverflowPolicy#SATURATE} a counter stops at
 * {@link CounterStore#MAX_COUNT} and is never decremented again, so its slot stays set. Under
 * {@link OverflowPolicy#FAIL} an add which would overflow any of its counters throws
 * {@link CounterOverflowException} before anything is changed.
 */
public class CountingBloomFilter<E> implements CountingFilter<E> {

  private static final Logger LOG = Logger.getLogger(CountingBloomFilter.class);

  private final FilterConfig filterConfig;
  private final Config conf;
  private final HashDeriver hashDeriver;
  private final BitStore bits;
  private final CounterStore counters;
  private long numberOfAddedElements;

  private CountingBloomFilter(FilterConfig filterConfig, Config conf, BitStore bits,
                              CounterStore counters, long numberOfAddedElements) {
    this.filterConfig = filterConfig;
    this.conf = conf;
    this.hashDeriver = HashDeriver.create(conf.getDigestAlgorithm(),
                                          filterConfig.getNumberOfHashes());
    this.bits = bits;
    this.counters = counters;
    this.numberOfAddedElements = numberOfAddedElements;
  }

  public static <E> CountingBloomFilter<E> create(FilterConfig filterConfig, Config conf) {
    int m = filterConfig.getBitArraySize();
    boolean saturating = conf.getOverflowPolicy() == OverflowPolicy.SATURATE;
    CountingBloomFilter<E> filter = new CountingBloomFilter<>(filterConfig, conf.copy(),
        new BitStore(m), new CounterStore(m, saturating), 0);
    LOG.info("Created counting bloom filter, " + filterConfig + ", " + filter.conf
             + ", expectedFalsePositiveProbability=" + filter.expectedFalsePositiveProbability());
    return filter;
  }

  public static <E> CountingBloomFilter<E> create(FilterConfig filterConfig) {
    return create(filterConfig, Config.getDefault());
  }

  /**
   * Build a counting filter from the contents of an existing one. Bits and counters are deep
   * copied; see {@link SimpleBloomFilter#copyOf} for how size, hash count and counts carry over.
   */
  public static <E> CountingBloomFilter<E> copyOf(int bitArraySize, int numberOfHashes,
                                                  CountingBloomFilter<E> source) {
    FilterConfig filterConfig = FilterConfig.create(bitArraySize, numberOfHashes,
                                                    source.getExpectedNumberOfElements());
    return new CountingBloomFilter<>(filterConfig, source.conf.copy(),
        source.bits.copy(bitArraySize), source.counters.copy(bitArraySize),
        source.numberOfAddedElements);
  }

  /**
   * Add a byte array, bumping the counter of each of its slots once per hash landing there.
   *
   * @return always true, a counting filter does not report novelty.
   * @throws CounterOverflowException under {@link OverflowPolicy#FAIL} if a counter would pass
   *                                  {@link CounterStore#MAX_COUNT}.
   */
  @Override
  public boolean add(byte[] bytes) {
    int[] indices = hashDeriver.indices(bytes, bits.size());
    if (conf.getOverflowPolicy() == OverflowPolicy.FAIL) {
      checkOverflow(indices);
    }
    for (int idx : indices) {
      bits.set(idx);
      boolean wasSaturated = counters.isSaturated(idx);
      counters.increment(idx);
      if (!wasSaturated && counters.isSaturated(idx)) {
        LOG.warn("Counter saturated, slot=" + idx + ", maxCount=" + CounterStore.MAX_COUNT
                 + ", the slot will never be cleared by remove");
      }
    }
    numberOfAddedElements++;
    return true;
  }

  private void checkOverflow(int[] indices) {
    for (int i = 0; i < indices.length; i++) {
      int hits = 0;
      for (int idx : indices) {
        if (idx == indices[i]) {
          hits++;
        }
      }
      int count = counters.get(indices[i]);
      if (count + hits > CounterStore.MAX_COUNT) {
        throw new CounterOverflowException(indices[i], count);
      }
    }
  }

  @Override
  public boolean contains(byte[] bytes) {
    for (int idx : hashDeriver.indices(bytes, bits.size())) {
      if (!bits.get(idx)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int count(byte[] bytes) {
    int min = Integer.MAX_VALUE;
    for (int idx : hashDeriver.indices(bytes, bits.size())) {
      min = Math.min(min, counters.get(idx));
    }
    return min;
  }

  @Override
  public boolean remove(byte[] bytes) {
    if (!contains(bytes)) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Skip removing absent element, length=" + bytes.length);
      }
      return false;
    }
    for (int idx : hashDeriver.indices(bytes, bits.size())) {
      if (counters.decrement(idx) == 0) {
        bits.clear(idx);
      }
    }
    return true;
  }

  @Override
  public void clear() {
    bits.clear();
    counters.clear();
    numberOfAddedElements = 0;
  }

  @Override
  public boolean getBit(int index) {
    return bits.get(index);
  }

  @Override
  public int getCount(int index) {
    return counters.get(index);
  }

  @Override
  public int[] getCounters() {
    return counters.toArray();
  }

  @Override
  public BitSet getBitSet() {
    return bits.toBitSet();
  }

  @Override
  public FilterConfig getFilterConfig() {
    return filterConfig;
  }

  @Override
  public Config getConfig() {
    return conf.copy();
  }

  @Override
  public long getNumberOfAddedElements() {
    return numberOfAddedElements;
  }

  @Override
  public CountingBloomFilter<E> copy() {
    return copyOf(getSizeOfBitArray(), getNumberOfHashes(), this);
  }

  @Override
  public String toString() {
    return Filters.describe(this);
  }
}
