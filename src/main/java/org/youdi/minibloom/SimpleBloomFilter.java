package org.youdi.minibloom;

import org.apache.log4j.Logger;

import java.util.BitSet;

/**
 * Plain Bloom filter over a {@link BitStore}. Never reports a false negative.
 */
public class SimpleBloomFilter<E> implements MembershipFilter<E> {

  private static final Logger LOG = Logger.getLogger(SimpleBloomFilter.class);

  private final FilterConfig filterConfig;
  private final Config conf;
  private final HashDeriver hashDeriver;
  private final BitStore bits;
  private long numberOfAddedElements;

  private SimpleBloomFilter(FilterConfig filterConfig, Config conf, BitStore bits,
                            long numberOfAddedElements) {
    this.filterConfig = filterConfig;
    this.conf = conf;
    this.hashDeriver = HashDeriver.create(conf.getDigestAlgorithm(),
                                          filterConfig.getNumberOfHashes());
    this.bits = bits;
    this.numberOfAddedElements = numberOfAddedElements;
  }

  public static <E> SimpleBloomFilter<E> create(FilterConfig filterConfig, Config conf) {
    SimpleBloomFilter<E> filter = new SimpleBloomFilter<>(filterConfig, conf.copy(),
        new BitStore(filterConfig.getBitArraySize()), 0);
    LOG.info("Created bloom filter, " + filterConfig + ", " + filter.conf
             + ", expectedFalsePositiveProbability=" + filter.expectedFalsePositiveProbability());
    return filter;
  }

  public static <E> SimpleBloomFilter<E> create(FilterConfig filterConfig) {
    return create(filterConfig, Config.getDefault());
  }

  /**
   * Build a filter from the contents of an existing one. The bits are deep copied, so the two
   * filters never affect each other afterwards. The new filter takes the given size and hash
   * count, and keeps the source's configuration, expected number of elements and number of added
   * elements. Bits past the end of the smaller array are dropped or left clear.
   */
  public static <E> SimpleBloomFilter<E> copyOf(int bitArraySize, int numberOfHashes,
                                                SimpleBloomFilter<E> source) {
    FilterConfig filterConfig = FilterConfig.create(bitArraySize, numberOfHashes,
                                                    source.getExpectedNumberOfElements());
    return new SimpleBloomFilter<>(filterConfig, source.conf.copy(),
        source.bits.copy(bitArraySize), source.numberOfAddedElements);
  }

  @Override
  public boolean add(byte[] bytes) {
    boolean changed = false;
    for (int idx : hashDeriver.indices(bytes, bits.size())) {
      changed |= bits.set(idx);
    }
    numberOfAddedElements++;
    return changed;
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
  public void clear() {
    bits.clear();
    numberOfAddedElements = 0;
  }

  @Override
  public boolean getBit(int index) {
    return bits.get(index);
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
  public SimpleBloomFilter<E> copy() {
    return copyOf(getSizeOfBitArray(), getNumberOfHashes(), this);
  }

  @Override
  public String toString() {
    return Filters.describe(this);
  }
}
