package org.youdi.minibloom;

/**
 * Immutable sizing of a filter: bit array size m, hash count k and expected element count n.
 * All three parameter shapes a filter can be built from are normalised here.
 */
public final class FilterConfig {

  private final int bitArraySize;
  private final int numberOfHashes;
  private final int expectedNumberOfElements;

  private FilterConfig(int bitArraySize, int numberOfHashes, int expectedNumberOfElements) {
    this.bitArraySize = bitArraySize;
    this.numberOfHashes = numberOfHashes;
    this.expectedNumberOfElements = expectedNumberOfElements;
  }

  public static FilterConfig create(int bitArraySize, int numberOfHashes,
                                    int expectedNumberOfElements) {
    if (bitArraySize <= 0) {
      throw new IllegalArgumentException("bitArraySize must be positive, bitArraySize="
                                         + bitArraySize);
    }
    if (numberOfHashes <= 0) {
      throw new IllegalArgumentException("numberOfHashes must be positive, numberOfHashes="
                                         + numberOfHashes);
    }
    if (expectedNumberOfElements <= 0) {
      throw new IllegalArgumentException(
          "expectedNumberOfElements must be positive, expectedNumberOfElements="
          + expectedNumberOfElements);
    }
    return new FilterConfig(bitArraySize, numberOfHashes, expectedNumberOfElements);
  }

  /**
   * Size the bit array as ceil(bitsPerElement * expectedNumberOfElements).
   */
  public static FilterConfig fromBitsPerElement(double bitsPerElement,
                                                int expectedNumberOfElements,
                                                int numberOfHashes) {
    if (expectedNumberOfElements <= 0) {
      throw new IllegalArgumentException(
          "expectedNumberOfElements must be positive, expectedNumberOfElements="
          + expectedNumberOfElements);
    }
    int m = FalsePositiveModel.bitArraySizeFor(bitsPerElement, expectedNumberOfElements);
    return create(m, numberOfHashes, expectedNumberOfElements);
  }

  /**
   * Pick k and m so that a filter holding expectedNumberOfElements has a false positive
   * probability no higher than the given one.
   */
  public static FilterConfig fromFalsePositiveRate(int expectedNumberOfElements,
                                                   double falsePositiveProbability) {
    int k = FalsePositiveModel.hashCountFor(falsePositiveProbability);
    return fromBitsPerElement(FalsePositiveModel.bitsPerElementFor(k), expectedNumberOfElements,
                              k);
  }

  public int getBitArraySize() {
    return bitArraySize;
  }

  public int getNumberOfHashes() {
    return numberOfHashes;
  }

  public int getExpectedNumberOfElements() {
    return expectedNumberOfElements;
  }

  public double expectedFalsePositiveProbability() {
    return FalsePositiveModel.falsePositiveProbability(bitArraySize, numberOfHashes,
                                                       expectedNumberOfElements);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FilterConfig)) {
      return false;
    }
    FilterConfig that = (FilterConfig) o;
    return bitArraySize == that.bitArraySize && numberOfHashes == that.numberOfHashes
           && expectedNumberOfElements == that.expectedNumberOfElements;
  }

  @Override
  public int hashCode() {
    return (bitArraySize * 31 + numberOfHashes) * 31 + expectedNumberOfElements;
  }

  @Override
  public String toString() {
    return "FilterConfig{m=" + bitArraySize + ", k=" + numberOfHashes + ", n="
           + expectedNumberOfElements + "}";
  }
}
