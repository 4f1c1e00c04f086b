package org.youdi.minibloom;

/**
 * Factories for the two filter variants, one per way of sizing a filter.
 */
public final class Filters {

  private Filters() {
  }

  public static <E> SimpleBloomFilter<E> simple(FilterConfig filterConfig) {
    return SimpleBloomFilter.create(filterConfig);
  }

  public static <E> SimpleBloomFilter<E> simple(FilterConfig filterConfig, Config conf) {
    return SimpleBloomFilter.create(filterConfig, conf);
  }

  public static <E> SimpleBloomFilter<E> simple(int bitArraySize, int numberOfHashes,
                                                int expectedNumberOfElements) {
    return simple(FilterConfig.create(bitArraySize, numberOfHashes, expectedNumberOfElements));
  }

  public static <E> SimpleBloomFilter<E> simpleWithBitsPerElement(double bitsPerElement,
                                                                  int expectedNumberOfElements,
                                                                  int numberOfHashes) {
    return simple(FilterConfig.fromBitsPerElement(bitsPerElement, expectedNumberOfElements,
                                                  numberOfHashes));
  }

  public static <E> SimpleBloomFilter<E> simpleWithFalsePositiveRate(int expectedNumberOfElements,
                                                                     double falsePositiveProbability) {
    return simple(FilterConfig.fromFalsePositiveRate(expectedNumberOfElements,
                                                     falsePositiveProbability));
  }

  public static <E> CountingBloomFilter<E> counting(FilterConfig filterConfig) {
    return CountingBloomFilter.create(filterConfig);
  }

  public static <E> CountingBloomFilter<E> counting(FilterConfig filterConfig, Config conf) {
    return CountingBloomFilter.create(filterConfig, conf);
  }

  public static <E> CountingBloomFilter<E> counting(int bitArraySize, int numberOfHashes,
                                                    int expectedNumberOfElements) {
    return counting(FilterConfig.create(bitArraySize, numberOfHashes, expectedNumberOfElements));
  }

  public static <E> CountingBloomFilter<E> countingWithBitsPerElement(double bitsPerElement,
                                                                      int expectedNumberOfElements,
                                                                      int numberOfHashes) {
    return counting(FilterConfig.fromBitsPerElement(bitsPerElement, expectedNumberOfElements,
                                                    numberOfHashes));
  }

  public static <E> CountingBloomFilter<E> countingWithFalsePositiveRate(
      int expectedNumberOfElements, double falsePositiveProbability) {
    return counting(FilterConfig.fromFalsePositiveRate(expectedNumberOfElements,
                                                       falsePositiveProbability));
  }

  /**
   * Wrap a filter so that every operation runs under a read/write lock of its own.
   */
  public static <E> MembershipFilter<E> synchronizedFilter(MembershipFilter<E> filter) {
    return new LockedMembershipFilter<>(filter);
  }

  public static <E> CountingFilter<E> synchronizedCountingFilter(CountingFilter<E> filter) {
    return new LockedCountingFilter<>(filter);
  }

  static String describe(MembershipFilter<?> filter) {
    StringBuilder sb = new StringBuilder();
    sb.append(filter.getClass().getSimpleName()).append(": {\n");
    sb.append("  size of bit array : ").append(filter.getSizeOfBitArray()).append('\n');
    sb.append("  number of hashes : ").append(filter.getNumberOfHashes()).append('\n');
    sb.append("  expected number of elements : ").append(filter.getExpectedNumberOfElements())
        .append('\n');
    sb.append("  number of added elements : ").append(filter.getNumberOfAddedElements())
        .append('\n');
    sb.append("  expected false positive probability : ")
        .append(filter.expectedFalsePositiveProbability()).append('\n');
    sb.append("  current false positive probability : ")
        .append(filter.currentFalsePositiveProbability()).append('\n');
    sb.append('}');
    return sb.toString();
  }
}
