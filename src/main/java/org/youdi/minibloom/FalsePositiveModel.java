package org.youdi.minibloom;

/**
 * Closed-form false positive model of a Bloom filter and the sizing rules derived from it.
 */
public final class FalsePositiveModel {

  private static final double LN2 = Math.log(2);

  private FalsePositiveModel() {
  }

  /**
   * (1 - e^(-k * n / m))^k
   *
   * @param bitArraySize     m, number of slots.
   * @param numberOfHashes   k, hashes per element.
   * @param numberOfElements n, elements added.
   */
  public static double falsePositiveProbability(int bitArraySize, int numberOfHashes,
                                                double numberOfElements) {
    return Math.pow(1 - Math.exp(-numberOfHashes * numberOfElements / (double) bitArraySize),
                    numberOfHashes);
  }

  /**
   * k = ceil(-log2(p))
   */
  public static int hashCountFor(double falsePositiveProbability) {
    if (!(falsePositiveProbability > 0 && falsePositiveProbability < 1)) {
      throw new IllegalArgumentException("falsePositiveProbability must be in (0, 1), p="
                                         + falsePositiveProbability);
    }
    return (int) Math.ceil(-(Math.log(falsePositiveProbability) / LN2));
  }

  /**
   * c = k / ln(2), the bits per element minimising the false positive rate for k hashes.
   */
  public static double bitsPerElementFor(int numberOfHashes) {
    return numberOfHashes / LN2;
  }

  /**
   * m = ceil(c * n)
   */
  public static int bitArraySizeFor(double bitsPerElement, int numberOfElements) {
    if (!(bitsPerElement > 0)) {
      throw new IllegalArgumentException("bitsPerElement must be positive, bitsPerElement="
                                         + bitsPerElement);
    }
    double m = Math.ceil(bitsPerElement * numberOfElements);
    if (m > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("Bit array too large, bitsPerElement=" + bitsPerElement
                                         + ", numberOfElements=" + numberOfElements);
    }
    return (int) m;
  }
}
