package org.youdi.minibloom;

import java.util.BitSet;
import java.util.Collection;

/**
 * A probabilistic set: {@link #contains} may report an element which was never added, with a
 * probability bounded by {@link #currentFalsePositiveProbability()}, but never misses one that was
 * added, unless a counting filter removed a colliding element.
 * <p>
 * Non-byte elements are rendered with {@code String.valueOf} and encoded in the configured
 * charset before hashing. Implementations are not thread safe, see
 * {@link Filters#synchronizedFilter(MembershipFilter)}.
 *
 * @param <E> element type.
 */
public interface MembershipFilter<E> {

  /**
   * Add a byte array to the filter.
   *
   * @return true if any bit changed. For a counting filter always true.
   */
  boolean add(byte[] bytes);

  boolean contains(byte[] bytes);

  /**
   * Clear all bits and reset the number of added elements. The sizing is kept.
   */
  void clear();

  /**
   * Read a single bit.
   *
   * @throws IndexOutOfBoundsException if index is outside [0, getSizeOfBitArray()).
   */
  boolean getBit(int index);

  /**
   * @return a snapshot of the bit array, later changes to the filter are not reflected.
   */
  BitSet getBitSet();

  FilterConfig getFilterConfig();

  Config getConfig();

  long getNumberOfAddedElements();

  /**
   * A deep copy with the same sizing, configuration and contents.
   */
  MembershipFilter<E> copy();

  default boolean add(E element) {
    return add(toBytes(element));
  }

  default boolean contains(E element) {
    return contains(toBytes(element));
  }

  /**
   * Add every element in iteration order.
   *
   * @return true if any of the adds changed a bit.
   */
  default boolean addAll(Collection<? extends E> elements) {
    boolean changed = false;
    for (E element : elements) {
      changed |= add(element);
    }
    return changed;
  }

  default boolean containsAll(Collection<? extends E> elements) {
    for (E element : elements) {
      if (!contains(element)) {
        return false;
      }
    }
    return true;
  }

  default byte[] toBytes(E element) {
    if (element == null) {
      throw new NullPointerException("element can not be null");
    }
    return String.valueOf(element).getBytes(getConfig().getCharset());
  }

  default int getSizeOfBitArray() {
    return getFilterConfig().getBitArraySize();
  }

  default int getNumberOfHashes() {
    return getFilterConfig().getNumberOfHashes();
  }

  default int getExpectedNumberOfElements() {
    return getFilterConfig().getExpectedNumberOfElements();
  }

  /**
   * The false positive probability once the expected number of elements has been added.
   */
  default double expectedFalsePositiveProbability() {
    return falsePositiveProbability(getExpectedNumberOfElements());
  }

  /**
   * The false positive probability for the elements added so far.
   */
  default double currentFalsePositiveProbability() {
    return falsePositiveProbability(getNumberOfAddedElements());
  }

  default double falsePositiveProbability(double numberOfElements) {
    return FalsePositiveModel.falsePositiveProbability(getSizeOfBitArray(), getNumberOfHashes(),
                                                       numberOfElements);
  }
}
