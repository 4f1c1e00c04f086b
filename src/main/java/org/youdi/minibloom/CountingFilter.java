package org.youdi.minibloom;

import java.util.Collection;

/**
 * A membership filter whose slots carry counters, which makes removal possible.
 * <p>
 * Removal decrements slots shared with other elements, so removing one element may make a
 * colliding element test absent. The filter does not try to detect that.
 */
public interface CountingFilter<E> extends MembershipFilter<E> {

  /**
   * Estimate how many times a byte array was added: the smallest counter among its slots. Collisions
   * only ever inflate the estimate.
   */
  int count(byte[] bytes);

  /**
   * Remove a byte array. Nothing changes if it does not test present.
   *
   * @return true if the byte array tested present and was removed.
   */
  boolean remove(byte[] bytes);

  /**
   * Read a single counter.
   *
   * @throws IndexOutOfBoundsException if index is outside [0, getSizeOfBitArray()).
   */
  int getCount(int index);

  /**
   * @return a snapshot of all counters.
   */
  int[] getCounters();

  @Override
  CountingFilter<E> copy();

  default int count(E element) {
    return count(toBytes(element));
  }

  default boolean remove(E element) {
    return remove(toBytes(element));
  }

  /**
   * Remove every element in iteration order.
   *
   * @return true if every element was removed.
   */
  default boolean removeAll(Collection<? extends E> elements) {
    boolean removed = true;
    for (E element : elements) {
      removed &= remove(element);
    }
    return removed;
  }
}
