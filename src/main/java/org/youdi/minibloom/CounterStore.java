package org.youdi.minibloom;

import java.util.Arrays;

/**
 * Unsigned 8-bit counters, one per filter slot. In a saturating store a counter at
 * {@link #MAX_COUNT} is saturated: {@link #decrement(int)} leaves it alone because the real number
 * of adds behind it is unknown. In a non-saturating store the caller keeps counters within bounds,
 * so {@link #MAX_COUNT} is an exact count and decrements like any other.
 */
public class CounterStore {

  public static final int MAX_COUNT = 0xFF;

  private final byte[] counters;
  private final boolean saturating;

  public CounterStore(int size) {
    this(size, true);
  }

  public CounterStore(int size, boolean saturating) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive, size=" + size);
    }
    this.counters = new byte[size];
    this.saturating = saturating;
  }

  public boolean isSaturating() {
    return saturating;
  }

  public int size() {
    return counters.length;
  }

  public int get(int idx) {
    checkIndex(idx);
    return counters[idx] & 0xFF;
  }

  /**
   * Increment a counter, stopping at {@link #MAX_COUNT}.
   *
   * @return the new value.
   */
  public int increment(int idx) {
    int c = get(idx);
    if (c < MAX_COUNT) {
      counters[idx] = (byte) ++c;
    }
    return c;
  }

  /**
   * Decrement a counter unless it is zero or saturated.
   *
   * @return the new value.
   */
  public int decrement(int idx) {
    int c = get(idx);
    if (c > 0 && !isSaturated(idx)) {
      counters[idx] = (byte) --c;
    }
    return c;
  }

  public boolean isSaturated(int idx) {
    return saturating && get(idx) == MAX_COUNT;
  }

  public void clear() {
    Arrays.fill(counters, (byte) 0);
  }

  public CounterStore copy(int newSize) {
    CounterStore store = new CounterStore(newSize, saturating);
    System.arraycopy(counters, 0, store.counters, 0, Math.min(newSize, counters.length));
    return store;
  }

  public int[] toArray() {
    int[] result = new int[counters.length];
    for (int i = 0; i < counters.length; i++) {
      result[i] = counters[i] & 0xFF;
    }
    return result;
  }

  private void checkIndex(int idx) {
    if (idx < 0 || idx >= counters.length) {
      throw new IndexOutOfBoundsException("Counter index out of range, idx=" + idx + ", size="
                                          + counters.length);
    }
  }
}
