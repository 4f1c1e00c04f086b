package org.youdi.minibloom;

import java.util.Arrays;
import java.util.BitSet;

/**
 * Fixed size bit vector backing a filter. Bits are packed eight to a byte, slot i living at
 * {@code bits[i / 8] & (1 << (i % 8))}.
 */
public class BitStore {

  private final int bitLen;
  private final byte[] bits;

  public BitStore(int bitLen) {
    if (bitLen <= 0) {
      throw new IllegalArgumentException("bitLen must be positive, bitLen=" + bitLen);
    }
    this.bitLen = bitLen;
    this.bits = new byte[(bitLen + 7) / 8];
  }

  public int size() {
    return bitLen;
  }

  /**
   * Set a bit.
   *
   * @return true if the bit was clear before.
   */
  public boolean set(int idx) {
    checkIndex(idx);
    int mask = 1 << (idx % 8);
    boolean wasClear = (bits[idx / 8] & mask) == 0;
    bits[idx / 8] |= mask;
    return wasClear;
  }

  public boolean get(int idx) {
    checkIndex(idx);
    return (bits[idx / 8] & (1 << (idx % 8))) != 0;
  }

  public void clear(int idx) {
    checkIndex(idx);
    bits[idx / 8] &= ~(1 << (idx % 8));
  }

  public void clear() {
    Arrays.fill(bits, (byte) 0);
  }

  public int cardinality() {
    int n = 0;
    for (byte b : bits) {
      n += Integer.bitCount(b & 0xFF);
    }
    return n;
  }

  /**
   * Copy into a new store of {@code newLen} bits. Bits past the end of the shorter store are
   * dropped or left clear.
   */
  public BitStore copy(int newLen) {
    BitStore store = new BitStore(newLen);
    if (newLen >= bitLen) {
      System.arraycopy(bits, 0, store.bits, 0, bits.length);
    } else {
      for (int i = 0; i < newLen; i++) {
        if (get(i)) {
          store.set(i);
        }
      }
    }
    return store;
  }

  public BitSet toBitSet() {
    return BitSet.valueOf(bits);
  }

  private void checkIndex(int idx) {
    if (idx < 0 || idx >= bitLen) {
      throw new IndexOutOfBoundsException("Bit index out of range, idx=" + idx + ", bitLen="
                                          + bitLen);
    }
  }
}
