package org.youdi.minibloom;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Derives k int hashes from a byte array by running a salted digest until enough 4-byte groups
 * have been produced. Round s digests the single salt byte {@code (byte) s} followed by the data.
 * <p>
 * One digest engine is owned per deriver and guarded by its monitor for the whole multi-round
 * derivation, so concurrent callers never interleave salt and data inside the engine.
 */
public class HashDeriver {

  private final String algorithm;
  private final int numberOfHashes;
  private final MessageDigest digest;

  private HashDeriver(String algorithm, int numberOfHashes, MessageDigest digest) {
    this.algorithm = algorithm;
    this.numberOfHashes = numberOfHashes;
    this.digest = digest;
  }

  public static HashDeriver create(String algorithm, int numberOfHashes) {
    if (numberOfHashes <= 0) {
      throw new IllegalArgumentException("numberOfHashes must be positive, numberOfHashes="
                                         + numberOfHashes);
    }
    return new HashDeriver(algorithm, numberOfHashes, lookup(algorithm));
  }

  static MessageDigest lookup(String algorithm) {
    if (algorithm == null) {
      throw new UnsupportedAlgorithmException(null, "digest algorithm can not be null");
    }
    MessageDigest md;
    try {
      md = MessageDigest.getInstance(algorithm);
    } catch (NoSuchAlgorithmException e) {
      throw new UnsupportedAlgorithmException(algorithm, e);
    }
    // A digest must yield at least one 4-byte group, otherwise derivation never terminates.
    if (md.getDigestLength() < 4) {
      throw new UnsupportedAlgorithmException(algorithm,
          "Digest too short, algorithm=" + algorithm + ", digestLength=" + md.getDigestLength());
    }
    return md;
  }

  /**
   * A deriver for the same algorithm and hash count with an engine of its own.
   */
  public HashDeriver copy() {
    return create(algorithm, numberOfHashes);
  }

  public String getAlgorithm() {
    return algorithm;
  }

  public int getNumberOfHashes() {
    return numberOfHashes;
  }

  public int[] hashes(byte[] data) {
    if (data == null) {
      throw new NullPointerException("data can not be null");
    }
    int[] result = new int[numberOfHashes];
    int k = 0;
    int salt = 0;
    synchronized (digest) {
      while (k < numberOfHashes) {
        digest.update((byte) salt);
        salt++;
        // digest() finishes the round and resets the engine for the next one.
        byte[] d = digest.digest(data);
        for (int i = 0; i < d.length / 4 && k < numberOfHashes; i++) {
          int h = 0;
          for (int j = i * 4; j < i * 4 + 4; j++) {
            h <<= 8;
            h |= d[j] & 0xFF;
          }
          result[k++] = h;
        }
      }
    }
    return result;
  }

  public int[] indices(byte[] data, int size) {
    int[] hashes = hashes(data);
    for (int i = 0; i < hashes.length; i++) {
      hashes[i] = indexFor(hashes[i], size);
    }
    return hashes;
  }

  /**
   * Map a raw hash to a slot in [0, size). Same as abs(h) mod size, but taking the remainder first
   * keeps Integer.MIN_VALUE in range.
   */
  public static int indexFor(int hash, int size) {
    return Math.abs(hash % size);
  }
}
