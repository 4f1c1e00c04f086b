package org.youdi.minibloom;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Tunables of a filter which do not change its sizing: the digest used to derive hashes, the
 * charset used to render non-byte elements, and how a counting filter treats a full counter.
 */
public class Config {

  public static final String DEFAULT_DIGEST_ALGORITHM = "MD5";

  private String digestAlgorithm = DEFAULT_DIGEST_ALGORITHM;
  private Charset charset = StandardCharsets.UTF_8;
  private OverflowPolicy overflowPolicy = OverflowPolicy.SATURATE;

  /**
   * What a counting filter does when an add would push a counter past {@link CounterStore#MAX_COUNT}.
   */
  public enum OverflowPolicy {
    /** Stop at the bound. A saturated counter is never decremented again. */
    SATURATE,
    /** Reject the add with a {@link CounterOverflowException}, leaving the filter untouched. */
    FAIL
  }

  /**
   * Set the digest algorithm, MD5 by default. The name is resolved right away, so an unknown
   * algorithm fails here rather than on the first add.
   *
   * @throws UnsupportedAlgorithmException if no provider offers a usable digest of that name.
   */
  public Config setDigestAlgorithm(String digestAlgorithm) {
    HashDeriver.lookup(digestAlgorithm);
    this.digestAlgorithm = digestAlgorithm;
    return this;
  }

  public Config setCharset(Charset charset) {
    if (charset == null) {
      throw new IllegalArgumentException("charset can not be null");
    }
    this.charset = charset;
    return this;
  }

  public Config setCharset(String charsetName) {
    return setCharset(Charset.forName(charsetName));
  }

  public Config setOverflowPolicy(OverflowPolicy overflowPolicy) {
    if (overflowPolicy == null) {
      throw new IllegalArgumentException("overflowPolicy can not be null");
    }
    this.overflowPolicy = overflowPolicy;
    return this;
  }

  public String getDigestAlgorithm() {
    return digestAlgorithm;
  }

  public Charset getCharset() {
    return charset;
  }

  public OverflowPolicy getOverflowPolicy() {
    return overflowPolicy;
  }

  public Config copy() {
    Config conf = new Config();
    conf.digestAlgorithm = this.digestAlgorithm;
    conf.charset = this.charset;
    conf.overflowPolicy = this.overflowPolicy;
    return conf;
  }

  @Override
  public String toString() {
    return "Config{digestAlgorithm=" + digestAlgorithm + ", charset=" + charset.name()
           + ", overflowPolicy=" + overflowPolicy + "}";
  }

  public static Config getDefault() {
    return new Config();
  }
}
