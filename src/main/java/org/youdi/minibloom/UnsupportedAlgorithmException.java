package org.youdi.minibloom;

/**
 * Thrown when a digest algorithm cannot back a {@link HashDeriver}, either because no provider
 * knows the name or because its digest is too short to fold into an int.
 */
public class UnsupportedAlgorithmException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  private final String algorithm;

  public UnsupportedAlgorithmException(String algorithm, String message) {
    super(message);
    this.algorithm = algorithm;
  }

  public UnsupportedAlgorithmException(String algorithm, Throwable cause) {
    super("Unsupported digest algorithm: " + algorithm, cause);
    this.algorithm = algorithm;
  }

  public String getAlgorithm() {
    return algorithm;
  }
}
