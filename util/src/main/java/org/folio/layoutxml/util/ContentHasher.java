package org.folio.layoutxml.util;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Incremental SHA-256 over the raw input chunks.
 *
 * <p>Must see every chunk, in order, before the chunk is handed to the XML parser.
 * The result is independent of where chunk boundaries fall.
 */
public class ContentHasher {

  static final String ALGORITHM = "SHA-256";

  private final MessageDigest messageDigest;

  private Digest digest;

  /**
   * Create hasher.
   * @throws IllegalStateException if the JVM lacks SHA-256
   */
  public ContentHasher() {
    try {
      messageDigest = MessageDigest.getInstance(ALGORITHM);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException(e.getMessage(), e);
    }
  }

  /**
   * Add chunk.
   * @param buf buffer
   * @param offset offset in buffer
   * @param length number of bytes
   * @throws IllegalStateException if already finalized
   */
  public void update(byte[] buf, int offset, int length) {
    if (digest != null) {
      throw new IllegalStateException("Digest already computed");
    }
    messageDigest.update(buf, offset, length);
  }

  public void update(byte[] buf) {
    update(buf, 0, buf.length);
  }

  /**
   * Finalize; may only be called once.
   * @return digest of all bytes seen
   * @throws IllegalStateException if called twice
   */
  public Digest digest() {
    if (digest != null) {
      throw new IllegalStateException("Digest already computed");
    }
    digest = Digest.of(messageDigest.digest());
    return digest;
  }

  public boolean isFinalized() {
    return digest != null;
  }
}
