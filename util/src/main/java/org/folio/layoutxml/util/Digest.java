package org.folio.layoutxml.util;

import java.util.Arrays;

/**
 * SHA-256 fingerprint of the raw bytes of a layout document.
 */
public final class Digest {

  public static final int LENGTH = 32;

  private static final char[] HEX = "0123456789abcdef".toCharArray();

  private final byte[] bytes;

  private Digest(byte[] bytes) {
    this.bytes = bytes;
  }

  /**
   * Create digest from raw bytes.
   * @param bytes 32 bytes; copied
   * @return digest
   * @throws IllegalArgumentException if length is not 32
   */
  public static Digest of(byte[] bytes) {
    if (bytes == null || bytes.length != LENGTH) {
      throw new IllegalArgumentException("Digest must be " + LENGTH + " bytes");
    }
    return new Digest(bytes.clone());
  }

  /**
   * Parse digest from its hex representation.
   * @param hex 64 hex digits, either case
   * @return digest
   * @throws IllegalArgumentException if not a valid digest
   */
  public static Digest fromHex(String hex) {
    if (hex == null || hex.length() != LENGTH * 2) {
      throw new IllegalArgumentException("Bad digest: " + hex);
    }
    byte[] bytes = new byte[LENGTH];
    for (int i = 0; i < LENGTH; i++) {
      int hi = Character.digit(hex.charAt(2 * i), 16);
      int lo = Character.digit(hex.charAt(2 * i + 1), 16);
      if (hi < 0 || lo < 0) {
        throw new IllegalArgumentException("Bad digest: " + hex);
      }
      bytes[i] = (byte) ((hi << 4) | lo);
    }
    return new Digest(bytes);
  }

  public byte[] getBytes() {
    return bytes.clone();
  }

  /**
   * Lower-case hex representation.
   * @return 64 hex digits
   */
  public String toHex() {
    char[] out = new char[LENGTH * 2];
    for (int i = 0; i < LENGTH; i++) {
      out[2 * i] = HEX[(bytes[i] >> 4) & 0xf];
      out[2 * i + 1] = HEX[bytes[i] & 0xf];
    }
    return new String(out);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Digest)) {
      return false;
    }
    return Arrays.equals(bytes, ((Digest) o).bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return toHex();
  }
}
