package com.codeheadsystems.provision.crypto.common;

import java.util.Arrays;
import java.util.Base64;

/**
 * Utility methods for fixed-width integer encoding, concatenation, base64 fields and
 * wiping of secret buffers.
 */
public class ByteUtils {

  private static final Base64.Encoder URL_ENCODER = Base64.getUrlEncoder().withoutPadding();
  private static final Base64.Decoder URL_DECODER = Base64.getUrlDecoder();

  private ByteUtils() {
  }

  /**
   * Big-endian encoding of a non-negative int into four bytes.
   *
   * @param value the value
   * @return the byte [ ]
   */
  public static byte[] uint32(int value) {
    if (value < 0) {
      throw new IllegalArgumentException("Negative length: " + value);
    }
    return new byte[]{
        (byte) (value >>> 24), (byte) (value >>> 16), (byte) (value >>> 8), (byte) value
    };
  }

  /**
   * Big-endian encoding of a long into eight bytes.
   *
   * @param value the value
   * @return the byte [ ]
   */
  public static byte[] uint64(long value) {
    byte[] out = new byte[8];
    for (int i = 7; i >= 0; i--) {
      out[i] = (byte) (value & 0xFF);
      value >>>= 8;
    }
    return out;
  }

  /**
   * Concatenates multiple byte arrays into a single array.
   *
   * @param arrays the arrays
   * @return the byte [ ]
   */
  public static byte[] concat(byte[]... arrays) {
    int totalLength = 0;
    for (byte[] arr : arrays) {
      totalLength += arr.length;
    }
    byte[] result = new byte[totalLength];
    int offset = 0;
    for (byte[] arr : arrays) {
      System.arraycopy(arr, 0, result, offset, arr.length);
      offset += arr.length;
    }
    return result;
  }

  /**
   * Overwrites every given buffer with zeros. Null entries are ignored.
   *
   * @param buffers the buffers to wipe
   */
  public static void wipe(byte[]... buffers) {
    for (byte[] buffer : buffers) {
      if (buffer != null) {
        Arrays.fill(buffer, (byte) 0);
      }
    }
  }

  public static String toBase64Url(byte[] bytes) {
    return URL_ENCODER.encodeToString(bytes);
  }

  /**
   * Decodes URL-safe base64 with or without padding.
   *
   * @param value the encoded value
   * @return the decoded bytes
   * @throws IllegalArgumentException if the value is null or not valid base64url
   */
  public static byte[] fromBase64Url(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Missing base64url value");
    }
    return URL_DECODER.decode(value);
  }

  public static String toBase64(byte[] bytes) {
    return Base64.getEncoder().encodeToString(bytes);
  }

  /**
   * Decodes standard base64.
   *
   * @param value the encoded value
   * @return the decoded bytes
   * @throws IllegalArgumentException if the value is null or not valid base64
   */
  public static byte[] fromBase64(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Missing base64 value");
    }
    return Base64.getDecoder().decode(value);
  }
}
