package com.bitflow.common;

import org.apache.commons.codec.digest.DigestUtils;

import java.util.ArrayList;
import java.util.List;

public final class TorrentUtils {

  private final static char[] HEX_SYMBOLS = "0123456789ABCDEF".toCharArray();

  /**
   * @param data for hashing
   * @return sha 1 hash of specified data
   */
  public static byte[] calculateSha1Hash(byte[] data) {
    return DigestUtils.sha1(data);
  }

  /**
   * Convert a byte string to a string containing an hexadecimal
   * representation of the original data.
   *
   * @param bytes The byte array to convert.
   */
  public static String byteArrayToHexString(byte[] bytes) {
    char[] hexChars = new char[bytes.length * 2];
    for (int j = 0; j < bytes.length; j++) {
      int v = bytes[j] & 0xFF;
      hexChars[j * 2] = HEX_SYMBOLS[v >>> 4];
      hexChars[j * 2 + 1] = HEX_SYMBOLS[v & 0x0F];
    }
    return new String(hexChars);
  }

  /**
   * Tells whether a byte is sent as itself in a tracker query string: the
   * RFC 3986 unreserved characters {@code A-Z a-z 0-9 - . _ ~}.
   */
  public static boolean isUrlSafe(byte b) {
    int c = b & 0xFF;
    return (c >= 'A' && c <= 'Z')
            || (c >= 'a' && c <= 'z')
            || (c >= '0' && c <= '9')
            || c == '-' || c == '.' || c == '_' || c == '~';
  }

  /**
   * Percent-encodes a raw byte string for a tracker query string. Safe
   * bytes (see {@link #isUrlSafe(byte)}) pass through, every other byte
   * becomes {@code %XX} with two upper-case hex digits.
   */
  public static String urlEncodeBytes(byte[] bytes) {
    StringBuilder sb = new StringBuilder(bytes.length * 3);
    for (byte b : bytes) {
      if (isUrlSafe(b)) {
        sb.append((char) b);
      } else {
        int v = b & 0xFF;
        sb.append('%').append(HEX_SYMBOLS[v >>> 4]).append(HEX_SYMBOLS[v & 0x0F]);
      }
    }
    return sb.toString();
  }

  public static List<String> getTorrentFileNames(TorrentMetadata metadata) {
    List<String> result = new ArrayList<String>();

    for (TorrentFile torrentFile : metadata.getInfo().getFiles()) {
      result.add(torrentFile.getRelativePathAsString());
    }

    return result;
  }

  private TorrentUtils() {
  }
}
