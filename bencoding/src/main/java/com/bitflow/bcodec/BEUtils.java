package com.bitflow.bcodec;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.Set;

/**
 * Typed lookups over decoded dictionaries, used by the closed-schema
 * decoders of torrent files and tracker responses.
 */
public final class BEUtils {

  @Nullable
  public static String getString(@Nullable BEValue value)
          throws InvalidBEncodingException {
    if (value == null)
      return null;
    return value.getString();
  }

  @Nullable
  public static byte[] getBytes(@Nullable BEValue value)
          throws InvalidBEncodingException {
    if (value == null)
      return null;
    return value.getBytes();
  }

  public static int getInt(@Nullable BEValue value, int dflt)
          throws InvalidBEncodingException {
    if (value == null)
      return dflt;
    return value.getInt();
  }

  public static long getLong(@Nullable BEValue value, long dflt)
          throws InvalidBEncodingException {
    if (value == null)
      return dflt;
    return value.getLong();
  }

  @NotNull
  public static BEValue getRequired(Map<String, BEValue> map, String key, String context)
          throws MissingFieldException {
    final BEValue value = map.get(key);
    if (value == null)
      throw new MissingFieldException(context, key);
    return value;
  }

  /**
   * Fails on the first key of {@code map} that {@code allowed} does not
   * contain.
   */
  public static void checkKeys(Map<String, BEValue> map, Set<String> allowed, String context)
          throws UnexpectedFieldException {
    for (String key : map.keySet()) {
      if (!allowed.contains(key))
        throw new UnexpectedFieldException(context, key);
    }
  }

  private BEUtils() {
  }
}
