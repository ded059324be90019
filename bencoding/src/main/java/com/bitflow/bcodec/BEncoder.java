/**
 * Copyright (C) 2011-2012 Turn, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.bitflow.bcodec;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Writes {@link BEValue}s, and the plain values they wrap, in B-encoding.
 *
 * <p>
 * Strings are written as UTF-8. Dictionary keys are written as ISO-8859-1,
 * the mapping {@link BDecoder} reads them with, and in ascending order of
 * those bytes, so a decoded dictionary encodes back to the bytes it came
 * from.
 * </p>
 *
 * @author mpetazzoni
 * @see <a href="http://en.wikipedia.org/wiki/Bencode">B-encoding specification</a>
 */
public class BEncoder {

  private BEncoder() {
  }

  /**
   * Encodes {@code o} onto {@code out}.
   *
   * @throws IllegalArgumentException when {@code o} is neither a
   *                                  {@link BEValue} nor one of the types
   *                                  it can hold.
   */
  @SuppressWarnings("unchecked")
  public static void bencode(Object o, OutputStream out)
          throws IOException, IllegalArgumentException {
    Object value = o instanceof BEValue ? ((BEValue) o).getValue() : o;

    if (value instanceof byte[]) {
      writeBytes((byte[]) value, out);
    } else if (value instanceof String) {
      writeBytes(((String) value).getBytes(StandardCharsets.UTF_8), out);
    } else if (value instanceof Number) {
      writeToken('i', value.toString(), out);
    } else if (value instanceof List) {
      out.write('l');
      for (Object item : (List<Object>) value) {
        bencode(item, out);
      }
      out.write('e');
    } else if (value instanceof Map) {
      out.write('d');
      for (Map.Entry<String, Object> entry : new TreeMap<String, Object>((Map<String, Object>) value).entrySet()) {
        writeBytes(entry.getKey().getBytes(BDecoder.KEY_ENCODING), out);
        bencode(entry.getValue(), out);
      }
      out.write('e');
    } else {
      throw new IllegalArgumentException("Cannot bencode: " +
              (value == null ? "null" : value.getClass()));
    }
  }

  /**
   * Encodes a dictionary into a freshly allocated buffer.
   */
  public static ByteBuffer bencode(Map<String, BEValue> m) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    bencode(m, out);
    return ByteBuffer.wrap(out.toByteArray());
  }

  private static void writeBytes(byte[] bytes, OutputStream out) throws IOException {
    out.write(Integer.toString(bytes.length).getBytes(StandardCharsets.US_ASCII));
    out.write(':');
    out.write(bytes);
  }

  private static void writeToken(char prefix, String text, OutputStream out) throws IOException {
    out.write(prefix);
    out.write(text.getBytes(StandardCharsets.US_ASCII));
    out.write('e');
  }
}
