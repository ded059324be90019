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

import org.apache.commons.io.IOUtils;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;


/**
 * B-encoding decoder.
 *
 * <p>
 * A b-encoded byte stream can represent byte arrays, numbers, lists and maps
 * (dictionaries). This class implements a decoder of such streams into
 * {@link BEValue}s.
 * </p>
 *
 * <p>
 * The whole input is held in memory so that every error can report the
 * offset of the first malformed byte, and so that each dictionary can keep
 * the exact byte span it was decoded from. Dictionary keys are raw byte
 * strings; they are exposed as ISO-8859-1 strings, which map every byte to
 * exactly one char, so two keys are equal exactly when their bytes are.
 * </p>
 *
 * @author mpetazzoni
 * @see <a href="http://en.wikipedia.org/wiki/Bencode">B-encoding specification</a>
 */
public class BDecoder {

  public static final String KEY_ENCODING = "ISO-8859-1";

  /**
   * Deepest list and dictionary nesting accepted. Real metainfo and tracker
   * responses stay within a handful of levels.
   */
  public static final int MAX_NESTING_DEPTH = 512;

  private final byte[] data;

  private int position;
  private int depth;

  /**
   * Initializes a new BDecoder.
   *
   * <p>
   * Nothing is decoded yet.
   * </p>
   *
   * @param data The bytes to decode.
   */
  public BDecoder(byte[] data) {
    this.data = data;
    this.position = 0;
  }

  /**
   * Decode a B-encoded stream.
   *
   * <p>
   * The stream is read fully, then its root member is decoded.
   * </p>
   *
   * @param in The input stream to read from.
   */
  public static BEValue bdecode(InputStream in) throws IOException {
    return bdecode(IOUtils.toByteArray(in));
  }

  /**
   * Decode a B-encoded byte buffer, from its position to its limit.
   *
   * @param data The {@link ByteBuffer} to read from.
   */
  public static BEValue bdecode(ByteBuffer data) throws InvalidBEncodingException {
    ByteBuffer copy = data.duplicate();
    byte[] bytes = new byte[copy.remaining()];
    copy.get(bytes);
    return bdecode(bytes);
  }

  /**
   * Decode the root member of a B-encoded byte array.
   *
   * @throws InvalidBEncodingException If the input is empty or malformed.
   */
  public static BEValue bdecode(byte[] data) throws InvalidBEncodingException {
    BDecoder decoder = new BDecoder(data);
    if (decoder.isAtEnd()) {
      throw new InvalidBEncodingException("Empty input", 0);
    }
    return decoder.bdecode();
  }

  public boolean isAtEnd() {
    return position >= data.length;
  }

  /**
   * @return the offset of the next byte to decode
   */
  public int getPosition() {
    return position;
  }

  /**
   * Decodes the next value, whatever its type.
   *
   * @throws InvalidBEncodingException If the next value is malformed.
   */
  public BEValue bdecode() throws InvalidBEncodingException {
    int indicator = peek();
    if (indicator >= '0' && indicator <= '9')
      return this.bdecodeBytes();
    else if (indicator == 'i')
      return this.bdecodeNumber();
    else if (indicator == 'l')
      return this.bdecodeList();
    else if (indicator == 'd')
      return this.bdecodeMap();
    else
      throw new InvalidBEncodingException("Unknown indicator '" + describe(indicator) + "'", position);
  }

  /**
   * Returns the next b-encoded value and makes sure it is a byte array.
   *
   * @throws InvalidBEncodingException If it is not a b-encoded byte array.
   */
  public BEValue bdecodeBytes() throws InvalidBEncodingException {
    return new BEValue(readByteString());
  }

  /**
   * Returns the next b-encoded value and makes sure it is a number.
   *
   * @throws InvalidBEncodingException If it is not a number.
   */
  public BEValue bdecodeNumber() throws InvalidBEncodingException {
    expect('i');

    int start = position;
    int c = read();
    if (c == '0') {
      if (peek() != 'e') {
        throw new InvalidBEncodingException("'e' expected after zero, not '" + describe(peek()) + "'", position);
      }
      position++;
      return new BEValue(BigInteger.ZERO);
    }

    StringBuilder digits = new StringBuilder();
    if (c == '-') {
      digits.append('-');
      c = read();
      if (c == '0') {
        throw new InvalidBEncodingException("Negative zero not allowed", position - 1);
      }
    }

    if (c < '1' || c > '9') {
      throw new InvalidBEncodingException("Invalid integer start '" + describe(c) + "'", position - 1);
    }
    digits.append((char) c);

    while ((c = read()) != 'e') {
      if (c < '0' || c > '9') {
        throw new InvalidBEncodingException("Integer should end with 'e', not '" + describe(c) + "'", position - 1);
      }
      digits.append((char) c);
    }

    if (digits.length() > 256) {
      throw new InvalidBEncodingException("Integer is too long", start);
    }
    return new BEValue(new BigInteger(digits.toString()));
  }

  /**
   * Returns the next b-encoded value and makes sure it is a list.
   *
   * @throws InvalidBEncodingException If it is not a list.
   */
  public BEValue bdecodeList() throws InvalidBEncodingException {
    enter();
    expect('l');

    List<BEValue> result = new ArrayList<BEValue>();
    while (peek() != 'e') {
      result.add(this.bdecode());
    }
    position++;
    depth--;

    return new BEValue(result);
  }

  /**
   * Returns the next b-encoded value and makes sure it is a map
   * (dictionary). The returned value carries the dictionary's raw bytes.
   *
   * @throws InvalidBEncodingException If it is not a map, if a key is not a
   *                                   byte string or if a key is repeated.
   */
  public BEValue bdecodeMap() throws InvalidBEncodingException {
    int start = position;
    enter();
    expect('d');

    Map<String, BEValue> result = new LinkedHashMap<String, BEValue>();
    while (peek() != 'e') {
      int keyOffset = position;
      int c = peek();
      if (c < '0' || c > '9') {
        throw new InvalidBEncodingException("Dictionary key must be a byte string, not '" + describe(c) + "'", keyOffset);
      }
      String key = new String(readByteString(), StandardCharsets.ISO_8859_1);
      if (result.containsKey(key)) {
        throw new InvalidBEncodingException("Duplicate dictionary key '" + key + "'", keyOffset);
      }

      BEValue value = this.bdecode();
      result.put(key, value);
    }
    position++;
    depth--;

    return new BEValue(result, Arrays.copyOfRange(data, start, position));
  }

  private byte[] readByteString() throws InvalidBEncodingException {
    int start = position;
    int c = read();
    if (c < '0' || c > '9') {
      throw new InvalidBEncodingException("Number expected, not '" + describe(c) + "'", start);
    }

    long length = c - '0';
    while ((c = read()) != ':') {
      if (c < '0' || c > '9') {
        throw new InvalidBEncodingException("Colon expected, not '" + describe(c) + "'", position - 1);
      }
      length = length * 10 + (c - '0');
      if (length > Integer.MAX_VALUE) {
        throw new InvalidBEncodingException("Byte string length prefix is too large", start);
      }
    }

    if (length > data.length - position) {
      throw new InvalidBEncodingException("Byte string of length " + length + " runs past the end of input", start);
    }
    byte[] result = Arrays.copyOfRange(data, position, position + (int) length);
    position += (int) length;
    return result;
  }

  private void enter() throws InvalidBEncodingException {
    if (++depth > MAX_NESTING_DEPTH) {
      throw new InvalidBEncodingException("Nesting too deep", position);
    }
  }

  private void expect(char indicator) throws InvalidBEncodingException {
    int c = read();
    if (c != indicator) {
      throw new InvalidBEncodingException("Expected '" + indicator + "', not '" + describe(c) + "'", position - 1);
    }
  }

  private int peek() throws InvalidBEncodingException {
    if (position >= data.length) {
      throw new InvalidBEncodingException("Unexpected end of input", position);
    }
    return data[position] & 0xFF;
  }

  private int read() throws InvalidBEncodingException {
    int c = peek();
    position++;
    return c;
  }

  private static String describe(int c) {
    if (c >= 0x20 && c < 0x7F) {
      return String.valueOf((char) c);
    }
    return String.format("0x%02x", c);
  }
}
