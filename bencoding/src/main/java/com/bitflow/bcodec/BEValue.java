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

import java.io.UnsupportedEncodingException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;


/**
 * A type-agnostic container for B-encoded values.
 *
 * <p>
 * Dictionaries produced by {@link BDecoder} also remember the exact bytes
 * they were decoded from, see {@link #getRawBytes()}.
 * </p>
 *
 * @author mpetazzoni
 */
public class BEValue {

  /**
   * The B-encoded value can be a byte array, a Number, a List or a Map.
   * Lists and Maps contains BEValues too.
   */
  private final Object value;

  private final byte[] rawBytes;

  public BEValue(byte[] value) {
    this.value = value;
    this.rawBytes = null;
  }

  public BEValue(String value) {
    this(value.getBytes(StandardCharsets.UTF_8));
  }

  public BEValue(String value, String enc) throws UnsupportedEncodingException {
    this(value.getBytes(enc));
  }

  public BEValue(int value) {
    this((Number) Integer.valueOf(value));
  }

  public BEValue(long value) {
    this((Number) Long.valueOf(value));
  }

  public BEValue(Number value) {
    this.value = value;
    this.rawBytes = null;
  }

  public BEValue(List<BEValue> value) {
    this.value = value;
    this.rawBytes = null;
  }

  public BEValue(Map<String, BEValue> value) {
    this(value, null);
  }

  /**
   * @param value    the decoded dictionary
   * @param rawBytes the encoded form the dictionary was read from
   */
  public BEValue(Map<String, BEValue> value, byte[] rawBytes) {
    this.value = value;
    this.rawBytes = rawBytes;
  }

  public Object getValue() {
    return this.value;
  }

  /**
   * Returns the exact input bytes this dictionary was decoded from, or
   * <code>null</code> for values built in memory.
   */
  public byte[] getRawBytes() {
    return this.rawBytes;
  }

  public boolean isBytes() {
    return this.value instanceof byte[];
  }

  public boolean isNumber() {
    return this.value instanceof Number;
  }

  public boolean isList() {
    return this.value instanceof List;
  }

  public boolean isMap() {
    return this.value instanceof Map;
  }

  /**
   * Returns this BEValue as a String, interpreted as UTF-8.
   *
   * @throws InvalidBEncodingException If the value is not a byte[].
   */
  public String getString() throws InvalidBEncodingException {
    return this.getString("UTF-8");
  }

  /**
   * Returns this BEValue as a String, interpreted with the specified
   * encoding.
   *
   * @param encoding The encoding to interpret the bytes as when converting
   *                 them into a {@link String}.
   * @throws InvalidBEncodingException If the value is not a byte[].
   */
  public String getString(String encoding) throws InvalidBEncodingException {
    try {
      return new String(this.getBytes(), encoding);
    } catch (UnsupportedEncodingException uee) {
      throw new InternalError(uee.toString());
    }
  }

  /**
   * Returns this BEValue as a byte[].
   *
   * @throws InvalidBEncodingException If the value is not a byte[].
   */
  public byte[] getBytes() throws InvalidBEncodingException {
    if (this.value instanceof byte[]) {
      return (byte[]) this.value;
    }
    throw new InvalidBEncodingException("Expected byte string, got " + describe());
  }

  /**
   * Returns this BEValue as a Number.
   *
   * @throws InvalidBEncodingException If the value is not a {@link Number}.
   */
  public Number getNumber() throws InvalidBEncodingException {
    if (this.value instanceof Number) {
      return (Number) this.value;
    }
    throw new InvalidBEncodingException("Expected integer, got " + describe());
  }

  /**
   * Returns this BEValue as int.
   *
   * @throws InvalidBEncodingException If the value is not a {@link Number}
   *                                   or does not fit into an int.
   */
  public int getInt() throws InvalidBEncodingException {
    long l = this.getLong();
    if (l < Integer.MIN_VALUE || l > Integer.MAX_VALUE) {
      throw new InvalidBEncodingException("Integer " + l + " is out of int range");
    }
    return (int) l;
  }

  /**
   * Returns this BEValue as long.
   *
   * @throws InvalidBEncodingException If the value is not a {@link Number}
   *                                   or does not fit into a long.
   */
  public long getLong() throws InvalidBEncodingException {
    Number number = this.getNumber();
    if (number instanceof BigInteger && ((BigInteger) number).bitLength() > 63) {
      throw new InvalidBEncodingException("Integer " + number + " is out of long range");
    }
    return number.longValue();
  }

  /**
   * Returns this BEValue as a List of BEValues.
   *
   * @throws InvalidBEncodingException If the value is not a {@link List}.
   */
  @SuppressWarnings("unchecked")
  public List<BEValue> getList() throws InvalidBEncodingException {
    if (this.value instanceof List) {
      return (List<BEValue>) this.value;
    }
    throw new InvalidBEncodingException("Expected list, got " + describe());
  }

  /**
   * Returns this BEValue as a Map of String keys and BEValue values.
   *
   * @throws InvalidBEncodingException If the value is not a {@link Map}.
   */
  @SuppressWarnings("unchecked")
  public Map<String, BEValue> getMap() throws InvalidBEncodingException {
    if (this.value instanceof Map) {
      return (Map<String, BEValue>) this.value;
    }
    throw new InvalidBEncodingException("Expected dictionary, got " + describe());
  }

  private String describe() {
    if (isBytes()) return "byte string";
    if (isNumber()) return "integer";
    if (isList()) return "list";
    if (isMap()) return "dictionary";
    return String.valueOf(value);
  }
}
