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
package com.bitflow.common;

import com.google.common.base.Preconditions;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Random;

/**
 * A 20-byte peer identifier.
 *
 * <p>
 * The local id is generated once per client and handed to every task that
 * needs it; remote ids are learnt from tracker responses and handshakes.
 * </p>
 */
public final class PeerId {

  public static final int LENGTH = 20;

  private static final char[] HEX_SYMBOLS = "0123456789abcdef".toCharArray();

  private final byte[] bytes;

  private PeerId(byte[] bytes) {
    Preconditions.checkArgument(bytes.length == LENGTH,
            "peer id must be %s bytes, got %s", LENGTH, bytes.length);
    this.bytes = bytes.clone();
  }

  public static PeerId fromBytes(byte[] bytes) {
    return new PeerId(bytes);
  }

  /**
   * Builds an id from a client signature (for instance {@code -BF0100-})
   * followed by random hex digits.
   */
  public static PeerId generate(String prefix, Random random) {
    byte[] signature = prefix.getBytes(StandardCharsets.US_ASCII);
    Preconditions.checkArgument(signature.length < LENGTH, "prefix %s is too long", prefix);
    byte[] id = Arrays.copyOf(signature, LENGTH);
    for (int i = signature.length; i < LENGTH; i++) {
      id[i] = (byte) HEX_SYMBOLS[random.nextInt(HEX_SYMBOLS.length)];
    }
    return new PeerId(id);
  }

  public byte[] getBytes() {
    return bytes.clone();
  }

  public String getHexPeerId() {
    return TorrentUtils.byteArrayToHexString(bytes);
  }

  public String urlEncoded() {
    return TorrentUtils.urlEncodeBytes(bytes);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return Arrays.equals(bytes, ((PeerId) o).bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return new String(bytes, StandardCharsets.ISO_8859_1);
  }
}
