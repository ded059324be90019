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

import com.bitflow.Constants;
import com.google.common.base.Preconditions;

import java.util.Arrays;

/**
 * The 20-byte SHA-1 digest of a torrent's raw <code>info</code> dictionary,
 * identifying the swarm in every tracker and peer exchange.
 */
public final class InfoHash {

  private final byte[] bytes;
  private final String hex;

  private InfoHash(byte[] bytes) {
    Preconditions.checkArgument(bytes.length == Constants.PIECE_HASH_SIZE,
            "info hash must be %s bytes, got %s", Constants.PIECE_HASH_SIZE, bytes.length);
    this.bytes = bytes.clone();
    this.hex = TorrentUtils.byteArrayToHexString(bytes);
  }

  public static InfoHash fromBytes(byte[] bytes) {
    return new InfoHash(bytes);
  }

  /**
   * Hashes the exact bytes of a bencoded <code>info</code> dictionary.
   */
  public static InfoHash ofInfoDictionary(byte[] rawInfo) {
    return new InfoHash(TorrentUtils.calculateSha1Hash(rawInfo));
  }

  public byte[] getBytes() {
    return bytes.clone();
  }

  public String getHexInfoHash() {
    return hex;
  }

  public String urlEncoded() {
    return TorrentUtils.urlEncodeBytes(bytes);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return Arrays.equals(bytes, ((InfoHash) o).bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return hex;
  }
}
