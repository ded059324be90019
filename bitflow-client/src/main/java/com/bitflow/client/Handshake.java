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
package com.bitflow.client;

import com.bitflow.Constants;
import com.bitflow.common.InfoHash;
import com.bitflow.common.PeerId;

import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.text.ParseException;
import java.util.Arrays;


/**
 * Peer handshake message.
 *
 * <p>
 * 68 bytes: the protocol name length (19), the protocol name, eight reserved
 * bytes, the torrent info hash and the sender's peer id.
 * </p>
 *
 * @author mpetazzoni
 */
public class Handshake {

  public static final String BITTORRENT_PROTOCOL_IDENTIFIER = "BitTorrent protocol";
  public static final int BASE_HANDSHAKE_LENGTH = 49;
  public static final int LENGTH = BASE_HANDSHAKE_LENGTH + BITTORRENT_PROTOCOL_IDENTIFIER.length();

  private static final byte[] PROTOCOL_BYTES =
          BITTORRENT_PROTOCOL_IDENTIFIER.getBytes(Charset.forName(Constants.BYTE_ENCODING));

  private final ByteBuffer data;
  private final InfoHash infoHash;
  private final PeerId peerId;

  private Handshake(ByteBuffer data, InfoHash infoHash, PeerId peerId) {
    this.data = data;
    this.data.rewind();
    this.infoHash = infoHash;
    this.peerId = peerId;
  }

  public ByteBuffer getData() {
    return this.data.duplicate();
  }

  public InfoHash getInfoHash() {
    return this.infoHash;
  }

  public PeerId getPeerId() {
    return this.peerId;
  }

  /**
   * Parses a handshake from the 68 bytes between {@code buffer}'s position
   * and limit.
   *
   * @throws ParseException when the length or the protocol name is wrong.
   */
  public static Handshake parse(ByteBuffer buffer) throws ParseException {
    if (buffer.remaining() != LENGTH) {
      throw new ParseException("Incorrect handshake message length (" +
              buffer.remaining() + " bytes)!", 0);
    }
    ByteBuffer data = ByteBuffer.allocate(LENGTH);
    data.put(buffer.duplicate());

    int pstrlen = buffer.get() & 0xFF;
    if (pstrlen != PROTOCOL_BYTES.length) {
      throw new ParseException("Incorrect protocol identifier length " +
              "(pstrlen=" + pstrlen + ")!", 0);
    }

    byte[] pstr = new byte[pstrlen];
    buffer.get(pstr);
    if (!Arrays.equals(PROTOCOL_BYTES, pstr)) {
      throw new ParseException("Invalid protocol identifier!", 1);
    }

    // Reserved bytes, unused.
    buffer.position(buffer.position() + 8);

    byte[] infoHash = new byte[20];
    buffer.get(infoHash);
    byte[] peerId = new byte[PeerId.LENGTH];
    buffer.get(peerId);
    return new Handshake(data, InfoHash.fromBytes(infoHash), PeerId.fromBytes(peerId));
  }

  public static Handshake craft(InfoHash infoHash, PeerId peerId) {
    ByteBuffer buffer = ByteBuffer.allocate(LENGTH);
    buffer.put((byte) PROTOCOL_BYTES.length);
    buffer.put(PROTOCOL_BYTES);
    buffer.put(new byte[8]);
    buffer.put(infoHash.getBytes());
    buffer.put(peerId.getBytes());
    return new Handshake(buffer, infoHash, peerId);
  }

  @Override
  public String toString() {
    return "handshake " + this.infoHash + " from " + this.peerId.getHexPeerId();
  }
}
