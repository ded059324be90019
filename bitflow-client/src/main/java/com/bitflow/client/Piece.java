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

import com.bitflow.common.Peer;
import com.bitflow.common.TorrentUtils;

import java.util.Arrays;
import java.util.BitSet;


/**
 * A torrent piece.
 *
 * <p>
 * This class represents a torrent piece. Torrents are made of pieces, which
 * are in turn made of blocks that are exchanged using the peer protocol.
 * The piece length is defined at the torrent level, but the last piece that
 * makes the torrent might be smaller.
 * </p>
 *
 * <p>
 * Besides its state, a piece tracks which peer each of its blocks is
 * currently requested from, which blocks have arrived, and how many connected
 * peers hold it. All mutable state is guarded by the owning
 * {@link PieceManager}'s lock.
 * </p>
 *
 * @author mpetazzoni
 */
public class Piece {

  private final int index;
  private final int length;
  private final byte[] hash;
  private final int blockSize;

  private PieceState state;
  private final Peer[] owners;
  private final BitSet received;
  private byte[] data;
  private int seen;

  /**
   * Initialize a new piece.
   *
   * @param index     This piece index in the torrent.
   * @param length    This piece length, in bytes.
   * @param hash      This piece 20-byte SHA1 hash sum.
   * @param blockSize The size of the blocks requested from peers.
   */
  public Piece(int index, int length, byte[] hash, int blockSize) {
    this.index = index;
    this.length = length;
    this.hash = hash;
    this.blockSize = blockSize;
    this.state = PieceState.MISSING;
    this.owners = new Peer[(length + blockSize - 1) / blockSize];
    this.received = new BitSet(this.owners.length);
    this.seen = 0;
  }

  /**
   * Returns the index of this piece in the torrent.
   */
  public int getIndex() {
    return this.index;
  }

  /**
   * Returns the size, in bytes, of this piece.
   */
  public int getSize() {
    return this.length;
  }

  public PieceState getState() {
    return this.state;
  }

  /**
   * Returns the number of connected peers known to hold this piece.
   */
  public int getAvailability() {
    return this.seen;
  }

  public int getBlockCount() {
    return this.owners.length;
  }

  int getBlockOffset(int block) {
    return block * this.blockSize;
  }

  int getBlockLength(int block) {
    return Math.min(this.blockSize, this.length - block * this.blockSize);
  }

  /**
   * Returns the block starting at {@code offset}, or -1 when no block starts
   * there.
   */
  int blockAt(int offset) {
    if (offset < 0 || offset % this.blockSize != 0 || offset >= this.length) {
      return -1;
    }
    return offset / this.blockSize;
  }

  void seenAt() {
    this.seen++;
  }

  void noLongerAt() {
    if (this.seen > 0) {
      this.seen--;
    }
  }

  void start() {
    this.state = PieceState.IN_FLIGHT;
    this.data = new byte[this.length];
  }

  Peer getOwner(int block) {
    return this.owners[block];
  }

  void setOwner(int block, Peer peer) {
    this.owners[block] = peer;
  }

  boolean isReceived(int block) {
    return this.received.get(block);
  }

  boolean hasOwners() {
    for (Peer owner : this.owners) {
      if (owner != null) {
        return true;
      }
    }
    return false;
  }

  boolean hasReceivedBlocks() {
    return !this.received.isEmpty();
  }

  /**
   * Stores a block; returns true when it was the last one missing.
   */
  boolean store(int block, byte[] bytes) {
    System.arraycopy(bytes, 0, this.data, getBlockOffset(block), bytes.length);
    this.received.set(block);
    this.owners[block] = null;
    return this.received.cardinality() == this.owners.length;
  }

  /**
   * Moves the piece to VERIFYING and hands its buffer to the caller.
   */
  byte[] startVerifying() {
    this.state = PieceState.VERIFYING;
    byte[] bytes = this.data;
    this.data = null;
    return bytes;
  }

  void complete() {
    this.state = PieceState.COMPLETE;
    this.data = null;
    Arrays.fill(this.owners, null);
    this.received.clear();
  }

  /**
   * Drops every received block and request, back to MISSING.
   */
  void reset() {
    this.state = PieceState.MISSING;
    this.data = null;
    Arrays.fill(this.owners, null);
    this.received.clear();
  }

  /**
   * Tells whether {@code bytes} hash to this piece's expected SHA-1.
   */
  public boolean isValid(byte[] bytes) {
    return bytes.length == this.length &&
            Arrays.equals(TorrentUtils.calculateSha1Hash(bytes), this.hash);
  }

  /**
   * Return a human-readable representation of this piece.
   */
  public String toString() {
    return String.format("piece#%4d%s",
            this.index,
            this.state == PieceState.COMPLETE ? "+" : "-");
  }
}
