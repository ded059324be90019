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

import com.bitflow.client.storage.TorrentByteStorage;
import com.bitflow.client.strategy.RequestStrategy;
import com.bitflow.common.LoggerUtils;
import com.bitflow.common.Peer;
import com.bitflow.common.TorrentInfo;
import com.bitflow.common.TorrentLoggerFactory;
import com.google.common.base.Preconditions;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owns the piece and block bookkeeping of one torrent.
 *
 * <p>
 * Connection tasks ask the manager which blocks to request, hand it the
 * blocks they receive and report what their peer holds. One read/write lock
 * guards the piece states, block ownership, availability counts and the
 * transfer counters, so a block is never requested from two peers at the
 * same time and progress snapshots are always consistent. Hash verification
 * and storage I/O run outside the lock.
 * </p>
 */
public class PieceManager {

  private static final Logger logger =
          TorrentLoggerFactory.getLogger(PieceManager.class);

  public enum Reception {
    /** The block was not outstanding with that peer and was dropped. */
    IGNORED,
    /** The block was stored; the piece still misses blocks. */
    INCOMPLETE,
    /** The block completed the piece and the piece verified. */
    VALID,
    /** The block completed the piece but the hash did not match. */
    INVALID
  }

  private final TorrentInfo torrent;
  private final TorrentByteStorage storage;
  private final RequestStrategy requestStrategy;
  private final Piece[] pieces;
  private final BitSet completed;
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final List<DownloadProgressListener> listeners = new CopyOnWriteArrayList<DownloadProgressListener>();

  private long downloaded;
  private long uploaded;
  private long left;

  public PieceManager(@NotNull TorrentInfo torrent,
                      @NotNull TorrentByteStorage storage,
                      @NotNull RequestStrategy requestStrategy,
                      int blockSize) {
    Preconditions.checkArgument(blockSize > 0, "block size must be positive");
    this.torrent = torrent;
    this.storage = storage;
    this.requestStrategy = requestStrategy;
    this.pieces = new Piece[torrent.getPieceCount()];
    for (int i = 0; i < this.pieces.length; i++) {
      this.pieces[i] = new Piece(i, torrent.getPieceSize(i), torrent.getPieceHash(i), blockSize);
    }
    this.completed = new BitSet(this.pieces.length);
    this.downloaded = 0;
    this.uploaded = 0;
    this.left = torrent.getTotalSize();
  }

  public TorrentInfo getTorrentInfo() {
    return this.torrent;
  }

  public int getPieceCount() {
    return this.pieces.length;
  }

  public void addListener(DownloadProgressListener listener) {
    this.listeners.add(listener);
  }

  public void removeListener(DownloadProgressListener listener) {
    this.listeners.remove(listener);
  }

  public PieceState getState(int index) {
    lock.readLock().lock();
    try {
      return this.pieces[index].getState();
    } finally {
      lock.readLock().unlock();
    }
  }

  public int getAvailability(int index) {
    lock.readLock().lock();
    try {
      return this.pieces[index].getAvailability();
    } finally {
      lock.readLock().unlock();
    }
  }

  public boolean isComplete(int index) {
    return index >= 0 && index < this.pieces.length && getState(index) == PieceState.COMPLETE;
  }

  public BitSet getCompletedPieces() {
    lock.readLock().lock();
    try {
      return (BitSet) this.completed.clone();
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * True exactly when every piece is COMPLETE.
   */
  public boolean finished() {
    lock.readLock().lock();
    try {
      return this.completed.cardinality() == this.pieces.length;
    } finally {
      lock.readLock().unlock();
    }
  }

  public DownloadProgress getProgress() {
    lock.readLock().lock();
    try {
      return new DownloadProgress(this.torrent.getTotalSize(), this.downloaded, this.uploaded,
              this.left, this.pieces.length, this.completed);
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Records that one more connected peer holds piece {@code index}.
   */
  public void peerHas(int index) {
    lock.writeLock().lock();
    try {
      this.pieces[index].seenAt();
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Records availability for every piece set in {@code bitfield}.
   */
  public void peerBitfield(BitSet bitfield) {
    lock.writeLock().lock();
    try {
      for (int i = bitfield.nextSetBit(0); i >= 0 && i < this.pieces.length; i = bitfield.nextSetBit(i + 1)) {
        this.pieces[i].seenAt();
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Tells whether {@code peerPieces} holds a piece that is not complete yet.
   */
  public boolean isInteresting(BitSet peerPieces) {
    BitSet interesting = (BitSet) peerPieces.clone();
    lock.readLock().lock();
    try {
      interesting.andNot(this.completed);
    } finally {
      lock.readLock().unlock();
    }
    return interesting.nextSetBit(0) >= 0 && interesting.nextSetBit(0) < this.pieces.length;
  }

  /**
   * Picks up to {@code max} blocks to request from {@code peer}.
   *
   * <p>
   * Unrequested blocks of pieces already in flight come first, then new
   * pieces chosen by the request strategy among the missing pieces the peer
   * holds. Every returned block is owned by {@code peer} until it arrives, is
   * cancelled or the peer disconnects.
   * </p>
   */
  public List<PieceBlock> requestBlocks(@NotNull Peer peer, BitSet peerPieces, int max) {
    List<PieceBlock> blocks = new ArrayList<PieceBlock>();
    if (max <= 0) {
      return blocks;
    }

    lock.writeLock().lock();
    try {
      for (int i = peerPieces.nextSetBit(0);
           i >= 0 && i < this.pieces.length && blocks.size() < max;
           i = peerPieces.nextSetBit(i + 1)) {
        if (this.pieces[i].getState() == PieceState.IN_FLIGHT) {
          assignBlocks(this.pieces[i], peer, max, blocks);
        }
      }

      BitSet interesting = new BitSet(this.pieces.length);
      for (int i = peerPieces.nextSetBit(0); i >= 0 && i < this.pieces.length; i = peerPieces.nextSetBit(i + 1)) {
        if (this.pieces[i].getState() == PieceState.MISSING) {
          interesting.set(i);
        }
      }

      while (blocks.size() < max) {
        Piece piece = this.requestStrategy.choosePiece(interesting, this.pieces);
        if (piece == null) {
          break;
        }
        interesting.clear(piece.getIndex());
        piece.start();
        logger.trace("Starting {} with {}", piece, peer);
        assignBlocks(piece, peer, max, blocks);
      }
    } finally {
      lock.writeLock().unlock();
    }
    return blocks;
  }

  private void assignBlocks(Piece piece, Peer peer, int max, List<PieceBlock> blocks) {
    for (int b = 0; b < piece.getBlockCount() && blocks.size() < max; b++) {
      if (piece.getOwner(b) == null && !piece.isReceived(b)) {
        piece.setOwner(b, peer);
        blocks.add(new PieceBlock(piece.getIndex(), piece.getBlockOffset(b), piece.getBlockLength(b)));
      }
    }
  }

  /**
   * Delivers a block received from {@code peer}.
   *
   * <p>
   * The block that completes a piece triggers its verification. A verified
   * piece is written to storage and becomes COMPLETE; a piece that fails
   * verification loses all its blocks and goes back to MISSING.
   * </p>
   *
   * @throws IOException when the verified piece cannot be written; the piece
   *                     goes back to MISSING.
   */
  public Reception receiveBlock(@NotNull Peer peer, int index, int offset, ByteBuffer block) throws IOException {
    if (index < 0 || index >= this.pieces.length) {
      return Reception.IGNORED;
    }
    Piece piece = this.pieces[index];
    byte[] bytes = new byte[block.remaining()];
    block.duplicate().get(bytes);

    byte[] pieceData;
    lock.writeLock().lock();
    try {
      if (piece.getState() != PieceState.IN_FLIGHT) {
        return Reception.IGNORED;
      }
      int b = piece.blockAt(offset);
      if (b < 0 || bytes.length != piece.getBlockLength(b) ||
              piece.isReceived(b) || !peer.equals(piece.getOwner(b))) {
        logger.trace("Ignoring unexpected block {} from {}", new PieceBlock(index, offset, bytes.length), peer);
        return Reception.IGNORED;
      }
      if (!piece.store(b, bytes)) {
        return Reception.INCOMPLETE;
      }
      pieceData = piece.startVerifying();
    } finally {
      lock.writeLock().unlock();
    }

    boolean valid = piece.isValid(pieceData);
    if (valid) {
      try {
        this.storage.write(ByteBuffer.wrap(pieceData), (long) index * this.torrent.getPieceLength());
      } catch (IOException ioe) {
        reset(piece);
        throw ioe;
      }
    }

    boolean finished;
    lock.writeLock().lock();
    try {
      if (!valid) {
        piece.reset();
      } else {
        piece.complete();
        this.completed.set(index);
        this.downloaded += piece.getSize();
        this.left -= piece.getSize();
      }
      finished = this.completed.cardinality() == this.pieces.length;
    } finally {
      lock.writeLock().unlock();
    }

    if (!valid) {
      logger.warn("Downloaded {} from {} does not match its hash, discarding it", piece, peer);
      return Reception.INVALID;
    }

    logger.debug("Completed download of {} from {}, now has {}/{} pieces.",
            piece, peer, getCompletedPieces().cardinality(), this.pieces.length);
    firePieceLoaded(piece);
    if (finished) {
      logger.debug("All {} piece(s) of {} verified", this.pieces.length, this.torrent.getName());
      fireDownloadComplete();
    }
    return Reception.VALID;
  }

  private void reset(Piece piece) {
    lock.writeLock().lock();
    try {
      piece.reset();
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Hands every block outstanding with {@code peer} back; pieces left with
   * neither a received nor a requested block go back to MISSING.
   *
   * @return the number of blocks released.
   */
  public int cancelRequests(@NotNull Peer peer) {
    int released = 0;
    lock.writeLock().lock();
    try {
      for (Piece piece : this.pieces) {
        if (piece.getState() != PieceState.IN_FLIGHT) {
          continue;
        }
        for (int b = 0; b < piece.getBlockCount(); b++) {
          if (peer.equals(piece.getOwner(b))) {
            piece.setOwner(b, null);
            released++;
          }
        }
        if (!piece.hasOwners() && !piece.hasReceivedBlocks()) {
          piece.reset();
        }
      }
    } finally {
      lock.writeLock().unlock();
    }
    if (released > 0) {
      logger.trace("Released {} outstanding block(s) of {}", released, peer);
    }
    return released;
  }

  /**
   * Forgets a peer: its outstanding blocks are released and the pieces it
   * held no longer count towards availability.
   */
  public void peerDisconnected(@NotNull Peer peer, BitSet peerPieces) {
    cancelRequests(peer);
    lock.writeLock().lock();
    try {
      for (int i = peerPieces.nextSetBit(0); i >= 0 && i < this.pieces.length; i = peerPieces.nextSetBit(i + 1)) {
        this.pieces[i].noLongerAt();
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Reads a block of a complete piece for upload to a peer.
   *
   * @throws IllegalStateException when the piece is not complete.
   */
  public ByteBuffer readBlock(int index, int offset, int length) throws IOException {
    if (!isComplete(index)) {
      throw new IllegalStateException("Piece #" + index + " is not complete");
    }
    Preconditions.checkArgument(offset >= 0 && length >= 0 && offset + length <= this.pieces[index].getSize(),
            "block %s+%s is out of piece #%s", offset, length, index);

    ByteBuffer buffer = ByteBuffer.allocate(length);
    this.storage.read(buffer, (long) index * this.torrent.getPieceLength() + offset);
    buffer.flip();

    lock.writeLock().lock();
    try {
      this.uploaded += length;
    } finally {
      lock.writeLock().unlock();
    }
    return buffer;
  }

  /**
   * Verifies the data already present in the storage and marks the pieces
   * that match as COMPLETE. They do not count as downloaded.
   *
   * @return the number of pieces found complete.
   */
  public int checkExistingData() throws IOException {
    int found = 0;
    for (Piece piece : this.pieces) {
      if (isComplete(piece.getIndex())) {
        continue;
      }
      ByteBuffer buffer = ByteBuffer.allocate(piece.getSize());
      this.storage.read(buffer, (long) piece.getIndex() * this.torrent.getPieceLength());
      if (!piece.isValid(buffer.array())) {
        continue;
      }
      lock.writeLock().lock();
      try {
        if (piece.getState() == PieceState.MISSING) {
          piece.complete();
          this.completed.set(piece.getIndex());
          this.left -= piece.getSize();
          found++;
        }
      } finally {
        lock.writeLock().unlock();
      }
    }
    logger.info("{}: {}/{} piece(s) already present", this.torrent.getName(), found, this.pieces.length);
    return found;
  }

  private void firePieceLoaded(Piece piece) {
    for (DownloadProgressListener listener : this.listeners) {
      try {
        listener.pieceLoaded(piece.getIndex(), piece.getSize());
      } catch (RuntimeException e) {
        LoggerUtils.warnAndDebugDetails(logger, "Download listener failed on {}", piece, e);
      }
    }
  }

  private void fireDownloadComplete() {
    for (DownloadProgressListener listener : this.listeners) {
      try {
        listener.downloadComplete();
      } catch (RuntimeException e) {
        LoggerUtils.warnAndDebugDetails(logger, "Download listener failed on completion", e);
      }
    }
  }
}
