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
 * Piece layout shared by both torrent shapes.
 */
public abstract class AbstractTorrentInfo implements TorrentInfo {

  private final String name;
  private final int pieceLength;
  private final byte[] piecesHashes;
  private final boolean isPrivate;

  protected AbstractTorrentInfo(String name, int pieceLength, byte[] piecesHashes, boolean isPrivate) {
    Preconditions.checkArgument(piecesHashes.length % Constants.PIECE_HASH_SIZE == 0,
            "pieces hashes length %s is not a multiple of %s", piecesHashes.length, Constants.PIECE_HASH_SIZE);
    this.name = name;
    this.pieceLength = pieceLength;
    this.piecesHashes = piecesHashes.clone();
    this.isPrivate = isPrivate;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public int getPieceLength() {
    return pieceLength;
  }

  @Override
  public int getPieceCount() {
    return piecesHashes.length / Constants.PIECE_HASH_SIZE;
  }

  @Override
  public byte[] getPieceHash(int pieceIndex) {
    checkPieceIndex(pieceIndex);
    int from = pieceIndex * Constants.PIECE_HASH_SIZE;
    return Arrays.copyOfRange(piecesHashes, from, from + Constants.PIECE_HASH_SIZE);
  }

  @Override
  public int getPieceSize(int pieceIndex) {
    checkPieceIndex(pieceIndex);
    if (pieceIndex < getPieceCount() - 1) {
      return pieceLength;
    }
    return (int) (getTotalSize() - (long) pieceLength * pieceIndex);
  }

  @Override
  public boolean isPrivate() {
    return isPrivate;
  }

  private void checkPieceIndex(int pieceIndex) {
    if (pieceIndex < 0 || pieceIndex >= getPieceCount()) {
      throw new IndexOutOfBoundsException("piece index " + pieceIndex + " out of " + getPieceCount());
    }
  }
}
