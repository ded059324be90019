package com.bitflow.client;

import com.google.common.base.MoreObjects;

import java.util.BitSet;

/**
 * Immutable snapshot of the download counters and the completed-piece
 * bitmap, taken under the piece manager's lock.
 */
public final class DownloadProgress {

  private final long totalSize;
  private final long downloaded;
  private final long uploaded;
  private final long left;
  private final int pieceCount;
  private final BitSet completed;

  public DownloadProgress(long totalSize, long downloaded, long uploaded, long left,
                          int pieceCount, BitSet completed) {
    this.totalSize = totalSize;
    this.downloaded = downloaded;
    this.uploaded = uploaded;
    this.left = left;
    this.pieceCount = pieceCount;
    this.completed = (BitSet) completed.clone();
  }

  public long getTotalSize() {
    return totalSize;
  }

  /**
   * Bytes of verified pieces fetched from peers in this session.
   */
  public long getDownloaded() {
    return downloaded;
  }

  public long getUploaded() {
    return uploaded;
  }

  /**
   * Bytes of pieces not yet complete.
   */
  public long getLeft() {
    return left;
  }

  public int getPieceCount() {
    return pieceCount;
  }

  public int getCompletedPieceCount() {
    return completed.cardinality();
  }

  public BitSet getCompletedPieces() {
    return (BitSet) completed.clone();
  }

  public boolean finished() {
    return completed.cardinality() == pieceCount;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
            .add("pieces", completed.cardinality() + "/" + pieceCount)
            .add("downloaded", downloaded)
            .add("uploaded", uploaded)
            .add("left", left)
            .toString();
  }
}
