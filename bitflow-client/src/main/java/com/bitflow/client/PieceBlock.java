package com.bitflow.client;

/**
 * A block of a piece, as requested from a peer.
 */
public final class PieceBlock {

  private final int piece;
  private final int offset;
  private final int length;

  public PieceBlock(int piece, int offset, int length) {
    this.piece = piece;
    this.offset = offset;
    this.length = length;
  }

  public int getPiece() {
    return piece;
  }

  public int getOffset() {
    return offset;
  }

  public int getLength() {
    return length;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof PieceBlock)) return false;
    PieceBlock that = (PieceBlock) o;
    return piece == that.piece && offset == that.offset && length == that.length;
  }

  @Override
  public int hashCode() {
    int result = piece;
    result = 31 * result + offset;
    result = 31 * result + length;
    return result;
  }

  @Override
  public String toString() {
    return "#" + piece + " (" + length + "@" + offset + ")";
  }
}
