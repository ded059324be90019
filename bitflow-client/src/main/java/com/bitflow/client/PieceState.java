package com.bitflow.client;

/**
 * Lifecycle of a piece in the {@link PieceManager}.
 */
public enum PieceState {
  /** No block is received or requested. */
  MISSING,
  /** Some blocks are requested or received. */
  IN_FLIGHT,
  /** All blocks are received and the hash is being checked. */
  VERIFYING,
  /** Verified and written to storage. Terminal. */
  COMPLETE
}
