package com.bitflow.client;

public enum ClientState {
  /** Created, not started. */
  WAITING,
  /** Downloading and uploading. */
  SHARING,
  /** Every piece is complete; only uploading. */
  SEEDING,
  /** Stopped. */
  DONE,
  /** Failed to start or to stop cleanly. */
  ERROR
}
