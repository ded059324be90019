package com.bitflow;

/**
 * Polls {@link #condition()} until it holds or the timeout expires; the
 * outcome is available from {@link #isMyResult()}.
 */
public abstract class WaitFor {
  public static final long POLL_INTERVAL = 100;

  private boolean myResult = false;

  protected WaitFor() {
    this(60 * 1000);
  }

  protected WaitFor(long timeout) {
    long maxTime = System.currentTimeMillis() + timeout;
    try {
      while (System.currentTimeMillis() < maxTime && !condition()) {
        Thread.sleep(POLL_INTERVAL);
      }
      myResult = condition();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  public boolean isMyResult() {
    return myResult;
  }

  protected abstract boolean condition();
}
