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
package com.bitflow.client.announce;

import com.bitflow.client.DownloadProgress;
import com.bitflow.common.LoggerUtils;
import com.bitflow.common.TorrentLoggerFactory;
import com.bitflow.common.protocol.AnnounceRequestMessage.RequestEvent;
import com.bitflow.common.protocol.AnnounceResponseMessage;
import org.slf4j.Logger;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * BitTorrent announce loop for one tracker.
 *
 * <p>
 * A BitTorrent client must check-in to the torrent's tracker(s) to get peers
 * and to report certain events. Each Announce runs in a worker thread and
 * repeatedly announces the current progress to its tracker: after a
 * successful announce it waits for the interval the tracker asked for, after
 * a failure it logs and retries after the default interval. Tracker failures
 * never end the loop; only {@link #stop()} does.
 * </p>
 *
 * <p>
 * The event is derived from the progress snapshot: <code>started</code>
 * while nothing has been downloaded, <code>finished</code> once every piece
 * is verified, none otherwise.
 * </p>
 *
 * @author mpetazzoni
 * @see com.bitflow.common.protocol.TrackerMessage
 */
public class Announce implements Runnable {

  protected static final Logger logger =
          TorrentLoggerFactory.getLogger(Announce.class);

  private final TrackerClient trackerClient;
  private final AnnounceableInformation torrent;
  private final int defaultIntervalSec;
  private final CountDownLatch stopSignal = new CountDownLatch(1);

  private volatile int announceCount;
  private volatile int failureCount;

  /**
   * @param trackerClient      The client for the tracker announced to.
   * @param torrent            The torrent announced.
   * @param defaultIntervalSec Seconds to wait after a failed announce, or
   *                           when the tracker does not give an interval.
   */
  public Announce(TrackerClient trackerClient, AnnounceableInformation torrent, int defaultIntervalSec) {
    this.trackerClient = trackerClient;
    this.torrent = torrent;
    this.defaultIntervalSec = defaultIntervalSec;
  }

  public TrackerClient getTrackerClient() {
    return this.trackerClient;
  }

  /**
   * Number of announces that got an answer from the tracker.
   */
  public int getAnnounceCount() {
    return this.announceCount;
  }

  public int getFailureCount() {
    return this.failureCount;
  }

  /**
   * Asks the loop to exit; it does so at its next wait.
   */
  public void stop() {
    this.stopSignal.countDown();
    this.trackerClient.close();
  }

  public boolean isStopped() {
    return this.stopSignal.getCount() == 0;
  }

  /**
   * Main announce loop.
   */
  @Override
  public void run() {
    logger.info("Starting announce loop to {}...", this.trackerClient.getTrackerURI());

    try {
      while (!isStopped()) {
        int waitSec = announceOnce();
        if (this.stopSignal.await(waitSec, TimeUnit.SECONDS)) {
          break;
        }
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    } finally {
      this.trackerClient.close();
    }

    logger.info("Exited announce loop to {}.", this.trackerClient.getTrackerURI());
  }

  /**
   * Sends one announce and returns the number of seconds to wait before the
   * next one.
   */
  int announceOnce() {
    DownloadProgress progress = this.torrent.getProgress();
    RequestEvent event = RequestEvent.fromProgress(progress.getDownloaded(), progress.finished());
    try {
      AnnounceResponseMessage response = this.trackerClient.announce(event, this.torrent.getInfoHash(), progress);
      this.announceCount++;
      int interval = Math.max(response.getInterval(), response.getMinInterval());
      return interval > 0 ? interval : this.defaultIntervalSec;
    } catch (AnnounceException ae) {
      this.failureCount++;
      LoggerUtils.warnWithMessageAndDebugDetails(logger, "Announce to {} failed, retrying later",
              this.trackerClient.getTrackerURI(), ae);
      return this.defaultIntervalSec;
    } catch (RuntimeException e) {
      this.failureCount++;
      LoggerUtils.errorAndDebugDetails(logger, "Unexpected error announcing to {}",
              this.trackerClient.getTrackerURI(), e);
      return this.defaultIntervalSec;
    }
  }
}
