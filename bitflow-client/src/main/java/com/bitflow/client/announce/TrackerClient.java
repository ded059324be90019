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
import com.bitflow.common.InfoHash;
import com.bitflow.common.TorrentLoggerFactory;
import com.bitflow.common.protocol.AnnounceRequestMessage;
import com.bitflow.common.protocol.AnnounceResponseMessage;
import com.bitflow.common.protocol.TrackerMessage;
import com.bitflow.common.protocol.TrackerMessage.ErrorMessage;
import org.slf4j.Logger;

import java.net.URI;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public abstract class TrackerClient {

  private static final Logger logger =
          TorrentLoggerFactory.getLogger(TrackerClient.class);

  /**
   * The set of listeners to announce request answers.
   */
  private final List<AnnounceResponseListener> listeners;

  protected final URI tracker;

  public TrackerClient(final URI tracker) {
    this.listeners = new CopyOnWriteArrayList<AnnounceResponseListener>();
    this.tracker = tracker;
  }

  /**
   * Register a new announce response listener.
   *
   * @param listener The listener to register on this announcer events.
   */
  public void register(AnnounceResponseListener listener) {
    this.listeners.add(listener);
  }

  /**
   * Returns the URI this tracker clients connects to.
   */
  public URI getTrackerURI() {
    return this.tracker;
  }

  /**
   * Build, send and process a tracker announce request.
   *
   * <p>
   * This function first builds an announce request for the specified event
   * with all the required parameters. Then, the request is made to the
   * tracker and the response analyzed.
   * </p>
   *
   * <p>
   * All registered {@link AnnounceResponseListener} objects are then fired
   * with the decoded payload.
   * </p>
   *
   * @param event    The announce event type (can be RequestEvent.NONE for
   *                 periodic updates).
   * @param infoHash The torrent being announced.
   * @param progress The transfer counters to report.
   * @return the tracker's answer, for scheduling the next announce.
   * @throws AnnounceException when the tracker cannot be reached, answers
   *                           with an error, or sends a malformed response.
   */
  public abstract AnnounceResponseMessage announce(AnnounceRequestMessage.RequestEvent event,
                                                   InfoHash infoHash,
                                                   DownloadProgress progress) throws AnnounceException;

  protected void logAnnounceRequest(AnnounceRequestMessage.RequestEvent event, DownloadProgress progress) {
    if (event != AnnounceRequestMessage.RequestEvent.NONE) {
      logger.debug("Announcing {} to {} with {}U/{}D/{}L bytes...",
              event.name(), this.tracker,
              progress.getUploaded(), progress.getDownloaded(), progress.getLeft());
    } else {
      logger.debug("Simply announcing to {} with {}U/{}D/{}L bytes...",
              this.tracker,
              progress.getUploaded(), progress.getDownloaded(), progress.getLeft());
    }
  }

  /**
   * Close any opened announce connection.
   *
   * <p>
   * This method is called to make sure all connections
   * are correctly closed when the announce loop is asked to stop.
   * </p>
   */
  protected void close() {
    // Do nothing by default, but can be overloaded.
  }

  /**
   * Handle the announce response from the tracker.
   *
   * <p>
   * Analyzes the response from the tracker and acts on it. If the response
   * is an error, an {@link AnnounceException} carrying the tracker's reason
   * is thrown. Otherwise, the announce response is used to fire the
   * corresponding announce and peer events to all announce listeners.
   * </p>
   *
   * @param message The incoming {@link TrackerMessage}.
   */
  protected AnnounceResponseMessage handleTrackerAnnounceResponse(TrackerMessage message)
          throws AnnounceException {
    if (message instanceof ErrorMessage) {
      ErrorMessage error = (ErrorMessage) message;
      throw new AnnounceException("Tracker " + this.tracker + " refused the announce: " + error.getReason());
    }

    if (!(message instanceof AnnounceResponseMessage)) {
      throw new AnnounceException("Unexpected tracker message type " +
              message.getType().name() + "!");
    }

    AnnounceResponseMessage response = (AnnounceResponseMessage) message;
    if (response.getWarningMessage() != null) {
      logger.warn("Tracker {} warns: {}", this.tracker, response.getWarningMessage());
    }

    this.fireAnnounceResponseEvent(
            response.getComplete(),
            response.getIncomplete(),
            response.getInterval());
    this.fireDiscoveredPeersEvent(response);
    return response;
  }

  /**
   * Fire the announce response event to all listeners.
   *
   * @param complete   The number of seeders on this torrent.
   * @param incomplete The number of leechers on this torrent.
   * @param interval   The announce interval requested by the tracker.
   */
  protected void fireAnnounceResponseEvent(int complete, int incomplete, int interval) {
    for (AnnounceResponseListener listener : this.listeners) {
      listener.handleAnnounceResponse(this.tracker, interval, complete, incomplete);
    }
  }

  /**
   * Fire the new peer discovery event to all listeners.
   */
  protected void fireDiscoveredPeersEvent(AnnounceResponseMessage response) {
    for (AnnounceResponseListener listener : this.listeners) {
      listener.handleDiscoveredPeers(this.tracker, response.getPeers());
    }
  }
}
