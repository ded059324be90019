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
package com.bitflow.common.protocol;

import com.bitflow.common.InfoHash;
import com.bitflow.common.PeerId;

/**
 * Base interface for announce request messages.
 *
 * @author mpetazzoni
 */
public interface AnnounceRequestMessage {

  /**
   * Announce request event types.
   *
   * <p>
   * A client that has not downloaded anything yet announces itself with
   * 'started'; once every piece is verified it reports 'finished'. Other
   * announces carry no event (NONE) and only refresh the client's counters
   * on the tracker.
   * </p>
   */
  enum RequestEvent {
    NONE,
    STARTED,
    FINISHED;

    public String getEventName() {
      return this.name().toLowerCase();
    }

    /**
     * Picks the event reported for a progress snapshot.
     *
     * @param downloaded bytes verified during this session
     * @param finished   whether every piece is complete
     */
    public static RequestEvent fromProgress(long downloaded, boolean finished) {
      if (downloaded == 0) {
        return STARTED;
      }
      return finished ? FINISHED : NONE;
    }
  }

  InfoHash getInfoHash();

  PeerId getPeerId();

  int getPort();

  long getUploaded();

  long getDownloaded();

  long getLeft();

  boolean getCompact();

  RequestEvent getEvent();
}
