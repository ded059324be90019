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
package com.bitflow.common.protocol.http;

import com.bitflow.common.InfoHash;
import com.bitflow.common.PeerId;
import com.bitflow.common.TorrentUtils;
import com.bitflow.common.protocol.AnnounceRequestMessage;
import com.google.common.base.MoreObjects;
import org.jetbrains.annotations.Nullable;

import java.net.MalformedURLException;
import java.net.URL;
import java.nio.charset.StandardCharsets;

/**
 * The announce request message for the HTTP tracker protocol.
 *
 * <p>
 * This class represents the announce request message in the HTTP tracker
 * protocol and crafts the GET url sent to the tracker. The info hash and
 * peer id are raw bytes and are percent-encoded byte by byte.
 * </p>
 *
 * @author mpetazzoni
 */
public class HTTPAnnounceRequestMessage extends HTTPTrackerMessage
        implements AnnounceRequestMessage {

  private final InfoHash infoHash;
  private final PeerId peerId;
  private final int port;
  private final long uploaded;
  private final long downloaded;
  private final long left;
  private final boolean compact;
  private final RequestEvent event;
  private final String trackerId;

  private HTTPAnnounceRequestMessage(InfoHash infoHash, PeerId peerId, int port,
                                     long uploaded, long downloaded, long left,
                                     boolean compact, RequestEvent event, @Nullable String trackerId) {
    super(Type.ANNOUNCE_REQUEST);
    this.infoHash = infoHash;
    this.peerId = peerId;
    this.port = port;
    this.uploaded = uploaded;
    this.downloaded = downloaded;
    this.left = left;
    this.compact = compact;
    this.event = event;
    this.trackerId = trackerId;
  }

  @Override
  public InfoHash getInfoHash() {
    return this.infoHash;
  }

  @Override
  public PeerId getPeerId() {
    return this.peerId;
  }

  @Override
  public int getPort() {
    return this.port;
  }

  @Override
  public long getUploaded() {
    return this.uploaded;
  }

  @Override
  public long getDownloaded() {
    return this.downloaded;
  }

  @Override
  public long getLeft() {
    return this.left;
  }

  @Override
  public boolean getCompact() {
    return this.compact;
  }

  @Override
  public RequestEvent getEvent() {
    return this.event;
  }

  @Nullable
  public String getTrackerId() {
    return this.trackerId;
  }

  /**
   * Appends this announce's query parameters to the tracker's announce URL,
   * after any query the URL already carries. Byte-valued parameters are
   * percent-encoded byte by byte; an event is only sent when there is one.
   */
  public URL buildAnnounceURL(URL trackerAnnounceURL) throws MalformedURLException {
    String base = trackerAnnounceURL.toString();
    StringBuilder url = new StringBuilder(base);
    char separator = base.indexOf('?') < 0 ? '?' : '&';

    separator = param(url, separator, "info_hash", this.infoHash.urlEncoded());
    separator = param(url, separator, "peer_id", this.peerId.urlEncoded());
    separator = param(url, separator, "port", this.port);
    separator = param(url, separator, "uploaded", this.uploaded);
    separator = param(url, separator, "downloaded", this.downloaded);
    separator = param(url, separator, "left", this.left);
    separator = param(url, separator, "compact", this.compact ? 1 : 0);
    if (this.event != null && this.event != RequestEvent.NONE) {
      separator = param(url, separator, "event", this.event.getEventName());
    }
    if (this.trackerId != null) {
      param(url, separator, "trackerid",
              TorrentUtils.urlEncodeBytes(this.trackerId.getBytes(StandardCharsets.UTF_8)));
    }
    return new URL(url.toString());
  }

  private static char param(StringBuilder url, char separator, String name, Object value) {
    url.append(separator).append(name).append('=').append(value);
    return '&';
  }

  public static HTTPAnnounceRequestMessage craft(InfoHash infoHash, PeerId peerId, int port,
                                                 long uploaded, long downloaded, long left,
                                                 boolean compact, RequestEvent event,
                                                 @Nullable String trackerId) {
    return new HTTPAnnounceRequestMessage(infoHash, peerId, port,
            uploaded, downloaded, left, compact, event, trackerId);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
            .add("infoHash", infoHash)
            .add("peerId", peerId)
            .add("port", port)
            .add("uploaded", uploaded)
            .add("downloaded", downloaded)
            .add("left", left)
            .add("compact", compact)
            .add("event", event)
            .add("trackerId", trackerId)
            .toString();
  }
}
