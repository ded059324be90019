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
import com.bitflow.common.PeerId;
import com.bitflow.common.TorrentLoggerFactory;
import com.bitflow.common.protocol.AnnounceRequestMessage;
import com.bitflow.common.protocol.AnnounceResponseMessage;
import com.bitflow.common.protocol.TrackerMessage.MessageValidationException;
import com.bitflow.common.protocol.http.HTTPAnnounceRequestMessage;
import com.bitflow.common.protocol.http.HTTPTrackerMessage;
import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URL;
import java.net.URLConnection;

/**
 * Announcer for HTTP trackers.
 *
 * <p>
 * The tracker id a tracker returns is remembered and sent back on the
 * following announces.
 * </p>
 *
 * @author mpetazzoni
 * @see <a href="http://wiki.theory.org/BitTorrentSpecification#Tracker_Request_Parameters">BitTorrent tracker request specification</a>
 */
public class HTTPTrackerClient extends TrackerClient {

  protected static final Logger logger =
          TorrentLoggerFactory.getLogger(HTTPTrackerClient.class);

  static final int MAX_REDIRECTS = 5;
  static final int TIMEOUT_MILLIS = 10000;

  private final PeerId peerId;
  private final int port;
  private volatile String trackerId;
  private volatile HttpURLConnection inFlight;
  private volatile boolean closed;

  /**
   * Create a new HTTP announcer for the given tracker.
   *
   * @param tracker The tracker announce URI.
   * @param peerId  Our peer id.
   * @param port    The port reported to the tracker.
   */
  public HTTPTrackerClient(URI tracker, PeerId peerId, int port) {
    super(tracker);
    this.peerId = peerId;
    this.port = port;
  }

  @Override
  public AnnounceResponseMessage announce(AnnounceRequestMessage.RequestEvent event,
                                          InfoHash infoHash,
                                          DownloadProgress progress) throws AnnounceException {
    logAnnounceRequest(event, progress);

    URL target = encodeAnnounceToURL(event, infoHash, progress);
    byte[] body = sendAnnounce(target);

    HTTPTrackerMessage message;
    try {
      message = HTTPTrackerMessage.parse(body);
    } catch (MessageValidationException mve) {
      throw new AnnounceException("Tracker message violates expected " +
              "protocol (" + mve.getMessage() + ")", mve);
    }

    AnnounceResponseMessage response = this.handleTrackerAnnounceResponse(message);
    if (response.getTrackerId() != null) {
      this.trackerId = response.getTrackerId();
    }
    logger.debug("Tracker {} answered: {} peer(s), interval {}s",
            this.tracker, response.getPeers().size(), response.getInterval());
    return response;
  }

  /**
   * Aborts the request in flight, if any. Later announces fail at once.
   */
  @Override
  protected void close() {
    this.closed = true;
    HttpURLConnection conn = this.inFlight;
    if (conn != null) {
      logger.debug("Aborting announce to {}", this.tracker);
      conn.disconnect();
    }
  }

  /**
   * Returns the tracker id echoed on announces, if the tracker sent one.
   */
  public String getTrackerId() {
    return this.trackerId;
  }

  private URL encodeAnnounceToURL(AnnounceRequestMessage.RequestEvent event,
                                  InfoHash infoHash,
                                  DownloadProgress progress) throws AnnounceException {
    try {
      HTTPAnnounceRequestMessage request = HTTPAnnounceRequestMessage.craft(
              infoHash,
              this.peerId,
              this.port,
              progress.getUploaded(),
              progress.getDownloaded(),
              progress.getLeft(),
              true,
              event,
              this.trackerId);
      return request.buildAnnounceURL(this.tracker.toURL());
    } catch (MalformedURLException | IllegalArgumentException e) {
      throw new AnnounceException("Invalid announce URL (" +
              e.getMessage() + ")", e);
    }
  }

  private byte[] sendAnnounce(final URL url) throws AnnounceException {
    HttpURLConnection conn = null;
    try {
      conn = openConnectionCheckRedirects(url);
      int status = conn.getResponseCode();
      if (status != HttpURLConnection.HTTP_OK) {
        throw new AnnounceException("Tracker " + this.tracker + " answered HTTP " + status);
      }
      InputStream in = conn.getInputStream();
      try {
        return IOUtils.toByteArray(in);
      } finally {
        in.close();
      }
    } catch (IOException ioe) {
      throw new AnnounceException("Error reaching tracker " + this.tracker +
              " (" + ioe.getMessage() + ")", ioe);
    } finally {
      this.inFlight = null;
      if (conn != null) {
        conn.disconnect();
      }
    }
  }

  private HttpURLConnection openConnectionCheckRedirects(URL url) throws IOException {
    boolean needRedirect;
    int redirects = 0;
    URL current = url;
    HttpURLConnection http;
    do {
      needRedirect = false;
      URLConnection connection = current.openConnection();
      if (!(connection instanceof HttpURLConnection)) {
        throw new IOException("Not an HTTP tracker URL: " + current);
      }
      http = (HttpURLConnection) connection;
      this.inFlight = http;
      if (this.closed) {
        throw new IOException("announce aborted");
      }
      http.setConnectTimeout(TIMEOUT_MILLIS);
      http.setReadTimeout(TIMEOUT_MILLIS);
      http.setInstanceFollowRedirects(false);
      http.setRequestMethod("GET");

      int stat = http.getResponseCode();
      if (stat >= 300 && stat <= 307 && stat != 306 &&
              stat != HttpURLConnection.HTTP_NOT_MODIFIED) {
        URL base = http.getURL();
        String newLocation = http.getHeaderField("Location");
        URL target = newLocation == null ? null : new URL(base, newLocation);
        http.disconnect();
        // Redirection should be allowed only for HTTP and HTTPS
        // and should be limited to 5 redirections at most.
        if (redirects >= MAX_REDIRECTS) {
          throw new IOException("too many redirects");
        }
        if (target == null || !(target.getProtocol().equals("http")
                || target.getProtocol().equals("https"))) {
          throw new IOException("illegal URL redirect or protocol");
        }
        needRedirect = true;
        current = target;
        redirects++;
      }
    }
    while (needRedirect);
    return http;
  }
}
