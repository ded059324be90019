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
package com.bitflow.client;

import com.bitflow.client.announce.Announce;
import com.bitflow.client.announce.AnnounceResponseListener;
import com.bitflow.client.announce.AnnounceableInformation;
import com.bitflow.client.announce.TrackerClient;
import com.bitflow.client.peer.SharingPeer;
import com.bitflow.client.peer.SharingPeerListener;
import com.bitflow.client.storage.StorageFactory;
import com.bitflow.client.storage.TorrentByteStorage;
import com.bitflow.common.InfoHash;
import com.bitflow.common.LoggerUtils;
import com.bitflow.common.Peer;
import com.bitflow.common.TorrentLoggerFactory;
import com.bitflow.common.TorrentMetadata;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;

import java.io.File;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.net.UnknownServiceException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * A pure-java BitTorrent client.
 *
 * <p>
 * A BitTorrent client in its bare essence shares a given torrent. The client
 * starts one announce loop per tracker of the torrent and one connection task
 * per peer the trackers report, all in one worker pool, and wires them to
 * the {@link PieceManager} that owns the download state. The same address
 * is never connected twice at the same time, and the number of live
 * connections is capped.
 * </p>
 *
 * @author mpetazzoni
 */
public class Client implements AnnounceResponseListener, SharingPeerListener, DownloadProgressListener {

  private static final Logger logger =
          TorrentLoggerFactory.getLogger(Client.class);

  private static final long SHUTDOWN_TIMEOUT_SEC = 30;

  private final ClientEnvironment environment;
  private final TorrentMetadata torrent;
  private final File downloadDir;

  private final List<Announce> announces = new CopyOnWriteArrayList<Announce>();
  private final Map<String, SharingPeer> connected = new HashMap<String, SharingPeer>();
  private final CountDownLatch completion = new CountDownLatch(1);

  private volatile ClientState state = ClientState.WAITING;
  private volatile boolean stopped = false;
  private ExecutorService executor;
  private TorrentByteStorage storage;
  private PieceManager pieceManager;

  /**
   * @param environment The per-process settings, peer id included.
   * @param torrent     The torrent to share.
   * @param downloadDir The directory the torrent data lands in.
   */
  public Client(@NotNull ClientEnvironment environment,
                @NotNull TorrentMetadata torrent,
                @NotNull File downloadDir) {
    this.environment = environment;
    this.torrent = torrent;
    this.downloadDir = downloadDir;
  }

  /**
   * Opens the storage, checks the data already there and starts announcing.
   *
   * @throws IOException when the storage cannot be opened or read; the
   *                     client is then in the ERROR state.
   */
  public synchronized void start() throws IOException {
    if (this.state != ClientState.WAITING) {
      throw new IllegalStateException("Client already started (" + this.state + ")");
    }

    try {
      this.storage = StorageFactory.create(this.torrent.getInfo(), this.downloadDir);
      this.pieceManager = new PieceManager(this.torrent.getInfo(), this.storage,
              this.environment.getRequestStrategy(), this.environment.getBlockSize());
      this.pieceManager.checkExistingData();
    } catch (IOException ioe) {
      this.state = ClientState.ERROR;
      closeStorage();
      throw ioe;
    }

    this.pieceManager.addListener(this);
    if (this.pieceManager.finished()) {
      this.state = ClientState.SEEDING;
      this.completion.countDown();
    } else {
      this.state = ClientState.SHARING;
    }

    for (String webSeed : this.torrent.getWebSeeds()) {
      logger.info("Web seed {} is not used", webSeed);
    }

    this.executor = this.environment.newExecutorService();
    AnnounceableInformation announceable = new AnnounceableInformation() {
      @Override
      public InfoHash getInfoHash() {
        return torrent.getInfoHash();
      }

      @Override
      public DownloadProgress getProgress() {
        return pieceManager.getProgress();
      }
    };

    for (String url : this.torrent.getTrackers()) {
      try {
        TrackerClient trackerClient = this.environment.getTrackerClientFactory()
                .createTrackerClient(new URI(url), this.environment.getPeerId(), this.environment.getPort());
        trackerClient.register(this);
        Announce announce = new Announce(trackerClient, announceable, this.environment.getAnnounceIntervalSec());
        this.announces.add(announce);
        this.executor.execute(announce);
      } catch (UnknownServiceException | UnknownHostException e) {
        logger.warn("Skipping tracker {}: {}", url, e.getMessage());
      } catch (URISyntaxException e) {
        logger.warn("Skipping malformed tracker URL {}", url);
      }
    }
    if (this.announces.isEmpty()) {
      logger.warn("No usable tracker for {}, no peer will be found", this.torrent.getInfo().getName());
    }

    logger.info("Started sharing {} ({}) as {}",
            this.torrent.getInfo().getName(), this.torrent.getHexInfoHash(), this.environment.getPeerId());
  }

  /**
   * Stops every task and waits for them to end, then closes the storage. If
   * the download is finished the files are moved into place.
   */
  public void stop() {
    List<SharingPeer> peers;
    synchronized (this) {
      if (this.stopped) {
        return;
      }
      this.stopped = true;
      if (this.executor == null) {
        if (this.state != ClientState.ERROR) {
          this.state = ClientState.DONE;
        }
        return;
      }
    }

    logger.info("Stopping {}...", this.torrent.getInfo().getName());
    for (Announce announce : this.announces) {
      announce.stop();
    }
    synchronized (this.connected) {
      peers = new ArrayList<SharingPeer>(this.connected.values());
    }
    for (SharingPeer peer : peers) {
      peer.stop();
    }

    this.executor.shutdown();
    try {
      if (!this.executor.awaitTermination(SHUTDOWN_TIMEOUT_SEC, TimeUnit.SECONDS)) {
        logger.warn("Some tasks did not end within {}s", SHUTDOWN_TIMEOUT_SEC);
        this.executor.shutdownNow();
      }
    } catch (InterruptedException ie) {
      this.executor.shutdownNow();
      Thread.currentThread().interrupt();
    }

    boolean clean = true;
    try {
      if (this.pieceManager.finished()) {
        this.storage.finish();
      }
    } catch (IOException ioe) {
      clean = false;
      LoggerUtils.errorAndDebugDetails(logger, "Could not move {} into place", this.torrent.getInfo().getName(), ioe);
    }
    clean &= closeStorage();

    this.state = clean ? ClientState.DONE : ClientState.ERROR;
    logger.info("Stopped {}: {}", this.torrent.getInfo().getName(), this.pieceManager.getProgress());
  }

  private boolean closeStorage() {
    if (this.storage == null) {
      return true;
    }
    try {
      this.storage.close();
      return true;
    } catch (IOException ioe) {
      LoggerUtils.errorAndDebugDetails(logger, "Could not close the storage of {}", this.torrent.getInfo().getName(), ioe);
      return false;
    }
  }

  /**
   * Blocks until every piece is complete or the timeout elapses.
   *
   * @return true if the download is finished.
   */
  public boolean waitForCompletion(long timeout, TimeUnit unit) throws InterruptedException {
    return this.completion.await(timeout, unit);
  }

  public ClientState getState() {
    return this.state;
  }

  public TorrentMetadata getTorrent() {
    return this.torrent;
  }

  public ClientEnvironment getEnvironment() {
    return this.environment;
  }

  /**
   * Returns the piece manager, or {@code null} before {@link #start()}.
   */
  public PieceManager getPieceManager() {
    return this.pieceManager;
  }

  public DownloadProgress getProgress() {
    if (this.pieceManager == null) {
      throw new IllegalStateException("Client not started");
    }
    return this.pieceManager.getProgress();
  }

  public List<Announce> getAnnounces() {
    return this.announces;
  }

  public Collection<SharingPeer> getConnectedPeers() {
    synchronized (this.connected) {
      return new ArrayList<SharingPeer>(this.connected.values());
    }
  }

  /** AnnounceResponseListener handler(s). **********************************/

  @Override
  public void handleAnnounceResponse(URI tracker, int interval, int complete, int incomplete) {
    logger.info("Tracker {} reports {} seeder(s) and {} leecher(s), next announce in {}s",
            tracker, complete, incomplete, interval);
  }

  /**
   * Starts a connection task for every reported peer that is not us, not
   * already connected and within the connection cap.
   */
  @Override
  public void handleDiscoveredPeers(URI tracker, List<Peer> peers) {
    logger.debug("Got {} peer(s) from {}", peers.size(), tracker);
    for (Peer peer : peers) {
      if (this.stopped) {
        return;
      }
      if (peer.hasPeerId() && this.environment.getPeerId().equals(peer.getPeerId())) {
        continue;
      }

      SharingPeer sharingPeer;
      synchronized (this.connected) {
        if (this.stopped) {
          return;
        }
        if (this.connected.containsKey(peer.getHostIdentifier())) {
          continue;
        }
        if (this.connected.size() >= this.environment.getMaxConnectionCount()) {
          logger.debug("Connection limit of {} reached, ignoring the remaining peers",
                  this.environment.getMaxConnectionCount());
          return;
        }
        sharingPeer = new SharingPeer(peer, this.torrent.getInfoHash(), this.pieceManager,
                this.environment, this);
        this.connected.put(peer.getHostIdentifier(), sharingPeer);
      }

      try {
        this.executor.execute(sharingPeer);
      } catch (RejectedExecutionException ree) {
        logger.debug("Not connecting to {}, client is stopping", peer);
        synchronized (this.connected) {
          this.connected.remove(peer.getHostIdentifier());
        }
      }
    }
  }

  /** SharingPeerListener handler(s). ***************************************/

  @Override
  public void peerDisconnected(SharingPeer peer) {
    synchronized (this.connected) {
      this.connected.remove(peer.getPeer().getHostIdentifier(), peer);
    }
  }

  /** DownloadProgressListener handler(s). **********************************/

  @Override
  public void pieceLoaded(int pieceIndex, int pieceSize) {
    logger.trace("Piece #{} ({} bytes) loaded", pieceIndex, pieceSize);
  }

  @Override
  public void downloadComplete() {
    logger.info("Download of {} complete, now seeding", this.torrent.getInfo().getName());
    if (!this.stopped) {
      this.state = ClientState.SEEDING;
    }
    this.completion.countDown();
  }
}
