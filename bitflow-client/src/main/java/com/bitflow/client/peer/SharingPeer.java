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
package com.bitflow.client.peer;

import com.bitflow.client.ClientEnvironment;
import com.bitflow.client.DownloadProgressListener;
import com.bitflow.client.PieceBlock;
import com.bitflow.client.PieceManager;
import com.bitflow.common.InfoHash;
import com.bitflow.common.LoggerUtils;
import com.bitflow.common.Peer;
import com.bitflow.common.TorrentLoggerFactory;
import com.bitflow.common.protocol.PeerMessage;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.BitSet;
import java.util.HashSet;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;


/**
 * A peer exchanging on a torrent with the BitTorrent client.
 *
 * <p>
 * A SharingPeer is the connection task for one remote peer: it connects and
 * handshakes, then loops reading messages and feeding the
 * {@link PieceManager} until it is stopped or the connection fails. It keeps
 * our interest in sync with the pieces the peer advertises, keeps a pipeline
 * of block requests open while the peer unchokes us, serves requests for the
 * pieces we have, and announces every piece completed by any connection.
 * </p>
 *
 * <p>
 * When the task ends its connection is closed and its outstanding blocks and
 * piece availability are handed back to the piece manager.
 * </p>
 *
 * @author mpetazzoni
 */
public class SharingPeer implements Runnable, DownloadProgressListener {

  private static final Logger logger =
          TorrentLoggerFactory.getLogger(SharingPeer.class);

  private final Peer peer;
  private final InfoHash infoHash;
  private final PieceManager pieceManager;
  private final ClientEnvironment environment;
  private final SharingPeerListener listener;

  private final BitSet availablePieces = new BitSet();
  private final Set<PieceBlock> requestedBlocks = new HashSet<PieceBlock>();
  private final Queue<Integer> completedPieces = new ConcurrentLinkedQueue<Integer>();

  private volatile PeerConnection connection;
  private volatile boolean stop = false;

  public SharingPeer(@NotNull Peer peer,
                     @NotNull InfoHash infoHash,
                     @NotNull PieceManager pieceManager,
                     @NotNull ClientEnvironment environment,
                     @NotNull SharingPeerListener listener) {
    this.peer = peer;
    this.infoHash = infoHash;
    this.pieceManager = pieceManager;
    this.environment = environment;
    this.listener = listener;
  }

  public Peer getPeer() {
    return this.peer;
  }

  /**
   * Returns the live connection, or {@code null} before the handshake is done
   * and after the task ended.
   */
  public PeerConnection getConnection() {
    return this.connection;
  }

  /**
   * Returns a copy of the pieces this peer advertised.
   */
  public BitSet getAvailablePieces() {
    synchronized (this.availablePieces) {
      return (BitSet) this.availablePieces.clone();
    }
  }

  /**
   * Asks the task to end; a blocked read returns because the socket is
   * closed.
   */
  public void stop() {
    this.stop = true;
    PeerConnection current = this.connection;
    if (current != null) {
      current.close();
    }
  }

  public boolean isStopped() {
    return this.stop;
  }

  @Override
  public void run() {
    boolean connected = false;
    try {
      if (this.stop) {
        return;
      }
      this.pieceManager.addListener(this);
      PeerConnection conn;
      try {
        conn = PeerConnection.connect(this.peer, this.pieceManager.getTorrentInfo(),
                this.infoHash, this.environment);
      } catch (PeerConnectionException pce) {
        logger.info("Could not connect to {} ({}): {}", this.peer, pce.getReason(), pce.getMessage());
        logger.debug("", pce);
        return;
      } catch (ProtocolViolationException pve) {
        LoggerUtils.warnWithMessageAndDebugDetails(logger, "Handshake with {} failed", this.peer, pve);
        return;
      }
      this.connection = conn;
      connected = true;
      if (this.stop) {
        return;
      }
      logger.info("Connected to {}", this.peer);

      BitSet ours = this.pieceManager.getCompletedPieces();
      if (!ours.isEmpty()) {
        conn.send(PeerMessage.BitfieldMessage.craft(ours, this.pieceManager.getPieceCount()));
      }

      while (!this.stop && !conn.isClosed()) {
        sendCompletedPieces(conn);
        updateInterest(conn);
        if (!conn.isPeerChoking() && conn.isAmInterested()) {
          fillPipeline(conn);
        }

        PeerMessage message = conn.receive();
        if (message != null) {
          handleMessage(conn, message);
        }
      }
    } catch (ProtocolViolationException pve) {
      LoggerUtils.warnWithMessageAndDebugDetails(logger, "Dropping {}", this.peer, pve);
    } catch (IOException ioe) {
      if (this.stop) {
        logger.debug("Connection to {} closed on stop", this.peer);
      } else {
        LoggerUtils.infoWithMessageAndDebugDetails(logger, "Lost connection to {}", this.peer, ioe);
      }
    } catch (RuntimeException e) {
      LoggerUtils.errorAndDebugDetails(logger, "Unexpected failure in the connection to {}", this.peer, e);
    } finally {
      this.pieceManager.removeListener(this);
      PeerConnection conn = this.connection;
      if (conn != null) {
        conn.close();
      }
      this.connection = null;
      this.requestedBlocks.clear();
      if (connected) {
        this.pieceManager.peerDisconnected(this.peer, getAvailablePieces());
        logger.info("Disconnected from {}", this.peer);
      }
      this.listener.peerDisconnected(this);
    }
  }

  private void handleMessage(PeerConnection conn, PeerMessage message) throws IOException {
    switch (message.getType()) {
      case KEEP_ALIVE:
        break;
      case CHOKE:
        this.pieceManager.cancelRequests(this.peer);
        this.requestedBlocks.clear();
        break;
      case UNCHOKE:
        logger.trace("{} unchoked us", this.peer);
        break;
      case INTERESTED:
        if (conn.isAmChoking()) {
          conn.send(PeerMessage.UnchokeMessage.craft());
        }
        break;
      case NOT_INTERESTED:
        break;
      case HAVE:
        int index = ((PeerMessage.HaveMessage) message).getPieceIndex();
        boolean added;
        synchronized (this.availablePieces) {
          added = !this.availablePieces.get(index);
          this.availablePieces.set(index);
        }
        if (added) {
          this.pieceManager.peerHas(index);
        }
        break;
      case BITFIELD:
        BitSet advertised = ((PeerMessage.BitfieldMessage) message).getBitfield();
        synchronized (this.availablePieces) {
          advertised.andNot(this.availablePieces);
          this.availablePieces.or(advertised);
        }
        this.pieceManager.peerBitfield(advertised);
        break;
      case PIECE:
        PeerMessage.PieceMessage piece = (PeerMessage.PieceMessage) message;
        ByteBuffer block = piece.getBlock();
        this.requestedBlocks.remove(new PieceBlock(piece.getPiece(), piece.getOffset(), block.remaining()));
        this.pieceManager.receiveBlock(this.peer, piece.getPiece(), piece.getOffset(), block);
        break;
      case REQUEST:
        PeerMessage.RequestMessage request = (PeerMessage.RequestMessage) message;
        if (conn.isAmChoking() || !this.pieceManager.isComplete(request.getPiece())) {
          logger.debug("Ignoring request for #{} from {}", request.getPiece(), this.peer);
          break;
        }
        ByteBuffer data = this.pieceManager.readBlock(request.getPiece(), request.getOffset(), request.getLength());
        conn.send(PeerMessage.PieceMessage.craft(request.getPiece(), request.getOffset(), data));
        break;
      case CANCEL:
        break;
      default:
        break;
    }
  }

  private void updateInterest(PeerConnection conn) throws IOException {
    boolean interesting = this.pieceManager.isInteresting(getAvailablePieces());
    if (interesting && !conn.isAmInterested()) {
      conn.send(PeerMessage.InterestedMessage.craft());
    } else if (!interesting && conn.isAmInterested()) {
      conn.send(PeerMessage.NotInterestedMessage.craft());
    }
  }

  private void fillPipeline(PeerConnection conn) throws IOException {
    int free = this.environment.getPipelineDepth() - this.requestedBlocks.size();
    if (free <= 0) {
      return;
    }
    List<PieceBlock> blocks = this.pieceManager.requestBlocks(this.peer, getAvailablePieces(), free);
    for (PieceBlock block : blocks) {
      this.requestedBlocks.add(block);
      conn.send(PeerMessage.RequestMessage.craft(block.getPiece(), block.getOffset(), block.getLength()));
    }
  }

  private void sendCompletedPieces(PeerConnection conn) throws IOException {
    Integer index;
    while ((index = this.completedPieces.poll()) != null) {
      conn.send(PeerMessage.HaveMessage.craft(index));
    }
  }

  @Override
  public void pieceLoaded(int pieceIndex, int pieceSize) {
    this.completedPieces.add(pieceIndex);
  }

  @Override
  public void downloadComplete() {
    logger.debug("Download complete, {} keeps seeding", this);
  }

  @Override
  public String toString() {
    return "sharing peer " + this.peer;
  }
}
