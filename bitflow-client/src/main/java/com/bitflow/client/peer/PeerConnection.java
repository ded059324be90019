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

import com.bitflow.Constants;
import com.bitflow.client.ClientEnvironment;
import com.bitflow.client.Handshake;
import com.bitflow.common.InfoHash;
import com.bitflow.common.Peer;
import com.bitflow.common.PeerId;
import com.bitflow.common.TorrentInfo;
import com.bitflow.common.TorrentLoggerFactory;
import com.bitflow.common.protocol.PeerMessage;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.ByteBuffer;
import java.text.ParseException;

/**
 * One TCP session with a remote peer.
 *
 * <p>
 * The connection performs the handshake, then frames and parses peer
 * protocol messages over a blocking socket. It tracks the four choke and
 * interest flags from the messages that go through it, and a coarse
 * {@link State} derived from the outstanding block requests.
 * </p>
 *
 * <p>
 * {@link #send(PeerMessage)} may be called from any thread;
 * {@link #receive()} must be called by one thread only. The socket read
 * timeout bounds how long a receive blocks, so the reading task can check for
 * cancellation between messages.
 * </p>
 */
public class PeerConnection {

  private static final Logger logger =
          TorrentLoggerFactory.getLogger(PeerConnection.class);

  public enum State {
    CONNECTING,
    HANDSHAKING,
    /** Connected, no block request outstanding. */
    IDLE,
    /** Block requests sent, no block received yet. */
    REQUESTING,
    /** Blocks arriving for outstanding requests. */
    TRANSFERRING,
    CLOSED
  }

  private final Peer peer;
  private final TorrentInfo torrent;
  private final InfoHash infoHash;
  private final PeerId localPeerId;
  private final Socket socket;
  private final int handshakeTimeout;
  private final int maxFrameLength;
  private final InputStream in;
  private final OutputStream out;

  private final Object writeLock = new Object();
  private final ByteBuffer lengthBuffer = ByteBuffer.allocate(4);
  private ByteBuffer frame;

  private volatile State state;
  private volatile boolean amChoking = true;
  private volatile boolean amInterested = false;
  private volatile boolean peerChoking = true;
  private volatile boolean peerInterested = false;
  private volatile long lastSent;
  private int pendingRequests;

  PeerConnection(Peer peer, TorrentInfo torrent, InfoHash infoHash, PeerId localPeerId,
                 Socket socket, int handshakeTimeout) throws IOException {
    this.peer = peer;
    this.torrent = torrent;
    this.infoHash = infoHash;
    this.localPeerId = localPeerId;
    this.socket = socket;
    this.handshakeTimeout = handshakeTimeout;
    this.maxFrameLength = PeerMessage.maxFrameLength(torrent);
    this.in = socket.getInputStream();
    this.out = socket.getOutputStream();
    this.state = State.CONNECTING;
    this.lastSent = System.currentTimeMillis();
  }

  /**
   * Opens a connection to {@code peer} and performs the handshake.
   *
   * @throws PeerConnectionException     when the address is unusable or the
   *                                     socket fails.
   * @throws ProtocolViolationException when the remote handshake is malformed
   *                                     or is for another torrent.
   */
  public static PeerConnection connect(Peer peer, TorrentInfo torrent, InfoHash infoHash,
                                       ClientEnvironment environment) throws IOException {
    if (peer.getPort() < 1 || peer.getPort() > 65535) {
      throw new PeerConnectionException(PeerConnectionException.Reason.INVALID_ADDRESS,
              "Invalid port for peer " + peer);
    }

    Socket socket = new Socket();
    try {
      InetSocketAddress address = peer.getAddress();
      if (address.isUnresolved()) {
        throw new PeerConnectionException(PeerConnectionException.Reason.INVALID_ADDRESS,
                "Cannot resolve peer " + peer);
      }
      logger.debug("Connecting to {}...", peer);
      socket.connect(address, environment.getConnectionTimeoutMillis());
      socket.setSoTimeout(environment.getSocketReadTimeoutMillis());
      socket.setTcpNoDelay(true);
    } catch (PeerConnectionException e) {
      closeQuietly(socket);
      throw e;
    } catch (IOException ioe) {
      closeQuietly(socket);
      throw new PeerConnectionException(PeerConnectionException.Reason.SOCKET_UNAVAILABLE,
              "Could not connect to " + peer + ": " + ioe.getMessage(), ioe);
    } catch (RuntimeException e) {
      closeQuietly(socket);
      throw new PeerConnectionException(PeerConnectionException.Reason.OTHER,
              "Could not connect to " + peer + ": " + e.getMessage(), e);
    }

    PeerConnection connection;
    try {
      connection = new PeerConnection(peer, torrent, infoHash, environment.getPeerId(),
              socket, environment.getConnectionTimeoutMillis());
    } catch (IOException ioe) {
      closeQuietly(socket);
      throw new PeerConnectionException(PeerConnectionException.Reason.SOCKET_UNAVAILABLE,
              "Could not open streams to " + peer, ioe);
    }
    connection.handshake();
    return connection;
  }

  /**
   * Sends our handshake and reads the remote one. The remote peer id is
   * recorded on the {@link Peer}.
   */
  void handshake() throws IOException {
    this.state = State.HANDSHAKING;
    Handshake remote;
    try {
      int readTimeout = this.socket.getSoTimeout();
      this.socket.setSoTimeout(this.handshakeTimeout);
      synchronized (this.writeLock) {
        ByteBuffer data = Handshake.craft(this.infoHash, this.localPeerId).getData();
        this.out.write(data.array(), data.arrayOffset(), data.remaining());
        this.out.flush();
        this.lastSent = System.currentTimeMillis();
      }
      ByteBuffer received = ByteBuffer.allocate(Handshake.LENGTH);
      fill(received);
      received.flip();
      this.socket.setSoTimeout(readTimeout);
      remote = Handshake.parse(received);
    } catch (ParseException pe) {
      close();
      throw new ProtocolViolationException("Invalid handshake from " + this.peer + ": " + pe.getMessage(), pe);
    } catch (IOException ioe) {
      close();
      throw new PeerConnectionException(PeerConnectionException.Reason.SOCKET_UNAVAILABLE,
              "Handshake with " + this.peer + " failed: " + ioe.getMessage(), ioe);
    }

    if (!this.infoHash.equals(remote.getInfoHash())) {
      close();
      throw new ProtocolViolationException("Peer " + this.peer + " is sharing " +
              remote.getInfoHash() + ", expected " + this.infoHash);
    }

    this.peer.setPeerId(remote.getPeerId());
    this.state = State.IDLE;
    logger.debug("Handshake with {} done", this.peer);
  }

  /**
   * Writes one framed message and updates the local choke and interest
   * flags. Any I/O failure closes the connection.
   */
  public void send(PeerMessage message) throws IOException {
    if (this.state == State.CLOSED) {
      throw new IOException("Connection to " + this.peer + " is closed");
    }
    synchronized (this.writeLock) {
      ByteBuffer data = message.getData();
      try {
        this.out.write(data.array(), data.arrayOffset() + data.position(), data.remaining());
        this.out.flush();
      } catch (IOException ioe) {
        close();
        throw ioe;
      }
      this.lastSent = System.currentTimeMillis();

      switch (message.getType()) {
        case CHOKE:
          this.amChoking = true;
          break;
        case UNCHOKE:
          this.amChoking = false;
          break;
        case INTERESTED:
          this.amInterested = true;
          break;
        case NOT_INTERESTED:
          this.amInterested = false;
          break;
        case REQUEST:
          requestsChanged(1, false);
          break;
        case CANCEL:
          requestsChanged(-1, false);
          break;
        default:
          break;
      }
    }
    logger.trace("Sent {} to {}", message, this.peer);
  }

  /**
   * Reads one message.
   *
   * @return the message, or {@code null} when nothing arrived within the read
   * timeout. A partially read frame is kept for the next call.
   * @throws ProtocolViolationException when the frame is oversized or does
   *                                    not parse.
   * @throws IOException                when the socket fails or the peer
   *                                    closed it.
   */
  @Nullable
  public PeerMessage receive() throws IOException {
    sendKeepAliveIfIdle();

    ByteBuffer data;
    try {
      if (this.frame == null) {
        fill(this.lengthBuffer);
        int length = this.lengthBuffer.getInt(0);
        this.lengthBuffer.clear();
        if (length < 0 || length > this.maxFrameLength) {
          close();
          throw new ProtocolViolationException("Peer " + this.peer +
                  " announced a " + length + " byte(s) message");
        }
        this.frame = ByteBuffer.allocate(4 + length);
        this.frame.putInt(length);
      }
      fill(this.frame);
      data = this.frame;
      this.frame = null;
    } catch (SocketTimeoutException ste) {
      return null;
    } catch (ProtocolViolationException pve) {
      throw pve;
    } catch (IOException ioe) {
      close();
      throw ioe;
    }

    data.flip();
    PeerMessage message;
    try {
      message = PeerMessage.parse(data, this.torrent);
    } catch (ParseException pe) {
      close();
      throw new ProtocolViolationException("Invalid message from " + this.peer + ": " + pe.getMessage(), pe);
    }

    switch (message.getType()) {
      case CHOKE:
        this.peerChoking = true;
        synchronized (this.writeLock) {
          requestsChanged(0, true);
        }
        break;
      case UNCHOKE:
        this.peerChoking = false;
        break;
      case INTERESTED:
        this.peerInterested = true;
        break;
      case NOT_INTERESTED:
        this.peerInterested = false;
        break;
      case PIECE:
        synchronized (this.writeLock) {
          requestsChanged(-1, false);
          if (this.pendingRequests > 0 && this.state != State.CLOSED) {
            this.state = State.TRANSFERRING;
          }
        }
        break;
      default:
        break;
    }
    logger.trace("Received {} from {}", message, this.peer);
    return message;
  }

  private void requestsChanged(int delta, boolean clear) {
    this.pendingRequests = clear ? 0 : Math.max(0, this.pendingRequests + delta);
    if (this.state == State.CLOSED) {
      return;
    }
    if (this.pendingRequests == 0) {
      this.state = State.IDLE;
    } else if (this.state == State.IDLE) {
      this.state = State.REQUESTING;
    }
  }

  private void sendKeepAliveIfIdle() throws IOException {
    if (System.currentTimeMillis() - this.lastSent >= Constants.KEEP_ALIVE_INTERVAL_MILLIS) {
      send(PeerMessage.KeepAliveMessage.craft());
    }
  }

  /**
   * Reads until {@code buffer} is full. Bytes read before a timeout stay in
   * the buffer.
   */
  private void fill(ByteBuffer buffer) throws IOException {
    while (buffer.hasRemaining()) {
      int read = this.in.read(buffer.array(), buffer.arrayOffset() + buffer.position(), buffer.remaining());
      if (read < 0) {
        throw new EOFException("Peer " + this.peer + " closed the connection");
      }
      buffer.position(buffer.position() + read);
    }
  }

  /**
   * Closes the socket, which also unblocks a pending {@link #receive()}.
   */
  public void close() {
    if (this.state == State.CLOSED) {
      return;
    }
    this.state = State.CLOSED;
    closeQuietly(this.socket);
    logger.debug("Closed connection to {}", this.peer);
  }

  private static void closeQuietly(Socket socket) {
    try {
      socket.close();
    } catch (IOException ioe) {
      logger.debug("Error while closing socket", ioe);
    }
  }

  public boolean isClosed() {
    return this.state == State.CLOSED;
  }

  public State getState() {
    return this.state;
  }

  public Peer getPeer() {
    return this.peer;
  }

  public boolean isAmChoking() {
    return this.amChoking;
  }

  public boolean isAmInterested() {
    return this.amInterested;
  }

  public boolean isPeerChoking() {
    return this.peerChoking;
  }

  public boolean isPeerInterested() {
    return this.peerInterested;
  }

  @Override
  public String toString() {
    return "connection to " + this.peer + " [" + this.state + "]";
  }
}
