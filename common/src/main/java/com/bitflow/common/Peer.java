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
package com.bitflow.common;

import org.jetbrains.annotations.Nullable;

import java.net.InetSocketAddress;


/**
 * A basic BitTorrent peer.
 *
 * <p>
 * Peers come out of tracker responses, either from the dictionary list form
 * (which may carry the peer id and a host name) or from the compact form.
 * The address is resolved only when a connection is attempted. Two peers
 * are equal when they point to the same host and port.
 * </p>
 *
 * @author mpetazzoni
 */
public class Peer {

  private final String ip;
  private final int port;
  private final String hostId;

  private volatile PeerId peerId;

  /**
   * Instantiate a new peer.
   *
   * @param ip   The peer's IP address or host name.
   * @param port The peer's port.
   */
  public Peer(String ip, int port) {
    this(ip, port, null);
  }

  /**
   * Instantiate a new peer.
   *
   * @param ip     The peer's IP address or host name.
   * @param port   The peer's port.
   * @param peerId The peer ID, when known.
   */
  public Peer(String ip, int port, @Nullable PeerId peerId) {
    this.ip = ip;
    this.port = port;
    this.hostId = String.format("%s:%d", ip, port);
    this.peerId = peerId;
  }

  /**
   * Tells whether this peer has a known peer ID yet or not.
   */
  public boolean hasPeerId() {
    return this.peerId != null;
  }

  @Nullable
  public PeerId getPeerId() {
    return this.peerId;
  }

  /**
   * Set a peer ID for this peer (usually during handshake).
   *
   * @param peerId The new peer ID for this peer.
   */
  public void setPeerId(@Nullable PeerId peerId) {
    this.peerId = peerId;
  }

  /**
   * Returns this peer's IP address (or host name).
   */
  public String getIp() {
    return this.ip;
  }

  /**
   * Returns this peer's port number.
   */
  public int getPort() {
    return this.port;
  }

  /**
   * Resolves this peer's address. The result is unresolved when the host
   * name could not be looked up.
   */
  public InetSocketAddress getAddress() {
    return new InetSocketAddress(this.ip, this.port);
  }

  /**
   * Returns this peer's host identifier ("host:port").
   */
  public String getHostIdentifier() {
    return this.hostId;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return hostId.equals(((Peer) o).hostId);
  }

  @Override
  public int hashCode() {
    return hostId.hashCode();
  }

  /**
   * Returns a human-readable representation of this peer.
   */
  @Override
  public String toString() {
    return "Peer " + hostId;
  }
}
