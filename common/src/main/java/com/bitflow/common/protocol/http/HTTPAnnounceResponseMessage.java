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

import com.bitflow.bcodec.BEUtils;
import com.bitflow.bcodec.BEValue;
import com.bitflow.bcodec.InvalidBEncodingException;
import com.bitflow.common.Peer;
import com.bitflow.common.PeerId;
import com.bitflow.common.protocol.AnnounceResponseMessage;
import com.google.common.base.MoreObjects;
import com.google.common.net.InetAddresses;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The announce response message from an HTTP tracker.
 *
 * @author mpetazzoni
 */
public class HTTPAnnounceResponseMessage extends HTTPTrackerMessage
        implements AnnounceResponseMessage {

  public static final int DEFAULT_INTERVAL_SEC = 60;

  public static final String INTERVAL = "interval";
  public static final String MIN_INTERVAL = "min interval";
  public static final String TRACKER_ID = "tracker id";
  public static final String WARNING_MESSAGE = "warning message";
  public static final String COMPLETE = "complete";
  public static final String INCOMPLETE = "incomplete";
  public static final String PEERS = "peers";
  public static final String PEERS6 = "peers6";
  public static final String EXTERNAL_IP = "external ip";
  public static final String PEER_ID = "peer id";
  public static final String PEER_IP = "ip";
  public static final String PEER_PORT = "port";

  private static final String RESPONSE = "tracker response";
  private static final String PEER_ENTRY = "peer entry";

  private static final Set<String> RESPONSE_KEYS = new HashSet<String>(Arrays.asList(
          INTERVAL, MIN_INTERVAL, TRACKER_ID, WARNING_MESSAGE, COMPLETE, INCOMPLETE,
          PEERS, PEERS6, EXTERNAL_IP));
  private static final Set<String> PEER_KEYS = new HashSet<String>(Arrays.asList(
          PEER_ID, PEER_IP, PEER_PORT));

  private static final int COMPACT_PEER_SIZE = 6;

  private final int interval;
  private final int minInterval;
  private final String trackerId;
  private final String warningMessage;
  private final int complete;
  private final int incomplete;
  private final List<Peer> peers;

  public HTTPAnnounceResponseMessage(int interval, int minInterval,
                                     @Nullable String trackerId, @Nullable String warningMessage,
                                     int complete, int incomplete, List<Peer> peers) {
    super(Type.ANNOUNCE_RESPONSE);
    this.interval = interval;
    this.minInterval = minInterval;
    this.trackerId = trackerId;
    this.warningMessage = warningMessage;
    this.complete = complete;
    this.incomplete = incomplete;
    this.peers = Collections.unmodifiableList(new ArrayList<Peer>(peers));
  }

  @Override
  public int getInterval() {
    return this.interval;
  }

  @Override
  public int getMinInterval() {
    return this.minInterval;
  }

  @Nullable
  @Override
  public String getTrackerId() {
    return this.trackerId;
  }

  @Nullable
  @Override
  public String getWarningMessage() {
    return this.warningMessage;
  }

  @Override
  public int getComplete() {
    return this.complete;
  }

  @Override
  public int getIncomplete() {
    return this.incomplete;
  }

  @Override
  public List<Peer> getPeers() {
    return this.peers;
  }

  @NotNull
  public static HTTPAnnounceResponseMessage fromBEValue(@NotNull Map<String, BEValue> params)
          throws MessageValidationException {
    try {
      BEUtils.checkKeys(params, RESPONSE_KEYS, RESPONSE);

      List<Peer> peers = Collections.emptyList();
      BEValue peersValue = params.get(PEERS);
      if (peersValue != null) {
        peers = decodePeers(peersValue);
      }

      return new HTTPAnnounceResponseMessage(
              BEUtils.getInt(params.get(INTERVAL), DEFAULT_INTERVAL_SEC),
              BEUtils.getInt(params.get(MIN_INTERVAL), 0),
              BEUtils.getString(params.get(TRACKER_ID)),
              BEUtils.getString(params.get(WARNING_MESSAGE)),
              BEUtils.getInt(params.get(COMPLETE), 0),
              BEUtils.getInt(params.get(INCOMPLETE), 0),
              peers);
    } catch (InvalidBEncodingException ibee) {
      throw new MessageValidationException("Invalid response from tracker: " + ibee.getMessage(), ibee);
    }
  }

  /**
   * The dictionary list form is tried first. Only a value that is not a list
   * at all is read as a compact blob; a list with a bad entry stays an error.
   */
  private static List<Peer> decodePeers(BEValue peersValue) throws InvalidBEncodingException {
    try {
      return toPeerList(peersValue.getList());
    } catch (InvalidBEncodingException e) {
      if (peersValue.isList()) {
        throw e;
      }
      return toPeerList(peersValue.getBytes());
    }
  }

  /**
   * Build a peer list as a list of {@link Peer}s from the
   * announce response's peer list (in non-compact mode).
   *
   * @param peers The list of {@link BEValue}s dictionaries describing the
   *              peers from the announce response.
   * @return A {@link List} of {@link Peer}s, with their peer IDs when the
   * tracker sent them.
   */
  private static List<Peer> toPeerList(List<BEValue> peers) throws InvalidBEncodingException {
    List<Peer> result = new ArrayList<Peer>();
    for (BEValue peer : peers) {
      Map<String, BEValue> peerInfo = peer.getMap();
      BEUtils.checkKeys(peerInfo, PEER_KEYS, PEER_ENTRY);

      String ip = BEUtils.getRequired(peerInfo, PEER_IP, PEER_ENTRY).getString();
      int port = BEUtils.getRequired(peerInfo, PEER_PORT, PEER_ENTRY).getInt();
      if (port < 0 || port > 0xFFFF) {
        throw new InvalidBEncodingException("Invalid peer entry: port " + port + " out of range");
      }

      PeerId peerId = null;
      byte[] peerIdBytes = BEUtils.getBytes(peerInfo.get(PEER_ID));
      if (peerIdBytes != null) {
        if (peerIdBytes.length != PeerId.LENGTH) {
          throw new InvalidBEncodingException("Invalid peer entry: peer id of " + peerIdBytes.length + " bytes");
        }
        peerId = PeerId.fromBytes(peerIdBytes);
      }
      result.add(new Peer(ip, port, peerId));
    }
    return result;
  }

  /**
   * Build a peer list as a list of {@link Peer}s from the
   * announce response's binary compact peer list: 4 bytes of IPv4 address
   * and 2 bytes of port per peer, both big-endian.
   *
   * @param data The bytes representing the compact peer list from the
   *             announce response.
   * @return A {@link List} of {@link Peer}s representing the
   * peers' addresses. Peer IDs are lost, but they are not crucial.
   */
  private static List<Peer> toPeerList(byte[] data) throws InvalidBEncodingException {
    if (data.length % COMPACT_PEER_SIZE != 0) {
      throw new InvalidBEncodingException("Invalid peers binary information string of " +
              data.length + " bytes");
    }

    List<Peer> result = new ArrayList<Peer>();
    ByteBuffer peers = ByteBuffer.wrap(data);
    byte[] ipBytes = new byte[4];
    while (peers.hasRemaining()) {
      peers.get(ipBytes);
      int port = peers.getShort() & 0xFFFF;
      try {
        result.add(new Peer(InetAddress.getByAddress(ipBytes).getHostAddress(), port));
      } catch (UnknownHostException e) {
        throw new InternalError(e.toString());
      }
    }
    return result;
  }

  /**
   * Encodes this response the way a tracker sends it.
   *
   * @param compact whether to send IPv4 peers as a compact blob
   */
  @NotNull
  public Map<String, BEValue> toBEValue(boolean compact) {
    Map<String, BEValue> params = new HashMap<String, BEValue>();
    params.put(INTERVAL, new BEValue(interval));
    if (minInterval > 0)
      params.put(MIN_INTERVAL, new BEValue(minInterval));
    if (trackerId != null)
      params.put(TRACKER_ID, new BEValue(trackerId));
    if (warningMessage != null)
      params.put(WARNING_MESSAGE, new BEValue(warningMessage));
    params.put(COMPLETE, new BEValue(complete));
    params.put(INCOMPLETE, new BEValue(incomplete));

    if (compact) {
      ByteBuffer data = ByteBuffer.allocate(peers.size() * COMPACT_PEER_SIZE);
      for (Peer peer : peers) {
        byte[] ip = InetAddresses.forString(peer.getIp()).getAddress();
        if (ip.length != 4) {
          throw new IllegalArgumentException("Cannot encode " + peer + " in compact form");
        }
        data.put(ip);
        data.putShort((short) peer.getPort());
      }
      params.put(PEERS, new BEValue(Arrays.copyOf(data.array(), data.position())));
    } else {
      List<BEValue> peerList = new ArrayList<BEValue>();
      for (Peer peer : peers) {
        Map<String, BEValue> peerItem = new HashMap<String, BEValue>();
        PeerId peerId = peer.getPeerId();
        if (peerId != null)
          peerItem.put(PEER_ID, new BEValue(peerId.getBytes()));
        peerItem.put(PEER_IP, new BEValue(peer.getIp()));
        peerItem.put(PEER_PORT, new BEValue(peer.getPort()));
        peerList.add(new BEValue(peerItem));
      }
      params.put(PEERS, new BEValue(peerList));
    }

    return params;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
            .add("interval", getInterval())
            .add("minInterval", getMinInterval())
            .add("trackerId", getTrackerId())
            .add("complete", getComplete())
            .add("incomplete", getIncomplete())
            .add("peers", getPeers())
            .toString();
  }
}
