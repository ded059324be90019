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

import com.bitflow.Constants;
import com.bitflow.client.announce.TrackerClientFactory;
import com.bitflow.client.announce.TrackerClientFactoryImpl;
import com.bitflow.client.strategy.RequestStrategy;
import com.bitflow.client.strategy.RequestStrategyImplRarest;
import com.bitflow.common.PeerId;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.jetbrains.annotations.NotNull;

import java.security.SecureRandom;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Per-process settings of a {@link Client}.
 *
 * <p>
 * The peer id is generated once, when the environment is created, and is
 * passed by value to every task. Every other setting starts from the
 * defaults in {@link Constants} and may be changed before the client starts.
 * </p>
 */
public class ClientEnvironment {

  public static final String BITTORRENT_ID_PREFIX = "-BF0100-";

  private final PeerId peerId;
  private int port = Constants.DEFAULT_PORT;
  private int announceIntervalSec = Constants.DEFAULT_ANNOUNCE_INTERVAL_SEC;
  private int connectionTimeoutMillis = Constants.DEFAULT_CONNECTION_TIMEOUT_MILLIS;
  private int socketReadTimeoutMillis = Constants.DEFAULT_SOCKET_READ_TIMEOUT_MILLIS;
  private int pipelineDepth = Constants.DEFAULT_PIPELINE_DEPTH;
  private int blockSize = Constants.DEFAULT_BLOCK_SIZE;
  private int maxConnectionCount = Constants.DEFAULT_MAX_CONNECTION_COUNT;
  private RequestStrategy requestStrategy = new RequestStrategyImplRarest();
  private TrackerClientFactory trackerClientFactory = new TrackerClientFactoryImpl();

  public ClientEnvironment() {
    this(PeerId.generate(BITTORRENT_ID_PREFIX, new SecureRandom()));
  }

  public ClientEnvironment(@NotNull PeerId peerId) {
    this.peerId = peerId;
  }

  @NotNull
  public PeerId getPeerId() {
    return peerId;
  }

  /**
   * The port reported to trackers.
   */
  public int getPort() {
    return port;
  }

  public void setPort(int port) {
    Preconditions.checkArgument(port > 0 && port <= 65535, "invalid port %s", port);
    this.port = port;
  }

  /**
   * Seconds between announces when a tracker does not say, and after a
   * failed announce.
   */
  public int getAnnounceIntervalSec() {
    return announceIntervalSec;
  }

  public void setAnnounceIntervalSec(int announceIntervalSec) {
    Preconditions.checkArgument(announceIntervalSec > 0, "announce interval must be positive");
    this.announceIntervalSec = announceIntervalSec;
  }

  public int getConnectionTimeoutMillis() {
    return connectionTimeoutMillis;
  }

  public void setConnectionTimeoutMillis(int connectionTimeoutMillis) {
    this.connectionTimeoutMillis = connectionTimeoutMillis;
  }

  /**
   * How long a peer read blocks before the connection task checks whether
   * it was asked to stop.
   */
  public int getSocketReadTimeoutMillis() {
    return socketReadTimeoutMillis;
  }

  public void setSocketReadTimeoutMillis(int socketReadTimeoutMillis) {
    Preconditions.checkArgument(socketReadTimeoutMillis > 0, "read timeout must be positive");
    this.socketReadTimeoutMillis = socketReadTimeoutMillis;
  }

  public int getPipelineDepth() {
    return pipelineDepth;
  }

  public void setPipelineDepth(int pipelineDepth) {
    Preconditions.checkArgument(pipelineDepth > 0, "pipeline depth must be positive");
    this.pipelineDepth = pipelineDepth;
  }

  public int getBlockSize() {
    return blockSize;
  }

  public void setBlockSize(int blockSize) {
    Preconditions.checkArgument(blockSize > 0 && blockSize <= 128 * 1024, "invalid block size %s", blockSize);
    this.blockSize = blockSize;
  }

  public int getMaxConnectionCount() {
    return maxConnectionCount;
  }

  public void setMaxConnectionCount(int maxConnectionCount) {
    Preconditions.checkArgument(maxConnectionCount > 0, "connection count must be positive");
    this.maxConnectionCount = maxConnectionCount;
  }

  public RequestStrategy getRequestStrategy() {
    return requestStrategy;
  }

  public void setRequestStrategy(@NotNull RequestStrategy requestStrategy) {
    this.requestStrategy = requestStrategy;
  }

  public TrackerClientFactory getTrackerClientFactory() {
    return trackerClientFactory;
  }

  public void setTrackerClientFactory(@NotNull TrackerClientFactory trackerClientFactory) {
    this.trackerClientFactory = trackerClientFactory;
  }

  /**
   * A cached pool of named daemon threads for announce loops and connection
   * tasks.
   */
  public ExecutorService newExecutorService() {
    return Executors.newCachedThreadPool(new ThreadFactoryBuilder()
            .setNameFormat("bitflow-worker-%d")
            .setDaemon(true)
            .build());
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
            .add("peerId", peerId)
            .add("port", port)
            .add("announceIntervalSec", announceIntervalSec)
            .add("pipelineDepth", pipelineDepth)
            .add("maxConnectionCount", maxConnectionCount)
            .toString();
  }
}
