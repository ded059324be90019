package com.bitflow.client.announce;

import com.bitflow.common.PeerId;

import java.net.URI;
import java.net.UnknownHostException;
import java.net.UnknownServiceException;

public class TrackerClientFactoryImpl implements TrackerClientFactory {

  @Override
  public TrackerClient createTrackerClient(URI tracker, PeerId peerId, int port)
          throws UnknownHostException, UnknownServiceException {
    String scheme = tracker.getScheme();
    if ("http".equals(scheme) || "https".equals(scheme)) {
      if (tracker.getHost() == null) {
        throw new UnknownHostException("No host in tracker URI " + tracker);
      }
      return new HTTPTrackerClient(tracker, peerId, port);
    }
    throw new UnknownServiceException("Unsupported announce scheme: " + scheme + "!");
  }
}
