package com.bitflow.client.peer;

import java.util.EventListener;

/**
 * Told when a connection task ends, whatever the reason.
 */
public interface SharingPeerListener extends EventListener {

  void peerDisconnected(SharingPeer peer);
}
