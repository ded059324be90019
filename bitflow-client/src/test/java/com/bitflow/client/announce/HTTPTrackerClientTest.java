package com.bitflow.client.announce;

import com.bitflow.FakeTracker;
import com.bitflow.bcodec.BEValue;
import com.bitflow.bcodec.BEncoder;
import com.bitflow.client.DownloadProgress;
import com.bitflow.common.InfoHash;
import com.bitflow.common.Peer;
import com.bitflow.common.PeerId;
import com.bitflow.common.protocol.AnnounceRequestMessage.RequestEvent;
import com.bitflow.common.protocol.AnnounceResponseMessage;
import com.bitflow.common.protocol.http.HTTPAnnounceResponseMessage;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.testng.Assert.*;

@Test
public class HTTPTrackerClientTest {

  private final InfoHash infoHash = InfoHash.ofInfoDictionary("d4:name3:abce".getBytes(StandardCharsets.US_ASCII));
  private final PeerId peerId = PeerId.generate("-BF0100-", new Random(11));

  private FakeTracker tracker;

  @BeforeMethod
  public void setUp() throws IOException {
    tracker = new FakeTracker();
    tracker.start();
  }

  @AfterMethod
  public void tearDown() throws IOException {
    tracker.stop();
  }

  private static DownloadProgress progress(long downloaded, long left) {
    return new DownloadProgress(40000, downloaded, 0, left, 3, new BitSet());
  }

  private static byte[] bencode(Map<String, BEValue> params) throws IOException {
    ByteBuffer encoded = BEncoder.bencode(params);
    byte[] bytes = new byte[encoded.remaining()];
    encoded.get(bytes);
    return bytes;
  }

  private static byte[] answer(String trackerId, Peer... peers) throws IOException {
    List<Peer> list = new ArrayList<Peer>();
    Collections.addAll(list, peers);
    return bencode(new HTTPAnnounceResponseMessage(1800, 0, trackerId, null, 3, 7, list).toBEValue(true));
  }

  public void testAnnounceQueryAndCompactPeers() throws Exception {
    tracker.respondWith(200, answer(null, new Peer("10.1.2.3", 6882)));
    HTTPTrackerClient client = new HTTPTrackerClient(tracker.getAnnounceURI(), peerId, 6881);

    AnnounceResponseMessage response = client.announce(RequestEvent.STARTED, infoHash, progress(0, 40000));

    assertEquals(tracker.getRequests().size(), 1);
    assertEquals(tracker.getRequests().get(0), "/announce" +
            "?info_hash=" + infoHash.urlEncoded() +
            "&peer_id=" + peerId.urlEncoded() +
            "&port=6881&uploaded=0&downloaded=0&left=40000&compact=1&event=started");
    assertEquals(response.getInterval(), 1800);
    assertEquals(response.getComplete(), 3);
    assertEquals(response.getIncomplete(), 7);
    assertEquals(response.getPeers().size(), 1);
    assertEquals(response.getPeers().get(0).getIp(), "10.1.2.3");
    assertEquals(response.getPeers().get(0).getPort(), 6882);
  }

  public void testRegularAnnounceHasNoEvent() throws Exception {
    tracker.respondWith(200, answer(null));
    HTTPTrackerClient client = new HTTPTrackerClient(tracker.getAnnounceURI(), peerId, 6881);

    client.announce(RequestEvent.NONE, infoHash, progress(16384, 23616));

    String request = tracker.getRequests().get(0);
    assertTrue(request.endsWith("&downloaded=16384&left=23616&compact=1"), request);
  }

  public void testTrackerIdIsEchoed() throws Exception {
    tracker.respondWith(200, answer("abc 1"));
    HTTPTrackerClient client = new HTTPTrackerClient(tracker.getAnnounceURI(), peerId, 6881);

    client.announce(RequestEvent.STARTED, infoHash, progress(0, 40000));
    assertFalse(tracker.getRequests().get(0).contains("trackerid="));
    assertEquals(client.getTrackerId(), "abc 1");

    client.announce(RequestEvent.NONE, infoHash, progress(10, 40000));
    assertTrue(tracker.getRequests().get(1).endsWith("&trackerid=abc%201"), tracker.getRequests().get(1));
  }

  public void testListenersAreFired() throws Exception {
    tracker.respondWith(200, answer(null, new Peer("10.1.2.3", 6882)));
    HTTPTrackerClient client = new HTTPTrackerClient(tracker.getAnnounceURI(), peerId, 6881);
    AnnounceResponseListener listener = mock(AnnounceResponseListener.class);
    client.register(listener);

    client.announce(RequestEvent.STARTED, infoHash, progress(0, 40000));

    URI uri = tracker.getAnnounceURI();
    verify(listener).handleAnnounceResponse(uri, 1800, 3, 7);
    verify(listener).handleDiscoveredPeers(eq(uri), any());
  }

  public void testFailureReason() throws Exception {
    tracker.respondWith(200, "d14:failure reason11:not allowed8:intervali30ee".getBytes(StandardCharsets.US_ASCII));
    HTTPTrackerClient client = new HTTPTrackerClient(tracker.getAnnounceURI(), peerId, 6881);
    try {
      client.announce(RequestEvent.STARTED, infoHash, progress(0, 40000));
      fail("The tracker refused the announce");
    } catch (AnnounceException e) {
      assertTrue(e.getMessage().contains("not allowed"), e.getMessage());
    }
  }

  @Test(expectedExceptions = AnnounceException.class)
  public void testHttpErrorStatus() throws Exception {
    tracker.respondWith(500, answer(null));
    new HTTPTrackerClient(tracker.getAnnounceURI(), peerId, 6881)
            .announce(RequestEvent.STARTED, infoHash, progress(0, 40000));
  }

  @Test(expectedExceptions = AnnounceException.class)
  public void testGarbageBody() throws Exception {
    tracker.respondWith(200, "<html>nope</html>".getBytes(StandardCharsets.US_ASCII));
    new HTTPTrackerClient(tracker.getAnnounceURI(), peerId, 6881)
            .announce(RequestEvent.STARTED, infoHash, progress(0, 40000));
  }

  @Test(expectedExceptions = AnnounceException.class)
  public void testUnknownPath() throws Exception {
    new HTTPTrackerClient(tracker.getURI("/nowhere"), peerId, 6881)
            .announce(RequestEvent.STARTED, infoHash, progress(0, 40000));
  }

  public void testRedirectIsFollowed() throws Exception {
    tracker.respondWith(200, answer(null, new Peer("10.1.2.3", 6882)));
    HTTPTrackerClient client = new HTTPTrackerClient(tracker.getURI(FakeTracker.REDIRECT_PATH), peerId, 6881);

    AnnounceResponseMessage response = client.announce(RequestEvent.STARTED, infoHash, progress(0, 40000));

    assertEquals(response.getPeers().size(), 1);
    assertEquals(tracker.getRequests().size(), 1);
    assertTrue(tracker.getRequests().get(0).contains("info_hash=" + infoHash.urlEncoded()));
  }

  @Test(expectedExceptions = AnnounceException.class)
  public void testUnreachableTracker() throws Exception {
    URI uri = tracker.getAnnounceURI();
    tracker.stop();
    new HTTPTrackerClient(uri, peerId, 6881)
            .announce(RequestEvent.STARTED, infoHash, progress(0, 40000));
  }

  public void testCloseAbortsRequestInFlight() throws Exception {
    ExecutorService executor = Executors.newFixedThreadPool(2);
    try (ServerSocket silent = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
      final CountDownLatch accepted = new CountDownLatch(1);
      Future<Socket> remote = executor.submit(() -> {
        Socket socket = silent.accept();
        accepted.countDown();
        return socket;
      });

      URI uri = new URI("http://127.0.0.1:" + silent.getLocalPort() + "/announce");
      final HTTPTrackerClient client = new HTTPTrackerClient(uri, peerId, 6881);
      Future<AnnounceResponseMessage> pending = executor.submit(
              () -> client.announce(RequestEvent.STARTED, infoHash, progress(0, 40000)));

      assertTrue(accepted.await(5, TimeUnit.SECONDS));
      long start = System.nanoTime();
      client.close();
      try {
        pending.get(HTTPTrackerClient.TIMEOUT_MILLIS / 2, TimeUnit.MILLISECONDS);
        fail("aborted announce must fail");
      } catch (ExecutionException e) {
        assertTrue(e.getCause() instanceof AnnounceException, String.valueOf(e.getCause()));
      }
      assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < HTTPTrackerClient.TIMEOUT_MILLIS);
      remote.get().close();
    } finally {
      executor.shutdownNow();
    }
  }

  @Test(expectedExceptions = AnnounceException.class)
  public void testAnnounceAfterCloseFails() throws Exception {
    HTTPTrackerClient client = new HTTPTrackerClient(tracker.getAnnounceURI(), peerId, 6881);
    client.close();
    try {
      client.announce(RequestEvent.STARTED, infoHash, progress(0, 40000));
    } finally {
      assertTrue(tracker.getRequests().isEmpty());
    }
  }
}
