package com.bitflow.client;

import com.bitflow.TempFiles;
import com.bitflow.client.announce.TrackerClient;
import com.bitflow.client.announce.TrackerClientFactory;
import com.bitflow.client.peer.SharingPeer;
import com.bitflow.common.InfoHash;
import com.bitflow.common.Peer;
import com.bitflow.common.TorrentInfo;
import com.bitflow.common.TorrentMetadata;
import com.bitflow.common.protocol.http.HTTPAnnounceResponseMessage;
import org.apache.commons.io.FileUtils;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.File;
import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;
import static org.testng.Assert.*;

@Test
public class ClientTest {

  private static final String TRACKER = "http://tracker.example/announce";

  private final byte[] content = TestTorrents.content(40000);
  private final TorrentInfo info = TestTorrents.singleFile(content, 16384);

  private TempFiles tempFiles;
  private File downloadDir;
  private ClientEnvironment environment;
  private TrackerClient trackerClient;
  private final List<ServerSocket> silentPeers = new ArrayList<ServerSocket>();

  @BeforeMethod
  public void setUp() throws Exception {
    tempFiles = new TempFiles();
    downloadDir = tempFiles.createTempDir();

    trackerClient = mock(TrackerClient.class);
    when(trackerClient.getTrackerURI()).thenReturn(URI.create(TRACKER));
    when(trackerClient.announce(any(), any(), any())).thenReturn(
            new HTTPAnnounceResponseMessage(3600, 0, null, null, 0, 0, Collections.<Peer>emptyList()));
    TrackerClientFactory factory = mock(TrackerClientFactory.class);
    when(factory.createTrackerClient(any(), any(), anyInt())).thenReturn(trackerClient);

    environment = new ClientEnvironment();
    environment.setTrackerClientFactory(factory);
    environment.setConnectionTimeoutMillis(3000);
    environment.setSocketReadTimeoutMillis(200);
  }

  @AfterMethod
  public void tearDown() throws IOException {
    for (ServerSocket socket : silentPeers) {
      socket.close();
    }
    silentPeers.clear();
    tempFiles.cleanup();
  }

  private TorrentMetadata metadata() {
    return new TorrentMetadata(InfoHash.ofInfoDictionary("d4:name11:content.bine".getBytes(StandardCharsets.US_ASCII)),
            TRACKER, Collections.<List<String>>emptyList(), info,
            null, null, null, null, Collections.<String>emptyList());
  }

  /**
   * A listening socket nobody accepts from: connections are established but
   * the handshake never gets an answer.
   */
  private Peer silentPeer() throws IOException {
    ServerSocket socket = new ServerSocket(0, 10, InetAddress.getLoopbackAddress());
    silentPeers.add(socket);
    return new Peer("127.0.0.1", socket.getLocalPort());
  }

  public void testFreshDownloadStartsSharing() throws Exception {
    Client client = new Client(environment, metadata(), downloadDir);
    client.start();
    try {
      assertEquals(client.getState(), ClientState.SHARING);
      assertEquals(client.getAnnounces().size(), 1);
      assertEquals(client.getProgress().getLeft(), 40000);
      assertFalse(client.waitForCompletion(10, TimeUnit.MILLISECONDS));
      verify(trackerClient).register(client);
    } finally {
      client.stop();
    }
    assertEquals(client.getState(), ClientState.DONE);
    assertTrue(new File(downloadDir, "content.bin.part").exists());
    assertFalse(new File(downloadDir, "content.bin").exists());
  }

  public void testCompleteDataStartsSeeding() throws Exception {
    FileUtils.writeByteArrayToFile(new File(downloadDir, "content.bin"), content);

    Client client = new Client(environment, metadata(), downloadDir);
    client.start();
    try {
      assertEquals(client.getState(), ClientState.SEEDING);
      assertTrue(client.waitForCompletion(1, TimeUnit.SECONDS));
      assertTrue(client.getProgress().finished());
      assertEquals(client.getProgress().getDownloaded(), 0);
    } finally {
      client.stop();
    }
    assertEquals(client.getState(), ClientState.DONE);
    assertEquals(FileUtils.readFileToByteArray(new File(downloadDir, "content.bin")), content);
  }

  @Test(expectedExceptions = IllegalStateException.class)
  public void testStartTwice() throws Exception {
    Client client = new Client(environment, metadata(), downloadDir);
    client.start();
    try {
      client.start();
    } finally {
      client.stop();
    }
  }

  public void testStorageFailureIsError() throws Exception {
    File notADirectory = tempFiles.createTempFile("blocker", new byte[]{1});
    Client client = new Client(environment, metadata(), notADirectory);
    try {
      client.start();
      fail("The download directory is a file");
    } catch (IOException e) {
      assertEquals(client.getState(), ClientState.ERROR);
    }
    client.stop();
    assertEquals(client.getState(), ClientState.ERROR);
  }

  public void testDiscoveredPeersAreDeduplicated() throws Exception {
    Client client = new Client(environment, metadata(), downloadDir);
    client.start();
    try {
      Peer first = silentPeer();
      Peer second = silentPeer();
      Peer self = new Peer("127.0.0.1", 6881, environment.getPeerId());

      client.handleDiscoveredPeers(URI.create(TRACKER), Arrays.asList(
              first, new Peer(first.getIp(), first.getPort()), self));
      client.handleDiscoveredPeers(URI.create(TRACKER), Arrays.asList(first, second));

      List<String> hosts = new ArrayList<String>();
      for (SharingPeer peer : client.getConnectedPeers()) {
        hosts.add(peer.getPeer().getHostIdentifier());
      }
      Collections.sort(hosts);
      List<String> expected = new ArrayList<String>(Arrays.asList(first.getHostIdentifier(), second.getHostIdentifier()));
      Collections.sort(expected);
      assertEquals(hosts, expected);
    } finally {
      client.stop();
    }
    assertTrue(client.getConnectedPeers().isEmpty());
  }

  public void testConnectionCap() throws Exception {
    environment.setMaxConnectionCount(2);
    Client client = new Client(environment, metadata(), downloadDir);
    client.start();
    try {
      client.handleDiscoveredPeers(URI.create(TRACKER), Arrays.asList(silentPeer(), silentPeer(), silentPeer()));
      assertEquals(client.getConnectedPeers().size(), 2);
    } finally {
      client.stop();
    }
  }

  public void testNoPeersAfterStop() throws Exception {
    Client client = new Client(environment, metadata(), downloadDir);
    client.start();
    client.stop();
    client.handleDiscoveredPeers(URI.create(TRACKER), Collections.singletonList(silentPeer()));
    assertTrue(client.getConnectedPeers().isEmpty());
  }
}
