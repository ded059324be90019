package com.bitflow.client.peer;

import com.bitflow.client.ClientEnvironment;
import com.bitflow.client.Handshake;
import com.bitflow.client.TestTorrents;
import com.bitflow.common.InfoHash;
import com.bitflow.common.Peer;
import com.bitflow.common.PeerId;
import com.bitflow.common.SingleFileInfo;
import com.bitflow.common.TorrentInfo;
import com.bitflow.common.protocol.PeerMessage;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.DataInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.BitSet;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.testng.Assert.*;

@Test
public class PeerConnectionTest {

  private final TorrentInfo torrent = TestTorrents.singleFile(TestTorrents.content(40000), 16384);
  private final InfoHash infoHash = InfoHash.ofInfoDictionary("d4:name11:content.bine".getBytes(StandardCharsets.US_ASCII));
  private final PeerId remoteId = PeerId.generate("-XX0001-", new Random(3));

  private ExecutorService executor;
  private ServerSocket server;
  private volatile Socket remote;
  private ClientEnvironment environment;

  @BeforeMethod
  public void setUp() throws IOException {
    executor = Executors.newSingleThreadExecutor();
    server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
    environment = new ClientEnvironment();
    environment.setConnectionTimeoutMillis(5000);
    environment.setSocketReadTimeoutMillis(200);
  }

  @AfterMethod
  public void tearDown() throws IOException {
    executor.shutdownNow();
    if (remote != null) {
      remote.close();
    }
    server.close();
  }

  private Peer localPeer() {
    return new Peer("127.0.0.1", server.getLocalPort());
  }

  /**
   * Accepts one connection, reads the handshake and answers with the given
   * info hash.
   */
  private Future<byte[]> answerHandshake(final InfoHash answerWith) {
    return executor.submit(() -> {
      remote = server.accept();
      byte[] received = new byte[Handshake.LENGTH];
      new DataInputStream(remote.getInputStream()).readFully(received);
      ByteBuffer reply = Handshake.craft(answerWith, remoteId).getData();
      remote.getOutputStream().write(reply.array(), reply.arrayOffset(), reply.remaining());
      remote.getOutputStream().flush();
      return received;
    });
  }

  private PeerConnection connect() throws Exception {
    return connect(torrent);
  }

  private PeerConnection connect(TorrentInfo sharing) throws Exception {
    Future<byte[]> handshake = answerHandshake(infoHash);
    PeerConnection connection = PeerConnection.connect(localPeer(), sharing, infoHash, environment);
    Handshake sent = Handshake.parse(ByteBuffer.wrap(handshake.get(5, TimeUnit.SECONDS)));
    assertEquals(sent.getInfoHash(), infoHash);
    assertEquals(sent.getPeerId(), environment.getPeerId());
    return connection;
  }

  private void remoteWrite(PeerMessage message) throws IOException {
    ByteBuffer data = message.getData();
    remoteWrite(data.array(), data.arrayOffset(), data.remaining());
  }

  private void remoteWrite(byte[] bytes, int offset, int length) throws IOException {
    OutputStream out = remote.getOutputStream();
    out.write(bytes, offset, length);
    out.flush();
  }

  public void testHandshakeRecordsRemotePeerId() throws Exception {
    PeerConnection connection = connect();
    try {
      assertEquals(connection.getState(), PeerConnection.State.IDLE);
      assertEquals(connection.getPeer().getPeerId(), remoteId);
      assertTrue(connection.isAmChoking());
      assertFalse(connection.isAmInterested());
      assertTrue(connection.isPeerChoking());
      assertFalse(connection.isPeerInterested());
    } finally {
      connection.close();
    }
    assertTrue(connection.isClosed());
  }

  @Test(expectedExceptions = ProtocolViolationException.class)
  public void testHandshakeForAnotherTorrent() throws Exception {
    answerHandshake(InfoHash.ofInfoDictionary("d4:name5:othere".getBytes(StandardCharsets.US_ASCII)));
    PeerConnection.connect(localPeer(), torrent, infoHash, environment);
  }

  @Test(expectedExceptions = ProtocolViolationException.class)
  public void testMalformedHandshake() throws Exception {
    executor.submit(() -> {
      remote = server.accept();
      byte[] garbage = new byte[Handshake.LENGTH];
      garbage[0] = 4;
      remote.getOutputStream().write(garbage);
      remote.getOutputStream().flush();
      return null;
    });
    PeerConnection.connect(localPeer(), torrent, infoHash, environment);
  }

  public void testInvalidPort() {
    try {
      PeerConnection.connect(new Peer("127.0.0.1", 0), torrent, infoHash, environment);
      fail("Port 0 must be rejected");
    } catch (PeerConnectionException e) {
      assertEquals(e.getReason(), PeerConnectionException.Reason.INVALID_ADDRESS);
    } catch (IOException e) {
      fail("Unexpected exception", e);
    }
  }

  public void testRefusedConnection() throws IOException {
    int port = server.getLocalPort();
    server.close();
    try {
      PeerConnection.connect(new Peer("127.0.0.1", port), torrent, infoHash, environment);
      fail("Nobody listens on " + port);
    } catch (PeerConnectionException e) {
      assertEquals(e.getReason(), PeerConnectionException.Reason.SOCKET_UNAVAILABLE);
    }
  }

  public void testReceiveTimesOutWithoutData() throws Exception {
    PeerConnection connection = connect();
    try {
      assertNull(connection.receive());
      assertFalse(connection.isClosed());
    } finally {
      connection.close();
    }
  }

  public void testPartialFrameSurvivesTimeout() throws Exception {
    PeerConnection connection = connect();
    try {
      ByteBuffer have = PeerMessage.HaveMessage.craft(2).getData();
      byte[] bytes = new byte[have.remaining()];
      have.get(bytes);

      remoteWrite(bytes, 0, 3);
      assertNull(connection.receive());
      remoteWrite(bytes, 3, 4);
      assertNull(connection.receive());
      remoteWrite(bytes, 7, bytes.length - 7);

      PeerMessage message = connection.receive();
      assertNotNull(message);
      assertEquals(message.getType(), PeerMessage.Type.HAVE);
      assertEquals(((PeerMessage.HaveMessage) message).getPieceIndex(), 2);
    } finally {
      connection.close();
    }
  }

  public void testFlagsFollowMessages() throws Exception {
    PeerConnection connection = connect();
    try {
      remoteWrite(PeerMessage.UnchokeMessage.craft());
      remoteWrite(PeerMessage.InterestedMessage.craft());
      assertEquals(connection.receive().getType(), PeerMessage.Type.UNCHOKE);
      assertFalse(connection.isPeerChoking());
      assertEquals(connection.receive().getType(), PeerMessage.Type.INTERESTED);
      assertTrue(connection.isPeerInterested());

      connection.send(PeerMessage.InterestedMessage.craft());
      connection.send(PeerMessage.UnchokeMessage.craft());
      assertTrue(connection.isAmInterested());
      assertFalse(connection.isAmChoking());

      DataInputStream in = new DataInputStream(remote.getInputStream());
      assertEquals(in.readInt(), 1);
      assertEquals(in.readByte(), PeerMessage.Type.INTERESTED.getTypeByte());
      assertEquals(in.readInt(), 1);
      assertEquals(in.readByte(), PeerMessage.Type.UNCHOKE.getTypeByte());
    } finally {
      connection.close();
    }
  }

  public void testRequestStateTransitions() throws Exception {
    PeerConnection connection = connect();
    try {
      connection.send(PeerMessage.RequestMessage.craft(0, 0, 4096));
      connection.send(PeerMessage.RequestMessage.craft(0, 4096, 4096));
      assertEquals(connection.getState(), PeerConnection.State.REQUESTING);

      remoteWrite(PeerMessage.PieceMessage.craft(0, 0, ByteBuffer.wrap(new byte[4096])));
      PeerMessage first = connection.receive();
      assertEquals(first.getType(), PeerMessage.Type.PIECE);
      assertEquals(connection.getState(), PeerConnection.State.TRANSFERRING);

      remoteWrite(PeerMessage.PieceMessage.craft(0, 4096, ByteBuffer.wrap(new byte[4096])));
      connection.receive();
      assertEquals(connection.getState(), PeerConnection.State.IDLE);

      connection.send(PeerMessage.RequestMessage.craft(1, 0, 4096));
      remoteWrite(PeerMessage.ChokeMessage.craft());
      connection.receive();
      assertTrue(connection.isPeerChoking());
      assertEquals(connection.getState(), PeerConnection.State.IDLE);
    } finally {
      connection.close();
    }
  }

  public void testOversizedFrameIsViolation() throws Exception {
    PeerConnection connection = connect();
    remoteWrite(ByteBuffer.allocate(4).putInt(1 << 30).array(), 0, 4);
    try {
      connection.receive();
      fail("A 1 GiB frame must be refused");
    } catch (ProtocolViolationException e) {
      assertTrue(connection.isClosed());
    }
  }

  public void testBitfieldLargerThanBlockFrameIsAccepted() throws Exception {
    int pieces = 1200000;
    TorrentInfo huge = new SingleFileInfo("huge", 16384, new byte[pieces * 20], false, (long) pieces * 16384, null);
    PeerConnection connection = connect(huge);
    try {
      BitSet available = new BitSet();
      available.set(0);
      available.set(pieces - 1);
      remoteWrite(PeerMessage.BitfieldMessage.craft(available, pieces));

      PeerMessage received = null;
      long deadline = System.currentTimeMillis() + 5000;
      while (received == null && System.currentTimeMillis() < deadline) {
        received = connection.receive();
      }
      assertNotNull(received);
      assertEquals(((PeerMessage.BitfieldMessage) received).getBitfield(), available);
    } finally {
      connection.close();
    }
  }

  public void testInvalidMessageIsViolation() throws Exception {
    PeerConnection connection = connect();
    remoteWrite(PeerMessage.HaveMessage.craft(99).getData().array(), 0, 9);
    try {
      connection.receive();
      fail("Piece 99 does not exist");
    } catch (ProtocolViolationException e) {
      assertTrue(connection.isClosed());
    }
  }

  public void testRemoteCloseFailsReceive() throws Exception {
    PeerConnection connection = connect();
    remote.close();
    try {
      connection.receive();
      fail("The remote side is gone");
    } catch (IOException e) {
      assertTrue(connection.isClosed());
    }
  }
}
