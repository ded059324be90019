package com.bitflow.client;

import com.bitflow.FakeTracker;
import com.bitflow.TempFiles;
import com.bitflow.WaitFor;
import com.bitflow.bcodec.BEValue;
import com.bitflow.bcodec.BEncoder;
import com.bitflow.common.InfoHash;
import com.bitflow.common.Peer;
import com.bitflow.common.PeerId;
import com.bitflow.common.TorrentMetadata;
import com.bitflow.common.TorrentParser;
import com.bitflow.common.TorrentUtils;
import com.bitflow.common.protocol.PeerMessage;
import com.bitflow.common.protocol.http.HTTPAnnounceResponseMessage;
import org.apache.commons.io.FileUtils;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.testng.Assert.*;

/**
 * Downloads through a fake HTTP tracker from a fake seeding peer.
 */
@Test(timeOut = 120000)
public class DownloadTest {

  private static final int PIECE_LENGTH = 16384;

  private TempFiles tempFiles;
  private FakeTracker tracker;
  private ExecutorService executor;
  private ServerSocket seedSocket;

  @BeforeMethod
  public void setUp() throws IOException {
    tempFiles = new TempFiles();
    tracker = new FakeTracker();
    tracker.start();
    executor = Executors.newCachedThreadPool();
    seedSocket = new ServerSocket(0, 5, InetAddress.getLoopbackAddress());
  }

  @AfterMethod
  public void tearDown() throws IOException {
    seedSocket.close();
    executor.shutdownNow();
    tracker.stop();
    tempFiles.cleanup();
  }

  private static byte[] content(int size) {
    byte[] content = new byte[size];
    new Random(size).nextBytes(content);
    return content;
  }

  private static byte[] toBytes(ByteBuffer buffer) {
    byte[] bytes = new byte[buffer.remaining()];
    buffer.get(bytes);
    return bytes;
  }

  private File writeTorrent(byte[] content) throws IOException {
    ByteArrayOutputStream hashes = new ByteArrayOutputStream();
    for (int offset = 0; offset < content.length; offset += PIECE_LENGTH) {
      hashes.write(TorrentUtils.calculateSha1Hash(
              Arrays.copyOfRange(content, offset, Math.min(content.length, offset + PIECE_LENGTH))));
    }

    Map<String, BEValue> info = new HashMap<String, BEValue>();
    info.put("name", new BEValue("payload.bin"));
    info.put("length", new BEValue(content.length));
    info.put("piece length", new BEValue(PIECE_LENGTH));
    info.put("pieces", new BEValue(hashes.toByteArray()));

    Map<String, BEValue> root = new HashMap<String, BEValue>();
    root.put("announce", new BEValue(tracker.getAnnounceURI().toString()));
    root.put("created by", new BEValue("DownloadTest"));
    root.put("info", new BEValue(info));

    return tempFiles.createTempFile("payload.torrent", toBytes(BEncoder.bencode(root)));
  }

  private void announceSeed(int interval) throws IOException {
    HTTPAnnounceResponseMessage response = new HTTPAnnounceResponseMessage(interval, 0, null, null, 1, 0,
            Collections.singletonList(new Peer("127.0.0.1", seedSocket.getLocalPort())));
    tracker.respondWith(200, toBytes(BEncoder.bencode(response.toBEValue(true))));
  }

  /**
   * Serves every block requested of {@code content} to one connection.
   */
  private void startSeed(final InfoHash infoHash, final byte[] content, final AtomicInteger served) {
    executor.submit(() -> {
      Socket socket = seedSocket.accept();
      try {
        DataInputStream in = new DataInputStream(socket.getInputStream());
        OutputStream out = socket.getOutputStream();

        byte[] handshake = new byte[Handshake.LENGTH];
        in.readFully(handshake);
        assertEquals(Handshake.parse(ByteBuffer.wrap(handshake)).getInfoHash(), infoHash);
        out.write(toBytes(Handshake.craft(infoHash, PeerId.generate("-SD0001-", new Random(5))).getData()));

        int pieceCount = (content.length + PIECE_LENGTH - 1) / PIECE_LENGTH;
        BitSet all = new BitSet();
        all.set(0, pieceCount);
        out.write(toBytes(PeerMessage.BitfieldMessage.craft(all, pieceCount).getData()));
        out.write(toBytes(PeerMessage.UnchokeMessage.craft().getData()));
        out.flush();

        while (true) {
          int length = in.readInt();
          if (length == 0) {
            continue;
          }
          byte type = in.readByte();
          byte[] payload = new byte[length - 1];
          in.readFully(payload);
          if (type != PeerMessage.Type.REQUEST.getTypeByte()) {
            continue;
          }
          ByteBuffer request = ByteBuffer.wrap(payload);
          int piece = request.getInt();
          int offset = request.getInt();
          int blockLength = request.getInt();
          ByteBuffer block = ByteBuffer.wrap(content, piece * PIECE_LENGTH + offset, blockLength);
          served.incrementAndGet();
          out.write(toBytes(PeerMessage.PieceMessage.craft(piece, offset, block).getData()));
          out.flush();
        }
      } catch (EOFException eof) {
        return null;
      } finally {
        socket.close();
      }
    });
  }

  private void download(byte[] content, int blockSize, int expectedBlocks) throws Exception {
    File torrentFile = writeTorrent(content);
    TorrentMetadata metadata = new TorrentParser().parseFromFile(torrentFile);
    announceSeed(1);
    AtomicInteger served = new AtomicInteger();
    startSeed(metadata.getInfoHash(), content, served);

    File downloadDir = tempFiles.createTempDir();
    ClientEnvironment environment = new ClientEnvironment();
    environment.setBlockSize(blockSize);
    environment.setSocketReadTimeoutMillis(100);
    Client client = new Client(environment, metadata, downloadDir);
    client.start();
    try {
      assertTrue(client.waitForCompletion(60, TimeUnit.SECONDS), "Download did not complete");
      assertEquals(client.getState(), ClientState.SEEDING);
      assertEquals(client.getProgress().getDownloaded(), content.length);
      assertEquals(client.getProgress().getLeft(), 0);
    } finally {
      client.stop();
    }

    assertEquals(client.getState(), ClientState.DONE);
    assertEquals(served.get(), expectedBlocks);
    File target = new File(downloadDir, "payload.bin");
    assertEquals(FileUtils.readFileToByteArray(target), content);
    assertFalse(new File(downloadDir, "payload.bin.part").exists());

    String first = tracker.getRequests().get(0);
    assertTrue(first.contains("info_hash=" + metadata.getInfoHash().urlEncoded()), first);
    assertTrue(first.contains("event=started"), first);
  }

  public void testSinglePieceDownload() throws Exception {
    download(content(PIECE_LENGTH), PIECE_LENGTH, 1);
  }

  public void testMultiPieceDownloadWithSmallBlocks() throws Exception {
    // 3 pieces, the last one 7232 bytes long, in 4 KiB blocks: 4 + 4 + 2.
    download(content(40000), 4096, 10);
  }

  public void testFinishedIsAnnounced() throws Exception {
    byte[] content = content(PIECE_LENGTH);
    TorrentMetadata metadata = new TorrentParser().parseFromFile(writeTorrent(content));
    announceSeed(1);
    startSeed(metadata.getInfoHash(), content, new AtomicInteger());

    Client client = new Client(new ClientEnvironment(), metadata, tempFiles.createTempDir());
    client.start();
    try {
      assertTrue(client.waitForCompletion(60, TimeUnit.SECONDS));
      WaitFor finished = new WaitFor(30 * 1000) {
        @Override
        protected boolean condition() {
          for (String request : tracker.getRequests()) {
            if (request.contains("event=finished")) {
              return true;
            }
          }
          return false;
        }
      };
      assertTrue(finished.isMyResult(), tracker.getRequests().toString());
    } finally {
      client.stop();
    }
  }
}
