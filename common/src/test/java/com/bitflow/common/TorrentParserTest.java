package com.bitflow.common;

import com.bitflow.bcodec.BEValue;
import com.bitflow.bcodec.BEncoder;
import com.bitflow.bcodec.InvalidBEncodingException;
import com.bitflow.bcodec.MissingFieldException;
import com.bitflow.bcodec.UnexpectedFieldException;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.io.IOUtils;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.*;

import static org.testng.Assert.*;

@Test
public class TorrentParserTest {

  private TorrentParser myTorrentParser;

  @BeforeMethod
  public void setUp() {
    myTorrentParser = new TorrentParser();
  }

  public void testFixtureInfoHash() throws IOException {
    TorrentMetadata metadata = myTorrentParser.parse(readFixture("single.torrent"));

    assertEquals(metadata.getHexInfoHash(), "9A3B839F1627818D562810CA0AEB023D2568EA9B");
    assertEquals(metadata.getAnnounce(), "http://tracker.example.com/announce");
    assertEquals(metadata.getComment(), "sample single");
    assertEquals(metadata.getCreatedBy(), "bitflow 1.0");
    assertEquals(metadata.getCreationDate(), Long.valueOf(1700000000L));
    assertEquals(metadata.getEncoding(), "UTF-8");
    assertEquals(metadata.getWebSeeds(), Collections.singletonList("http://seed.example.net/files"));

    TorrentInfo info = metadata.getInfo();
    assertFalse(info.isMultiFile());
    assertTrue(info.isPrivate());
    assertEquals(info.getName(), "sample.bin");
    assertEquals(info.getTotalSize(), 40000L);
    assertEquals(info.getPieceCount(), 3);
    assertEquals(info.getPieceSize(0), 16384);
    assertEquals(info.getPieceSize(2), 40000 - 2 * 16384);
    assertEquals(TorrentUtils.byteArrayToHexString(info.getPieceHash(1)),
            "DE9EE0222CD528EFC5E01227E4BF16CF6AC6836A");
    assertEquals(info.getFiles().size(), 1);
    assertEquals(info.getFiles().get(0).relativePath, Collections.singletonList("sample.bin"));
  }

  public void testDescribe() throws IOException {
    String description = myTorrentParser.parse(readFixture("single.torrent")).describe();

    assertTrue(description.startsWith("Name:          sample.bin\n"), description);
    assertTrue(description.contains("Info hash:     9A3B839F1627818D562810CA0AEB023D2568EA9B\n"), description);
    assertTrue(description.contains("Comment:       sample single\n"), description);
    assertTrue(description.contains("Private:       yes\n"), description);
    assertTrue(description.contains("Pieces:        3 x 16384 bytes\n"), description);
    assertTrue(description.contains("Total size:    40000 bytes\nFile:\n"), description);
  }

  public void testTrackersAreFlattenedAndDeduplicated() throws IOException {
    TorrentMetadata metadata = myTorrentParser.parse(readFixture("single.torrent"));

    assertEquals(metadata.getAnnounceList().size(), 2);
    assertEquals(metadata.getTrackers(), Arrays.asList(
            "http://tracker.example.com/announce",
            "http://backup.example.org:8080/announce"));
  }

  public void testInfoHashUsesRawBytes() throws IOException {
    // keys out of canonical order: a re-encoding would produce other bytes
    String info = "d4:name3:abc6:lengthi5e12:piece lengthi16384e6:pieces20:" + repeat('x', 20) + "e";
    byte[] torrent = ("d8:announce10:http://t/a4:info" + info + "e").getBytes(StandardCharsets.ISO_8859_1);

    TorrentMetadata metadata = myTorrentParser.parse(torrent);

    byte[] rawInfo = info.getBytes(StandardCharsets.ISO_8859_1);
    assertEquals(metadata.getInfoHash().getBytes(), DigestUtils.sha1(rawInfo));

    Map<String, BEValue> decodedInfo = com.bitflow.bcodec.BDecoder.bdecode(rawInfo).getMap();
    assertNotEquals(metadata.getInfoHash().getBytes(),
            DigestUtils.sha1(BEncoder.bencode(decodedInfo).array()));
  }

  public void testMultiFile() throws IOException {
    final Map<String, BEValue> metadata = new HashMap<String, BEValue>();
    final Map<String, BEValue> infoTable = new HashMap<String, BEValue>();
    metadata.put("announce", new BEValue("http://localhost/announce"));
    infoTable.put("name", new BEValue("dir"));
    infoTable.put("piece length", new BEValue(8));
    infoTable.put("pieces", new BEValue(new byte[40]));
    List<BEValue> files = new ArrayList<BEValue>();
    files.add(file(5, "a.txt"));
    files.add(file(7, "sub", "b.txt"));
    infoTable.put("files", new BEValue(files));
    metadata.put("info", new BEValue(infoTable));

    TorrentInfo info = myTorrentParser.parse(BEncoder.bencode(metadata).array()).getInfo();

    assertTrue(info.isMultiFile());
    assertFalse(info.isPrivate());
    assertEquals(info.getTotalSize(), 12L);
    assertEquals(info.getPieceCount(), 2);
    assertEquals(info.getPieceSize(1), 4);
    assertEquals(info.getFiles().get(1).relativePath, Arrays.asList("sub", "b.txt"));
    assertEquals(info.getFiles().get(1).offset, 5L);
  }

  public void testPrivateOnlyWhenEqualToOne() throws IOException {
    Map<String, BEValue> metadata = singleFile(19, 4, 100);
    metadata.get("info").getMap().put("private", new BEValue(2));
    assertFalse(myTorrentParser.parse(BEncoder.bencode(metadata).array()).getInfo().isPrivate());
  }

  public void testNeitherLengthNorFiles() throws IOException {
    Map<String, BEValue> metadata = singleFile(19, 4, 100);
    metadata.get("info").getMap().remove("length");
    assertRejected(metadata);
  }

  public void testBothLengthAndFiles() throws IOException {
    Map<String, BEValue> metadata = singleFile(19, 4, 100);
    metadata.get("info").getMap().put("files", new BEValue(Collections.singletonList(file(19, "x"))));
    assertRejected(metadata);
  }

  public void testDeeplyNestedFileRejected() {
    byte[] metadata = new byte[400000];
    Arrays.fill(metadata, 0, 200000, (byte) 'l');
    try {
      myTorrentParser.parse(metadata);
      fail("deeply nested metadata must be rejected");
    } catch (InvalidBEncodingException e) {
      assertTrue(e.getMessage().startsWith("Nesting too deep"), e.getMessage());
    }
  }

  public void testPiecesNotMultipleOfTwenty() throws IOException {
    assertRejected(singleFile(19, 4, 99));
  }

  public void testPieceCountMismatch() throws IOException {
    assertRejected(singleFile(19, 4, 80));
  }

  public void testUnknownInfoKeyRejected() throws IOException {
    Map<String, BEValue> metadata = singleFile(19, 4, 100);
    metadata.get("info").getMap().put("source", new BEValue("somewhere"));
    try {
      myTorrentParser.parse(BEncoder.bencode(metadata).array());
      fail("unknown info key must be rejected");
    } catch (UnexpectedFieldException e) {
      assertEquals(e.getField(), "source");
    }
  }

  public void testUnknownFileKeyRejected() throws IOException {
    Map<String, BEValue> metadata = singleFile(19, 4, 100);
    Map<String, BEValue> info = metadata.get("info").getMap();
    info.remove("length");
    BEValue entry = file(19, "x");
    entry.getMap().put("attr", new BEValue("h"));
    info.put("files", new BEValue(Collections.singletonList(entry)));
    try {
      myTorrentParser.parse(BEncoder.bencode(metadata).array());
      fail("unknown file key must be rejected");
    } catch (UnexpectedFieldException e) {
      assertEquals(e.getField(), "attr");
    }
  }

  public void testUnknownTopLevelKeyIgnored() throws IOException {
    Map<String, BEValue> metadata = singleFile(19, 4, 100);
    metadata.put("nodes", new BEValue("ignored"));
    assertEquals(myTorrentParser.parse(BEncoder.bencode(metadata).array()).getInfo().getTotalSize(), 19L);
  }

  public void testMissingAnnounce() throws IOException {
    Map<String, BEValue> metadata = singleFile(19, 4, 100);
    metadata.remove("announce");
    try {
      myTorrentParser.parse(BEncoder.bencode(metadata).array());
      fail("missing announce must be rejected");
    } catch (MissingFieldException e) {
      assertEquals(e.getField(), "announce");
    }
  }

  public void badBEPFormatTest() {
    try {
      myTorrentParser.parse("abcd".getBytes(StandardCharsets.US_ASCII));
      fail("This method must throw invalid bencoding exception");
    } catch (InvalidBEncodingException e) {
      //it's okay
    }
  }

  private void assertRejected(Map<String, BEValue> metadata) throws IOException {
    try {
      myTorrentParser.parse(BEncoder.bencode(metadata).array());
      fail("This method must throw invalid bencoding exception");
    } catch (InvalidBEncodingException e) {
      //it's okay
    }
  }

  private Map<String, BEValue> singleFile(long length, int pieceLength, int piecesBytes) {
    final Map<String, BEValue> metadata = new HashMap<String, BEValue>();
    final Map<String, BEValue> infoTable = new HashMap<String, BEValue>();
    metadata.put("announce", new BEValue("http://localhost/announce"));
    infoTable.put("piece length", new BEValue(pieceLength));
    infoTable.put("pieces", new BEValue(new byte[piecesBytes]));
    infoTable.put("name", new BEValue("test.file"));
    infoTable.put("length", new BEValue(length));
    metadata.put("info", new BEValue(infoTable));
    return metadata;
  }

  private BEValue file(long length, String... path) {
    Map<String, BEValue> entry = new HashMap<String, BEValue>();
    entry.put("length", new BEValue(length));
    List<BEValue> segments = new ArrayList<BEValue>();
    for (String segment : path) {
      segments.add(new BEValue(segment));
    }
    entry.put("path", new BEValue(segments));
    return new BEValue(entry);
  }

  private static String repeat(char c, int count) {
    char[] chars = new char[count];
    Arrays.fill(chars, c);
    return new String(chars);
  }

  static byte[] readFixture(String name) throws IOException {
    InputStream in = TorrentParserTest.class.getResourceAsStream("/torrents/" + name);
    assertNotNull(in, "missing fixture " + name);
    try {
      return IOUtils.toByteArray(in);
    } finally {
      in.close();
    }
  }
}
