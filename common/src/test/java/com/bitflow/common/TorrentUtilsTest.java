package com.bitflow.common;

import org.testng.annotations.Test;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Random;

import static org.testng.Assert.*;

@Test
public class TorrentUtilsTest {

  public void testBytesToHexWithNull() {
    try {
      TorrentUtils.byteArrayToHexString(null);
      fail("null array must be rejected");
    } catch (NullPointerException e) {
      // expected
    }
  }

  public void testBytesToHex() {
    assertEquals(TorrentUtils.byteArrayToHexString(new byte[]{0x00, (byte) 0xAB, 0x7F}), "00AB7F");
  }

  public void testUrlEncodeKeepsUnreservedBytes() {
    String safe = "AZaz09-._~";
    assertEquals(TorrentUtils.urlEncodeBytes(safe.getBytes()), safe);
  }

  public void testUrlEncodeEscapesEverythingElse() {
    assertEquals(TorrentUtils.urlEncodeBytes(new byte[]{0x12, 0x34, ' ', '%', '/', (byte) 0xFF, 0x7F}),
            "%124%20%25%2F%FF%7F");
  }

  public void testEveryByteSurvivesStrictDecoding() {
    byte[] all = new byte[256];
    for (int i = 0; i < all.length; i++) {
      all[i] = (byte) i;
    }
    String encoded = TorrentUtils.urlEncodeBytes(all);
    assertEquals(URLDecoder.decode(encoded, StandardCharsets.ISO_8859_1).getBytes(StandardCharsets.ISO_8859_1), all);

    for (int i = 0; i < 256; i++) {
      String single = TorrentUtils.urlEncodeBytes(new byte[]{(byte) i});
      if (TorrentUtils.isUrlSafe((byte) i)) {
        assertEquals(single.length(), 1);
      } else {
        assertTrue(single.matches("%[0-9A-F]{2}"), single);
      }
    }
  }

  public void testPeerIdGeneration() {
    PeerId peerId = PeerId.generate("-BF0100-", new Random(1));
    String text = peerId.toString();
    assertEquals(peerId.getBytes().length, PeerId.LENGTH);
    assertTrue(text.startsWith("-BF0100-"));
    assertTrue(text.substring(8).matches("[0-9a-f]{12}"), text);
  }
}
