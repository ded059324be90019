package com.bitflow.client;

import com.bitflow.common.SingleFileInfo;
import com.bitflow.common.TorrentInfo;
import com.bitflow.common.TorrentUtils;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;

/**
 * Small single-file torrents over deterministic content.
 */
public final class TestTorrents {

  private TestTorrents() {
  }

  public static byte[] content(int size) {
    byte[] content = new byte[size];
    for (int i = 0; i < size; i++) {
      content[i] = (byte) (i % 251);
    }
    return content;
  }

  public static TorrentInfo singleFile(byte[] content, int pieceLength) {
    ByteArrayOutputStream hashes = new ByteArrayOutputStream();
    for (int offset = 0; offset < content.length; offset += pieceLength) {
      byte[] piece = Arrays.copyOfRange(content, offset, Math.min(content.length, offset + pieceLength));
      hashes.write(TorrentUtils.calculateSha1Hash(piece), 0, 20);
    }
    return new SingleFileInfo("content.bin", pieceLength, hashes.toByteArray(), false, content.length, null);
  }
}
