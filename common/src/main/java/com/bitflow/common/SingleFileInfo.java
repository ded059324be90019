package com.bitflow.common;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;

public class SingleFileInfo extends AbstractTorrentInfo {

  private final long length;
  private final TorrentFile file;

  public SingleFileInfo(String name, int pieceLength, byte[] piecesHashes, boolean isPrivate,
                        long length, @Nullable String md5Sum) {
    super(name, pieceLength, piecesHashes, isPrivate);
    this.length = length;
    this.file = new TorrentFile(Collections.singletonList(name), length, 0, md5Sum);
  }

  @Override
  public long getTotalSize() {
    return length;
  }

  @Override
  public boolean isMultiFile() {
    return false;
  }

  @Override
  public List<TorrentFile> getFiles() {
    return Collections.singletonList(file);
  }
}
