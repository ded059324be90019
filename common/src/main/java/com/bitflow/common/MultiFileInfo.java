package com.bitflow.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class MultiFileInfo extends AbstractTorrentInfo {

  private final List<TorrentFile> files;
  private final long totalSize;

  /**
   * @param files the files in declared order; their offsets must follow
   *              each other without gaps
   */
  public MultiFileInfo(String name, int pieceLength, byte[] piecesHashes, boolean isPrivate,
                       List<TorrentFile> files) {
    super(name, pieceLength, piecesHashes, isPrivate);
    this.files = Collections.unmodifiableList(new ArrayList<TorrentFile>(files));
    long size = 0;
    for (TorrentFile file : files) {
      size += file.size;
    }
    this.totalSize = size;
  }

  @Override
  public long getTotalSize() {
    return totalSize;
  }

  @Override
  public boolean isMultiFile() {
    return true;
  }

  @Override
  public List<TorrentFile> getFiles() {
    return files;
  }
}
