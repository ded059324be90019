package com.bitflow.common;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * One file of a torrent, located in the torrent's contiguous byte stream by
 * its offset.
 *
 * @author dgiffin
 * @author mpetazzoni
 */
public class TorrentFile {

  @NotNull
  public final List<String> relativePath;
  public final long size;
  public final long offset;
  @Nullable
  public final String md5Hash;

  public TorrentFile(@NotNull List<String> relativePath, long size, long offset, @Nullable String md5Hash) {
    this.relativePath = Collections.unmodifiableList(new ArrayList<String>(relativePath));
    this.size = size;
    this.offset = offset;
    this.md5Hash = md5Hash;
  }

  public String getRelativePathAsString() {
    String delimiter = File.separator;
    final Iterator<String> iterator = relativePath.iterator();
    StringBuilder sb = new StringBuilder();
    if (iterator.hasNext()) {
      sb.append(iterator.next());
      while (iterator.hasNext()) {
        sb.append(delimiter).append(iterator.next());
      }
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return getRelativePathAsString() + " (" + size + " bytes)";
  }
}
