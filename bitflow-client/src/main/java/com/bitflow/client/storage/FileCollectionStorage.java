/**
 * Copyright (C) 2011-2012 Turn, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.bitflow.client.storage;

import com.bitflow.common.TorrentLoggerFactory;
import com.google.common.base.MoreObjects;
import org.slf4j.Logger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.List;


/**
 * Presents the files of a multi-file torrent as one contiguous byte range.
 *
 * <p>
 * An operation crossing file boundaries is split into one call per file,
 * each limited to the part of the buffer that file holds. Zero-length files
 * never take part in a transfer but are still created and finished.
 * </p>
 *
 * @author mpetazzoni
 * @author dgiffin
 */
public class FileCollectionStorage implements TorrentByteStorage {

  private static final Logger logger =
          TorrentLoggerFactory.getLogger(FileCollectionStorage.class);

  private interface Transfer {
    int apply(FileStorage file, ByteBuffer buffer, long position) throws IOException;
  }

  private final List<FileStorage> files;
  private final long size;

  /**
   * @param files the torrent's files, ordered by their offset.
   * @param size  the sum of their sizes.
   */
  public FileCollectionStorage(List<FileStorage> files, long size) {
    this.files = files;
    this.size = size;
    logger.debug("{} file(s) make up {} byte(s) of torrent data", files.size(), size);
  }

  public void open() throws IOException {
    for (FileStorage file : this.files) {
      file.open();
    }
  }

  public List<FileStorage> getFiles() {
    return this.files;
  }

  @Override
  public long size() {
    return this.size;
  }

  @Override
  public int read(ByteBuffer buffer, long position) throws IOException {
    return this.spread(buffer, position, FileStorage::read);
  }

  @Override
  public int write(ByteBuffer buffer, long position) throws IOException {
    return this.spread(buffer, position, FileStorage::write);
  }

  /**
   * Closes every file; the first failure is rethrown once all of them had
   * their turn, later ones attached as suppressed.
   */
  @Override
  public void close() throws IOException {
    IOException failure = null;
    for (FileStorage file : this.files) {
      try {
        file.close();
      } catch (IOException ioe) {
        if (failure == null) {
          failure = ioe;
        } else {
          failure.addSuppressed(ioe);
        }
      }
    }
    if (failure != null) {
      throw failure;
    }
  }

  @Override
  public void finish() throws IOException {
    for (FileStorage file : this.files) {
      file.finish();
    }
  }

  @Override
  public boolean isFinished() {
    return this.files.stream().allMatch(FileStorage::isFinished);
  }

  /**
   * Runs {@code transfer} on every file overlapping
   * {@code [position, position + buffer.remaining())}, moving the buffer
   * window along as each file is served.
   */
  private int spread(ByteBuffer buffer, long position, Transfer transfer) throws IOException {
    int wanted = buffer.remaining();
    if (position < 0 || position + wanted > this.size) {
      throw new IllegalArgumentException("Range " + position + "+" + wanted +
              " is outside of the " + this.size + " byte(s) of " + this);
    }

    int limit = buffer.limit();
    long end = position + wanted;
    int done = 0;
    try {
      for (FileStorage file : this.files) {
        long fileEnd = file.offset() + file.size();
        if (file.size() == 0 || fileEnd <= position) {
          continue;
        }
        if (file.offset() >= end) {
          break;
        }
        long from = Math.max(position + done, file.offset());
        int chunk = (int) (Math.min(end, fileEnd) - from);
        buffer.limit(buffer.position() + chunk);
        done += transfer.apply(file, buffer, from - file.offset());
      }
    } finally {
      buffer.limit(limit);
    }

    if (done < wanted) {
      throw new IOException("Files of " + this + " cover only " + done + " of " + wanted + " byte(s)");
    }
    return done;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
            .add("files", this.files.size())
            .add("size", this.size)
            .toString();
  }
}
