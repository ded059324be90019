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
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;


/**
 * One file of a torrent, addressed by its own byte positions.
 *
 * <p>
 * Until {@link #finish()} the bytes live in a {@code .part} sibling of the
 * target file. Reads share a lock; writes, opening, closing and the final
 * rename are exclusive.
 * </p>
 *
 * @author mpetazzoni
 */
public class FileStorage implements TorrentByteStorage {

  static final String PARTIAL_FILE_NAME_SUFFIX = ".part";

  private static final Logger logger =
          TorrentLoggerFactory.getLogger(FileStorage.class);

  private final File target;
  private final File partial;
  private final long offset;
  private final long size;
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  private File backing;
  private RandomAccessFile handle;

  /**
   * @param file   where the completed file must end up.
   * @param offset position of the file's first byte in the torrent.
   * @param size   length of the file in bytes.
   */
  public FileStorage(File file, long offset, long size) {
    this.target = file;
    this.partial = new File(file.getAbsolutePath() + PARTIAL_FILE_NAME_SUFFIX);
    this.offset = offset;
    this.size = size;
  }

  /**
   * Opens the backing file and sizes it. A partial download is resumed
   * first; an existing target is reused when there is none. Otherwise a
   * fresh partial file is created, parent directories included.
   */
  public void open() throws IOException {
    lock.writeLock().lock();
    try {
      if (this.handle != null) {
        return;
      }
      this.backing = this.target.exists() && !this.partial.exists() ? this.target : this.partial;
      logger.debug("Using {} for {} ({} byte(s) at {})",
              this.backing.getName(), this.target.getName(), this.size, this.offset);

      File parent = this.backing.getAbsoluteFile().getParentFile();
      if (parent != null) {
        FileUtils.forceMkdir(parent);
      }
      this.handle = attach(this.backing);
    } finally {
      lock.writeLock().unlock();
    }
  }

  public long offset() {
    return this.offset;
  }

  @Override
  public long size() {
    return this.size;
  }

  public File getTarget() {
    return this.target;
  }

  @Override
  public int read(ByteBuffer buffer, long position) throws IOException {
    lock.readLock().lock();
    try {
      FileChannel channel = channelFor(buffer, position);
      int wanted = buffer.remaining();
      int done = 0;
      while (done < wanted) {
        int n = channel.read(buffer, position + done);
        if (n < 0) {
          throw new IOException("Only " + done + " of " + wanted + " byte(s) available in " + this.backing);
        }
        done += n;
      }
      return done;
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public int write(ByteBuffer buffer, long position) throws IOException {
    lock.writeLock().lock();
    try {
      FileChannel channel = channelFor(buffer, position);
      int done = 0;
      while (buffer.hasRemaining()) {
        done += channel.write(buffer, position + done);
      }
      return done;
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public void close() throws IOException {
    lock.writeLock().lock();
    try {
      detach();
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Renames the partial file onto the target, replacing whatever was there.
   * A storage that was open stays open on the renamed file.
   */
  @Override
  public void finish() throws IOException {
    lock.writeLock().lock();
    try {
      if (this.backing == null || this.target.equals(this.backing)) {
        return;
      }
      boolean wasOpen = this.handle != null;
      detach();

      FileUtils.deleteQuietly(this.target);
      FileUtils.moveFile(this.backing, this.target);
      logger.debug("Moved {} into place as {}", this.backing.getName(), this.target.getName());
      this.backing = this.target;

      if (wasOpen) {
        this.handle = attach(this.backing);
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public boolean isFinished() {
    lock.readLock().lock();
    try {
      return this.target.equals(this.backing);
    } finally {
      lock.readLock().unlock();
    }
  }

  private RandomAccessFile attach(File file) throws IOException {
    RandomAccessFile raf = new RandomAccessFile(file, "rw");
    if (raf.length() != this.size) {
      raf.setLength(this.size);
    }
    return raf;
  }

  private void detach() throws IOException {
    if (this.handle == null) {
      return;
    }
    try {
      this.handle.getChannel().force(true);
    } finally {
      this.handle.close();
      this.handle = null;
    }
  }

  private FileChannel channelFor(ByteBuffer buffer, long position) throws IOException {
    if (this.handle == null) {
      throw new IOException("Storage " + this.target.getName() + " is not open");
    }
    if (position < 0 || position + buffer.remaining() > this.size) {
      throw new IllegalArgumentException("Range " + position + "+" + buffer.remaining() +
              " is outside of " + this);
    }
    return this.handle.getChannel();
  }

  @Override
  public String toString() {
    return this.target.getPath() + " (" + this.offset + "+" + this.size + ")";
  }
}
