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

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;


/**
 * Abstract torrent byte storage.
 *
 * <p>
 * This interface defines the methods for accessing an abstracted torrent byte
 * storage. A torrent, especially when it contains multiple files, needs to be
 * seen as one single continuous stream of bytes. Torrent pieces will most
 * likely span accross file boundaries. This abstracted byte storage aims at
 * providing a simple interface for read/write access to the torrent data,
 * regardless of how it is composed underneath the piece structure.
 * </p>
 *
 * @author mpetazzoni
 * @author dgiffin
 */
public interface TorrentByteStorage extends Closeable {

  /**
   * Returns the total size of the torrent storage.
   */
  long size();

  /**
   * Read from the byte storage.
   *
   * <p>
   * Read {@code buffer.remaining()} bytes starting at {@code position} into
   * the given buffer.
   * </p>
   *
   * @param buffer   The buffer to read into.
   * @param position The offset in the torrent byte stream to read from.
   * @return The number of bytes read.
   * @throws IOException If an I/O error occurs or fewer bytes than requested
   *                     are available.
   */
  int read(ByteBuffer buffer, long position) throws IOException;

  /**
   * Write bytes to the byte storage.
   *
   * @param buffer   The buffer holding the bytes to write.
   * @param position The offset in the torrent byte stream to write at.
   * @return The number of bytes written.
   * @throws IOException If an I/O error occurs.
   */
  int write(ByteBuffer buffer, long position) throws IOException;

  /**
   * Finalize the byte storage when the download is complete.
   *
   * <p>
   * This gives the byte storage the opportunity to perform finalization
   * operations when the download completes, like moving the files from a
   * temporary location to their destination.
   * </p>
   */
  void finish() throws IOException;

  /**
   * Tells whether this storage has been finalized.
   */
  boolean isFinished();
}
