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

import com.bitflow.common.TorrentFile;
import com.bitflow.common.TorrentInfo;
import com.bitflow.common.TorrentLoggerFactory;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Lays a torrent out on disk: a single-file torrent becomes one file in the
 * download directory, a multi-file torrent becomes a directory named after
 * the torrent holding the declared file tree.
 */
public final class StorageFactory {

  private static final Logger logger =
          TorrentLoggerFactory.getLogger(StorageFactory.class);

  private StorageFactory() {
  }

  /**
   * Builds and opens the storage for {@code info} under {@code downloadDir}.
   *
   * @throws IOException when a path segment would escape the download
   *                     directory or a file cannot be opened.
   */
  public static TorrentByteStorage create(TorrentInfo info, File downloadDir) throws IOException {
    checkSegment(info.getName());
    FileUtils.forceMkdir(downloadDir);

    if (!info.isMultiFile()) {
      FileStorage storage = new FileStorage(new File(downloadDir, info.getName()), 0, info.getTotalSize());
      storage.open();
      return storage;
    }

    File root = new File(downloadDir, info.getName());
    List<FileStorage> files = new ArrayList<FileStorage>();
    for (TorrentFile file : info.getFiles()) {
      File actual = root;
      for (String segment : file.relativePath) {
        checkSegment(segment);
        actual = new File(actual, segment);
      }
      logger.trace("Adding {} ({} bytes at {}) to the torrent storage", actual, file.size, file.offset);
      files.add(new FileStorage(actual, file.offset, file.size));
    }

    FileCollectionStorage storage = new FileCollectionStorage(files, info.getTotalSize());
    try {
      storage.open();
    } catch (IOException ioe) {
      storage.close();
      throw ioe;
    }
    return storage;
  }

  static void checkSegment(String segment) throws IOException {
    if (segment.isEmpty() || ".".equals(segment) || "..".equals(segment) ||
            segment.indexOf('/') >= 0 || segment.indexOf('\\') >= 0 ||
            segment.indexOf(File.separatorChar) >= 0 || segment.indexOf('\0') >= 0) {
      throw new IOException("Illegal path segment in torrent: '" + segment + "'");
    }
  }
}
