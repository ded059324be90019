package com.bitflow.common;

import java.util.List;

/**
 * The content description of a torrent: the decoded <code>info</code>
 * dictionary. Implemented by {@link SingleFileInfo} and
 * {@link MultiFileInfo}.
 */
public interface TorrentInfo {

  /**
   * @return the file name (single-file) or directory name (multi-file)
   */
  String getName();

  /**
   * @return number of bytes in each piece but the last one
   */
  int getPieceLength();

  int getPieceCount();

  /**
   * @return the expected SHA-1 digest of the piece at the given index
   */
  byte[] getPieceHash(int pieceIndex);

  /**
   * @return the length of the piece at the given index; only the last piece
   * may be shorter than {@link #getPieceLength()}
   */
  int getPieceSize(int pieceIndex);

  /**
   * @return sum of the lengths of all files
   */
  long getTotalSize();

  /**
   * @return true if it's private torrent. In this case client must get peers only from tracker and
   * must initiate connections to peers returned from the tracker.
   * @see <a href="http://bittorrent.org/beps/bep_0027.html"></a>
   */
  boolean isPrivate();

  boolean isMultiFile();

  /**
   * @return the files of this torrent in declared order. A single-file
   * torrent has one file named after {@link #getName()}.
   */
  List<TorrentFile> getFiles();
}
