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
package com.bitflow.common;

import com.bitflow.Constants;
import com.bitflow.bcodec.BDecoder;
import com.bitflow.bcodec.BEValue;
import com.bitflow.bcodec.InvalidBEncodingException;
import org.apache.commons.io.FileUtils;
import org.jetbrains.annotations.Nullable;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.bitflow.bcodec.BEUtils.checkKeys;
import static com.bitflow.bcodec.BEUtils.getRequired;
import static com.bitflow.common.TorrentMetadataKeys.*;

/**
 * Decodes .torrent files.
 *
 * <p>
 * The top level dictionary is open: unknown keys are ignored. The
 * <code>info</code> dictionary and the entries of its <code>files</code>
 * list are closed, an unknown key fails the decoding. The info hash is the
 * SHA-1 of the <code>info</code> dictionary exactly as it appears in the
 * file.
 * </p>
 */
public class TorrentParser {

  private static final String METAINFO = "metainfo";
  private static final String INFO = "info dictionary";
  private static final String FILE_ENTRY = "file entry";

  private static final Set<String> INFO_KEYS = new HashSet<String>(Arrays.asList(
          NAME, PIECE_LENGTH, PIECES, FILE_LENGTH, FILES, PRIVATE, MD5_SUM));
  private static final Set<String> FILE_KEYS = new HashSet<String>(Arrays.asList(
          FILE_LENGTH, FILE_PATH, MD5_SUM));

  public TorrentMetadata parseFromFile(File torrentFile) throws IOException {
    byte[] fileContent = FileUtils.readFileToByteArray(torrentFile);
    return parse(fileContent);
  }

  /**
   * @param metadata binary .torrent content
   * @return parsed metadata object
   * @throws InvalidBEncodingException if metadata has incorrect BEP format, misses required fields
   *                                   or carries unknown fields in the info dictionary
   */
  public TorrentMetadata parse(byte[] metadata) throws InvalidBEncodingException {
    final Map<String, BEValue> dictionaryMetadata = BDecoder.bdecode(metadata).getMap();

    final String announceUrl = getRequired(dictionaryMetadata, ANNOUNCE, METAINFO).getString();
    final BEValue infoValue = getRequired(dictionaryMetadata, INFO_TABLE, METAINFO);
    final TorrentInfo info = parseInfo(infoValue.getMap());

    final BEValue creationDateValue = dictionaryMetadata.get(CREATION_DATE_SEC);
    final Long creationDate = creationDateValue == null ? null : creationDateValue.getLong();

    return new TorrentMetadata(
            InfoHash.ofInfoDictionary(infoValue.getRawBytes()),
            announceUrl,
            getTrackers(dictionaryMetadata),
            info,
            creationDate,
            getStringOrNull(dictionaryMetadata, COMMENT),
            getStringOrNull(dictionaryMetadata, CREATED_BY),
            getStringOrNull(dictionaryMetadata, ENCODING),
            getWebSeeds(dictionaryMetadata));
  }

  private TorrentInfo parseInfo(Map<String, BEValue> infoTable) throws InvalidBEncodingException {
    checkKeys(infoTable, INFO_KEYS, INFO);

    final String name = getRequired(infoTable, NAME, INFO).getString();
    final int pieceLength = getRequired(infoTable, PIECE_LENGTH, INFO).getInt();
    final byte[] piecesHashes = getRequired(infoTable, PIECES, INFO).getBytes();
    final BEValue privateValue = infoTable.get(PRIVATE);
    final boolean isPrivate = privateValue != null && privateValue.getLong() == 1;

    if (pieceLength <= 0)
      throw new InvalidBEncodingException("Invalid info dictionary: piece length must be positive, got " + pieceLength);
    if (piecesHashes.length % Constants.PIECE_HASH_SIZE != 0)
      throw new InvalidBEncodingException("Invalid info dictionary: size of pieces hashes " +
              piecesHashes.length + " is not a multiple of " + Constants.PIECE_HASH_SIZE);

    final boolean hasLength = infoTable.containsKey(FILE_LENGTH);
    final boolean hasFiles = infoTable.containsKey(FILES);
    if (hasLength && hasFiles)
      throw new InvalidBEncodingException("Invalid info dictionary: both '" + FILE_LENGTH + "' and '" + FILES + "' are present");
    if (!hasLength && !hasFiles)
      throw new InvalidBEncodingException("Invalid info dictionary: neither '" + FILE_LENGTH + "' nor '" + FILES + "' is present");

    final TorrentInfo info;
    if (hasLength) {
      final long length = infoTable.get(FILE_LENGTH).getLong();
      if (length < 0)
        throw new InvalidBEncodingException("Invalid info dictionary: negative length " + length);
      info = new SingleFileInfo(name, pieceLength, piecesHashes, isPrivate, length,
              getStringOrNull(infoTable, MD5_SUM));
    } else {
      info = new MultiFileInfo(name, pieceLength, piecesHashes, isPrivate,
              parseFiles(infoTable.get(FILES).getList()));
    }

    final long expectedPieces = (info.getTotalSize() + pieceLength - 1) / pieceLength;
    if (expectedPieces != info.getPieceCount())
      throw new InvalidBEncodingException("Invalid info dictionary: " + info.getPieceCount() +
              " piece hashes for " + info.getTotalSize() + " bytes in pieces of " + pieceLength +
              " bytes, expected " + expectedPieces);
    return info;
  }

  private List<TorrentFile> parseFiles(List<BEValue> filesList) throws InvalidBEncodingException {
    if (filesList.isEmpty())
      throw new InvalidBEncodingException("Invalid info dictionary: '" + FILES + "' is empty");

    List<TorrentFile> result = new ArrayList<TorrentFile>();
    long offset = 0;
    for (BEValue file : filesList) {
      Map<String, BEValue> fileInfo = file.getMap();
      checkKeys(fileInfo, FILE_KEYS, FILE_ENTRY);

      final long length = getRequired(fileInfo, FILE_LENGTH, FILE_ENTRY).getLong();
      if (length < 0)
        throw new InvalidBEncodingException("Invalid file entry: negative length " + length);

      List<String> path = new ArrayList<String>();
      for (BEValue pathElement : getRequired(fileInfo, FILE_PATH, FILE_ENTRY).getList()) {
        path.add(pathElement.getString());
      }
      if (path.isEmpty())
        throw new InvalidBEncodingException("Invalid file entry: empty path");

      result.add(new TorrentFile(path, length, offset, getStringOrNull(fileInfo, MD5_SUM)));
      offset += length;
    }
    return result;
  }

  @Nullable
  private String getStringOrNull(Map<String, BEValue> dictionary, String key) throws InvalidBEncodingException {
    final BEValue value = dictionary.get(key);
    if (value == null) return null;
    return value.getString();
  }

  private List<List<String>> getTrackers(Map<String, BEValue> dictionaryMetadata) throws InvalidBEncodingException {
    final BEValue announceListValue = dictionaryMetadata.get(ANNOUNCE_LIST);
    if (announceListValue == null) return Collections.emptyList();
    List<BEValue> announceList = announceListValue.getList();
    List<List<String>> result = new ArrayList<List<String>>();
    Set<String> allTrackers = new HashSet<String>();
    for (BEValue tv : announceList) {
      List<BEValue> trackers = tv.getList();
      if (trackers.isEmpty()) {
        continue;
      }

      List<String> tier = new ArrayList<String>();
      for (BEValue tracker : trackers) {
        final String url = tracker.getString();
        if (!allTrackers.contains(url)) {
          tier.add(url);
          allTrackers.add(url);
        }
      }

      if (!tier.isEmpty()) {
        result.add(tier);
      }
    }
    return result;
  }

  private List<String> getWebSeeds(Map<String, BEValue> dictionaryMetadata) throws InvalidBEncodingException {
    final BEValue urlList = dictionaryMetadata.get(URL_LIST);
    if (urlList == null) return Collections.emptyList();
    if (urlList.isBytes()) {
      final String url = urlList.getString();
      return url.isEmpty() ? Collections.<String>emptyList() : Collections.singletonList(url);
    }
    List<String> result = new ArrayList<String>();
    for (BEValue url : urlList.getList()) {
      result.add(url.getString());
    }
    return result;
  }
}
