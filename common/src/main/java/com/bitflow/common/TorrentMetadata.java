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

import com.google.common.base.MoreObjects;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Provides access to all stored info in a .torrent file. Built once by
 * {@link TorrentParser} and read-only afterwards.
 *
 * @see <a href="https://wiki.theory.org/index.php/BitTorrentSpecification#Metainfo_File_Structure"></a>
 */
public class TorrentMetadata {

  private final InfoHash infoHash;
  private final String announce;
  private final List<List<String>> announceList;
  private final TorrentInfo info;
  private final Long creationDate;
  private final String comment;
  private final String createdBy;
  private final String encoding;
  private final List<String> webSeeds;

  public TorrentMetadata(@NotNull InfoHash infoHash,
                         @NotNull String announce,
                         @NotNull List<List<String>> announceList,
                         @NotNull TorrentInfo info,
                         @Nullable Long creationDate,
                         @Nullable String comment,
                         @Nullable String createdBy,
                         @Nullable String encoding,
                         @NotNull List<String> webSeeds) {
    this.infoHash = infoHash;
    this.announce = announce;
    List<List<String>> tiers = new ArrayList<List<String>>();
    for (List<String> tier : announceList) {
      tiers.add(Collections.unmodifiableList(new ArrayList<String>(tier)));
    }
    this.announceList = Collections.unmodifiableList(tiers);
    this.info = info;
    this.creationDate = creationDate;
    this.comment = comment;
    this.createdBy = createdBy;
    this.encoding = encoding;
    this.webSeeds = Collections.unmodifiableList(new ArrayList<String>(webSeeds));
  }

  @NotNull
  public InfoHash getInfoHash() {
    return infoHash;
  }

  public String getHexInfoHash() {
    return infoHash.getHexInfoHash();
  }

  /**
   * @return main announce url for tracker
   */
  @NotNull
  public String getAnnounce() {
    return announce;
  }

  /**
   * @return tracker tiers, empty when the torrent has no announce-list
   * @see <a href="http://bittorrent.org/beps/bep_0012.html"></a>
   */
  @NotNull
  public List<List<String>> getAnnounceList() {
    return announceList;
  }

  /**
   * Every tracker of this torrent once: the main announce url first, then
   * the tiers in order.
   */
  public List<String> getTrackers() {
    Set<String> result = new LinkedHashSet<String>();
    result.add(announce);
    for (List<String> tier : announceList) {
      result.addAll(tier);
    }
    return new ArrayList<String>(result);
  }

  @NotNull
  public TorrentInfo getInfo() {
    return info;
  }

  /**
   * @return creation date of the torrent in unix format
   */
  @Nullable
  public Long getCreationDate() {
    return creationDate;
  }

  /**
   * @return free-form text comment of the author
   */
  @Nullable
  public String getComment() {
    return comment;
  }

  /**
   * @return name and version of the program used to create .torrent
   */
  @Nullable
  public String getCreatedBy() {
    return createdBy;
  }

  @Nullable
  public String getEncoding() {
    return encoding;
  }

  /**
   * @see <a href="http://bittorrent.org/beps/bep_0019.html"></a>
   */
  @NotNull
  public List<String> getWebSeeds() {
    return webSeeds;
  }

  /**
   * Multi-line, human readable summary of the torrent.
   */
  public String describe() {
    StringBuilder sb = new StringBuilder();
    sb.append("Name:          ").append(info.getName()).append('\n');
    sb.append("Info hash:     ").append(infoHash.getHexInfoHash()).append('\n');
    sb.append("Announce:      ").append(announce).append('\n');
    for (int i = 0; i < announceList.size(); i++) {
      sb.append("Tier ").append(i).append(":        ").append(announceList.get(i)).append('\n');
    }
    if (creationDate != null) {
      sb.append("Created:       ").append(new Date(creationDate * 1000L)).append('\n');
    }
    if (createdBy != null) {
      sb.append("Created by:    ").append(createdBy).append('\n');
    }
    if (comment != null) {
      sb.append("Comment:       ").append(comment).append('\n');
    }
    if (encoding != null) {
      sb.append("Encoding:      ").append(encoding).append('\n');
    }
    for (String webSeed : webSeeds) {
      sb.append("Web seed:      ").append(webSeed).append('\n');
    }
    sb.append("Private:       ").append(info.isPrivate() ? "yes" : "no").append('\n');
    sb.append("Pieces:        ").append(info.getPieceCount())
            .append(" x ").append(info.getPieceLength()).append(" bytes\n");
    sb.append("Total size:    ").append(info.getTotalSize()).append(" bytes\n");
    sb.append(info.isMultiFile() ? "Files:\n" : "File:\n");
    for (TorrentFile file : info.getFiles()) {
      sb.append("  ").append(file).append('\n');
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
            .add("name", info.getName())
            .add("infoHash", infoHash)
            .add("announce", announce)
            .add("size", info.getTotalSize())
            .toString();
  }
}
