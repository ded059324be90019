package com.bitflow.client.announce;

import com.bitflow.client.DownloadProgress;
import com.bitflow.common.InfoHash;

/**
 * What an announce loop needs to know about the torrent it announces.
 */
public interface AnnounceableInformation {

  InfoHash getInfoHash();

  /**
   * A consistent snapshot of the transfer counters.
   */
  DownloadProgress getProgress();
}
