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
package com.bitflow.common.protocol;

import com.bitflow.common.Peer;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Base interface for announce response messages.
 *
 * @author mpetazzoni
 */
public interface AnnounceResponseMessage {

  /**
   * @return seconds to wait before the next regular announce
   */
  int getInterval();

  /**
   * @return the minimum announce interval in seconds, or 0 when the tracker
   * did not send one
   */
  int getMinInterval();

  @Nullable
  String getTrackerId();

  @Nullable
  String getWarningMessage();

  /**
   * @return number of seeders
   */
  int getComplete();

  /**
   * @return number of leechers
   */
  int getIncomplete();

  List<Peer> getPeers();
}
