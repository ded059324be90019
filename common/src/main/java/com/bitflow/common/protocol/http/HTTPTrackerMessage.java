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
package com.bitflow.common.protocol.http;

import com.bitflow.bcodec.BDecoder;
import com.bitflow.bcodec.BEValue;
import com.bitflow.bcodec.InvalidBEncodingException;
import com.bitflow.common.protocol.TrackerMessage;
import org.jetbrains.annotations.NotNull;

import java.util.Map;

/**
 * Base class for HTTP tracker messages.
 *
 * @author mpetazzoni
 */
public abstract class HTTPTrackerMessage extends TrackerMessage {

  public static final String FAILURE_REASON = "failure reason";

  protected HTTPTrackerMessage(Type type) {
    super(type);
  }

  /**
   * Decodes the body of a tracker's answer.
   *
   * <p>
   * A <code>failure reason</code> key turns the whole answer into an
   * {@link HTTPTrackerErrorMessage}, whatever else the dictionary holds.
   * Anything else must decode as an {@link HTTPAnnounceResponseMessage}.
   * </p>
   *
   * @param body the raw response body
   * @throws MessageValidationException if the body is not a bencoded
   *                                    dictionary of either kind
   */
  @NotNull
  public static HTTPTrackerMessage parse(byte[] body) throws MessageValidationException {
    final Map<String, BEValue> params;
    try {
      params = BDecoder.bdecode(body).getMap();
    } catch (InvalidBEncodingException e) {
      throw new MessageValidationException("Could not decode tracker message: " + e.getMessage(), e);
    }

    if (params.containsKey(FAILURE_REASON)) {
      return HTTPTrackerErrorMessage.fromBEValue(params);
    }

    return HTTPAnnounceResponseMessage.fromBEValue(params);
  }
}
