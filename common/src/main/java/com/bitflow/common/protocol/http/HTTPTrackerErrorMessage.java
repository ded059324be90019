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

import com.bitflow.bcodec.BEValue;
import com.bitflow.bcodec.InvalidBEncodingException;
import com.bitflow.common.protocol.TrackerMessage.ErrorMessage;
import org.jetbrains.annotations.NotNull;

import java.util.HashMap;
import java.util.Map;

/**
 * An error message from an HTTP tracker.
 *
 * @author mpetazzoni
 */
public class HTTPTrackerErrorMessage extends HTTPTrackerMessage implements ErrorMessage {

  private final String reason;

  public HTTPTrackerErrorMessage(String reason) {
    super(Type.ERROR);
    this.reason = reason;
  }

  @Override
  public String getReason() {
    return this.reason;
  }

  @NotNull
  public static HTTPTrackerErrorMessage fromBEValue(@NotNull Map<String, BEValue> params)
          throws MessageValidationException {

    try {
      String reason = params.get(FAILURE_REASON).getString();
      return new HTTPTrackerErrorMessage(reason);
    } catch (InvalidBEncodingException ibee) {
      throw new MessageValidationException("Invalid tracker error message!", ibee);
    }
  }

  @NotNull
  public Map<String, BEValue> toBEValue() {
    Map<String, BEValue> params = new HashMap<String, BEValue>();
    params.put(FAILURE_REASON, new BEValue(getReason()));
    return params;
  }

  @Override
  public String toString() {
    return "tracker failure: " + reason;
  }
}
