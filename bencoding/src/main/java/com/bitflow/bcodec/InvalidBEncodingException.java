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
package com.bitflow.bcodec;

import java.io.IOException;


/**
 * Exception thrown when a B-encoded stream cannot be decoded, or when a
 * decoded dictionary does not match the schema the caller expects.
 *
 * <p>
 * When the problem is structural, {@link #getOffset()} is the position of
 * the first offending byte in the decoded input. Schema problems found after
 * decoding report {@link #UNKNOWN_OFFSET}.
 * </p>
 *
 * @author mpetazzoni
 */
public class InvalidBEncodingException extends IOException {

  public static final long serialVersionUID = -1;

  public static final int UNKNOWN_OFFSET = -1;

  private final int offset;

  public InvalidBEncodingException(String message) {
    this(message, UNKNOWN_OFFSET);
  }

  public InvalidBEncodingException(String message, int offset) {
    super(offset == UNKNOWN_OFFSET ? message : message + " (at offset " + offset + ")");
    this.offset = offset;
  }

  public int getOffset() {
    return offset;
  }
}
