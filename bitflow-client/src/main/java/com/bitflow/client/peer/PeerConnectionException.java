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
package com.bitflow.client.peer;

import java.io.IOException;

/**
 * A peer could not be reached, or its socket failed.
 */
public class PeerConnectionException extends IOException {

  private static final long serialVersionUID = -1;

  public enum Reason {
    /** Unresolvable host or a port outside 1..65535. */
    INVALID_ADDRESS,
    /** Connect, read or write failed on the socket. */
    SOCKET_UNAVAILABLE,
    OTHER
  }

  private final Reason reason;

  public PeerConnectionException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public PeerConnectionException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason getReason() {
    return reason;
  }
}
