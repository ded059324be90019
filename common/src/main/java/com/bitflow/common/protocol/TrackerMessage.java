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

/**
 * BitTorrent tracker protocol messages representations.
 *
 * <p>
 * This class and its <em>*TrackerMessage</em> subclasses provide POJO
 * representations of the tracker protocol messages along with parsing of
 * the tracker's answers.
 * </p>
 *
 * @author mpetazzoni
 */
public abstract class TrackerMessage {

  /**
   * Message type.
   */
  public enum Type {
    ANNOUNCE_REQUEST,
    ANNOUNCE_RESPONSE,
    ERROR
  }

  private final Type type;

  /**
   * Constructor for the base tracker message type.
   *
   * @param type The message type.
   */
  protected TrackerMessage(Type type) {
    this.type = type;
  }

  /**
   * Returns the type of this tracker message.
   */
  public Type getType() {
    return this.type;
  }

  /**
   * Generic exception for message format and message validation exceptions.
   */
  public static class MessageValidationException extends Exception {

    static final long serialVersionUID = -1;

    public MessageValidationException(String s) {
      super(s);
    }

    public MessageValidationException(String s, Throwable cause) {
      super(s, cause);
    }

  }


  /**
   * Base interface for tracker error messages.
   *
   * <p>
   * A tracker answering with a <code>failure reason</code> refuses the
   * announce; the reason is meant to be shown to the user.
   * </p>
   *
   * @author mpetazzoni
   */
  public interface ErrorMessage {

    String getReason();
  }

}
