/*
 * Copyright 2000-2013 JetBrains s.r.o.
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

package com.bitflow;

public class Constants {
  public static final int DEFAULT_ANNOUNCE_INTERVAL_SEC = 60;

  public static final int DEFAULT_CONNECTION_TIMEOUT_MILLIS = 10000;
  public static final int DEFAULT_SOCKET_READ_TIMEOUT_MILLIS = 1000;
  public static final int KEEP_ALIVE_INTERVAL_MILLIS = 2 * 60 * 1000;

  public static final int DEFAULT_MAX_CONNECTION_COUNT = 50;
  public static final int DEFAULT_PIPELINE_DEPTH = 5;
  public static final int DEFAULT_PORT = 6881;

  public static final int DEFAULT_BLOCK_SIZE = 16 * 1024;

  public static final String BYTE_ENCODING = "ISO-8859-1";

  public static final int PIECE_HASH_SIZE = 20;

}
