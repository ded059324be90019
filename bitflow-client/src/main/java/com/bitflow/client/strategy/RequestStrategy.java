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
package com.bitflow.client.strategy;

import com.bitflow.client.Piece;

import java.util.BitSet;

/**
 * Interface for a piece request strategy provider.
 *
 * <p>
 * Implementations must be deterministic: the same candidates and the same
 * availability counts give the same choice.
 * </p>
 *
 * @author cjmalloy
 */
public interface RequestStrategy {

  /**
   * Choose a piece from the remaining pieces.
   *
   * @param interesting A set of the index of all interesting pieces
   * @param pieces      The complete array of pieces
   * @return The chosen piece, or <code>null</code> if no piece is interesting
   */
  Piece choosePiece(BitSet interesting, Piece[] pieces);
}
