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
 * The default request strategy implementation- rarest first.
 *
 * <p>
 * Picks the interesting piece held by the fewest connected peers; ties go to
 * the lowest index.
 * </p>
 *
 * @author cjmalloy
 */
public class RequestStrategyImplRarest implements RequestStrategy {

  @Override
  public Piece choosePiece(BitSet interesting, Piece[] pieces) {
    Piece rarest = null;
    for (int i = interesting.nextSetBit(0); i >= 0 && i < pieces.length; i = interesting.nextSetBit(i + 1)) {
      Piece piece = pieces[i];
      if (rarest == null || piece.getAvailability() < rarest.getAvailability()) {
        rarest = piece;
      }
    }
    return rarest;
  }
}
