package com.bitflow.client.strategy;

import com.bitflow.client.Piece;
import org.testng.annotations.Test;

import java.util.BitSet;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertSame;

@Test
public class RequestStrategyImplRarestTest {

  private static Piece[] pieces(int count) {
    Piece[] pieces = new Piece[count];
    for (int i = 0; i < count; i++) {
      pieces[i] = new Piece(i, 1024, new byte[20], 1024);
    }
    return pieces;
  }

  public void testNothingInteresting() {
    assertNull(new RequestStrategyImplRarest().choosePiece(new BitSet(), pieces(4)));
    assertNull(new RequestStrategyImplSequential().choosePiece(new BitSet(), pieces(4)));
  }

  public void testSameInputSameChoice() {
    Piece[] pieces = pieces(8);
    BitSet interesting = new BitSet();
    interesting.set(3);
    interesting.set(5);
    interesting.set(6);

    RequestStrategy strategy = new RequestStrategyImplRarest();
    Piece first = strategy.choosePiece(interesting, pieces);
    for (int i = 0; i < 10; i++) {
      assertSame(strategy.choosePiece(interesting, pieces), first);
    }
    assertEquals(first.getIndex(), 3);
  }

  public void testSequentialIgnoresIndicesOutOfRange() {
    BitSet interesting = new BitSet();
    interesting.set(9);
    assertNull(new RequestStrategyImplSequential().choosePiece(interesting, pieces(4)));
  }
}
