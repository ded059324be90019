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

import com.bitflow.common.TorrentInfo;

import java.nio.ByteBuffer;
import java.text.ParseException;
import java.util.BitSet;

/**
 * Immutable view of one peer wire message.
 *
 * <p>
 * Each message keeps the exact frame it was crafted into or parsed from,
 * 4-byte big-endian length prefix included, so it can be written to a
 * socket as is. Parsing checks the frame against the torrent it belongs to
 * and rejects anything that addresses pieces or blocks outside of it.
 * </p>
 *
 * @author mpetazzoni
 * @see <a href="http://wiki.theory.org/BitTorrentSpecification#Peer_wire_protocol_.28TCP.29">BitTorrent peer wire protocol</a>
 */
public abstract class PeerMessage {

  private static final int LENGTH_PREFIX = 4;

  /**
   * Wire identifier of each message. Keep-alive frames carry no identifier
   * at all; -1 is only a placeholder.
   */
  public enum Type {
    KEEP_ALIVE(-1),
    CHOKE(0),
    UNCHOKE(1),
    INTERESTED(2),
    NOT_INTERESTED(3),
    HAVE(4),
    BITFIELD(5),
    REQUEST(6),
    PIECE(7),
    CANCEL(8);

    private static final Type[] BY_ID = {
            CHOKE, UNCHOKE, INTERESTED, NOT_INTERESTED, HAVE, BITFIELD, REQUEST, PIECE, CANCEL
    };

    private final byte id;

    Type(int id) {
      this.id = (byte) id;
    }

    public byte getTypeByte() {
      return this.id;
    }

    /**
     * @return the type sent on the wire as {@code id}, or null for an
     * identifier this client does not speak.
     */
    public static Type get(byte id) {
      return id >= 0 && id < BY_ID.length ? BY_ID[id] : null;
    }
  }

  private final Type type;
  private final ByteBuffer frame;

  private PeerMessage(Type type, ByteBuffer frame) {
    this.type = type;
    this.frame = frame;
    this.frame.rewind();
  }

  public Type getType() {
    return this.type;
  }

  /**
   * Returns the whole frame, length prefix included. Every call hands out
   * an independent duplicate so concurrent readers never share a position.
   */
  public ByteBuffer getData() {
    return this.frame.duplicate();
  }

  /**
   * Checks this message against the torrent it was received for. Messages
   * without addressing accept any torrent.
   *
   * @param torrent the torrent the message belongs to.
   * @return this message.
   */
  public PeerMessage validate(TorrentInfo torrent)
          throws MessageValidationException {
    return this;
  }

  @Override
  public String toString() {
    return this.type.name();
  }

  /**
   * Decodes one complete frame.
   *
   * @param buffer  the frame, length prefix included. Its position is
   *                moved past the data that was read.
   * @param torrent the torrent this connection shares.
   * @return the decoded, validated message.
   * @throws ParseException when the announced length disagrees with the
   *                        frame, the identifier is unknown, or the payload
   *                        is malformed or out of range for the torrent.
   */
  public static PeerMessage parse(ByteBuffer buffer, TorrentInfo torrent)
          throws ParseException {
    int announced = buffer.getInt();
    if (announced == 0) {
      return KeepAliveMessage.parse(buffer.slice(), torrent);
    }
    if (announced != buffer.remaining()) {
      throw new ParseException("Frame announces " + announced + " bytes but carries " +
              buffer.remaining(), 0);
    }

    byte id = buffer.get();
    Type type = Type.get(id);
    if (type == null) {
      throw new ParseException("Unknown message id " + id, buffer.position() - 1);
    }

    ByteBuffer payload = buffer.slice();
    switch (type) {
      case CHOKE:
        return ChokeMessage.parse(payload, torrent);
      case UNCHOKE:
        return UnchokeMessage.parse(payload, torrent);
      case INTERESTED:
        return InterestedMessage.parse(payload, torrent);
      case NOT_INTERESTED:
        return NotInterestedMessage.parse(payload, torrent);
      case HAVE:
        return HaveMessage.parse(payload, torrent);
      case BITFIELD:
        return BitfieldMessage.parse(payload, torrent);
      case REQUEST:
        return RequestMessage.parse(payload, torrent);
      case PIECE:
        return PieceMessage.parse(payload, torrent);
      case CANCEL:
        return CancelMessage.parse(payload, torrent);
      default:
        throw new ParseException("Unexpected message id " + id, buffer.position() - 1);
    }
  }

  /**
   * Longest length prefix a peer may announce for {@code torrent}: a
   * maximal request-sized block, or the torrent's bitfield when that is
   * larger.
   */
  public static int maxFrameLength(TorrentInfo torrent) {
    int bitfieldFrame = 1 + (torrent.getPieceCount() + 7) / 8;
    return Math.max(13 + RequestMessage.MAX_REQUEST_SIZE, bitfieldFrame);
  }

  public static class MessageValidationException extends ParseException {

    static final long serialVersionUID = -1;

    public MessageValidationException(PeerMessage m) {
      super("Message " + m + " is not valid!", 0);
    }

    public MessageValidationException(Type type, String reason) {
      super("Message " + type + " is not valid: " + reason, 0);
    }
  }

  /**
   * Allocates a frame for {@code type} with room for {@code payloadSize}
   * bytes after the identifier, prefix and identifier already written.
   */
  private static ByteBuffer frame(Type type, int payloadSize) {
    ByteBuffer frame = ByteBuffer.allocate(LENGTH_PREFIX + 1 + payloadSize);
    frame.putInt(1 + payloadSize).put(type.getTypeByte());
    return frame;
  }

  private static void expectPayload(Type type, ByteBuffer payload, int size)
          throws MessageValidationException {
    if (payload.remaining() != size) {
      throw new MessageValidationException(type, payload.remaining() + " payload bytes instead of " + size);
    }
  }

  private static boolean addressesBlock(TorrentInfo torrent, int piece, int offset, long length) {
    if (piece < 0 || piece >= torrent.getPieceCount() || offset < 0) {
      return false;
    }
    return offset + length <= torrent.getPieceSize(piece);
  }

  /** {@code <len=0000>} */
  public static class KeepAliveMessage extends PeerMessage {

    private KeepAliveMessage(ByteBuffer frame) {
      super(Type.KEEP_ALIVE, frame);
    }

    public static KeepAliveMessage parse(ByteBuffer payload, TorrentInfo torrent)
            throws ParseException {
      if (payload.hasRemaining()) {
        throw new ParseException("Keep-alive followed by " + payload.remaining() + " byte(s)", 0);
      }
      return craft();
    }

    public static KeepAliveMessage craft() {
      return new KeepAliveMessage(ByteBuffer.allocate(LENGTH_PREFIX).putInt(0));
    }
  }

  /** {@code <len=0001><id=0>} */
  public static class ChokeMessage extends PeerMessage {

    private ChokeMessage(ByteBuffer frame) {
      super(Type.CHOKE, frame);
    }

    public static ChokeMessage parse(ByteBuffer payload, TorrentInfo torrent)
            throws MessageValidationException {
      expectPayload(Type.CHOKE, payload, 0);
      return craft();
    }

    public static ChokeMessage craft() {
      return new ChokeMessage(frame(Type.CHOKE, 0));
    }
  }

  /** {@code <len=0001><id=1>} */
  public static class UnchokeMessage extends PeerMessage {

    private UnchokeMessage(ByteBuffer frame) {
      super(Type.UNCHOKE, frame);
    }

    public static UnchokeMessage parse(ByteBuffer payload, TorrentInfo torrent)
            throws MessageValidationException {
      expectPayload(Type.UNCHOKE, payload, 0);
      return craft();
    }

    public static UnchokeMessage craft() {
      return new UnchokeMessage(frame(Type.UNCHOKE, 0));
    }
  }

  /** {@code <len=0001><id=2>} */
  public static class InterestedMessage extends PeerMessage {

    private InterestedMessage(ByteBuffer frame) {
      super(Type.INTERESTED, frame);
    }

    public static InterestedMessage parse(ByteBuffer payload, TorrentInfo torrent)
            throws MessageValidationException {
      expectPayload(Type.INTERESTED, payload, 0);
      return craft();
    }

    public static InterestedMessage craft() {
      return new InterestedMessage(frame(Type.INTERESTED, 0));
    }
  }

  /** {@code <len=0001><id=3>} */
  public static class NotInterestedMessage extends PeerMessage {

    private NotInterestedMessage(ByteBuffer frame) {
      super(Type.NOT_INTERESTED, frame);
    }

    public static NotInterestedMessage parse(ByteBuffer payload, TorrentInfo torrent)
            throws MessageValidationException {
      expectPayload(Type.NOT_INTERESTED, payload, 0);
      return craft();
    }

    public static NotInterestedMessage craft() {
      return new NotInterestedMessage(frame(Type.NOT_INTERESTED, 0));
    }
  }

  /** {@code <len=0005><id=4><piece index>} */
  public static class HaveMessage extends PeerMessage {

    private final int piece;

    private HaveMessage(ByteBuffer frame, int piece) {
      super(Type.HAVE, frame);
      this.piece = piece;
    }

    public int getPieceIndex() {
      return this.piece;
    }

    @Override
    public HaveMessage validate(TorrentInfo torrent) throws MessageValidationException {
      if (this.piece < 0 || this.piece >= torrent.getPieceCount()) {
        throw new MessageValidationException(this);
      }
      return this;
    }

    public static HaveMessage parse(ByteBuffer payload, TorrentInfo torrent)
            throws MessageValidationException {
      expectPayload(Type.HAVE, payload, 4);
      return craft(payload.getInt()).validate(torrent);
    }

    public static HaveMessage craft(int piece) {
      return new HaveMessage(frame(Type.HAVE, 4).putInt(piece), piece);
    }

    @Override
    public String toString() {
      return super.toString() + " #" + this.piece;
    }
  }

  /**
   * {@code <len=0001+X><id=5><bitfield>}
   *
   * <p>
   * Bit 7 of the first byte stands for piece 0. A valid bitfield holds
   * exactly one bit per piece, rounded up to whole bytes, and leaves the
   * trailing spare bits cleared.
   * </p>
   */
  public static class BitfieldMessage extends PeerMessage {

    private final BitSet pieces;
    private final int size;

    private BitfieldMessage(ByteBuffer frame, BitSet pieces, int size) {
      super(Type.BITFIELD, frame);
      this.pieces = pieces;
      this.size = size;
    }

    public BitSet getBitfield() {
      return (BitSet) this.pieces.clone();
    }

    @Override
    public BitfieldMessage validate(TorrentInfo torrent) throws MessageValidationException {
      int count = torrent.getPieceCount();
      if (this.size != (count + 7) / 8 || this.pieces.length() > count) {
        throw new MessageValidationException(this);
      }
      return this;
    }

    public static BitfieldMessage parse(ByteBuffer payload, TorrentInfo torrent)
            throws MessageValidationException {
      byte[] bytes = new byte[payload.remaining()];
      payload.get(bytes);
      return craft(bytes).validate(torrent);
    }

    public static BitfieldMessage craft(BitSet availablePieces, int pieceCount) {
      byte[] bytes = new byte[(pieceCount + 7) / 8];
      int piece = availablePieces.nextSetBit(0);
      while (piece >= 0 && piece < pieceCount) {
        bytes[piece >> 3] |= (byte) (0x80 >>> (piece & 7));
        piece = availablePieces.nextSetBit(piece + 1);
      }
      return craft(bytes);
    }

    private static BitfieldMessage craft(byte[] bytes) {
      BitSet pieces = new BitSet(bytes.length * 8);
      for (int bit = 0; bit < bytes.length * 8; bit++) {
        if ((bytes[bit >> 3] & (0x80 >>> (bit & 7))) != 0) {
          pieces.set(bit);
        }
      }
      return new BitfieldMessage(frame(Type.BITFIELD, bytes.length).put(bytes), pieces, bytes.length);
    }

    @Override
    public String toString() {
      return super.toString() + " " + this.pieces.cardinality();
    }
  }

  /**
   * Shared shape of the messages naming a block by piece, offset and
   * length: {@code <len=0013><id><piece index><block offset><block length>}.
   */
  public abstract static class BlockMessage extends PeerMessage {

    private final int piece;
    private final int offset;
    private final int length;

    private BlockMessage(Type type, int piece, int offset, int length) {
      super(type, frame(type, 12).putInt(piece).putInt(offset).putInt(length));
      this.piece = piece;
      this.offset = offset;
      this.length = length;
    }

    public int getPiece() {
      return this.piece;
    }

    public int getOffset() {
      return this.offset;
    }

    public int getLength() {
      return this.length;
    }

    boolean isWithin(TorrentInfo torrent) {
      return this.length > 0 && addressesBlock(torrent, this.piece, this.offset, this.length);
    }

    @Override
    public String toString() {
      return super.toString() + " #" + this.piece + " (" + this.length + "@" + this.offset + ")";
    }
  }

  /** {@code <len=0013><id=6><piece index><block offset><block length>} */
  public static class RequestMessage extends BlockMessage {

    /**
     * Largest block a peer may ask for, 128 KiB.
     */
    public static final int MAX_REQUEST_SIZE = 131072;

    private RequestMessage(int piece, int offset, int length) {
      super(Type.REQUEST, piece, offset, length);
    }

    @Override
    public RequestMessage validate(TorrentInfo torrent) throws MessageValidationException {
      if (this.getLength() > MAX_REQUEST_SIZE || !this.isWithin(torrent)) {
        throw new MessageValidationException(this);
      }
      return this;
    }

    public static RequestMessage parse(ByteBuffer payload, TorrentInfo torrent)
            throws MessageValidationException {
      expectPayload(Type.REQUEST, payload, 12);
      return craft(payload.getInt(), payload.getInt(), payload.getInt()).validate(torrent);
    }

    public static RequestMessage craft(int piece, int offset, int length) {
      return new RequestMessage(piece, offset, length);
    }
  }

  /** {@code <len=0013><id=8><piece index><block offset><block length>} */
  public static class CancelMessage extends BlockMessage {

    private CancelMessage(int piece, int offset, int length) {
      super(Type.CANCEL, piece, offset, length);
    }

    @Override
    public CancelMessage validate(TorrentInfo torrent) throws MessageValidationException {
      if (!this.isWithin(torrent)) {
        throw new MessageValidationException(this);
      }
      return this;
    }

    public static CancelMessage parse(ByteBuffer payload, TorrentInfo torrent)
            throws MessageValidationException {
      expectPayload(Type.CANCEL, payload, 12);
      return craft(payload.getInt(), payload.getInt(), payload.getInt()).validate(torrent);
    }

    public static CancelMessage craft(int piece, int offset, int length) {
      return new CancelMessage(piece, offset, length);
    }
  }

  /** {@code <len=0009+X><id=7><piece index><block offset><block data>} */
  public static class PieceMessage extends PeerMessage {

    private final int piece;
    private final int offset;
    private final ByteBuffer block;

    private PieceMessage(ByteBuffer frame, int piece, int offset, ByteBuffer block) {
      super(Type.PIECE, frame);
      this.piece = piece;
      this.offset = offset;
      this.block = block;
    }

    public int getPiece() {
      return this.piece;
    }

    public int getOffset() {
      return this.offset;
    }

    /**
     * @return the block data as a duplicate positioned at its first byte.
     */
    public ByteBuffer getBlock() {
      return this.block.duplicate();
    }

    @Override
    public PieceMessage validate(TorrentInfo torrent) throws MessageValidationException {
      int size = this.block.remaining();
      if (size == 0 || !addressesBlock(torrent, this.piece, this.offset, size)) {
        throw new MessageValidationException(this);
      }
      return this;
    }

    public static PieceMessage parse(ByteBuffer payload, TorrentInfo torrent)
            throws MessageValidationException {
      if (payload.remaining() < 8) {
        throw new MessageValidationException(Type.PIECE, "truncated header");
      }
      int piece = payload.getInt();
      int offset = payload.getInt();
      return craft(piece, offset, payload.slice()).validate(torrent);
    }

    public static PieceMessage craft(int piece, int offset, ByteBuffer block) {
      ByteBuffer data = block.duplicate();
      ByteBuffer frame = frame(Type.PIECE, 8 + data.remaining()).putInt(piece).putInt(offset);
      ByteBuffer copy = frame.slice().put(data);
      copy.flip();
      frame.position(frame.limit());
      return new PieceMessage(frame, piece, offset, copy);
    }

    @Override
    public String toString() {
      return super.toString() + " #" + this.piece + " (" + this.block.remaining() + "@" + this.offset + ")";
    }
  }
}
