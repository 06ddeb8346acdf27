package rules;

import static rules.contracts.PositionFactory.*;

import java.util.Arrays;
import rules.contracts.PositionFactory;

/**
 * Immutable snapshot of a chessboard.
 *
 * <p>Wraps a packed position (see {@link PositionFactory}). The array is copied on the way in and on
 * the way out, so a {@code Board} never changes after construction. Square indices follow the common
 * bitboard convention:
 *
 * <pre>
 * A1 = 0, B1 = 1, …, H8 = 63
 * </pre>
 */
public final class Board {

  private final long[] bb;

  private Board(long[] bb) {
    this.bb = bb;
  }

  public static Board fromPacked(long[] packed) {
    if (packed.length != BB_LEN)
      throw new IllegalArgumentException("packed position must have " + BB_LEN + " words");
    return new Board(packed.clone());
  }

  /** Fresh copy of the packed words; safe to mutate. */
  public long[] toPacked() {
    return bb.clone();
  }

  /* ────── Side to move & clocks ────── */

  public boolean whiteToMove() {
    return PositionFactory.whiteToMove(bb[META]);
  }

  /** Half-move clock for the fifty-move rule. */
  public int halfmoveClock() {
    return (int) halfClock(bb[META]);
  }

  /** Full-move number (starts at 1, incremented after Black’s move). */
  public int fullmoveNumber() {
    return (int) fullMove(bb[META]);
  }

  /* ────── Castling / en-passant ────── */

  /**
   * Bit-mask of castling rights:
   *
   * <pre>
   * 0x1 = White O-O, 0x2 = White O-O-O,
   * 0x4 = Black O-O, 0x8 = Black O-O-O
   * </pre>
   */
  public int castlingRights() {
    return (int) castling(bb[META]);
  }

  /** En-passant target square (0-63), or {@code -1} if no en-passant capture is possible. */
  public int enPassantSquare() {
    int ep = (int) epSquare(bb[META]);
    return ep == EP_NONE ? -1 : ep;
  }

  /* ────── Piece accessors ────── */

  public long bitboard(Piece piece) {
    return bb[piece.index()];
  }

  /** @return the piece on {@code square}, or {@code null} for empty */
  public Piece pieceAt(int square) {
    long bit = 1L << square;
    for (int i = WP; i <= BK; ++i) if ((bb[i] & bit) != 0) return Piece.fromIndex(i);
    return null;
  }

  public long occupancy() {
    long occ = 0;
    for (int i = WP; i <= BK; ++i) occ |= bb[i];
    return occ;
  }

  /* ────── equality ────── */

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    return o instanceof Board other && Arrays.equals(bb, other.bb);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bb);
  }

  /** Eight ranks, rank 8 first, {@code .} for empty squares. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(80);
    for (int rank = 7; rank >= 0; --rank) {
      for (int file = 0; file < 8; ++file) {
        Piece p = pieceAt(rank * 8 + file);
        sb.append(p == null ? '.' : p.fenChar());
      }
      sb.append('\n');
    }
    sb.append(whiteToMove() ? "w" : "b").append(' ').append(fullmoveNumber());
    return sb.toString();
  }
}
