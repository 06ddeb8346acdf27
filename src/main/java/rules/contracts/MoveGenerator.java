package rules.contracts;

/**
 * Pseudo-legal move generation over packed positions.
 *
 * <p>Moves are packed into an {@code int}:
 *
 * <pre>
 * 19   16 15  14 13  12 11      6 5       0
 * ┌──────┬──────┬──────┬─────────┬─────────┐
 * │mover │ type │promo │ fromSq  │  toSq   │
 * └──────┴──────┴──────┴─────────┴─────────┘
 * </pre>
 *
 * type: 0 normal, 1 promotion, 2 en passant, 3 castle. promo: 0 N, 1 B, 2 R, 3 Q.
 */
public interface MoveGenerator {

  int TYPE_NORMAL = 0, TYPE_PROMOTION = 1, TYPE_EN_PASSANT = 2, TYPE_CASTLE = 3;

  /**
   * Appends every pseudo-legal move of the side to move to {@code mv}, starting at {@code n}.
   * Castling is only emitted when the king does not start in, pass through or land on an attacked
   * square; other moves may still leave the own king in check.
   *
   * @return the new move count
   */
  int generatePseudoLegal(long[] bb, int[] mv, int n);

  /** @return {@code true} if the king of the given colour is attacked */
  boolean kingAttacked(long[] bb, boolean white);

  boolean isAttacked(long[] bb, boolean byWhite, int sq);

  static int packMove(int from, int to, int type, int promo, int mover) {
    return to | (from << 6) | (promo << 12) | (type << 14) | (mover << 16);
  }

  static int moveTo(int mv)    { return  mv         & 0x3F; }
  static int moveFrom(int mv)  { return (mv >>>  6) & 0x3F; }
  static int movePromo(int mv) { return (mv >>> 12) & 0x3;  }
  static int moveType(int mv)  { return (mv >>> 14) & 0x3;  }
  static int moveMover(int mv) { return (mv >>> 16) & 0xF;  }
}
