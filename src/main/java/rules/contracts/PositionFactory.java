package rules.contracts;

/**
 * Builds and mutates packed positions.
 *
 * <p>A packed position is a {@code long[BB_LEN]}: twelve piece bitboards followed by one META word.
 * META holds side to move, castling rights, en-passant square, half-move clock and full-move number.
 */
public interface PositionFactory {

  /* ───────── Piece indices ──────── */
  int WP = 0, WN = 1, WB = 2, WR = 3, WQ = 4, WK = 5;
  int BP = 6, BN = 7, BB = 8, BR = 9, BQ = 10, BK = 11;
  int META = 12;

  int BB_LEN = META + 1;

  long EP_NONE = 63;
  long STM_MASK = 1L;
  int CR_SHIFT = 1;
  long CR_MASK = 0b1111L << CR_SHIFT;
  int EP_SHIFT = 5;
  long EP_MASK = 0x3FL << EP_SHIFT;
  int HC_SHIFT = 11;
  long HC_MASK = 0xFFFFL << HC_SHIFT;
  int FM_SHIFT = 27;
  long FM_MASK = 0x7FFFFFFFL << FM_SHIFT;

  /** Largest half-move clock and full-move number a META word holds. */
  int HC_MAX = 0xFFFF;
  int FM_MAX = Integer.MAX_VALUE;

  /** Plays an already validated move; no legality check is made. */
  void makeMoveInPlace(long[] bb, int move);

  /** @throws IllegalArgumentException if {@code fen} is not a well-formed FEN string */
  long[] fromFen(String fen);

  String toFen(long[] bb);

  static boolean whiteToMove(long meta) {
    return (meta & STM_MASK) == 0;
  }

  static long castling(long meta) {
    return (meta & CR_MASK) >>> CR_SHIFT;
  }

  static long epSquare(long meta) {
    return (meta & EP_MASK) >>> EP_SHIFT;
  }

  static long halfClock(long meta) {
    return (meta & HC_MASK) >>> HC_SHIFT;
  }

  static long fullMove(long meta) {
    return 1 + ((meta & FM_MASK) >>> FM_SHIFT);
  }
}
