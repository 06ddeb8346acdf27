package rules;

import java.util.Objects;

/**
 * Immutable chess move in long-algebraic form (“e2e4”, “e7e8q”).
 *
 * <p>Castling is the king's two-square move (“e1g1”). Whether a move is a capture, an en-passant
 * capture or a castle depends on the position it is played in; the {@link rules.contracts.RulesEngine}
 * works that out.
 *
 * @param from      0 – 63 index of the origin square (A1 = 0, H8 = 63)
 * @param to        0 – 63 index of the destination square
 * @param promotion promotion piece, {@code null} if none
 */
public record Move(int from, int to, Piece.Type promotion) {

  public Move {
    if ((from & ~63) != 0 || (to & ~63) != 0)
      throw new IllegalArgumentException("square out of range: " + from + "->" + to);
    if (promotion == Piece.Type.PAWN || promotion == Piece.Type.KING)
      throw new IllegalArgumentException("cannot promote to " + promotion);
  }

  public static Move of(int from, int to) {
    return new Move(from, to, null);
  }

  public static Move of(String from, String to) {
    return new Move(squareIndex(from), squareIndex(to), null);
  }

  /** Parses “e2e4” / “e7e8q”. */
  public static Move fromUci(String uci) {
    Objects.requireNonNull(uci, "uci");
    if (uci.length() != 4 && uci.length() != 5)
      throw new IllegalArgumentException("bad UCI move: " + uci);

    Piece.Type promo = null;
    if (uci.length() == 5) {
      promo = Piece.Type.fromLetter(uci.charAt(4));
      if (promo == null) throw new IllegalArgumentException("bad promotion in: " + uci);
    }
    return new Move(squareIndex(uci.substring(0, 2)), squareIndex(uci.substring(2, 4)), promo);
  }

  public boolean isPromotion() {
    return promotion != null;
  }

  /** Render as long algebraic notation, e.g. “e2e4”, “e7e8q”. */
  public String toUci() {
    String uci = squareName(from) + squareName(to);
    return isPromotion() ? uci + Character.toLowerCase(promotion.letter()) : uci;
  }

  @Override
  public String toString() {
    return toUci();
  }

  /* ── square helpers ─────────────────────────────────────────── */

  /** “e4” → 28. */
  public static int squareIndex(String name) {
    if (name == null || name.length() != 2)
      throw new IllegalArgumentException("bad square: " + name);
    int file = name.charAt(0) - 'a';
    int rank = name.charAt(1) - '1';
    if (file < 0 || file > 7 || rank < 0 || rank > 7)
      throw new IllegalArgumentException("bad square: " + name);
    return rank * 8 + file;
  }

  /** 28 → “e4”. */
  public static String squareName(int sq) {
    return "" + (char) ('a' + (sq & 7)) + (char) ('1' + (sq >>> 3));
  }
}
