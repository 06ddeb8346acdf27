package rules;

/**
 * Immutable identity of a chess piece.
 *
 * <p>The packed board stores one bitboard per piece; {@link #index()} is that slot
 * (white pawn = 0 … black king = 11).
 */
public record Piece(Type type, boolean white) {

  /** Enumerates the six piece kinds recognised by orthodox chess. */
  public enum Type {
    PAWN('P'),
    KNIGHT('N'),
    BISHOP('B'),
    ROOK('R'),
    QUEEN('Q'),
    KING('K');

    private final char letter;

    Type(char letter) {
      this.letter = letter;
    }

    /** Upper-case SAN letter ('P' for pawns, although SAN omits it). */
    public char letter() {
      return letter;
    }

    /** @return the type for an upper- or lower-case letter, or {@code null}. */
    public static Type fromLetter(char c) {
      return switch (Character.toUpperCase(c)) {
        case 'P' -> PAWN;
        case 'N' -> KNIGHT;
        case 'B' -> BISHOP;
        case 'R' -> ROOK;
        case 'Q' -> QUEEN;
        case 'K' -> KING;
        default -> null;
      };
    }
  }

  public static Piece fromIndex(int idx) {
    if (idx < 0 || idx > 11) throw new IllegalArgumentException("bad piece index: " + idx);
    return new Piece(Type.values()[idx % 6], idx < 6);
  }

  public int index() {
    return type.ordinal() + (white ? 0 : 6);
  }

  /** Shorthand for {@code !white()}. */
  public boolean black() {
    return !white;
  }

  /** FEN letter: upper case for White. */
  public char fenChar() {
    return white ? type.letter : Character.toLowerCase(type.letter);
  }

  @Override
  public String toString() {
    return String.valueOf(fenChar());
  }
}
