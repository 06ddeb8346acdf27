package rules.constants;

/**
 * Central place for rules-engine compile-time constants.
 */
public final class RulesConstants {

    private RulesConstants() {}

    public static final String START_FEN = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1";

    /* ────────────── move-list capacity ────────────── */
    public static final int MAX_MOVES = 256; // Max pseudo-legal moves in a position

    /* ────────────── castling-right bits ────────────── */
    public static final int CR_WHITE_KING  = 0b0001;
    public static final int CR_WHITE_QUEEN = 0b0010;
    public static final int CR_BLACK_KING  = 0b0100;
    public static final int CR_BLACK_QUEEN = 0b1000;

    /* ────────────── notation ────────────── */
    public static final String CASTLE_KING_SIDE  = "O-O";
    public static final String CASTLE_QUEEN_SIDE = "O-O-O";
}
