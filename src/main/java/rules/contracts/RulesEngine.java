package rules.contracts;

import java.util.List;
import java.util.Optional;
import rules.Board;
import rules.Move;

/**
 * Chess rules as seen by the game tree: legality, move application and notation.
 *
 * <p>Implementations are stateless; every method works on the immutable {@link Board} it is given.
 */
public interface RulesEngine {

    /** The standard initial position. */
    Board startingPosition();

    /**
     * Plays {@code move} without checking legality. Callers must only pass moves that came from
     * {@link #legalMoves}, {@link #notationToMove} or passed {@link #isLegal}.
     */
    Board apply(Board position, Move move);

    boolean isLegal(Board position, Move move);

    /** All legal moves of the side to move, in generation order. */
    List<Move> legalMoves(Board position);

    /**
     * Resolves SAN text ("Nf3", "exd5", "O-O", "e8=Q+") against {@code position}.
     *
     * @return the move, or empty if the text is malformed, ambiguous or illegal here
     */
    Optional<Move> notationToMove(Board position, String san);

    /** SAN of a legal {@code move}, including the check or mate suffix. */
    String moveToNotation(Board position, Move move);

    /**
     * @throws IllegalArgumentException if {@code fen} is not a usable position
     */
    Board parseStartPosition(String fen);

    String toFen(Board position);

    boolean isCheck(Board position);

    boolean isCheckmate(Board position);

    /**
     * The legal move from {@code from} to {@code to}; a pawn reaching the last rank promotes to a
     * queen.
     */
    Optional<Move> legalMove(Board position, int from, int to);

    /** Legal destination squares of the piece on {@code from}, ascending. */
    List<Integer> hints(Board position, int from);

    /** The subset of {@link #hints} that captures a piece (en passant included). */
    List<Integer> captures(Board position, int from);
}
