package game.contracts;

import rules.Board;
import rules.Move;

/**
 * Walks a finished game tree, the export-side counterpart of {@link PgnVisitor}.
 *
 * <p>The tree calls, in order: {@link #beginGame()}, the header block, the game comment, the
 * movetext and {@link #visitResult}, then {@link #endGame()}. For every node with children the
 * movetext visits the mainline child's move, each side line wrapped in
 * {@link #beginVariation()}/{@link #endVariation()}, and finally continues down the mainline.</p>
 *
 * @param <R> what the visitor produces
 */
public interface GameVisitor<R> {

    void beginGame();

    void beginHeaders();

    void visitHeader(String key, String value);

    void endHeaders();

    /**
     * @param before the position the move is played from
     * @param move   a legal move in {@code before}
     */
    void visitMove(Board before, Move move);

    void visitComment(String comment);

    void visitNag(int nag);

    /** @return {@code true} to leave this side line out of the traversal */
    boolean beginVariation();

    void endVariation();

    void visitResult(String result);

    R endGame();
}
