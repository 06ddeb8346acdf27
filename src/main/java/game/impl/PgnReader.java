package game.impl;

import static game.constants.PgnConstants.TAG_FEN;
import static game.constants.PgnConstants.TAG_RESULT;

import game.PgnFormatException;
import game.contracts.Diagnostics;
import game.contracts.PgnVisitor;
import game.records.Diagnostic;
import game.records.GameResult;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rules.Board;
import rules.Move;
import rules.contracts.RulesEngine;
import rules.impl.RulesEngineImpl;

/**
 * Builds a {@link GameTree} from tokenizer events.
 *
 * <p>The reader keeps a stack of insertion points. Each {@code (} pushes the parent of the
 * current node, because a variation replaces the move just played; each {@code )} pops back to
 * where the enclosing line left off, so a comment after {@code )} annotates the move before
 * {@code (} again.
 *
 * <p>A comment right after a move annotates that move. A comment at the start of a variation,
 * before its first move, is held back and becomes the starting comment of that first move.
 *
 * <p>Not thread-safe; one reader handles one game at a time but may be reused.
 */
public final class PgnReader implements PgnVisitor<GameTree> {

    private static final Logger LOGGER = LoggerFactory.getLogger(PgnReader.class);

    private final RulesEngine rules;
    private final Diagnostics diagnostics;

    /* ── per-game state ────────────────────────────────────────── */
    private GameTree tree;
    private final List<Integer> stack = new ArrayList<>();
    /** {@link #afterMove} of each enclosing line, restored when its variation closes. */
    private final List<Boolean> resume = new ArrayList<>();
    private boolean afterMove;
    private String pendingComment;
    private boolean resultTagSeen;

    public PgnReader() {
        this(new RulesEngineImpl(), LoggingDiagnostics.INSTANCE);
    }

    public PgnReader(RulesEngine rules, Diagnostics diagnostics) {
        this.rules = rules;
        this.diagnostics = diagnostics;
    }

    /**
     * Parses the first game of {@code pgn}.
     *
     * @throws PgnFormatException if there is no game or the text is structurally unreadable
     */
    public GameTree read(String pgn) {
        return new PgnTokenizer(pgn).readGame(this)
                .orElseThrow(() -> new PgnFormatException("no game found"));
    }

    /**
     * Parses every game of a multi-game file, in order.
     *
     * @throws PgnFormatException if there is no game or the text is structurally unreadable
     */
    public List<GameTree> readAll(String pgn) {
        PgnTokenizer tokenizer = new PgnTokenizer(pgn);
        List<GameTree> games = new ArrayList<>();
        while (tokenizer.hasNextGame()) {
            tokenizer.readGame(this).ifPresent(games::add);
        }
        if (games.isEmpty()) throw new PgnFormatException("no game found");
        LOGGER.debug("read {} games", games.size());
        return games;
    }

    /* ── PgnVisitor ────────────────────────────────────────────── */

    @Override
    public void beginGame() {
        tree = new GameTree(rules, diagnostics);
        stack.clear();
        stack.add(tree.root().id());
        resume.clear();
        afterMove = false;
        pendingComment = null;
        resultTagSeen = false;
    }

    @Override
    public void header(String key, String value) {
        if (TAG_FEN.equals(key)) setUp(value);
        if (TAG_RESULT.equals(key)) resultTagSeen = true;
        if (!tree.header().parse(key, value)) tree.putExtraHeader(key, value);
    }

    private void setUp(String fen) {
        Board position;
        try {
            position = rules.parseStartPosition(fen);
        } catch (IllegalArgumentException e) {
            report(Diagnostic.Kind.MALFORMED_INPUT, -1, "bad FEN '" + fen + "': " + e.getMessage());
            return;
        }
        tree.resetStartingPosition(position);
        stack.clear();
        stack.add(tree.root().id());
        resume.clear();
    }

    @Override
    public void endHeaders() {
        // nothing buffered
    }

    @Override
    public void san(String token) {
        int top = top();
        Board board = tree.boardOf(top);
        Move move = rules.notationToMove(board, token).orElse(null);
        if (move == null) {
            report(Diagnostic.Kind.MALFORMED_INPUT, top, "cannot play '" + token + "' in " + rules.toFen(board));
            return;
        }

        int next = tree.extend(top, move);
        if (pendingComment != null) tree.setStartingComment(next, pendingComment);
        pendingComment = null;
        stack.set(stack.size() - 1, next);
        afterMove = true;
    }

    @Override
    public void nag(int code) {
        int top = top();
        if (!tree.editNag(top, code, true) && tree.parentId(top) < 0) {
            report(Diagnostic.Kind.MALFORMED_INPUT, top, "glyph $" + code + " before any move");
        }
    }

    @Override
    public void comment(String text) {
        String comment = text.trim();
        int top = top();
        boolean gameComment = tree.parentId(top) < 0 && tree.childIds(top).isEmpty();

        if (afterMove || gameComment) {
            appendComment(top, comment);
        } else {
            pendingComment = pendingComment == null ? comment : pendingComment + " " + comment;
        }
    }

    @Override
    public boolean beginVariation() {
        int top = top();
        int branch = tree.parentId(top);
        if (branch < 0) {
            report(Diagnostic.Kind.VARIATION_UNDERFLOW, top, "variation before any move, skipped");
            return true;
        }
        stack.add(branch);
        resume.add(afterMove);
        afterMove = false;
        return false;
    }

    @Override
    public void endVariation() {
        if (stack.size() <= 1) {
            report(Diagnostic.Kind.VARIATION_UNDERFLOW, top(), "unmatched ')' ignored");
            return;
        }
        flushPendingComment();
        stack.remove(stack.size() - 1);
        afterMove = resume.remove(resume.size() - 1);
    }

    @Override
    public void outcome(String result) {
        if (!resultTagSeen) tree.header().setResult(GameResult.parse(result));
    }

    @Override
    public GameTree endGame() {
        flushPendingComment();
        GameTree done = tree;
        tree = null;
        stack.clear();
        resume.clear();
        LOGGER.debug("read game with {} nodes", done.nodeCount());
        return done;
    }

    /* ── helpers ───────────────────────────────────────────────── */

    private int top() {
        if (stack.isEmpty()) throw new IllegalStateException("variation stack empty");
        return stack.get(stack.size() - 1);
    }

    /** A starting comment that never met its move stays with the position it was written at. */
    private void flushPendingComment() {
        if (pendingComment == null) return;
        appendComment(top(), pendingComment);
        pendingComment = null;
    }

    private void appendComment(int id, String comment) {
        String old = tree.comment(id);
        tree.setComment(id, old == null ? comment : old + " " + comment);
    }

    private void report(Diagnostic.Kind kind, int nodeId, String message) {
        diagnostics.report(new Diagnostic(kind, nodeId, message));
    }
}
