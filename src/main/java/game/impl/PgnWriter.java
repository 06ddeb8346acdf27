package game.impl;

import game.contracts.GameVisitor;
import game.records.PgnSettings;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import rules.Board;
import rules.Move;
import rules.contracts.RulesEngine;

/**
 * Renders a game tree as PGN lines.
 *
 * <p>Movetext tokens go into a line buffer that is flushed before a token would push it past
 * {@link PgnSettings#maxWidth()}. Header lines are never wrapped.
 *
 * <p>White's moves always carry their number. Black's move carries {@code N...} only as the first
 * move of the game or after a comment or a parenthesis, where a reader would otherwise lose track
 * of the move number.
 */
public final class PgnWriter implements GameVisitor<List<String>> {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final RulesEngine rules;
    private final PgnSettings settings;

    private List<String> lines = new ArrayList<>();
    private final StringBuilder line = new StringBuilder();
    private boolean forceNumber;

    public PgnWriter(RulesEngine rules, PgnSettings settings) {
        this.rules = rules;
        this.settings = settings;
    }

    /* ── line buffer ───────────────────────────────────────────── */

    private void flush() {
        String done = line.toString().trim();
        line.setLength(0);
        if (!done.isEmpty()) lines.add(done);
    }

    private void token(String token) {
        if (settings.wraps()) {
            int max = settings.maxWidth();
            if (max < line.length() || max - line.length() < token.length()) flush();
        }
        line.append(token);
    }

    private void fullLine(String text) {
        flush();
        lines.add(text.trim());
    }

    /* ── GameVisitor ───────────────────────────────────────────── */

    @Override
    public void beginGame() {
        lines = new ArrayList<>();
        line.setLength(0);
        // a game set up with Black to move opens with "N..."
        forceNumber = true;
    }

    @Override
    public void beginHeaders() {
        // header lines are written one by one
    }

    @Override
    public void visitHeader(String key, String value) {
        fullLine("[" + key + " \"" + escape(value) + "\"]");
    }

    @Override
    public void endHeaders() {
        fullLine("");
    }

    @Override
    public void visitMove(Board before, Move move) {
        String prefix;
        if (before.whiteToMove()) prefix = before.fullmoveNumber() + ". ";
        else if (forceNumber) prefix = before.fullmoveNumber() + "... ";
        else prefix = "";

        token(prefix + rules.moveToNotation(before, move) + " ");
        forceNumber = false;
    }

    @Override
    public void visitComment(String comment) {
        if (!settings.includeComments()) return;
        // a closing brace cannot be escaped inside a PGN comment; line breaks would split the line
        String text = WHITESPACE.matcher(comment.trim()).replaceAll(" ").replace('}', ')');
        token("{ " + text + " } ");
        forceNumber = true;
    }

    @Override
    public void visitNag(int nag) {
        if (settings.includeNags()) token("$" + nag + " ");
    }

    @Override
    public boolean beginVariation() {
        if (!settings.includeVariations()) return true;
        forceNumber = true;
        token("( ");
        return false;
    }

    @Override
    public void endVariation() {
        forceNumber = true;
        token(") ");
    }

    @Override
    public void visitResult(String result) {
        token(result + " ");
    }

    @Override
    public List<String> endGame() {
        flush();
        List<String> out = lines;
        lines = new ArrayList<>();
        return out;
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
