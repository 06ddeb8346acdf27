package game.impl;

import static game.constants.PgnConstants.*;

import game.PgnFormatException;
import game.contracts.PgnVisitor;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexes PGN text into {@link PgnVisitor} events, one game per {@link #readGame} call.
 *
 * <p>Tolerant by default: stray brackets, unknown symbols and out-of-range glyphs are dropped.
 * Only an unterminated comment or header line makes the text unreadable.
 */
public final class PgnTokenizer {

    private static final Pattern MOVE_NUMBER = Pattern.compile("^(\\d+\\.+|\\.+)");
    private static final Pattern DIGITS      = Pattern.compile("\\d+");
    private static final Pattern SUFFIX      = Pattern.compile("[!?]+$");

    private final String text;
    private int pos;

    public PgnTokenizer(String text) {
        // a leading byte order mark is not part of the first header
        this.text = text.startsWith("\uFEFF") ? text.substring(1) : text;
    }

    /** {@code true} if anything but whitespace and escape lines is left. */
    public boolean hasNextGame() {
        skipBlank();
        return pos < text.length();
    }

    /**
     * Feeds the next game to {@code visitor}.
     *
     * @return what {@link PgnVisitor#endGame()} produced, or empty if no game is left
     * @throws PgnFormatException on an unterminated comment or header
     */
    public <R> Optional<R> readGame(PgnVisitor<R> visitor) {
        if (!hasNextGame()) return Optional.empty();

        visitor.beginGame();
        readHeaders(visitor);
        visitor.endHeaders();
        readMovetext(visitor);
        return Optional.ofNullable(visitor.endGame());
    }

    /* ── header section ────────────────────────────────────────── */

    private void readHeaders(PgnVisitor<?> visitor) {
        while (true) {
            skipBlank();
            if (pos >= text.length() || text.charAt(pos) != '[') return;
            readHeader(visitor);
        }
    }

    private void readHeader(PgnVisitor<?> visitor) {
        int start = pos++;
        skipSpaces();

        int keyStart = pos;
        while (pos < text.length() && !isSpace(text.charAt(pos))
                && text.charAt(pos) != '"' && text.charAt(pos) != ']') pos++;
        String key = text.substring(keyStart, pos);
        skipSpaces();

        StringBuilder value = new StringBuilder();
        if (pos < text.length() && text.charAt(pos) == '"') {
            pos++;
            while (true) {
                if (pos >= text.length()) throw new PgnFormatException("unterminated header", start);
                char c = text.charAt(pos++);
                if (c == '"') break;
                if (c == '\\' && pos < text.length()) c = text.charAt(pos++);
                value.append(c);
            }
        }

        int close = text.indexOf(']', pos);
        if (close < 0) throw new PgnFormatException("unterminated header", start);
        pos = close + 1;

        if (!key.isEmpty()) visitor.header(key, value.toString());
    }

    /* ── movetext ──────────────────────────────────────────────── */

    private void readMovetext(PgnVisitor<?> visitor) {
        while (true) {
            skipBlank();
            if (pos >= text.length()) return;

            char c = text.charAt(pos);
            switch (c) {
                case '{' -> visitor.comment(readBraceComment());
                case ';' -> visitor.comment(readLineComment());
                case '(' -> {
                    pos++;
                    if (visitor.beginVariation()) skipVariation();
                }
                case ')' -> {
                    pos++;
                    visitor.endVariation();
                }
                case '[' -> {
                    // next game's headers
                    return;
                }
                case '$' -> readNag(visitor);
                default -> {
                    if (isDelimiter(c)) {
                        pos++;
                    } else if (readSymbol(visitor)) {
                        return;
                    }
                }
            }
        }
    }

    private String readBraceComment() {
        int start = pos;
        int close = text.indexOf('}', pos + 1);
        if (close < 0) throw new PgnFormatException("unterminated comment", start);
        pos = close + 1;
        return text.substring(start + 1, close);
    }

    private String readLineComment() {
        int eol = text.indexOf('\n', pos);
        int end = eol < 0 ? text.length() : eol;
        String comment = text.substring(pos + 1, end);
        pos = end;
        return comment;
    }

    private void readNag(PgnVisitor<?> visitor) {
        int start = ++pos;
        while (pos < text.length() && Character.isDigit(text.charAt(pos))) pos++;
        String digits = text.substring(start, pos);
        if (!digits.isEmpty() && digits.length() <= 3) {
            int nag = Integer.parseInt(digits);
            if (nag > 0 && nag <= MAX_NAG) visitor.nag(nag);
        }
    }

    /**
     * Reads one move, move number, suffix annotation or result token.
     *
     * @return {@code true} if the token ended the game
     */
    private boolean readSymbol(PgnVisitor<?> visitor) {
        int start = pos;
        while (pos < text.length() && !isDelimiter(text.charAt(pos))) pos++;
        String token = text.substring(start, pos);

        if (RESULT_TOKENS.contains(token)) {
            visitor.outcome(token);
            return true;
        }

        Matcher number = MOVE_NUMBER.matcher(token);
        if (number.find()) token = token.substring(number.end());
        if (token.isEmpty() || DIGITS.matcher(token).matches()) return false;

        String suffix = "";
        Matcher annotation = SUFFIX.matcher(token);
        if (annotation.find()) {
            suffix = annotation.group();
            token = token.substring(0, annotation.start());
        }

        if (!token.isEmpty()) visitor.san(token);
        Integer nag = SUFFIX_NAGS.get(suffix);
        if (nag != null) visitor.nag(nag);
        return false;
    }

    /** Drops everything up to the parenthesis matching one already consumed. */
    private void skipVariation() {
        int depth = 1;
        while (pos < text.length() && depth > 0) {
            char c = text.charAt(pos);
            switch (c) {
                case '{' -> readBraceComment();
                case ';' -> readLineComment();
                case '(' -> { depth++; pos++; }
                case ')' -> { depth--; pos++; }
                default -> pos++;
            }
        }
    }

    /* ── scanning helpers ──────────────────────────────────────── */

    /** Skips whitespace and {@code %} escape lines. */
    private void skipBlank() {
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (isSpace(c)) {
                pos++;
            } else if (c == '%' && (pos == 0 || text.charAt(pos - 1) == '\n')) {
                int eol = text.indexOf('\n', pos);
                pos = eol < 0 ? text.length() : eol + 1;
            } else {
                return;
            }
        }
    }

    private void skipSpaces() {
        while (pos < text.length() && isSpace(text.charAt(pos))) pos++;
    }

    private static boolean isSpace(char c) {
        return Character.isWhitespace(c);
    }

    private static boolean isDelimiter(char c) {
        return isSpace(c) || "{}();[]$".indexOf(c) >= 0;
    }
}
