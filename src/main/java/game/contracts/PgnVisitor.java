package game.contracts;

/**
 * Receives the structural events of one PGN game, in text order.
 *
 * <p>The tokenizer calls {@link #beginGame()} first and {@link #endGame()} last; everything in
 * between follows the input. Header events always precede movetext events.</p>
 *
 * @param <R> what the visitor builds from the game
 */
public interface PgnVisitor<R> {

    void beginGame();

    /** One {@code [Key "value"]} line, value already unescaped. */
    void header(String key, String value);

    /** Called once, after the last header and before any movetext event. */
    void endHeaders();

    /** A move in SAN, with move numbers and suffix annotations already stripped. */
    void san(String token);

    void nag(int code);

    /** Text of a brace or rest-of-line comment, without the delimiters. */
    void comment(String text);

    /**
     * An opening parenthesis.
     *
     * @return {@code true} to skip everything up to the matching closing parenthesis; no
     *     {@link #endVariation()} is delivered for a skipped variation
     */
    boolean beginVariation();

    void endVariation();

    /** The game termination marker ({@code 1-0}, {@code 0-1}, {@code 1/2-1/2} or {@code *}). */
    void outcome(String result);

    R endGame();
}
