package game;

/**
 * Thrown when PGN text is structurally unreadable: no game at all, an unterminated comment or an
 * unterminated header. Recoverable token-level problems are reported as diagnostics instead.
 */
public class PgnFormatException extends RuntimeException {

    private final int offset;

    public PgnFormatException(String message) {
        this(message, -1);
    }

    public PgnFormatException(String message, int offset) {
        super(offset < 0 ? message : message + " (at offset " + offset + ")");
        this.offset = offset;
    }

    /** Character offset into the input where the problem starts, or {@code -1}. */
    public int offset() {
        return offset;
    }
}
