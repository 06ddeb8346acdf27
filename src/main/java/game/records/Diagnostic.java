package game.records;

/**
 * A recoverable problem noticed while editing or importing a game.
 *
 * @param kind    what went wrong
 * @param nodeId  arena id of the node involved, or {@code -1}
 * @param message human-readable detail
 */
public record Diagnostic(Kind kind, int nodeId, String message) {

    public enum Kind {
        /** Promote/remove of a node that is not a child of its claimed parent, or of the root. */
        STRUCTURAL_MISUSE,
        /** A token that could not be used (unresolvable move, bad FEN, stray bracket). */
        MALFORMED_INPUT,
        /** A variation opened at the root or closed with nothing open. */
        VARIATION_UNDERFLOW
    }

    @Override
    public String toString() {
        return nodeId < 0 ? kind + ": " + message : kind + " (node " + nodeId + "): " + message;
    }
}
