package game.records;

/**
 * Immutable set of <em>export options</em>.
 *
 * Use the nested {@link Builder} to construct an instance of this record.
 *
 * @param maxWidth          Wrap movetext before a line would exceed this many characters (0 = never).
 * @param includeComments   Emit game, move and starting comments.
 * @param includeNags       Emit numeric annotation glyphs.
 * @param includeVariations Emit side lines; {@code false} exports the mainline only.
 */
public record PgnSettings(
        int maxWidth,
        boolean includeComments,
        boolean includeNags,
        boolean includeVariations
) {
    public static final PgnSettings DEFAULT = new Builder().build();

    public PgnSettings {
        if (maxWidth < 0) throw new IllegalArgumentException("maxWidth must be >= 0");
    }

    public boolean wraps() {
        return maxWidth > 0;
    }

    public PgnSettings withMaxWidth(int width) {
        return new PgnSettings(width, includeComments, includeNags, includeVariations);
    }

    /**
     * Reads {@code pgn.maxWidth}, {@code pgn.comments}, {@code pgn.nags} and {@code pgn.variations},
     * falling back to the defaults for anything unset or unparsable.
     */
    public static PgnSettings fromSystemProperties() {
        Builder b = new Builder();
        b.maxWidth(Math.max(0, toInt(System.getProperty("pgn.maxWidth"), 0)));
        b.includeComments(Boolean.parseBoolean(System.getProperty("pgn.comments", "true")));
        b.includeNags(Boolean.parseBoolean(System.getProperty("pgn.nags", "true")));
        b.includeVariations(Boolean.parseBoolean(System.getProperty("pgn.variations", "true")));
        return b.build();
    }

    private static int toInt(String s, int d) {
        if (s == null) return d;
        try { return Integer.parseInt(s.trim()); } catch (NumberFormatException e) { return d; }
    }

    public static class Builder {
        private int maxWidth = 0;
        private boolean includeComments = true;
        private boolean includeNags = true;
        private boolean includeVariations = true;

        public Builder maxWidth(int maxWidth) { this.maxWidth = maxWidth; return this; }
        public Builder includeComments(boolean includeComments) { this.includeComments = includeComments; return this; }
        public Builder includeNags(boolean includeNags) { this.includeNags = includeNags; return this; }
        public Builder includeVariations(boolean includeVariations) { this.includeVariations = includeVariations; return this; }

        public PgnSettings build() {
            return new PgnSettings(maxWidth, includeComments, includeNags, includeVariations);
        }
    }
}
