package game.records;

/**
 * Outcome recorded in the {@code Result} header and after the movetext.
 *
 * <p>Scores are kept in half-points so draws survive: {@code 1/2-1/2} is {@code (1, 1)},
 * {@code 1-0} is {@code (2, 0)}.
 *
 * @param finished        {@code false} for a game still in progress ({@code *})
 * @param whiteHalfPoints White's score times two
 * @param blackHalfPoints Black's score times two
 */
public record GameResult(boolean finished, int whiteHalfPoints, int blackHalfPoints) {

    public static final GameResult ONGOING   = new GameResult(false, 0, 0);
    public static final GameResult WHITE_WON = new GameResult(true, 2, 0);
    public static final GameResult BLACK_WON = new GameResult(true, 0, 2);
    public static final GameResult DRAW      = new GameResult(true, 1, 1);

    public GameResult {
        if (whiteHalfPoints < 0 || blackHalfPoints < 0)
            throw new IllegalArgumentException("negative score");
    }

    /** Anything that is not {@code a-b} with non-negative scores reads as {@link #ONGOING}. */
    public static GameResult parse(String value) {
        if (value == null) return ONGOING;
        String[] parts = value.trim().split("-");
        if (parts.length != 2) return ONGOING;

        int white = halfPoints(parts[0]);
        int black = halfPoints(parts[1]);
        if (white < 0 || black < 0) return ONGOING;
        return new GameResult(true, white, black);
    }

    /** "1" → 2, "1/2" → 1, "½" → 1, anything else → -1. */
    private static int halfPoints(String score) {
        String s = score.trim();
        if (s.equals("½")) return 1;
        try {
            if (s.endsWith("/2")) return Integer.parseInt(s.substring(0, s.length() - 2));
            return Math.multiplyExact(Integer.parseInt(s), 2);
        } catch (NumberFormatException | ArithmeticException e) {
            return -1;
        }
    }

    private static String score(int halfPoints) {
        return halfPoints % 2 == 0 ? Integer.toString(halfPoints / 2) : halfPoints + "/2";
    }

    /** {@code "1-0"}, {@code "1/2-1/2"} or {@code "*"}. */
    @Override
    public String toString() {
        return finished ? score(whiteHalfPoints) + "-" + score(blackHalfPoints) : "*";
    }
}
