package game.constants;

import java.util.List;
import java.util.Map;

/**
 * Central place for PGN notation constants.
 */
public final class PgnConstants {

    private PgnConstants() {}

    /* ────────────── Seven Tag Roster ────────────── */
    public static final String TAG_EVENT  = "Event";
    public static final String TAG_SITE   = "Site";
    public static final String TAG_DATE   = "Date";
    public static final String TAG_ROUND  = "Round";
    public static final String TAG_WHITE  = "White";
    public static final String TAG_BLACK  = "Black";
    public static final String TAG_RESULT = "Result";

    public static final List<String> SEVEN_TAG_ROSTER =
            List.of(TAG_EVENT, TAG_SITE, TAG_DATE, TAG_ROUND, TAG_WHITE, TAG_BLACK, TAG_RESULT);

    /* ────────────── set-up tags ────────────── */
    public static final String TAG_FEN   = "FEN";
    public static final String TAG_SETUP = "SetUp";

    /* ────────────── unknown-value sentinels ────────────── */
    public static final String UNKNOWN      = "?";
    public static final String UNKNOWN_ALT  = "??";
    public static final String UNKNOWN_DATE = "????.??.??";

    /* ────────────── game termination markers ────────────── */
    public static final List<String> RESULT_TOKENS = List.of("1-0", "0-1", "1/2-1/2", "*");

    /* ────────────── suffix annotations → NAG ────────────── */
    public static final int NAG_GOOD        = 1; // !
    public static final int NAG_MISTAKE     = 2; // ?
    public static final int NAG_BRILLIANT   = 3; // !!
    public static final int NAG_BLUNDER     = 4; // ??
    public static final int NAG_SPECULATIVE = 5; // !?
    public static final int NAG_DUBIOUS     = 6; // ?!

    public static final Map<String, Integer> SUFFIX_NAGS = Map.of(
            "!",  NAG_GOOD,
            "?",  NAG_MISTAKE,
            "!!", NAG_BRILLIANT,
            "??", NAG_BLUNDER,
            "!?", NAG_SPECULATIVE,
            "?!", NAG_DUBIOUS);

    /** NAGs are a single byte in the export format. */
    public static final int MAX_NAG = 255;
}
