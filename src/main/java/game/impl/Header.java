package game.impl;

import static game.constants.PgnConstants.*;

import game.records.GameResult;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The Seven Tag Roster of a game. Every text field is optional; an unknown value is stored as
 * absent and exported as {@code ?} (or {@code ????.??.??} for the date).
 */
public final class Header {

    private String event;
    private String site;
    private String date;
    private String round;
    private String white;
    private String black;
    private GameResult result = GameResult.ONGOING;

    /* ── accessors ─────────────────────────────────────────────── */

    public Optional<String> event() { return Optional.ofNullable(event); }
    public Optional<String> site()  { return Optional.ofNullable(site); }
    public Optional<String> date()  { return Optional.ofNullable(date); }
    public Optional<String> round() { return Optional.ofNullable(round); }
    public Optional<String> white() { return Optional.ofNullable(white); }
    public Optional<String> black() { return Optional.ofNullable(black); }
    public GameResult result()      { return result; }

    /* ── mutators: null or an unknown marker clears the field ─── */

    public void setEvent(String v) { event = known(v); }
    public void setSite(String v)  { site  = known(v); }
    public void setRound(String v) { round = known(v); }
    public void setWhite(String v) { white = known(v); }
    public void setBlack(String v) { black = known(v); }

    public void setDate(String v) {
        date = UNKNOWN_DATE.equals(v) ? null : known(v);
    }

    public void setResult(GameResult r) {
        result = r == null ? GameResult.ONGOING : r;
    }

    /**
     * Stores {@code value} if {@code key} is one of the seven roster tags.
     *
     * @return {@code false} for any other key, leaving the header untouched
     */
    public boolean parse(String key, String value) {
        switch (key) {
            case TAG_EVENT  -> setEvent(value);
            case TAG_SITE   -> setSite(value);
            case TAG_DATE   -> setDate(value);
            case TAG_ROUND  -> setRound(value);
            case TAG_WHITE  -> setWhite(value);
            case TAG_BLACK  -> setBlack(value);
            case TAG_RESULT -> setResult(GameResult.parse(value));
            default -> { return false; }
        }
        return true;
    }

    /** The seven tags in roster order, unknown values filled with their export markers. */
    public Map<String, String> tags() {
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put(TAG_EVENT,  event().orElse(UNKNOWN));
        tags.put(TAG_SITE,   site().orElse(UNKNOWN));
        tags.put(TAG_DATE,   date().orElse(UNKNOWN_DATE));
        tags.put(TAG_ROUND,  round().orElse(UNKNOWN));
        tags.put(TAG_WHITE,  white().orElse(UNKNOWN));
        tags.put(TAG_BLACK,  black().orElse(UNKNOWN));
        tags.put(TAG_RESULT, result.toString());
        return tags;
    }

    private static String known(String v) {
        if (v == null) return null;
        String s = v.trim();
        return s.isEmpty() || UNKNOWN.equals(s) || UNKNOWN_ALT.equals(s) ? null : s;
    }

    @Override
    public String toString() {
        return tags().toString();
    }
}
