package rules.impl;

import static rules.contracts.MoveGenerator.*;
import static rules.contracts.PositionFactory.*;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import rules.Move;
import rules.Piece;
import rules.constants.RulesConstants;
import rules.contracts.PositionFactory;

/**
 * Standard Algebraic Notation for packed moves.
 *
 * <p>Formatting uses minimal disambiguation (file, then rank, then both). Parsing tolerates
 * {@code 0-0}, a promotion without {@code =}, and any trailing {@code +#!?}.
 */
final class SanCodec {

  /* piece letter? from-file? from-rank? capture? to-square promotion? */
  private static final Pattern SAN =
          Pattern.compile("([NBRQK])?([a-h])?([1-8])?(x)?([a-h][1-8])(?:=?([NBRQnbrq]))?");

  private final RulesEngineImpl rules;

  SanCodec(RulesEngineImpl rules) {
    this.rules = rules;
  }

  /* ── formatting ───────────────────────────────────────────────── */

  String format(long[] bb, int mv) {
    StringBuilder sb = new StringBuilder(8);
    int from  = moveFrom(mv);
    int to    = moveTo(mv);
    int type  = moveType(mv);
    int mover = moveMover(mv);
    Piece.Type kind = Piece.fromIndex(mover).type();

    if (type == TYPE_CASTLE) {
      sb.append((to & 7) == 6 ? RulesConstants.CASTLE_KING_SIDE : RulesConstants.CASTLE_QUEEN_SIDE);
    } else {
      boolean capture = type == TYPE_EN_PASSANT || (occupancy(bb) & (1L << to)) != 0;
      if (kind == Piece.Type.PAWN) {
        if (capture) sb.append((char) ('a' + (from & 7)));
      } else {
        sb.append(kind.letter());
        sb.append(disambiguation(bb, mv));
      }
      if (capture) sb.append('x');
      sb.append(Move.squareName(to));
      if (type == TYPE_PROMOTION) {
        sb.append('=').append(Piece.Type.values()[Piece.Type.KNIGHT.ordinal() + movePromo(mv)].letter());
      }
    }

    long[] after = bb.clone();
    rules.positionFactory().makeMoveInPlace(after, mv);
    boolean them = PositionFactory.whiteToMove(after[META]);
    if (rules.moveGenerator().kingAttacked(after, them)) {
      int replies = rules.generateLegal(after, new int[RulesConstants.MAX_MOVES]);
      sb.append(replies == 0 ? '#' : '+');
    }
    return sb.toString();
  }

  private String disambiguation(long[] bb, int mv) {
    int from = moveFrom(mv), to = moveTo(mv), mover = moveMover(mv);
    int[] list = new int[RulesConstants.MAX_MOVES];
    int n = rules.generateLegal(bb, list);

    boolean clash = false, sameFile = false, sameRank = false;
    for (int i = 0; i < n; i++) {
      int other = list[i];
      if (other == mv || moveMover(other) != mover || moveTo(other) != to) continue;
      int otherFrom = moveFrom(other);
      if (otherFrom == from) continue;
      clash = true;
      if ((otherFrom & 7) == (from & 7)) sameFile = true;
      if ((otherFrom >>> 3) == (from >>> 3)) sameRank = true;
    }
    if (!clash) return "";
    if (!sameFile) return String.valueOf((char) ('a' + (from & 7)));
    if (!sameRank) return String.valueOf((char) ('1' + (from >>> 3)));
    return Move.squareName(from);
  }

  /* ── parsing ──────────────────────────────────────────────────── */

  /** @return the unique legal packed move matching {@code text} */
  Optional<Integer> parse(long[] bb, String text) {
    if (text == null) return Optional.empty();
    String s = text.trim().replaceAll("[+#!?]+$", "");
    if (s.isEmpty()) return Optional.empty();

    int[] list = new int[RulesConstants.MAX_MOVES];
    int n = rules.generateLegal(bb, list);

    boolean kingSide  = s.equals("O-O") || s.equals("0-0");
    boolean queenSide = s.equals("O-O-O") || s.equals("0-0-0");
    if (kingSide || queenSide) {
      for (int i = 0; i < n; i++) {
        int mv = list[i];
        if (moveType(mv) == TYPE_CASTLE && ((moveTo(mv) & 7) == 6) == kingSide) return Optional.of(mv);
      }
      return Optional.empty();
    }

    Matcher m = SAN.matcher(s);
    if (!m.matches()) return Optional.empty();

    Piece.Type kind = m.group(1) == null ? Piece.Type.PAWN : Piece.Type.fromLetter(m.group(1).charAt(0));
    int fromFile = m.group(2) == null ? -1 : m.group(2).charAt(0) - 'a';
    int fromRank = m.group(3) == null ? -1 : m.group(3).charAt(0) - '1';
    int to = Move.squareIndex(m.group(5));
    Piece.Type promo = m.group(6) == null ? null : Piece.Type.fromLetter(m.group(6).charAt(0));

    int found = 0, hits = 0;
    for (int i = 0; i < n; i++) {
      int mv = list[i];
      if (moveTo(mv) != to || moveType(mv) == TYPE_CASTLE) continue;
      if (Piece.fromIndex(moveMover(mv)).type() != kind) continue;
      int from = moveFrom(mv);
      if (fromFile >= 0 && (from & 7) != fromFile) continue;
      if (fromRank >= 0 && (from >>> 3) != fromRank) continue;

      boolean isPromo = moveType(mv) == TYPE_PROMOTION;
      if (isPromo != (promo != null)) continue;
      if (isPromo && Piece.Type.KNIGHT.ordinal() + movePromo(mv) != promo.ordinal()) continue;

      found = mv;
      hits++;
    }
    return hits == 1 ? Optional.of(found) : Optional.empty();
  }

  private static long occupancy(long[] bb) {
    long occ = 0;
    for (int i = WP; i <= BK; ++i) occ |= bb[i];
    return occ;
  }
}
