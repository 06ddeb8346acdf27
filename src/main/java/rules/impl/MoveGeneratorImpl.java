package rules.impl;

import static rules.contracts.MoveGenerator.*;
import static rules.contracts.PositionFactory.*;

import rules.contracts.MoveGenerator;
import rules.contracts.PositionFactory;

/**
 * Pseudo-legal move generator over packed positions.
 *
 * <p>• Emits full promotion set Q/R/B/N<br>
 * • Castles only through unattacked squares<br>
 * • Other king-safety checks are left to the caller (play the move, then {@link #kingAttacked})
 */
public final class MoveGeneratorImpl implements MoveGenerator {
  /* ── bit-board constants ─────────────────────────────────────── */
  private static final long RANK_1 = 0xFFL;
  private static final long RANK_2 = RANK_1 << 8;
  private static final long RANK_7 = RANK_1 << 48;
  private static final long RANK_8 = RANK_1 << 56;

  /* ── attack tables, filled once ─────────────────────────────── */
  static final long[] KNIGHT_ATK = new long[64];
  static final long[] KING_ATK   = new long[64];
  /** squares a white / black pawn on sq attacks */
  static final long[] PAWN_ATK_W = new long[64];
  static final long[] PAWN_ATK_B = new long[64];

  private static final int[][] KNIGHT_STEPS = {{1, 2}, {2, 1}, {2, -1}, {1, -2}, {-1, -2}, {-2, -1}, {-2, 1}, {-1, 2}};
  private static final int[][] KING_STEPS   = {{1, 0}, {1, 1}, {0, 1}, {-1, 1}, {-1, 0}, {-1, -1}, {0, -1}, {1, -1}};
  private static final int[][] ROOK_DIRS    = {{1, 0}, {-1, 0}, {0, 1}, {0, -1}};
  private static final int[][] BISHOP_DIRS  = {{1, 1}, {1, -1}, {-1, 1}, {-1, -1}};

  static {
    for (int sq = 0; sq < 64; ++sq) {
      KNIGHT_ATK[sq] = stepTargets(sq, KNIGHT_STEPS);
      KING_ATK[sq]   = stepTargets(sq, KING_STEPS);
      PAWN_ATK_W[sq] = stepTargets(sq, new int[][] {{-1, 1}, {1, 1}});
      PAWN_ATK_B[sq] = stepTargets(sq, new int[][] {{-1, -1}, {1, -1}});
    }
  }

  private static long stepTargets(int sq, int[][] steps) {
    int file = sq & 7, rank = sq >>> 3;
    long bits = 0;
    for (int[] s : steps) {
      int f = file + s[0], r = rank + s[1];
      if (f >= 0 && f < 8 && r >= 0 && r < 8) bits |= 1L << (r * 8 + f);
    }
    return bits;
  }

  /* ── public entry point ───────────────────────────────────────── */
  @Override
  public int generatePseudoLegal(long[] bb, int[] mv, int n) {
    final boolean white = PositionFactory.whiteToMove(bb[META]);

    /* side-dependant indexes once ------------------------------------ */
    final int usP = white ? WP : BP,  usN = white ? WN : BN,
            usB = white ? WB : BB,  usR = white ? WR : BR,
            usQ = white ? WQ : BQ,  usK = white ? WK : BK;

    /* board masks ---------------------------------------------------- */
    long own   = white ? (bb[WP]|bb[WN]|bb[WB]|bb[WR]|bb[WQ]|bb[WK])
            : (bb[BP]|bb[BN]|bb[BB]|bb[BR]|bb[BQ]|bb[BK]);
    long enemy = white ? (bb[BP]|bb[BN]|bb[BB]|bb[BR]|bb[BQ]|bb[BK])
            : (bb[WP]|bb[WN]|bb[WB]|bb[WR]|bb[WQ]|bb[WK]);
    long occ        = own | enemy;
    long allTargets = ~own;

    /* 1 ───────── PAWNS (pushes + captures + EP) ──────────────────── */
    n = addPawnPushes(bb[usP], white, occ, mv, n, usP);
    n = addPawnCaptures(bb, white, enemy, mv, n, usP);

    /* 2 ───────── KNIGHTS ─────────────────────────────────────────── */
    long knights = bb[usN];
    while (knights != 0) {
      int from = Long.numberOfTrailingZeros(knights);
      knights &= knights - 1;
      n = emitMoves(mv, n, from, KNIGHT_ATK[from] & allTargets, usN);
    }

    /* 3 ───────── BISHOPS / ROOKS / QUEENS ────────────────────────── */
    long bishops = bb[usB];
    while (bishops != 0) {
      int from = Long.numberOfTrailingZeros(bishops);
      bishops &= bishops - 1;
      n = emitMoves(mv, n, from, bishopAtt(occ, from) & allTargets, usB);
    }

    long rooks = bb[usR];
    while (rooks != 0) {
      int from = Long.numberOfTrailingZeros(rooks);
      rooks &= rooks - 1;
      n = emitMoves(mv, n, from, rookAtt(occ, from) & allTargets, usR);
    }

    long queens = bb[usQ];
    while (queens != 0) {
      int from = Long.numberOfTrailingZeros(queens);
      queens &= queens - 1;
      n = emitMoves(mv, n, from, queenAtt(occ, from) & allTargets, usQ);
    }

    /* 4 ───────── KING + CASTLING ─────────────────────────────────── */
    long king = bb[usK];
    if (king != 0) {
      int kSq = Long.numberOfTrailingZeros(king);
      n = emitMoves(mv, n, kSq, KING_ATK[kSq] & allTargets, usK);
      n = addCastles(bb, white, occ, mv, n);
    }
    return n;
  }

  @Override
  public boolean kingAttacked(long[] bb, boolean white) {
    long king = bb[white ? WK : BK];
    if (king == 0) return false;
    return isAttacked(bb, !white, Long.numberOfTrailingZeros(king));
  }

  @Override
  public boolean isAttacked(long[] bb, boolean byWhite, int sq) {
    long occ = 0;
    for (int i = WP; i <= BK; ++i) occ |= bb[i];

    // a white pawn attacks sq iff a black pawn on sq would attack the white pawn's square
    long pawns = byWhite ? bb[WP] : bb[BP];
    if (((byWhite ? PAWN_ATK_B[sq] : PAWN_ATK_W[sq]) & pawns) != 0) return true;

    if ((KNIGHT_ATK[sq] & (byWhite ? bb[WN] : bb[BN])) != 0) return true;
    if ((KING_ATK[sq]   & (byWhite ? bb[WK] : bb[BK])) != 0) return true;

    long queens = byWhite ? bb[WQ] : bb[BQ];
    if ((bishopAtt(occ, sq) & ((byWhite ? bb[WB] : bb[BB]) | queens)) != 0) return true;
    return (rookAtt(occ, sq) & ((byWhite ? bb[WR] : bb[BR]) | queens)) != 0;
  }

  /* ── sliders ──────────────────────────────────────────────────── */
  public static long rookAtt(long occ, int sq) {
    return slide(occ, sq, ROOK_DIRS);
  }

  public static long bishopAtt(long occ, int sq) {
    return slide(occ, sq, BISHOP_DIRS);
  }

  public static long queenAtt(long occ, int sq) {
    return rookAtt(occ, sq) | bishopAtt(occ, sq);
  }

  private static long slide(long occ, int sq, int[][] dirs) {
    int file = sq & 7, rank = sq >>> 3;
    long attacks = 0;
    for (int[] d : dirs) {
      int f = file + d[0], r = rank + d[1];
      while (f >= 0 && f < 8 && r >= 0 && r < 8) {
        long bit = 1L << (r * 8 + f);
        attacks |= bit;
        if ((occ & bit) != 0) break;   // blocker: include it, stop the ray
        f += d[0];
        r += d[1];
      }
    }
    return attacks;
  }

  /* ── helpers ──────────────────────────────────────────────────── */
  private static int emitMoves(int[] mv, int n, int from, long targets, int mover) {
    while (targets != 0) {
      int to = Long.numberOfTrailingZeros(targets);
      targets &= targets - 1;
      mv[n++] = packMove(from, to, TYPE_NORMAL, 0, mover);
    }
    return n;
  }

  private static int addPawnPushes(long pawns, boolean white, long occ, int[] mv, int n, int mover) {
    long empty = ~occ;
    long single = white ? (pawns << 8) & empty : (pawns >>> 8) & empty;
    long start  = white ? RANK_2 : RANK_7;
    long dbl    = white ? ((((pawns & start) << 8) & empty) << 8) & empty
            : ((((pawns & start) >>> 8) & empty) >>> 8) & empty;
    long promoRank = white ? RANK_8 : RANK_1;
    int delta = white ? 8 : -8;

    long quiet = single & ~promoRank;
    while (quiet != 0) {
      int to = Long.numberOfTrailingZeros(quiet);
      quiet &= quiet - 1;
      mv[n++] = packMove(to - delta, to, TYPE_NORMAL, 0, mover);
    }

    long promo = single & promoRank;
    while (promo != 0) {
      int to = Long.numberOfTrailingZeros(promo);
      promo &= promo - 1;
      n = emitPromotions(mv, n, to - delta, to, mover);
    }

    while (dbl != 0) {
      int to = Long.numberOfTrailingZeros(dbl);
      dbl &= dbl - 1;
      mv[n++] = packMove(to - 2 * delta, to, TYPE_NORMAL, 0, mover);
    }
    return n;
  }

  private static int addPawnCaptures(long[] bb, boolean white, long enemy, int[] mv, int n, int mover) {
    long pawns = bb[mover];
    long promoRank = white ? RANK_8 : RANK_1;
    long ep = epSquare(bb[META]);
    long epBit = ep == EP_NONE ? 0 : 1L << ep;

    while (pawns != 0) {
      int from = Long.numberOfTrailingZeros(pawns);
      pawns &= pawns - 1;
      long atk = white ? PAWN_ATK_W[from] : PAWN_ATK_B[from];

      long caps = atk & enemy;
      while (caps != 0) {
        int to = Long.numberOfTrailingZeros(caps);
        caps &= caps - 1;
        if (((1L << to) & promoRank) != 0) n = emitPromotions(mv, n, from, to, mover);
        else mv[n++] = packMove(from, to, TYPE_NORMAL, 0, mover);
      }

      if ((atk & epBit) != 0) mv[n++] = packMove(from, (int) ep, TYPE_EN_PASSANT, 0, mover);
    }
    return n;
  }

  private static int emitPromotions(int[] mv, int n, int from, int to, int mover) {
    for (int promo = 3; promo >= 0; --promo)      // Q, R, B, N
      mv[n++] = packMove(from, to, TYPE_PROMOTION, promo, mover);
    return n;
  }

  private int addCastles(long[] bb, boolean white, long occ, int[] mv, int n) {
    int cr = (int) castling(bb[META]);
    boolean them = !white;
    if (white) {
      if ((bb[WK] & (1L << 4)) == 0) return n;
      if ((cr & 0b0001) != 0 && (bb[WR] & (1L << 7)) != 0
              && (occ & ((1L << 5) | (1L << 6))) == 0
              && !isAttacked(bb, them, 4) && !isAttacked(bb, them, 5) && !isAttacked(bb, them, 6))
        mv[n++] = packMove(4, 6, TYPE_CASTLE, 0, WK);
      if ((cr & 0b0010) != 0 && (bb[WR] & 1L) != 0
              && (occ & ((1L << 1) | (1L << 2) | (1L << 3))) == 0
              && !isAttacked(bb, them, 4) && !isAttacked(bb, them, 3) && !isAttacked(bb, them, 2))
        mv[n++] = packMove(4, 2, TYPE_CASTLE, 0, WK);
    } else {
      if ((bb[BK] & (1L << 60)) == 0) return n;
      if ((cr & 0b0100) != 0 && (bb[BR] & (1L << 63)) != 0
              && (occ & ((1L << 61) | (1L << 62))) == 0
              && !isAttacked(bb, them, 60) && !isAttacked(bb, them, 61) && !isAttacked(bb, them, 62))
        mv[n++] = packMove(60, 62, TYPE_CASTLE, 0, BK);
      if ((cr & 0b1000) != 0 && (bb[BR] & (1L << 56)) != 0
              && (occ & ((1L << 57) | (1L << 58) | (1L << 59))) == 0
              && !isAttacked(bb, them, 60) && !isAttacked(bb, them, 59) && !isAttacked(bb, them, 58))
        mv[n++] = packMove(60, 58, TYPE_CASTLE, 0, BK);
    }
    return n;
  }
}
