package rules.impl;

import static rules.contracts.MoveGenerator.*;
import static rules.contracts.PositionFactory.*;

import java.util.Arrays;
import rules.contracts.PositionFactory;

public final class PositionFactoryImpl implements PositionFactory {

  /* Precomputed masks for castling rights updates */
  private static final short[] CR_MASK_LOST_FROM = new short[64];
  private static final short[] CR_MASK_LOST_TO   = new short[64];

  static {
    Arrays.fill(CR_MASK_LOST_FROM, (short) 0b1111);
    Arrays.fill(CR_MASK_LOST_TO,   (short) 0b1111);

    CR_MASK_LOST_FROM[ 4]  = 0b1100; // e1  white king
    CR_MASK_LOST_FROM[60]  = 0b0011; // e8  black king
    CR_MASK_LOST_FROM[ 7] &= ~0b0001; // h1  → clear white-K
    CR_MASK_LOST_FROM[ 0] &= ~0b0010; // a1  → clear white-Q
    CR_MASK_LOST_FROM[63] &= ~0b0100; // h8  → clear black-k
    CR_MASK_LOST_FROM[56] &= ~0b1000; // a8  → clear black-q
    CR_MASK_LOST_TO[ 7]  &= ~0b0001;
    CR_MASK_LOST_TO[ 0]  &= ~0b0010;
    CR_MASK_LOST_TO[63]  &= ~0b0100;
    CR_MASK_LOST_TO[56]  &= ~0b1000;
  }

  @Override
  public long[] fromFen(String fen) {
    if (fen == null || fen.isBlank()) throw new IllegalArgumentException("empty FEN");
    return fenToBitboards(fen);
  }

  @Override
  public String toFen(long[] bb) {
    StringBuilder sb = new StringBuilder(64);
    for (int rank = 7; rank >= 0; --rank) {
      int empty = 0;
      for (int file = 0; file < 8; ++file) {
        int sq = rank * 8 + file;
        char pc = pieceCharAt(bb, sq);
        if (pc == 0) {
          empty++;
          continue;
        }
        if (empty != 0) {
          sb.append(empty);
          empty = 0;
        }
        sb.append(pc);
      }
      if (empty != 0) sb.append(empty);
      if (rank != 0) sb.append('/');
    }
    sb.append(PositionFactory.whiteToMove(bb[META]) ? " w " : " b ");

    int cr = (int) castling(bb[META]);
    sb.append(cr == 0 ? "-" : "")
            .append((cr & 1) != 0 ? "K" : "")
            .append((cr & 2) != 0 ? "Q" : "")
            .append((cr & 4) != 0 ? "k" : "")
            .append((cr & 8) != 0 ? "q" : "");
    sb.append(' ');

    // En Passant square.
    long ep = epSquare(bb[META]);
    if (ep != EP_NONE) {
      sb.append((char) ('a' + (ep & 7))).append(1 + (ep >>> 3));
    } else {
      sb.append('-');
    }

    sb.append(' ');
    sb.append(halfClock(bb[META])).append(' ').append(fullMove(bb[META]));
    return sb.toString();
  }

  private static char pieceCharAt(long[] bb, int sq) {
    for (int i = 0; i < 12; ++i) if ((bb[i] & (1L << sq)) != 0) return "PNBRQKpnbrqk".charAt(i);
    return 0;
  }

  @Override
  public void makeMoveInPlace(long[] bb, int mv) {
    int from  = moveFrom(mv);
    int to    = moveTo(mv);
    int type  = moveType(mv);
    int promo = movePromo(mv);
    int mover = moveMover(mv);

    boolean white   = mover < 6;
    long    fromBit = 1L << from;
    long    toBit   = 1L << to;

    long metaOld = bb[META];
    int  oldCR   = (int) castling(metaOld);

    // --- Execute Move ---
    boolean captured = false;
    if (type <= TYPE_PROMOTION) {
      int first = white ? BP : WP;
      for (int p = first; p < first + 6; ++p) {
        if ((bb[p] & toBit) != 0) {
          bb[p] &= ~toBit;
          captured = true;
          break;
        }
      }
    } else if (type == TYPE_EN_PASSANT) {
      int capSq = white ? to - 8 : to + 8;
      bb[white ? BP : WP] &= ~(1L << capSq);
      captured = true;
    }

    bb[mover] ^= fromBit;
    if (type == TYPE_PROMOTION) {
      bb[(white ? WN : BN) + promo] |= toBit;
    } else {
      bb[mover] |= toBit;
    }

    // Handle castling rook moves
    if (type == TYPE_CASTLE) switch (to) {
      case  6 -> bb[WR] ^= (1L << 7)  | (1L << 5);
      case  2 -> bb[WR] ^= (1L << 0)  | (1L << 3);
      case 62 -> bb[BR] ^= (1L << 63) | (1L << 61);
      case 58 -> bb[BR] ^= (1L << 56) | (1L << 59);
      default -> throw new IllegalStateException("castle to " + to);
    }

    // --- Update META ---
    long meta = metaOld;

    // EP target only when the opponent can actually capture
    int ep = (int) EP_NONE;
    if ((mover == WP || mover == BP) && ((from ^ to) == 16)) {
      long opponentPawns = white ? bb[BP] : bb[WP];
      boolean canCapture =
              (((to & 7) > 0) && ((opponentPawns & (1L << (to - 1))) != 0))
              || (((to & 7) < 7) && ((opponentPawns & (1L << (to + 1))) != 0));
      if (canCapture) ep = white ? from + 8 : from - 8;
    }
    meta = (meta & ~EP_MASK) | ((long) ep << EP_SHIFT);

    int cr = oldCR & CR_MASK_LOST_FROM[from] & CR_MASK_LOST_TO[to];
    meta = (meta & ~CR_MASK) | ((long) cr << CR_SHIFT);

    long newHC = ((mover == WP || mover == BP) || captured)
            ? 0
            : Math.min(halfClock(metaOld) + 1, HC_MAX);
    meta = (meta & ~HC_MASK) | (newHC << HC_SHIFT);

    // stored as number - 1
    long fm = fullMove(metaOld) - 1;
    if (!white && fm < FM_MAX - 1) fm++;
    meta ^= STM_MASK;
    meta = (meta & ~FM_MASK) | (fm << FM_SHIFT);

    bb[META] = meta;
  }

  // Helper to check if an EP capture is possible, used in fenToBitboards.
  private static boolean hasEpCapture(long[] bb, int epSq, boolean whiteToMove) {
    long capturingPawns;
    if (whiteToMove) {
      if ((epSq >>> 3) != 5) return false;
      capturingPawns = bb[WP];
    } else {
      if ((epSq >>> 3) != 2) return false;
      capturingPawns = bb[BP];
    }

    int epFile = epSq & 7;
    if (epFile > 0) {
      int sourceSq = whiteToMove ? (epSq - 9) : (epSq + 7);
      if ((capturingPawns & (1L << sourceSq)) != 0) return true;
    }
    if (epFile < 7) {
      int sourceSq = whiteToMove ? (epSq - 7) : (epSq + 9);
      if ((capturingPawns & (1L << sourceSq)) != 0) return true;
    }
    return false;
  }

  private static long[] fenToBitboards(String fen) {
    long[] bb = new long[BB_LEN];
    String[] parts = fen.trim().split("\\s+");
    if (parts.length < 4)
      throw new IllegalArgumentException("FEN needs at least four fields: " + fen);

    // 1. Board layout
    int rank = 7, file = 0;
    for (char c : parts[0].toCharArray()) {
      if (c == '/') {
        if (file != 8) throw new IllegalArgumentException("short rank in FEN: " + fen);
        rank--;
        file = 0;
        continue;
      }
      if (c >= '1' && c <= '8') {
        file += c - '0';
        if (file > 8) throw new IllegalArgumentException("rank overflow in FEN: " + fen);
        continue;
      }
      if (rank < 0 || file > 7) throw new IllegalArgumentException("too many squares in FEN: " + fen);
      int sq = rank * 8 + file++;
      int idx =
              switch (c) {
                case 'P' -> WP; case 'N' -> WN; case 'B' -> WB; case 'R' -> WR; case 'Q' -> WQ; case 'K' -> WK;
                case 'p' -> BP; case 'n' -> BN; case 'b' -> BB; case 'r' -> BR; case 'q' -> BQ; case 'k' -> BK;
                default -> throw new IllegalArgumentException("bad fen piece: " + c);
              };
      bb[idx] |= 1L << sq;
    }
    if (rank != 0 || file != 8) throw new IllegalArgumentException("incomplete board in FEN: " + fen);
    if (Long.bitCount(bb[WK]) != 1 || Long.bitCount(bb[BK]) != 1)
      throw new IllegalArgumentException("FEN must have exactly one king per side: " + fen);

    // 2. Side to move
    boolean whiteToMove = switch (parts[1]) {
      case "w" -> true;
      case "b" -> false;
      default -> throw new IllegalArgumentException("invalid active colour: " + parts[1]);
    };
    long meta = whiteToMove ? 0L : 1L;

    // 3. Castling rights
    int cr = 0;
    if (!parts[2].equals("-")) {
      for (char c : parts[2].toCharArray()) {
        switch (c) {
          case 'K' -> cr |= 0b0001;
          case 'Q' -> cr |= 0b0010;
          case 'k' -> cr |= 0b0100;
          case 'q' -> cr |= 0b1000;
          default -> throw new IllegalArgumentException("invalid castling char: " + c);
        }
      }
    }
    // drop rights whose king or rook has left its home square
    if ((bb[WK] & (1L << 4)) == 0)  cr &= ~0b0011;
    if ((bb[BK] & (1L << 60)) == 0) cr &= ~0b1100;
    if ((bb[WR] & (1L << 7)) == 0)  cr &= ~0b0001;
    if ((bb[WR] & 1L) == 0)         cr &= ~0b0010;
    if ((bb[BR] & (1L << 63)) == 0) cr &= ~0b0100;
    if ((bb[BR] & (1L << 56)) == 0) cr &= ~0b1000;
    meta |= (long) cr << CR_SHIFT;

    // 4. En passant square
    int epSq = (int) EP_NONE;
    if (!parts[3].equals("-")) {
      if (parts[3].length() != 2) throw new IllegalArgumentException("bad EP square: " + parts[3]);
      int f = parts[3].charAt(0) - 'a';
      int r = parts[3].charAt(1) - '1';
      if (f < 0 || f > 7 || r < 0 || r > 7) throw new IllegalArgumentException("bad EP square: " + parts[3]);
      int potentialEpSq = r * 8 + f;
      if (hasEpCapture(bb, potentialEpSq, whiteToMove)) {
        epSq = potentialEpSq;
      }
    }
    meta |= (long) epSq << EP_SHIFT;

    // 5. Halfmove clock and 6. Fullmove number
    int hc, fm;
    try {
      hc = (parts.length > 4) ? Integer.parseInt(parts[4]) : 0;
      fm = (parts.length > 5) ? Integer.parseInt(parts[5]) - 1 : 0;
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("bad move counters in FEN: " + fen, e);
    }
    if (hc < 0 || hc > HC_MAX) throw new IllegalArgumentException("half-move clock out of range: " + fen);
    if (fm < 0) throw new IllegalArgumentException("full-move number out of range: " + fen);
    meta |= (long) hc << HC_SHIFT;
    meta |= (long) fm << FM_SHIFT;

    bb[META] = meta;
    return bb;
  }
}
