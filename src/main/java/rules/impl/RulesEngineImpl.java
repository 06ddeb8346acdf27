package rules.impl;

import static rules.contracts.MoveGenerator.*;
import static rules.contracts.PositionFactory.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import rules.Board;
import rules.Move;
import rules.Piece;
import rules.constants.RulesConstants;
import rules.contracts.MoveGenerator;
import rules.contracts.PositionFactory;
import rules.contracts.RulesEngine;

/**
 * Bitboard-backed {@link RulesEngine}.
 *
 * <p>Legal moves are the pseudo-legal moves that do not leave the mover's king attacked, the same
 * filter the perft walk applies.
 */
public final class RulesEngineImpl implements RulesEngine {

    /* ── engine singletons ─────────────────────────────────────── */
    private final PositionFactory pf;
    private final MoveGenerator   mg;
    private final SanCodec        san;
    private final Board           start;

    public RulesEngineImpl() {
        this(new PositionFactoryImpl(), new MoveGeneratorImpl());
    }

    public RulesEngineImpl(PositionFactory pf, MoveGenerator mg) {
        this.pf    = pf;
        this.mg    = mg;
        this.san   = new SanCodec(this);
        this.start = Board.fromPacked(pf.fromFen(RulesConstants.START_FEN));
    }

    /* ── RulesEngine ──────────────────────────────────────────── */

    @Override
    public Board startingPosition() {
        return start;
    }

    @Override
    public Board apply(Board position, Move move) {
        long[] bb = position.toPacked();
        pf.makeMoveInPlace(bb, pack(bb, move));
        return Board.fromPacked(bb);
    }

    @Override
    public boolean isLegal(Board position, Move move) {
        return findLegal(position.toPacked(), move) != 0;
    }

    @Override
    public List<Move> legalMoves(Board position) {
        long[] bb = position.toPacked();
        int[] list = new int[RulesConstants.MAX_MOVES];
        int n = generateLegal(bb, list);
        List<Move> moves = new ArrayList<>(n);
        for (int i = 0; i < n; i++) moves.add(unpack(list[i]));
        return moves;
    }

    @Override
    public Optional<Move> notationToMove(Board position, String text) {
        return san.parse(position.toPacked(), text).map(RulesEngineImpl::unpack);
    }

    @Override
    public String moveToNotation(Board position, Move move) {
        long[] bb = position.toPacked();
        int mv = findLegal(bb, move);
        if (mv == 0) throw new IllegalArgumentException("illegal move " + move + " in " + pf.toFen(bb));
        return san.format(bb, mv);
    }

    @Override
    public Board parseStartPosition(String fen) {
        return Board.fromPacked(pf.fromFen(fen));
    }

    @Override
    public String toFen(Board position) {
        return pf.toFen(position.toPacked());
    }

    @Override
    public boolean isCheck(Board position) {
        long[] bb = position.toPacked();
        return mg.kingAttacked(bb, PositionFactory.whiteToMove(bb[META]));
    }

    @Override
    public boolean isCheckmate(Board position) {
        long[] bb = position.toPacked();
        return mg.kingAttacked(bb, PositionFactory.whiteToMove(bb[META]))
                && generateLegal(bb, new int[RulesConstants.MAX_MOVES]) == 0;
    }

    @Override
    public Optional<Move> legalMove(Board position, int from, int to) {
        Move best = null;
        for (Move m : legalMoves(position)) {
            if (m.from() != from || m.to() != to) continue;
            if (!m.isPromotion() || m.promotion() == Piece.Type.QUEEN) return Optional.of(m);
            best = m;
        }
        return Optional.ofNullable(best);
    }

    @Override
    public List<Integer> hints(Board position, int from) {
        return destinations(position, from, false);
    }

    @Override
    public List<Integer> captures(Board position, int from) {
        return destinations(position, from, true);
    }

    /* ── package helpers (shared with SanCodec) ───────────────── */

    PositionFactory positionFactory() {
        return pf;
    }

    MoveGenerator moveGenerator() {
        return mg;
    }

    /** Fills {@code out} with the legal packed moves of {@code bb}; {@code bb} is left unchanged. */
    int generateLegal(long[] bb, int[] out) {
        int[] pseudo = new int[RulesConstants.MAX_MOVES];
        int n = mg.generatePseudoLegal(bb, pseudo, 0);
        boolean white = PositionFactory.whiteToMove(bb[META]);

        int legal = 0;
        long[] scratch = new long[BB_LEN];
        for (int i = 0; i < n; i++) {
            System.arraycopy(bb, 0, scratch, 0, BB_LEN);
            pf.makeMoveInPlace(scratch, pseudo[i]);
            if (!mg.kingAttacked(scratch, white)) out[legal++] = pseudo[i];
        }
        return legal;
    }

    /** Packed form of {@code move} if it is legal in {@code bb}, else 0. */
    int findLegal(long[] bb, Move move) {
        int[] list = new int[RulesConstants.MAX_MOVES];
        int n = generateLegal(bb, list);
        for (int i = 0; i < n; i++) if (unpack(list[i]).equals(move)) return list[i];
        return 0;
    }

    static Move unpack(int mv) {
        Piece.Type promo = moveType(mv) == TYPE_PROMOTION
                ? Piece.Type.values()[Piece.Type.KNIGHT.ordinal() + movePromo(mv)]
                : null;
        return new Move(moveFrom(mv), moveTo(mv), promo);
    }

    /* ── helpers ─────────────────────────────────────────────── */

    /** Derives type and mover from the position; a bare pawn move to the last rank promotes to a queen. */
    private static int pack(long[] bb, Move m) {
        int from = m.from(), to = m.to();
        int mover = -1;
        for (int i = WP; i <= BK; ++i) {
            if ((bb[i] & (1L << from)) != 0) {
                mover = i;
                break;
            }
        }
        if (mover < 0) throw new IllegalArgumentException("no piece on " + Move.squareName(from));

        boolean pawn = mover == WP || mover == BP;
        boolean king = mover == WK || mover == BK;
        long occ = 0;
        for (int i = WP; i <= BK; ++i) occ |= bb[i];

        if (king && Math.abs((to & 7) - (from & 7)) == 2)
            return packMove(from, to, TYPE_CASTLE, 0, mover);
        if (pawn && (to >>> 3) % 7 == 0) {
            Piece.Type promo = m.isPromotion() ? m.promotion() : Piece.Type.QUEEN;
            return packMove(from, to, TYPE_PROMOTION, promo.ordinal() - Piece.Type.KNIGHT.ordinal(), mover);
        }
        if (pawn && (from & 7) != (to & 7) && (occ & (1L << to)) == 0)
            return packMove(from, to, TYPE_EN_PASSANT, 0, mover);
        return packMove(from, to, TYPE_NORMAL, 0, mover);
    }

    private List<Integer> destinations(Board position, int from, boolean capturesOnly) {
        long occ = position.occupancy();
        List<Integer> squares = new ArrayList<>();
        for (Move m : legalMoves(position)) {
            if (m.from() != from || squares.contains(m.to())) continue;
            boolean capture = (occ & (1L << m.to())) != 0
                    || (position.enPassantSquare() == m.to()
                        && position.pieceAt(from).type() == Piece.Type.PAWN);
            if (!capturesOnly || capture) squares.add(m.to());
        }
        squares.sort(null);
        return squares;
    }
}
