package rules.impl;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import rules.Board;
import rules.Move;
import rules.contracts.RulesEngine;

class SanCodecTest {

  private static final RulesEngine RULES = new RulesEngineImpl();

  static Stream<Arguments> notation() {
    return Stream.of(
            Arguments.of("rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1", "g1f3", "Nf3"),
            Arguments.of("rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1", "e2e4", "e4"),
            // pawn capture and en passant
            Arguments.of("rnbqkbnr/ppp1pppp/8/3p4/4P3/8/PPPP1PPP/RNBQKBNR w KQkq - 0 2", "e4d5", "exd5"),
            Arguments.of("rnbqkbnr/ppp1p1pp/8/3pPp2/8/8/PPPP1PPP/RNBQKBNR w KQkq f6 0 3", "e5f6", "exf6"),
            // castling both ways
            Arguments.of("r3k2r/8/8/8/8/8/8/R3K2R w KQkq - 0 1", "e1g1", "O-O"),
            Arguments.of("r3k2r/8/8/8/8/8/8/R3K2R b KQkq - 0 1", "e8c8", "O-O-O"),
            // file, rank and full-square disambiguation
            Arguments.of("4k3/8/8/8/8/8/8/R4RK1 w - - 0 1", "a1d1", "Rad1"),
            Arguments.of("4k3/8/8/R7/8/8/8/R3K3 w - - 0 1", "a1a3", "R1a3"),
            Arguments.of("k7/8/8/8/8/2Q1Q3/8/4Q2K w - - 0 1", "e3d2", "Qe3d2"),
            // promotion with check, mate
            Arguments.of("8/4P3/8/8/8/8/k7/4K3 w - - 0 1", "e7e8q", "e8=Q"),
            Arguments.of("k7/4P3/8/8/8/8/8/4K3 w - - 0 1", "e7e8r", "e8=R+"),
            Arguments.of("6k1/5ppp/8/8/8/8/8/R3K3 w - - 0 1", "a1a8", "Ra8#"));
  }

  @ParameterizedTest(name = "{2}")
  @MethodSource("notation")
  void formatsAndParses(String fen, String uci, String san) {
    Board b = RULES.parseStartPosition(fen);
    Move m = Move.fromUci(uci);
    assertEquals(san, RULES.moveToNotation(b, m));
    assertEquals(Optional.of(m), RULES.notationToMove(b, san));
  }

  @Test
  void parseIsLenient() {
    Board start = RULES.startingPosition();
    assertEquals(Optional.of(Move.fromUci("g1f3")), RULES.notationToMove(start, "Nf3!?"));
    assertEquals(Optional.of(Move.fromUci("g1f3")), RULES.notationToMove(start, "Ng1f3"));

    Board castle = RULES.parseStartPosition("r3k2r/8/8/8/8/8/8/R3K2R w KQkq - 0 1");
    assertEquals(Optional.of(Move.fromUci("e1g1")), RULES.notationToMove(castle, "0-0"));

    Board promo = RULES.parseStartPosition("8/4P3/8/8/8/8/k7/4K3 w - - 0 1");
    assertEquals(Optional.of(Move.fromUci("e7e8n")), RULES.notationToMove(promo, "e8N"));
  }

  @Test
  void rejectsAmbiguousIllegalAndGarbage() {
    Board twoRooks = RULES.parseStartPosition("4k3/8/8/8/8/8/8/R4RK1 w - - 0 1");
    assertTrue(RULES.notationToMove(twoRooks, "Rd1").isEmpty());
    assertTrue(RULES.notationToMove(twoRooks, "Ra2").isPresent());

    Board start = RULES.startingPosition();
    assertTrue(RULES.notationToMove(start, "e5").isEmpty());
    assertTrue(RULES.notationToMove(start, "O-O").isEmpty());
    assertTrue(RULES.notationToMove(start, "Zz9").isEmpty());
    assertTrue(RULES.notationToMove(start, "").isEmpty());
    // promotion square without a piece is not a move
    Board promo = RULES.parseStartPosition("8/4P3/8/8/8/8/k7/4K3 w - - 0 1");
    assertTrue(RULES.notationToMove(promo, "e8").isEmpty());
  }
}
