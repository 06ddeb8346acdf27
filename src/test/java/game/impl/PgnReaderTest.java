package game.impl;

import static org.junit.jupiter.api.Assertions.*;

import game.PgnFormatException;
import game.records.Diagnostic;
import game.records.GameResult;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import rules.Move;
import rules.contracts.RulesEngine;
import rules.impl.RulesEngineImpl;

class PgnReaderTest {

  private final RulesEngine rules = new RulesEngineImpl();
  private List<Diagnostic> reports;
  private PgnReader reader;

  @BeforeEach
  void freshReader() {
    reports = new ArrayList<>();
    reader = new PgnReader(rules, reports::add);
  }

  static String resource(String path) throws Exception {
    try (InputStream is = PgnReaderTest.class.getResourceAsStream(path)) {
      return new String(Objects.requireNonNull(is, path).readAllBytes(), StandardCharsets.UTF_8);
    }
  }

  private static Optional<String> san(Node n) {
    return n.san();
  }

  /* ── basic shapes ─────────────────────────────────────────────── */

  @Test
  void mainlineOfTwoPlies() {
    GameTree tree = reader.read("1. e4 e5");
    Node root = tree.root();
    assertEquals(1, root.children().size());
    Node e4 = root.mainline().orElseThrow();
    assertEquals(Optional.of(Move.of("e2", "e4")), e4.prevMove());
    assertEquals(1, e4.children().size());
    assertEquals(Optional.of(Move.of("e7", "e5")), e4.mainline().orElseThrow().prevMove());
    assertTrue(reports.isEmpty());
  }

  @Test
  void sideLineBranchesBeforeTheLastMove() {
    GameTree tree = reader.read("1. e4 (1. d4) 1... e5");
    Node root = tree.root();
    assertEquals(2, root.children().size());
    assertEquals(1, root.otherVariations().size());
    assertEquals(Optional.of(Move.of("d2", "d4")), root.otherVariations().get(0).prevMove());
    assertEquals(Optional.of(Move.of("e7", "e5")),
            root.mainline().orElseThrow().mainline().orElseThrow().prevMove());
  }

  @Test
  void suffixAnnotationsBecomeNags() {
    GameTree tree = reader.read("1. e4?? c5!");
    Node e4 = tree.root().mainline().orElseThrow();
    Node c5 = e4.mainline().orElseThrow();
    assertTrue(e4.nags().contains(4));
    assertTrue(c5.nags().contains(1));
  }

  @Test
  void nestedVariationsAttachToTheRightAncestor() {
    GameTree tree = reader.read("1. e4 e5 (1... c5 2. Nf3 (2. c3) 2... d6) (1... e6) 2. Nf3 *");
    Node e4 = tree.root().mainline().orElseThrow();
    assertEquals(List.of(Optional.of("e5"), Optional.of("c5"), Optional.of("e6")),
            e4.children().stream().map(PgnReaderTest::san).toList());

    Node c5 = e4.children().get(1);
    Node nf3 = c5.mainline().orElseThrow();
    assertEquals(List.of(Optional.of("Nf3"), Optional.of("c3")),
            c5.children().stream().map(PgnReaderTest::san).toList());
    assertEquals(Optional.of("d6"), nf3.mainline().flatMap(Node::san));

    Node e5 = e4.mainline().orElseThrow();
    assertEquals(Optional.of("Nf3"), e5.mainline().flatMap(Node::san));
    assertEquals(9, tree.nodeCount());
  }

  /* ── comments ─────────────────────────────────────────────────── */

  @Test
  void commentPlacement() {
    GameTree tree = reader.read(
            "{ intro } { more } 1. e4 { king pawn } (1. d4 { queen pawn }) ({ flank } 1. c4) 1... e5 *");
    Node root = tree.root();
    assertEquals(Optional.of("intro more"), root.comment());

    Node e4 = root.children().get(0);
    Node d4 = root.children().get(1);
    Node c4 = root.children().get(2);
    assertEquals(Optional.of("king pawn"), e4.comment());
    assertEquals(Optional.of("queen pawn"), d4.comment());
    assertTrue(d4.startingComment().isEmpty());
    assertEquals(Optional.of("flank"), c4.startingComment());
    assertTrue(c4.comment().isEmpty());
  }

  @Test
  void startingCommentsAreJoined() {
    GameTree tree = reader.read("1. e4 ({ one } { two } 1. d4) *");
    Node d4 = tree.root().children().get(1);
    assertEquals(Optional.of("one two"), d4.startingComment());
  }

  @Test
  void orphanStartingCommentStaysWithThePosition() {
    GameTree tree = reader.read("1. e4 ({ no moves here }) 1... e5 *");
    Node root = tree.root();
    assertEquals(1, root.children().size());
    assertEquals(Optional.of("no moves here"), root.comment());
  }

  @Test
  void commentAfterClosedVariationAnnotatesTheMoveBeforeIt() {
    GameTree tree = reader.read("1. e4 ( ) { x } 1... e5 (1... c5) { y } 2. Nf3 *");
    Node e4 = tree.root().mainline().orElseThrow();
    Node e5 = e4.mainline().orElseThrow();
    assertEquals(Optional.of("x"), e4.comment());
    assertTrue(e5.startingComment().isEmpty());
    assertEquals(Optional.of("y"), e5.comment());
    assertTrue(e5.mainline().orElseThrow().startingComment().isEmpty());
  }

  /* ── headers ──────────────────────────────────────────────────── */

  @Test
  void rosterAndExtraHeaders() {
    GameTree tree = reader.read(
            "[Event \"Club\"]\n[Site \"??\"]\n[Date \"????.??.??\"]\n[Round \"3\"]\n"
            + "[White \"A\"]\n[Black \"B\"]\n[Result \"1/2-1/2\"]\n[ECO \"C20\"]\n\n1. e4 e5 1/2-1/2");
    Header h = tree.header();
    assertEquals(Optional.of("Club"), h.event());
    assertTrue(h.site().isEmpty());
    assertTrue(h.date().isEmpty());
    assertEquals(Optional.of("3"), h.round());
    assertEquals(GameResult.DRAW, h.result());
    assertEquals(Optional.of("C20"), Optional.ofNullable(tree.extraHeaders().get("ECO")));
    assertEquals(1, tree.extraHeaders().size());
  }

  @Test
  void resultTokenFillsMissingResult() {
    assertEquals(GameResult.WHITE_WON, reader.read("1. e4 1-0").header().result());
    assertEquals(GameResult.ONGOING, reader.read("1. e4 *").header().result());
    // an explicit header wins over the token
    assertEquals(GameResult.BLACK_WON, reader.read("[Result \"0-1\"]\n1. e4 1-0").header().result());
  }

  @Test
  void fenHeaderRootsTheTree() {
    String fen = "4k3/8/8/8/8/8/4P3/4K3 w - - 0 1";
    GameTree tree = reader.read("[SetUp \"1\"]\n[FEN \"" + fen + "\"]\n\n1. e4 Kd7 *");
    assertEquals(fen, rules.toFen(tree.startingPosition()));
    assertEquals(3, tree.nodeCount());
    assertEquals("1", tree.extraHeaders().get("SetUp"));
    assertEquals(fen, tree.extraHeaders().get("FEN"));

    Node kd7 = tree.root().mainline().orElseThrow().mainline().orElseThrow();
    assertEquals(kd7.board(), kd7.replay(tree.startingPosition()));
  }

  @Test
  void badFenIsReportedAndIgnored() {
    GameTree tree = reader.read("[FEN \"nonsense\"]\n\n1. e4 *");
    assertEquals(rules.startingPosition(), tree.startingPosition());
    assertEquals(2, tree.nodeCount());
    assertEquals(Diagnostic.Kind.MALFORMED_INPUT, reports.get(0).kind());
  }

  /* ── malformed input ──────────────────────────────────────────── */

  @Test
  void unplayableMovesAreSkipped() {
    GameTree tree = reader.read("1. e4 Ke2 e5 2. Qxf7 Nf3 *");
    assertEquals(List.of("e4", "e5", "Nf3"),
            tree.root().mainline().orElseThrow().mainlineNodes().stream()
                    .map(n -> n.san().orElseThrow()).toList());
    assertEquals(2, reports.size());
    assertTrue(reports.stream().allMatch(d -> d.kind() == Diagnostic.Kind.MALFORMED_INPUT));
  }

  @Test
  void variationBeforeAnyMoveIsSkipped() {
    GameTree tree = reader.read("(1. d4 d5) 1. e4 *");
    assertEquals(2, tree.nodeCount());
    assertEquals(Diagnostic.Kind.VARIATION_UNDERFLOW, reports.get(0).kind());
  }

  @Test
  void strayClosingParenIsIgnored() {
    GameTree tree = reader.read("1. e4 ) e5 *");
    assertEquals(3, tree.nodeCount());
    assertEquals(Diagnostic.Kind.VARIATION_UNDERFLOW, reports.get(0).kind());
  }

  @Test
  void nagBeforeAnyMoveIsReported() {
    GameTree tree = reader.read("$1 1. e4 *");
    assertTrue(tree.root().nags().isEmpty());
    assertEquals(Diagnostic.Kind.MALFORMED_INPUT, reports.get(0).kind());
  }

  @Test
  void blankInputHasNoGame() {
    assertThrows(PgnFormatException.class, () -> reader.read(""));
    assertThrows(PgnFormatException.class, () -> reader.read(" \n "));
    assertThrows(PgnFormatException.class, () -> reader.readAll("\n"));
  }

  @Test
  void structurallyBrokenTextFails() {
    assertThrows(PgnFormatException.class, () -> reader.read("1. e4 { open"));
  }

  /* ── multi-game files ─────────────────────────────────────────── */

  @Test
  void readAllReturnsEveryGame() {
    List<GameTree> games = reader.readAll(
            "[Event \"one\"]\n\n1. e4 e5 1-0\n\n[Event \"two\"]\n\n1. d4 *\n\n[Event \"three\"]\n\n*\n");
    assertEquals(3, games.size());
    assertEquals(Optional.of("two"), games.get(1).header().event());
    assertEquals(3, games.get(0).nodeCount());
    assertEquals(1, games.get(2).nodeCount());
    assertNotSame(games.get(0), games.get(1));
  }

  /* ── a real game ──────────────────────────────────────────────── */

  @Test
  void lichessGame() throws Exception {
    GameTree tree = reader.read(resource("/games/lichess-5uSupub7.pgn"));
    assertTrue(reports.isEmpty(), reports::toString);

    Header h = tree.header();
    assertEquals(Optional.of("Casual Rapid game"), h.event());
    assertEquals(Optional.of("2023.03.06"), h.date());
    assertTrue(h.round().isEmpty());
    assertEquals(Optional.of("maia1"), h.white());
    assertEquals(Optional.of("soyflourbread"), h.black());
    assertEquals(GameResult.BLACK_WON, h.result());
    assertEquals(10, tree.extraHeaders().size());
    assertEquals("D00", tree.extraHeaders().get("ECO"));

    Node root = tree.root();
    assertEquals(Optional.of("Chess, when played perfectly, ends in a draw"), root.comment());
    assertEquals(2, root.children().size());
    Node d4 = root.children().get(0);
    assertEquals(Optional.of("d4"), d4.san());
    assertEquals(Optional.of("The best opening move"), d4.comment());
    Node e4 = root.children().get(1);
    assertEquals(Optional.of("This blunder allows the Sicilian Defense"), e4.comment());
    assertEquals(Optional.of("c5"), e4.mainline().flatMap(Node::san));

    List<Node> mainline = root.mainlineNodes();
    assertEquals(109, mainline.size());
    assertEquals(123, tree.nodeCount());

    Node bg4 = mainline.get(16);
    assertEquals(Optional.of("Bg4"), bg4.san());
    assertEquals(Set.of(2), bg4.nags());
    Node nxe5 = bg4.siblings().get(0);
    assertEquals(Optional.of("Apparently this is best"), nxe5.startingComment());
    assertEquals(9, nxe5.mainlineNodes().size());

    Node last = mainline.get(108);
    assertEquals(Optional.of("Qg6#"), last.san());
    assertEquals(Optional.of("Black wins by checkmate."), last.comment());
    assertTrue(rules.isCheckmate(last.board().orElseThrow()));
    assertEquals(last.board(), last.replay(tree.startingPosition()));
  }
}
