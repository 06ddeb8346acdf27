package game.impl;

import static org.junit.jupiter.api.Assertions.*;

import game.contracts.GameVisitor;
import game.records.Diagnostic;
import game.records.GameResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import rules.Board;
import rules.Move;
import rules.contracts.RulesEngine;
import rules.impl.RulesEngineImpl;

class GameTreeTest {

  private final RulesEngine rules = new RulesEngineImpl();
  private List<Diagnostic> reports;
  private GameTree tree;

  @BeforeEach
  void freshTree() {
    reports = new ArrayList<>();
    tree = new GameTree(rules, reports::add);
  }

  @Test
  void emptyTreeHasOnlyTheRoot() {
    assertEquals(1, tree.nodeCount());
    assertEquals(rules.startingPosition(), tree.startingPosition());
    assertTrue(tree.extraHeaders().isEmpty());
    assertEquals(GameResult.ONGOING, tree.header().result());
    assertTrue(tree.exists(tree.root()));
  }

  @Test
  void addRemovePromoteThroughTheTree() {
    Node root = tree.root();
    Node e4 = tree.addNode(root, Move.of("e2", "e4")).orElseThrow();
    Node d4 = tree.addNode(root, Move.of("d2", "d4")).orElseThrow();
    assertEquals(3, tree.nodeCount());

    assertEquals(Optional.of(d4), tree.promoteVariation(d4));
    assertEquals(List.of(d4, e4), root.children());

    assertEquals(Optional.of(e4), tree.removeNode(e4));
    assertEquals(List.of(d4), root.children());
    assertTrue(tree.removeNode(e4).isEmpty());
    assertTrue(tree.addNode(e4, Move.of("e7", "e5")).isEmpty());
    assertTrue(reports.isEmpty());
  }

  @Test
  void removedSlotsStayTakenUntilTheGameIsCopied() {
    Node root = tree.root();
    for (String san : List.of("a3", "b3", "c3", "d3", "f3", "g3", "h3")) {
      root.newVariation(san).orElseThrow().removeNode();
    }
    Node e4 = root.newVariation("e4").orElseThrow();
    Node e5 = e4.newVariation("e5").orElseThrow();
    assertEquals(3, tree.nodeCount());
    assertEquals(9, e5.id());

    GameTree copy = GameTree.fromPgn(tree.toString());
    assertEquals(3, copy.nodeCount());
    List<Node> line = copy.root().mainlineNodes();
    assertEquals(List.of(0, 1, 2), List.of(line.get(0).id(), line.get(1).id(), line.get(2).id()));
  }

  @Test
  void rootCannotBePromoted() {
    assertTrue(tree.promoteVariation(tree.root()).isEmpty());
    assertEquals(1, reports.size());
    assertEquals(Diagnostic.Kind.STRUCTURAL_MISUSE, reports.get(0).kind());
  }

  @Test
  void nodeLookupById() {
    Node e4 = tree.root().newVariation("e4").orElseThrow();
    assertEquals(Optional.of(e4), tree.node(e4.id()));
    assertTrue(tree.node(-1).isEmpty());
    assertTrue(tree.node(999).isEmpty());
  }

  @Test
  void extraHeadersKeepInsertionOrder() {
    assertTrue(tree.putExtraHeader("WhiteElo", "1537"));
    assertTrue(tree.putExtraHeader("ECO", "D00"));
    assertTrue(tree.putExtraHeader("Annotator", "me"));
    assertFalse(tree.putExtraHeader("Event", "roster tag"));

    assertEquals(List.of("WhiteElo", "ECO", "Annotator"), new ArrayList<>(tree.extraHeaders().keySet()));
    assertEquals(Optional.of("D00"), tree.removeExtraHeader("ECO"));
    assertTrue(tree.removeExtraHeader("ECO").isEmpty());
    assertThrows(UnsupportedOperationException.class, () -> tree.extraHeaders().put("x", "y"));
  }

  @Test
  void customStartRecordsSetUpHeaders() {
    String fen = "4k3/8/8/8/8/8/4P3/4K3 w - - 0 1";
    GameTree endgame = GameTree.fromFen(fen);
    assertEquals(Map.of("SetUp", "1", "FEN", fen), endgame.extraHeaders());
    assertEquals(fen, endgame.rules().toFen(endgame.startingPosition()));

    Node e4 = endgame.root().newVariation("e4").orElseThrow();
    assertEquals(e4.board(), e4.replay(endgame.startingPosition()));

    assertThrows(IllegalArgumentException.class, () -> GameTree.fromFen("garbage"));
  }

  @Test
  void customStartKeepsItsMoveNumber() {
    String fen = "4k3/8/8/8/8/8/4P3/4K3 w - - 0 600";
    GameTree late = GameTree.fromFen(fen);
    assertEquals(fen, late.extraHeaders().get("FEN"));
    assertEquals(600, late.startingPosition().fullmoveNumber());

    late.root().newVariation("e4").orElseThrow();
    List<String> lines = late.render();
    assertEquals("600. e4 *", lines.get(lines.size() - 1));
  }

  @Test
  void visitorSeesSideLinesBeforeMainlineContinues() {
    // 1. e4 (1. d4 d5) 1... e5 2. Nf3
    Node root = tree.root();
    Node e4 = root.newVariation("e4").orElseThrow();
    Node d4 = root.newVariation("d4").orElseThrow();
    d4.newVariation("d5").orElseThrow();
    e4.newVariation("e5").orElseThrow().newVariation("Nf3").orElseThrow();
    root.setComment("intro");
    e4.addNag(1);

    List<String> events = tree.accept(new Recorder());
    assertEquals(List.of(
            "begin", "headers", "header Event", "header Site", "header Date", "header Round",
            "header White", "header Black", "header Result", "/headers",
            "comment intro",
            "move e2e4", "nag 1",
            "(", "move d2d4", "move d7d5", ")",
            "move e7e5", "move g1f3",
            "result *"), events);
  }

  @Test
  void renderingAndToStringAgree() {
    tree.root().newVariation("e4").orElseThrow().newVariation("e5").orElseThrow();
    List<String> lines = tree.render();
    assertEquals("[Event \"?\"]", lines.get(0));
    assertEquals("", lines.get(7));
    assertEquals("1. e4 e5 *", lines.get(8));
    assertEquals(String.join("\n", lines) + "\n", tree.toString());
  }

  /** Flattens visitor callbacks into strings. */
  private static final class Recorder implements GameVisitor<List<String>> {
    private final List<String> out = new ArrayList<>();

    @Override public void beginGame() { out.add("begin"); }
    @Override public void beginHeaders() { out.add("headers"); }
    @Override public void visitHeader(String key, String value) { out.add("header " + key); }
    @Override public void endHeaders() { out.add("/headers"); }
    @Override public void visitMove(Board before, Move move) { out.add("move " + move.toUci()); }
    @Override public void visitComment(String comment) { out.add("comment " + comment); }
    @Override public void visitNag(int nag) { out.add("nag " + nag); }
    @Override public boolean beginVariation() { out.add("("); return false; }
    @Override public void endVariation() { out.add(")"); }
    @Override public void visitResult(String result) { out.add("result " + result); }
    @Override public List<String> endGame() { return out; }
  }
}
