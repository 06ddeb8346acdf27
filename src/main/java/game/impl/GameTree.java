package game.impl;

import static game.constants.PgnConstants.TAG_FEN;
import static game.constants.PgnConstants.TAG_SETUP;

import game.contracts.Diagnostics;
import game.contracts.GameVisitor;
import game.records.Diagnostic;
import game.records.PgnSettings;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import rules.Board;
import rules.Move;
import rules.contracts.RulesEngine;
import rules.impl.RulesEngineImpl;

/**
 * An editable game: a tree of positions with its header and starting position.
 *
 * <p>Nodes live in an arena owned by the tree and are addressed by integer ids that are never
 * reused. Links between nodes are ids, so a parent and its children never own each other. A
 * {@link Node} is only a handle onto a slot; once the slot is cleared by a removal the handle is
 * stale and every operation through it reports "absent".
 *
 * <p>The arena only grows. A removed node leaves an empty slot behind, and a new {@code FEN}
 * root is appended after the old slots, so memory follows every node ever created rather than the
 * live ones. A long editing session can start over on a compact arena with
 * {@code fromPgn(tree.toString())}; the copy has fresh ids.
 */
public final class GameTree {

    /** One arena slot. {@code parent == -1} marks the root. */
    private static final class NodeData {
        final int parent;
        final Move move;
        final Board board;
        final int depth;
        final List<Integer> children = new ArrayList<>(2);
        final Set<Integer> nags = new LinkedHashSet<>();
        String comment;
        String startingComment;

        NodeData(int parent, Move move, Board board, int depth) {
            this.parent = parent;
            this.move   = move;
            this.board  = board;
            this.depth  = depth;
        }
    }

    private final RulesEngine rules;
    private final Diagnostics diagnostics;
    private final Header header = new Header();
    private final Map<String, String> extraHeaders = new LinkedHashMap<>();
    private final List<NodeData> arena = new ArrayList<>();

    private Board start;
    private int rootId;
    private int live;

    public GameTree() {
        this(new RulesEngineImpl(), LoggingDiagnostics.INSTANCE);
    }

    public GameTree(RulesEngine rules, Diagnostics diagnostics) {
        this(rules, diagnostics, rules.startingPosition());
    }

    /**
     * A tree rooted at {@code start}. A position other than the standard one is recorded in
     * {@code SetUp} and {@code FEN} headers so that it survives export.
     */
    public GameTree(RulesEngine rules, Diagnostics diagnostics, Board start) {
        this.rules = rules;
        this.diagnostics = diagnostics;
        resetStartingPosition(start);
        if (!start.equals(rules.startingPosition())) {
            extraHeaders.put(TAG_SETUP, "1");
            extraHeaders.put(TAG_FEN, rules.toFen(start));
        }
    }

    /**
     * @throws IllegalArgumentException if {@code fen} does not describe a usable position
     */
    public static GameTree fromFen(String fen) {
        RulesEngine rules = new RulesEngineImpl();
        return new GameTree(rules, LoggingDiagnostics.INSTANCE, rules.parseStartPosition(fen));
    }

    /**
     * Parses the first game in {@code pgn}.
     *
     * @throws game.PgnFormatException if the text holds no game or is structurally unreadable
     */
    public static GameTree fromPgn(String pgn) {
        return new PgnReader().read(pgn);
    }

    public static GameTree fromPgn(String pgn, RulesEngine rules, Diagnostics diagnostics) {
        return new PgnReader(rules, diagnostics).read(pgn);
    }

    /* ── tree-level queries ────────────────────────────────────── */

    public Node root() {
        return new Node(this, rootId);
    }

    /** The live node with this id, if any. */
    public Optional<Node> node(int id) {
        return data(id) == null ? Optional.empty() : Optional.of(new Node(this, id));
    }

    /** {@code true} if {@code node} belongs to this tree and has not been removed. */
    public boolean exists(Node node) {
        return node != null && node.tree() == this && data(node.id()) != null;
    }

    /** Number of live nodes, the root included. */
    public int nodeCount() {
        return live;
    }

    public Board startingPosition() {
        return start;
    }

    public Header header() {
        return header;
    }

    /** Non-roster headers in insertion order. */
    public Map<String, String> extraHeaders() {
        return Collections.unmodifiableMap(extraHeaders);
    }

    /**
     * Adds or replaces a non-roster header.
     *
     * @return {@code false} if {@code key} is a roster tag; those go through {@link #header()}
     */
    public boolean putExtraHeader(String key, String value) {
        if (key == null || value == null || header.tags().containsKey(key)) return false;
        extraHeaders.put(key, value);
        return true;
    }

    public Optional<String> removeExtraHeader(String key) {
        return Optional.ofNullable(extraHeaders.remove(key));
    }

    public RulesEngine rules() {
        return rules;
    }

    public Diagnostics diagnostics() {
        return diagnostics;
    }

    /* ── tree-level mutation ───────────────────────────────────── */

    /** Plays a legal {@code move} from {@code at}; empty if the move is illegal or {@code at} is stale. */
    public Optional<Node> addNode(Node at, Move move) {
        return exists(at) ? at.newVariation(move) : Optional.empty();
    }

    /** Detaches {@code node} and its subtree; empty for the root or a stale handle. */
    public Optional<Node> removeNode(Node node) {
        return exists(node) ? node.removeNode() : Optional.empty();
    }

    /**
     * Makes {@code node} the mainline continuation of its parent.
     *
     * @return {@code node}, or empty if it is the root or stale
     */
    public Optional<Node> promoteVariation(Node node) {
        if (!exists(node)) return Optional.empty();
        Optional<Node> parent = node.parent();
        if (parent.isEmpty()) {
            report(Diagnostic.Kind.STRUCTURAL_MISUSE, node.id(), "cannot promote the root");
            return Optional.empty();
        }
        return parent.get().promoteVariation(node) ? Optional.of(node) : Optional.empty();
    }

    /* ── traversal and export ──────────────────────────────────── */

    /**
     * Walks the tree: headers, game comment, movetext, result. Side lines of a node are visited
     * after its mainline move and before the mainline continues.
     */
    public <R> R accept(GameVisitor<R> visitor) {
        visitor.beginGame();

        visitor.beginHeaders();
        header.tags().forEach(visitor::visitHeader);
        extraHeaders.forEach(visitor::visitHeader);
        visitor.endHeaders();

        NodeData root = arena.get(rootId);
        if (root.comment != null) visitor.visitComment(root.comment);

        walk(rootId, visitor);

        visitor.visitResult(header.result().toString());
        return visitor.endGame();
    }

    private <R> void walk(int id, GameVisitor<R> visitor) {
        List<Integer> children = arena.get(id).children;
        if (children.isEmpty()) return;

        Board before = arena.get(id).board;
        int main = children.get(0);
        visitEdge(before, main, visitor);

        for (int i = 1; i < children.size(); i++) {
            int side = children.get(i);
            if (visitor.beginVariation()) continue;
            visitEdge(before, side, visitor);
            walk(side, visitor);
            visitor.endVariation();
        }

        walk(main, visitor);
    }

    private <R> void visitEdge(Board before, int id, GameVisitor<R> visitor) {
        NodeData d = arena.get(id);
        if (d.startingComment != null) visitor.visitComment(d.startingComment);
        visitor.visitMove(before, d.move);
        for (int nag : d.nags) visitor.visitNag(nag);
        if (d.comment != null) visitor.visitComment(d.comment);
    }

    public List<String> render() {
        return render(PgnSettings.DEFAULT);
    }

    public List<String> render(int maxWidth) {
        return render(PgnSettings.DEFAULT.withMaxWidth(maxWidth));
    }

    public List<String> render(PgnSettings settings) {
        return accept(new PgnWriter(rules, settings));
    }

    /** The unwrapped export, every line terminated by a newline. */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (String line : render()) sb.append(line).append('\n');
        return sb.toString();
    }

    /* ── arena access for Node and PgnReader ───────────────────── */

    private NodeData data(int id) {
        return id >= 0 && id < arena.size() ? arena.get(id) : null;
    }

    boolean alive(int id) {
        return data(id) != null;
    }

    int parentId(int id) {
        NodeData d = data(id);
        return d == null ? -1 : d.parent;
    }

    Move moveOf(int id) {
        NodeData d = data(id);
        return d == null ? null : d.move;
    }

    Board boardOf(int id) {
        NodeData d = data(id);
        return d == null ? null : d.board;
    }

    int depthOf(int id) {
        NodeData d = data(id);
        return d == null ? -1 : d.depth;
    }

    List<Integer> childIds(int id) {
        NodeData d = data(id);
        return d == null ? List.of() : List.copyOf(d.children);
    }

    String comment(int id) {
        NodeData d = data(id);
        return d == null ? null : d.comment;
    }

    boolean setComment(int id, String comment) {
        NodeData d = data(id);
        if (d == null) return false;
        d.comment = comment;
        return true;
    }

    String startingComment(int id) {
        NodeData d = data(id);
        return d == null ? null : d.startingComment;
    }

    boolean setStartingComment(int id, String comment) {
        NodeData d = data(id);
        if (d == null || d.parent < 0) return false;
        d.startingComment = comment;
        return true;
    }

    Set<Integer> nags(int id) {
        NodeData d = data(id);
        return d == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(d.nags));
    }

    /** Edits the NAG set of a non-root node; {@code add == false} removes. */
    boolean editNag(int id, int nag, boolean add) {
        NodeData d = data(id);
        if (d == null || d.parent < 0) return false;
        return add ? d.nags.add(nag) : d.nags.remove(nag);
    }

    /**
     * Appends a child without checking legality. Only for moves already resolved against the
     * parent's position.
     */
    int extend(int parentId, Move move) {
        NodeData p = data(parentId);
        if (p == null) throw new IllegalStateException("extend on dead node " + parentId);

        NodeData child = new NodeData(parentId, move, rules.apply(p.board, move), p.depth + 1);
        arena.add(child);
        int id = arena.size() - 1;
        p.children.add(id);
        live++;
        return id;
    }

    /**
     * Replaces the child list of {@code id} with a reordering of a subset of it. Children left out
     * are removed with their subtrees.
     *
     * @return {@code false}, without mutating, if {@code order} names a node that is not currently a
     *     child of {@code id} or names one twice
     */
    boolean replaceChildren(int id, List<Integer> order) {
        NodeData d = data(id);
        if (d == null) return false;

        Set<Integer> seen = new HashSet<>();
        for (int c : order) {
            if (!d.children.contains(c) || !seen.add(c)) return false;
        }

        for (int c : d.children) {
            if (!seen.contains(c)) clearSubtree(c);
        }
        d.children.clear();
        d.children.addAll(order);
        return true;
    }

    /** Empties the slots of {@code id} and all of its descendants. */
    private void clearSubtree(int id) {
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(id);
        while (!queue.isEmpty()) {
            int cur = queue.poll();
            NodeData d = arena.get(cur);
            if (d == null) continue;
            queue.addAll(d.children);
            arena.set(cur, null);
            live--;
        }
    }

    /**
     * Discards every node and roots the tree at {@code position}. Used when a {@code FEN} header
     * arrives during import.
     */
    void resetStartingPosition(Board position) {
        for (int i = 0; i < arena.size(); i++) arena.set(i, null);
        start = position;
        arena.add(new NodeData(-1, null, position, 0));
        rootId = arena.size() - 1;
        live = 1;
    }

    void report(Diagnostic.Kind kind, int nodeId, String message) {
        diagnostics.report(new Diagnostic(kind, nodeId, message));
    }
}
