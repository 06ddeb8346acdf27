package game.impl;

import game.records.Diagnostic;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import rules.Board;
import rules.Move;

/**
 * Handle onto one position of a {@link GameTree}.
 *
 * <p>Handles are cheap and freely shared: any number of them may point at the same node and all of
 * them see every mutation at once. Two handles are equal only if they name the same slot of the same
 * tree; nodes with identical moves and comments (a transposition, say) are still different nodes.
 *
 * <p>After the node is removed the handle is stale. Queries then return empty results and mutators
 * return {@code false} or empty; the live tree is never touched through a stale handle.
 */
public final class Node {

    private final GameTree tree;
    private final int id;

    Node(GameTree tree, int id) {
        this.tree = tree;
        this.id   = id;
    }

    public GameTree tree() {
        return tree;
    }

    /** Arena id; stable for the lifetime of the tree and never reused. */
    public int id() {
        return id;
    }

    public boolean isAlive() {
        return tree.alive(id);
    }

    public boolean isRoot() {
        return isAlive() && tree.parentId(id) < 0;
    }

    /* ── navigation ────────────────────────────────────────────── */

    public Optional<Node> parent() {
        int p = tree.parentId(id);
        return p < 0 ? Optional.empty() : Optional.of(new Node(tree, p));
    }

    /** The move on the edge from the parent; empty for the root. */
    public Optional<Move> prevMove() {
        return Optional.ofNullable(tree.moveOf(id));
    }

    /** Children in order: index 0 is the mainline, the rest are side variations. */
    public List<Node> children() {
        return handles(tree.childIds(id));
    }

    /**
     * Replaces the child list in one step. {@code order} must be a reordering of some or all of the
     * current children; children left out are removed together with their subtrees.
     *
     * @return {@code false}, with no change, if {@code order} contains a foreign node or a duplicate
     */
    public boolean setChildren(List<Node> order) {
        if (!isAlive()) return false;
        List<Integer> ids = new ArrayList<>(order.size());
        for (Node n : order) {
            if (n == null || n.tree != tree) return false;
            ids.add(n.id);
        }
        return tree.replaceChildren(id, ids);
    }

    public Optional<Node> mainline() {
        List<Integer> c = tree.childIds(id);
        return c.isEmpty() ? Optional.empty() : Optional.of(new Node(tree, c.get(0)));
    }

    public List<Node> otherVariations() {
        List<Integer> c = tree.childIds(id);
        return c.size() <= 1 ? List.of() : handles(c.subList(1, c.size()));
    }

    /** The parent's other children; empty for the root. */
    public List<Node> siblings() {
        int p = tree.parentId(id);
        if (p < 0) return List.of();
        List<Node> out = new ArrayList<>();
        for (int c : tree.childIds(p)) {
            if (c != id) out.add(new Node(tree, c));
        }
        return out;
    }

    /** This node followed by its mainline continuation to the end of the line. */
    public List<Node> mainlineNodes() {
        if (!isAlive()) return List.of();
        List<Node> out = new ArrayList<>();
        Optional<Node> cur = Optional.of(this);
        while (cur.isPresent()) {
            out.add(cur.get());
            cur = cur.get().mainline();
        }
        return out;
    }

    public Node root() {
        return tree.root();
    }

    /** Plies from the root, or {@code -1} for a stale handle. */
    public int depth() {
        return tree.depthOf(id);
    }

    /* ── structure edits ───────────────────────────────────────── */

    /**
     * Plays {@code move} from this position and appends the result as the last child.
     *
     * @return the new node, or empty if the move is illegal here or this handle is stale
     */
    public Optional<Node> newVariation(Move move) {
        Board board = tree.boardOf(id);
        if (board == null || move == null || !tree.rules().isLegal(board, move)) return Optional.empty();
        return Optional.of(new Node(tree, tree.extend(id, move)));
    }

    /** Same as {@link #newVariation(Move)} with the move given in SAN. */
    public Optional<Node> newVariation(String san) {
        Board board = tree.boardOf(id);
        if (board == null) return Optional.empty();
        return tree.rules().notationToMove(board, san).map(m -> new Node(tree, tree.extend(id, m)));
    }

    /**
     * Detaches this node and its whole subtree from the tree.
     *
     * @return this handle, now stale, or empty for the root or an already stale handle
     */
    public Optional<Node> removeNode() {
        if (!isAlive()) return Optional.empty();
        int p = tree.parentId(id);
        if (p < 0) {
            tree.report(Diagnostic.Kind.STRUCTURAL_MISUSE, id, "cannot remove the root");
            return Optional.empty();
        }

        List<Integer> keep = new ArrayList<>(tree.childIds(p));
        keep.remove(Integer.valueOf(id));
        if (!tree.replaceChildren(p, keep)) {
            throw new IllegalStateException("node " + id + " missing from its parent " + p);
        }
        return Optional.of(this);
    }

    /**
     * Moves {@code child} to the mainline slot; the other children keep their relative order.
     *
     * @return {@code false}, with no change, if {@code child} is not currently a child of this node
     */
    public boolean promoteVariation(Node child) {
        if (!isAlive()) return false;
        List<Integer> order = new ArrayList<>(tree.childIds(id));
        if (child == null || child.tree != tree || !order.contains(child.id)) {
            tree.report(Diagnostic.Kind.STRUCTURAL_MISUSE, id,
                    "promote of " + (child == null ? "null" : "node " + child.id) + " which is not a child");
            return false;
        }

        order.remove(Integer.valueOf(child.id));
        order.add(0, child.id);
        return tree.replaceChildren(id, order);
    }

    /* ── annotations ───────────────────────────────────────────── */

    /** Comment on the position reached here; on the root this is the game comment. */
    public Optional<String> comment() {
        return Optional.ofNullable(tree.comment(id));
    }

    /** {@code null} clears. */
    public boolean setComment(String comment) {
        return tree.setComment(id, comment);
    }

    /** Comment printed before this node's move. Always empty on the root. */
    public Optional<String> startingComment() {
        return Optional.ofNullable(tree.startingComment(id));
    }

    /** @return {@code false} on the root or a stale handle */
    public boolean setStartingComment(String comment) {
        return tree.setStartingComment(id, comment);
    }

    /** Annotation glyphs in insertion order. Always empty on the root. */
    public Set<Integer> nags() {
        return tree.nags(id);
    }

    /** @return {@code true} if the glyph was not yet present */
    public boolean addNag(int nag) {
        return nag > 0 && tree.editNag(id, nag, true);
    }

    public boolean removeNag(int nag) {
        return tree.editNag(id, nag, false);
    }

    /* ── positions ─────────────────────────────────────────────── */

    /** Moves from the root to this node; empty for the root or a stale handle. */
    public List<Move> moves() {
        if (!isAlive()) return List.of();
        List<Move> out = new ArrayList<>(Math.max(0, depth()));
        for (int cur = id; tree.parentId(cur) >= 0; cur = tree.parentId(cur)) {
            out.add(tree.moveOf(cur));
        }
        Collections.reverse(out);
        return out;
    }

    /** Position reached at this node. */
    public Optional<Board> board() {
        return Optional.ofNullable(tree.boardOf(id));
    }

    /** Position before {@link #prevMove()}; empty for the root. */
    public Optional<Board> boardBefore() {
        int p = tree.parentId(id);
        return p < 0 ? Optional.empty() : Optional.of(tree.boardOf(p));
    }

    /**
     * Replays {@link #moves()} onto {@code start} without legality checks. From the tree's starting
     * position this always yields {@link #board()}.
     */
    public Optional<Board> replay(Board start) {
        if (!isAlive()) return Optional.empty();
        Board b = start;
        for (Move m : moves()) b = tree.rules().apply(b, m);
        return Optional.of(b);
    }

    /** SAN of {@link #prevMove()} with its check suffix; empty for the root. */
    public Optional<String> san() {
        return boardBefore().map(b -> tree.rules().moveToNotation(b, tree.moveOf(id)));
    }

    private List<Node> handles(List<Integer> ids) {
        List<Node> out = new ArrayList<>(ids.size());
        for (int c : ids) out.add(new Node(tree, c));
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Node)) return false;
        Node other = (Node) o;
        return tree == other.tree && id == other.id;
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(tree), id);
    }

    @Override
    public String toString() {
        return isAlive()
                ? "Node#" + id + prevMove().map(m -> "(" + m + ")").orElse("(root)")
                : "Node#" + id + "(removed)";
    }
}
