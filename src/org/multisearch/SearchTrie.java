/*
 * @LICENSE@
 */

package org.multisearch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * An Aho-Corasick automaton which can take on new search terms after it has
 * been built and searched.
 * <p>
 * The automaton is a trie of {@link Node}s, one per distinct prefix of the
 * terms, plus a root. Each node carries its failure link (the node for its
 * longest proper suffix which is also in the trie), the inverse of that
 * relation, and its output set: every term which is a suffix of the node's
 * path. Output sets are kept closed under the failure relation at all times,
 * so matching never walks failure chains to collect terms.
 * <p>
 * Nodes live in an arena owned by the trie and refer to each other by index.
 * A node's index is its id; ids are handed out in creation order, and are
 * only unique within one trie.
 * <p>
 * Adding a term creates any missing nodes along its path and completes each
 * new node's failure function on the spot. Existing nodes which now have a
 * longer suffix in the trie are found by walking the inverse failure links
 * and are re-pointed; new terms are pushed out to every node whose failure
 * chain reaches the term's node. The result is the same automaton
 * {@link #build(Iterable)} would produce for the full set of terms.
 * <p>
 * Instances are not thread safe for writers. Any number of searches may run
 * concurrently, but {@link #addSearchTerm(String)} must be serialized with
 * respect to all searches in flight and to other additions.
 */
public final class SearchTrie implements Searcher {

    private static final Logger logger = Logger.getLogger("org.multisearch");
    private static final Level level = Level.FINEST;

    static final int ROOT = 0;
    static final int NONE = -1;

    /**
     * A trie node. All links are arena indices; {@link #NONE} stands for "no
     * link", which for {@link #lps} is only ever true of the root.
     */
    static final class Node {

        final int id;
        final int parent;
        final int cp;
        final int depth;
        boolean word;
        final SortedMap<Integer, Integer> children = new TreeMap<Integer, Integer>();
        int lps = NONE;
        final SortedSet<Integer> ilps = new TreeSet<Integer>();
        final Set<String> outputs = new LinkedHashSet<String>();

        private Node(int id, int parent, int cp, int depth) {
            this.id = id;
            this.parent = parent;
            this.cp = cp;
            this.depth = depth;
        }

        int child(int cp) {
            Integer child = children.get(cp);
            return child == null ? NONE : child;
        }

        boolean isRoot() {
            return parent == NONE;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append("node ").append(id);
            if (!isRoot()) {
                sb.append(" '").appendCodePoint(cp).append("' lps=").append(lps);
            }
            if (word) sb.append(" (word)");
            sb.append(" ilps=").append(ilps);
            sb.append(" ot=").append(outputs);
            return sb.toString();
        }
    }

    private final List<Node> nodes = new ArrayList<Node>();
    private final Executor executor;
    private int words = 0;

    /**
     * Creates an empty trie. Searches run on a new daemon thread each.
     */
    public SearchTrie() {
        this(null);
    }

    /**
     * Creates an empty trie whose searches run on the given executor.
     *
     * @param executor
     *            runs one producer task per search. The task blocks while the
     *            consumer of its matches falls behind, so a bounded pool can
     *            starve; <code>null</code> means a new daemon thread per
     *            search.
     */
    public SearchTrie(Executor executor) {
        this.executor = executor != null ? executor : newThreadExecutor();
        nodes.add(new Node(ROOT, NONE, NONE, 0));
    }

    /**
     * Builds a trie for the given terms in one pass: all terms are entered
     * first, then failure links and output sets are computed breadth first.
     *
     * @param terms
     *            the initial terms.
     * @return the trie.
     */
    public static SearchTrie build(Iterable<String> terms) {
        return build(terms, null);
    }

    public static SearchTrie build(String... terms) {
        return build(Arrays.asList(terms), null);
    }

    public static SearchTrie build(Iterable<String> terms, Executor executor) {
        SearchTrie trie = new SearchTrie(executor);
        for (String term : terms) {
            trie.enterInTrie(term);
        }
        trie.buildFailureFn();

        logger.log(level, "built: " + trie);
        if (logger.isLoggable(level)) {
            logger.log(level, "trie: " + trie.toJSON());
        }
        assert trie.invariantViolations().isEmpty() : trie.invariantViolations();
        return trie;
    }

    /**
     * Adds a term, completing the failure function of every node it creates
     * and redirecting existing nodes which now have a longer proper suffix in
     * the trie. Adding a term already present changes nothing. The empty term
     * is ignored: it would match between every pair of characters.
     */
    public void addSearchTerm(String term) {
        if (term == null) {
            throw new NullPointerException("term");
        }
        if (term.length() == 0) {
            logger.fine("ignoring empty search term");
            return;
        }
        logger.log(level, "term: " + Misc.Esc.JSON.esc(term));

        Node current = root();
        for (int i = 0; i < term.length(); ) {
            int cp = term.codePointAt(i);
            int next = current.child(cp);
            current = next == NONE ? enterChild(current, cp) : nodes.get(next);
            i += Character.charCount(cp);
        }
        enterOutput(current, term);

        assert invariantViolations().isEmpty() : invariantViolations();
    }

    /**
     * {@inheritDoc}
     * <p>
     * The search runs on this trie's executor, feeding a small bounded buffer
     * which the returned {@link Matches} drains.
     */
    public Matches search(CodePointSource in) {
        if (in == null) {
            throw new NullPointerException("in");
        }
        return new Matches(this, in, executor);
    }

    /*
     * Batch path: the trie only, no failure function.
     */
    private void enterInTrie(String term) {
        if (term.length() == 0) {
            logger.fine("ignoring empty search term");
            return;
        }
        Node current = root();
        for (int i = 0; i < term.length(); ) {
            int cp = term.codePointAt(i);
            int next = current.child(cp);
            current = next == NONE ? newNode(current, cp) : nodes.get(next);
            i += Character.charCount(cp);
        }
        if (!current.word) {
            current.word = true;
            current.outputs.add(term);
            ++words;
        }
    }

    /**
     * Computes failure links in order of non-decreasing depth: a node's link
     * only depends on links of shallower nodes, which are final by the time
     * it is reached.
     */
    private void buildFailureFn() {
        LinkedList<Node> queue = new LinkedList<Node>();
        for (int child : root().children.values()) {
            queue.add(nodes.get(child));
        }
        while (!queue.isEmpty()) {
            Node node = queue.remove();
            Node target = nodes.get(failureTarget(node.parent, node.cp));
            link(node, target);
            node.outputs.addAll(target.outputs);
            for (int child : node.children.values()) {
                queue.add(nodes.get(child));
            }
        }
    }

    private Node newNode(Node parent, int cp) {
        Node child = new Node(nodes.size(), parent.id, cp, parent.depth + 1);
        nodes.add(child);
        parent.children.put(cp, child.id);
        return child;
    }

    /*
     * Incremental path: a new node, with its failure function complete, and
     * every existing node which should now fail to it redirected.
     */
    private Node enterChild(Node parent, int cp) {
        Node target = nodes.get(failureTarget(parent.id, cp));
        Node child = newNode(parent, cp);
        link(child, target);
        child.outputs.addAll(target.outputs);
        completeInverseFn(parent, cp, child);
        return child;
    }

    /**
     * Finds the failure target for the node reached from <code>parent</code>
     * by <code>cp</code>: the <code>cp</code> child of the first node on the
     * parent's failure chain which has one, or the root.
     */
    private int failureTarget(int parent, int cp) {
        if (parent == ROOT) {
            return ROOT;
        }
        int m = parent;
        do {
            m = nodes.get(m).lps;
            int mp = nodes.get(m).child(cp);
            if (mp != NONE) {
                return mp;
            }
        } while (m != ROOT);
        return ROOT;
    }

    /**
     * Re-points the <code>cp</code> children of every node whose failure
     * chain reaches <code>parent</code> without passing a node that already
     * has a <code>cp</code> child; those children now have <code>child</code>
     * as their longest proper suffix. Their output sets already contain
     * everything <code>child</code>'s do.
     */
    private void completeInverseFn(Node parent, int cp, Node child) {
        List<Node> redirects = new ArrayList<Node>();
        LinkedList<Node> stack = new LinkedList<Node>();
        stack.push(parent);
        while (!stack.isEmpty()) {
            for (int x : stack.pop().ilps) {
                Node xn = nodes.get(x);
                int xp = xn.child(cp);
                if (xp != NONE) {
                    redirects.add(nodes.get(xp));
                } else {
                    stack.push(xn);
                }
            }
        }
        // collected first: a redirect can edit the set being walked
        for (Node y : redirects) {
            unlink(y);
            link(y, child);
        }
        if (!redirects.isEmpty()) {
            logger.log(level, "redirected to " + child.id + ": " + redirects.size());
        }
    }

    /**
     * Marks <code>node</code> as a word and adds the term to its output set and
     * to those of every node in its inverse failure subtree.
     */
    private void enterOutput(Node node, String term) {
        if (node.word) {
            return;
        }
        node.word = true;
        ++words;
        LinkedList<Node> stack = new LinkedList<Node>();
        stack.push(node);
        while (!stack.isEmpty()) {
            Node x = stack.pop();
            x.outputs.add(term);
            for (int y : x.ilps) {
                stack.push(nodes.get(y));
            }
        }
    }

    private void link(Node node, Node target) {
        node.lps = target.id;
        target.ilps.add(node.id);
    }

    private void unlink(Node node) {
        nodes.get(node.lps).ilps.remove(node.id);
        node.lps = NONE;
    }

    /*
     * read-only accessors for Cursor and tests
     */

    Node root() {
        return nodes.get(ROOT);
    }

    Node node(int id) {
        return nodes.get(id);
    }

    /**
     * The goto function with failure: the node reached from <code>from</code>
     * on <code>cp</code>, falling back along failure links, or the root.
     */
    int next(int from, int cp) {
        Node n = nodes.get(from);
        while (!n.isRoot() && n.child(cp) == NONE) {
            n = nodes.get(n.lps);
        }
        int child = n.child(cp);
        return child == NONE ? ROOT : child;
    }

    Cursor cursor() {
        return new Cursor(this);
    }

    /**
     * @return the number of nodes, root included.
     */
    public int size() {
        return nodes.size();
    }

    /**
     * @return the number of distinct terms.
     */
    public int termCount() {
        return words;
    }

    /**
     * The path from the root to a node, as a string.
     */
    String pathOf(Node node) {
        int[] cps = new int[node.depth];
        for (Node n = node; !n.isRoot(); n = nodes.get(n.parent)) {
            cps[n.depth - 1] = n.cp;
        }
        return new String(cps, 0, cps.length);
    }

    /**
     * Checks the structural invariants of the trie: children agree with their
     * parents; every node but the root has a failure link to a shallower
     * node; the failure and inverse failure relations mirror each other
     * exactly; and output sets contain the node's own term and everything in
     * the failure target's output set.
     *
     * @return a description of each violation found; empty if none.
     */
    List<String> invariantViolations() {
        List<String> ret = new ArrayList<String>();
        Node root = root();
        if (root.lps != NONE || root.word) {
            ret.add("root: " + root);
        }
        for (Node n : nodes) {
            for (Map.Entry<Integer, Integer> e : n.children.entrySet()) {
                Node c = nodes.get(e.getValue());
                if (c.parent != n.id || c.cp != e.getKey() || c.depth != n.depth + 1) {
                    ret.add("child " + c.id + " of " + n.id + " disagrees: " + c);
                }
            }
            for (int x : n.ilps) {
                if (nodes.get(x).lps != n.id) {
                    ret.add("ilps of " + n.id + " has " + x + " which fails to " + nodes.get(x).lps);
                }
            }
            if (n.isRoot()) {
                continue;
            }
            if (n.lps == NONE) {
                ret.add("no failure link: " + n);
                continue;
            }
            Node f = nodes.get(n.lps);
            if (f.depth >= n.depth) {
                ret.add("failure link not shallower: " + n + " -> " + f);
            }
            if (!f.ilps.contains(n.id)) {
                ret.add("missing from ilps of " + f.id + ": " + n.id);
            }
            if (!n.outputs.containsAll(f.outputs)) {
                ret.add("outputs not closed: " + n + " -> " + f);
            }
            if (n.word && !n.outputs.contains(pathOf(n))) {
                ret.add("word missing own term: " + n);
            }
        }
        return ret;
    }

    /**
     * Dumps the trie as JSON, for debugging: each node's id, its failure link
     * (omitted when it is the root), whether it is a word, its output set and
     * its children keyed by character. Not a storage format.
     */
    public String toJSON() {
        StringBuilder sb = new StringBuilder();
        toJSON(sb, root());
        return sb.toString();
    }

    private void toJSON(StringBuilder sb, Node node) {
        sb.append("{\"id\":").append(node.id);
        if (node.lps != NONE && node.lps != ROOT) {
            sb.append(",\"lps\":").append(node.lps);
        }
        if (node.word) {
            sb.append(",\"isWord\":true");
        }
        sb.append(",\"ot\":[");
        String sep = "";
        for (String term : new TreeSet<String>(node.outputs)) {
            sb.append(sep);
            Misc.Esc.JSON.quote(sb, term);
            sep = ",";
        }
        sb.append("],\"children\":{");
        sep = "";
        for (Map.Entry<Integer, Integer> e : node.children.entrySet()) {
            sb.append(sep);
            Misc.Esc.JSON.quote(sb, new String(Character.toChars(e.getKey())));
            sb.append(':');
            toJSON(sb, nodes.get(e.getValue()));
            sep = ",";
        }
        sb.append("}}");
    }

    @Override
    public String toString() {
        return "SearchTrie: nodes=" + nodes.size() + " terms=" + words;
    }

    /*
     * One daemon thread per search; the counter only names them.
     */
    private static Executor newThreadExecutor() {
        final AtomicInteger count = new AtomicInteger();
        return new Executor() {
            public void execute(Runnable command) {
                Thread t = new Thread(command, "multisearch-search-" + count.incrementAndGet());
                t.setDaemon(true);
                t.start();
            }
        };
    }

    /**
     * For testability: the terms of the trie, in no particular order.
     */
    Set<String> terms() {
        Set<String> ret = new TreeSet<String>();
        for (Node n : nodes) {
            if (n.word) ret.add(pathOf(n));
        }
        return Collections.unmodifiableSet(ret);
    }
}
