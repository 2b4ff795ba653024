/*
 * @LICENSE@
 */
package org.multisearch;

import java.util.Set;

/**
 * The state of one search over a {@link SearchTrie}: the current node and the
 * offset just past the last code point consumed. Read-only with respect to
 * the trie.
 */
final class Cursor {

    private final SearchTrie trie;
    private int node = SearchTrie.ROOT;
    private int offset = 0;

    Cursor(SearchTrie trie) {
        this.trie = trie;
    }

    /**
     * Consumes one code point.
     *
     * @param cp
     *            the code point
     * @param width
     *            its encoded width
     * @return the terms ending here. Valid until the next step; must not be
     *         modified.
     */
    Set<String> step(int cp, int width) {
        offset += width;
        node = trie.next(node, cp);
        return trie.node(node).outputs;
    }

    int offset() {
        return offset;
    }

    int node() {
        return node;
    }

    @Override
    public String toString() {
        return "Cursor: node=" + node + " offset=" + offset;
    }
}
