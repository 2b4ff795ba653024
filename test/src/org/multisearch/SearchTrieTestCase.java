/*
 * @LICENSE@
 */

package org.multisearch;

import static org.multisearch.SearchAssert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;

public class SearchTrieTestCase extends AbstractSearchTestCase {

    public SearchTrieTestCase(String name) {
        super(name);
    }

    public void testAddedTerm() {
        SearchTrie trie = SearchTrie.build("a", "can");
        trie.addSearchTerm("an");
        assertMatches(trie, "you can do it!", "a[5,6)", "an[5,7)", "can[4,7)");
        assertStructure(trie);
    }

    public void testOverlapping() {
        SearchTrie trie = SearchTrie.build("he", "she", "his", "hers");
        assertMatches(trie, "ushers", "she[1,4)", "he[2,4)", "hers[2,6)");
        assertStructure(trie);
    }

    public void testNested() {
        SearchTrie trie = SearchTrie.build("abcd", "bc", "b", "c");
        assertMatches(trie, "xabcdx", "b[2,3)", "bc[2,4)", "c[3,4)", "abcd[1,5)");
    }

    public void testRepeats() {
        SearchTrie trie = SearchTrie.build("aa");
        assertMatches(trie, "aaaa", "aa[0,2)", "aa[1,3)", "aa[2,4)");
    }

    public void testNoTerms() {
        SearchTrie trie = new SearchTrie();
        assertEquals(Collections.emptyList(), search(trie, ""));
        assertEquals(Collections.emptyList(), search(trie, "anything at all"));
        assertEquals(Collections.emptyList(), search(SearchTrie.build(), "anything"));
        assertEquals(1, trie.size());
        assertEquals(0, trie.termCount());
    }

    public void testEmptyInput() {
        assertEquals(Collections.emptyList(), search(SearchTrie.build("a"), ""));
    }

    public void testEmptyTermIgnored() {
        SearchTrie trie = SearchTrie.build("", "ab");
        String before = trie.toJSON();
        trie.addSearchTerm("");
        assertEquals(before, trie.toJSON());
        assertFalse(trie.root().word);
        assertEquals(1, trie.termCount());
        assertStructure(trie);
        assertMatches(trie, "xab", "ab[1,3)");
    }

    public void testIdempotent() {
        SearchTrie trie = SearchTrie.build("she", "he");
        String before = trie.toJSON();
        trie.addSearchTerm("he");
        trie.addSearchTerm("she");
        assertEquals(before, trie.toJSON());
        assertEquals(2, trie.termCount());
        assertMatches(trie, "she", "she[0,3)", "he[1,3)");

        SearchTrie twice = SearchTrie.build("he", "he", "she");
        assertSameShape(trie, twice);
    }

    public void testRepeatedChar() {
        SearchTrie trie = new SearchTrie();
        String term = "";
        for (int i = 0; i < 6; ++i) {
            term += "a";
            trie.addSearchTerm(term);
            assertStructure(trie);
            trie.addSearchTerm(term);
            assertStructure(trie);
        }
        assertSameShape(SearchTrie.build("aaaaaa", "aaaaa", "aaaa", "aaa", "aa", "a"), trie);
        // a term of every length up to i ends at position i
        assertEquals(1 + 2 + 3 + 4 + 5, search(trie, "aaaaa").size());
    }

    public void testRepeatedCharDescending() {
        SearchTrie trie = new SearchTrie();
        for (String term : Arrays.asList("aaaa", "aaa", "aa", "a")) {
            trie.addSearchTerm(term);
            assertStructure(trie);
        }
        assertMatches(trie, "aaa",
            "a[0,1)", "a[1,2)", "a[2,3)", "aa[0,2)", "aa[1,3)", "aaa[0,3)");
    }

    /*
     * The new depth one node must pick up nodes which used to fail to the root.
     */
    public void testRedirectFromRoot() {
        SearchTrie trie = SearchTrie.build("ac", "bcd");
        trie.addSearchTerm("c");
        assertStructure(trie);
        assertMatches(trie, "acbcd", "ac[0,2)", "c[1,2)", "c[3,4)", "bcd[2,5)");
    }

    /*
     * "baa" fails to "a" until "aa" exists; it's found by walking the very set
     * it has to be removed from.
     */
    public void testRedirectWithinWalkedSet() {
        SearchTrie trie = SearchTrie.build("baa", "a");
        SearchTrie.Node baa = trie.node(trie.next(trie.next(trie.next(SearchTrie.ROOT, 'b'), 'a'), 'a'));
        assertEquals("a", trie.pathOf(trie.node(baa.lps)));

        trie.addSearchTerm("aa");
        assertStructure(trie);
        assertEquals("aa", trie.pathOf(trie.node(baa.lps)));
        assertMatches(trie, "baa",
            "a[1,2)", "a[2,3)", "aa[1,3)", "baa[0,3)");
    }

    /*
     * Redirects reach through intermediate nodes which have no matching child.
     */
    public void testRedirectTransitive() {
        SearchTrie trie = SearchTrie.build("xyzq", "yzq", "zq");
        trie.addSearchTerm("q");
        assertStructure(trie);
        assertSameShape(SearchTrie.build("xyzq", "yzq", "zq", "q"), trie);
        assertMatches(trie, "xyzq", "xyzq[0,4)", "yzq[1,4)", "zq[2,4)", "q[3,4)");
    }

    /*
     * A new term in the middle of existing paths: nodes deeper down the
     * inverse failure forest must see it in their outputs.
     */
    public void testOutputPropagation() {
        SearchTrie trie = SearchTrie.build("abcd", "xbcd", "bcd");
        trie.addSearchTerm("cd");
        trie.addSearchTerm("d");
        assertStructure(trie);
        assertMatches(trie, "abcd", "abcd[0,4)", "bcd[1,4)", "cd[2,4)", "d[3,4)");
        assertMatches(trie, "xbcd", "xbcd[0,4)", "bcd[1,4)", "cd[2,4)", "d[3,4)");
    }

    public void testSearchBetweenAdds() {
        SearchTrie trie = SearchTrie.build("can");
        assertMatches(trie, "you can do it!", "can[4,7)");
        trie.addSearchTerm("an");
        assertMatches(trie, "you can do it!", "can[4,7)", "an[5,7)");
        trie.addSearchTerm("a");
        assertMatches(trie, "you can do it!", "can[4,7)", "an[5,7)", "a[5,6)");
        trie.addSearchTerm("do it");
        assertMatches(trie, "you can do it!", "can[4,7)", "an[5,7)", "a[5,6)", "do it[8,13)");
    }

    public void testCaseSensitive() {
        SearchTrie trie = SearchTrie.build("Can");
        assertMatches(trie, "can Can CAN", "Can[4,7)");
    }

    public void testMultiByte() {
        // é is 2 bytes, € 3, the G clef 4
        SearchTrie trie = SearchTrie.build("é", "€", "\uD834\uDD1E", "aé€");
        assertMatches(trie, "aé€\uD834\uDD1E",
            "é[1,3)", "€[3,6)", "aé€[0,6)", "\uD834\uDD1E[6,10)");
        assertStructure(trie);
        assertTrue(trie.root().child(0x1D11E) != SearchTrie.NONE);
    }

    public void testCursor() {
        SearchTrie trie = SearchTrie.build("ab", "b");
        Cursor cursor = trie.cursor();
        assertEquals(Collections.emptySet(), cursor.step('a', 1));
        assertEquals(1, cursor.offset());
        assertEquals(new HashSet<String>(Arrays.asList("ab", "b")), cursor.step('b', 1));
        assertEquals(2, cursor.offset());
        assertEquals(Collections.emptySet(), cursor.step('x', 1));
        assertEquals(SearchTrie.ROOT, cursor.node());
        assertEquals(3, cursor.offset());
    }

    public void testJSON() {
        SearchTrie trie = SearchTrie.build("he", "she");
        assertEquals(
            "{\"id\":0,\"ot\":[],\"children\":{"
                + "\"h\":{\"id\":1,\"ot\":[],\"children\":{"
                    + "\"e\":{\"id\":2,\"isWord\":true,\"ot\":[\"he\"],\"children\":{}}}},"
                + "\"s\":{\"id\":3,\"ot\":[],\"children\":{"
                    + "\"h\":{\"id\":4,\"lps\":1,\"ot\":[],\"children\":{"
                        + "\"e\":{\"id\":5,\"lps\":2,\"isWord\":true,\"ot\":[\"he\",\"she\"],\"children\":{}}}}}}}}",
            trie.toJSON());
    }

    public void testJSONEscapes() {
        SearchTrie trie = SearchTrie.build("\"\\\u00e9");
        String json = trie.toJSON();
        assertTrue(json, json.contains("\"ot\":[\"\\\"\\\\\\u00e9\"]"));
        assertTrue(json, json.contains("\"\\u00e9\":{"));
    }

    public void testBatchMatchesIncremental() {
        String[] terms = {"he", "she", "his", "hers", "her", "is", "s", "ushers"};
        SearchTrie incremental = new SearchTrie();
        for (String term : terms) {
            incremental.addSearchTerm(term);
        }
        SearchTrie batch = SearchTrie.build(terms);
        assertStructure(batch);
        assertStructure(incremental);
        assertSameShape(batch, incremental);
        assertEquals(batch.toJSON(), incremental.toJSON());
    }

    public void testNullTerm() {
        try {
            new SearchTrie().addSearchTerm(null);
            fail();
        } catch (NullPointerException e) {
            // expected
        }
    }

    public void testNullSource() {
        try {
            new SearchTrie().search(null);
            fail();
        } catch (NullPointerException e) {
            // expected
        }
    }

    public void testToString() {
        SearchTrie trie = SearchTrie.build("ab", "b");
        assertEquals("SearchTrie: nodes=4 terms=2", trie.toString());
    }
}
