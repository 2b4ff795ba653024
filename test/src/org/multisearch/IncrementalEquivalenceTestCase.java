/*
 * @LICENSE@
 */

package org.multisearch;

import static org.multisearch.SearchAssert.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Random term sets over small alphabets, where suffixes of one term are very
 * likely to be prefixes of another: the incrementally grown trie must equal
 * the batch built one, node for node, and both must report what a brute
 * force scan reports.
 */
public class IncrementalEquivalenceTestCase extends AbstractSearchTestCase {

    private static final long SEED = 0x5eedL;
    private static final int ROUNDS = 60;

    private Random random;

    public IncrementalEquivalenceTestCase(String name) {
        super(name);
    }

    protected void setUp() throws Exception {
        super.setUp();
        random = new Random(SEED);
    }

    private String randomString(String alphabet, int maxLength) {
        int n = 1 + random.nextInt(maxLength);
        StringBuilder sb = new StringBuilder(n);
        for (int i = 0; i < n; ++i) {
            sb.append(alphabet.charAt(random.nextInt(alphabet.length())));
        }
        return sb.toString();
    }

    private List<String> randomTerms(String alphabet, int count, int maxLength) {
        Set<String> ret = new LinkedHashSet<String>();
        while (ret.size() < count) {
            ret.add(randomString(alphabet, maxLength));
        }
        return new ArrayList<String>(ret);
    }

    public void testStructureAfterEveryAdd() {
        for (int round = 0; round < ROUNDS; ++round) {
            List<String> terms = randomTerms("ab", 1 + random.nextInt(12), 6);
            SearchTrie trie = new SearchTrie();
            for (String term : terms) {
                trie.addSearchTerm(term);
                assertStructure(trie);
            }
            assertSameShape(SearchTrie.build(terms), trie);
        }
    }

    public void testIncrementalEquivalence() {
        for (int round = 0; round < ROUNDS; ++round) {
            List<String> terms = randomTerms("abc", 2 + random.nextInt(10), 5);
            int split = random.nextInt(terms.size());
            SearchTrie trie = SearchTrie.build(terms.subList(0, split));
            String text = randomString("abcd", 40);
            // search, grow, search again
            assertEquals(bruteForce(terms.subList(0, split), text), matchSet(trie, text));
            for (String term : terms.subList(split, terms.size())) {
                trie.addSearchTerm(term);
            }
            SearchTrie batch = SearchTrie.build(terms);
            assertSameShape(batch, trie);
            assertEquals(matchSet(batch, text), matchSet(trie, text));
            assertEquals(bruteForce(terms, text), matchSet(trie, text));
        }
    }

    public void testOrderIndependence() {
        for (int round = 0; round < ROUNDS; ++round) {
            List<String> terms = randomTerms("abc", 2 + random.nextInt(10), 5);
            String text = randomString("abc", 30);
            SearchTrie first = SearchTrie.build(terms);
            Set<Match> expected = matchSet(first, text);
            for (int shuffle = 0; shuffle < 3; ++shuffle) {
                Collections.shuffle(terms, random);
                SearchTrie incremental = new SearchTrie();
                for (String term : terms) {
                    incremental.addSearchTerm(term);
                }
                assertSameShape(first, incremental);
                assertEquals(expected, matchSet(incremental, text));
                assertEquals(expected, matchSet(SearchTrie.build(terms), text));
            }
        }
    }

    public void testClosure() {
        for (int round = 0; round < ROUNDS; ++round) {
            List<String> terms = randomTerms("abé", 1 + random.nextInt(8), 4);
            String text = randomString("abé ", 50);
            SearchTrie trie = new SearchTrie();
            for (String term : terms) {
                trie.addSearchTerm(term);
            }
            assertEquals(text, bruteForce(terms, text), matchSet(trie, text));
        }
    }

    public void testIdempotentReinsertion() {
        for (int round = 0; round < ROUNDS / 2; ++round) {
            List<String> terms = randomTerms("ab", 1 + random.nextInt(8), 5);
            SearchTrie trie = SearchTrie.build(terms);
            String before = trie.toJSON();
            for (String term : terms) {
                trie.addSearchTerm(term);
            }
            assertEquals(before, trie.toJSON());
        }
    }
}
