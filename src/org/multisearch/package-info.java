/*
 * @LICENSE@
 */

/**
 * <h3><b>multisearch</b> - finds every occurrence of many terms in a stream,
 * in one pass.</h3>
 * <p>
 * <h4>Usage.</h4>
 * <p>
 * Build a {@link org.multisearch.SearchTrie} from the initial terms, then
 * search any number of {@link org.multisearch.CodePointSource}s with it:
 * <blockquote><pre>
 *      SearchTrie trie = SearchTrie.build("a", "can");
 *      trie.addSearchTerm("an");
 *      for (Match m : trie.search(new CharSequenceSource("you can do it!"))) {
 *          System.out.println(m);     // "a" [5,6), "an" [5,7), "can" [4,7)
 *      }
 * </pre></blockquote>
 * Every occurrence is reported, including overlapping and nested ones. Terms
 * ending at the same position are reported together, in no particular order.
 * Locations are in the encoded units of the input (UTF-8 bytes by default),
 * so they can be used to seek in the original file.
 * <p>
 * <h4>Incremental terms.</h4>
 * <p>
 * The trie is a classic Aho-Corasick automaton: goto edges, failure links,
 * and output sets closed under the failure relation. It also keeps the
 * inverse of the failure relation, which lets
 * {@link org.multisearch.SearchTrie#addSearchTerm(String)} patch the failure
 * links and output sets of existing nodes rather than rebuilding. A trie
 * built from some terms and then given more is indistinguishable from one
 * built from all of them at once.
 * <p>
 * <h4>Threads.</h4>
 * <p>
 * Each search runs as its own task, producing into a small bounded buffer
 * which the caller drains through {@link org.multisearch.Matches}. Searches
 * only read the trie, so any number may run at once. Adding terms is not
 * synchronized: finish adding before starting to search, or otherwise make
 * sure no search is running while terms are added.
 * <p>
 * <h4>References:</h4>
 * <ul>
 * <li>Aho, A. V. and Corasick, M. J., "Efficient string matching: an aid to
 * bibliographic search", CACM 18(6), 1975.</li>
 * <li>Meyer, B., "Incremental string matching", Information Processing
 * Letters 21, 1985, which extends the construction with the inverse failure
 * function used here.</li>
 * </ul>
 */
package org.multisearch;
