/*
 * @LICENSE@
 */
package org.multisearch;

/**
 * Something which searches text for a set of search terms, where the set can
 * grow over the searcher's lifetime.
 * <p>
 * Implementations need not be thread safe for writers: calls to
 * {@link #addSearchTerm(String)} must not overlap each other or any search
 * still producing matches. Any number of searches may run at once.
 */
public interface Searcher {

    /**
     * Adds another search term. Searches started afterwards will report it.
     *
     * @param term
     *            the term; never <code>null</code>.
     */
    void addSearchTerm(String term);

    /**
     * Searches the input for all terms, reporting every occurrence including
     * overlapping and nested ones. The input is consumed once, forward only,
     * as the returned {@link Matches} is drained.
     *
     * @param in
     *            the input
     * @return a lazy, single use sequence of matches.
     */
    Matches search(CodePointSource in);
}
