/*
 * @LICENSE@
 */
package org.multisearch;

import java.util.regex.MatchResult;

/**
 * A search hit: the term found, and its location <code>[start, end)</code>
 * in the input, measured in the encoded units of the
 * {@link CodePointSource} searched. There are no capturing groups; group 0 is
 * the term itself.
 */
public final class Match implements MatchResult {

    private final String term;
    private final int start;
    private final int end;

    public Match(String term, int start, int end) {
        if (term == null) {
            throw new NullPointerException("term");
        }
        if (start > end) {
            throw new IllegalArgumentException("start > end: " + start + " > " + end);
        }
        this.term = term;
        this.start = start;
        this.end = end;
    }

    public String term() {
        return term;
    }

    public int start() {
        return start;
    }

    public int start(int group) {
        checkGroup(group);
        return start;
    }

    public int end() {
        return end;
    }

    public int end(int group) {
        checkGroup(group);
        return end;
    }

    public String group() {
        return term;
    }

    public String group(int group) {
        checkGroup(group);
        return term;
    }

    public int groupCount() {
        return 0;
    }

    private static void checkGroup(int group) {
        if (group != 0) {
            throw new IndexOutOfBoundsException("No group " + group);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Match)) return false;
        Match that = (Match) o;
        return start == that.start && end == that.end && term.equals(that.term);
    }

    @Override
    public int hashCode() {
        return (term.hashCode() * 31 + start) * 31 + end;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        Misc.Esc.JSON.quote(sb, term);
        return sb.append(" [").append(start).append(',').append(end).append(')').toString();
    }
}
