/*
 * @LICENSE@
 */
package org.multisearch;

import java.io.IOException;

/**
 * Lower cases every code point read from another {@link CodePointSource}.
 * Widths are those of the original input, so match ends still refer to the
 * unfolded text. Terms must be folded the same way before they are added to a
 * {@link Searcher}; see {@link #fold(String)}.
 * <p>
 * A match start is its end less the length of the folded term. Where folding
 * changes a code point's encoded length (U+0130 or U+212A to ASCII, say), the
 * start is off by the difference and does not point into the original text.
 */
public final class LowerCaseSource implements CodePointSource {

    private final CodePointSource in;

    public LowerCaseSource(CodePointSource in) {
        if (in == null) {
            throw new NullPointerException("in");
        }
        this.in = in;
    }

    public int read() throws IOException {
        int cp = in.read();
        return cp == EOF ? EOF : Character.toLowerCase(cp);
    }

    public int width() {
        return in.width();
    }

    /**
     * Terms are folded before they reach the searcher, so their length is
     * measured as folded.
     */
    public int encodedLength(CharSequence term) {
        return in.encodedLength(term);
    }

    /**
     * Folds a term code point by code point, the same way text read through
     * this class is folded. Unlike {@link String#toLowerCase()} this never
     * changes the number of code points.
     */
    public static String fold(String term) {
        StringBuilder sb = new StringBuilder(term.length());
        for (int i = 0; i < term.length(); ) {
            int cp = term.codePointAt(i);
            sb.appendCodePoint(Character.toLowerCase(cp));
            i += Character.charCount(cp);
        }
        return sb.toString();
    }
}
