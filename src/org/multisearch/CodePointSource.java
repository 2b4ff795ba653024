/*
 * @LICENSE@
 */
package org.multisearch;

import java.io.IOException;

/**
 * A forward only source of decoded characters, read one code point at a time
 * along with the number of encoded units (bytes, for byte oriented charsets)
 * the code point occupied in the underlying input. Offsets reported in
 * {@link Match}es are sums of these widths.
 */
public interface CodePointSource {

    /** Returned by {@link #read()} when the input is exhausted. */
    int EOF = -1;

    /**
     * Reads the next code point.
     *
     * @return the code point, or {@link #EOF}.
     * @throws IOException
     *             if the underlying input fails. Searches treat this the same
     *             as end of input.
     */
    int read() throws IOException;

    /**
     * @return the encoded width of the code point most recently returned by
     *         {@link #read()}. Undefined before the first read or after EOF.
     */
    int width();

    /**
     * The encoded length of a whole term, in the same units as
     * {@link #width()}.
     */
    int encodedLength(CharSequence term);
}
