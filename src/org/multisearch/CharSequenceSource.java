/*
 * @LICENSE@
 */
package org.multisearch;

import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * A {@link CodePointSource} over in-memory text. Widths are the lengths the
 * code points would have when encoded in a given charset; UTF-8 unless
 * specified. A byte order mark is never counted.
 */
public final class CharSequenceSource implements CodePointSource {

    private static final String PREFIX = " ";

    private final CharSequence csq;
    private final CharsetEncoder encoder;   // null for UTF-8
    private int i = 0;
    private int width = 0;

    public CharSequenceSource(CharSequence csq) {
        this(csq, StandardCharsets.UTF_8);
    }

    public CharSequenceSource(CharSequence csq, String charsetName) {
        this(csq, Charset.forName(charsetName));
    }

    public CharSequenceSource(CharSequence csq, Charset charset) {
        if (csq == null) {
            throw new NullPointerException("csq");
        }
        this.csq = csq;
        this.encoder = StandardCharsets.UTF_8.equals(charset) ? null : charset
            .newEncoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);
    }

    public int read() {
        if (i >= csq.length()) {
            return EOF;
        }
        int cp = Character.codePointAt(csq, i);
        int n = Character.charCount(cp);
        width = encoder == null
                ? Misc.utf8Width(cp)
                : encodedLength(csq.subSequence(i, i + n));
        i += n;
        return cp;
    }

    public int width() {
        return width;
    }

    public int encodedLength(CharSequence term) {
        return encoder == null ? Misc.utf8Length(term) : encodedLength(encoder, term);
    }

    /*
     * Shared with DecodingSource; REPLACE actions mean this can't really fail.
     * Measured after a one char prefix, so a byte order mark or the shift
     * sequences an encoder writes at the start and end of its output are not
     * counted.
     */
    static int encodedLength(CharsetEncoder encoder, CharSequence term) {
        if (term.length() == 0) {
            return 0;
        }
        return encode(encoder, PREFIX + term) - encode(encoder, PREFIX);
    }

    private static int encode(CharsetEncoder encoder, CharSequence cs) {
        try {
            return encoder.encode(CharBuffer.wrap(cs)).remaining();
        } catch (CharacterCodingException e) {
            throw new IllegalStateException("encoder should replace: " + e, e);
        }
    }

    @Override
    public String toString() {
        return "CharSequenceSource: position=" + i + " of " + csq.length();
    }
}
